package com.gantry.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Gantry-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, String lane) {
        MDC.put("taskId", taskId);
        MDC.put("lane", lane);
    }

    public static void setJob(String taskId, String jobId, String executor, String lane) {
        MDC.put("taskId", taskId);
        MDC.put("jobId", jobId);
        MDC.put("executor", executor);
        MDC.put("lane", lane);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("jobId");
        MDC.remove("executor");
        MDC.remove("lane");
    }
}

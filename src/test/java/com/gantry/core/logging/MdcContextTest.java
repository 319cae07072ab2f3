package com.gantry.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask puts taskId and lane in MDC")
    void setTask() {
        MdcContext.setTask("TASK-0001", "mainlane");
        assertEquals("TASK-0001", MDC.get("taskId"));
        assertEquals("mainlane", MDC.get("lane"));
        assertNull(MDC.get("jobId"));
    }

    @Test
    @DisplayName("setJob puts taskId, jobId, executor and lane in MDC")
    void setJob() {
        MdcContext.setJob("TASK-0001", "JOB-0003", "claude", "fastlane");
        assertEquals("TASK-0001", MDC.get("taskId"));
        assertEquals("JOB-0003", MDC.get("jobId"));
        assertEquals("claude", MDC.get("executor"));
        assertEquals("fastlane", MDC.get("lane"));
    }

    @Test
    @DisplayName("clear removes gantry keys but leaves others")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setJob("TASK-0001", "JOB-0003", "claude", "fastlane");
        MdcContext.clear();
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("executor"));
        assertNull(MDC.get("lane"));
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}

package com.gantry.executor;

import com.gantry.core.model.Job;

/**
 * @param outcome STARTED, NO_EXECUTOR (nothing eligible right now) or START_FAILED
 * @param job     the job created for the attempt, null when none was created
 * @param reason  detail for non-started outcomes
 */
public record DispatchResult(Outcome outcome, Job job, String reason) {

    public enum Outcome { STARTED, NO_EXECUTOR, START_FAILED }

    public static DispatchResult started(Job job) {
        return new DispatchResult(Outcome.STARTED, job, null);
    }

    public static DispatchResult noExecutor(String reason) {
        return new DispatchResult(Outcome.NO_EXECUTOR, null, reason);
    }

    public static DispatchResult startFailed(Job job, String reason) {
        return new DispatchResult(Outcome.START_FAILED, job, reason);
    }
}

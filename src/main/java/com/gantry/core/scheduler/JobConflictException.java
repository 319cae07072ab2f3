package com.gantry.core.scheduler;

/**
 * Thrown when an operation does not fit the job's current state, such as a
 * second submission or a cancel of a finished job.
 */
public class JobConflictException extends RuntimeException {

    private final String jobId;

    public JobConflictException(String jobId, String message) {
        super("Job " + jobId + ": " + message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}

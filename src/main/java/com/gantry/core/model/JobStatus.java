package com.gantry.core.model;

public enum JobStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    public boolean finished() {
        return this != QUEUED && this != RUNNING;
    }
}

package com.gantry.core.model;

/**
 * Self-reported outcome of an executor run.
 */
public enum SubmissionStatus {
    DONE,
    NEED_INPUT,
    FAILED
}

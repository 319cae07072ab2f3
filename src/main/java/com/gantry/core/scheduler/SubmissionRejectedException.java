package com.gantry.core.scheduler;

import java.util.List;

public class SubmissionRejectedException extends RuntimeException {

    private final List<String> errors;

    public SubmissionRejectedException(String jobId, List<String> errors) {
        super("Submission for job " + jobId + " rejected: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

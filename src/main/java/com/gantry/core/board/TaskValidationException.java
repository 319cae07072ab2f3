package com.gantry.core.board;

import java.util.List;

/**
 * Raised when a task is rejected at intake. Carries every reason code found, not just the first.
 */
public class TaskValidationException extends RuntimeException {

    private final List<String> reasons;

    public TaskValidationException(List<String> reasons) {
        super("Task rejected: " + String.join(", ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}

package com.gantry.core.model;

/**
 * Coarse failure taxonomy deciding whether a reason is retried and whether it
 * counts against an executor's circuit breaker.
 */
public enum FailureClass {
    SCOPE_POLICY(false, false),
    GATE(true, false),
    INFRASTRUCTURE(true, true),
    AMBIGUITY(false, false),
    OTHER(true, false);

    private final boolean retryable;
    private final boolean feedsBreaker;

    FailureClass(boolean retryable, boolean feedsBreaker) {
        this.retryable = retryable;
        this.feedsBreaker = feedsBreaker;
    }

    public boolean retryable() {
        return retryable;
    }

    public boolean feedsBreaker() {
        return feedsBreaker;
    }

    public static FailureClass of(String reason) {
        if (reason == null) {
            return OTHER;
        }
        return switch (reason) {
            case ReasonCodes.SCOPE_CONFLICT, ReasonCodes.ROLE_POLICY_VIOLATION,
                 ReasonCodes.PINS_INSUFFICIENT -> SCOPE_POLICY;
            case ReasonCodes.CI_FAILED, ReasonCodes.POLICY_GATE_FAILED,
                 ReasonCodes.HYGIENE_FAILED, ReasonCodes.SCHEMA_VIOLATION,
                 ReasonCodes.TESTS_MISSING -> GATE;
            case ReasonCodes.EXECUTOR_CRASH, ReasonCodes.EXECUTOR_TIMEOUT,
                 ReasonCodes.EXECUTOR_START_FAILED, ReasonCodes.EXECUTOR_LOST -> INFRASTRUCTURE;
            case ReasonCodes.NEEDS_CLARIFICATION, ReasonCodes.SUBMIT_NEED_INPUT,
                 ReasonCodes.MISSING_TASK_ID -> AMBIGUITY;
            default -> reason.startsWith(ReasonCodes.GATE_NOT_EXECUTED_PREFIX) ? GATE : OTHER;
        };
    }
}

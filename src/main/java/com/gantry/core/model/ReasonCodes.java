package com.gantry.core.model;

/**
 * Reason and action codes attached to verdicts, escalations and rejections.
 */
public final class ReasonCodes {

    private ReasonCodes() {}

    // Scope / policy: never auto-retried
    public static final String SCOPE_CONFLICT = "SCOPE_CONFLICT";
    public static final String ROLE_POLICY_VIOLATION = "ROLE_POLICY_VIOLATION";
    public static final String PINS_INSUFFICIENT = "PINS_INSUFFICIENT";

    // Gates: retryable
    public static final String CI_FAILED = "CI_FAILED";
    public static final String POLICY_GATE_FAILED = "POLICY_GATE_FAILED";
    public static final String HYGIENE_FAILED = "HYGIENE_FAILED";
    public static final String SCHEMA_VIOLATION = "SCHEMA_VIOLATION";
    public static final String GATE_NOT_EXECUTED_PREFIX = "gate_not_executed:";

    // Submission
    public static final String MISSING_TASK_ID = "missing_task_id";
    public static final String SUBMIT_NEED_INPUT = "submit:NEED_INPUT";
    public static final String SUBMIT_FAILED = "submit:FAILED";
    public static final String EXIT_CODE_NONZERO = "exit_code_nonzero";
    public static final String TESTS_MISSING = "tests_missing";
    public static final String NEEDS_CLARIFICATION = "NEEDS_CLARIFICATION";

    // Infrastructure: retried and fed into the breaker
    public static final String EXECUTOR_CRASH = "executor_crash";
    public static final String EXECUTOR_TIMEOUT = "executor_timeout";
    public static final String EXECUTOR_START_FAILED = "executor_start_failed";
    public static final String EXECUTOR_LOST = "executor_lost";

    // Lifecycle
    public static final String RETRIES_EXHAUSTED = "retries_exhausted";
    public static final String CANCELLED_BY_OPERATOR = "cancelled_by_operator";
    public static final String RELEASED_BY_OPERATOR = "released_by_operator";
    public static final String CHILDREN_DONE = "children_done";

    // Advisory actions
    public static final String ACTION_CI_FIXUP = "create_ci_fixup_child_task";
    public static final String ACTION_POLICY_FIXUP = "create_policy_fixup_child_task";
    public static final String ACTION_HYGIENE_FIXUP = "run_hygiene_fixup";
    public static final String ACTION_OPERATOR_REVIEW = "operator_review";

    public static String gateNotExecuted(String gate) {
        return GATE_NOT_EXECUTED_PREFIX + gate;
    }
}

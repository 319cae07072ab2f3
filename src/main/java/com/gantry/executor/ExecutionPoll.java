package com.gantry.executor;

/**
 * Current state of a started job as seen by its back-end.
 *
 * @param state          RUNNING, EXITED, or LOST when the back-end no longer knows the handle
 * @param exitCode       exit code once EXITED
 * @param output         captured stdout/stderr, truncated
 * @param submissionJson raw structured result written by the executor, or null
 */
public record ExecutionPoll(
    State state,
    Integer exitCode,
    String output,
    String submissionJson
) {

    public enum State { RUNNING, EXITED, LOST }

    public static ExecutionPoll running() {
        return new ExecutionPoll(State.RUNNING, null, null, null);
    }

    public static ExecutionPoll lost() {
        return new ExecutionPoll(State.LOST, null, null, null);
    }

    public static ExecutionPoll exited(int exitCode, String output, String submissionJson) {
        return new ExecutionPoll(State.EXITED, exitCode, output, submissionJson);
    }
}

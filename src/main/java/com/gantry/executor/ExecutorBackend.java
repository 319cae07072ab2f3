package com.gantry.executor;

import java.time.Duration;

/**
 * Abstraction over an external executor (CLI tool, remote API).
 * The orchestrator only sees start/poll/cancel plus a health probe; how the
 * executor does its work is its own business.
 */
public interface ExecutorBackend {

    /**
     * Starts a job without waiting for it.
     *
     * @return opaque handle for {@link #poll} and {@link #cancel}
     * @throws ExecutorStartException if the executor could not be started
     */
    String start(ExecutionRequest request);

    ExecutionPoll poll(String handle);

    /** Stops the job if it is still running. Unknown handles are ignored. */
    void cancel(String handle);

    /**
     * @return true if the executor responded healthily within {@code timeout}
     */
    boolean healthCheck(Duration timeout);
}

package com.gantry.core.admission;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted circuit breaker state of one executor.
 *
 * @param executor            executor name
 * @param state               CLOSED, OPEN or HALF_OPEN
 * @param consecutiveFailures failures since the last success, within the failure window
 * @param firstFailureAt      start of the current failure window
 * @param openedAt            when the breaker last opened
 * @param cooldownMs          current cooldown; grows on every failed trial
 * @param trialJobId          the HALF_OPEN trial job admitted and not yet finished, or null
 * @param schemaVersion       persisted layout version
 */
public record BreakerRecord(
    String executor,
    CircuitState state,
    int consecutiveFailures,
    Instant firstFailureAt,
    Instant openedAt,
    long cooldownMs,
    String trialJobId,
    int schemaVersion
) implements Serializable {

    public static final int SCHEMA_VERSION = 2;

    public static BreakerRecord closed(String executor, long cooldownMs) {
        return new BreakerRecord(executor, CircuitState.CLOSED, 0, null, null, cooldownMs, null, SCHEMA_VERSION);
    }

    BreakerRecord with(CircuitState nextState, int failures, Instant windowStart, Instant opened,
                       long cooldown, String trial) {
        return new BreakerRecord(executor, nextState, failures, windowStart, opened, cooldown, trial, schemaVersion);
    }

    public boolean trialInFlight() {
        return trialJobId != null;
    }

    boolean isTrial(String jobId) {
        return trialJobId != null && trialJobId.equals(jobId);
    }
}

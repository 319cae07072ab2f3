package com.gantry.core.admission;

import com.gantry.core.metrics.GantryMetrics;
import com.gantry.core.persistence.JsonRecords;
import com.gantry.core.persistence.StateJson;
import com.gantry.core.persistence.StateNamespace;
import com.gantry.core.persistence.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-executor circuit breakers, persisted as versioned policy records.
 * <p>
 * CLOSED opens after {@code failure-threshold} consecutive failures inside
 * {@code failure-window}. OPEN excludes the executor until the cooldown
 * elapses; the next dispatch is then a single HALF_OPEN trial, remembered by
 * job id. Only that job's outcome moves the breaker on: success closes it and
 * resets the cooldown, failure reopens it with the cooldown multiplied
 * (capped at {@code max-cooldown}).
 */
@Service
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private static final String KEY_PREFIX = "breaker:";

    private final JsonRecords<BreakerRecord> records;
    private final AdmissionProperties.Breaker config;
    private final GantryMetrics metrics;
    private final Clock clock;

    public CircuitBreakerRegistry(StateStore stateStore, AdmissionProperties properties,
                                  GantryMetrics metrics, Clock clock) {
        this.records = new JsonRecords<>(stateStore, StateNamespace.POLICY, BreakerRecord.class, StateJson.mapper());
        this.config = properties.getBreaker();
        this.metrics = metrics;
        this.clock = clock;
    }

    public BreakerRecord state(String executor) {
        return records.get(KEY_PREFIX + executor).orElseGet(() -> initial(executor));
    }

    public List<BreakerRecord> snapshot() {
        return records.listByPrefix(KEY_PREFIX);
    }

    /**
     * Read-only check used while choosing an executor: would a dispatch be let through now?
     */
    public boolean isAvailable(String executor) {
        BreakerRecord current = state(executor);
        return switch (current.state()) {
            case CLOSED -> true;
            case OPEN -> cooldownElapsed(current);
            case HALF_OPEN -> !current.trialInFlight();
        };
    }

    /**
     * Claims permission for one dispatch. An OPEN breaker whose cooldown has
     * elapsed moves to HALF_OPEN and hands out its single trial to {@code jobId}.
     *
     * @return false if the executor must not be used now
     */
    public boolean tryAcquire(String executor, String jobId) {
        if (state(executor).state() == CircuitState.CLOSED) {
            return true;
        }
        var granted = new AtomicBoolean(false);
        records.upsert(KEY_PREFIX + executor, () -> initial(executor), current -> {
            granted.set(false);
            switch (current.state()) {
                case CLOSED -> {
                    granted.set(true);
                    return current;
                }
                case OPEN -> {
                    if (!cooldownElapsed(current)) {
                        return current;
                    }
                    granted.set(true);
                    transitionLogged(executor, CircuitState.OPEN, CircuitState.HALF_OPEN);
                    return current.with(CircuitState.HALF_OPEN, current.consecutiveFailures(),
                            current.firstFailureAt(), current.openedAt(), current.cooldownMs(), jobId);
                }
                default -> {
                    if (current.trialInFlight()) {
                        return current;
                    }
                    granted.set(true);
                    return current.with(CircuitState.HALF_OPEN, current.consecutiveFailures(),
                            current.firstFailureAt(), current.openedAt(), current.cooldownMs(), jobId);
                }
            }
        });
        return granted.get();
    }

    /** Gives back a trial that never produced an outcome (for example an operator cancel). */
    public void releaseTrial(String executor, String jobId) {
        records.upsert(KEY_PREFIX + executor, () -> initial(executor), current ->
                current.state() == CircuitState.HALF_OPEN && current.isTrial(jobId)
                        ? current.with(CircuitState.HALF_OPEN, current.consecutiveFailures(),
                                current.firstFailureAt(), current.openedAt(), current.cooldownMs(), null)
                        : current);
    }

    /**
     * Records a job that worked. Only the trial job can close a breaker that
     * is not CLOSED; late successes of jobs started before it opened are ignored.
     */
    public void recordSuccess(String executor, String jobId) {
        records.upsert(KEY_PREFIX + executor, () -> initial(executor), current -> {
            if (current.state() == CircuitState.CLOSED) {
                return current.with(CircuitState.CLOSED, 0, null, null, config.getCooldown().toMillis(), null);
            }
            if (!current.isTrial(jobId)) {
                log.debug("Ignoring success of {} on {} breaker of {}", jobId, current.state(), executor);
                return current;
            }
            transitionLogged(executor, current.state(), CircuitState.CLOSED);
            return current.with(CircuitState.CLOSED, 0, null, null, config.getCooldown().toMillis(), null);
        });
    }

    /**
     * Records an infrastructure failure. Only the trial job can reopen a
     * HALF_OPEN breaker; other failures are counted without a state change.
     */
    public void recordFailure(String executor, String jobId) {
        Instant now = clock.instant();
        records.upsert(KEY_PREFIX + executor, () -> initial(executor), current -> switch (current.state()) {
            case HALF_OPEN -> {
                if (!current.isTrial(jobId)) {
                    yield current.with(CircuitState.HALF_OPEN, current.consecutiveFailures() + 1,
                            current.firstFailureAt(), current.openedAt(), current.cooldownMs(),
                            current.trialJobId());
                }
                long next = Math.min((long) (current.cooldownMs() * config.getCooldownMultiplier()),
                        config.getMaxCooldown().toMillis());
                transitionLogged(executor, CircuitState.HALF_OPEN, CircuitState.OPEN);
                log.warn("Executor {} failed its trial {}; reopening for {}ms", executor, jobId, next);
                yield current.with(CircuitState.OPEN, current.consecutiveFailures() + 1,
                        current.firstFailureAt(), now, next, null);
            }
            case OPEN -> current.with(CircuitState.OPEN, current.consecutiveFailures() + 1,
                    current.firstFailureAt(), current.openedAt(), current.cooldownMs(), null);
            case CLOSED -> {
                boolean windowExpired = current.firstFailureAt() == null
                        || Duration.between(current.firstFailureAt(), now).compareTo(config.getFailureWindow()) > 0;
                int failures = windowExpired ? 1 : current.consecutiveFailures() + 1;
                Instant windowStart = windowExpired ? now : current.firstFailureAt();
                if (failures >= config.getFailureThreshold()) {
                    transitionLogged(executor, CircuitState.CLOSED, CircuitState.OPEN);
                    log.warn("Executor {} breaker opened after {} consecutive failures", executor, failures);
                    yield current.with(CircuitState.OPEN, failures, windowStart, now,
                            config.getCooldown().toMillis(), null);
                }
                yield current.with(CircuitState.CLOSED, failures, windowStart, null, current.cooldownMs(), null);
            }
        });
    }

    private boolean cooldownElapsed(BreakerRecord current) {
        return current.openedAt() == null
                || !clock.instant().isBefore(current.openedAt().plusMillis(current.cooldownMs()));
    }

    private BreakerRecord initial(String executor) {
        return BreakerRecord.closed(executor, config.getCooldown().toMillis());
    }

    private void transitionLogged(String executor, CircuitState from, CircuitState to) {
        log.info("Breaker for executor {}: {} -> {}", executor, from, to);
        metrics.recordBreakerTransition(executor, from, to);
    }
}

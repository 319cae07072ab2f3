package com.gantry.core.metrics;

import com.gantry.core.admission.CircuitState;
import com.gantry.core.model.Lane;
import com.gantry.core.model.VerdictDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GantryMetricsTest {

    private SimpleMeterRegistry registry;
    private GantryMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GantryMetrics(registry);
    }

    @Test
    @DisplayName("recordAdmission counts by lane and result")
    void recordAdmission() {
        metrics.recordAdmission(Lane.MAINLANE, "granted");
        metrics.recordAdmission(Lane.MAINLANE, "granted");
        metrics.recordAdmission(Lane.BATCHLANE, "deferred");

        assertEquals(2.0, registry.find("gantry.admission.decisions")
                .tag("lane", "mainlane").tag("result", "granted").counter().count());
        assertEquals(1.0, registry.find("gantry.admission.decisions")
                .tag("lane", "batchlane").tag("result", "deferred").counter().count());
    }

    @Test
    @DisplayName("recordVerdict counts decisions and reason prefixes")
    void recordVerdict() {
        metrics.recordVerdict(VerdictDecision.RETRY, List.of("CI_FAILED", "gate_not_executed:policy"));
        metrics.recordVerdict(VerdictDecision.RETRY, List.of("gate_not_executed:ci"));

        assertEquals(2.0, registry.find("gantry.verdicts.total").tag("decision", "RETRY").counter().count());
        assertEquals(1.0, registry.find("gantry.verdict.reasons").tag("reason", "CI_FAILED").counter().count());
        assertEquals(2.0, registry.find("gantry.verdict.reasons")
                .tag("reason", "gate_not_executed").counter().count());
    }

    @Test
    @DisplayName("recordBreakerTransition tags both states")
    void recordBreakerTransition() {
        metrics.recordBreakerTransition("claude", CircuitState.CLOSED, CircuitState.OPEN);

        var counter = registry.find("gantry.breaker.transitions")
                .tag("executor", "claude").tag("from", "CLOSED").tag("to", "OPEN").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordDispatch separates started and failed starts")
    void recordDispatch() {
        metrics.recordDispatch("codex", true);
        metrics.recordDispatch("codex", false);

        assertEquals(1.0, registry.find("gantry.dispatch.total").tag("result", "started").counter().count());
        assertEquals(1.0, registry.find("gantry.dispatch.total").tag("result", "start_failed").counter().count());
    }

    @Test
    @DisplayName("recordJobDuration and recordQueueWait create timers")
    void timers() {
        metrics.recordJobDuration("claude", "DONE", Duration.ofSeconds(42));
        metrics.recordQueueWait(Lane.FASTLANE, Duration.ofMillis(300));

        var duration = registry.find("gantry.job.duration").tag("executor", "claude").tag("status", "DONE").timer();
        assertNotNull(duration);
        assertEquals(1, duration.count());
        assertEquals(1, registry.find("gantry.lane.queue_wait").tag("lane", "fastlane").timer().count());
    }

    @Test
    @DisplayName("degradation gauge reads the supplier")
    void degradationGauge() {
        var level = new AtomicInteger(0);
        metrics.registerDegradationGauge(level::get);
        level.set(2);

        assertEquals(2.0, registry.find("gantry.degradation.level").gauge().value());
    }
}

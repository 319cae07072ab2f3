package com.gantry.core.metrics;

import com.gantry.core.admission.CircuitState;
import com.gantry.core.model.Lane;
import com.gantry.core.model.VerdictDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for task orchestration.
 */
@Service
public class GantryMetrics {

    private final MeterRegistry registry;

    public GantryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAdmission(Lane lane, String result) {
        Counter.builder("gantry.admission.decisions")
                .tag("lane", lane.key())
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordVerdict(VerdictDecision decision, List<String> reasons) {
        Counter.builder("gantry.verdicts.total")
                .tag("decision", decision.name())
                .register(registry)
                .increment();
        for (String reason : reasons) {
            Counter.builder("gantry.verdict.reasons")
                    .tag("reason", reasonTag(reason))
                    .register(registry)
                    .increment();
        }
    }

    public void recordBreakerTransition(String executor, CircuitState from, CircuitState to) {
        Counter.builder("gantry.breaker.transitions")
                .tag("executor", executor)
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    public void recordDispatch(String executor, boolean started) {
        Counter.builder("gantry.dispatch.total")
                .tag("executor", executor)
                .tag("result", started ? "started" : "start_failed")
                .register(registry)
                .increment();
    }

    public void recordJobDuration(String executor, String status, Duration duration) {
        Timer.builder("gantry.job.duration")
                .tag("executor", executor)
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    /**
     * Time a task waited in its lane before dispatch. Advisory fairness signal only;
     * scheduling never reads it back.
     *
     * @param lane the lane the task was dispatched from
     * @param wait time since the task last changed state
     */
    public void recordQueueWait(Lane lane, Duration wait) {
        Timer.builder("gantry.lane.queue_wait")
                .description("Time tasks wait in a lane before dispatch")
                .tag("lane", lane.key())
                .register(registry)
                .record(wait);
    }

    public void registerDegradationGauge(Supplier<Number> level) {
        Gauge.builder("gantry.degradation.level", level)
                .description("0 = normal, 1 = degraded, 2 = critical")
                .register(registry);
    }

    // gate_not_executed:<gate> and CODE:detail would explode tag cardinality
    private static String reasonTag(String reason) {
        int colon = reason.indexOf(':');
        return colon > 0 ? reason.substring(0, colon) : reason;
    }
}

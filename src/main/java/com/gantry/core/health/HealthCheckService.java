package com.gantry.core.health;

import com.gantry.core.admission.CircuitBreakerRegistry;
import com.gantry.core.admission.CircuitState;
import com.gantry.core.admission.DegradationLevel;
import com.gantry.core.admission.DegradationMonitor;
import com.gantry.core.persistence.StateStore;
import com.gantry.executor.ExecutorDescriptor;
import com.gantry.executor.ExecutorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final StateStore stateStore;
    private final ExecutorRegistry executorRegistry;
    private final CircuitBreakerRegistry breakers;
    private final DegradationMonitor degradationMonitor;

    public HealthCheckService(StateStore stateStore,
                              ExecutorRegistry executorRegistry,
                              CircuitBreakerRegistry breakers,
                              DegradationMonitor degradationMonitor) {
        this.stateStore = stateStore;
        this.executorRegistry = executorRegistry;
        this.breakers = breakers;
        this.degradationMonitor = degradationMonitor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStateStore());
        results.add(checkExecutors());
        results.add(checkDegradation());
        return results;
    }

    private HealthStatus checkStateStore() {
        try {
            if (stateStore.isHealthy()) {
                return new HealthStatus("state-store", HealthStatus.Status.UP,
                        "Backend " + stateStore.backendName() + " reachable", Map.of());
            }
            return new HealthStatus("state-store", HealthStatus.Status.DOWN,
                    "Backend " + stateStore.backendName() + " not reachable", Map.of());
        } catch (RuntimeException e) {
            log.warn("State store health check failed: {}", e.getMessage());
            return new HealthStatus("state-store", HealthStatus.Status.DOWN,
                    "State store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkExecutors() {
        List<ExecutorDescriptor> executors = executorRegistry.byPriority();
        if (executors.isEmpty()) {
            return new HealthStatus("executors", HealthStatus.Status.DOWN,
                    "No executors configured", Map.of());
        }
        var metadata = new LinkedHashMap<String, String>();
        int available = 0;
        for (ExecutorDescriptor executor : executors) {
            boolean healthy = executorRegistry.isHealthy(executor.name());
            CircuitState breaker = breakers.state(executor.name()).state();
            metadata.put(executor.name(), (healthy ? "healthy" : "unhealthy") + ", breaker " + breaker
                    + ", in-flight " + executorRegistry.inFlight(executor.name()) + "/" + executor.maxConcurrency());
            if (healthy && breaker != CircuitState.OPEN) {
                available++;
            }
        }
        String detail = available + " of " + executors.size() + " executors available";
        if (available == 0) {
            return new HealthStatus("executors", HealthStatus.Status.DOWN, detail, metadata);
        }
        HealthStatus.Status status = available < executors.size()
                ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
        return new HealthStatus("executors", status, detail, metadata);
    }

    private HealthStatus checkDegradation() {
        DegradationLevel level = degradationMonitor.currentLevel();
        var metadata = Map.of(
                "failureRate", String.format(Locale.ROOT, "%.2f", degradationMonitor.failureRate()),
                "saturation", String.format(Locale.ROOT, "%.2f", degradationMonitor.saturation()));
        HealthStatus.Status status = level == DegradationLevel.NORMAL
                ? HealthStatus.Status.UP : HealthStatus.Status.DEGRADED;
        return new HealthStatus("degradation", status, "Level " + level, metadata);
    }
}

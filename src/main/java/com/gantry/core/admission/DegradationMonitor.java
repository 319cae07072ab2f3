package com.gantry.core.admission;

import com.gantry.core.metrics.GantryMetrics;
import com.gantry.core.model.Lane;
import com.gantry.core.persistence.JsonRecords;
import com.gantry.core.persistence.StateJson;
import com.gantry.core.persistence.StateNamespace;
import com.gantry.core.persistence.StateStore;
import com.gantry.core.persistence.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the system-wide degradation level from the rolling job failure rate
 * and from how full the regular lanes are.
 */
@Service
public class DegradationMonitor {

    private static final Logger log = LoggerFactory.getLogger(DegradationMonitor.class);

    private static final String KEY = "degradation:outcomes";

    private final JsonRecords<OutcomeWindow> records;
    private final TaskRepository taskRepository;
    private final AdmissionProperties properties;

    public DegradationMonitor(StateStore stateStore, TaskRepository taskRepository,
                              AdmissionProperties properties, GantryMetrics metrics) {
        this.records = new JsonRecords<>(stateStore, StateNamespace.POLICY, OutcomeWindow.class, StateJson.mapper());
        this.taskRepository = taskRepository;
        this.properties = properties;
        metrics.registerDegradationGauge(() -> currentLevel().ordinal());
    }

    /** Records a finished job; infrastructure failures and failed verdicts count as failures. */
    public void recordOutcome(boolean success) {
        int capacity = Math.max(1, properties.getDegradation().getOutcomeWindow());
        records.upsert(KEY, OutcomeWindow::empty, window -> window.append(success, capacity));
    }

    public double failureRate() {
        OutcomeWindow window = records.get(KEY).orElseGet(OutcomeWindow::empty);
        if (window.outcomes().size() < properties.getDegradation().getMinSamples()) {
            return 0.0;
        }
        return window.failureRate();
    }

    /** In-progress tasks over the configured (unscaled) capacity of the regular lanes. */
    public double saturation() {
        long capacity = 0;
        long inProgress = 0;
        for (Lane lane : Lane.values()) {
            if (lane.escalation()) {
                continue;
            }
            capacity += properties.getWipLimits().getOrDefault(lane.key(), 0);
            inProgress += taskRepository.countInProgress(lane);
        }
        return capacity == 0 ? 1.0 : (double) inProgress / capacity;
    }

    public DegradationLevel currentLevel() {
        var config = properties.getDegradation();
        double rate = failureRate();
        if (rate >= config.getCriticalFailureRate()) {
            log.debug("Degradation CRITICAL: failure rate {}", rate);
            return DegradationLevel.CRITICAL;
        }
        if (rate >= config.getDegradedFailureRate() || saturation() >= config.getDegradedSaturation()) {
            return DegradationLevel.DEGRADED;
        }
        return DegradationLevel.NORMAL;
    }
}

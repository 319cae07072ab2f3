package com.gantry.core.admission;

import com.gantry.core.metrics.GantryMetrics;
import com.gantry.core.model.Lane;
import com.gantry.core.model.Task;
import com.gantry.core.model.TaskKind;
import com.gantry.core.model.TaskStatus;
import com.gantry.core.persistence.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether tasks may enter READY and whether READY (or retryable FAILED)
 * tasks may start, given lane WIP ceilings and the degradation level.
 * Never blocks: a deferred task is simply offered again on the next tick.
 */
@Service
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final TaskRepository taskRepository;
    private final DegradationMonitor degradationMonitor;
    private final AdmissionProperties properties;
    private final GantryMetrics metrics;

    public AdmissionController(TaskRepository taskRepository,
                               DegradationMonitor degradationMonitor,
                               AdmissionProperties properties,
                               GantryMetrics metrics) {
        this.taskRepository = taskRepository;
        this.degradationMonitor = degradationMonitor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Gate for BACKLOG to READY. Under CRITICAL degradation only fast-lane work is let in.
     */
    public AdmissionDecision admitToReady(Task task) {
        if (task.status() != TaskStatus.BACKLOG) {
            return AdmissionDecision.blocked("status_" + task.status().name().toLowerCase());
        }
        if (task.kind() == TaskKind.ATOMIC && task.lane() != Lane.FASTLANE
                && degradationMonitor.currentLevel() == DegradationLevel.CRITICAL) {
            return AdmissionDecision.deferred("degradation_critical");
        }
        return AdmissionDecision.granted();
    }

    /**
     * Gate for READY/FAILED to IN_PROGRESS.
     */
    public AdmissionDecision admit(Task task) {
        AdmissionDecision decision = decide(task);
        metrics.recordAdmission(task.lane(), decision.outcome().name().toLowerCase());
        if (!decision.isGranted()) {
            log.debug("Admission for {} {}: {}", task.id(), decision.outcome(), decision.reason());
        }
        return decision;
    }

    private AdmissionDecision decide(Task task) {
        if (task.kind() == TaskKind.PARENT) {
            return AdmissionDecision.blocked("parent_task");
        }
        if (task.lane().escalation()) {
            return AdmissionDecision.blocked("lane_" + task.lane().key());
        }
        if (task.status() != TaskStatus.READY && task.status() != TaskStatus.FAILED) {
            return AdmissionDecision.blocked("status_" + task.status().name().toLowerCase());
        }
        if (task.attemptsRemaining() == 0) {
            return AdmissionDecision.blocked("attempts_exhausted");
        }
        int limit = effectiveWipLimit(task.lane());
        long inProgress = taskRepository.countInProgress(task.lane());
        if (inProgress >= limit) {
            return AdmissionDecision.deferred("wip_ceiling:" + task.lane().key());
        }
        return AdmissionDecision.granted();
    }

    /**
     * Configured ceiling of a lane, scaled down for non-fast lanes while degraded.
     * Escalation lanes have no capacity.
     */
    public int effectiveWipLimit(Lane lane) {
        if (lane.escalation()) {
            return 0;
        }
        int base = properties.getWipLimits().getOrDefault(lane.key(), 0);
        if (lane == Lane.FASTLANE || base == 0) {
            return base;
        }
        if (degradationMonitor.currentLevel() == DegradationLevel.NORMAL) {
            return base;
        }
        return Math.max(1, (int) Math.floor(base * properties.getDegradedWipFactor()));
    }

    public DegradationLevel degradationLevel() {
        return degradationMonitor.currentLevel();
    }

    public List<LaneSnapshot> laneSnapshots() {
        var snapshots = new ArrayList<LaneSnapshot>();
        var tasks = taskRepository.findAll();
        for (Lane lane : Lane.values()) {
            long inProgress = tasks.stream()
                    .filter(t -> t.lane() == lane && t.status() == TaskStatus.IN_PROGRESS).count();
            long waiting = tasks.stream()
                    .filter(t -> t.lane() == lane)
                    .filter(t -> t.status() == TaskStatus.READY || t.status() == TaskStatus.BACKLOG
                            || (t.status() == TaskStatus.FAILED && !lane.escalation() && t.attemptsRemaining() > 0))
                    .count();
            snapshots.add(new LaneSnapshot(lane, inProgress, effectiveWipLimit(lane), waiting));
        }
        return snapshots;
    }
}

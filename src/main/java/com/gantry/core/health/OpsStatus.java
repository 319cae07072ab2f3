package com.gantry.core.health;

import com.gantry.core.admission.BreakerRecord;
import com.gantry.core.admission.DegradationLevel;
import com.gantry.core.admission.LaneSnapshot;
import com.gantry.core.model.TaskStatus;

import java.util.List;
import java.util.Map;

/**
 * Operator view of the orchestrator at one moment.
 */
public record OpsStatus(
    DegradationLevel degradationLevel,
    double failureRate,
    double saturation,
    Map<TaskStatus, Long> tasksByStatus,
    long runningJobs,
    List<LaneSnapshot> lanes,
    List<BreakerRecord> breakers
) {}

package com.gantry.core.admission;

import com.gantry.core.model.Lane;

/**
 * Point-in-time capacity view of one lane.
 */
public record LaneSnapshot(
    Lane lane,
    long inProgress,
    int wipLimit,
    long waiting
) {}

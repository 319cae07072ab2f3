package com.gantry.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of a task's append-only history.
 */
public record TaskTransition(
    TaskStatus from,
    TaskStatus to,
    Lane lane,
    String reason,
    Instant at
) implements Serializable {}

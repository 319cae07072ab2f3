package com.gantry.executor;

import java.time.Duration;

/**
 * Static description of a registered executor.
 *
 * @param name           unique executor name
 * @param priority       lower is tried first when no preference applies
 * @param maxConcurrency jobs the executor may run at once
 * @param timeout        hard deadline applied to each job
 */
public record ExecutorDescriptor(
    String name,
    int priority,
    int maxConcurrency,
    Duration timeout
) {}

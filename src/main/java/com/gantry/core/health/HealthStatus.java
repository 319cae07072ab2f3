package com.gantry.core.health;

import java.util.Collection;
import java.util.Map;

public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    /** DOWN if any component is down, else DEGRADED if any is degraded, else UP. */
    public static Status overall(Collection<HealthStatus> checks) {
        Status overall = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status() == Status.DOWN) {
                return Status.DOWN;
            }
            if (check.status() == Status.DEGRADED) {
                overall = Status.DEGRADED;
            }
        }
        return overall;
    }
}

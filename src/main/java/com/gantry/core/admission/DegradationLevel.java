package com.gantry.core.admission;

public enum DegradationLevel {
    NORMAL,
    DEGRADED,
    CRITICAL
}

package com.gantry.core.admission;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}

package com.gantry.core.model;

public enum GateCategory {
    CI,
    POLICY,
    HYGIENE
}

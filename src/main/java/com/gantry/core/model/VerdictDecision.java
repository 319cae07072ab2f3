package com.gantry.core.model;

public enum VerdictDecision {
    DONE,
    RETRY,
    ESCALATE
}

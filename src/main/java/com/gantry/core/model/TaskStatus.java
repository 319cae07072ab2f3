package com.gantry.core.model;

public enum TaskStatus {
    BACKLOG,
    READY,
    IN_PROGRESS,
    BLOCKED,
    DONE,
    FAILED,
    NEEDS_SPLIT
}

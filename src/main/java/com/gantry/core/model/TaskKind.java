package com.gantry.core.model;

/**
 * Shape of a task in the task tree.
 * PARENT tasks only plan and split; only ATOMIC tasks are ever dispatched.
 */
public enum TaskKind {
    PARENT,
    ATOMIC
}

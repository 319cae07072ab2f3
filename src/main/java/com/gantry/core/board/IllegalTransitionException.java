package com.gantry.core.board;

import com.gantry.core.model.TaskStatus;

/**
 * Raised on any attempt to move a task along an edge the lifecycle does not allow,
 * or along a legal edge whose guard does not hold.
 */
public class IllegalTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTransitionException(String taskId, TaskStatus from, TaskStatus to, String detail) {
        super("Task " + taskId + ": illegal transition " + from + " -> " + to
                + (detail == null ? "" : " (" + detail + ")"));
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() { return taskId; }
    public TaskStatus getFrom() { return from; }
    public TaskStatus getTo() { return to; }
}

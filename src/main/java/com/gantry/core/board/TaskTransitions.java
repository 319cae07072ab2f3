package com.gantry.core.board;

import com.gantry.core.model.TaskStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The legal edges of the task lifecycle. Guards live in {@link TaskBoard}.
 */
public final class TaskTransitions {

    private static final Map<TaskStatus, Set<TaskStatus>> LEGAL = new EnumMap<>(TaskStatus.class);

    static {
        LEGAL.put(TaskStatus.BACKLOG, EnumSet.of(TaskStatus.READY, TaskStatus.NEEDS_SPLIT, TaskStatus.BLOCKED));
        LEGAL.put(TaskStatus.READY, EnumSet.of(TaskStatus.IN_PROGRESS, TaskStatus.BLOCKED));
        LEGAL.put(TaskStatus.IN_PROGRESS, EnumSet.of(TaskStatus.DONE, TaskStatus.FAILED,
                TaskStatus.BLOCKED, TaskStatus.NEEDS_SPLIT));
        LEGAL.put(TaskStatus.FAILED, EnumSet.of(TaskStatus.IN_PROGRESS));
        LEGAL.put(TaskStatus.BLOCKED, EnumSet.of(TaskStatus.READY));
        LEGAL.put(TaskStatus.NEEDS_SPLIT, EnumSet.of(TaskStatus.DONE));
        LEGAL.put(TaskStatus.DONE, EnumSet.noneOf(TaskStatus.class));
    }

    private TaskTransitions() {}

    public static boolean isLegal(TaskStatus from, TaskStatus to) {
        return LEGAL.getOrDefault(from, Set.of()).contains(to);
    }

    public static Set<TaskStatus> targets(TaskStatus from) {
        return Set.copyOf(LEGAL.getOrDefault(from, Set.of()));
    }
}

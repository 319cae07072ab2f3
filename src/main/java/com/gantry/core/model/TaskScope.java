package com.gantry.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Declared file-system scope of a task. Immutable once the task is created.
 *
 * @param allowedPaths   patterns the task may touch; empty means nothing is allowed
 * @param forbiddenPaths patterns the task must never touch; wins over allowedPaths
 */
public record TaskScope(
    List<String> allowedPaths,
    List<String> forbiddenPaths
) implements Serializable {

    public TaskScope {
        allowedPaths = allowedPaths == null ? List.of() : List.copyOf(allowedPaths);
        forbiddenPaths = forbiddenPaths == null ? List.of() : List.copyOf(forbiddenPaths);
    }

    public static TaskScope empty() {
        return new TaskScope(List.of(), List.of());
    }
}

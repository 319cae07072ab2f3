package com.gantry.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gantry.core.board.NewTask;
import com.gantry.core.model.TaskKind;
import com.gantry.core.model.TaskScope;

import java.util.List;
import java.util.Locale;

public record CreateTaskRequest(
    @JsonProperty("goal") String goal,
    @JsonProperty("role") String role,
    @JsonProperty("kind") String kind,
    @JsonProperty("parent_id") String parentId,
    @JsonProperty("area") String area,
    @JsonProperty("lane") String lane,
    @JsonProperty("priority") Integer priority,
    @JsonProperty("allowed_paths") List<String> allowedPaths,
    @JsonProperty("forbidden_paths") List<String> forbiddenPaths,
    @JsonProperty("max_attempts") Integer maxAttempts,
    @JsonProperty("executor_preference") String executorPreference,
    @JsonProperty("skills") List<String> skills,
    @JsonProperty("dedup_key") String dedupKey
) {

    /**
     * @throws IllegalArgumentException for an unknown kind
     */
    public NewTask toNewTask() {
        TaskKind taskKind = kind == null || kind.isBlank()
                ? TaskKind.ATOMIC : TaskKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        return new NewTask(goal, role, taskKind, parentId, area, lane, priority,
                new TaskScope(allowedPaths, forbiddenPaths), maxAttempts, executorPreference, skills, dedupKey);
    }
}

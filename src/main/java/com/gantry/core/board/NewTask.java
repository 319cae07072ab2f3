package com.gantry.core.board;

import com.gantry.core.model.TaskKind;
import com.gantry.core.model.TaskScope;

import java.util.List;

/**
 * Intake request for a new task. Nullable fields fall back to defaults.
 *
 * @param goal               free-text goal, required
 * @param role               execution role, required
 * @param kind               ATOMIC when null
 * @param parentId           parent task; the scope must stay within the parent's
 * @param area               optional area for lane routing
 * @param laneHint           optional explicit lane (fastlane, mainlane, batchlane)
 * @param priority           lower is more urgent; configured default when null
 * @param scope              declared allowed/forbidden patterns
 * @param maxAttempts        attempt ceiling; {@code 2} when null
 * @param executorPreference optional executor tried first
 * @param skills             requested skills
 * @param dedupKey           optional stable key; a repeated key returns the existing task
 */
public record NewTask(
    String goal,
    String role,
    TaskKind kind,
    String parentId,
    String area,
    String laneHint,
    Integer priority,
    TaskScope scope,
    Integer maxAttempts,
    String executorPreference,
    List<String> skills,
    String dedupKey
) {

    public static NewTask atomic(String goal, String role, TaskScope scope) {
        return new NewTask(goal, role, TaskKind.ATOMIC, null, null, null, null, scope, null, null, null, null);
    }

    public NewTask withParent(String parent) {
        return new NewTask(goal, role, kind, parent, area, laneHint, priority, scope, maxAttempts,
                executorPreference, skills, dedupKey);
    }
}

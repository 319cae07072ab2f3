package com.gantry.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of agent work tracked on the task board.
 *
 * @param id                 stable identifier, immutable once minted
 * @param parentId           parent task id, or null for a root task
 * @param kind               PARENT (planning only) or ATOMIC (dispatchable)
 * @param goal               free-text goal handed to the context renderer
 * @param role               execution role; fixes tools and path classes
 * @param area               optional area used for lane derivation
 * @param status             lifecycle status
 * @param lane               queue the task is routed through
 * @param priority           lower value is more urgent
 * @param sequence           creation order, used to break priority ties
 * @param scope              declared allowed/forbidden path patterns
 * @param attempt            number of dispatches that started
 * @param maxAttempts        ceiling for {@code attempt}
 * @param executorPreference optional executor name tried first
 * @param skills             requested skills, passed through to the renderer
 * @param dedupKey           optional caller-supplied key for duplicate detection
 * @param reasons            reason codes of the latest verdict or escalation
 * @param notBefore          earliest redispatch of a retry held back by backoff, or null
 * @param history            append-only transition history
 * @param createdAt          creation timestamp
 * @param updatedAt          last mutation timestamp
 * @param schemaVersion      persisted layout version
 */
public record Task(
    String id,
    String parentId,
    TaskKind kind,
    String goal,
    String role,
    String area,
    TaskStatus status,
    Lane lane,
    int priority,
    long sequence,
    TaskScope scope,
    int attempt,
    int maxAttempts,
    String executorPreference,
    List<String> skills,
    String dedupKey,
    List<String> reasons,
    Instant notBefore,
    List<TaskTransition> history,
    Instant createdAt,
    Instant updatedAt,
    int schemaVersion
) implements Serializable {

    public static final int SCHEMA_VERSION = 1;
    public static final int DEFAULT_MAX_ATTEMPTS = 2;

    public Task {
        scope = scope == null ? TaskScope.empty() : scope;
        skills = skills == null ? List.of() : List.copyOf(skills);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** DONE, or parked in the dead-letter lane. */
    public boolean terminal() {
        return status == TaskStatus.DONE || lane == Lane.DLQ;
    }

    public int attemptsRemaining() {
        return Math.max(0, maxAttempts - attempt);
    }

    public Task transition(TaskStatus to, Lane toLane, String reason, Instant at) {
        var nextHistory = new ArrayList<>(history);
        nextHistory.add(new TaskTransition(status, to, toLane, reason, at));
        return new Task(id, parentId, kind, goal, role, area, to, toLane, priority, sequence, scope,
                attempt, maxAttempts, executorPreference, skills, dedupKey, reasons, notBefore, nextHistory,
                createdAt, at, schemaVersion);
    }

    public Task withAttempt(int nextAttempt) {
        return new Task(id, parentId, kind, goal, role, area, status, lane, priority, sequence, scope,
                nextAttempt, maxAttempts, executorPreference, skills, dedupKey, reasons, notBefore, history,
                createdAt, updatedAt, schemaVersion);
    }

    public Task withReasons(List<String> nextReasons) {
        return new Task(id, parentId, kind, goal, role, area, status, lane, priority, sequence, scope,
                attempt, maxAttempts, executorPreference, skills, dedupKey, nextReasons, notBefore, history,
                createdAt, updatedAt, schemaVersion);
    }

    /** True while a retry is held back by its backoff. */
    public boolean backingOff(Instant now) {
        return notBefore != null && now.isBefore(notBefore);
    }

    public Task withNotBefore(Instant nextNotBefore) {
        return new Task(id, parentId, kind, goal, role, area, status, lane, priority, sequence, scope,
                attempt, maxAttempts, executorPreference, skills, dedupKey, reasons, nextNotBefore, history,
                createdAt, updatedAt, schemaVersion);
    }

    /** The same task as a planning-only parent, ready to receive children. */
    public Task asParent() {
        return new Task(id, parentId, TaskKind.PARENT, goal, role, area, status, lane, priority, sequence, scope,
                attempt, maxAttempts, executorPreference, skills, dedupKey, reasons, null, history,
                createdAt, updatedAt, schemaVersion);
    }
}

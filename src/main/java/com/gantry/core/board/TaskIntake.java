package com.gantry.core.board;

import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.Task;
import com.gantry.core.model.TaskKind;
import com.gantry.core.model.TaskScope;
import com.gantry.core.model.TaskStatus;
import com.gantry.core.model.TaskTransition;
import com.gantry.core.persistence.StateConflictException;
import com.gantry.core.persistence.StateNamespace;
import com.gantry.core.persistence.StateStore;
import com.gantry.core.persistence.TaskRepository;
import com.gantry.core.pins.PinsResolver;
import com.gantry.core.security.RolePolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates and mints new tasks.
 * <p>
 * Validation fails fast on the whole request: every problem found is reported
 * in one {@link TaskValidationException}. Intake is not idempotent unless the
 * caller supplies a dedup key.
 */
@Service
public class TaskIntake {

    private static final Logger log = LoggerFactory.getLogger(TaskIntake.class);

    private static final String DEDUP_PREFIX = "dedup:";

    private final TaskRepository taskRepository;
    private final StateStore stateStore;
    private final RolePolicyEngine rolePolicyEngine;
    private final PinsResolver pinsResolver;
    private final LaneRouter laneRouter;
    private final Clock clock;

    public TaskIntake(TaskRepository taskRepository,
                      StateStore stateStore,
                      RolePolicyEngine rolePolicyEngine,
                      PinsResolver pinsResolver,
                      LaneRouter laneRouter,
                      Clock clock) {
        this.taskRepository = taskRepository;
        this.stateStore = stateStore;
        this.rolePolicyEngine = rolePolicyEngine;
        this.pinsResolver = pinsResolver;
        this.laneRouter = laneRouter;
        this.clock = clock;
    }

    /**
     * @throws TaskValidationException with all reason codes when the request is rejected
     */
    public IntakeResult create(NewTask request) {
        if (request.dedupKey() != null && !request.dedupKey().isBlank()) {
            Optional<Task> existing = findByDedupKey(request.dedupKey());
            if (existing.isPresent()) {
                log.info("Dedup key '{}' already maps to {}", request.dedupKey(), existing.get().id());
                return new IntakeResult(existing.get(), true);
            }
        }

        List<String> reasons = validate(request);
        if (!reasons.isEmpty()) {
            log.info("Rejected task '{}' for role {}: {}", abbreviate(request.goal()), request.role(), reasons);
            throw new TaskValidationException(reasons);
        }

        long sequence = taskRepository.nextSequence();
        String taskId = TaskRepository.idFor(sequence);

        if (request.dedupKey() != null && !request.dedupKey().isBlank()) {
            String claimed = claimDedupKey(request.dedupKey(), taskId);
            if (!claimed.equals(taskId)) {
                return new IntakeResult(taskRepository.find(claimed).orElseThrow(() ->
                        new StateConflictException("Task " + claimed + " for dedup key is still being created")), true);
            }
        }

        Task task = taskRepository.create(mint(request, taskId, sequence));
        log.info("Created task {} ({}, role={}, lane={}, priority={})",
                task.id(), task.kind(), task.role(), task.lane().key(), task.priority());
        return new IntakeResult(task, false);
    }

    private Task mint(NewTask request, String taskId, long sequence) {
        Instant now = clock.instant();
        TaskKind kind = request.kind() == null ? TaskKind.ATOMIC : request.kind();
        int priority = request.priority() == null ? laneRouter.defaultPriority() : request.priority();
        var lane = laneRouter.route(request.laneHint(), request.area(), priority);
        int maxAttempts = request.maxAttempts() == null ? Task.DEFAULT_MAX_ATTEMPTS : request.maxAttempts();
        String role = rolePolicyEngine.capabilitiesFor(request.role()).role();
        var created = new TaskTransition(null, TaskStatus.BACKLOG, lane, "created", now);
        return new Task(taskId, request.parentId(), kind, request.goal().trim(), role, request.area(),
                TaskStatus.BACKLOG, lane, priority, sequence, scopeOf(request), 0, maxAttempts,
                request.executorPreference(), request.skills(), request.dedupKey(), List.of(), null,
                List.of(created), now, now, Task.SCHEMA_VERSION);
    }

    List<String> validate(NewTask request) {
        var reasons = new ArrayList<String>();
        if (request.goal() == null || request.goal().isBlank()) {
            reasons.add(ReasonCodes.SCHEMA_VIOLATION + ":goal_required");
        }
        if (request.maxAttempts() != null && request.maxAttempts() < 1) {
            reasons.add(ReasonCodes.SCHEMA_VIOLATION + ":max_attempts_must_be_positive");
        }
        try {
            int priority = request.priority() == null ? laneRouter.defaultPriority() : request.priority();
            laneRouter.route(request.laneHint(), request.area(), priority);
        } catch (IllegalArgumentException e) {
            reasons.add(ReasonCodes.SCHEMA_VIOLATION + ":lane_hint:" + request.laneHint());
        }

        TaskScope scope = scopeOf(request);
        List<String> patternErrors = pinsResolver.validatePatterns(scope);
        for (String error : patternErrors) {
            reasons.add(ReasonCodes.SCOPE_CONFLICT + ":" + error);
        }

        if (request.role() == null || !rolePolicyEngine.isKnownRole(request.role())) {
            reasons.add(ReasonCodes.ROLE_POLICY_VIOLATION + ":unknown_role:" + request.role());
        } else if (patternErrors.isEmpty()) {
            reasons.addAll(rolePolicyEngine.validateScope(request.role(), scope));
        }

        if (request.parentId() != null) {
            Optional<Task> parent = taskRepository.find(request.parentId());
            if (parent.isEmpty()) {
                reasons.add(ReasonCodes.SCHEMA_VIOLATION + ":parent_not_found:" + request.parentId());
            } else if (parent.get().kind() != TaskKind.PARENT) {
                reasons.add(ReasonCodes.SCOPE_CONFLICT + ":parent_not_splittable:" + request.parentId());
            } else if (patternErrors.isEmpty()) {
                var inheritance = pinsResolver.validateInheritance(scope, parent.get().scope());
                for (String violation : inheritance.violations()) {
                    reasons.add(ReasonCodes.SCOPE_CONFLICT + ":" + violation);
                }
            }
        }
        return reasons;
    }

    private Optional<Task> findByDedupKey(String dedupKey) {
        return stateStore.read(StateNamespace.POLICY, DEDUP_PREFIX + dedupKey)
                .flatMap(claim -> taskRepository.find(claim.body()));
    }

    private String claimDedupKey(String dedupKey, String taskId) {
        return stateStore.update(StateNamespace.POLICY, DEDUP_PREFIX + dedupKey,
                body -> body == null ? taskId : body).body();
    }

    private static TaskScope scopeOf(NewTask request) {
        return request.scope() == null ? TaskScope.empty() : request.scope();
    }

    private static String abbreviate(String goal) {
        if (goal == null) {
            return "";
        }
        return goal.length() <= 60 ? goal : goal.substring(0, 57) + "...";
    }
}

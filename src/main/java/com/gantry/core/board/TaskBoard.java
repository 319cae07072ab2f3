package com.gantry.core.board;

import com.gantry.core.model.FailureClass;
import com.gantry.core.model.Lane;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.Task;
import com.gantry.core.model.TaskKind;
import com.gantry.core.model.TaskStatus;
import com.gantry.core.model.Verdict;
import com.gantry.core.model.VerdictDecision;
import com.gantry.core.persistence.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The task lifecycle state machine.
 * <p>
 * Every status change goes through {@link #transition}, which re-checks the
 * edge and its guard inside the record's read-modify-write, so two writers
 * racing on the same task cannot both win. Illegal moves throw
 * {@link IllegalTransitionException}; nothing is silently coerced.
 */
@Service
public class TaskBoard {

    private static final Logger log = LoggerFactory.getLogger(TaskBoard.class);

    /** Queue order within a lane: lower priority value first, then creation order. */
    public static final Comparator<Task> QUEUE_ORDER =
            Comparator.comparingInt(Task::priority).thenComparingLong(Task::sequence);

    private final TaskRepository taskRepository;
    private final TaskIntake taskIntake;
    private final LaneRouter laneRouter;
    private final LaneProperties laneProperties;
    private final Clock clock;

    public TaskBoard(TaskRepository taskRepository, TaskIntake taskIntake, LaneRouter laneRouter,
                     LaneProperties laneProperties, Clock clock) {
        this.taskRepository = taskRepository;
        this.taskIntake = taskIntake;
        this.laneRouter = laneRouter;
        this.laneProperties = laneProperties;
        this.clock = clock;
    }

    // -- Queries --

    public Task get(String taskId) {
        return taskRepository.get(taskId);
    }

    /** Tasks filtered by status and lane; a null filter matches everything. */
    public List<Task> list(TaskStatus status, Lane lane) {
        return taskRepository.findAll().stream()
                .filter(t -> status == null || t.status() == status)
                .filter(t -> lane == null || t.lane() == lane)
                .toList();
    }

    /**
     * Tasks of one lane waiting for dispatch, in queue order: READY tasks and
     * FAILED tasks that still have attempts left and are past their backoff.
     */
    public List<Task> dispatchQueue(Lane lane) {
        Instant now = clock.instant();
        return taskRepository.findAll().stream()
                .filter(t -> t.lane() == lane && t.kind() == TaskKind.ATOMIC)
                .filter(t -> t.status() == TaskStatus.READY
                        || (t.status() == TaskStatus.FAILED && t.attemptsRemaining() > 0 && !t.backingOff(now)))
                .sorted(QUEUE_ORDER)
                .toList();
    }

    public List<Task> backlog() {
        return taskRepository.findByStatus(TaskStatus.BACKLOG).stream().sorted(QUEUE_ORDER).toList();
    }

    // -- Intake --

    public IntakeResult create(NewTask request) {
        return taskIntake.create(request);
    }

    // -- Transitions --

    /**
     * BACKLOG to READY for atomic tasks, BACKLOG to NEEDS_SPLIT for parents.
     * Admission to READY is the caller's decision.
     */
    public Task promote(String taskId) {
        Task task = get(taskId);
        if (task.kind() == TaskKind.PARENT) {
            return transition(taskId, TaskStatus.NEEDS_SPLIT, null, "parent_awaits_split", UnaryOperator.identity());
        }
        return transition(taskId, TaskStatus.READY, null, "admitted_to_ready", UnaryOperator.identity());
    }

    /**
     * READY or FAILED to IN_PROGRESS once a job has started. Counts the attempt.
     */
    public Task markInProgress(String taskId, String jobId) {
        return transition(taskId, TaskStatus.IN_PROGRESS, null, "dispatched:" + jobId, t -> {
            if (t.kind() != TaskKind.ATOMIC) {
                throw new IllegalTransitionException(taskId, t.status(), TaskStatus.IN_PROGRESS,
                        "parent tasks never execute");
            }
            if (t.lane().escalation()) {
                throw new IllegalTransitionException(taskId, t.status(), TaskStatus.IN_PROGRESS,
                        "task is parked in " + t.lane().key());
            }
            if (t.attemptsRemaining() == 0) {
                throw new IllegalTransitionException(taskId, t.status(), TaskStatus.IN_PROGRESS,
                        "attempts exhausted");
            }
            return t.withAttempt(t.attempt() + 1).withNotBefore(null);
        });
    }

    /**
     * Applies a verdict to an IN_PROGRESS task.
     * DONE closes the task; ESCALATE parks it in quarantine; RETRY marks it FAILED,
     * or dead-letters it once attempts are exhausted. A retry caused by an
     * infrastructure failure is held back for a backoff that doubles per attempt.
     */
    public Task applyVerdict(String taskId, Verdict verdict) {
        Task task = get(taskId);
        if (task.status() != TaskStatus.IN_PROGRESS) {
            throw new IllegalTransitionException(taskId, task.status(), targetOf(verdict),
                    "verdicts apply to in-progress tasks only");
        }
        List<String> reasons = verdict.reasons();
        Task result = switch (verdict.decision()) {
            case DONE -> transition(taskId, TaskStatus.DONE, null, "verdict:DONE", t -> t.withReasons(reasons));
            case ESCALATE -> transition(taskId, TaskStatus.FAILED, Lane.QUARANTINE, "verdict:ESCALATE",
                    t -> t.withReasons(reasons));
            case RETRY -> {
                if (task.attemptsRemaining() == 0) {
                    var exhausted = new LinkedHashSet<>(reasons);
                    exhausted.add(ReasonCodes.RETRIES_EXHAUSTED);
                    yield transition(taskId, TaskStatus.FAILED, Lane.DLQ, ReasonCodes.RETRIES_EXHAUSTED,
                            t -> t.withReasons(new ArrayList<>(exhausted)));
                }
                Instant notBefore = retryNotBefore(task.attempt(), reasons);
                yield transition(taskId, TaskStatus.FAILED, null, "verdict:RETRY",
                        t -> t.withReasons(reasons).withNotBefore(notBefore));
            }
        };
        log.info("Task {} verdict {} -> {} / {} {}", taskId, verdict.decision(), result.status(),
                result.lane().key(), result.reasons());
        return result;
    }

    public Task block(String taskId, String reason) {
        return transition(taskId, TaskStatus.BLOCKED, null, reason, t -> t.withReasons(List.of(reason)));
    }

    /**
     * Operator cancel of a running task: IN_PROGRESS to BLOCKED. The cancelled
     * attempt is not counted against the budget.
     */
    public Task holdCancelled(String taskId) {
        return transition(taskId, TaskStatus.BLOCKED, null, ReasonCodes.CANCELLED_BY_OPERATOR,
                t -> t.withAttempt(Math.max(0, t.attempt() - 1))
                        .withReasons(List.of(ReasonCodes.CANCELLED_BY_OPERATOR)));
    }

    public Task unblock(String taskId) {
        return transition(taskId, TaskStatus.READY, null, "unblocked", t -> t.withReasons(List.of()));
    }

    /**
     * Marks a task as too large to execute. An atomic task becomes a parent, so
     * {@link #split} accepts it and it closes once its children are done. A
     * verdict arriving later for its running job is no longer applied.
     */
    public Task requestSplit(String taskId, String reason) {
        return transition(taskId, TaskStatus.NEEDS_SPLIT, null, reason == null ? "split_requested" : reason,
                t -> t.kind() == TaskKind.PARENT ? t : t.asParent());
    }

    /**
     * Creates children under a parent task. A parent still in BACKLOG is moved to
     * NEEDS_SPLIT first. Each child is validated against the parent's scope.
     */
    public List<Task> split(String parentId, List<NewTask> children) {
        Task parent = get(parentId);
        if (parent.kind() != TaskKind.PARENT) {
            throw new IllegalTransitionException(parentId, parent.status(), TaskStatus.NEEDS_SPLIT,
                    "only parent tasks can be split");
        }
        if (parent.status() == TaskStatus.BACKLOG) {
            promote(parentId);
        } else if (parent.status() != TaskStatus.NEEDS_SPLIT) {
            throw new IllegalTransitionException(parentId, parent.status(), TaskStatus.NEEDS_SPLIT,
                    "parent must be awaiting a split");
        }
        var created = new ArrayList<Task>();
        for (NewTask child : children) {
            created.add(taskIntake.create(child.withParent(parentId)).task());
        }
        log.info("Split {} into {}", parentId, created.stream().map(Task::id).toList());
        return created;
    }

    /**
     * Returns a quarantined task to its derived lane with a fresh attempt budget.
     * It stays FAILED and re-enters through admission as a retry.
     */
    public Task releaseFromQuarantine(String taskId) {
        Task task = get(taskId);
        if (task.lane() != Lane.QUARANTINE) {
            throw new IllegalTransitionException(taskId, task.status(), task.status(),
                    "task is not quarantined (lane " + task.lane().key() + ")");
        }
        Lane lane = laneRouter.route(null, task.area(), task.priority());
        return taskRepository.update(taskId, t -> {
            if (t.lane() != Lane.QUARANTINE) {
                throw new IllegalTransitionException(taskId, t.status(), t.status(), "no longer quarantined");
            }
            log.info("Task {} released from quarantine into {}", taskId, lane.key());
            return t.transition(t.status(), lane, ReasonCodes.RELEASED_BY_OPERATOR, clock.instant())
                    .withAttempt(0).withNotBefore(null)
                    .withReasons(List.of(ReasonCodes.RELEASED_BY_OPERATOR));
        });
    }

    /** Operator lane change between the regular lanes. */
    public Task overrideLane(String taskId, Lane lane) {
        if (lane.escalation()) {
            throw new IllegalArgumentException("Lane " + lane.key() + " is reached by escalation only");
        }
        return taskRepository.update(taskId, t -> {
            if (t.terminal() || t.lane().escalation()) {
                throw new IllegalTransitionException(taskId, t.status(), t.status(),
                        "lane of " + t.lane().key() + " task cannot be overridden");
            }
            return t.transition(t.status(), lane, "lane_override", clock.instant());
        });
    }

    /**
     * Closes every NEEDS_SPLIT parent whose children are all DONE.
     *
     * @return the parents closed by this call
     */
    public List<Task> rollUpParents() {
        var closed = new ArrayList<Task>();
        for (Task parent : taskRepository.findByStatus(TaskStatus.NEEDS_SPLIT)) {
            var children = taskRepository.findChildren(parent.id());
            if (!children.isEmpty() && children.stream().allMatch(c -> c.status() == TaskStatus.DONE)) {
                closed.add(transition(parent.id(), TaskStatus.DONE, null, ReasonCodes.CHILDREN_DONE,
                        t -> t.withReasons(List.of(ReasonCodes.CHILDREN_DONE))));
                log.info("Parent {} closed: all {} children done", parent.id(), children.size());
            }
        }
        return closed;
    }

    /**
     * Moves a task along a legal edge, checking the edge again under the record lock.
     *
     * @param lane   new lane, or null to keep the current one
     * @param guard  applied to the current task before the move; may adjust it or throw
     */
    Task transition(String taskId, TaskStatus to, Lane lane, String reason, UnaryOperator<Task> guard) {
        return taskRepository.update(taskId, current -> {
            if (!TaskTransitions.isLegal(current.status(), to)) {
                throw new IllegalTransitionException(taskId, current.status(), to, null);
            }
            if (current.status() == TaskStatus.FAILED && current.lane() == Lane.DLQ) {
                throw new IllegalTransitionException(taskId, current.status(), to, "task is dead-lettered");
            }
            Task guarded = guard.apply(current);
            Lane nextLane = lane == null ? guarded.lane() : lane;
            log.debug("Task {} {} -> {} ({}) lane={}", taskId, current.status(), to, reason, nextLane.key());
            return guarded.transition(to, nextLane, reason, clock.instant());
        });
    }

    /**
     * Backoff deadline for a retry, or null when no reason is an infrastructure failure.
     * Attempt 1 waits the base delay, each later attempt twice the previous one, up to the cap.
     */
    Instant retryNotBefore(int attempt, List<String> reasons) {
        if (reasons.stream().noneMatch(r -> FailureClass.of(r) == FailureClass.INFRASTRUCTURE)) {
            return null;
        }
        Duration cap = laneProperties.getRetryBackoffMax();
        Duration delay = laneProperties.getRetryBackoff();
        for (int i = 1; i < attempt && delay.compareTo(cap) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        if (delay.compareTo(cap) > 0) {
            delay = cap;
        }
        return clock.instant().plus(delay);
    }

    private static TaskStatus targetOf(Verdict verdict) {
        return verdict.decision() == VerdictDecision.DONE ? TaskStatus.DONE : TaskStatus.FAILED;
    }
}

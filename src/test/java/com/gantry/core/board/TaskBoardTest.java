package com.gantry.core.board;

import com.gantry.core.model.Lane;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.Task;
import com.gantry.core.model.TaskKind;
import com.gantry.core.model.TaskScope;
import com.gantry.core.model.TaskStatus;
import com.gantry.core.model.Verdict;
import com.gantry.core.model.VerdictDecision;
import com.gantry.support.GantryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.gantry.support.GantryFixture.ACME_ALLOWED;
import static com.gantry.support.GantryFixture.ACME_FORBIDDEN;
import static org.junit.jupiter.api.Assertions.*;

class TaskBoardTest {

    private GantryFixture fixture;
    private TaskBoard board;

    @BeforeEach
    void setUp() {
        fixture = new GantryFixture();
        board = fixture.taskBoard;
    }

    private static Verdict verdict(VerdictDecision decision, String... reasons) {
        return new Verdict(decision, List.of(reasons), List.of(), Instant.EPOCH);
    }

    private Task inProgress(String goal) {
        var task = fixture.readyTask(goal);
        return board.markInProgress(task.id(), "JOB-00001");
    }

    private Task parent(String goal) {
        return board.create(new NewTask(goal, "engineer", TaskKind.PARENT, null, null, null, null,
                new TaskScope(ACME_ALLOWED, ACME_FORBIDDEN), null, null, null, null)).task();
    }

    private static NewTask child(String goal) {
        return NewTask.atomic(goal, "engineer",
                new TaskScope(List.of("src/main/java/com/acme/api/**"), ACME_FORBIDDEN));
    }

    @Nested
    @DisplayName("lifecycle edges")
    class Edges {

        @Test
        void promoteMovesAtomicTaskToReady() {
            var task = fixture.readyTask("goal");
            assertEquals(TaskStatus.READY, task.status());
            assertEquals(TaskStatus.BACKLOG, task.history().get(1).from());
        }

        @Test
        void promoteMovesParentToNeedsSplit() {
            var task = board.promote(parent("epic").id());
            assertEquals(TaskStatus.NEEDS_SPLIT, task.status());
        }

        @Test
        void markInProgressCountsTheAttempt() {
            var task = inProgress("goal");
            assertEquals(TaskStatus.IN_PROGRESS, task.status());
            assertEquals(1, task.attempt());
            assertEquals("dispatched:JOB-00001", task.history().get(task.history().size() - 1).reason());
        }

        @Test
        void backlogCannotJumpToInProgress() {
            var task = fixture.backlogTask("goal");
            var e = assertThrows(IllegalTransitionException.class, () -> board.markInProgress(task.id(), "JOB-1"));
            assertEquals(TaskStatus.BACKLOG, e.getFrom());
            assertEquals(TaskStatus.IN_PROGRESS, e.getTo());
        }

        @Test
        void doneIsTerminal() {
            var task = inProgress("goal");
            board.applyVerdict(task.id(), verdict(VerdictDecision.DONE));
            assertThrows(IllegalTransitionException.class, () -> board.block(task.id(), "late"));
            assertTrue(board.get(task.id()).terminal());
        }

        @Test
        void blockedTaskReturnsToReadyWithClearedReasons() {
            var task = fixture.readyTask("goal");
            var blocked = board.block(task.id(), "waiting_on_review");
            assertEquals(List.of("waiting_on_review"), blocked.reasons());

            var unblocked = board.unblock(task.id());
            assertEquals(TaskStatus.READY, unblocked.status());
            assertTrue(unblocked.reasons().isEmpty());
        }

        @Test
        void inProgressCanRequestSplit() {
            var task = inProgress("too big");
            assertEquals(TaskStatus.NEEDS_SPLIT, board.requestSplit(task.id(), null).status());
        }

        @Test
        void historyIsAppendOnly() {
            var task = inProgress("goal");
            var after = board.applyVerdict(task.id(), verdict(VerdictDecision.RETRY, "CI_FAILED"));
            assertEquals(task.history(), after.history().subList(0, task.history().size()));
            assertEquals(task.history().size() + 1, after.history().size());
        }
    }

    @Nested
    @DisplayName("applyVerdict")
    class ApplyVerdict {

        @Test
        void doneClosesTask() {
            var task = inProgress("goal");
            var done = board.applyVerdict(task.id(), verdict(VerdictDecision.DONE));
            assertEquals(TaskStatus.DONE, done.status());
            assertEquals(Lane.MAINLANE, done.lane());
        }

        @Test
        void escalateParksInQuarantine() {
            var task = inProgress("goal");
            var parked = board.applyVerdict(task.id(), verdict(VerdictDecision.ESCALATE, "SCOPE_CONFLICT"));
            assertEquals(TaskStatus.FAILED, parked.status());
            assertEquals(Lane.QUARANTINE, parked.lane());
            assertEquals(List.of("SCOPE_CONFLICT"), parked.reasons());
        }

        @Test
        void retryWithAttemptsLeftStaysInLane() {
            var task = inProgress("goal");
            var failed = board.applyVerdict(task.id(), verdict(VerdictDecision.RETRY, "CI_FAILED"));
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals(Lane.MAINLANE, failed.lane());
            assertEquals(List.of(failed), board.dispatchQueue(Lane.MAINLANE));
        }

        @Test
        void infrastructureRetryWaitsOutItsBackoff() {
            var task = inProgress("goal");
            var failed = board.applyVerdict(task.id(), verdict(VerdictDecision.RETRY, ReasonCodes.EXECUTOR_CRASH));

            assertEquals(fixture.clock.instant().plusSeconds(30), failed.notBefore());
            assertTrue(board.dispatchQueue(Lane.MAINLANE).isEmpty());

            fixture.clock.advance(Duration.ofSeconds(30));
            assertEquals(List.of(task.id()), board.dispatchQueue(Lane.MAINLANE).stream().map(Task::id).toList());
        }

        @Test
        void backoffDoublesPerAttemptUpToTheCap() {
            var now = fixture.clock.instant();
            var crash = List.of(ReasonCodes.EXECUTOR_TIMEOUT);

            assertEquals(now.plusSeconds(30), board.retryNotBefore(1, crash));
            assertEquals(now.plusSeconds(120), board.retryNotBefore(3, crash));
            assertEquals(now.plus(Duration.ofMinutes(10)), board.retryNotBefore(12, crash));
            assertNull(board.retryNotBefore(3, List.of(ReasonCodes.CI_FAILED)));
        }

        @Test
        void redispatchClearsTheBackoff() {
            var task = inProgress("goal");
            board.applyVerdict(task.id(), verdict(VerdictDecision.RETRY, ReasonCodes.EXECUTOR_LOST));
            fixture.clock.advance(Duration.ofMinutes(1));

            assertNull(board.markInProgress(task.id(), "JOB-00002").notBefore());
        }

        @Test
        void retryOnLastAttemptDeadLetters() {
            var task = inProgress("goal");
            board.applyVerdict(task.id(), verdict(VerdictDecision.RETRY, "CI_FAILED"));
            board.markInProgress(task.id(), "JOB-00002");

            var dead = board.applyVerdict(task.id(), verdict(VerdictDecision.RETRY, "CI_FAILED"));

            assertEquals(TaskStatus.FAILED, dead.status());
            assertEquals(Lane.DLQ, dead.lane());
            assertEquals(List.of("CI_FAILED", ReasonCodes.RETRIES_EXHAUSTED), dead.reasons());
            assertTrue(dead.terminal());
            assertTrue(board.dispatchQueue(Lane.MAINLANE).isEmpty());
            assertThrows(IllegalTransitionException.class, () -> board.markInProgress(task.id(), "JOB-00003"));
        }

        @Test
        void verdictOnIdleTaskIsIllegal() {
            var task = fixture.readyTask("goal");
            assertThrows(IllegalTransitionException.class,
                    () -> board.applyVerdict(task.id(), verdict(VerdictDecision.DONE)));
        }
    }

    @Nested
    @DisplayName("split and roll-up")
    class Split {

        @Test
        void splitCreatesChildrenAndMovesParentToNeedsSplit() {
            var epic = parent("epic");

            var children = board.split(epic.id(), List.of(child("api"), child("api docs")));

            assertEquals(2, children.size());
            assertTrue(children.stream().allMatch(c -> epic.id().equals(c.parentId())));
            assertEquals(TaskStatus.NEEDS_SPLIT, board.get(epic.id()).status());
        }

        @Test
        void atomicTaskCannotBeSplit() {
            var task = fixture.backlogTask("atomic");
            assertThrows(IllegalTransitionException.class, () -> board.split(task.id(), List.of(child("x"))));
        }

        @Test
        void parentClosesOnceAllChildrenAreDone() {
            var epic = parent("epic");
            var children = board.split(epic.id(), List.of(child("a"), child("b")));
            for (Task c : children) {
                board.promote(c.id());
                board.markInProgress(c.id(), "JOB-" + c.id());
            }
            board.applyVerdict(children.get(0).id(), verdict(VerdictDecision.DONE));
            assertTrue(board.rollUpParents().isEmpty());

            board.applyVerdict(children.get(1).id(), verdict(VerdictDecision.DONE));
            var closed = board.rollUpParents();

            assertEquals(1, closed.size());
            assertEquals(TaskStatus.DONE, board.get(epic.id()).status());
            assertEquals(List.of(ReasonCodes.CHILDREN_DONE), board.get(epic.id()).reasons());
        }

        @Test
        void taskThatRequestedASplitCanBeSplitAndRollsUp() {
            var task = inProgress("too big");
            var needsSplit = board.requestSplit(task.id(), "too_large");
            assertEquals(TaskKind.PARENT, needsSplit.kind());

            var children = board.split(task.id(), List.of(child("api")));
            var c = children.get(0);
            board.promote(c.id());
            board.markInProgress(c.id(), "JOB-" + c.id());
            board.applyVerdict(c.id(), verdict(VerdictDecision.DONE));

            assertEquals(List.of(task.id()), board.rollUpParents().stream().map(Task::id).toList());
            assertEquals(TaskStatus.DONE, board.get(task.id()).status());
        }

        @Test
        void lateVerdictForTheSplitTaskIsRejected() {
            var task = inProgress("too big");
            board.requestSplit(task.id(), null);

            assertThrows(IllegalTransitionException.class,
                    () -> board.applyVerdict(task.id(), verdict(VerdictDecision.DONE)));
            assertEquals(TaskStatus.NEEDS_SPLIT, board.get(task.id()).status());
        }

        @Test
        void parentsAreNeverQueuedForDispatch() {
            var epic = parent("epic");
            board.promote(epic.id());
            assertTrue(board.dispatchQueue(Lane.MAINLANE).isEmpty());
        }
    }

    @Nested
    @DisplayName("operator actions")
    class Operator {

        @Test
        void releaseFromQuarantineResetsBudget() {
            var task = inProgress("goal");
            board.applyVerdict(task.id(), verdict(VerdictDecision.ESCALATE, "SCOPE_CONFLICT"));

            var released = board.releaseFromQuarantine(task.id());

            assertEquals(TaskStatus.FAILED, released.status());
            assertEquals(Lane.MAINLANE, released.lane());
            assertEquals(0, released.attempt());
            assertEquals(List.of(ReasonCodes.RELEASED_BY_OPERATOR), released.reasons());
            assertEquals(List.of(released), board.dispatchQueue(Lane.MAINLANE));
        }

        @Test
        void releaseRequiresQuarantine() {
            var task = fixture.readyTask("goal");
            assertThrows(IllegalTransitionException.class, () -> board.releaseFromQuarantine(task.id()));
        }

        @Test
        void overrideLaneMovesBetweenRegularLanes() {
            var task = fixture.readyTask("goal");
            assertEquals(Lane.BATCHLANE, board.overrideLane(task.id(), Lane.BATCHLANE).lane());
            assertThrows(IllegalArgumentException.class, () -> board.overrideLane(task.id(), Lane.DLQ));
        }

        @Test
        void cancelledAttemptIsGivenBack() {
            var task = inProgress("goal");
            var held = board.holdCancelled(task.id());
            assertEquals(TaskStatus.BLOCKED, held.status());
            assertEquals(0, held.attempt());
        }
    }

    @Test
    void dispatchQueueOrdersByPriorityThenCreation() {
        var late = board.create(new NewTask("late urgent", "engineer", null, null, null, "mainlane", 0,
                new TaskScope(ACME_ALLOWED, ACME_FORBIDDEN), null, null, null, null)).task();
        var first = fixture.backlogTask("first");
        var second = fixture.backlogTask("second");
        for (Task t : List.of(second, late, first)) {
            board.promote(t.id());
        }

        var queue = board.dispatchQueue(Lane.MAINLANE).stream().map(Task::id).toList();

        assertEquals(List.of(late.id(), first.id(), second.id()), queue);
    }
}

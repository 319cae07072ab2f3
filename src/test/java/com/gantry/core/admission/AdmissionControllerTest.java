package com.gantry.core.admission;

import com.gantry.core.board.NewTask;
import com.gantry.core.model.Lane;
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

import java.time.Instant;
import java.util.List;

import static com.gantry.support.GantryFixture.ACME_ALLOWED;
import static com.gantry.support.GantryFixture.ACME_FORBIDDEN;
import static org.junit.jupiter.api.Assertions.*;

class AdmissionControllerTest {

    private GantryFixture fixture;
    private AdmissionController admission;

    @BeforeEach
    void setUp() {
        fixture = new GantryFixture();
        admission = fixture.admissionController;
    }

    private Task readyIn(String lane, String goal) {
        var task = fixture.taskBoard.create(new NewTask(goal, "engineer", null, null, null, lane, null,
                new TaskScope(ACME_ALLOWED, ACME_FORBIDDEN), null, null, null, null)).task();
        return fixture.taskBoard.promote(task.id());
    }

    private void start(Task task) {
        fixture.taskBoard.markInProgress(task.id(), "JOB-" + task.id());
    }

    private void degrade(int failures) {
        for (int i = 0; i < 10 - failures; i++) {
            fixture.degradationMonitor.recordOutcome(true);
        }
        for (int i = 0; i < failures; i++) {
            fixture.degradationMonitor.recordOutcome(false);
        }
    }

    @Nested
    @DisplayName("WIP ceilings")
    class Ceilings {

        @Test
        void batchLaneAtCeilingDefersAndTaskStaysReady() {
            fixture.admissionProperties.getWipLimits().put("batchlane", 2);
            start(readyIn("batchlane", "one"));
            start(readyIn("batchlane", "two"));
            var third = readyIn("batchlane", "three");

            var decision = admission.admit(third);

            assertEquals(AdmissionDecision.Outcome.DEFERRED, decision.outcome());
            assertEquals("wip_ceiling:batchlane", decision.reason());
            assertEquals(TaskStatus.READY, fixture.task(third.id()).status());
        }

        @Test
        void ceilingsArePerLane() {
            fixture.admissionProperties.getWipLimits().put("batchlane", 1);
            start(readyIn("batchlane", "batch"));
            var main = readyIn("mainlane", "main");

            assertTrue(admission.admit(main).isGranted());
        }

        @Test
        void unconfiguredLaneHasNoCapacity() {
            fixture.admissionProperties.getWipLimits().remove("fastlane");
            var urgent = readyIn("fastlane", "urgent");
            assertEquals(AdmissionDecision.Outcome.DEFERRED, admission.admit(urgent).outcome());
        }

        @Test
        void degradationHalvesRegularLanesButNotFastLane() {
            degrade(4);
            assertEquals(DegradationLevel.DEGRADED, admission.degradationLevel());

            assertEquals(5, admission.effectiveWipLimit(Lane.MAINLANE));
            assertEquals(10, admission.effectiveWipLimit(Lane.BATCHLANE));
            assertEquals(5, admission.effectiveWipLimit(Lane.FASTLANE));
            assertEquals(0, admission.effectiveWipLimit(Lane.QUARANTINE));
        }

        @Test
        void degradedLimitNeverDropsBelowOne() {
            fixture.admissionProperties.getWipLimits().put("mainlane", 1);
            degrade(4);
            assertEquals(1, admission.effectiveWipLimit(Lane.MAINLANE));
        }
    }

    @Nested
    @DisplayName("blocked admissions")
    class Blocked {

        @Test
        void parentsNeverRun() {
            var parent = fixture.taskBoard.create(new NewTask("epic", "engineer", TaskKind.PARENT, null, null, null,
                    null, new TaskScope(ACME_ALLOWED, ACME_FORBIDDEN), null, null, null, null)).task();
            assertEquals("parent_task", admission.admit(parent).reason());
        }

        @Test
        void quarantinedTasksAreNotAdmitted() {
            var task = readyIn(null, "goal");
            start(task);
            var parked = fixture.taskBoard.applyVerdict(task.id(),
                    new Verdict(VerdictDecision.ESCALATE, List.of("SCOPE_CONFLICT"), List.of(), Instant.EPOCH));

            var decision = admission.admit(parked);

            assertEquals(AdmissionDecision.Outcome.BLOCKED, decision.outcome());
            assertEquals("lane_quarantine", decision.reason());
        }

        @Test
        void backlogTasksMustBePromotedFirst() {
            var task = fixture.backlogTask("goal");
            assertEquals("status_backlog", admission.admit(task).reason());
        }

        @Test
        void exhaustedTasksAreBlocked() {
            var task = readyIn(null, "goal").withAttempt(2);
            assertEquals("attempts_exhausted", admission.admit(task).reason());
        }
    }

    @Nested
    @DisplayName("admitToReady")
    class AdmitToReady {

        @Test
        void backlogTaskIsGranted() {
            assertTrue(admission.admitToReady(fixture.backlogTask("goal")).isGranted());
        }

        @Test
        void criticalDegradationHoldsNonFastWork() {
            degrade(7);
            assertEquals(DegradationLevel.CRITICAL, admission.degradationLevel());

            var main = fixture.backlogTask("main");
            var fast = fixture.taskBoard.create(new NewTask("fast", "engineer", null, null, null, "fastlane", null,
                    new TaskScope(ACME_ALLOWED, ACME_FORBIDDEN), null, null, null, null)).task();

            assertEquals("degradation_critical", admission.admitToReady(main).reason());
            assertTrue(admission.admitToReady(fast).isGranted());
        }

        @Test
        void nonBacklogTaskIsBlocked() {
            var ready = fixture.readyTask("goal");
            assertEquals(AdmissionDecision.Outcome.BLOCKED, admission.admitToReady(ready).outcome());
        }
    }

    @Test
    void decisionsAreCountedPerLane() {
        var task = fixture.readyTask("goal");
        admission.admit(task);
        admission.admit(task);

        assertEquals(2.0, fixture.meterRegistry.get("gantry.admission.decisions")
                .tag("lane", "mainlane").tag("result", "granted").counter().count());
    }

    @Test
    void laneSnapshotsReportUsageAndWaiting() {
        start(readyIn("mainlane", "running"));
        readyIn("mainlane", "waiting");
        fixture.backlogTask("backlog");

        var main = admission.laneSnapshots().stream().filter(s -> s.lane() == Lane.MAINLANE).findFirst().orElseThrow();

        assertEquals(1, main.inProgress());
        assertEquals(10, main.wipLimit());
        assertEquals(2, main.waiting());
    }
}

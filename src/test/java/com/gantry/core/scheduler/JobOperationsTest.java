package com.gantry.core.scheduler;

import com.gantry.core.model.GateCategory;
import com.gantry.core.model.GateResult;
import com.gantry.core.model.JobStatus;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.SubmissionStatus;
import com.gantry.core.model.TaskStatus;
import com.gantry.core.model.TestRun;
import com.gantry.core.verdict.SubmissionPayload;
import com.gantry.support.GantryFixture;
import com.gantry.support.StubExecutorBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobOperationsTest {

    private GantryFixture fixture;
    private StubExecutorBackend claude;
    private String taskId;
    private String jobId;

    @BeforeEach
    void setUp() {
        fixture = new GantryFixture();
        claude = fixture.addExecutor("claude", 10, 2);
        taskId = fixture.readyTask("Add retry to client").id();
        fixture.scheduler.tick();
        jobId = fixture.jobRepository.findRunning(taskId).orElseThrow().id();
    }

    private SubmissionPayload done() {
        return new SubmissionPayload(taskId, "DONE", 0, List.of("src/main/java/com/acme/Client.java"),
                List.of("mvn test"), List.of(new TestRun("mvn test", true)), null, null);
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        void recordsSubmissionWithoutJudging() {
            var job = fixture.jobOperations.submit(jobId, done());

            assertEquals(SubmissionStatus.DONE, job.submission().status());
            assertEquals(JobStatus.RUNNING, job.status());
            assertNull(job.verdict());
            assertEquals(TaskStatus.IN_PROGRESS, fixture.task(taskId).status());
        }

        @Test
        void secondSubmissionConflicts() {
            fixture.jobOperations.submit(jobId, done());

            var ex = assertThrows(JobConflictException.class, () -> fixture.jobOperations.submit(jobId, done()));
            assertEquals(jobId, ex.getJobId());
        }

        @Test
        void invalidPayloadIsRejectedWithErrors() {
            var bad = new SubmissionPayload(taskId, "MAYBE", 0, null, null, null, null, null);

            var ex = assertThrows(SubmissionRejectedException.class, () -> fixture.jobOperations.submit(jobId, bad));
            assertEquals(List.of("SCHEMA_VIOLATION:status_invalid:MAYBE"), ex.getErrors());
            assertNull(fixture.jobRepository.get(jobId).submission());
        }

        @Test
        void finishedJobCannotBeSubmittedTo() {
            claude.exit(jobId, 137, null);
            fixture.reaper.reapAll();

            assertThrows(JobConflictException.class, () -> fixture.jobOperations.submit(jobId, done()));
        }

        @Test
        void recordedSubmissionIsJudgedOnExit() {
            fixture.jobOperations.submit(jobId, done());
            claude.exit(jobId, 0, null);

            assertEquals(1, fixture.reaper.reapAll());
            assertEquals(TaskStatus.DONE, fixture.task(taskId).status());
        }
    }

    @Nested
    @DisplayName("gate results")
    class Gates {

        @Test
        void laterResultReplacesEarlierOne() {
            fixture.jobOperations.recordGateResults(jobId, List.of(GateResult.failed("ci", GateCategory.CI, "red")));
            var job = fixture.jobOperations.recordGateResults(jobId, List.of(GateResult.passed("ci", GateCategory.CI)));

            assertEquals(List.of(GateResult.passed("ci", GateCategory.CI)), job.gateResults());
        }

        @Test
        void judgedJobRejectsResults() {
            claude.exit(jobId, 137, null);
            fixture.reaper.reapAll();

            assertThrows(JobConflictException.class, () -> fixture.jobOperations.recordGateResults(jobId,
                    List.of(GateResult.passed("ci", GateCategory.CI))));
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        void cancelStopsJobAndHoldsTask() {
            var job = fixture.jobOperations.cancel(jobId);

            assertEquals(JobStatus.CANCELLED, job.status());
            assertEquals(ReasonCodes.CANCELLED_BY_OPERATOR, job.failureReason());
            assertEquals(List.of(jobId), claude.cancelled);
            assertEquals(0, fixture.executorRegistry.inFlight("claude"));

            var task = fixture.task(taskId);
            assertEquals(TaskStatus.BLOCKED, task.status());
            assertEquals(0, task.attempt());
            assertEquals(List.of(ReasonCodes.CANCELLED_BY_OPERATOR), task.reasons());
        }

        @Test
        void cancelDoesNotCountAgainstBreaker() {
            fixture.jobOperations.cancel(jobId);
            assertEquals(0, fixture.breakers.state("claude").consecutiveFailures());
        }

        @Test
        void cancelledJobIsNotReaped() {
            fixture.jobOperations.cancel(jobId);

            assertEquals(0, fixture.reaper.reapAll());
            assertNull(fixture.jobRepository.get(jobId).verdict());
        }

        @Test
        void cancellingTwiceConflicts() {
            fixture.jobOperations.cancel(jobId);
            assertThrows(JobConflictException.class, () -> fixture.jobOperations.cancel(jobId));
        }

        @Test
        void unblockedTaskIsDispatchedAgain() {
            fixture.jobOperations.cancel(jobId);
            fixture.taskBoard.unblock(taskId);

            assertEquals(1, fixture.scheduler.tick());
            assertEquals(1, fixture.task(taskId).attempt());
        }
    }
}

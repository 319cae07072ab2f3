package com.gantry.core.verdict;

import com.gantry.core.gate.GateProperties;
import com.gantry.core.model.GateCategory;
import com.gantry.core.model.VerdictDecision;
import com.gantry.core.persistence.RecordNotFoundException;
import com.gantry.support.GantryFixture;
import com.gantry.support.StubExecutorBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.gantry.support.GantryFixture.doneSubmission;
import static com.gantry.support.GantryFixture.failedSubmission;
import static org.junit.jupiter.api.Assertions.*;

class VerdictReplayServiceTest {

    private GantryFixture fixture;
    private StubExecutorBackend claude;

    @BeforeEach
    void setUp() {
        fixture = new GantryFixture();
        claude = fixture.addExecutor("claude", 10, 5);
    }

    private String runToExit(String taskId, String submission) {
        fixture.scheduler.tick();
        var job = fixture.jobRepository.findRunning(taskId).orElseThrow();
        claude.exit(job.id(), 0, submission);
        fixture.scheduler.tick();
        return job.id();
    }

    @Test
    @DisplayName("Task without a judged job has nothing to replay")
    void nothingToReplay() {
        var task = fixture.readyTask("Add retry to client");
        fixture.scheduler.tick();

        assertTrue(fixture.replayService.replay(task.id()).isEmpty());
    }

    @Test
    @DisplayName("Unknown task -> RecordNotFoundException")
    void unknownTask() {
        assertThrows(RecordNotFoundException.class, () -> fixture.replayService.replay("TASK-9999"));
    }

    @Test
    @DisplayName("Latest attempt is the one replayed")
    void replaysLatestAttempt() {
        var task = fixture.readyTask("Add retry to client");
        fixture.scheduler.tick();
        var first = fixture.jobRepository.findRunning(task.id()).orElseThrow();
        claude.exit(first.id(), 1, failedSubmission(task.id()));
        fixture.scheduler.tick();
        var second = fixture.jobRepository.findRunning(task.id()).orElseThrow();
        claude.exit(second.id(), 0, doneSubmission(task.id()));
        fixture.scheduler.tick();

        var replay = fixture.replayService.replay(task.id()).orElseThrow();

        assertEquals(second.id(), replay.jobId());
        assertEquals(VerdictDecision.DONE, replay.stored().decision());
        assertTrue(replay.consistent());
    }

    @Test
    @DisplayName("A gate made required after judging shows up as an inconsistency")
    void ruleChangeIsReported() {
        var task = fixture.readyTask("Add retry to client");
        var jobId = runToExit(task.id(), doneSubmission(task.id()));

        var hygiene = new GateProperties.GateDefinition();
        hygiene.setName("hygiene");
        hygiene.setCategory(GateCategory.HYGIENE);
        var definitions = new ArrayList<>(fixture.gateProperties.getDefinitions());
        definitions.add(hygiene);
        fixture.gateProperties.setDefinitions(definitions);

        var replay = fixture.replayService.replay(task.id()).orElseThrow();

        assertEquals(jobId, replay.jobId());
        assertFalse(replay.consistent());
        assertEquals(VerdictDecision.DONE, replay.stored().decision());
        assertEquals(VerdictDecision.RETRY, replay.replayed().decision());
        assertEquals(List.of("gate_not_executed:hygiene"), replay.replayed().reasons());
    }

    @Test
    @DisplayName("Replay does not write anything")
    void replayIsReadOnly() {
        var task = fixture.readyTask("Add retry to client");
        var jobId = runToExit(task.id(), doneSubmission(task.id()));
        var before = fixture.jobRepository.get(jobId);
        var invocations = fixture.gates.invocations.size();

        fixture.replayService.replay(task.id());

        assertEquals(before, fixture.jobRepository.get(jobId));
        assertEquals(invocations, fixture.gates.invocations.size());
    }
}

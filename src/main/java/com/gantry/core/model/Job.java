package com.gantry.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One dispatch attempt of one task. A retried task gets a new job; a finished
 * job is never reopened.
 *
 * @param id            job identifier
 * @param taskId        owning task
 * @param attempt       the task attempt this job represents
 * @param executor      executor the job was dispatched to
 * @param status        job status
 * @param handle        opaque back-end handle, null until started
 * @param createdAt     creation timestamp
 * @param startedAt     when the back-end accepted the job
 * @param finishedAt    when the job reached a finished status
 * @param deadline      hard deadline; the job is cancelled once it passes
 * @param exitCode      process exit code, if any
 * @param failureReason reason code for FAILED/TIMED_OUT/CANCELLED jobs
 * @param submission    executor submission, recorded at most once
 * @param gateResults   gate outcomes, one per gate name
 * @param verdict       verdict issued for this job
 * @param schemaVersion persisted layout version
 */
public record Job(
    String id,
    String taskId,
    int attempt,
    String executor,
    JobStatus status,
    String handle,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    Instant deadline,
    Integer exitCode,
    String failureReason,
    Submission submission,
    List<GateResult> gateResults,
    Verdict verdict,
    int schemaVersion
) implements Serializable {

    public static final int SCHEMA_VERSION = 1;

    public Job {
        gateResults = gateResults == null ? List.of() : List.copyOf(gateResults);
    }

    public static Job queued(String id, String taskId, int attempt, String executor, Instant now) {
        return new Job(id, taskId, attempt, executor, JobStatus.QUEUED, null, now, null, null, null,
                null, null, null, List.of(), null, SCHEMA_VERSION);
    }

    public Job started(String backendHandle, Instant at, Instant jobDeadline) {
        return new Job(id, taskId, attempt, executor, JobStatus.RUNNING, backendHandle, createdAt, at,
                null, jobDeadline, exitCode, failureReason, submission, gateResults, verdict, schemaVersion);
    }

    public Job finished(JobStatus finalStatus, Integer code, String reason, Instant at) {
        return new Job(id, taskId, attempt, executor, finalStatus, handle, createdAt, startedAt,
                at, deadline, code, reason, submission, gateResults, verdict, schemaVersion);
    }

    public Job withSubmission(Submission value) {
        return new Job(id, taskId, attempt, executor, status, handle, createdAt, startedAt,
                finishedAt, deadline, exitCode, failureReason, value, gateResults, verdict, schemaVersion);
    }

    /** Adds or replaces the result for {@code result.gate()}. */
    public Job withGateResult(GateResult result) {
        var next = new ArrayList<GateResult>();
        for (GateResult existing : gateResults) {
            if (!existing.gate().equals(result.gate())) {
                next.add(existing);
            }
        }
        next.add(result);
        return new Job(id, taskId, attempt, executor, status, handle, createdAt, startedAt,
                finishedAt, deadline, exitCode, failureReason, submission, next, verdict, schemaVersion);
    }

    public Job withVerdict(Verdict value) {
        return new Job(id, taskId, attempt, executor, status, handle, createdAt, startedAt,
                finishedAt, deadline, exitCode, failureReason, submission, gateResults, value, schemaVersion);
    }

    public boolean hasGateResult(String gate) {
        return gateResults.stream().anyMatch(r -> r.gate().equals(gate));
    }
}

package com.gantry.core.scheduler;

import com.gantry.core.admission.CircuitBreakerRegistry;
import com.gantry.core.board.TaskBoard;
import com.gantry.core.model.GateResult;
import com.gantry.core.model.Job;
import com.gantry.core.model.JobStatus;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.persistence.JobRepository;
import com.gantry.core.verdict.SubmissionParser;
import com.gantry.core.verdict.SubmissionPayload;
import com.gantry.executor.ExecutorDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Job-level operations that come from outside the scheduler: submissions and
 * gate results pushed by executors or CI, and operator cancels.
 */
@Service
public class JobOperations {

    private static final Logger log = LoggerFactory.getLogger(JobOperations.class);

    private final JobRepository jobRepository;
    private final SubmissionParser submissionParser;
    private final ExecutorDispatcher dispatcher;
    private final CircuitBreakerRegistry breakers;
    private final TaskBoard taskBoard;
    private final Clock clock;

    public JobOperations(JobRepository jobRepository,
                         SubmissionParser submissionParser,
                         ExecutorDispatcher dispatcher,
                         CircuitBreakerRegistry breakers,
                         TaskBoard taskBoard,
                         Clock clock) {
        this.jobRepository = jobRepository;
        this.submissionParser = submissionParser;
        this.dispatcher = dispatcher;
        this.breakers = breakers;
        this.taskBoard = taskBoard;
        this.clock = clock;
    }

    /**
     * Records the submission of a running job. It is judged once the executor exits.
     *
     * @throws SubmissionRejectedException if the payload fails validation
     * @throws JobConflictException        if the job already has a submission or is not running
     */
    public Job submit(String jobId, SubmissionPayload payload) {
        var parsed = submissionParser.fromPayload(payload);
        if (!parsed.valid()) {
            throw new SubmissionRejectedException(jobId, parsed.errors());
        }
        Job job = jobRepository.update(jobId, j -> {
            if (j.submission() != null) {
                throw new JobConflictException(jobId, "already submitted");
            }
            if (j.status() != JobStatus.RUNNING) {
                throw new JobConflictException(jobId, "not running (" + j.status() + ")");
            }
            return j.withSubmission(parsed.submission());
        });
        log.info("Submission recorded for {} ({}): {}", jobId, job.taskId(), parsed.submission().status());
        return job;
    }

    /**
     * Stores gate results reported from outside; they replace results of the same gate.
     * Rejected once the job has a verdict.
     */
    public Job recordGateResults(String jobId, List<GateResult> results) {
        return jobRepository.update(jobId, j -> {
            if (j.verdict() != null) {
                throw new JobConflictException(jobId, "already judged");
            }
            Job next = j;
            for (GateResult result : results) {
                next = next.withGateResult(result);
            }
            return next;
        });
    }

    /**
     * Operator cancel. The job becomes CANCELLED, its process is stopped and the
     * task is held in BLOCKED. The attempt is not counted and the breaker is not fed.
     */
    public Job cancel(String jobId) {
        Job job = jobRepository.update(jobId, j -> {
            if (j.status() != JobStatus.RUNNING) {
                throw new JobConflictException(jobId, "not running (" + j.status() + ")");
            }
            return j.finished(JobStatus.CANCELLED, null, ReasonCodes.CANCELLED_BY_OPERATOR, clock.instant());
        });
        dispatcher.abort(job);
        breakers.releaseTrial(job.executor(), job.id());
        taskBoard.holdCancelled(job.taskId());
        log.info("Job {} cancelled by operator; task {} held", jobId, job.taskId());
        return job;
    }
}

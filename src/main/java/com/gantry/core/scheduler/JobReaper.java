package com.gantry.core.scheduler;

import com.gantry.core.admission.CircuitBreakerRegistry;
import com.gantry.core.admission.DegradationMonitor;
import com.gantry.core.board.IllegalTransitionException;
import com.gantry.core.board.TaskBoard;
import com.gantry.core.gate.GateRunner;
import com.gantry.core.logging.MdcContext;
import com.gantry.core.metrics.GantryMetrics;
import com.gantry.core.model.FailureClass;
import com.gantry.core.model.GateResult;
import com.gantry.core.model.Job;
import com.gantry.core.model.JobStatus;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.Task;
import com.gantry.core.model.Verdict;
import com.gantry.core.model.VerdictDecision;
import com.gantry.core.persistence.JobRepository;
import com.gantry.core.verdict.SubmissionParser;
import com.gantry.core.verdict.VerdictEngine;
import com.gantry.core.verdict.VerdictReplayService;
import com.gantry.executor.ExecutionPoll;
import com.gantry.executor.ExecutorDispatcher;
import com.gantry.executor.ExecutorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Collects finished and expired jobs and turns each into a verdict.
 * <p>
 * For a job whose process exited: read the submission (pushed through the API
 * or left in the submission file) and start the gates that have not reported.
 * Once every gate is back the job is judged, the verdict is recorded on the
 * job and applied to the task, then the executor's breaker and the degradation
 * window are fed. Jobs past their deadline are cancelled and judged as timeouts.
 */
@Service
public class JobReaper {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobRepository jobRepository;
    private final TaskBoard taskBoard;
    private final ExecutorDispatcher dispatcher;
    private final SubmissionParser submissionParser;
    private final GateRunner gateRunner;
    private final VerdictEngine verdictEngine;
    private final VerdictReplayService replayService;
    private final CircuitBreakerRegistry breakers;
    private final DegradationMonitor degradationMonitor;
    private final ExecutorProperties executorProperties;
    private final GantryMetrics metrics;
    private final Clock clock;

    public JobReaper(JobRepository jobRepository,
                     TaskBoard taskBoard,
                     ExecutorDispatcher dispatcher,
                     SubmissionParser submissionParser,
                     GateRunner gateRunner,
                     VerdictEngine verdictEngine,
                     VerdictReplayService replayService,
                     CircuitBreakerRegistry breakers,
                     DegradationMonitor degradationMonitor,
                     ExecutorProperties executorProperties,
                     GantryMetrics metrics,
                     Clock clock) {
        this.jobRepository = jobRepository;
        this.taskBoard = taskBoard;
        this.dispatcher = dispatcher;
        this.submissionParser = submissionParser;
        this.gateRunner = gateRunner;
        this.verdictEngine = verdictEngine;
        this.replayService = replayService;
        this.breakers = breakers;
        this.degradationMonitor = degradationMonitor;
        this.executorProperties = executorProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Checks every RUNNING job once, then every exited job still waiting for gates.
     *
     * @return number of jobs judged
     */
    public int reapAll() {
        int judged = 0;
        for (Job job : jobRepository.findByStatus(JobStatus.RUNNING)) {
            if (guarded(job, () -> reap(job))) {
                judged++;
            }
        }
        for (Job job : awaitingVerdict()) {
            if (guarded(job, () -> settle(job))) {
                judged++;
            }
        }
        return judged;
    }

    private boolean guarded(Job job, BooleanSupplier step) {
        MdcContext.setJob(job.taskId(), job.id(), job.executor(), null);
        try {
            return step.getAsBoolean();
        } catch (RuntimeException e) {
            log.error("Reaping {} failed: {}", job.id(), e.getMessage(), e);
            return false;
        } finally {
            MdcContext.clear();
        }
    }

    /** Exited jobs with a submission and no verdict yet. Start failures never ran and are skipped. */
    private List<Job> awaitingVerdict() {
        var waiting = new ArrayList<Job>();
        for (JobStatus status : List.of(JobStatus.DONE, JobStatus.FAILED)) {
            for (Job job : jobRepository.findByStatus(status)) {
                if (job.verdict() == null && job.startedAt() != null && job.submission() != null) {
                    waiting.add(job);
                }
            }
        }
        return waiting;
    }

    /**
     * @return true if the job finished and was judged
     */
    public boolean reap(Job job) {
        if (job.deadline() != null && clock.instant().isAfter(job.deadline())) {
            return expire(job, ReasonCodes.EXECUTOR_TIMEOUT);
        }
        ExecutionPoll poll = dispatcher.poll(job);
        return switch (poll.state()) {
            case RUNNING -> false;
            case LOST -> {
                log.warn("Executor {} no longer knows job {}", job.executor(), job.id());
                dispatcher.release(job);
                yield finishWithoutSubmission(job, JobStatus.FAILED, ReasonCodes.EXECUTOR_LOST);
            }
            case EXITED -> exited(job, poll);
        };
    }

    /**
     * Cancels a job that overran its deadline and judges it as a timeout.
     * Does nothing if the job is no longer RUNNING.
     */
    public boolean expire(Job job, String reason) {
        log.warn("Job {} passed its deadline {}; cancelling", job.id(), job.deadline());
        dispatcher.abort(job);
        return finishWithoutSubmission(job, JobStatus.TIMED_OUT, reason);
    }

    private boolean exited(Job job, ExecutionPoll poll) {
        dispatcher.release(job);
        Job current = job;
        String noSubmissionReason = null;
        if (current.submission() == null && poll.submissionJson() != null) {
            var parsed = submissionParser.parse(poll.submissionJson());
            if (parsed.valid()) {
                current = jobRepository.update(job.id(), j -> j.submission() == null
                        ? j.withSubmission(parsed.submission()) : j);
            } else {
                log.warn("Job {} left an invalid submission: {}", job.id(), parsed.errors());
                noSubmissionReason = ReasonCodes.SCHEMA_VIOLATION;
            }
        }
        if (current.submission() == null) {
            String reason = noSubmissionReason == null ? ReasonCodes.EXECUTOR_CRASH : noSubmissionReason;
            return finishWithoutSubmission(current, JobStatus.FAILED, reason);
        }

        Integer exitCode = poll.exitCode();
        boolean clean = exitCode == null || exitCode == 0;
        var finished = new AtomicBoolean(false);
        current = jobRepository.update(job.id(), j -> {
            if (j.status() != JobStatus.RUNNING) {
                return j;
            }
            finished.set(true);
            return j.finished(clean ? JobStatus.DONE : JobStatus.FAILED, exitCode,
                    clean ? null : ReasonCodes.EXIT_CODE_NONZERO, clock.instant());
        });
        if (!finished.get()) {
            return false;
        }
        return settle(current);
    }

    /**
     * Starts missing gates, stores the ones that came back and judges the job
     * once none is outstanding.
     *
     * @return true if the job was judged
     */
    private boolean settle(Job job) {
        gateRunner.start(job, jobDir(job));
        Job current = job;
        for (GateResult result : gateRunner.collect(job.id())) {
            current = jobRepository.update(job.id(), j -> j.hasGateResult(result.gate()) ? j : j.withGateResult(result));
        }
        if (gateRunner.pending(job.id())) {
            log.debug("Job {} waiting for gates", job.id());
            return false;
        }
        return judge(current);
    }

    private boolean finishWithoutSubmission(Job job, JobStatus status, String reason) {
        var finished = new AtomicBoolean(false);
        Job updated = jobRepository.update(job.id(), j -> {
            if (j.status() != JobStatus.RUNNING) {
                return j;
            }
            finished.set(true);
            return j.finished(status, null, reason, clock.instant());
        });
        return finished.get() && judge(updated);
    }

    private boolean judge(Job job) {
        Task task = taskBoard.get(job.taskId());
        Verdict verdict = verdictEngine.judge(replayService.requestFor(task, job));
        var recorded = new AtomicBoolean(false);
        jobRepository.update(job.id(), j -> {
            if (j.verdict() != null) {
                return j;
            }
            recorded.set(true);
            return j.withVerdict(verdict);
        });
        if (!recorded.get()) {
            return false;
        }

        try {
            taskBoard.applyVerdict(task.id(), verdict);
        } catch (IllegalTransitionException e) {
            log.warn("Verdict {} for {} not applied: {}", verdict.decision(), task.id(), e.getMessage());
        }

        boolean infrastructure = verdict.reasons().stream()
                .anyMatch(r -> FailureClass.of(r).feedsBreaker());
        if (infrastructure) {
            breakers.recordFailure(job.executor(), job.id());
        } else {
            breakers.recordSuccess(job.executor(), job.id());
        }
        degradationMonitor.recordOutcome(verdict.decision() == VerdictDecision.DONE);
        metrics.recordVerdict(verdict.decision(), verdict.reasons());
        if (job.startedAt() != null) {
            Instant end = job.finishedAt() == null ? clock.instant() : job.finishedAt();
            metrics.recordJobDuration(job.executor(), job.status().name(), Duration.between(job.startedAt(), end));
        }
        log.info("Job {} for {} judged {} {}", job.id(), task.id(), verdict.decision(), verdict.reasons());
        return true;
    }

    private Path jobDir(Job job) {
        return Path.of(executorProperties.getWorkDir()).resolve(job.id());
    }
}

package com.gantry.executor;

import com.gantry.core.admission.CircuitBreakerRegistry;
import com.gantry.core.admission.DegradationMonitor;
import com.gantry.core.board.IllegalTransitionException;
import com.gantry.core.board.TaskBoard;
import com.gantry.core.logging.MdcContext;
import com.gantry.core.metrics.GantryMetrics;
import com.gantry.core.model.Job;
import com.gantry.core.model.JobStatus;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.Task;
import com.gantry.core.persistence.JobRepository;
import com.gantry.core.security.RoleCapabilities;
import com.gantry.core.security.RolePolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Picks an executor for an admitted task and starts a job on it.
 *
 * <p>Candidate order is the task's executor preference, then the executors
 * listed for its role, then the rest of the registry by priority. A candidate
 * qualifies only when it is healthy, its breaker lets work through and it is
 * below its concurrency ceiling.
 *
 * <p>The task moves to IN_PROGRESS only after the back-end accepted the job.
 * If the start fails the job is recorded as FAILED, the breaker is fed, and
 * the task is left untouched for a later tick.
 */
@Service
public class ExecutorDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutorDispatcher.class);

    private final ExecutorRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final DegradationMonitor degradationMonitor;
    private final RolePolicyEngine rolePolicyEngine;
    private final JobRepository jobRepository;
    private final TaskBoard taskBoard;
    private final InstructionRenderer renderer;
    private final ExecutorProperties properties;
    private final GantryMetrics metrics;
    private final Clock clock;

    public ExecutorDispatcher(ExecutorRegistry registry,
                              CircuitBreakerRegistry breakers,
                              DegradationMonitor degradationMonitor,
                              RolePolicyEngine rolePolicyEngine,
                              JobRepository jobRepository,
                              TaskBoard taskBoard,
                              InstructionRenderer renderer,
                              ExecutorProperties properties,
                              GantryMetrics metrics,
                              Clock clock) {
        this.registry = registry;
        this.breakers = breakers;
        this.degradationMonitor = degradationMonitor;
        this.rolePolicyEngine = rolePolicyEngine;
        this.jobRepository = jobRepository;
        this.taskBoard = taskBoard;
        this.renderer = renderer;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Eligible executors for a task, best first.
     */
    public List<String> candidates(Task task) {
        var ordered = new LinkedHashSet<String>();
        if (task.executorPreference() != null && registry.find(task.executorPreference()).isPresent()) {
            ordered.add(task.executorPreference());
        }
        rolePolicyEngine.capabilitiesFor(task.role()).executors().stream()
                .filter(name -> registry.find(name).isPresent())
                .forEach(ordered::add);
        registry.byPriority().forEach(d -> ordered.add(d.name()));

        var eligible = new ArrayList<String>();
        for (String name : ordered) {
            if (registry.isHealthy(name) && breakers.isAvailable(name) && registry.hasCapacity(name)) {
                eligible.add(name);
            }
        }
        return eligible;
    }

    public Optional<String> selectExecutor(Task task) {
        return candidates(task).stream().findFirst();
    }

    /**
     * Starts the task on the best eligible executor. The caller must already hold an admission grant.
     */
    public DispatchResult dispatch(Task task) {
        var candidates = candidates(task);
        if (candidates.isEmpty()) {
            log.debug("No eligible executor for {}", task.id());
            return DispatchResult.noExecutor("no_executor_available");
        }
        String jobId = jobRepository.nextId();
        for (String executor : candidates) {
            if (!registry.tryAcquire(executor, jobId)) {
                continue;
            }
            if (!breakers.tryAcquire(executor, jobId)) {
                registry.release(executor, jobId);
                continue;
            }
            return start(task, executor, jobId);
        }
        return DispatchResult.noExecutor("no_executor_slot");
    }

    private DispatchResult start(Task task, String executor, String jobId) {
        MdcContext.setJob(task.id(), jobId, executor, task.lane().key());
        try {
            Instant now = clock.instant();
            int attempt = task.attempt() + 1;
            Job job = jobRepository.create(Job.queued(jobId, task.id(), attempt, executor, now));
            RoleCapabilities capabilities = rolePolicyEngine.capabilitiesFor(task.role());
            ExecutorDescriptor descriptor = registry.find(executor).orElseThrow();

            String handle;
            try {
                var request = new ExecutionRequest(jobId, task.id(), attempt, task.role(),
                        renderer.render(task, capabilities, attempt),
                        Path.of(properties.getWorkDir()).resolve(jobId), descriptor.timeout(), null);
                handle = registry.backend(executor).start(request);
            } catch (RuntimeException e) {
                log.warn("Executor {} failed to start {} for {}: {}", executor, jobId, task.id(), e.getMessage());
                Job failed = jobRepository.update(jobId, j -> j.finished(JobStatus.FAILED, null,
                        ReasonCodes.EXECUTOR_START_FAILED, clock.instant()));
                registry.release(executor, jobId);
                breakers.recordFailure(executor, jobId);
                degradationMonitor.recordOutcome(false);
                metrics.recordDispatch(executor, false);
                return DispatchResult.startFailed(failed, ReasonCodes.EXECUTOR_START_FAILED);
            }

            Instant startedAt = clock.instant();
            Job running = jobRepository.update(jobId,
                    j -> j.started(handle, startedAt, startedAt.plus(descriptor.timeout())));
            try {
                taskBoard.markInProgress(task.id(), jobId);
            } catch (IllegalTransitionException e) {
                log.warn("Task {} changed under dispatch of {}; cancelling: {}", task.id(), jobId, e.getMessage());
                abort(running);
                breakers.releaseTrial(executor, jobId);
                Job cancelled = jobRepository.update(jobId, j -> j.finished(JobStatus.CANCELLED, null,
                        "dispatch_race", clock.instant()));
                return DispatchResult.startFailed(cancelled, "dispatch_race");
            }

            metrics.recordDispatch(executor, true);
            metrics.recordQueueWait(task.lane(), Duration.between(task.updatedAt(), startedAt));
            log.info("Dispatched {} attempt {}/{} to {} as {}", task.id(), attempt, task.maxAttempts(),
                    executor, jobId);
            return DispatchResult.started(running);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops a job's back-end process and frees its concurrency slot.
     * Job and task records are left to the caller.
     */
    public void abort(Job job) {
        if (job.handle() != null) {
            try {
                registry.backend(job.executor()).cancel(job.handle());
            } catch (RuntimeException e) {
                log.warn("Cancel of {} on {} failed: {}", job.id(), job.executor(), e.getMessage());
            }
        }
        registry.release(job.executor(), job.id());
    }

    public ExecutionPoll poll(Job job) {
        return registry.backend(job.executor()).poll(job.handle());
    }

    /** Frees the slot of a job that finished on its own. */
    public void release(Job job) {
        registry.release(job.executor(), job.id());
    }

    /** Re-claims the slot of a job that was running before a restart. */
    public void reclaim(Job job) {
        registry.tryAcquire(job.executor(), job.id());
    }
}

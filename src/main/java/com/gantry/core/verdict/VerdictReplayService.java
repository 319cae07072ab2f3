package com.gantry.core.verdict;

import com.gantry.core.gate.GateRunner;
import com.gantry.core.model.FailureClass;
import com.gantry.core.model.Job;
import com.gantry.core.model.Task;
import com.gantry.core.model.Verdict;
import com.gantry.core.persistence.JobRepository;
import com.gantry.core.persistence.TaskRepository;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Optional;

/**
 * Re-judges the most recent judged job of a task from what was persisted.
 * Nothing is written; the result only tells whether today's rules agree
 * with the stored verdict.
 */
@Service
public class VerdictReplayService {

    private final TaskRepository taskRepository;
    private final JobRepository jobRepository;
    private final VerdictEngine verdictEngine;
    private final GateRunner gateRunner;

    public VerdictReplayService(TaskRepository taskRepository, JobRepository jobRepository,
                                VerdictEngine verdictEngine, GateRunner gateRunner) {
        this.taskRepository = taskRepository;
        this.jobRepository = jobRepository;
        this.verdictEngine = verdictEngine;
        this.gateRunner = gateRunner;
    }

    public Optional<VerdictReplay> replay(String taskId) {
        Task task = taskRepository.get(taskId);
        return jobRepository.findByTask(taskId).stream()
                .filter(j -> j.verdict() != null)
                .max(Comparator.comparingInt(Job::attempt).thenComparing(Job::createdAt))
                .map(job -> {
                    Verdict replayed = verdictEngine.judge(requestFor(task, job));
                    Verdict stored = job.verdict();
                    boolean consistent = stored.decision() == replayed.decision()
                            && stored.reasons().equals(replayed.reasons());
                    return new VerdictReplay(taskId, job.id(), stored, replayed, consistent);
                });
    }

    /** The judge inputs of a finished job, rebuilt from its record. */
    public JudgeRequest requestFor(Task task, Job job) {
        String failureReason = job.submission() == null
                || FailureClass.of(job.failureReason()).feedsBreaker() ? job.failureReason() : null;
        return new JudgeRequest(task.id(), task.role(), task.scope(), job.submission(), job.gateResults(),
                gateRunner.requiredGates(), failureReason, job.exitCode());
    }
}

package com.gantry.core.persistence;

import com.gantry.core.model.Job;
import com.gantry.core.model.JobStatus;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Job records in the {@code jobs} namespace, keyed by job id.
 */
@Component
public class JobRepository {

    private static final String SEQUENCE_NAME = "job";

    private final JsonRecords<Job> records;
    private final SequenceGenerator sequences;

    public JobRepository(StateStore store, SequenceGenerator sequences) {
        this.records = new JsonRecords<>(store, StateNamespace.JOBS, Job.class, StateJson.mapper());
        this.sequences = sequences;
    }

    public String nextId() {
        return "JOB-%05d".formatted(sequences.next(SEQUENCE_NAME));
    }

    public Job create(Job job) {
        return records.create(job.id(), job);
    }

    public Optional<Job> find(String jobId) {
        return records.get(jobId);
    }

    public Job get(String jobId) {
        return find(jobId).orElseThrow(() -> new RecordNotFoundException("Job " + jobId + " not found"));
    }

    public Job update(String jobId, UnaryOperator<Job> mutator) {
        return records.update(jobId, mutator);
    }

    public List<Job> findAll() {
        return records.list().stream().sorted(Comparator.comparing(Job::createdAt)).toList();
    }

    public List<Job> findByStatus(JobStatus status) {
        return findAll().stream().filter(j -> j.status() == status).toList();
    }

    /** Job history of a task, oldest first. */
    public List<Job> findByTask(String taskId) {
        return findAll().stream()
                .filter(j -> taskId.equals(j.taskId()))
                .sorted(Comparator.comparingInt(Job::attempt).thenComparing(Job::createdAt))
                .toList();
    }

    public Optional<Job> findRunning(String taskId) {
        return findByTask(taskId).stream().filter(j -> j.status() == JobStatus.RUNNING).findFirst();
    }

    public Optional<Job> findLatest(String taskId) {
        var jobs = findByTask(taskId);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(jobs.size() - 1));
    }
}

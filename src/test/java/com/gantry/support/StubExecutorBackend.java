package com.gantry.support;

import com.gantry.executor.ExecutionPoll;
import com.gantry.executor.ExecutionRequest;
import com.gantry.executor.ExecutorBackend;
import com.gantry.executor.ExecutorStartException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory executor back-end. Jobs stay RUNNING until a test finishes them.
 */
public class StubExecutorBackend implements ExecutorBackend {

    private final Map<String, ExecutionPoll> jobs = new ConcurrentHashMap<>();
    public final List<ExecutionRequest> started = new ArrayList<>();
    public final List<String> cancelled = new ArrayList<>();
    public boolean failStarts;
    public boolean healthy = true;

    @Override
    public String start(ExecutionRequest request) {
        if (failStarts) {
            throw new ExecutorStartException("stub refused " + request.jobId(), null);
        }
        started.add(request);
        jobs.put(request.jobId(), ExecutionPoll.running());
        return request.jobId();
    }

    @Override
    public ExecutionPoll poll(String handle) {
        return jobs.getOrDefault(handle, ExecutionPoll.lost());
    }

    @Override
    public void cancel(String handle) {
        cancelled.add(handle);
        jobs.remove(handle);
    }

    @Override
    public boolean healthCheck(Duration timeout) {
        return healthy;
    }

    /** Marks a job exited with the given exit code and submission file contents. */
    public void exit(String jobId, int exitCode, String submissionJson) {
        jobs.put(jobId, ExecutionPoll.exited(exitCode, "", submissionJson));
    }

    public void forget(String jobId) {
        jobs.remove(jobId);
    }
}

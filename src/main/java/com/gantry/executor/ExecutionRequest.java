package com.gantry.executor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Everything a back-end needs to start one job.
 *
 * @param jobId   job identifier, also used as the job's artifact directory name
 * @param taskId  owning task
 * @param attempt task attempt this job represents
 * @param role    execution role
 * @param context rendered context document; opaque to the orchestrator
 * @param jobDir  directory for the job's artifacts (context, logs, submission)
 * @param timeout hard limit for the run
 * @param env     extra environment for the executor
 */
public record ExecutionRequest(
    String jobId,
    String taskId,
    int attempt,
    String role,
    String context,
    Path jobDir,
    Duration timeout,
    Map<String, String> env
) {

    public ExecutionRequest {
        env = env == null ? Map.of() : Map.copyOf(env);
    }
}

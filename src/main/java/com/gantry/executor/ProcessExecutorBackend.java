package com.gantry.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs an executor as a local CLI process.
 * <p>
 * The rendered context is written to {@code context.md} in the job directory
 * and fed to the process on stdin. stdout and stderr go to log files next to
 * it. An executor that wants to return a structured result writes JSON to the
 * file named by {@code GANTRY_SUBMISSION_FILE}.
 */
public class ProcessExecutorBackend implements ExecutorBackend {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutorBackend.class);

    static final int MAX_OUTPUT_CHARS = 10_000;
    static final String CONTEXT_FILE = "context.md";
    static final String SUBMISSION_FILE = "submission.json";

    private final String name;
    private final List<String> command;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final List<String> healthCommand;
    private final ConcurrentHashMap<String, RunningProcess> processes = new ConcurrentHashMap<>();

    private record RunningProcess(Process process, Path jobDir) {}

    public ProcessExecutorBackend(String name, List<String> command, Path workingDirectory,
                                  Map<String, String> environment, List<String> healthCommand) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Executor " + name + " has no command");
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.healthCommand = healthCommand == null ? List.of() : List.copyOf(healthCommand);
    }

    @Override
    public String start(ExecutionRequest request) {
        Path jobDir = request.jobDir();
        try {
            Files.createDirectories(jobDir);
            Path contextFile = jobDir.resolve(CONTEXT_FILE);
            Files.writeString(contextFile, request.context(), StandardCharsets.UTF_8);

            var pb = new ProcessBuilder(command);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            var env = pb.environment();
            env.putAll(environment);
            env.putAll(request.env());
            env.put("GANTRY_TASK_ID", request.taskId());
            env.put("GANTRY_JOB_ID", request.jobId());
            env.put("GANTRY_ATTEMPT", String.valueOf(request.attempt()));
            env.put("GANTRY_ROLE", request.role());
            env.put("GANTRY_CONTEXT_FILE", contextFile.toAbsolutePath().toString());
            env.put("GANTRY_SUBMISSION_FILE", jobDir.resolve(SUBMISSION_FILE).toAbsolutePath().toString());
            pb.redirectInput(contextFile.toFile());
            pb.redirectOutput(jobDir.resolve("stdout.log").toFile());
            pb.redirectError(jobDir.resolve("stderr.log").toFile());

            Process process = pb.start();
            processes.put(request.jobId(), new RunningProcess(process, jobDir));
            log.info("Executor {} started job {} (pid {})", name, request.jobId(), process.pid());
            return request.jobId();
        } catch (IOException e) {
            throw new ExecutorStartException("Executor " + name + " failed to start job " + request.jobId(), e);
        }
    }

    @Override
    public ExecutionPoll poll(String handle) {
        RunningProcess running = processes.get(handle);
        if (running == null) {
            return ExecutionPoll.lost();
        }
        if (running.process().isAlive()) {
            return ExecutionPoll.running();
        }
        processes.remove(handle);
        int exitCode = running.process().exitValue();
        String output = readQuietly(running.jobDir().resolve("stdout.log"))
                + readQuietly(running.jobDir().resolve("stderr.log"));
        Path submission = running.jobDir().resolve(SUBMISSION_FILE);
        String submissionJson = Files.exists(submission) ? readQuietly(submission) : null;
        log.info("Executor {} job {} exited with code {}", name, handle, exitCode);
        return ExecutionPoll.exited(exitCode, truncateOutput(output), submissionJson);
    }

    @Override
    public void cancel(String handle) {
        RunningProcess running = processes.remove(handle);
        if (running == null) {
            return;
        }
        Process process = running.process();
        process.destroy();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        log.info("Executor {} job {} cancelled", name, handle);
    }

    @Override
    public boolean healthCheck(Duration timeout) {
        if (healthCommand.isEmpty()) {
            return true;
        }
        try {
            var pb = new ProcessBuilder(new ArrayList<>(healthCommand));
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Health probe for executor {} timed out after {}ms", name, timeout.toMillis());
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            log.warn("Health probe for executor {} failed: {}", name, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    int running() {
        return processes.size();
    }

    private String readQuietly(Path file) {
        try {
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }

    /**
     * Truncates output to ~10KB keeping the head and tail for context.
     */
    static String truncateOutput(String output) {
        if (output == null || output.length() <= MAX_OUTPUT_CHARS) return output;
        int headSize = MAX_OUTPUT_CHARS / 2;
        int tailSize = MAX_OUTPUT_CHARS / 2;
        return output.substring(0, headSize)
                + "\n\n... [truncated " + (output.length() - MAX_OUTPUT_CHARS) + " chars] ...\n\n"
                + output.substring(output.length() - tailSize);
    }
}

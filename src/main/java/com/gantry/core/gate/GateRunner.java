package com.gantry.core.gate;

import com.gantry.core.model.GateResult;
import com.gantry.core.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs the configured gates that have not already reported for a job.
 * Results pushed in from outside take precedence and are never re-run.
 * <p>
 * Gates run on their own executor so a long CI gate never holds the scheduler
 * thread. The reaper starts them once the job's process exits and collects
 * finished results on later ticks, the same way it polls executor jobs.
 */
@Service
public class GateRunner {

    private static final Logger log = LoggerFactory.getLogger(GateRunner.class);

    private final GateProperties properties;
    private final GateCollaborator collaborator;
    private final Executor gateExecutor;
    private final Map<String, Map<String, CompletableFuture<GateResult>>> inFlight = new ConcurrentHashMap<>();

    public GateRunner(GateProperties properties, GateCollaborator collaborator,
                      @Qualifier(GateConfig.GATE_EXECUTOR) Executor gateExecutor) {
        this.properties = properties;
        this.collaborator = collaborator;
        this.gateExecutor = gateExecutor;
    }

    /**
     * Starts every configured gate that has neither reported nor is already running for the job.
     * Safe to call again for the same job, for example after a restart lost the running gates.
     */
    public void start(Job job, Path jobDir) {
        List<String> touched = job.submission() == null ? List.of() : job.submission().touchedFiles();
        var context = new GateContext(job.taskId(), job.id(), jobDir, touched);
        var running = inFlight.computeIfAbsent(job.id(), id -> new ConcurrentHashMap<>());
        for (GateProperties.GateDefinition gate : properties.getDefinitions()) {
            if (job.hasGateResult(gate.getName())) {
                log.debug("Gate {} already reported for {}", gate.getName(), job.id());
                continue;
            }
            running.computeIfAbsent(gate.getName(), name -> {
                log.debug("Starting gate {} for {}", name, job.id());
                return CompletableFuture.supplyAsync(() -> collaborator.run(gate, context), gateExecutor)
                        .exceptionally(e -> {
                            log.warn("Gate {} for {} failed to run: {}", name, job.id(), e.getMessage());
                            return new GateResult(name, gate.getCategory(), false, false, gate.isRequired(),
                                    "gate_error");
                        });
            });
        }
    }

    /**
     * Takes the results of gates that finished since the last call.
     */
    public List<GateResult> collect(String jobId) {
        var running = inFlight.get(jobId);
        if (running == null) {
            return List.of();
        }
        var finished = new ArrayList<GateResult>();
        var it = running.entrySet().iterator();
        while (it.hasNext()) {
            var entry = it.next();
            if (entry.getValue().isDone()) {
                finished.add(entry.getValue().join());
                it.remove();
            }
        }
        if (running.isEmpty()) {
            inFlight.remove(jobId, running);
        }
        return finished;
    }

    /** True while a gate started for the job has not been collected. */
    public boolean pending(String jobId) {
        var running = inFlight.get(jobId);
        return running != null && !running.isEmpty();
    }

    public Set<String> requiredGates() {
        return properties.requiredGates();
    }
}

package com.gantry.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gantry.core.model.GateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Runs a gate as a local command.
 * <p>
 * The command should print {@code {"ran": bool, "ok": bool, "reason": "..."}} as
 * the last line of its output. Commands that print no such line are judged by
 * exit code. A gate that cannot be started or times out did not run.
 */
@Component
public class ProcessGateCollaborator implements GateCollaborator {

    private static final Logger log = LoggerFactory.getLogger(ProcessGateCollaborator.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public GateResult run(GateProperties.GateDefinition gate, GateContext context) {
        if (gate.getCommand().isEmpty()) {
            return withRequired(GateResult.notRun(gate.getName(), gate.getCategory(), "gate_not_configured"), gate);
        }
        Path output = context.jobDir().resolve("gate-" + gate.getName() + ".log");
        try {
            Files.createDirectories(context.jobDir());
            var pb = new ProcessBuilder(gate.getCommand());
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            pb.environment().put("GANTRY_TASK_ID", context.taskId());
            pb.environment().put("GANTRY_JOB_ID", context.jobId());
            pb.environment().put("GANTRY_JOB_DIR", context.jobDir().toAbsolutePath().toString());
            pb.environment().put("GANTRY_TOUCHED_FILES", String.join("\n", context.touchedFiles()));
            Process process = pb.start();
            if (!process.waitFor(gate.getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Gate {} for job {} timed out after {}s", gate.getName(), context.jobId(),
                        gate.getTimeout().toSeconds());
                return withRequired(GateResult.notRun(gate.getName(), gate.getCategory(), "gate_timeout"), gate);
            }
            String text = Files.readString(output, StandardCharsets.UTF_8);
            GateResult result = parse(gate, text, process.exitValue());
            log.info("Gate {} for job {}: ran={} ok={}{}", gate.getName(), context.jobId(), result.ran(),
                    result.ok(), result.reason() == null ? "" : " (" + result.reason() + ")");
            return result;
        } catch (IOException e) {
            log.warn("Gate {} for job {} could not run: {}", gate.getName(), context.jobId(), e.getMessage());
            return withRequired(GateResult.notRun(gate.getName(), gate.getCategory(), "gate_start_failed"), gate);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return withRequired(GateResult.notRun(gate.getName(), gate.getCategory(), "gate_interrupted"), gate);
        }
    }

    GateResult parse(GateProperties.GateDefinition gate, String output, int exitCode) {
        String[] lines = output.strip().split("\n");
        String last = lines.length == 0 ? "" : lines[lines.length - 1].trim();
        if (last.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(last);
                boolean ran = node.path("ran").asBoolean(true);
                boolean ok = node.path("ok").asBoolean(false);
                String reason = node.hasNonNull("reason") ? node.get("reason").asText() : null;
                return new GateResult(gate.getName(), gate.getCategory(), ran, ran && ok, gate.isRequired(), reason);
            } catch (IOException e) {
                log.debug("Gate {} printed unparseable JSON, falling back to exit code", gate.getName());
            }
        }
        if (exitCode == 0) {
            return new GateResult(gate.getName(), gate.getCategory(), true, true, gate.isRequired(), null);
        }
        return new GateResult(gate.getName(), gate.getCategory(), true, false, gate.isRequired(),
                "exit_code:" + exitCode);
    }

    private static GateResult withRequired(GateResult result, GateProperties.GateDefinition gate) {
        return new GateResult(result.gate(), result.category(), result.ran(), result.ok(), gate.isRequired(),
                result.reason());
    }
}

package com.gantry.core.verdict;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gantry.core.model.TestRun;

import java.util.List;
import java.util.Map;

/**
 * Wire form of an executor submission, as posted to the API or written to the submission file.
 */
public record SubmissionPayload(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("status") String status,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("touched_files") List<String> touchedFiles,
    @JsonProperty("tools_used") List<String> toolsUsed,
    @JsonProperty("tests") List<TestRun> tests,
    @JsonProperty("tests_passed") Boolean testsPassed,
    @JsonProperty("evidence") Map<String, String> evidence
) {}

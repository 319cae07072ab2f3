package com.gantry.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Structured result returned by an executor for one job. Immutable once recorded.
 *
 * @param taskId       task id echoed back by the executor, may be null
 * @param status       DONE, NEED_INPUT or FAILED
 * @param exitCode     process exit code, null when the executor has none
 * @param touchedFiles repository-relative paths the run modified
 * @param toolsUsed    tools the run invoked
 * @param tests        test commands and their outcome
 * @param testsPassed  summary flag for executors that do not list individual tests
 * @param evidence     free-form pointers (logs, diffs, reports)
 * @param submittedAt  when the submission was recorded
 */
public record Submission(
    String taskId,
    SubmissionStatus status,
    Integer exitCode,
    List<String> touchedFiles,
    List<String> toolsUsed,
    List<TestRun> tests,
    Boolean testsPassed,
    Map<String, String> evidence,
    Instant submittedAt
) implements Serializable {

    public Submission {
        touchedFiles = touchedFiles == null ? List.of() : List.copyOf(touchedFiles);
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        tests = tests == null ? List.of() : List.copyOf(tests);
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }

    /** True when any test evidence was supplied. */
    public boolean testsRan() {
        return !tests.isEmpty() || testsPassed != null;
    }

    /** True when test evidence exists and every listed test passed. */
    public boolean allTestsPassed() {
        if (!tests.isEmpty()) {
            return tests.stream().allMatch(TestRun::passed)
                    && (testsPassed == null || testsPassed);
        }
        return Boolean.TRUE.equals(testsPassed);
    }

    public Submission withSubmittedAt(Instant at) {
        return new Submission(taskId, status, exitCode, touchedFiles, toolsUsed, tests,
                testsPassed, evidence, at);
    }
}

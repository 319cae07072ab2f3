package com.gantry.core.verdict;

import com.gantry.core.model.SubmissionStatus;
import com.gantry.support.GantryFixture;
import com.gantry.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionParserTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final SubmissionParser parser = new SubmissionParser(clock);

    @Test
    void parsesWellFormedSubmission() {
        var result = parser.parse(GantryFixture.doneSubmission("TASK-0007", "src/main/java/com/acme/A.java"));

        assertTrue(result.valid());
        var submission = result.submission();
        assertEquals("TASK-0007", submission.taskId());
        assertEquals(SubmissionStatus.DONE, submission.status());
        assertEquals(0, submission.exitCode());
        assertEquals(List.of("src/main/java/com/acme/A.java"), submission.touchedFiles());
        assertEquals(List.of("git status", "mvn test"), submission.toolsUsed());
        assertTrue(submission.allTestsPassed());
        assertEquals(clock.instant(), submission.submittedAt());
    }

    @Test
    void statusIsCaseInsensitive() {
        var result = parser.parse("{\"task_id\": \"TASK-0001\", \"status\": \"need_input\"}");

        assertTrue(result.valid());
        assertEquals(SubmissionStatus.NEED_INPUT, result.submission().status());
        assertFalse(result.submission().testsRan());
    }

    @Test
    void emptyInputIsRejected() {
        assertEquals(List.of("SCHEMA_VIOLATION:empty_submission"), parser.parse("  ").errors());
        assertEquals(List.of("SCHEMA_VIOLATION:empty_submission"), parser.parse(null).errors());
    }

    @Test
    void malformedJsonIsRejected() {
        var result = parser.parse("{\"status\": ");
        assertFalse(result.valid());
        assertNull(result.submission());
        assertEquals(List.of("SCHEMA_VIOLATION:unparseable"), result.errors());
    }

    @Test
    void unknownFieldsAreRejected() {
        var result = parser.parse("{\"status\": \"DONE\", \"confidence\": 0.9}");
        assertEquals(List.of("SCHEMA_VIOLATION:unparseable"), result.errors());
    }

    @Test
    void fractionalExitCodeIsNotTruncated() {
        var result = parser.parse("{\"task_id\": \"TASK-0001\", \"status\": \"DONE\", \"exit_code\": 0.9}");

        assertFalse(result.valid());
        assertEquals(List.of("SCHEMA_VIOLATION:exit_code_not_integer"), result.errors());
    }

    @Test
    void integralExitCodeIsKept() {
        var result = parser.parse("{\"task_id\": \"TASK-0001\", \"status\": \"FAILED\", \"exit_code\": 2}");
        assertEquals(Integer.valueOf(2), result.submission().exitCode());
    }

    @Test
    void statusMustBePresentAndKnown() {
        assertEquals(List.of("SCHEMA_VIOLATION:status_required"), parser.parse("{\"task_id\": \"T\"}").errors());
        assertEquals(List.of("SCHEMA_VIOLATION:status_invalid:MAYBE"),
                parser.parse("{\"status\": \"MAYBE\"}").errors());
    }

    @Test
    void touchedFilesMustStayInsideRepository() {
        var result = parser.parse("""
                {"status": "DONE", "touched_files": ["src/A.java", "/etc/passwd", "../outside.txt"]}
                """);

        assertEquals(List.of("SCHEMA_VIOLATION:touched_file_not_relative:/etc/passwd",
                "SCHEMA_VIOLATION:touched_file_not_relative:../outside.txt"), result.errors());
    }

    @Test
    void testEntriesNeedACommand() {
        var result = parser.parse("""
                {"status": "DONE", "tests": [{"command": " ", "passed": true}]}
                """);
        assertEquals(List.of("SCHEMA_VIOLATION:test_command_missing"), result.errors());
    }

    @Test
    void allViolationsAreReportedTogether() {
        var payload = new SubmissionPayload(null, null, null, List.of("/abs"), null, null, null, null);
        assertEquals(2, parser.fromPayload(payload).errors().size());
    }
}

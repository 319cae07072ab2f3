package com.gantry.core.verdict;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.Submission;
import com.gantry.core.model.SubmissionStatus;
import com.gantry.core.model.TestRun;
import com.gantry.core.persistence.StateJson;
import com.gantry.core.pins.PathNormalizer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Strict reader for executor submissions. Anything malformed is reported as
 * {@code SCHEMA_VIOLATION:<detail>} rather than guessed at.
 */
@Component
public class SubmissionParser {

    private static final String EXIT_CODE_FIELD = "exit_code";

    /** Unknown fields fail, and a fractional exit code is never truncated to an int. */
    private final ObjectMapper objectMapper = StateJson.mapper().copy()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    private final Clock clock;

    public SubmissionParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param submission the parsed submission, null when {@code errors} is non-empty
     * @param errors     schema violations found
     */
    public record Result(Submission submission, List<String> errors) {

        public boolean valid() {
            return errors.isEmpty();
        }
    }

    public Result parse(String json) {
        if (json == null || json.isBlank()) {
            return new Result(null, List.of(ReasonCodes.SCHEMA_VIOLATION + ":empty_submission"));
        }
        try {
            return fromPayload(objectMapper.readValue(json, SubmissionPayload.class));
        } catch (MismatchedInputException e) {
            if (EXIT_CODE_FIELD.equals(lastField(e))) {
                return new Result(null, List.of(ReasonCodes.SCHEMA_VIOLATION + ":exit_code_not_integer"));
            }
            return new Result(null, List.of(ReasonCodes.SCHEMA_VIOLATION + ":unparseable"));
        } catch (JsonProcessingException e) {
            return new Result(null, List.of(ReasonCodes.SCHEMA_VIOLATION + ":unparseable"));
        }
    }

    public Result fromPayload(SubmissionPayload payload) {
        List<String> errors = validate(payload);
        if (!errors.isEmpty()) {
            return new Result(null, errors);
        }
        var status = SubmissionStatus.valueOf(payload.status().trim().toUpperCase(Locale.ROOT));
        return new Result(new Submission(payload.taskId(), status, payload.exitCode(), payload.touchedFiles(),
                payload.toolsUsed(), payload.tests(), payload.testsPassed(), payload.evidence(),
                clock.instant()), List.of());
    }

    List<String> validate(SubmissionPayload payload) {
        var errors = new ArrayList<String>();
        if (payload == null) {
            errors.add(ReasonCodes.SCHEMA_VIOLATION + ":empty_submission");
            return errors;
        }
        if (payload.status() == null || payload.status().isBlank()) {
            errors.add(ReasonCodes.SCHEMA_VIOLATION + ":status_required");
        } else if (!isStatus(payload.status())) {
            errors.add(ReasonCodes.SCHEMA_VIOLATION + ":status_invalid:" + payload.status());
        }
        if (payload.touchedFiles() != null) {
            for (String path : payload.touchedFiles()) {
                if (path == null || PathNormalizer.normalize(path).isEmpty()) {
                    errors.add(ReasonCodes.SCHEMA_VIOLATION + ":touched_file_not_relative:" + path);
                }
            }
        }
        if (payload.tests() != null) {
            for (TestRun test : payload.tests()) {
                if (test == null || test.command() == null || test.command().isBlank()) {
                    errors.add(ReasonCodes.SCHEMA_VIOLATION + ":test_command_missing");
                }
            }
        }
        return errors;
    }

    private static String lastField(JsonMappingException e) {
        var path = e.getPath();
        return path.isEmpty() ? null : path.get(path.size() - 1).getFieldName();
    }

    private static boolean isStatus(String value) {
        try {
            SubmissionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}

package com.gantry.dispatch.api;

import com.gantry.core.board.IllegalTransitionException;
import com.gantry.core.board.TaskValidationException;
import com.gantry.core.persistence.RecordNotFoundException;
import com.gantry.core.persistence.StateConflictException;
import com.gantry.core.persistence.StateWriteTimeoutException;
import com.gantry.core.scheduler.JobConflictException;
import com.gantry.core.scheduler.SubmissionRejectedException;
import com.gantry.core.security.UnknownRoleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP responses with an {@code error} message and,
 * where there are any, the reason codes.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TaskValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(TaskValidationException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "task_rejected", ex.getReasons());
    }

    @ExceptionHandler(SubmissionRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleSubmission(SubmissionRejectedException ex) {
        return body(HttpStatus.BAD_REQUEST, "SCHEMA_VIOLATION", ex.getErrors());
    }

    @ExceptionHandler({IllegalTransitionException.class, JobConflictException.class, StateConflictException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
        return body(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(RecordNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(StateWriteTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleWriteTimeout(StateWriteTimeoutException ex) {
        log.warn("State write timed out: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), null);
    }

    @ExceptionHandler({UnknownRoleException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, List<String> reasons) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error == null ? status.getReasonPhrase() : error);
        if (reasons != null) {
            body.put("reasons", reasons);
        }
        return ResponseEntity.status(status).body(body);
    }
}

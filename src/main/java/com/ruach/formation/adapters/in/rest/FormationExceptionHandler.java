package com.ruach.formation.adapters.in.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.ruach.formation.application.guard.DuplicateSubmissionException;

/**
 * Maps application exceptions to HTTP responses for
 * {@link FormationController}.
 */
@RestControllerAdvice(assignableTypes = FormationController.class)
public class FormationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(FormationExceptionHandler.class);

    @ExceptionHandler(DuplicateSubmissionException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateSubmissionException e) {
        log.warn("action=duplicate_in_flight operationId={} recordedAt={}", e.getOperationId(), e.getRecordedAt());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("operationId", e.getOperationId());
        body.put("recordedAt", e.getRecordedAt() != null ? e.getRecordedAt().toString() : null);
        body.put("cooldownMs", e.getCooldownMs());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("action=bad_request error={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(IllegalStateException e) {
        log.warn("action=state_conflict error={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("action=request_failed error={}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(Map.of("error", "Unable to process formation request"));
    }
}

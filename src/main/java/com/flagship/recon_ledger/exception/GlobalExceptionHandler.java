package com.flagship.recon_ledger.exception;

import com.flagship.recon_ledger.ledger.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to structured error responses.
 *
 * Every error carries a stable {@code code} so clients can tell a version conflict
 * (re-fetch and retry) from an already-processed item (nothing to retry).
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ErrorResponse> handleLedgerValidation(LedgerValidationException e) {
        ValidationResult result = e.getResult();
        log.warn("Ledger validation failed: failure={}, message={}", result.getFailure(), result.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failure", result.getFailure());
        if (result.getDelta() != null) {
            details.put("delta", result.getDelta().toPlainString());
            details.put("short_side", result.getShortSide());
        }
        if (result.getAccountId() != null) {
            details.put("account_id", result.getAccountId());
        }

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Ledger Validation Failed", result.getFailure().name(),
                e.getMessage(), details);
    }

    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<ErrorResponse> handleVersionConflict(VersionConflictException e) {
        log.warn("Version conflict: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("entity_type", e.getEntityType());
        details.put("entity_id", e.getEntityId());
        details.put("expected_version", e.getExpectedVersion());
        details.put("actual_version", e.getActualVersion());

        return build(HttpStatus.CONFLICT, "Version Conflict", "VERSION_CONFLICT", e.getMessage(), details);
    }

    @ExceptionHandler(AlreadyProcessedException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyProcessed(AlreadyProcessedException e) {
        log.warn("Already processed: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("entity_type", e.getEntityType());
        details.put("entity_id", e.getEntityId());
        details.put("status", e.getStatus());

        return build(HttpStatus.CONFLICT, "Already Processed", "ALREADY_PROCESSED", e.getMessage(), details);
    }

    @ExceptionHandler(ConsistencyBlockException.class)
    public ResponseEntity<ErrorResponse> handleConsistencyBlock(ConsistencyBlockException e) {
        log.warn("Blocked by consistency checks: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("match_id", e.getMatchId());
        details.put("blocking_check_ids", e.getBlockingCheckIds());

        return build(HttpStatus.LOCKED, "Blocked By Consistency Checks", "CONSISTENCY_BLOCKED", e.getMessage(), details);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", "NOT_FOUND", e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return build(HttpStatus.BAD_REQUEST, "Missing Required Header", "MISSING_HEADER",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing,
                        LinkedHashMap::new
                ));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "INVALID_REQUEST",
                "Request validation failed", errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "INVALID_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid State", "INVALID_STATE", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String code,
                                                String message, Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
                .error(error)
                .code(code)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
    }
}

package com.flagship.general_ledger.exception;

import com.flagship.general_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the ledger error taxonomy onto HTTP responses.
 * Messages are passed through unchanged so the end user sees the business rule that failed.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return build(HttpStatus.BAD_REQUEST, "Missing Required Header", ValidationException.ERROR_CODE,
            "Required header '" + e.getHeaderName() + "' is missing", false, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", ValidationException.ERROR_CODE,
            "Request validation failed", false, errors);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", e);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ApiError> handleInvariantViolation(InvariantViolationException e) {
        log.warn("Unbalanced voucher: voucher={}, debits={}, credits={}, diff={}",
            e.getVoucherNumber(), e.getTotalDebits(), e.getTotalCredits(), e.getDifference());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unbalanced Voucher", e);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ApiError> handleInvalidState(InvalidStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid State", e);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ApiError> handleAuthorization(AuthorizationException e) {
        log.warn("Authorization failed: {}", e.getMessage());
        return build(HttpStatus.FORBIDDEN, "Not Authorized", e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.info("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", e);
    }

    @ExceptionHandler(DuplicateRequestException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateRequestException e) {
        log.info("Duplicate request: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Duplicate Request", e);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ApiError> handleConcurrencyConflict(ConcurrencyConflictException e) {
        log.warn("Concurrency conflict: {}", e.getMessage());
        return retryable(build(HttpStatus.CONFLICT, "Concurrency Conflict", e));
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleLockFailure(PessimisticLockingFailureException e) {
        log.warn("Lock acquisition failed outside a guarded section: {}", e.getMessage());
        return retryable(build(HttpStatus.CONFLICT, "Concurrency Conflict", ConcurrencyConflictException.ERROR_CODE,
            "The record is locked by another transaction, retry the request", true, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
            "An unexpected error occurred", false, null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String error, LedgerException e) {
        return build(status, error, e.getErrorCode(), e.getMessage(), e.isRetryable(), null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String error, String errorCode, String message,
                                           boolean retryable, Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .retryable(retryable)
            .details(details)
            .correlationId(CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ApiError> retryable(ResponseEntity<ApiError> response) {
        return ResponseEntity.status(response.getStatusCode())
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(response.getBody());
    }
}

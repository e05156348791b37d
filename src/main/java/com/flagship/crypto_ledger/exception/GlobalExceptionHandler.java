package com.flagship.crypto_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.crypto_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the ledger's error taxonomy onto HTTP.
 *
 * InvalidOperation 400, NotFound 404, OfferNotActive 409, InsufficientFunds 422,
 * TooEarly 429 (+ Retry-After), PriceUnavailable and StorageUnavailable 503,
 * InvariantViolation 500. The body always carries the error code.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(InvalidOperationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOperation(InvalidOperationException e) {
        log.warn("Invalid operation: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e, null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e, null);
    }

    @ExceptionHandler(OfferNotActiveException.class)
    public ResponseEntity<ErrorResponse> handleOfferNotActive(OfferNotActiveException e) {
        log.warn("Offer not active: offerId={}, status={}", e.getOfferId(), e.getStatus());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("offer_id", e.getOfferId().toString());
        details.put("status", e.getStatus().name());
        return respond(HttpStatus.CONFLICT, e, details);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        log.warn("Insufficient funds: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("currency", e.getCurrency());
        details.put("required", e.getRequired().toPlainString());
        details.put("available", e.getAvailable().toPlainString());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e, details);
    }

    @ExceptionHandler(TooEarlyException.class)
    public ResponseEntity<ErrorResponse> handleTooEarly(TooEarlyException e) {
        log.info("Too early: {}", e.getMessage());
        long retryAfterSeconds = Math.max(1, (e.getRemaining().toMillis() + 999) / 1000);
        Map<String, String> details = new LinkedHashMap<>();
        details.put("next_eligible_at", e.getNextEligibleAt().toString());
        details.put("remaining_seconds", String.valueOf(retryAfterSeconds));

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
            .body(body(e.getErrorCode(), e.getMessage(), details));
    }

    @ExceptionHandler(PriceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handlePriceUnavailable(PriceUnavailableException e) {
        log.warn("Price unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, null);
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(StorageUnavailableException e) {
        log.warn("Storage unavailable: {} (cause: {})", e.getMessage(),
            e.getCause() != null ? e.getCause().getMessage() : "none");
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, null);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e) {
        log.error("Invariant violation, operation aborted", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e, null);
    }

    /**
     * Transient failures that escaped a store method, e.g. at commit time.
     */
    @ExceptionHandler({DataAccessException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ErrorResponse> handleDataAccess(RuntimeException e) {
        if (StorageFailures.isTransient(e)) {
            log.warn("Transient storage failure: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body("StorageUnavailable", "Storage temporarily unavailable, retry the request", null));
        }
        log.error("Storage failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body("InternalError", "An unexpected error occurred", null));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(body("InvalidOperation", "Required header '" + e.getHeaderName() + "' is missing", null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> errors.putIfAbsent(
            error.getField(),
            error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(body("InvalidOperation", "Request validation failed", errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(body("InvalidOperation", "Malformed request", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body("InternalError", "An unexpected error occurred", null));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, LedgerException e, Map<String, String> details) {
        return ResponseEntity.status(status).body(body(e.getErrorCode(), e.getMessage(), details));
    }

    private ErrorResponse body(String error, String message, Map<String, String> details) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null)
            .timestamp(clock.instant())
            .build();
    }

    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        @JsonProperty("correlation_id")
        String correlationId;
        Instant timestamp;
    }
}

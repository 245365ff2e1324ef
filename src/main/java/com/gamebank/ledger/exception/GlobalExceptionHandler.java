package com.gamebank.ledger.exception;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger outcomes to HTTP responses. Every failure below leaves the store
 * unchanged because the throwing transaction has already rolled back.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AccountNotFoundException e) {
        log.warn("Account not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        log.warn("Transfer rejected: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_funds", e.getMessage(), null);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        log.warn("Unauthorized: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "unauthorized", e.getMessage(), null);
    }

    @ExceptionHandler(InvalidPaymentRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidPaymentRequestException e) {
        return respond(HttpStatus.GONE, "invalid_request", e.getMessage(), null);
    }

    @ExceptionHandler({InvalidAmountException.class, InvalidRegistrationException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException e) {
        log.warn("Rejected input: {}", e.getMessage());
        String code = e instanceof InvalidAmountException ? "invalid_amount" : "invalid_registration";
        return respond(HttpStatus.BAD_REQUEST, code, e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return respond(HttpStatus.BAD_REQUEST, "missing_header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing
                ));
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "malformed_request", "Request could not be parsed", null);
    }

    /**
     * Connectivity, lock-timeout and deadlock failures: nothing was committed,
     * so the caller may retry.
     */
    @ExceptionHandler({
            TransientDataAccessException.class,
            DataAccessResourceFailureException.class
    })
    public ResponseEntity<ErrorResponse> handleTransientStoreFailure(RuntimeException e) {
        log.error("Ledger store unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable",
                "Ledger store is temporarily unavailable; no changes were applied", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @Value
    @Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}

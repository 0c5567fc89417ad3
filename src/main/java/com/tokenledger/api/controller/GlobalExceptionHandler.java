package com.tokenledger.api.controller;

import com.tokenledger.common.exception.ErrorCode;
import com.tokenledger.common.exception.TokenLedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TokenLedgerException.class)
    public ResponseEntity<Map<String, Object>> handleTokenLedgerException(TokenLedgerException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", e.getErrorCode(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.getErrorCode(), e.getMessage());
        }

        Map<String, Object> error = buildError(status, e.getMessage());
        error.put("code", e.getErrorCode().name());
        error.put("retryable", e.isRetryable());
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(buildError(HttpStatus.BAD_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(buildError(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(buildError(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred"));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case ACCOUNT_NOT_FOUND, TRANSACTION_NOT_FOUND, NO_OPEN_INTENT -> HttpStatus.NOT_FOUND;
            case DUPLICATE_SETTLEMENT, INVALID_STATE -> HttpStatus.CONFLICT;
            case CHAIN_SUBMISSION_FAILED -> HttpStatus.BAD_GATEWAY;
            default -> code.isRetryable() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        };
    }

    private Map<String, Object> buildError(HttpStatus status, String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", message);
        error.put("status", status.value());
        return error;
    }
}

package com.example.reportsync.exception;

import com.example.reportsync.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the admin REST controllers.
 * Converts exceptions to the ErrorResponse envelope.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IntegrationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleIntegrationNotFound(IntegrationNotFoundException ex) {
        log.warn("Integration not found: {}", ex.getIntegrationId());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "INTEGRATION_NOT_FOUND",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleReportNotFound(ReportNotFoundException ex) {
        log.warn("Report not found: {}", ex.getReportId());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "REPORT_NOT_FOUND",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException ex) {
        log.warn("Bad request: {} {}", ex.getCode(), ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            ex.getCode(),
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(SyncFailedException.class)
    public ResponseEntity<ErrorResponse> handleSyncFailed(SyncFailedException ex) {
        log.error("Sync operation failed: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "SYNC_FAILED",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );

        String firstField = ex.getBindingResult().getFieldErrors().isEmpty()
            ? null
            : ex.getBindingResult().getFieldErrors().get(0).getField();
        String firstMessage = ex.getBindingResult().getFieldErrors().isEmpty()
            ? "Validation failed"
            : ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            firstMessage,
            firstField,
            errors
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "INVALID_REQUEST_BODY",
            "Request body is missing or malformed",
            null
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_SERVER_ERROR",
            "An unexpected error occurred",
            null
        );
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field
    ) {
        return buildErrorResponse(status, code, message, field, null);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field,
        Object details
    ) {
        ErrorResponse response = ErrorResponse.builder()
            .error(ErrorResponse.Error.builder()
                .code(code)
                .message(message)
                .field(field)
                .details(details)
                .build())
            .timestamp(Instant.now().toString())
            .build();

        return ResponseEntity.status(status).body(response);
    }
}

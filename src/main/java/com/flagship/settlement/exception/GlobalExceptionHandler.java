package com.flagship.settlement.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps settlement failures to HTTP responses.
 *
 * Validation and conflict errors carry their specific reason back to the
 * caller. Reconciliation alerts and unexpected errors return a generic message.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Required Header")
            .code(SettlementErrorCode.INVALID_OPERATION.name())
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .code(SettlementErrorCode.INVALID_OPERATION.name())
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                SettlementErrorCode.INVALID_OPERATION.name(), "Request body is malformed");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("Bad request parameter: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                SettlementErrorCode.INVALID_OPERATION.name(), "Request parameter is missing or malformed");
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Rejected request: code={}, message={}", e.getCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getCode().name(), e.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getCode().name(), e.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e) {
        log.warn("Conflict: code={}, message={}", e.getCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getCode().name(), e.getMessage());
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ErrorResponse> handleExternal(ExternalServiceException e) {
        log.error("Payment provider failure (timeout={}): {}", e.isTimeout(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Payment Provider Error", e.getCode().name(),
                e.isTimeout() ? "Payment provider did not respond in time" : "Payment provider request failed");
    }

    @ExceptionHandler(ReconciliationAlertException.class)
    public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationAlertException e) {
        log.error("Request ended in reconciliation alert {}: {}", e.getAlertId(), e.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", e.getCode().name(),
                "The request could not be completed and has been flagged for review");
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignature(InvalidSignatureException e) {
        log.warn("Rejected webhook with invalid signature: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Signature", e.getCode().name(),
                "Signature verification failed");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
                "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String code, String message) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .code(code)
            .message(message)
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
        Map<String, String> details;
        Instant timestamp;
    }
}

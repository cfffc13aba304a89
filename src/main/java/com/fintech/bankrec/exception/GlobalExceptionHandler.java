package com.fintech.bankrec.exception;

import com.fintech.bankrec.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders engine exceptions as {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ToleranceViolationException.class)
    public ResponseEntity<ErrorResponse> handleToleranceViolation(ToleranceViolationException e) {
        log.warn("Rejected tolerance: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", e.getParameter());
        details.put("suppliedValue", e.getSuppliedValue());
        return respond(HttpStatus.BAD_REQUEST, "Tolerance Violation", e.getMessage(), details);
    }

    @ExceptionHandler(TransactionRollbackException.class)
    public ResponseEntity<ErrorResponse> handleRollback(TransactionRollbackException e) {
        log.error("Reconciliation batch rolled back at {}", e.getFailingItem(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Transaction Rollback", e.getMessage(),
                Map.of("failingItem", e.getFailingItem()));
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationException e) {
        HttpStatus status;
        switch (e.getErrorType()) {
            case RUN_IN_PROGRESS:
                status = HttpStatus.CONFLICT;
                break;
            case INVALID_REQUEST:
            case TOLERANCE_VIOLATION:
                status = HttpStatus.BAD_REQUEST;
                break;
            case VENDOR_LOOKUP:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                break;
        }
        log.warn("Reconciliation request failed ({}): {}", e.getErrorType(), e.getMessage());
        return respond(status, e.getErrorType().name(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, Object> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build());
    }
}

package com.fintech.bankrec.exception;

/**
 * Base exception for reconciliation-related errors.
 * Every instance carries the {@link ReconciliationErrorType} it belongs to.
 */
public class ReconciliationException extends RuntimeException {

    private final ReconciliationErrorType errorType;

    public ReconciliationException(ReconciliationErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ReconciliationException(ReconciliationErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ReconciliationErrorType getErrorType() {
        return errorType;
    }
}

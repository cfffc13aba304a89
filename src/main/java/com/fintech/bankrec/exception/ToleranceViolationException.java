package com.fintech.bankrec.exception;

/**
 * Thrown when a caller supplies a negative or unreasonably wide matching tolerance.
 * Rejected at the API boundary, before any run starts.
 */
public class ToleranceViolationException extends ReconciliationException {

    private final String parameter;
    private final long suppliedValue;

    public ToleranceViolationException(String parameter, long suppliedValue, long maximum) {
        super(ReconciliationErrorType.TOLERANCE_VIOLATION,
                String.format("%s must be between 0 and %d, got %d", parameter, maximum, suppliedValue));
        this.parameter = parameter;
        this.suppliedValue = suppliedValue;
    }

    public String getParameter() {
        return parameter;
    }

    public long getSuppliedValue() {
        return suppliedValue;
    }
}

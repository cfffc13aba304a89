package com.fintech.bankrec.exception;

/**
 * Error taxonomy of the reconciliation engine.
 * <p>
 * {@link #AMBIGUOUS_MATCH}, {@link #SPLIT_NOT_FOUND} and {@link #DUPLICATE_KEY_CONFLICT}
 * are recovered locally and only ever appear in run and import reports.
 */
public enum ReconciliationErrorType {
    AMBIGUOUS_MATCH,
    SPLIT_NOT_FOUND,
    TOLERANCE_VIOLATION,
    DUPLICATE_KEY_CONFLICT,
    TRANSACTION_ROLLBACK,
    RUN_IN_PROGRESS,
    VENDOR_LOOKUP,
    INVALID_REQUEST
}

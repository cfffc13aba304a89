package com.fintech.bankrec.exception;

/**
 * Thrown when applying a run's decisions fails. The whole batch has been rolled back;
 * {@link #getFailingItem()} names the decision that could not be applied.
 */
public class TransactionRollbackException extends ReconciliationException {

    private final String failingItem;

    public TransactionRollbackException(String failingItem, Throwable cause) {
        super(ReconciliationErrorType.TRANSACTION_ROLLBACK,
                "Reconciliation batch rolled back while applying " + failingItem + ": "
                + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.failingItem = failingItem;
    }

    public String getFailingItem() {
        return failingItem;
    }
}

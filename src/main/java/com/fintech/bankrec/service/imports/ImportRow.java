package com.fintech.bankrec.service.imports;

/**
 * One validated line of an import batch. Implemented by {@link ReceiptImportRow} and
 * {@link TransactionImportRow}.
 */
public interface ImportRow {

    /**
     * 1-based position of the row within its batch, header excluded.
     */
    int getRowIndex();
}

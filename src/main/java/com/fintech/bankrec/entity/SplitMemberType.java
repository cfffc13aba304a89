package com.fintech.bankrec.entity;

/**
 * Which side of the reconciliation the members of a split group come from.
 */
public enum SplitMemberType {
    /**
     * Several receipts jointly satisfy one bank transaction.
     */
    RECEIPT,

    /**
     * Several bank transactions jointly satisfy one receipt.
     */
    BANKING_TRANSACTION
}

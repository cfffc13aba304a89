package com.fintech.bankrec.dto;

/**
 * Why a record was left for manual review instead of being resolved automatically.
 */
public enum ReviewReason {
    AMBIGUOUS_MATCH,
    SPLIT_NOT_FOUND,
    NO_CANDIDATE,
    BELOW_MIN_CONFIDENCE,
    CONTESTED_TRANSACTION,
    PROTECTED_FEE,
    DUPLICATE_RETAINED
}

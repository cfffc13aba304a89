package com.fintech.bankrec.service.split;

public enum SplitError {

    /**
     * A single candidate already equals the anchor; it must be matched 1:1 instead.
     */
    NOT_A_SPLIT,

    /**
     * No subset of two or more candidates sums to the anchor within one cent.
     */
    SPLIT_NOT_FOUND
}

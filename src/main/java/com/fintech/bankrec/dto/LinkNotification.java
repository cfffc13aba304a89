package com.fintech.bankrec.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Published after a link or split group commits. Exactly one of {@code receiptId} and
 * {@code splitGroupId} is set.
 */
@Value
@Builder
public class LinkNotification {
    Long receiptId;
    Long splitGroupId;
    Long transactionId;
    double confidence;
    String ruleApplied;
    String runId;
}

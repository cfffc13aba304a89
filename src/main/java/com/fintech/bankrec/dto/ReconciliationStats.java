package com.fintech.bankrec.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ReconciliationStats {
    private long unmatchedReceipts;
    private long matchedReceipts;
    private long unmatchedTransactions;
    private long splitGroups;
    private long auditEntries;
    private boolean isReconciliationRunning;
}

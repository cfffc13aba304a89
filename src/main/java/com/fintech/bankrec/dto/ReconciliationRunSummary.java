package com.fintech.bankrec.dto;

import com.fintech.bankrec.service.RunState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Human-reviewable result of a reconciliation run.
 * <p>
 * For a dry run ({@link RunState#PREVIEWED}) the counters describe what would have
 * been applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationRunSummary {

    private String runId;
    private RunState finalState;
    private boolean dryRun;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int receiptsLoaded = 0;

    @Builder.Default
    private int transactionsLoaded = 0;

    @Builder.Default
    private int matched = 0;

    @Builder.Default
    private int splitGroups = 0;

    @Builder.Default
    private int duplicatesRemoved = 0;

    @Builder.Default
    private int shadowReceipts = 0;

    @Builder.Default
    private List<String> backupTables = new ArrayList<>();

    /**
     * Set when the run rolled back: the decision that could not be applied.
     */
    private String failingItem;
    private String errorMessage;

    @Builder.Default
    private List<ReviewItem> reviewItems = new ArrayList<>();

    @Builder.Default
    private List<LinkNotification> links = new ArrayList<>();

    public int getFlagged() {
        return reviewItems == null ? 0 : reviewItems.size();
    }

    public boolean isRolledBack() {
        return finalState == RunState.ROLLED_BACK;
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}

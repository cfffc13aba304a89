package com.fintech.bankrec.config;

import com.fintech.bankrec.service.matching.MatchingTolerance;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable settings for one reconciliation run.
 * <p>
 * Built once from {@link ReconciliationProperties}; per-run overrides (dry run,
 * widened tolerance) derive a copy with {@code toBuilder()}. The orchestrator
 * receives it through its constructor and never consults anything else.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationConfig {

    public static final int MAX_BATCH_SIZE = 500;
    public static final int HARD_MAX_SPLIT_MEMBERS = 6;

    @Builder.Default
    int batchSize = 250;

    @Builder.Default
    MatchingTolerance tolerance = MatchingTolerance.defaults();

    /**
     * Candidates scoring below this are discarded before any decision.
     */
    @Builder.Default
    double minConfidence = 0.70;

    @Builder.Default
    int splitDateWindowDays = 3;

    @Builder.Default
    int maxSplitMembers = HARD_MAX_SPLIT_MEMBERS;

    /**
     * Bounds the subset search; larger pools keep only the largest pieces.
     */
    @Builder.Default
    int maxSplitCandidates = 12;

    /**
     * Two same-vendor, same-amount receipts further apart than this are a recurring charge.
     */
    @Builder.Default
    int recurrenceGapDays = 5;

    @Singular
    List<String> feePatterns;

    boolean dryRun;

    boolean backup;

    @Builder.Default
    boolean removeDuplicates = true;

    boolean createShadowReceipts;

    public int effectiveBatchSize() {
        return Math.max(1, Math.min(batchSize, MAX_BATCH_SIZE));
    }

    public int effectiveMaxSplitMembers() {
        return Math.max(2, Math.min(maxSplitMembers, HARD_MAX_SPLIT_MEMBERS));
    }
}

package com.fintech.bankrec.config;

import com.fintech.bankrec.service.matching.MatchingTolerance;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code reconciliation.*} settings from application.yml.
 */
@Data
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    private int batchSize = 250;

    private long amountToleranceCents = MatchingTolerance.DEFAULT_AMOUNT_TOLERANCE_CENTS;

    private int dateWindowDays = MatchingTolerance.DEFAULT_DATE_WINDOW_DAYS;

    private double minConfidence = 0.70;

    private int splitDateWindowDays = 3;

    private int maxSplitMembers = ReconciliationConfig.HARD_MAX_SPLIT_MEMBERS;

    private int maxSplitCandidates = 12;

    private int recurrenceGapDays = 5;

    private boolean removeDuplicates = true;

    private boolean createShadowReceipts = false;

    private List<String> feePatterns = new ArrayList<>(List.of(
            "E-?TRANSFER FEE",
            "NSF",
            "NON-SUFFICIENT FUNDS",
            "INSUFFICIENT FUNDS",
            "SERVICE CHARGE",
            "CARD SERVICE FEE",
            "OVERDRAFT",
            "MONTHLY FEE",
            "TRANSACTION FEE"));

    public ReconciliationConfig toConfig() {
        return ReconciliationConfig.builder()
                .batchSize(batchSize)
                .tolerance(MatchingTolerance.of(amountToleranceCents, dateWindowDays))
                .minConfidence(minConfidence)
                .splitDateWindowDays(splitDateWindowDays)
                .maxSplitMembers(maxSplitMembers)
                .maxSplitCandidates(maxSplitCandidates)
                .recurrenceGapDays(recurrenceGapDays)
                .removeDuplicates(removeDuplicates)
                .createShadowReceipts(createShadowReceipts)
                .feePatterns(feePatterns)
                .build();
    }
}

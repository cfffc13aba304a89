package com.fintech.bankrec.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A record the run could not resolve, with the candidates it considered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewItem {

    private String entityTable;
    private Long entityId;
    private ReviewReason reason;
    private String detail;
    private BigDecimal amount;
    private LocalDate date;
    private String vendor;

    @Builder.Default
    private List<CandidateSummary> candidates = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CandidateSummary {
        private Long transactionId;
        private double confidence;
        private String ruleApplied;
        private BigDecimal amountDelta;
        private long dateDeltaDays;
    }
}

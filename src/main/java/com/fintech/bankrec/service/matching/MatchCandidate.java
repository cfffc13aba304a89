package com.fintech.bankrec.service.matching;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * A proposed receipt/transaction pairing. Never persisted.
 */
@Value
@Builder
public class MatchCandidate {

    /**
     * Best first: confidence, then smallest date delta, smallest amount delta and
     * finally lowest transaction id, so runs over the same data rank identically.
     */
    public static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingDouble(MatchCandidate::getConfidence).reversed()
            .thenComparingLong(MatchCandidate::absoluteDateDelta)
            .thenComparing(MatchCandidate::absoluteAmountDelta)
            .thenComparing(MatchCandidate::getTransactionId);

    Long receiptId;
    Long transactionId;

    /**
     * Transaction amount minus receipt amount.
     */
    BigDecimal amountDelta;

    /**
     * Days from the receipt date to the transaction date.
     */
    long dateDeltaDays;

    double vendorSimilarity;
    double confidence;
    ConfidenceTier tier;

    public long absoluteDateDelta() {
        return Math.abs(dateDeltaDays);
    }

    public BigDecimal absoluteAmountDelta() {
        return amountDelta.abs();
    }

    public String getRuleApplied() {
        return tier.getRuleName();
    }

    /**
     * Same rank under {@link #RANKING} apart from the transaction id tiebreak.
     */
    public boolean tiesWith(MatchCandidate other) {
        return Double.compare(confidence, other.confidence) == 0
                && absoluteDateDelta() == other.absoluteDateDelta()
                && absoluteAmountDelta().compareTo(other.absoluteAmountDelta()) == 0;
    }
}

package com.fintech.bankrec.service.matching;

import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.value.CalendarDates;
import com.fintech.bankrec.value.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Proposes bank transactions for a receipt within amount and date windows and ranks
 * them by confidence.
 * <p>
 * Pure: reads its inputs, never modifies them, touches no repository.
 */
@Component
@Slf4j
public class CandidateMatcher {

    static final Money FEE_ADJUSTED_TOLERANCE = Money.ofCents(100);
    static final int NEAR_DATE_DAYS = 3;

    private static final double AMOUNT_WEIGHT = 0.40;
    private static final double DATE_WEIGHT = 0.30;
    private static final double VENDOR_WEIGHT = 0.30;

    public List<MatchCandidate> findCandidates(Receipt receipt,
                                               Collection<BankingTransaction> transactionPool,
                                               long amountToleranceCents,
                                               int dateWindowDays) {
        return findCandidates(receipt, transactionPool,
                MatchingTolerance.of(amountToleranceCents, dateWindowDays), false);
    }

    public List<MatchCandidate> findCandidates(Receipt receipt,
                                               Collection<BankingTransaction> transactionPool,
                                               MatchingTolerance tolerance) {
        return findCandidates(receipt, transactionPool, tolerance, false);
    }

    /**
     * @param includeLinked also consider transactions that are already linked; only the
     *                      unlink-and-re-match maintenance path sets this
     * @return candidates ordered by {@link MatchCandidate#RANKING}
     */
    public List<MatchCandidate> findCandidates(Receipt receipt,
                                               Collection<BankingTransaction> transactionPool,
                                               MatchingTolerance tolerance,
                                               boolean includeLinked) {
        if (receipt.getAmount() == null || receipt.getReceiptDate() == null) {
            return List.of();
        }

        Money receiptAmount = receipt.amountAsMoney();
        Money amountTolerance = tolerance.amountTolerance();
        String vendor = receipt.effectiveVendor();

        List<MatchCandidate> candidates = new ArrayList<>();
        for (BankingTransaction transaction : transactionPool) {
            if (!includeLinked && transaction.isLinked()) {
                continue;
            }
            if (transaction.getTransactionDate() == null
                    || !CalendarDates.withinWindow(receipt.getReceiptDate(),
                    transaction.getTransactionDate(), tolerance.getDateWindowDays())) {
                continue;
            }
            Money transactionAmount = transaction.signedAmount();
            if (!transactionAmount.isWithin(receiptAmount, amountTolerance)) {
                continue;
            }
            candidates.add(score(receipt, vendor, receiptAmount, transaction, transactionAmount));
        }

        candidates.sort(MatchCandidate.RANKING);
        log.debug("Receipt {} has {} candidate(s) within ±{} / ±{}d",
                receipt.getReceiptId(), candidates.size(), amountTolerance, tolerance.getDateWindowDays());
        return candidates;
    }

    private MatchCandidate score(Receipt receipt, String vendor, Money receiptAmount,
                                 BankingTransaction transaction, Money transactionAmount) {
        Money delta = transactionAmount.minus(receiptAmount);
        Money distance = delta.abs();
        long dateDelta = CalendarDates.daysBetween(receipt.getReceiptDate(), transaction.getTransactionDate());
        long absDays = Math.abs(dateDelta);
        double vendorSimilarity = VendorSimilarity.score(vendor, transaction.getDescription());

        boolean exactAmount = distance.compareTo(Money.ONE_CENT) <= 0;
        boolean vendorMatch = vendorSimilarity >= VendorSimilarity.MATCH_THRESHOLD;

        ConfidenceTier tier;
        if (exactAmount && absDays <= NEAR_DATE_DAYS && vendorMatch) {
            tier = ConfidenceTier.HIGH;
        } else if (exactAmount) {
            tier = ConfidenceTier.MEDIUM;
        } else if (distance.compareTo(FEE_ADJUSTED_TOLERANCE) <= 0 && vendorMatch) {
            tier = ConfidenceTier.LOW;
        } else {
            tier = ConfidenceTier.WEAK;
        }

        double refinement = AMOUNT_WEIGHT * amountScore(distance)
                + DATE_WEIGHT * dateScore(absDays)
                + VENDOR_WEIGHT * vendorSimilarity;

        return MatchCandidate.builder()
                .receiptId(receipt.getReceiptId())
                .transactionId(transaction.getTransactionId())
                .amountDelta(delta.toBigDecimal())
                .dateDeltaDays(dateDelta)
                .vendorSimilarity(vendorSimilarity)
                .confidence(tier.scale(refinement))
                .tier(tier)
                .build();
    }

    private static double amountScore(Money distance) {
        if (distance.isZero()) {
            return 1.0;
        }
        if (distance.compareTo(Money.ONE_CENT) <= 0) {
            return 0.95;
        }
        if (distance.compareTo(FEE_ADJUSTED_TOLERANCE) <= 0) {
            return 0.70;
        }
        return 0.40;
    }

    private static double dateScore(long absDays) {
        if (absDays == 0) {
            return 1.0;
        }
        if (absDays <= NEAR_DATE_DAYS) {
            return 0.85;
        }
        if (absDays <= 7) {
            return 0.65;
        }
        if (absDays <= 30) {
            return 0.35;
        }
        return 0.10;
    }
}

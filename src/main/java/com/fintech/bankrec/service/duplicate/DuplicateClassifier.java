package com.fintech.bankrec.service.duplicate;

import com.fintech.bankrec.config.ReconciliationConfig;
import com.fintech.bankrec.entity.PaymentMethod;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.service.matching.VendorSimilarity;
import com.fintech.bankrec.value.CalendarDates;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether two receipts with the same vendor and amount are a true duplicate.
 * <p>
 * Only {@link DuplicateVerdict#TRUE_DUPLICATE} permits a deletion, and it is returned
 * only when date, amount and vendor are identical, at most one side is linked, and
 * nothing else (cash payment, an unreversed fee, differing source references) suggests
 * two genuine charges.
 */
@Slf4j
public class DuplicateClassifier {

    private final FeePatternMatcher feePatterns;
    private final int recurrenceGapDays;

    public DuplicateClassifier(ReconciliationConfig config) {
        this(new FeePatternMatcher(config.getFeePatterns()), config.getRecurrenceGapDays());
    }

    public DuplicateClassifier(FeePatternMatcher feePatterns, int recurrenceGapDays) {
        this.feePatterns = feePatterns;
        this.recurrenceGapDays = recurrenceGapDays;
    }

    public DuplicateAssessment classify(Receipt a, Receipt b) {
        return classify(a, b, List.of(a, b));
    }

    /**
     * @param vendorHistory other receipts of the same vendor, searched for fee reversals
     */
    public DuplicateAssessment classify(Receipt a, Receipt b, Collection<Receipt> vendorHistory) {
        String vendorA = VendorSimilarity.vendorKey(a.effectiveVendor());
        String vendorB = VendorSimilarity.vendorKey(b.effectiveVendor());
        if (vendorA.isEmpty() || !vendorA.equals(vendorB)
                || a.getAmount() == null || b.getAmount() == null
                || !a.amountAsMoney().equals(b.amountAsMoney())) {
            return DuplicateAssessment.of(DuplicateVerdict.NOT_DUPLICATE, "vendor or amount differs");
        }

        long gap = CalendarDates.absoluteDaysBetween(a.getReceiptDate(), b.getReceiptDate());
        if (gap >= recurrenceGapDays) {
            return DuplicateAssessment.of(DuplicateVerdict.LEGITIMATE_RECURRING,
                    "same amount recurs " + gap + " days apart");
        }

        if (isUnreversedFee(a, vendorHistory) || isUnreversedFee(b, vendorHistory)) {
            return DuplicateAssessment.of(DuplicateVerdict.PROTECTED_FEE, "unreversed bank fee");
        }

        if (a.getPaymentMethod() == PaymentMethod.CASH || b.getPaymentMethod() == PaymentMethod.CASH) {
            return DuplicateAssessment.of(DuplicateVerdict.NOT_DUPLICATE, "cash payments repeat legitimately");
        }

        if (gap != 0) {
            return DuplicateAssessment.of(DuplicateVerdict.NOT_DUPLICATE, "dates differ by " + gap + " day(s)");
        }

        if (a.isMatched() && b.isMatched()) {
            return DuplicateAssessment.of(DuplicateVerdict.NOT_DUPLICATE, "both receipts are linked");
        }

        if (conflictingReferences(a, b)) {
            return DuplicateAssessment.of(DuplicateVerdict.NOT_DUPLICATE, "source references differ");
        }

        Receipt keep;
        Receipt delete;
        if (a.isMatched()) {
            keep = a;
            delete = b;
        } else if (b.isMatched()) {
            keep = b;
            delete = a;
        } else if (a.getReceiptId() <= b.getReceiptId()) {
            keep = a;
            delete = b;
        } else {
            keep = b;
            delete = a;
        }

        log.debug("Receipt {} duplicates receipt {}", delete.getReceiptId(), keep.getReceiptId());
        return DuplicateAssessment.builder()
                .verdict(DuplicateVerdict.TRUE_DUPLICATE)
                .keepId(keep.getReceiptId())
                .deleteCandidateId(delete.getReceiptId())
                .reason("duplicate removal: kept #" + keep.getReceiptId())
                .build();
    }

    private boolean isUnreversedFee(Receipt receipt, Collection<Receipt> vendorHistory) {
        return feePatterns.isFee(receipt) && !feePatterns.hasReversal(receipt, vendorHistory);
    }

    private static boolean conflictingReferences(Receipt a, Receipt b) {
        String refA = a.getSourceReference();
        String refB = b.getSourceReference();
        if (refA == null || refA.isBlank() || refB == null || refB.isBlank()) {
            return false;
        }
        return !Objects.equals(refA.trim(), refB.trim());
    }
}

package com.fintech.bankrec.service;

import com.fintech.bankrec.dto.ReviewItem;
import com.fintech.bankrec.entity.SplitMemberType;
import com.fintech.bankrec.service.duplicate.DuplicateAssessment;
import com.fintech.bankrec.service.matching.MatchCandidate;
import com.fintech.bankrec.value.Money;
import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Decisions collected while planning a run, applied together in one transaction.
 */
@Getter
class ReconciliationPlan {

    private final List<Link> links = new ArrayList<>();
    private final List<Split> splits = new ArrayList<>();
    private final List<DuplicateAssessment> deletions = new ArrayList<>();
    private final List<Long> shadowTransactionIds = new ArrayList<>();
    private final List<ReviewItem> reviewItems = new ArrayList<>();

    @Value
    static class Link {
        Long receiptId;
        Long transactionId;
        MatchCandidate candidate;

        String describe() {
            return "link receipt #" + receiptId + " -> transaction #" + transactionId;
        }
    }

    /**
     * Members are receipts anchored on a transaction, or transactions anchored on a
     * receipt, in descending amount order.
     */
    @Value
    static class Split {
        SplitMemberType memberType;
        Long anchorId;
        List<Long> memberIds;
        Money expectedTotal;
        double confidence;
        String ruleApplied;

        String describe() {
            String members = memberType == SplitMemberType.RECEIPT ? "receipts " : "transactions ";
            String anchor = memberType == SplitMemberType.RECEIPT ? "transaction #" : "receipt #";
            return "split " + members + memberIds + " -> " + anchor + anchorId;
        }
    }
}

package com.fintech.bankrec.service.duplicate;

import lombok.Builder;
import lombok.Value;

/**
 * Classifier decision for a pair of receipts. Only {@link DuplicateVerdict#TRUE_DUPLICATE}
 * carries ids to keep and delete.
 */
@Value
@Builder
public class DuplicateAssessment {

    DuplicateVerdict verdict;
    Long keepId;
    Long deleteCandidateId;
    String reason;

    public boolean isTrueDuplicate() {
        return verdict == DuplicateVerdict.TRUE_DUPLICATE;
    }

    static DuplicateAssessment of(DuplicateVerdict verdict, String reason) {
        return DuplicateAssessment.builder()
                .verdict(verdict)
                .reason(reason)
                .build();
    }
}

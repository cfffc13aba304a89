package com.fintech.bankrec.service.duplicate;

import com.fintech.bankrec.config.ReconciliationProperties;
import com.fintech.bankrec.entity.PaymentMethod;
import com.fintech.bankrec.entity.Receipt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateClassifierTest {

    private static final LocalDate DATE = LocalDate.of(2019, 4, 30);

    private final DuplicateClassifier classifier = new DuplicateClassifier(
            new FeePatternMatcher(List.of("E-?TRANSFER FEE", "NSF", "SERVICE CHARGE")), 5);

    @Nested
    @DisplayName("True duplicates")
    class TrueDuplicateTests {

        @Test
        @DisplayName("Same remittance twice, one linked: the unlinked copy is the one to delete")
        void linkedCopyIsKept() {
            Receipt linked = receipt(1L, "RECEIVER GENERAL", "23577.00", DATE);
            linked.setBankingTransactionId(500L);
            Receipt copy = receipt(2L, "RECEIVER GENERAL", "23577.00", DATE);

            DuplicateAssessment assessment = classifier.classify(linked, copy);

            assertThat(assessment.getVerdict()).isEqualTo(DuplicateVerdict.TRUE_DUPLICATE);
            assertThat(assessment.getKeepId()).isEqualTo(1L);
            assertThat(assessment.getDeleteCandidateId()).isEqualTo(2L);
            assertThat(assessment.getReason()).isEqualTo("duplicate removal: kept #1");
        }

        @Test
        @DisplayName("Argument order does not change the decision")
        void symmetric() {
            Receipt linked = receipt(1L, "RECEIVER GENERAL", "23577.00", DATE);
            linked.setBankingTransactionId(500L);
            Receipt copy = receipt(2L, "receiver general ", "23577.00", DATE);

            DuplicateAssessment assessment = classifier.classify(copy, linked);

            assertThat(assessment.isTrueDuplicate()).isTrue();
            assertThat(assessment.getDeleteCandidateId()).isEqualTo(2L);
        }

        @Test
        @DisplayName("Neither linked: the lower id is kept")
        void lowestIdKept() {
            DuplicateAssessment assessment = classifier.classify(
                    receipt(9L, "STAPLES", "45.00", DATE), receipt(4L, "STAPLES", "45.00", DATE));

            assertThat(assessment.getKeepId()).isEqualTo(4L);
            assertThat(assessment.getDeleteCandidateId()).isEqualTo(9L);
        }

        @Test
        @DisplayName("Remittance paid by online transfer is still a duplicate under the default fee patterns")
        void transferIsNotAFee() {
            DuplicateClassifier defaults = new DuplicateClassifier(new ReconciliationProperties().toConfig());
            Receipt linked = receipt(1L, "RECEIVER GENERAL", "23577.00", DATE);
            linked.setDescription("payroll remittance by online transfer");
            linked.setBankingTransactionId(500L);
            Receipt copy = receipt(2L, "RECEIVER GENERAL", "23577.00", DATE);
            copy.setDescription("payroll remittance by online transfer");

            DuplicateAssessment assessment = defaults.classify(linked, copy);

            assertThat(assessment.getVerdict()).isEqualTo(DuplicateVerdict.TRUE_DUPLICATE);
            assertThat(assessment.getDeleteCandidateId()).isEqualTo(2L);
        }

        @Test
        @DisplayName("E-transfer payment to a person is not mistaken for an NSF fee")
        void eTransferPaymentIsNotAFee() {
            DuplicateClassifier defaults = new DuplicateClassifier(new ReconciliationProperties().toConfig());

            DuplicateAssessment assessment = defaults.classify(
                    receipt(1L, "INTERAC E-TRANSFER JOHN SMITH", "300.00", DATE),
                    receipt(2L, "INTERAC E-TRANSFER JOHN SMITH", "300.00", DATE));

            assertThat(assessment.getVerdict()).isEqualTo(DuplicateVerdict.TRUE_DUPLICATE);
        }
    }

    @Nested
    @DisplayName("Protected patterns")
    class ProtectedTests {

        @Test
        @DisplayName("Monthly charge of the same amount is recurring, not a duplicate")
        void recurringCharge() {
            DuplicateAssessment assessment = classifier.classify(
                    receipt(1L, "SHAW CABLE", "110.00", LocalDate.of(2019, 4, 1)),
                    receipt(2L, "SHAW CABLE", "110.00", LocalDate.of(2019, 5, 1)));

            assertThat(assessment.getVerdict()).isEqualTo(DuplicateVerdict.LEGITIMATE_RECURRING);
            assertThat(assessment.getDeleteCandidateId()).isNull();
        }

        @Test
        @DisplayName("Two unreversed NSF fees on one day are both kept")
        void unreversedFee() {
            Receipt first = receipt(1L, "NSF CHARGE", "45.00", DATE);
            Receipt second = receipt(2L, "NSF CHARGE", "45.00", DATE);

            assertThat(classifier.classify(first, second).getVerdict()).isEqualTo(DuplicateVerdict.PROTECTED_FEE);
        }

        @Test
        @DisplayName("E-transfer fee stays protected with the default fee patterns")
        void eTransferFeeProtected() {
            DuplicateClassifier defaults = new DuplicateClassifier(new ReconciliationProperties().toConfig());

            Receipt fee = receipt(3L, "E-TRANSFER FEE", "1.50", DATE);
            Receipt repeat = receipt(4L, "E-TRANSFER FEE", "1.50", DATE);
            assertThat(defaults.classify(fee, repeat).getVerdict()).isEqualTo(DuplicateVerdict.PROTECTED_FEE);
        }

        @Test
        @DisplayName("A reversed fee loses its protection")
        void reversedFee() {
            Receipt first = receipt(1L, "NSF CHARGE", "45.00", DATE);
            Receipt second = receipt(2L, "NSF CHARGE", "45.00", DATE);
            Receipt reversal = receipt(3L, "NSF CHARGE", "-45.00", DATE.plusDays(1));

            DuplicateAssessment assessment = classifier.classify(first, second, List.of(first, second, reversal));

            assertThat(assessment.getVerdict()).isEqualTo(DuplicateVerdict.TRUE_DUPLICATE);
        }

        @Test
        @DisplayName("Cash purchases repeat legitimately")
        void cashNeverDuplicate() {
            Receipt first = receipt(1L, "TIM HORTONS", "12.50", DATE);
            Receipt second = receipt(2L, "TIM HORTONS", "12.50", DATE);
            second.setPaymentMethod(PaymentMethod.CASH);

            assertThat(classifier.classify(first, second).getVerdict()).isEqualTo(DuplicateVerdict.NOT_DUPLICATE);
        }
    }

    @Nested
    @DisplayName("Not duplicates")
    class NotDuplicateTests {

        @Test
        void differentAmount() {
            assertThat(classifier.classify(
                    receipt(1L, "STAPLES", "45.00", DATE), receipt(2L, "STAPLES", "45.01", DATE)).getVerdict())
                    .isEqualTo(DuplicateVerdict.NOT_DUPLICATE);
        }

        @Test
        void dateGapBelowRecurrence() {
            assertThat(classifier.classify(
                    receipt(1L, "STAPLES", "45.00", DATE), receipt(2L, "STAPLES", "45.00", DATE.plusDays(2))).getVerdict())
                    .isEqualTo(DuplicateVerdict.NOT_DUPLICATE);
        }

        @Test
        void bothLinked() {
            Receipt a = receipt(1L, "STAPLES", "45.00", DATE);
            a.setBankingTransactionId(10L);
            Receipt b = receipt(2L, "STAPLES", "45.00", DATE);
            b.setBankingTransactionId(11L);

            assertThat(classifier.classify(a, b).getVerdict()).isEqualTo(DuplicateVerdict.NOT_DUPLICATE);
        }

        @Test
        void differentSourceReferences() {
            Receipt a = receipt(1L, "STAPLES", "45.00", DATE);
            a.setSourceReference("INV-1001");
            Receipt b = receipt(2L, "STAPLES", "45.00", DATE);
            b.setSourceReference("INV-1002");

            assertThat(classifier.classify(a, b).getVerdict()).isEqualTo(DuplicateVerdict.NOT_DUPLICATE);
        }

        @Test
        void blankVendor() {
            assertThat(classifier.classify(
                    receipt(1L, null, "500.00", DATE), receipt(2L, null, "500.00", DATE)).getVerdict())
                    .isEqualTo(DuplicateVerdict.NOT_DUPLICATE);
        }
    }

    private static Receipt receipt(Long id, String vendor, String amount, LocalDate date) {
        return Receipt.builder()
                .receiptId(id)
                .vendorNameRaw(vendor)
                .amount(new BigDecimal(amount))
                .receiptDate(date)
                .build();
    }
}

package com.fintech.bankrec.service.matching;

import com.fintech.bankrec.entity.BankingTransaction;
import com.fintech.bankrec.entity.Receipt;
import com.fintech.bankrec.exception.ToleranceViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateMatcherTest {

    private final CandidateMatcher matcher = new CandidateMatcher();

    @Nested
    @DisplayName("Tolerance windows")
    class ToleranceWindowTests {

        @Test
        @DisplayName("Amount one cent away is a candidate, two cents is not")
        void amountBoundary() {
            Receipt receipt = receipt(1L, "STAPLES", "100.00", LocalDate.of(2025, 3, 10));
            List<BankingTransaction> pool = List.of(
                    debit(10L, "100.01", LocalDate.of(2025, 3, 10), "STAPLES"),
                    debit(11L, "99.99", LocalDate.of(2025, 3, 10), "STAPLES"),
                    debit(12L, "100.02", LocalDate.of(2025, 3, 10), "STAPLES"));

            List<MatchCandidate> candidates = matcher.findCandidates(receipt, pool, 1, 7);

            assertThat(candidates).extracting(MatchCandidate::getTransactionId).containsExactlyInAnyOrder(10L, 11L);
        }

        @Test
        @DisplayName("Dates exactly at the window edge are candidates, one day beyond is not")
        void dateBoundary() {
            Receipt receipt = receipt(1L, "STAPLES", "100.00", LocalDate.of(2025, 3, 10));
            List<BankingTransaction> pool = List.of(
                    debit(10L, "100.00", LocalDate.of(2025, 3, 17), "STAPLES"),
                    debit(11L, "100.00", LocalDate.of(2025, 3, 3), "STAPLES"),
                    debit(12L, "100.00", LocalDate.of(2025, 3, 18), "STAPLES"));

            List<MatchCandidate> candidates = matcher.findCandidates(receipt, pool, 1, 7);

            assertThat(candidates).extracting(MatchCandidate::getTransactionId).containsExactlyInAnyOrder(10L, 11L);
        }

        @Test
        @DisplayName("Negative or oversized tolerance is rejected")
        void rejectsBadTolerance() {
            Receipt receipt = receipt(1L, "STAPLES", "100.00", LocalDate.of(2025, 3, 10));

            assertThatThrownBy(() -> matcher.findCandidates(receipt, List.of(), -1, 7))
                    .isInstanceOf(ToleranceViolationException.class);
            assertThatThrownBy(() -> matcher.findCandidates(receipt, List.of(), 1, -3))
                    .isInstanceOf(ToleranceViolationException.class);
            assertThatThrownBy(() -> MatchingTolerance.of(1, MatchingTolerance.MAX_DATE_WINDOW_DAYS + 1))
                    .isInstanceOf(ToleranceViolationException.class);
        }

        @Test
        @DisplayName("Zero windows still match the exact amount on the same day")
        void zeroWindows() {
            Receipt receipt = receipt(1L, "STAPLES", "100.00", LocalDate.of(2025, 3, 10));
            List<BankingTransaction> pool = List.of(debit(10L, "100.00", LocalDate.of(2025, 3, 10), "X"));

            assertThat(matcher.findCandidates(receipt, pool, 0, 0)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Exact amount with near date and vendor match ranks highest")
        void highTierFirst() {
            Receipt receipt = receipt(1L, "FAS GAS", "62.40", LocalDate.of(2025, 5, 2));
            List<BankingTransaction> pool = List.of(
                    debit(20L, "62.40", LocalDate.of(2025, 5, 8), "UNRELATED"),
                    debit(21L, "62.40", LocalDate.of(2025, 5, 3), "POS FAS GAS #88"));

            List<MatchCandidate> candidates = matcher.findCandidates(receipt, pool, 1, 7);

            assertThat(candidates).hasSize(2);
            assertThat(candidates.get(0).getTransactionId()).isEqualTo(21L);
            assertThat(candidates.get(0).getTier()).isEqualTo(ConfidenceTier.HIGH);
            assertThat(candidates.get(0).getConfidence()).isGreaterThanOrEqualTo(0.90);
            assertThat(candidates.get(1).getTier()).isEqualTo(ConfidenceTier.MEDIUM);
            assertThat(candidates.get(0).getConfidence()).isGreaterThan(candidates.get(1).getConfidence());
        }

        @Test
        @DisplayName("Fee-adjusted amount with vendor match is LOW tier")
        void feeAdjustedTier() {
            Receipt receipt = receipt(1L, "SHAW CABLE", "110.00", LocalDate.of(2025, 5, 2));
            List<BankingTransaction> pool = List.of(debit(30L, "110.75", LocalDate.of(2025, 5, 2), "SHAW CABLE"));

            List<MatchCandidate> candidates = matcher.findCandidates(receipt, pool, 100, 7);

            assertThat(candidates).singleElement().satisfies(c -> {
                assertThat(c.getTier()).isEqualTo(ConfidenceTier.LOW);
                assertThat(c.getRuleApplied()).isEqualTo("fee-adjusted-amount+vendor");
                assertThat(c.getAmountDelta()).isEqualByComparingTo("0.75");
            });
        }

        @Test
        @DisplayName("Equal candidates are ordered by transaction id and flagged as tied")
        void deterministicTieBreak() {
            Receipt receipt = receipt(1L, "ESSO", "40.00", LocalDate.of(2025, 5, 2));
            List<BankingTransaction> pool = List.of(
                    debit(41L, "40.00", LocalDate.of(2025, 5, 2), "ESSO"),
                    debit(40L, "40.00", LocalDate.of(2025, 5, 2), "ESSO"));

            List<MatchCandidate> candidates = matcher.findCandidates(receipt, pool, 1, 7);

            assertThat(candidates).extracting(MatchCandidate::getTransactionId).containsExactly(40L, 41L);
            assertThat(candidates.get(0).tiesWith(candidates.get(1))).isTrue();
        }
    }

    @Nested
    @DisplayName("Pool filtering")
    class PoolFilteringTests {

        @Test
        @DisplayName("Linked transactions are skipped unless explicitly included")
        void linkedTransactionsSkipped() {
            Receipt receipt = receipt(1L, "STAPLES", "100.00", LocalDate.of(2025, 3, 10));
            BankingTransaction linked = debit(10L, "100.00", LocalDate.of(2025, 3, 10), "STAPLES");
            linked.setMatchedReceiptId(99L);
            BankingTransaction inGroup = debit(11L, "100.00", LocalDate.of(2025, 3, 10), "STAPLES");
            inGroup.setMatchedSplitGroupId(5L);

            assertThat(matcher.findCandidates(receipt, List.of(linked, inGroup), 1, 7)).isEmpty();
            assertThat(matcher.findCandidates(receipt, List.of(linked, inGroup), MatchingTolerance.defaults(), true))
                    .hasSize(2);
        }

        @Test
        @DisplayName("Refund receipts match bank credits")
        void refundMatchesCredit() {
            Receipt refund = receipt(1L, "COSTCO", "-35.10", LocalDate.of(2025, 3, 10));
            BankingTransaction credit = BankingTransaction.builder()
                    .transactionId(50L)
                    .accountId("0228362")
                    .transactionDate(LocalDate.of(2025, 3, 11))
                    .creditAmount(new BigDecimal("35.10"))
                    .description("COSTCO REFUND")
                    .build();
            BankingTransaction debit = debit(51L, "35.10", LocalDate.of(2025, 3, 11), "COSTCO");

            assertThat(matcher.findCandidates(refund, List.of(credit, debit), 1, 7))
                    .extracting(MatchCandidate::getTransactionId).containsExactly(50L);
        }

        @Test
        @DisplayName("Inputs are left untouched")
        void doesNotMutateInputs() {
            Receipt receipt = receipt(1L, "STAPLES", "100.00", LocalDate.of(2025, 3, 10));
            BankingTransaction transaction = debit(10L, "100.00", LocalDate.of(2025, 3, 10), "STAPLES");
            BankingTransaction before = transaction.toBuilder().build();

            matcher.findCandidates(receipt, List.of(transaction), 1, 7);

            assertThat(transaction).isEqualTo(before);
            assertThat(receipt.getBankingTransactionId()).isNull();
        }
    }

    @Test
    @DisplayName("Receipt without vendor, exact amount, three days apart: confident enough to link")
    void exactAmountWithoutVendor() {
        Receipt receipt = receipt(1L, null, "500.00", LocalDate.of(2025, 12, 23));
        BankingTransaction transaction = debit(10L, "500.00", LocalDate.of(2025, 12, 20), "CHEQUE 215");

        List<MatchCandidate> candidates = matcher.findCandidates(receipt, List.of(transaction), 1, 7);

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.getTier()).isEqualTo(ConfidenceTier.MEDIUM);
            assertThat(c.getDateDeltaDays()).isEqualTo(-3);
            assertThat(c.getConfidence()).isGreaterThanOrEqualTo(0.70);
        });
    }

    static Receipt receipt(Long id, String vendor, String amount, LocalDate date) {
        return Receipt.builder()
                .receiptId(id)
                .vendorNameRaw(vendor)
                .amount(new BigDecimal(amount))
                .receiptDate(date)
                .build();
    }

    static BankingTransaction debit(Long id, String amount, LocalDate date, String description) {
        return BankingTransaction.builder()
                .transactionId(id)
                .accountId("0228362")
                .transactionDate(date)
                .debitAmount(new BigDecimal(amount))
                .description(description)
                .build();
    }
}

package com.fintech.bankrec.service.split;

import com.fintech.bankrec.value.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SplitGroupResolverTest {

    private final SplitGroupResolver resolver = new SplitGroupResolver();

    @Nested
    @DisplayName("Resolved splits")
    class ResolvedTests {

        @Test
        @DisplayName("Three fuel receipts explain one bank line; the larger receipt is left out")
        void threeMemberSplit() {
            List<SplitCandidate> candidates = List.of(
                    candidate(1L, "128.00"),
                    candidate(2L, "40.20"),
                    candidate(3L, "5.76"),
                    candidate(4L, "80.00"));

            SplitResolution resolution = resolver.resolveSplit(Money.of("125.96"), candidates);

            assertThat(resolution.isResolved()).isTrue();
            assertThat(resolution.memberIds()).containsExactly(4L, 2L, 3L);
            assertThat(resolution.total()).isEqualTo(Money.of("125.96"));
        }

        @ParameterizedTest(name = "{0} members")
        @ValueSource(ints = {2, 3, 4, 5, 6})
        @DisplayName("Members sum to the anchor for every supported group size")
        void everyGroupSize(int size) {
            List<SplitCandidate> candidates = new ArrayList<>();
            List<Long> expectedIds = new ArrayList<>();
            Money anchor = Money.ZERO;
            for (int i = 0; i < size; i++) {
                // Doubling amounts give every subset a distinct total.
                Money amount = Money.of(new BigDecimal("1.01").multiply(BigDecimal.valueOf(1L << i)));
                candidates.add(SplitCandidate.of((long) i + 1, amount));
                expectedIds.add(0, (long) i + 1);
                anchor = anchor.plus(amount);
            }
            candidates.add(candidate(99L, "0.50"));

            SplitResolution resolution = resolver.resolveSplit(anchor, candidates);

            assertThat(resolution.isResolved()).isTrue();
            assertThat(resolution.memberIds()).containsExactlyElementsOf(expectedIds);
            assertThat(resolution.total()).isEqualTo(anchor);
        }

        @Test
        @DisplayName("Backtracks when the largest-first path overshoots")
        void backtracksPastGreedyPath() {
            List<SplitCandidate> candidates = List.of(
                    candidate(1L, "6.00"),
                    candidate(2L, "5.00"),
                    candidate(3L, "5.00"));

            SplitResolution resolution = resolver.resolveSplit(Money.of("10.00"), candidates);

            assertThat(resolution.isResolved()).isTrue();
            assertThat(resolution.memberIds()).containsExactly(2L, 3L);
        }

        @Test
        @DisplayName("Sum within one cent of the anchor is accepted")
        void centTolerance() {
            SplitResolution resolution = resolver.resolveSplit(Money.of("50.01"),
                    List.of(candidate(1L, "30.00"), candidate(2L, "20.00")));

            assertThat(resolution.isResolved()).isTrue();
            assertThat(resolution.total()).isEqualTo(Money.of("50.00"));
        }

        @Test
        @DisplayName("Six members is the largest group")
        void sixMembers() {
            List<SplitCandidate> candidates = new ArrayList<>();
            for (long id = 1; id <= 6; id++) {
                candidates.add(candidate(id, "1.00"));
            }

            SplitResolution resolution = resolver.resolveSplit(Money.of("6.00"), candidates);

            assertThat(resolution.isResolved()).isTrue();
            assertThat(resolution.getMembers()).hasSize(6);
        }

        @Test
        @DisplayName("Credits split like debits and keep their sign")
        void creditSplit() {
            SplitResolution resolution = resolver.resolveSplit(Money.of("-70.00"),
                    List.of(candidate(1L, "-50.00"), candidate(2L, "-20.00"), candidate(3L, "20.00")));

            assertThat(resolution.isResolved()).isTrue();
            assertThat(resolution.memberIds()).containsExactly(1L, 2L);
            assertThat(resolution.total()).isEqualTo(Money.of("-70.00"));
        }
    }

    @Nested
    @DisplayName("Unresolved")
    class UnresolvedTests {

        @Test
        @DisplayName("A single exact candidate is a one-to-one match, not a split")
        void singleCandidateIsNotASplit() {
            SplitResolution resolution = resolver.resolveSplit(Money.of("125.96"),
                    List.of(candidate(1L, "80.00"), candidate(2L, "125.96"), candidate(3L, "45.96")));

            assertThat(resolution.isResolved()).isFalse();
            assertThat(resolution.getError()).isEqualTo(SplitError.NOT_A_SPLIT);
        }

        @Test
        @DisplayName("No subset sums to the anchor")
        void noSubset() {
            SplitResolution resolution = resolver.resolveSplit(Money.of("1500.00"),
                    List.of(candidate(1L, "400.00"), candidate(2L, "305.00")));

            assertThat(resolution.getError()).isEqualTo(SplitError.SPLIT_NOT_FOUND);
            assertThat(resolution.getMembers()).isEmpty();
        }

        @Test
        @DisplayName("Seven members would be needed: not found")
        void overMemberCap() {
            List<SplitCandidate> candidates = new ArrayList<>();
            for (long id = 1; id <= 7; id++) {
                candidates.add(candidate(id, "1.00"));
            }

            assertThat(resolver.resolveSplit(Money.of("7.00"), candidates).getError())
                    .isEqualTo(SplitError.SPLIT_NOT_FOUND);
        }

        @Test
        @DisplayName("Fewer than two eligible candidates")
        void tooFewCandidates() {
            assertThat(resolver.resolveSplit(Money.of("10.00"), List.of(candidate(1L, "4.00"))).getError())
                    .isEqualTo(SplitError.SPLIT_NOT_FOUND);
            assertThat(resolver.resolveSplit(Money.of("10.00"), List.of()).getError())
                    .isEqualTo(SplitError.SPLIT_NOT_FOUND);
        }

        @Test
        @DisplayName("Lower member cap is honoured")
        void configuredCap() {
            List<SplitCandidate> candidates = List.of(
                    candidate(1L, "3.00"), candidate(2L, "3.00"), candidate(3L, "3.00"));

            assertThat(resolver.resolveSplit(Money.of("9.00"), candidates, 2, 12).isResolved()).isFalse();
            assertThat(resolver.resolveSplit(Money.of("9.00"), candidates, 3, 12).isResolved()).isTrue();
        }
    }

    private static SplitCandidate candidate(Long id, String amount) {
        return SplitCandidate.of(id, Money.of(amount));
    }
}

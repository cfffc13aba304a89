package com.fintech.bankrec.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MoneyTest {

    @Test
    @DisplayName("Sums of cent amounts are exact")
    void sumIsExact() {
        Money total = Money.sum(List.of(Money.of("80.00"), Money.of("40.20"), Money.of("5.76")));

        assertThat(total).isEqualTo(Money.of("125.96"));
        assertThat(total.toCents()).isEqualTo(12596);
    }

    @Test
    @DisplayName("Ten dimes make exactly one dollar")
    void noFloatingPointDrift() {
        Money total = Money.ZERO;
        for (int i = 0; i < 10; i++) {
            total = total.plus(Money.of("0.10"));
        }
        assertThat(total).isEqualTo(Money.of("1.00"));
    }

    @Test
    @DisplayName("Tolerance boundary is inclusive")
    void toleranceBoundaryInclusive() {
        Money amount = Money.of("500.00");

        assertThat(amount.isWithin(Money.of("500.01"), Money.ONE_CENT)).isTrue();
        assertThat(amount.isWithin(Money.of("499.99"), Money.ONE_CENT)).isTrue();
        assertThat(amount.isWithin(Money.of("500.02"), Money.ONE_CENT)).isFalse();
    }

    @Test
    @DisplayName("Equality ignores scale")
    void equalityIgnoresScale() {
        assertThat(Money.of(new BigDecimal("12.5"))).isEqualTo(Money.of("12.50"));
        assertThat(Money.of(new BigDecimal("12.5")).hashCode()).isEqualTo(Money.of("12.50").hashCode());
    }

    @Test
    @DisplayName("Sign helpers")
    void signHelpers() {
        Money refund = Money.of("-23.50");

        assertThat(refund.isNegative()).isTrue();
        assertThat(refund.abs()).isEqualTo(Money.of("23.50"));
        assertThat(refund.negate().isPositive()).isTrue();
        assertThat(Money.orZero(null).isZero()).isTrue();
        assertThat(refund.distanceTo(Money.of("-20.00"))).isEqualTo(Money.of("3.50"));
    }
}

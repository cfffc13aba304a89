package com.fintech.bankrec.value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Exact currency amount held at cent precision.
 * <p>
 * Amounts are signed: positive values are money leaving the business (a debit on
 * the bank statement), negative values are money coming in (a credit or refund).
 * All comparisons are exact at the cent level, so {@code sum(parts) == whole}
 * checks never suffer from binary floating point drift.
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    public static final Money ONE_CENT = ofCents(1);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        return new Money(amount);
    }

    public static Money of(String amount) {
        Objects.requireNonNull(amount, "amount");
        return new Money(new BigDecimal(amount.trim()));
    }

    public static Money ofCents(long cents) {
        return new Money(BigDecimal.valueOf(cents, SCALE));
    }

    /**
     * Null-tolerant factory for nullable database columns.
     */
    public static Money orZero(BigDecimal amount) {
        return amount == null ? ZERO : of(amount);
    }

    public BigDecimal toBigDecimal() {
        return amount;
    }

    public long toCents() {
        return amount.movePointRight(SCALE).longValueExact();
    }

    public Money plus(Money other) {
        return new Money(amount.add(other.amount));
    }

    public Money minus(Money other) {
        return new Money(amount.subtract(other.amount));
    }

    public Money negate() {
        return new Money(amount.negate());
    }

    public Money abs() {
        return amount.signum() < 0 ? negate() : this;
    }

    public int signum() {
        return amount.signum();
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    /**
     * Absolute difference between this amount and another.
     */
    public Money distanceTo(Money other) {
        return minus(other).abs();
    }

    /**
     * True when {@code |this - other| <= tolerance}. The boundary is inclusive.
     */
    public boolean isWithin(Money other, Money tolerance) {
        return distanceTo(other).compareTo(tolerance) <= 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public static Money sum(Iterable<Money> parts) {
        BigDecimal total = BigDecimal.ZERO;
        for (Money part : parts) {
            total = total.add(part.amount);
        }
        return new Money(total);
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money)) {
            return false;
        }
        return amount.compareTo(((Money) o).amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.hashCode();
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}

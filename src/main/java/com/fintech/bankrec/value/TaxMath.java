package com.fintech.bankrec.value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Sales-tax arithmetic for tax-included amounts.
 * <p>
 * The reconciliation engine never assumes a tax rate; this is offered to callers
 * that already know the applicable rate.
 */
public final class TaxMath {

    private TaxMath() {
    }

    /**
     * Tax portion of a tax-included gross amount: {@code gross * rate / (1 + rate)}.
     *
     * @param grossAmount amount including tax
     * @param rate        tax rate as a fraction, e.g. {@code 0.05}
     */
    public static Money gstIncluded(Money grossAmount, BigDecimal rate) {
        if (rate == null || rate.signum() < 0) {
            throw new IllegalArgumentException("Tax rate must be zero or positive: " + rate);
        }
        BigDecimal gross = grossAmount.toBigDecimal();
        BigDecimal tax = gross.multiply(rate)
                .divide(BigDecimal.ONE.add(rate), MathContext.DECIMAL64)
                .setScale(Money.SCALE, RoundingMode.HALF_UP);
        return Money.of(tax);
    }

    /**
     * Net amount of a tax-included gross amount.
     */
    public static Money netOfGst(Money grossAmount, BigDecimal rate) {
        return grossAmount.minus(gstIncluded(grossAmount, rate));
    }
}

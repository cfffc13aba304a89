package com.fintech.bankrec.service.matching;

import com.fintech.bankrec.exception.ToleranceViolationException;
import com.fintech.bankrec.value.Money;
import lombok.Value;

/**
 * Amount and date windows for candidate matching. Both boundaries are inclusive.
 * <p>
 * Construction validates the values, so a tolerance that exists is always sane.
 */
@Value
public class MatchingTolerance {

    public static final long DEFAULT_AMOUNT_TOLERANCE_CENTS = 1;
    public static final int DEFAULT_DATE_WINDOW_DAYS = 7;

    /**
     * $100.
     */
    public static final long MAX_AMOUNT_TOLERANCE_CENTS = 10_000;

    /**
     * Two years.
     */
    public static final int MAX_DATE_WINDOW_DAYS = 730;

    long amountToleranceCents;
    int dateWindowDays;

    private MatchingTolerance(long amountToleranceCents, int dateWindowDays) {
        if (amountToleranceCents < 0 || amountToleranceCents > MAX_AMOUNT_TOLERANCE_CENTS) {
            throw new ToleranceViolationException("amountToleranceCents", amountToleranceCents,
                    MAX_AMOUNT_TOLERANCE_CENTS);
        }
        if (dateWindowDays < 0 || dateWindowDays > MAX_DATE_WINDOW_DAYS) {
            throw new ToleranceViolationException("dateWindowDays", dateWindowDays, MAX_DATE_WINDOW_DAYS);
        }
        this.amountToleranceCents = amountToleranceCents;
        this.dateWindowDays = dateWindowDays;
    }

    public static MatchingTolerance of(long amountToleranceCents, int dateWindowDays) {
        return new MatchingTolerance(amountToleranceCents, dateWindowDays);
    }

    public static MatchingTolerance defaults() {
        return new MatchingTolerance(DEFAULT_AMOUNT_TOLERANCE_CENTS, DEFAULT_DATE_WINDOW_DAYS);
    }

    public Money amountTolerance() {
        return Money.ofCents(amountToleranceCents);
    }

    public MatchingTolerance withAmountToleranceCents(long cents) {
        return new MatchingTolerance(cents, dateWindowDays);
    }

    public MatchingTolerance withDateWindowDays(int days) {
        return new MatchingTolerance(amountToleranceCents, days);
    }
}

package com.fintech.bankrec.value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Calendar-date helpers used by the matching windows.
 */
public final class CalendarDates {

    private CalendarDates() {
    }

    /**
     * Signed number of days from {@code a} to {@code b}; negative when {@code b} is earlier.
     */
    public static long daysBetween(LocalDate a, LocalDate b) {
        return ChronoUnit.DAYS.between(a, b);
    }

    public static long absoluteDaysBetween(LocalDate a, LocalDate b) {
        return Math.abs(daysBetween(a, b));
    }

    /**
     * Symmetric, inclusive window check: {@code |a - b| <= windowDays}.
     */
    public static boolean withinWindow(LocalDate a, LocalDate b, int windowDays) {
        return absoluteDaysBetween(a, b) <= windowDays;
    }
}

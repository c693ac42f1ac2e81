package com.kotsin.fairvalue.util;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Options expiration calendar rules.
 *
 * Monthly opex is the third Friday of the month, which always falls on day 15-21.
 * Any other Friday is treated as a weekly expiration.
 */
public final class OpexCalendar {

    private static final int THIRD_FRIDAY_FIRST_DAY = 15;
    private static final int THIRD_FRIDAY_LAST_DAY = 21;

    private OpexCalendar() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isMonthlyOpex(LocalDate date) {
        if (date == null || date.getDayOfWeek() != DayOfWeek.FRIDAY) {
            return false;
        }
        int day = date.getDayOfMonth();
        return day >= THIRD_FRIDAY_FIRST_DAY && day <= THIRD_FRIDAY_LAST_DAY;
    }

    public static boolean isWeeklyOpex(LocalDate date) {
        return date != null && date.getDayOfWeek() == DayOfWeek.FRIDAY && !isMonthlyOpex(date);
    }
}

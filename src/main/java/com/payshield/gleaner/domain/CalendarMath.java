package com.payshield.gleaner.domain;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Calendar helpers shared by the stateful detectors.
 */
public final class CalendarMath {

    private CalendarMath() {
    }

    public static LocalDate monthStart(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    /**
     * First day of the date's quarter. Quarters start in January, April, July and October.
     */
    public static LocalDate quarterStart(LocalDate date) {
        int firstMonth = (date.getMonthValue() - 1) / 3 * 3 + 1;
        return LocalDate.of(date.getYear(), firstMonth, 1);
    }

    public static LocalDate previousMonthStart(LocalDate date) {
        return monthStart(date).minusMonths(1);
    }

    public static LocalDate previousQuarterStart(LocalDate date) {
        return quarterStart(date).minusMonths(3);
    }

    public static LocalDate nextQuarterStart(LocalDate date) {
        return quarterStart(date).plusMonths(3);
    }

    public static boolean isSameMonth(LocalDate a, LocalDate b) {
        return a.getYear() == b.getYear() && a.getMonthValue() == b.getMonthValue();
    }

    /**
     * The month {@code months} after {@code date}'s month, on {@code day}. A day past the end of that
     * month lands on its last day instead.
     */
    public static LocalDate plusMonthsOnDay(LocalDate date, int months, int day) {
        YearMonth target = YearMonth.from(date).plusMonths(months);
        return clampToMonth(target, day);
    }

    public static LocalDate clampToMonth(YearMonth month, int day) {
        if (day > month.lengthOfMonth()) {
            return month.atEndOfMonth();
        }
        return month.atDay(day);
    }

    public static long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }
}

package com.payshield.gleaner.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarMathTest {

    @Test
    void truncatesToMonthAndQuarter() {
        LocalDate date = LocalDate.of(2020, 8, 17);

        assertThat(CalendarMath.monthStart(date)).isEqualTo(LocalDate.of(2020, 8, 1));
        assertThat(CalendarMath.quarterStart(date)).isEqualTo(LocalDate.of(2020, 7, 1));
        assertThat(CalendarMath.quarterStart(LocalDate.of(2020, 12, 31))).isEqualTo(LocalDate.of(2020, 10, 1));
        assertThat(CalendarMath.quarterStart(LocalDate.of(2020, 1, 1))).isEqualTo(LocalDate.of(2020, 1, 1));
    }

    @Test
    void stepsBetweenQuartersAcrossYears() {
        assertThat(CalendarMath.nextQuarterStart(LocalDate.of(2020, 11, 5))).isEqualTo(LocalDate.of(2021, 1, 1));
        assertThat(CalendarMath.previousQuarterStart(LocalDate.of(2021, 2, 5))).isEqualTo(LocalDate.of(2020, 10, 1));
        assertThat(CalendarMath.previousMonthStart(LocalDate.of(2021, 1, 15))).isEqualTo(LocalDate.of(2020, 12, 1));
    }

    @Test
    void clampsDayToEndOfShortMonths() {
        LocalDate january = LocalDate.of(2020, 1, 1);

        assertThat(CalendarMath.plusMonthsOnDay(january, 1, 31)).isEqualTo(LocalDate.of(2020, 2, 29));
        assertThat(CalendarMath.plusMonthsOnDay(LocalDate.of(2021, 1, 1), 1, 30)).isEqualTo(LocalDate.of(2021, 2, 28));
        assertThat(CalendarMath.plusMonthsOnDay(LocalDate.of(2020, 10, 1), 1, 31)).isEqualTo(LocalDate.of(2020, 11, 30));
        assertThat(CalendarMath.plusMonthsOnDay(january, 3, 15)).isEqualTo(LocalDate.of(2020, 4, 15));
    }

    @Test
    void rollsDecemberIntoNextYear() {
        assertThat(CalendarMath.plusMonthsOnDay(LocalDate.of(2020, 12, 1), 1, 31)).isEqualTo(LocalDate.of(2021, 1, 31));
    }

    @Test
    void countsDaysAndComparesMonths() {
        assertThat(CalendarMath.daysBetween(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 4, 1))).isEqualTo(91);
        assertThat(CalendarMath.daysBetween(LocalDate.of(2020, 4, 1), LocalDate.of(2020, 1, 1))).isEqualTo(-91);
        assertThat(CalendarMath.isSameMonth(LocalDate.of(2020, 4, 1), LocalDate.of(2020, 4, 30))).isTrue();
        assertThat(CalendarMath.isSameMonth(LocalDate.of(2020, 4, 1), LocalDate.of(2021, 4, 1))).isFalse();
    }
}

package com.payshield.gleaner.domain.detection;

import java.util.Comparator;

/**
 * Position of an invoice within its quarter: month offset from the quarter start (0-2) and day of month.
 */
public record QuarterSlot(int monthOffset, int day) implements Comparable<QuarterSlot> {

    private static final Comparator<QuarterSlot> ORDER = Comparator
            .comparingInt(QuarterSlot::monthOffset)
            .thenComparingInt(QuarterSlot::day);

    @Override
    public int compareTo(QuarterSlot other) {
        return ORDER.compare(this, other);
    }
}

package com.payshield.gleaner.domain.detection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrequencyTableTest {

    @Test
    void picksMostFrequentKey() {
        FrequencyTable<Integer> table = new FrequencyTable<>();
        table.increment(20);
        table.increment(5);
        table.increment(5);

        assertThat(table.usualKey()).isEqualTo(5);
        assertThat(table.count(5)).isEqualTo(2);
        assertThat(table.count(7)).isZero();
    }

    @Test
    void breaksTiesWithSmallestKey() {
        FrequencyTable<Integer> table = new FrequencyTable<>();
        for (int day : new int[] {28, 10, 28, 10, 3}) {
            table.increment(day);
        }

        assertThat(table.usualKey()).isEqualTo(10);
    }

    @Test
    void ordersQuarterSlotsByMonthThenDay() {
        FrequencyTable<QuarterSlot> table = new FrequencyTable<>();
        table.increment(new QuarterSlot(2, 1));
        table.increment(new QuarterSlot(0, 27));

        assertThat(table.usualKey()).isEqualTo(new QuarterSlot(0, 27));
    }

    @Test
    void mergesCounts() {
        FrequencyTable<Integer> first = new FrequencyTable<>();
        first.increment(1);
        FrequencyTable<Integer> second = new FrequencyTable<>();
        second.increment(2);
        second.increment(2);

        first.addAll(second);

        assertThat(first.usualKey()).isEqualTo(2);
        assertThat(first.count(1)).isEqualTo(1);
    }

    @Test
    void emptyTableHasNoUsualKey() {
        FrequencyTable<Integer> table = new FrequencyTable<>();

        assertThat(table.isEmpty()).isTrue();
        assertThatThrownBy(table::usualKey).isInstanceOf(IllegalStateException.class);
    }
}

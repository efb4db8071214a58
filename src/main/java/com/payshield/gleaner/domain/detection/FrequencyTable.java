package com.payshield.gleaner.domain.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Occurrence counts per key, with a deterministic "most usual key" pick.
 */
public class FrequencyTable<K extends Comparable<? super K>> {

    private final Map<K, Integer> counts = new HashMap<>();

    public void increment(K key) {
        counts.merge(key, 1, Integer::sum);
    }

    public void addAll(FrequencyTable<K> other) {
        other.counts.forEach((key, count) -> counts.merge(key, count, Integer::sum));
    }

    public int count(K key) {
        return counts.getOrDefault(key, 0);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * The most frequent key. Among keys sharing the highest count the smallest one wins.
     *
     * @throws IllegalStateException if the table is empty
     */
    public K usualKey() {
        if (counts.isEmpty()) {
            throw new IllegalStateException("No keys recorded");
        }

        List<Map.Entry<K, Integer>> ordered = new ArrayList<>(counts.entrySet());
        ordered.sort(Map.Entry.<K, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<K, Integer>comparingByKey()));

        int mode = ordered.get(0).getValue();
        K usual = ordered.get(0).getKey();
        for (Map.Entry<K, Integer> entry : ordered) {
            if (entry.getValue() < mode) {
                break;
            }
            if (entry.getKey().compareTo(usual) < 0) {
                usual = entry.getKey();
            }
        }
        return usual;
    }
}

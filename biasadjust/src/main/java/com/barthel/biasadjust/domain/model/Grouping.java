package com.barthel.biasadjust.domain.model;

import com.barthel.biasadjust.domain.exception.GroupingNotSupportedException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Calendar key used to split a time axis into groups that are corrected separately.
 */
public enum Grouping {
    MONTH("time.month", LocalDate::getMonthValue),
    DAY_OF_YEAR("time.dayofyear", LocalDate::getDayOfYear),
    YEAR("time.year", LocalDate::getYear);

    private final String key;
    private final ToIntFunction<LocalDate> keyFunction;

    Grouping(String key, ToIntFunction<LocalDate> keyFunction) {
        this.key = key;
        this.keyFunction = keyFunction;
    }

    public String key() {
        return key;
    }

    /**
     * Indices of {@code dates} per calendar key, keys ascending, indices in time order.
     */
    public SortedMap<Integer, int[]> partition(List<LocalDate> dates) {
        return partitionByKey(dates, keyFunction::applyAsInt);
    }

    /**
     * Accepts {@code time.month}, {@code month}, {@code time.dayofyear}, {@code dayofyear},
     * {@code time.year} and {@code year}.
     */
    public static Grouping fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (Grouping grouping : values()) {
                if (grouping.key.equals(normalized) || grouping.key.equals("time." + normalized)) {
                    return grouping;
                }
            }
        }
        throw new GroupingNotSupportedException("Unknown group '" + key + "'. Available groups: "
                + Arrays.stream(values()).map(Grouping::key).toList());
    }

    public static <T, K extends Comparable<K>> SortedMap<K, int[]> partitionByKey(List<T> labels,
                                                                                Function<T, K> keyFunction) {
        SortedMap<K, List<Integer>> buckets = new TreeMap<>();
        for (int i = 0; i < labels.size(); i++) {
            buckets.computeIfAbsent(keyFunction.apply(labels.get(i)), k -> new ArrayList<>()).add(i);
        }
        SortedMap<K, int[]> partition = new TreeMap<>();
        buckets.forEach((k, indices) -> partition.put(k, indices.stream().mapToInt(Integer::intValue).toArray()));
        return partition;
    }
}

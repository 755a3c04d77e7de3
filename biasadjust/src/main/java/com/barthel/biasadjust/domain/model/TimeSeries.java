package com.barthel.biasadjust.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * Ordered samples (NaN allowed) with optional calendar labels, one label per sample.
 *
 * @param values the samples in time order
 * @param dates  calendar labels aligned 1:1 with {@code values}, or {@code null} when the
 *               series is never grouped
 */
public record TimeSeries(double[] values, List<LocalDate> dates) {
    public TimeSeries {
        if (values == null) {
            throw new IllegalArgumentException("Values are required");
        }
        if (dates != null && dates.size() != values.length) {
            throw new IllegalArgumentException("Got " + dates.size() + " dates for " + values.length + " values");
        }
        values = values.clone();
        dates = dates == null ? null : List.copyOf(dates);
    }

    public static TimeSeries of(double... values) {
        return new TimeSeries(values, null);
    }

    public int size() {
        return values.length;
    }

    public boolean hasDates() {
        return dates != null;
    }

    public SortedMap<Integer, int[]> partition(Grouping grouping) {
        if (dates == null) {
            throw new IllegalArgumentException("Grouping by " + grouping.key() + " requires dates");
        }
        return grouping.partition(dates);
    }

    public double[] select(int[] indices) {
        double[] selected = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = values[indices[i]];
        }
        return selected;
    }
}

package com.barthel.biasadjust.domain.math;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * NaN-ignoring summary statistics. Each returns NaN when every sample is NaN.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double nanMean(double[] values) {
        return StatUtils.mean(withoutNaN(values));
    }

    /**
     * Population standard deviation (divisor {@code n}).
     */
    public static double nanStd(double[] values) {
        return new StandardDeviation(false).evaluate(withoutNaN(values));
    }

    public static double nanMin(double[] values) {
        return StatUtils.min(withoutNaN(values));
    }

    public static double nanMax(double[] values) {
        return StatUtils.max(withoutNaN(values));
    }

    public static double[] shift(double[] values, double offset) {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] + offset;
        }
        return shifted;
    }

    public static double[] scale(double[] values, double factor) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factor;
        }
        return scaled;
    }

    private static double[] withoutNaN(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }
}

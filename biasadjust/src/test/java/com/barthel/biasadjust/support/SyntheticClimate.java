package com.barthel.biasadjust.support;

import com.barthel.biasadjust.application.service.BiasCorrectionServiceRouter;
import com.barthel.biasadjust.application.service.impl.DeltaMethodService;
import com.barthel.biasadjust.application.service.impl.LinearScalingService;
import com.barthel.biasadjust.application.service.impl.QuantileDeltaMappingService;
import com.barthel.biasadjust.application.service.impl.QuantileMappingService;
import com.barthel.biasadjust.application.service.impl.VarianceScalingService;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic daily temperature and precipitation fixtures on a 365-day calendar.
 */
public final class SyntheticClimate {

    private SyntheticClimate() {
    }

    public static List<LocalDate> noLeapDays(int startYear, int years) {
        List<LocalDate> days = new ArrayList<>(years * 365);
        LocalDate day = LocalDate.of(startYear, 1, 1);
        LocalDate end = LocalDate.of(startYear + years, 1, 1);
        while (day.isBefore(end)) {
            if (!(day.getMonth() == Month.FEBRUARY && day.getDayOfMonth() == 29)) {
                days.add(day);
            }
            day = day.plusDays(1);
        }
        return days;
    }

    /**
     * Seasonal cycle with an amplitude of {@code lat} K, noise and a slight warming trend.
     */
    public static double[] temperature(List<LocalDate> days, double lat, long seed) {
        Random random = new Random(seed);
        double[] values = new double[days.size()];
        for (int t = 0; t < values.length; t++) {
            double season = lat * Math.cos(2 * Math.PI * days.get(t).getDayOfYear() / 365.0);
            values[t] = -(season + 2 * random.nextDouble() + 0.1 * t / 365.0);
        }
        return values;
    }

    /**
     * Non-negative, seasonal, with roughly two dry days out of three.
     */
    public static double[] precipitation(List<LocalDate> days, long seed) {
        Random random = new Random(seed);
        double[] values = new double[days.size()];
        double max = 0;
        for (int t = 0; t < values.length; t++) {
            double season = Math.cos(2 * Math.PI * days.get(t).getDayOfYear() / 365.0);
            values[t] = random.nextDouble() < 0.65 ? 0.0 : season * season * random.nextDouble();
            max = Math.max(max, values[t]);
        }
        for (int t = 0; t < values.length; t++) {
            values[t] *= 0.0004 / max;
        }
        return values;
    }

    public static double[] plus(double[] values, double offset) {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] + offset;
        }
        return shifted;
    }

    public static double[] times(double[] values, double factor) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factor;
        }
        return scaled;
    }

    public static double[] range(double from, int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = from + i;
        }
        return values;
    }

    public static double rmse(double[] actual, double[] expected) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double diff = actual[i] - expected[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum / actual.length);
    }

    /**
     * Temperature-like data: the model runs 2 K cold in both periods and the scenario
     * period is independent noise around the same climate.
     */
    public static Scenario additiveScenario() {
        List<LocalDate> historical = noLeapDays(1971, 30);
        List<LocalDate> future = noLeapDays(2041, 30);
        double[] obs = temperature(historical, 10, 1);
        double[] obsp = temperature(future, 10, 2);
        return new Scenario(obs, plus(obs, -2), plus(obsp, -2), obsp, historical, future);
    }

    /**
     * Precipitation-like data: the model rains half as much as observed and the scenario
     * period is 20 % wetter.
     */
    public static Scenario multiplicativeScenario() {
        List<LocalDate> historical = noLeapDays(1971, 30);
        List<LocalDate> future = noLeapDays(2041, 30);
        double[] precipitation = precipitation(historical, 3);
        return new Scenario(precipitation, times(precipitation, 0.5), times(precipitation, 0.6),
                times(precipitation, 1.2), historical, future);
    }

    public record Scenario(double[] obs, double[] simh, double[] simp, double[] obsp,
                           List<LocalDate> historical, List<LocalDate> future) {

        public double uncorrectedError() {
            return rmse(simp, obsp);
        }
    }

    public static BiasCorrectionServiceRouter router() {
        LinearScalingService linearScaling = new LinearScalingService();
        return new BiasCorrectionServiceRouter(List.of(
                linearScaling,
                new VarianceScalingService(linearScaling),
                new DeltaMethodService(),
                new QuantileMappingService(),
                new QuantileDeltaMappingService()));
    }
}

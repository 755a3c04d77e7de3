package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.domain.math.EmpiricalDistributions;
import com.barthel.biasadjust.domain.math.SeriesStatistics;

import java.util.Optional;

/**
 * Bin edges derived from the value range of the control period.
 */
final class ControlPeriodBins {

    private ControlPeriodBins() {
    }

    static double globalMin(double[] obs, double[] simh) {
        return Math.min(SeriesStatistics.nanMin(obs), SeriesStatistics.nanMin(simh));
    }

    static double globalMax(double[] obs, double[] simh) {
        return Math.max(SeriesStatistics.nanMax(obs), SeriesStatistics.nanMax(simh));
    }

    /**
     * {@code nQuantiles} bins of equal width over {@code [min, max]}; empty when the range
     * is NaN or collapses to a point.
     */
    static Optional<double[]> over(double min, double max, int nQuantiles) {
        if (EmpiricalDistributions.nanOrEqual(max, min)) {
            return Optional.empty();
        }
        return usable(EmpiricalDistributions.bins(min, max, nQuantiles));
    }

    /**
     * Bins of width {@code max / nQuantiles} starting at {@code min}, used for ratio variables.
     */
    static Optional<double[]> fromOrigin(double min, double max, int nQuantiles) {
        if (EmpiricalDistributions.nanOrEqual(max, min)) {
            return Optional.empty();
        }
        double width = max / nQuantiles;
        return usable(EmpiricalDistributions.bins(min, max + width, width));
    }

    private static Optional<double[]> usable(double[] xbins) {
        return xbins.length < 2 ? Optional.empty() : Optional.of(xbins);
    }
}

package com.barthel.biasadjust.domain.model;

import com.barthel.biasadjust.domain.math.EmpiricalDistributions;

/**
 * Histogram of a series over fixed bin edges.
 *
 * @param xbins bin edges, ascending
 * @param pdf   samples per bin, {@code xbins.length - 1} entries
 * @param cdf   running total of {@code pdf} with a leading 0, {@code xbins.length} entries
 */
public record EmpiricalDistribution(double[] xbins, double[] pdf, double[] cdf) {
    public EmpiricalDistribution {
        if (xbins == null || cdf == null || cdf.length != xbins.length) {
            throw new IllegalArgumentException("CDF and bin edges must have the same length");
        }
    }

    public static EmpiricalDistribution of(double[] values, double[] xbins) {
        double[] pdf = EmpiricalDistributions.pdf(values, xbins);
        return new EmpiricalDistribution(xbins, pdf, EmpiricalDistributions.cumulate(pdf));
    }

    /**
     * Quantile mass of each probe, clamped to the CDF's end values outside the bins.
     */
    public double[] quantileMass(double[] probes) {
        return EmpiricalDistributions.interpolate(probes, xbins, cdf);
    }

    /**
     * Quantile mass of each probe with explicit fill values below and above the bins.
     */
    public double[] quantileMass(double[] probes, double left, double right) {
        return EmpiricalDistributions.interpolate(probes, xbins, cdf, left, right);
    }

    /**
     * Values whose quantile mass is {@code masses}.
     */
    public double[] invert(double[] masses) {
        return EmpiricalDistributions.invert(cdf, masses, xbins);
    }

    public double total() {
        return cdf.length == 0 ? 0.0 : cdf[cdf.length - 1];
    }
}

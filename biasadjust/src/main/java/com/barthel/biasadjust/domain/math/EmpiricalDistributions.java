package com.barthel.biasadjust.domain.math;

/**
 * Histogram, CDF and piecewise-linear interpolation primitives shared by the
 * distribution-based correctors.
 */
public final class EmpiricalDistributions {

    private EmpiricalDistributions() {
    }

    /**
     * Evenly spaced edges {@code start, start + step, ...} strictly below {@code stop}.
     * Returns an empty array when the step is not positive and finite.
     */
    public static double[] bins(double start, double stop, double step) {
        if (!(step > 0) || Double.isInfinite(step) || Double.isNaN(start) || Double.isNaN(stop)) {
            return new double[0];
        }
        double count = Math.ceil((stop - start) / step);
        if (!(count > 0) || count > Integer.MAX_VALUE - 8) {
            return new double[0];
        }
        double delta = (start + step) - start;
        double[] edges = new double[(int) count];
        for (int i = 0; i < edges.length; i++) {
            edges[i] = start + i * delta;
        }
        return edges;
    }

    /**
     * Bin edges spanning {@code [min, max]} with width {@code |max - min| / nQuantiles}.
     */
    public static double[] bins(double min, double max, int nQuantiles) {
        double width = Math.abs(max - min) / nQuantiles;
        return bins(min, max + width, width);
    }

    /**
     * Samples per bin. Bins are half-open except the last one, which also holds its
     * upper edge. NaN and out-of-range samples are not counted.
     */
    public static double[] pdf(double[] values, double[] xbins) {
        if (xbins.length < 2) {
            return new double[0];
        }
        double[] counts = new double[xbins.length - 1];
        double first = xbins[0];
        double last = xbins[xbins.length - 1];
        for (double value : values) {
            if (Double.isNaN(value) || value < first || value > last) {
                continue;
            }
            int bin = value == last ? counts.length - 1 : floorIndex(xbins, value);
            counts[bin]++;
        }
        return counts;
    }

    /**
     * Running total of {@code pdf} prefixed with 0, one entry per bin edge.
     */
    public static double[] cumulate(double[] pdf) {
        double[] cdf = new double[pdf.length + 1];
        for (int i = 0; i < pdf.length; i++) {
            cdf[i + 1] = cdf[i] + pdf[i];
        }
        return cdf;
    }

    public static double[] cdf(double[] values, double[] xbins) {
        if (xbins.length == 0) {
            return new double[0];
        }
        return cumulate(pdf(values, xbins));
    }

    /**
     * Inverse of {@code baseCdf}: maps each quantile mass in {@code probes} back onto
     * {@code xbins}, clamping outside the CDF's range.
     */
    public static double[] invert(double[] baseCdf, double[] probes, double[] xbins) {
        return interpolate(probes, baseCdf, xbins);
    }

    public static double[] interpolate(double[] x, double[] xp, double[] fp) {
        requireTable(xp, fp);
        return interpolate(x, xp, fp, fp[0], fp[fp.length - 1]);
    }

    /**
     * Piecewise-linear interpolation of {@code x} on the table {@code (xp, fp)}, where
     * {@code xp} is non-decreasing. Probes below {@code xp[0]} yield {@code left}, above the
     * last abscissa {@code right}; NaN probes yield NaN. Within a run of equal abscissas the
     * last one wins.
     */
    public static double[] interpolate(double[] x, double[] xp, double[] fp, double left, double right) {
        requireTable(xp, fp);
        int n = xp.length;
        double[] result = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double probe = x[i];
            if (Double.isNaN(probe)) {
                result[i] = probe;
            } else if (probe > xp[n - 1]) {
                result[i] = right;
            } else if (probe < xp[0]) {
                result[i] = left;
            } else {
                int j = floorIndex(xp, probe);
                if (j == n - 1 || xp[j] == probe) {
                    result[i] = fp[j];
                } else {
                    double slope = (fp[j + 1] - fp[j]) / (xp[j + 1] - xp[j]);
                    double value = slope * (probe - xp[j]) + fp[j];
                    if (Double.isNaN(value)) {
                        value = slope * (probe - xp[j + 1]) + fp[j + 1];
                        if (Double.isNaN(value) && fp[j] == fp[j + 1]) {
                            value = fp[j];
                        }
                    }
                    result[i] = value;
                }
            }
        }
        return result;
    }

    /**
     * @return {@code true} if either bound is NaN or both are equal
     */
    public static boolean nanOrEqual(double a, double b) {
        return Double.isNaN(a) || Double.isNaN(b) || a == b;
    }

    // last index j with sorted[j] <= value; -1 if value < sorted[0]
    private static int floorIndex(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo - 1;
    }

    private static void requireTable(double[] xp, double[] fp) {
        if (xp.length == 0 || xp.length != fp.length) {
            throw new IllegalArgumentException("Interpolation table needs matching, non-empty abscissas and ordinates");
        }
    }
}

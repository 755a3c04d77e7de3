package com.barthel.biasadjust.domain.math;

/**
 * Division and clamping rules that keep multiplicative corrections bounded.
 */
public final class ScalingFactors {

    private ScalingFactors() {
    }

    /**
     * {@code numerator / denominator}, except that an infinite quotient becomes
     * {@code sign(numerator) * |maxScalingFactor|} and an undefined one becomes 0.
     */
    public static double divide(double numerator, double denominator, double maxScalingFactor) {
        double quotient = numerator / denominator;
        if (Double.isInfinite(quotient)) {
            double sign = denominator == 0.0 ? Math.signum(numerator) : Math.signum(quotient);
            return sign * Math.abs(maxScalingFactor);
        }
        if (Double.isNaN(quotient)) {
            return 0.0;
        }
        return quotient;
    }

    public static double[] divide(double[] numerators, double[] denominators, double maxScalingFactor) {
        if (numerators.length != denominators.length) {
            throw new IllegalArgumentException("Cannot divide " + numerators.length + " by " + denominators.length + " values");
        }
        double[] quotients = new double[numerators.length];
        for (int i = 0; i < quotients.length; i++) {
            quotients[i] = divide(numerators[i], denominators[i], maxScalingFactor);
        }
        return quotients;
    }

    /**
     * Bound {@code factor} to {@code [-|maxScalingFactor|, |maxScalingFactor|]}.
     */
    public static double clamp(double factor, double maxScalingFactor) {
        double bound = Math.abs(maxScalingFactor);
        if (factor > bound) {
            return bound;
        }
        if (factor < -bound) {
            return -bound;
        }
        return factor;
    }

    /**
     * Guarded and clamped ratio of two summary statistics.
     */
    public static double of(double numerator, double denominator, double maxScalingFactor) {
        return clamp(divide(numerator, denominator, maxScalingFactor), maxScalingFactor);
    }
}

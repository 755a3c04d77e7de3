package com.barthel.biasadjust.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Options recognised by the correctors. Unset options fall back to their defaults;
 * {@code nQuantiles} has none and is only required by distribution-based methods.
 */
@Getter
@ToString
public final class AdjustmentParameters {

    public static final double DEFAULT_MAX_SCALING_FACTOR = 10.0;
    /** Upper bound of {@code nQuantiles}; each distribution holds a few arrays of this length. */
    public static final int MAX_N_QUANTILES = 1_000_000;

    private final Kind kind;
    private final Integer nQuantiles;
    private final Grouping grouping;
    private final double maxScalingFactor;
    private final Double globalMin;
    private final Double globalMax;
    private final Double valMin;
    private final Double valMax;
    private final int workers;

    @Builder(toBuilder = true)
    private AdjustmentParameters(Kind kind,
                                 Integer nQuantiles,
                                 Grouping grouping,
                                 Double maxScalingFactor,
                                 Double globalMin,
                                 Double globalMax,
                                 Double valMin,
                                 Double valMax,
                                 Integer workers) {
        if (nQuantiles != null && nQuantiles <= 0) {
            throw new IllegalArgumentException("'n_quantiles' must be a positive integer, got " + nQuantiles);
        }
        if (nQuantiles != null && nQuantiles > MAX_N_QUANTILES) {
            throw new IllegalArgumentException("'n_quantiles' must not exceed " + MAX_N_QUANTILES + ", got " + nQuantiles);
        }
        if (maxScalingFactor != null && !(maxScalingFactor > 0)) {
            throw new IllegalArgumentException("'max_scaling_factor' must be positive, got " + maxScalingFactor);
        }
        if (workers != null && workers < 1) {
            throw new IllegalArgumentException("'workers' must be at least 1, got " + workers);
        }
        this.kind = kind != null ? kind : Kind.ADDITIVE;
        this.nQuantiles = nQuantiles;
        this.grouping = grouping;
        this.maxScalingFactor = maxScalingFactor != null ? maxScalingFactor : DEFAULT_MAX_SCALING_FACTOR;
        this.globalMin = globalMin;
        this.globalMax = globalMax;
        this.valMin = valMin;
        this.valMax = valMax;
        this.workers = workers != null ? workers : 1;
    }

    public static AdjustmentParameters defaults() {
        return builder().build();
    }

    /**
     * @return the bin count
     * @throws IllegalArgumentException if none was configured
     */
    public int requireQuantiles() {
        if (nQuantiles == null) {
            throw new IllegalArgumentException("'n_quantiles' is required for distribution-based methods");
        }
        return nQuantiles;
    }

    public boolean isGrouped() {
        return grouping != null;
    }
}

package com.barthel.biasadjust.config;

import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Service-wide defaults, bound from the {@code biasadjust.*} properties.
 *
 * @param maxScalingFactor bound of multiplicative scaling factors
 * @param defaultQuantiles bin count used when a request names none
 * @param maxQuantiles     largest bin count a request may ask for
 * @param workers          default parallelism of grid adjustments, 1 runs sequentially
 * @param version          reported in result attributes
 */
@ConfigurationProperties(prefix = "biasadjust")
public record BiasAdjustProperties(
        @DefaultValue("10") double maxScalingFactor,
        @DefaultValue("100") int defaultQuantiles,
        @DefaultValue("100000") int maxQuantiles,
        @DefaultValue("1") int workers,
        @DefaultValue("dev") String version) {

    public BiasAdjustProperties {
        if (!(maxScalingFactor > 0)) {
            throw new IllegalArgumentException("biasadjust.max-scaling-factor must be positive");
        }
        if (defaultQuantiles < 1) {
            throw new IllegalArgumentException("biasadjust.default-quantiles must be positive");
        }
        if (maxQuantiles < defaultQuantiles || maxQuantiles > AdjustmentParameters.MAX_N_QUANTILES) {
            throw new IllegalArgumentException("biasadjust.max-quantiles must lie between default-quantiles and "
                    + AdjustmentParameters.MAX_N_QUANTILES);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("biasadjust.workers must be at least 1");
        }
    }
}

package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.application.port.in.BiasCorrectionUseCase;
import com.barthel.biasadjust.domain.math.ScalingFactors;
import com.barthel.biasadjust.domain.math.SeriesStatistics;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.EmpiricalDistribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Quantile mapping: reads each {@code simp} value's quantile mass off the {@code simh}
 * distribution and returns the {@code obs} value of equal mass. Results stay within the
 * observed range of the control period.
 */
@Slf4j
@Service
public class QuantileMappingService implements BiasCorrectionUseCase {

    @Override
    public double[] correct(AdjustmentMethod method, double[] obs, double[] simh, double[] simp,
                            AdjustmentParameters parameters) {
        int nQuantiles = parameters.requireQuantiles();

        Optional<double[]> bins = ControlPeriodBins.over(
                ControlPeriodBins.globalMin(obs, simh), ControlPeriodBins.globalMax(obs, simh), nQuantiles);
        if (bins.isEmpty()) {
            log.debug("Control period range is degenerate, returning simp unchanged");
            return simp.clone();
        }
        double[] xbins = bins.get();
        EmpiricalDistribution obsDistribution = EmpiricalDistribution.of(obs, xbins);
        EmpiricalDistribution simhDistribution = EmpiricalDistribution.of(simh, xbins);

        return switch (parameters.getKind()) {
            case ADDITIVE -> obsDistribution.invert(simhDistribution.quantileMass(simp));
            case MULTIPLICATIVE -> multiplicative(obsDistribution, simhDistribution, simh, simp, parameters);
        };
    }

    // simp is rescaled to the long-term mean of simh before the lookup and the mean ratio
    // is restored afterwards
    private double[] multiplicative(EmpiricalDistribution obsDistribution,
                                    EmpiricalDistribution simhDistribution,
                                    double[] simh, double[] simp, AdjustmentParameters parameters) {
        double maxScalingFactor = parameters.getMaxScalingFactor();
        double simhMean = SeriesStatistics.nanMean(simh);
        double simpMean = SeriesStatistics.nanMean(simp);

        double[] proxy = SeriesStatistics.scale(simp, ScalingFactors.divide(simhMean, simpMean, maxScalingFactor));
        double[] epsilon = simhDistribution.quantileMass(proxy,
                parameters.getValMin() != null ? parameters.getValMin() : 0.0,
                parameters.getValMax() != null ? parameters.getValMax() : simhDistribution.total());
        return SeriesStatistics.scale(obsDistribution.invert(epsilon),
                ScalingFactors.divide(simpMean, simhMean, maxScalingFactor));
    }

    @Override
    public boolean supports(AdjustmentMethod method) {
        return method == AdjustmentMethod.QUANTILE_MAPPING;
    }
}

package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.application.port.in.BiasCorrectionUseCase;
import com.barthel.biasadjust.domain.math.ScalingFactors;
import com.barthel.biasadjust.domain.math.SeriesStatistics;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import org.springframework.stereotype.Service;

/**
 * Delta (change) method: perturbs {@code obs} by the modelled change between the control
 * and the scenario period. The result therefore follows the shape of {@code obs}, which
 * must be as long as {@code simp}.
 */
@Service
public class DeltaMethodService implements BiasCorrectionUseCase {

    @Override
    public double[] correct(AdjustmentMethod method, double[] obs, double[] simh, double[] simp,
                            AdjustmentParameters parameters) {
        if (obs.length != simp.length) {
            throw new IllegalArgumentException("delta_method needs obs and simp of equal length, got "
                    + obs.length + " and " + simp.length);
        }
        double simpMean = SeriesStatistics.nanMean(simp);
        double simhMean = SeriesStatistics.nanMean(simh);
        return switch (parameters.getKind()) {
            case ADDITIVE -> SeriesStatistics.shift(obs, simpMean - simhMean);
            case MULTIPLICATIVE -> SeriesStatistics.scale(obs,
                    ScalingFactors.of(simpMean, simhMean, parameters.getMaxScalingFactor()));
        };
    }

    @Override
    public boolean supports(AdjustmentMethod method) {
        return method == AdjustmentMethod.DELTA_METHOD;
    }
}

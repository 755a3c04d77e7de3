package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.application.port.in.BiasCorrectionUseCase;
import com.barthel.biasadjust.domain.math.ScalingFactors;
import com.barthel.biasadjust.domain.math.SeriesStatistics;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Kind;
import org.springframework.stereotype.Service;

/**
 * Linear scaling: shifts (additive) or scales (multiplicative) {@code simp} by the bias
 * between the long-term means of {@code obs} and {@code simh}.
 */
@Service
public class LinearScalingService implements BiasCorrectionUseCase {

    @Override
    public double[] correct(AdjustmentMethod method, double[] obs, double[] simh, double[] simp,
                            AdjustmentParameters parameters) {
        return correct(obs, simh, simp, parameters.getKind(), parameters.getMaxScalingFactor());
    }

    double[] correct(double[] obs, double[] simh, double[] simp, Kind kind, double maxScalingFactor) {
        double obsMean = SeriesStatistics.nanMean(obs);
        double simhMean = SeriesStatistics.nanMean(simh);
        return switch (kind) {
            case ADDITIVE -> SeriesStatistics.shift(simp, obsMean - simhMean);
            case MULTIPLICATIVE -> SeriesStatistics.scale(simp,
                    ScalingFactors.of(obsMean, simhMean, maxScalingFactor));
        };
    }

    @Override
    public boolean supports(AdjustmentMethod method) {
        return method == AdjustmentMethod.LINEAR_SCALING;
    }
}

package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.application.port.in.BiasCorrectionUseCase;
import com.barthel.biasadjust.domain.exception.KindNotSupportedException;
import com.barthel.biasadjust.domain.math.ScalingFactors;
import com.barthel.biasadjust.domain.math.SeriesStatistics;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Kind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Variance scaling: linear scaling followed by matching the standard deviation of the
 * mean-centred series to the one of {@code obs}. Additive only.
 */
@Service
@RequiredArgsConstructor
public class VarianceScalingService implements BiasCorrectionUseCase {

    private final LinearScalingService linearScaling;

    @Override
    public double[] correct(AdjustmentMethod method, double[] obs, double[] simh, double[] simp,
                            AdjustmentParameters parameters) {
        if (parameters.getKind() != Kind.ADDITIVE) {
            throw new KindNotSupportedException(parameters.getKind(), AdjustmentMethod.VARIANCE_SCALING,
                    List.of(Kind.ADDITIVE));
        }
        double maxScalingFactor = parameters.getMaxScalingFactor();

        double[] scaledSimh = linearScaling.correct(obs, simh, simh, Kind.ADDITIVE, maxScalingFactor);
        double[] scaledSimp = linearScaling.correct(obs, simh, simp, Kind.ADDITIVE, maxScalingFactor);

        double[] centredSimh = SeriesStatistics.shift(scaledSimh, -SeriesStatistics.nanMean(scaledSimh));
        double scaledSimpMean = SeriesStatistics.nanMean(scaledSimp);
        double[] centredSimp = SeriesStatistics.shift(scaledSimp, -scaledSimpMean);

        double factor = ScalingFactors.of(SeriesStatistics.nanStd(obs), SeriesStatistics.nanStd(centredSimh),
                maxScalingFactor);
        return SeriesStatistics.shift(SeriesStatistics.scale(centredSimp, factor), scaledSimpMean);
    }

    @Override
    public boolean supports(AdjustmentMethod method) {
        return method == AdjustmentMethod.VARIANCE_SCALING;
    }
}

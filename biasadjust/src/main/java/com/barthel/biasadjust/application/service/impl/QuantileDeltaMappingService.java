package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.application.port.in.BiasCorrectionUseCase;
import com.barthel.biasadjust.domain.math.ScalingFactors;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.EmpiricalDistribution;
import com.barthel.biasadjust.domain.model.Kind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Quantile delta mapping: maps each {@code simp} value through its own quantile mass onto
 * {@code obs} and re-applies the modelled change between {@code simh} and {@code simp} at
 * that quantile.
 */
@Slf4j
@Service
public class QuantileDeltaMappingService implements BiasCorrectionUseCase {

    @Override
    public double[] correct(AdjustmentMethod method, double[] obs, double[] simh, double[] simp,
                            AdjustmentParameters parameters) {
        int nQuantiles = parameters.requireQuantiles();
        Kind kind = parameters.getKind();

        double globalMax = parameters.getGlobalMax() != null
                ? parameters.getGlobalMax()
                : ControlPeriodBins.globalMax(obs, simh);
        Optional<double[]> bins;
        if (kind == Kind.ADDITIVE) {
            double globalMin = parameters.getGlobalMin() != null
                    ? parameters.getGlobalMin()
                    : ControlPeriodBins.globalMin(obs, simh);
            bins = ControlPeriodBins.over(globalMin, globalMax, nQuantiles);
        } else {
            double globalMin = parameters.getGlobalMin() != null ? parameters.getGlobalMin() : 0.0;
            bins = ControlPeriodBins.fromOrigin(globalMin, globalMax, nQuantiles);
        }
        if (bins.isEmpty()) {
            log.debug("Bin range is degenerate, returning simp unchanged");
            return simp.clone();
        }
        double[] xbins = bins.get();

        EmpiricalDistribution obsDistribution = EmpiricalDistribution.of(obs, xbins);
        EmpiricalDistribution simhDistribution = EmpiricalDistribution.of(simh, xbins);
        EmpiricalDistribution simpDistribution = EmpiricalDistribution.of(simp, xbins);

        double[] epsilon = simpDistribution.quantileMass(simp);
        double[] corrected = obsDistribution.invert(epsilon);
        double[] simhAtEpsilon = simhDistribution.invert(epsilon);

        double[] result = new double[simp.length];
        for (int i = 0; i < result.length; i++) {
            if (kind == Kind.ADDITIVE) {
                result[i] = corrected[i] + (simp[i] - simhAtEpsilon[i]);
            } else {
                result[i] = corrected[i]
                        * ScalingFactors.divide(simp[i], simhAtEpsilon[i], parameters.getMaxScalingFactor());
            }
        }
        return result;
    }

    @Override
    public boolean supports(AdjustmentMethod method) {
        return method == AdjustmentMethod.QUANTILE_DELTA_MAPPING;
    }
}

package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.domain.math.ScalingFactors;
import com.barthel.biasadjust.domain.math.SeriesStatistics;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.EmpiricalDistribution;
import com.barthel.biasadjust.domain.model.Grouping;
import com.barthel.biasadjust.domain.model.Kind;
import com.barthel.biasadjust.domain.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Detrended quantile mapping. Within every calendar month, {@code simp} is moved onto the
 * long-term monthly mean of {@code simh} (shifted or scaled depending on the kind), mapped
 * through the control period distributions and moved back afterwards, so values outside
 * the historical range keep their trend.
 */
@Slf4j
@Service
public class DetrendedQuantileMappingService {

    public double[] correct(TimeSeries obs, TimeSeries simh, TimeSeries simp, AdjustmentParameters parameters) {
        int nQuantiles = parameters.requireQuantiles();
        if (!simh.hasDates() || !simp.hasDates()) {
            throw new IllegalArgumentException("detrended_quantile_mapping needs dated simh and simp series");
        }

        Optional<double[]> bins = ControlPeriodBins.over(
                ControlPeriodBins.globalMin(obs.values(), simh.values()),
                ControlPeriodBins.globalMax(obs.values(), simh.values()),
                nQuantiles);
        if (bins.isEmpty()) {
            log.debug("Control period range is degenerate, returning simp unchanged");
            return simp.values().clone();
        }
        double[] xbins = bins.get();
        EmpiricalDistribution obsDistribution = EmpiricalDistribution.of(obs.values(), xbins);
        EmpiricalDistribution simhDistribution = EmpiricalDistribution.of(simh.values(), xbins);

        SortedMap<Integer, int[]> simhMonths = simh.partition(Grouping.MONTH);
        double[] result = new double[simp.size()];
        for (Map.Entry<Integer, int[]> month : simp.partition(Grouping.MONTH).entrySet()) {
            int[] simhIndices = simhMonths.get(month.getKey());
            if (simhIndices == null) {
                throw new IllegalArgumentException("simh has no values for month " + month.getKey());
            }
            double[] monthSimp = simp.select(month.getValue());
            double simhMean = SeriesStatistics.nanMean(simh.select(simhIndices));
            double simpMean = SeriesStatistics.nanMean(monthSimp);

            double[] corrected = parameters.getKind() == Kind.ADDITIVE
                    ? additive(obsDistribution, simhDistribution, monthSimp, simhMean, simpMean)
                    : multiplicative(obsDistribution, simhDistribution, monthSimp, simhMean, simpMean, parameters);

            int[] indices = month.getValue();
            for (int i = 0; i < indices.length; i++) {
                result[indices[i]] = corrected[i];
            }
        }
        return result;
    }

    private double[] additive(EmpiricalDistribution obsDistribution, EmpiricalDistribution simhDistribution,
                              double[] monthSimp, double simhMean, double simpMean) {
        double[] epsilon = simhDistribution.quantileMass(SeriesStatistics.shift(monthSimp, simhMean - simpMean));
        return SeriesStatistics.shift(obsDistribution.invert(epsilon), simpMean - simhMean);
    }

    private double[] multiplicative(EmpiricalDistribution obsDistribution, EmpiricalDistribution simhDistribution,
                                    double[] monthSimp, double simhMean, double simpMean,
                                    AdjustmentParameters parameters) {
        double maxScalingFactor = parameters.getMaxScalingFactor();
        double[] detrended = SeriesStatistics.scale(monthSimp,
                ScalingFactors.divide(simhMean, simpMean, maxScalingFactor));
        double[] epsilon = simhDistribution.quantileMass(detrended,
                parameters.getValMin() != null ? parameters.getValMin() : 0.0,
                parameters.getValMax() != null ? parameters.getValMax() : simhDistribution.total());
        return SeriesStatistics.scale(obsDistribution.invert(epsilon),
                ScalingFactors.divide(simpMean, simhMean, maxScalingFactor));
    }
}

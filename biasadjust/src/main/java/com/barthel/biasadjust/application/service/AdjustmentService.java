package com.barthel.biasadjust.application.service;

import com.barthel.biasadjust.application.port.in.AdjustUseCase;
import com.barthel.biasadjust.application.port.in.DetrendedQuantileMappingUseCase;
import com.barthel.biasadjust.application.service.impl.DetrendedQuantileMappingService;
import com.barthel.biasadjust.domain.exception.GroupingNotSupportedException;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.AdjustmentResult;
import com.barthel.biasadjust.domain.model.Grid;
import com.barthel.biasadjust.domain.model.GridAdjustmentResult;
import com.barthel.biasadjust.domain.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point validating a request and handing it to the grouping or grid layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdjustmentService implements AdjustUseCase, DetrendedQuantileMappingUseCase {

    private final GroupedCorrectionService groupedCorrection;
    private final GridAdjustmentService gridAdjustment;
    private final DetrendedQuantileMappingService detrendedQuantileMapping;
    private final ResultAttributes resultAttributes;

    @Override
    public AdjustmentResult adjust(AdjustmentMethod method, TimeSeries obs, TimeSeries simh, TimeSeries simp,
                                   AdjustmentParameters parameters) {
        validate(method, parameters);
        requirePresent(obs, simh, simp);
        log.info("Adjusting {} samples with {} (kind={}, group={})", simp.size(), method.methodName(),
                parameters.getKind().symbol(), groupKey(parameters));

        double[] values = groupedCorrection.apply(method, obs, simh, simp, parameters);
        return new AdjustmentResult(method, values, resultAttributes.describe(method, parameters));
    }

    @Override
    public GridAdjustmentResult adjust(AdjustmentMethod method, Grid obs, Grid simh, Grid simp,
                                       AdjustmentParameters parameters) {
        validate(method, parameters);
        requirePresent(obs, simh, simp);
        log.info("Adjusting grid ({}, {}, {}) with {} (kind={}, group={}, workers={})",
                simp.latCount(), simp.lonCount(), simp.timeCount(), method.methodName(),
                parameters.getKind().symbol(), groupKey(parameters), parameters.getWorkers());

        double[][][] values = gridAdjustment.adjust(method, obs, simh, simp, parameters);
        return new GridAdjustmentResult(method, values, resultAttributes.describe(method, parameters));
    }

    @Override
    public AdjustmentResult adjustDetrended(TimeSeries obs, TimeSeries simh, TimeSeries simp,
                                            AdjustmentParameters parameters) {
        requirePresent(obs, simh, simp);
        if (parameters.isGrouped()) {
            throw new GroupingNotSupportedException(
                    "detrended_quantile_mapping always groups by month; 'group' must not be set");
        }
        parameters.requireQuantiles();
        log.info("Adjusting {} samples with {} (kind={})", simp.size(),
                AdjustmentMethod.DETRENDED_QUANTILE_MAPPING.methodName(), parameters.getKind().symbol());

        double[] values = detrendedQuantileMapping.correct(obs, simh, simp, parameters);
        return new AdjustmentResult(AdjustmentMethod.DETRENDED_QUANTILE_MAPPING, values,
                resultAttributes.describe(AdjustmentMethod.DETRENDED_QUANTILE_MAPPING, parameters));
    }

    @Override
    public List<String> availableMethods() {
        return AdjustmentMethod.names();
    }

    private void validate(AdjustmentMethod method, AdjustmentParameters parameters) {
        if (method == null) {
            throw new IllegalArgumentException("Method is required");
        }
        if (method == AdjustmentMethod.DETRENDED_QUANTILE_MAPPING) {
            throw new IllegalArgumentException("This function is not available for detrended quantile mapping."
                    + " Please use the dedicated detrended quantile mapping entry point.");
        }
        if (method.isDistributionBased()) {
            if (parameters.isGrouped()) {
                throw new GroupingNotSupportedException("Can't use group for distribution based methods.");
            }
            parameters.requireQuantiles();
        }
    }

    private static void requirePresent(Object obs, Object simh, Object simp) {
        if (obs == null || simh == null || simp == null) {
            throw new IllegalArgumentException("obs, simh and simp are required");
        }
    }

    private static String groupKey(AdjustmentParameters parameters) {
        return parameters.isGrouped() ? parameters.getGrouping().key() : "none";
    }
}

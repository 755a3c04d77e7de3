package com.barthel.biasadjust.adapter.in.web;

import com.barthel.biasadjust.adapter.in.web.dto.AdjustmentRequestDto;
import com.barthel.biasadjust.adapter.in.web.dto.GridAdjustmentRequestDto;
import com.barthel.biasadjust.config.BiasAdjustProperties;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Grid;
import com.barthel.biasadjust.domain.model.Grouping;
import com.barthel.biasadjust.domain.model.Kind;
import com.barthel.biasadjust.domain.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Translates request bodies into domain values, filling in service defaults.
 */
@Component
@RequiredArgsConstructor
public class AdjustmentRequestMapper {

    private final BiasAdjustProperties properties;

    public AdjustmentParameters toParameters(AdjustmentRequestDto request, boolean distributionBased) {
        return parameters(request.kind(), request.nQuantiles(), request.group(), request.maxScalingFactor(),
                request.globalMin(), request.globalMax(), request.valMin(), request.valMax(), null,
                distributionBased);
    }

    public AdjustmentParameters toParameters(GridAdjustmentRequestDto request, boolean distributionBased) {
        return parameters(request.kind(), request.nQuantiles(), request.group(), request.maxScalingFactor(),
                request.globalMin(), request.globalMax(), request.valMin(), request.valMax(), request.workers(),
                distributionBased);
    }

    public TimeSeries toSeries(String name, double[] values, List<LocalDate> dates) {
        if (values == null) {
            throw new IllegalArgumentException("'" + name + "' is required");
        }
        return new TimeSeries(values, dates);
    }

    public Grid toGrid(String name, double[][][] values, List<LocalDate> dates) {
        if (values == null) {
            throw new IllegalArgumentException("'" + name + "' is required");
        }
        return new Grid(values, dates);
    }

    private AdjustmentParameters parameters(String kind, Integer nQuantiles, String group, Double maxScalingFactor,
                                            Double globalMin, Double globalMax, Double valMin, Double valMax,
                                            Integer workers, boolean distributionBased) {
        if (nQuantiles != null && nQuantiles > properties.maxQuantiles()) {
            throw new IllegalArgumentException("'nQuantiles' must not exceed " + properties.maxQuantiles()
                    + ", got " + nQuantiles);
        }
        Integer quantiles = nQuantiles;
        if (quantiles == null && distributionBased) {
            quantiles = properties.defaultQuantiles();
        }
        return AdjustmentParameters.builder()
                .kind(kind == null ? Kind.ADDITIVE : Kind.fromAlias(kind))
                .nQuantiles(quantiles)
                .grouping(group == null || group.isBlank() ? null : Grouping.fromKey(group))
                .maxScalingFactor(maxScalingFactor != null ? maxScalingFactor : properties.maxScalingFactor())
                .globalMin(globalMin)
                .globalMax(globalMax)
                .valMin(valMin)
                .valMax(valMax)
                .workers(workers != null ? workers : properties.workers())
                .build();
    }
}

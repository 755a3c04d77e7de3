package com.barthel.biasadjust.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Request body for adjusting a single series. Dates are only needed when grouping or
 * for detrended quantile mapping.
 */
public record AdjustmentRequestDto(
        String method,
        double[] obs,
        double[] simh,
        double[] simp,
        List<LocalDate> obsDates,
        List<LocalDate> simhDates,
        List<LocalDate> simpDates,
        String kind,
        @JsonProperty("nQuantiles") Integer nQuantiles,
        String group,
        Double maxScalingFactor,
        Double globalMin,
        Double globalMax,
        Double valMin,
        Double valMax
) {}

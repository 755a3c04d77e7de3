package com.barthel.biasadjust.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Request body for adjusting gridded data indexed {@code [lat][lon][time]}.
 */
public record GridAdjustmentRequestDto(
        String method,
        double[][][] obs,
        double[][][] simh,
        double[][][] simp,
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
        Double valMax,
        Integer workers
) {}

package com.barthel.biasadjust.application.port.in;

import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.AdjustmentResult;
import com.barthel.biasadjust.domain.model.TimeSeries;

/**
 * Detrended quantile mapping of a single dated series.
 */
public interface DetrendedQuantileMappingUseCase {
    /**
     * Adjusts {@code simp} month by month after removing its long-term monthly mean shift.
     *
     * @param obs the observed reference series of the control period
     * @param simh the simulated series of the control period, dated
     * @param simp the simulated series of the period to correct, dated
     * @param parameters method options; {@code nQuantiles} is required and grouping is not allowed
     * @return the corrected series, aligned with {@code simp}
     */
    AdjustmentResult adjustDetrended(TimeSeries obs, TimeSeries simh, TimeSeries simp,
                                     AdjustmentParameters parameters);
}

package com.barthel.biasadjust.application.port.in;

import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.AdjustmentResult;
import com.barthel.biasadjust.domain.model.Grid;
import com.barthel.biasadjust.domain.model.GridAdjustmentResult;
import com.barthel.biasadjust.domain.model.TimeSeries;

import java.util.List;

/**
 * Generic entry point applying any technique except detrended quantile mapping.
 */
public interface AdjustUseCase {
    /**
     * Adjusts one series, optionally per calendar group.
     *
     * @param method the technique to apply
     * @param obs the observed reference series of the control period
     * @param simh the simulated series of the control period
     * @param simp the simulated series of the period to correct
     * @param parameters method options
     * @return the corrected series, aligned with {@code simp}
     */
    AdjustmentResult adjust(AdjustmentMethod method, TimeSeries obs, TimeSeries simh, TimeSeries simp,
                            AdjustmentParameters parameters);

    /**
     * Adjusts every grid cell independently.
     *
     * @param method the technique to apply
     * @param obs the observed reference grid of the control period
     * @param simh the simulated grid of the control period
     * @param simp the simulated grid of the period to correct
     * @param parameters method options, {@code workers} selects the parallelism
     * @return the corrected grid, shaped like {@code simp}
     */
    GridAdjustmentResult adjust(AdjustmentMethod method, Grid obs, Grid simh, Grid simp,
                                AdjustmentParameters parameters);

    /**
     * @return the names of all implemented techniques
     */
    List<String> availableMethods();
}

package com.barthel.biasadjust.application.port.in;

import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;

/**
 * Use case for correcting one 1-dimensional series with a single technique.
 */
public interface BiasCorrectionUseCase {
    /**
     * Corrects {@code simp} using the control period pair {@code obs} / {@code simh}.
     *
     * @param method the technique to apply
     * @param obs the observed reference series of the control period
     * @param simh the simulated series of the control period
     * @param simp the simulated series of the period to correct
     * @param parameters method options
     * @return the corrected values, one per {@code simp} sample
     */
    double[] correct(AdjustmentMethod method, double[] obs, double[] simh, double[] simp,
                     AdjustmentParameters parameters);

    /**
     * Whether this implementation handles the given technique.
     *
     * @param method the technique to check
     * @return true if supported
     */
    boolean supports(AdjustmentMethod method);
}

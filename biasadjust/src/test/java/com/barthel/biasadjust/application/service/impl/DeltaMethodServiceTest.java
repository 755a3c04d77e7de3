package com.barthel.biasadjust.application.service.impl;

import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Kind;
import com.barthel.biasadjust.support.SyntheticClimate;
import com.barthel.biasadjust.support.SyntheticClimate.Scenario;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeltaMethodServiceTest {

    private final DeltaMethodService service = new DeltaMethodService();

    @Test
    void perturbsObservationsByModelledChange() {
        double[] result = service.correct(AdjustmentMethod.DELTA_METHOD,
                new double[]{1, 2, 3}, new double[]{0, 0, 3}, new double[]{2, 2, 2},
                AdjustmentParameters.defaults());

        assertThat(result).containsExactly(2, 3, 4);
    }

    @Test
    void scalesObservationsByModelledRatio() {
        double[] result = service.correct(AdjustmentMethod.DELTA_METHOD,
                new double[]{1, 2, 3}, new double[]{1, 1, 1}, new double[]{2, 2, 2},
                AdjustmentParameters.builder().kind(Kind.MULTIPLICATIVE).build());

        assertThat(result).containsExactly(2, 4, 6);
    }

    @Test
    void reducesErrorOfBothKinds() {
        Scenario additive = SyntheticClimate.additiveScenario();
        Scenario multiplicative = SyntheticClimate.multiplicativeScenario();

        double[] temperature = service.correct(AdjustmentMethod.DELTA_METHOD,
                additive.obs(), additive.simh(), additive.simp(), AdjustmentParameters.defaults());
        double[] precipitation = service.correct(AdjustmentMethod.DELTA_METHOD,
                multiplicative.obs(), multiplicative.simh(), multiplicative.simp(),
                AdjustmentParameters.builder().kind(Kind.MULTIPLICATIVE).build());

        assertThat(SyntheticClimate.rmse(temperature, additive.obsp())).isLessThan(additive.uncorrectedError());
        assertThat(SyntheticClimate.rmse(precipitation, multiplicative.obsp()))
                .isLessThan(multiplicative.uncorrectedError() / 100);
    }

    @Test
    void requiresObsAsLongAsSimp() {
        assertThatThrownBy(() -> service.correct(AdjustmentMethod.DELTA_METHOD,
                new double[]{1, 2}, new double[]{1, 2, 3}, new double[]{1, 2, 3},
                AdjustmentParameters.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("equal length");
    }
}

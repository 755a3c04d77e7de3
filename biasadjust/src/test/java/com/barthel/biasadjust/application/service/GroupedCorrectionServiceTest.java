package com.barthel.biasadjust.application.service;

import com.barthel.biasadjust.application.service.impl.LinearScalingService;
import com.barthel.biasadjust.domain.exception.GroupingNotSupportedException;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Grouping;
import com.barthel.biasadjust.domain.model.Kind;
import com.barthel.biasadjust.domain.model.TimeSeries;
import com.barthel.biasadjust.support.SyntheticClimate;
import com.barthel.biasadjust.support.SyntheticClimate.Scenario;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GroupedCorrectionServiceTest {

    private final GroupedCorrectionService service = new GroupedCorrectionService(SyntheticClimate.router());

    private static AdjustmentParameters grouped(Grouping grouping, Kind kind) {
        return AdjustmentParameters.builder().grouping(grouping).kind(kind).build();
    }

    @Test
    void ungroupedDelegatesToTheCorrector() {
        double[] result = service.apply(AdjustmentMethod.LINEAR_SCALING,
                TimeSeries.of(SyntheticClimate.range(0, 10)),
                TimeSeries.of(SyntheticClimate.range(-2, 10)),
                TimeSeries.of(SyntheticClimate.range(-1, 10)),
                AdjustmentParameters.defaults());

        assertThat(result).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    }

    @Test
    void monthlyGroupsAreCorrectedSeparatelyAndScatteredBack() {
        Scenario scenario = SyntheticClimate.additiveScenario();
        TimeSeries obs = new TimeSeries(scenario.obs(), scenario.historical());
        TimeSeries simh = new TimeSeries(scenario.simh(), scenario.historical());
        TimeSeries simp = new TimeSeries(scenario.simp(), scenario.future());

        double[] result = service.apply(AdjustmentMethod.LINEAR_SCALING, obs, simh, simp,
                grouped(Grouping.MONTH, Kind.ADDITIVE));

        assertThat(result).hasSize(simp.size());
        LinearScalingService linearScaling = new LinearScalingService();
        SortedMap<Integer, int[]> historicalMonths = obs.partition(Grouping.MONTH);
        for (Map.Entry<Integer, int[]> month : simp.partition(Grouping.MONTH).entrySet()) {
            int[] control = historicalMonths.get(month.getKey());
            double[] expected = linearScaling.correct(AdjustmentMethod.LINEAR_SCALING,
                    obs.select(control), simh.select(control), simp.select(month.getValue()),
                    AdjustmentParameters.defaults());
            int[] indices = month.getValue();
            for (int i = 0; i < indices.length; i++) {
                assertThat(result[indices[i]]).isEqualTo(expected[i]);
            }
        }
    }

    @Test
    void yearsOfDifferentPeriodsArePairedInOrder() {
        List<LocalDate> historical = List.of(LocalDate.of(1990, 6, 1), LocalDate.of(1990, 7, 1),
                LocalDate.of(1991, 6, 1), LocalDate.of(1991, 7, 1));
        List<LocalDate> future = List.of(LocalDate.of(2050, 6, 1), LocalDate.of(2050, 7, 1),
                LocalDate.of(2051, 6, 1), LocalDate.of(2051, 7, 1));

        double[] result = service.apply(AdjustmentMethod.LINEAR_SCALING,
                new TimeSeries(new double[]{2, 4, 10, 20}, historical),
                new TimeSeries(new double[]{1, 2, 5, 10}, historical),
                new TimeSeries(new double[]{1, 1, 3, 3}, future),
                grouped(Grouping.YEAR, Kind.MULTIPLICATIVE));

        assertThat(result).containsExactly(new double[]{2, 2, 6, 6}, within(1e-12));
    }

    @Test
    void groupCountsMustMatch() {
        List<LocalDate> twoMonths = List.of(LocalDate.of(2000, 1, 1), LocalDate.of(2000, 2, 1));
        List<LocalDate> oneMonth = List.of(LocalDate.of(2050, 1, 1), LocalDate.of(2050, 1, 2));

        assertThatThrownBy(() -> service.apply(AdjustmentMethod.LINEAR_SCALING,
                new TimeSeries(new double[]{1, 2}, twoMonths),
                new TimeSeries(new double[]{1, 2}, twoMonths),
                new TimeSeries(new double[]{1, 2}, oneMonth),
                grouped(Grouping.MONTH, Kind.ADDITIVE)))
                .isInstanceOf(GroupingNotSupportedException.class)
                .hasMessageContaining("2 obs, 2 simh and 1 simp groups");
    }

    @Test
    void distributionMethodsCannotBeGrouped() {
        List<LocalDate> days = List.of(LocalDate.of(2000, 1, 1));
        TimeSeries series = new TimeSeries(new double[]{1}, days);

        assertThatThrownBy(() -> service.apply(AdjustmentMethod.QUANTILE_MAPPING, series, series, series,
                AdjustmentParameters.builder().grouping(Grouping.MONTH).nQuantiles(10).build()))
                .isInstanceOf(GroupingNotSupportedException.class)
                .hasMessage("Can't use group for distribution based methods.");
    }
}

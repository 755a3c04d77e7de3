package com.barthel.biasadjust.application.service;

import com.barthel.biasadjust.adapter.out.concurrent.ThreadPoolRowExecutionAdapter;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Grid;
import com.barthel.biasadjust.domain.model.Grouping;
import com.barthel.biasadjust.domain.model.TimeSeries;
import com.barthel.biasadjust.support.SyntheticClimate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridAdjustmentServiceTest {

    private static final int LATS = 3;
    private static final int LONS = 4;

    private final GroupedCorrectionService groupedCorrection = new GroupedCorrectionService(SyntheticClimate.router());
    private final GridAdjustmentService service =
            new GridAdjustmentService(groupedCorrection, new ThreadPoolRowExecutionAdapter());

    private List<LocalDate> historical;
    private List<LocalDate> future;
    private Grid obs;
    private Grid simh;
    private Grid simp;

    @BeforeEach
    void setUp() {
        historical = SyntheticClimate.noLeapDays(1981, 5);
        future = SyntheticClimate.noLeapDays(2051, 5);
        double[][][] obsValues = new double[LATS][LONS][];
        double[][][] simhValues = new double[LATS][LONS][];
        double[][][] simpValues = new double[LATS][LONS][];
        for (int lat = 0; lat < LATS; lat++) {
            for (int lon = 0; lon < LONS; lon++) {
                long seed = 31L * lat + lon;
                obsValues[lat][lon] = SyntheticClimate.temperature(historical, 5 + lat, seed);
                simhValues[lat][lon] = SyntheticClimate.plus(obsValues[lat][lon], -2);
                simpValues[lat][lon] = SyntheticClimate.plus(
                        SyntheticClimate.temperature(future, 5 + lat, seed + 1000), -1);
            }
        }
        obs = new Grid(obsValues, historical);
        simh = new Grid(simhValues, historical);
        simp = new Grid(simpValues, future);
    }

    @Test
    void parallelRowsMatchSequentialRun() {
        AdjustmentParameters sequential = AdjustmentParameters.builder().nQuantiles(50).build();
        AdjustmentParameters parallel = sequential.toBuilder().workers(4).build();

        double[][][] expected = service.adjust(AdjustmentMethod.QUANTILE_DELTA_MAPPING, obs, simh, simp, sequential);
        double[][][] actual = service.adjust(AdjustmentMethod.QUANTILE_DELTA_MAPPING, obs, simh, simp, parallel);

        assertThat(actual).isDeepEqualTo(expected);
    }

    @Test
    void everyCellEqualsItsSeriesAdjustment() {
        AdjustmentParameters parameters = AdjustmentParameters.builder().grouping(Grouping.MONTH).workers(2).build();

        double[][][] result = service.adjust(AdjustmentMethod.VARIANCE_SCALING, obs, simh, simp, parameters);

        assertThat(result.length).isEqualTo(LATS);
        for (int lat = 0; lat < LATS; lat++) {
            assertThat(result[lat].length).isEqualTo(LONS);
            for (int lon = 0; lon < LONS; lon++) {
                TimeSeries cellObs = obs.cell(lat, lon);
                double[] expected = groupedCorrection.apply(AdjustmentMethod.VARIANCE_SCALING,
                        cellObs, simh.cell(lat, lon), simp.cell(lat, lon), parameters);
                assertThat(result[lat][lon]).containsExactly(expected);
            }
        }
    }

    @Test
    void inputIsLeftUntouched() {
        double[][][] before = simp.values().clone();
        for (int lat = 0; lat < LATS; lat++) {
            before[lat] = simp.row(lat);
        }

        service.adjust(AdjustmentMethod.LINEAR_SCALING, obs, simh, simp, AdjustmentParameters.defaults());

        assertThat(simp.values()).isDeepEqualTo(before);
    }

    @Test
    void extentsMustAgree() {
        Grid narrow = new Grid(new double[][][]{{{1, 2}}}, null);

        assertThatThrownBy(() -> service.adjust(AdjustmentMethod.LINEAR_SCALING, narrow, simh, simp,
                AdjustmentParameters.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same lat/lon extent");
    }
}

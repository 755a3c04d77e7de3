package com.barthel.biasadjust.application.service;

import com.barthel.biasadjust.application.port.out.RowExecutionPort;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Grid;
import com.barthel.biasadjust.domain.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Applies a (possibly grouped) corrector to every {@code (lat, lon)} cell, one job per
 * latitude row. Each job owns copies of its row data, and results are placed by row index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GridAdjustmentService {

    private final GroupedCorrectionService groupedCorrection;
    private final RowExecutionPort rowExecution;

    public double[][][] adjust(AdjustmentMethod method, Grid obs, Grid simh, Grid simp,
                               AdjustmentParameters parameters) {
        if (!obs.sameExtent(simp) || !simh.sameExtent(simp)) {
            throw new IllegalArgumentException("obs, simh and simp must cover the same lat/lon extent, got "
                    + extent(obs) + ", " + extent(simh) + " and " + extent(simp));
        }
        List<RowJob> jobs = new ArrayList<>(simp.latCount());
        for (int lat = 0; lat < simp.latCount(); lat++) {
            jobs.add(new RowJob(lat, method, parameters,
                    obs.row(lat), obs.dates(),
                    simh.row(lat), simh.dates(),
                    simp.row(lat), simp.dates()));
        }
        log.debug("Dispatching {} rows of {} cells with {} worker(s)", jobs.size(), simp.lonCount(),
                parameters.getWorkers());

        List<double[][]> rows = rowExecution.executeAll(jobs, parameters.getWorkers());
        double[][][] result = new double[simp.latCount()][][];
        for (int lat = 0; lat < result.length; lat++) {
            result[lat] = rows.get(lat);
        }
        return result;
    }

    private static String extent(Grid grid) {
        return "(" + grid.latCount() + ", " + grid.lonCount() + ")";
    }

    private final class RowJob implements Callable<double[][]> {

        private final int lat;
        private final AdjustmentMethod method;
        private final AdjustmentParameters parameters;
        private final double[][] obs;
        private final List<LocalDate> obsDates;
        private final double[][] simh;
        private final List<LocalDate> simhDates;
        private final double[][] simp;
        private final List<LocalDate> simpDates;

        private RowJob(int lat, AdjustmentMethod method, AdjustmentParameters parameters,
                       double[][] obs, List<LocalDate> obsDates,
                       double[][] simh, List<LocalDate> simhDates,
                       double[][] simp, List<LocalDate> simpDates) {
            this.lat = lat;
            this.method = method;
            this.parameters = parameters;
            this.obs = obs;
            this.obsDates = obsDates;
            this.simh = simh;
            this.simhDates = simhDates;
            this.simp = simp;
            this.simpDates = simpDates;
        }

        @Override
        public double[][] call() {
            double[][] row = new double[simp.length][];
            for (int lon = 0; lon < simp.length; lon++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Row " + lat + " cancelled at cell " + lon);
                }
                row[lon] = groupedCorrection.apply(method,
                        new TimeSeries(obs[lon], obsDates),
                        new TimeSeries(simh[lon], simhDates),
                        new TimeSeries(simp[lon], simpDates),
                        parameters);
            }
            log.trace("Row {} done", lat);
            return row;
        }
    }
}

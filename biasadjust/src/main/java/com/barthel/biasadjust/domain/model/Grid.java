package com.barthel.biasadjust.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Gridded data shaped {@code (lat, lon, time)} sharing one time axis.
 *
 * @param values samples indexed {@code [lat][lon][time]}
 * @param dates  calendar labels of the time axis, or {@code null}
 */
public record Grid(double[][][] values, List<LocalDate> dates) {
    public Grid {
        if (values == null || values.length == 0 || values[0].length == 0) {
            throw new IllegalArgumentException("Grid needs at least one cell");
        }
        int lonCount = values[0].length;
        int timeCount = values[0][0].length;
        for (double[][] row : values) {
            if (row.length != lonCount) {
                throw new IllegalArgumentException("Grid rows must all have " + lonCount + " cells");
            }
            for (double[] cell : row) {
                if (cell.length != timeCount) {
                    throw new IllegalArgumentException("Grid cells must all have " + timeCount + " time steps");
                }
            }
        }
        if (dates != null && dates.size() != timeCount) {
            throw new IllegalArgumentException("Got " + dates.size() + " dates for " + timeCount + " time steps");
        }
        dates = dates == null ? null : List.copyOf(dates);
    }

    public int latCount() {
        return values.length;
    }

    public int lonCount() {
        return values[0].length;
    }

    public int timeCount() {
        return values[0][0].length;
    }

    /**
     * Copy of one latitude row, {@code [lon][time]}.
     */
    public double[][] row(int lat) {
        double[][] row = new double[lonCount()][];
        for (int lon = 0; lon < row.length; lon++) {
            row[lon] = values[lat][lon].clone();
        }
        return row;
    }

    public TimeSeries cell(int lat, int lon) {
        return new TimeSeries(values[lat][lon], dates);
    }

    public boolean sameExtent(Grid other) {
        return latCount() == other.latCount() && lonCount() == other.lonCount();
    }
}

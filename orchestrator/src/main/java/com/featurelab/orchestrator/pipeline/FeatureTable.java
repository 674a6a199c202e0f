package com.featurelab.orchestrator.pipeline;

import com.featurelab.orchestrator.feature.TimeSeries;

import java.util.List;
import java.util.Map;

/**
 * Assembled feature values: one row per time series, one column per feature.
 * Missing values are NaN. Instances are never modified after construction.
 */
public final class FeatureTable {

    private final List<String> features;
    private final List<String> seriesNames;
    private final double[][]   values;

    public FeatureTable(List<String> features, List<String> seriesNames, double[][] values) {
        if (seriesNames.size() != values.length) {
            throw new IllegalArgumentException(
                    seriesNames.size() + " series names for " + values.length + " rows");
        }
        for (double[] row : values) {
            if (row.length != features.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.length + " values for " + features.size() + " features");
            }
        }
        this.features    = List.copyOf(features);
        this.seriesNames = List.copyOf(seriesNames);
        this.values      = deepCopy(values);
    }

    /**
     * Build a table from per-series feature maps, paired with the series they
     * were computed from. A feature absent from a map becomes NaN.
     */
    public static FeatureTable assemble(List<String> features,
                                        List<Map<String, Double>> perSeries,
                                        List<TimeSeries> series) {
        if (perSeries.size() != series.size()) {
            throw new IllegalArgumentException(
                    perSeries.size() + " feature rows for " + series.size() + " time series");
        }
        double[][] values = new double[perSeries.size()][features.size()];
        for (int i = 0; i < perSeries.size(); i++) {
            Map<String, Double> row = perSeries.get(i);
            for (int j = 0; j < features.size(); j++) {
                Double v = row.get(features.get(j));
                values[i][j] = v == null ? Double.NaN : v;
            }
        }
        List<String> names = series.stream().map(TimeSeries::name).toList();
        return new FeatureTable(features, names, values);
    }

    public List<String> features()    { return features; }
    public List<String> seriesNames() { return seriesNames; }
    public int          rowCount()    { return values.length; }

    public double get(int row, int column) {
        return values[row][column];
    }

    /** Copy of all values. */
    public double[][] values() {
        return deepCopy(values);
    }

    public boolean hasMissingValues() {
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isFinite(v)) return true;
            }
        }
        return false;
    }

    /** Same features and series, new values. */
    public FeatureTable withValues(double[][] newValues) {
        return new FeatureTable(features, seriesNames, newValues);
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}

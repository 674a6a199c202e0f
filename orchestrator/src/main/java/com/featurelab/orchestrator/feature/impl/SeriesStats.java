package com.featurelab.orchestrator.feature.impl;

import java.util.Arrays;

/**
 * Moment and order statistics shared by the built-in features.
 * All methods return NaN for empty input.
 */
final class SeriesStats {

    private SeriesStats() {}

    static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(Double.NaN);
    }

    /** Population standard deviation (divides by n). */
    static double std(double[] values) {
        return Math.sqrt(centralMoment(values, 2));
    }

    static double centralMoment(double[] values, int order) {
        if (values.length == 0) return Double.NaN;
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow(v - mean, order);
        }
        return sum / values.length;
    }

    static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    static double max(double[] values) {
        return Arrays.stream(values).max().orElse(Double.NaN);
    }

    static double min(double[] values) {
        return Arrays.stream(values).min().orElse(Double.NaN);
    }
}

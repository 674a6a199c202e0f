package com.featurelab.orchestrator.pipeline;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Replaces missing (NaN) feature values so the artifact can be consumed by
 * models that do not accept gaps.
 *
 * Infinite values and values whose magnitude reaches {@code maxValue} are
 * treated as missing. Missing cells are then filled according to the
 * configured {@link ImputationStrategy}. The CONSTANT fill value is
 * {@code -2 * max|v|} over the remaining values (0 if there are none), which
 * keeps imputed entries clearly apart from observed ones. MEAN and MEDIAN
 * fall back to that constant for a column with no finite values.
 *
 * The input table is never modified.
 */
@Component
public class FeatureImputer {

    private final ImputationStrategy strategy;
    private final double             maxValue;

    public FeatureImputer(@Value("${featurelab.impute.strategy:CONSTANT}") ImputationStrategy strategy,
                          @Value("${featurelab.impute.max-value:1e20}") double maxValue) {
        this.strategy = strategy;
        this.maxValue = maxValue;
    }

    public FeatureTable impute(FeatureTable table) {
        double[][] values = table.values();
        maskOutOfRange(values);

        double constant = constantFill(values);
        int columns = table.features().size();
        for (int j = 0; j < columns; j++) {
            double fill = switch (strategy) {
                case CONSTANT -> constant;
                case MEAN     -> orElse(columnMean(values, j), constant);
                case MEDIAN   -> orElse(columnMedian(values, j), constant);
            };
            for (double[] row : values) {
                if (Double.isNaN(row[j])) row[j] = fill;
            }
        }
        return table.withValues(values);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void maskOutOfRange(double[][] values) {
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) {
                if (Math.abs(row[j]) >= maxValue) {
                    row[j] = Double.NaN;
                }
            }
        }
    }

    private static double constantFill(double[][] values) {
        double maxAbs = Arrays.stream(values)
                .flatMapToDouble(Arrays::stream)
                .filter(Double::isFinite)
                .map(Math::abs)
                .max()
                .orElse(0.0);
        // Avoid writing -0.0 when every cell is missing.
        return maxAbs == 0.0 ? 0.0 : -2.0 * maxAbs;
    }

    private static double columnMean(double[][] values, int column) {
        return Arrays.stream(values)
                .mapToDouble(row -> row[column])
                .filter(Double::isFinite)
                .average()
                .orElse(Double.NaN);
    }

    private static double columnMedian(double[][] values, int column) {
        double[] finite = Arrays.stream(values)
                .mapToDouble(row -> row[column])
                .filter(Double::isFinite)
                .sorted()
                .toArray();
        if (finite.length == 0) return Double.NaN;
        int mid = finite.length / 2;
        return finite.length % 2 == 1 ? finite[mid] : (finite[mid - 1] + finite[mid]) / 2.0;
    }

    private static double orElse(double value, double fallback) {
        return Double.isNaN(value) ? fallback : value;
    }
}

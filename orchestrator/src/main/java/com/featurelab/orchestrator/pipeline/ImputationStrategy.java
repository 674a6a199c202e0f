package com.featurelab.orchestrator.pipeline;

/**
 * How {@link FeatureImputer} fills missing feature values.
 */
public enum ImputationStrategy {
    CONSTANT,   // a single value far below any observed one
    MEAN,       // column mean of the finite values
    MEDIAN      // column median of the finite values
}

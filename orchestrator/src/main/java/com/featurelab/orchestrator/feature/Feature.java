package com.featurelab.orchestrator.feature;

/**
 * A scalar feature computable from a single time series.
 *
 * Every {@code @Component} implementing this interface is registered in the
 * {@link FeatureRegistry} at startup and becomes selectable by name.
 * Implementations must be stateless: the registry calls them concurrently
 * from worker-pool threads.
 */
public interface Feature {

    FeatureManifest manifest();

    /**
     * Compute the feature value.
     * May return NaN when the series is too short for the feature to be defined.
     */
    double compute(TimeSeries series);
}

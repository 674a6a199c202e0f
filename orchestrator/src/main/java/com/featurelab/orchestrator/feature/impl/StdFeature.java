package com.featurelab.orchestrator.feature.impl;

import com.featurelab.orchestrator.feature.Feature;
import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.TimeSeries;
import org.springframework.stereotype.Component;

@Component
public class StdFeature implements Feature {

    private static final FeatureManifest MANIFEST = new FeatureManifest(
            "std",
            "Standard deviation of the magnitudes.");

    @Override
    public FeatureManifest manifest() {
        return MANIFEST;
    }

    @Override
    public double compute(TimeSeries series) {
        return SeriesStats.std(series.measurements());
    }
}

package com.featurelab.orchestrator.feature.impl;

import com.featurelab.orchestrator.feature.Feature;
import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.TimeSeries;
import org.springframework.stereotype.Component;

@Component
public class MeanFeature implements Feature {

    private static final FeatureManifest MANIFEST = new FeatureManifest(
            "mean",
            "Mean magnitude.");

    @Override
    public FeatureManifest manifest() {
        return MANIFEST;
    }

    @Override
    public double compute(TimeSeries series) {
        return SeriesStats.mean(series.measurements());
    }
}

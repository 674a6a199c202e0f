package com.featurelab.orchestrator.feature.impl;

import com.featurelab.orchestrator.feature.Feature;
import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.TimeSeries;
import org.springframework.stereotype.Component;

@Component
public class MaxFeature implements Feature {

    private static final FeatureManifest MANIFEST = new FeatureManifest(
            "max",
            "Maximum magnitude.");

    @Override
    public FeatureManifest manifest() {
        return MANIFEST;
    }

    @Override
    public double compute(TimeSeries series) {
        return SeriesStats.max(series.measurements());
    }
}

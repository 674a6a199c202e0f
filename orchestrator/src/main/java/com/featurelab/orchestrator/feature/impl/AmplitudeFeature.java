package com.featurelab.orchestrator.feature.impl;

import com.featurelab.orchestrator.feature.Feature;
import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.TimeSeries;
import org.springframework.stereotype.Component;

@Component
public class AmplitudeFeature implements Feature {

    private static final FeatureManifest MANIFEST = new FeatureManifest(
            "amplitude",
            "Half the difference between the maximum and minimum magnitude.");

    @Override
    public FeatureManifest manifest() {
        return MANIFEST;
    }

    @Override
    public double compute(TimeSeries series) {
        return (SeriesStats.max(series.measurements()) - SeriesStats.min(series.measurements())) / 2.0;
    }
}

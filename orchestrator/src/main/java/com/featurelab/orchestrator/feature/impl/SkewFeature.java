package com.featurelab.orchestrator.feature.impl;

import com.featurelab.orchestrator.feature.Feature;
import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.TimeSeries;
import org.springframework.stereotype.Component;

@Component
public class SkewFeature implements Feature {

    private static final FeatureManifest MANIFEST = new FeatureManifest(
            "skew",
            "Skewness of the magnitudes.");

    @Override
    public FeatureManifest manifest() {
        return MANIFEST;
    }

    @Override
    public double compute(TimeSeries series) {
        double m2 = SeriesStats.centralMoment(series.measurements(), 2);
        if (m2 == 0.0) return Double.NaN;
        return SeriesStats.centralMoment(series.measurements(), 3) / Math.pow(m2, 1.5);
    }
}

package com.featurelab.orchestrator.feature.impl;

import com.featurelab.orchestrator.feature.Feature;
import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.TimeSeries;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Component
public class PercentBeyondOneStdFeature implements Feature {

    private static final FeatureManifest MANIFEST = new FeatureManifest(
            "percent_beyond_1_std",
            "Fraction of observations more than one standard deviation from the mean.");

    @Override
    public FeatureManifest manifest() {
        return MANIFEST;
    }

    @Override
    public double compute(TimeSeries series) {
        double[] m = series.measurements();
        if (m.length == 0) return Double.NaN;
        double mean = SeriesStats.mean(m);
        double std  = SeriesStats.std(m);
        long beyond = Arrays.stream(m).filter(v -> Math.abs(v - mean) > std).count();
        return (double) beyond / m.length;
    }
}

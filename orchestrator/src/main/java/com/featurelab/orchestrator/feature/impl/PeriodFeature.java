package com.featurelab.orchestrator.feature.impl;

import com.featurelab.orchestrator.feature.Feature;
import com.featurelab.orchestrator.feature.FeatureManifest;
import com.featurelab.orchestrator.feature.TimeSeries;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Dominant period from a Lomb-Scargle periodogram.
 *
 * Works on unevenly sampled series. Frequencies are scanned from 1/T
 * (T = time baseline) up to the pseudo-Nyquist frequency 0.5/median(dt),
 * with a step of 1/(OVERSAMPLING * T). The grid is capped at MAX_FREQUENCIES
 * points so one long series cannot monopolise a worker.
 */
@Component
public class PeriodFeature implements Feature {

    private static final FeatureManifest MANIFEST = new FeatureManifest(
            "period",
            "Period with the highest Lomb-Scargle power.");

    private static final int OVERSAMPLING    = 5;
    private static final int MAX_FREQUENCIES = 20_000;
    private static final int MIN_SAMPLES     = 3;

    @Override
    public FeatureManifest manifest() {
        return MANIFEST;
    }

    @Override
    public double compute(TimeSeries series) {
        double[] t = series.times();
        double[] m = series.measurements();
        if (m.length < MIN_SAMPLES) return Double.NaN;

        double baseline = SeriesStats.max(t) - SeriesStats.min(t);
        double medianDt = medianSpacing(t);
        if (baseline <= 0.0 || medianDt <= 0.0) return Double.NaN;

        double fMin = 1.0 / baseline;
        double fMax = 0.5 / medianDt;
        double step = 1.0 / (OVERSAMPLING * baseline);
        int count = (int) Math.min(MAX_FREQUENCIES, Math.floor((fMax - fMin) / step) + 1);
        if (count < 1) return Double.NaN;

        double mean = SeriesStats.mean(m);
        double[] y = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            y[i] = m[i] - mean;
        }

        double bestFrequency = Double.NaN;
        double bestPower = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < count; k++) {
            double f = fMin + k * step;
            double power = power(t, y, 2.0 * Math.PI * f);
            if (power > bestPower) {
                bestPower = power;
                bestFrequency = f;
            }
        }
        return 1.0 / bestFrequency;
    }

    /** Classical (unnormalised) Lomb-Scargle power at angular frequency w. */
    private static double power(double[] t, double[] y, double w) {
        double sin2 = 0.0;
        double cos2 = 0.0;
        for (double ti : t) {
            sin2 += Math.sin(2.0 * w * ti);
            cos2 += Math.cos(2.0 * w * ti);
        }
        double tau = Math.atan2(sin2, cos2) / (2.0 * w);

        double yc = 0.0, ys = 0.0, cc = 0.0, ss = 0.0;
        for (int i = 0; i < t.length; i++) {
            double c = Math.cos(w * (t[i] - tau));
            double s = Math.sin(w * (t[i] - tau));
            yc += y[i] * c;
            ys += y[i] * s;
            cc += c * c;
            ss += s * s;
        }
        double p = 0.0;
        if (cc > 0.0) p += yc * yc / cc;
        if (ss > 0.0) p += ys * ys / ss;
        return 0.5 * p;
    }

    private static double medianSpacing(double[] t) {
        double[] sorted = t.clone();
        Arrays.sort(sorted);
        double[] dt = new double[sorted.length - 1];
        for (int i = 1; i < sorted.length; i++) {
            dt[i - 1] = sorted[i] - sorted[i - 1];
        }
        return SeriesStats.median(dt);
    }
}

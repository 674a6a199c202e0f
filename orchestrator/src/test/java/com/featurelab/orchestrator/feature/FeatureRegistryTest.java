package com.featurelab.orchestrator.feature;

import com.featurelab.orchestrator.feature.impl.MaxFeature;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.featurelab.orchestrator.feature.BuiltInFeatures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the feature catalog and the built-in features.
 * No Spring context; all wiring is done manually.
 */
class FeatureRegistryTest {

    SimpleMeterRegistry meters;
    FeatureRegistry registry;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        registry = new FeatureRegistry(BuiltInFeatures.all(), meters);
    }

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    @Test
    void registry_registersAllBuiltInFeatures() {
        assertThat(registry.names()).containsExactly(
                "amplitude", "max", "mean", "median", "min", "n_epochs",
                "percent_beyond_1_std", "period", "skew", "std");
        assertThat(registry.manifests()).allSatisfy(m -> assertThat(m.description()).isNotBlank());
    }

    @Test
    void registry_duplicateName_isRejected() {
        List<Feature> features = List.of(
                new MaxFeature(),
                new MaxFeature());

        assertThatThrownBy(() -> new FeatureRegistry(features, meters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("max");
    }

    @Test
    void get_unknownFeature_throws() {
        assertThatThrownBy(() -> registry.get("no_such_feature"))
                .isInstanceOf(UnknownFeatureException.class)
                .hasMessageContaining("no_such_feature");
    }

    @Test
    void filterKnown_dropsUnknown_keepsRequestOrder_removesDuplicates() {
        List<String> known = registry.filterKnown(List.of("period", "bogus", "amplitude", "period", "skew"));

        assertThat(known).containsExactly("period", "amplitude", "skew");
    }

    @Test
    void filterKnown_nothingKnown_returnsEmpty() {
        assertThat(registry.filterKnown(List.of("bogus", "featureset_name"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // compute()
    // ------------------------------------------------------------------

    @Test
    void compute_recordsSuccessMetrics() {
        double value = registry.compute("amplitude", series("s1", 1, 5, 3));

        assertThat(value).isEqualTo(2.0);
        assertThat(meters.get("featurelab.feature.calls")
                .tags("feature", "amplitude", "status", "success").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("featurelab.feature.duration")
                .tag("feature", "amplitude").timer().count()).isEqualTo(1);
    }

    @Test
    void compute_failingFeature_wrapsErrorAndCountsIt() {
        Feature broken = new Feature() {
            @Override public FeatureManifest manifest() { return new FeatureManifest("broken", "Always fails."); }
            @Override public double compute(TimeSeries s) { throw new ArithmeticException("boom"); }
        };
        FeatureRegistry withBroken = new FeatureRegistry(List.of(broken), meters);

        assertThatThrownBy(() -> withBroken.compute("broken", series("s1", 1, 2)))
                .isInstanceOf(FeatureException.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("s1")
                .hasCauseInstanceOf(ArithmeticException.class);
        assertThat(meters.get("featurelab.feature.calls")
                .tags("feature", "broken", "status", "error").counter().count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Built-in features
    // ------------------------------------------------------------------

    @Test
    void simpleStatistics() {
        TimeSeries s = series("s", 2, 4, 4, 4, 5, 5, 7, 9);

        assertThat(registry.compute("max", s)).isEqualTo(9.0);
        assertThat(registry.compute("min", s)).isEqualTo(2.0);
        assertThat(registry.compute("mean", s)).isEqualTo(5.0);
        assertThat(registry.compute("median", s)).isEqualTo(4.5);
        assertThat(registry.compute("std", s)).isEqualTo(2.0);
        assertThat(registry.compute("n_epochs", s)).isEqualTo(8.0);
        assertThat(registry.compute("amplitude", s)).isEqualTo(3.5);
    }

    @Test
    void percentBeyondOneStd() {
        // mean 5, std 2: only 2 and 9 lie further than 2 from the mean
        TimeSeries s = series("s", 2, 4, 4, 4, 5, 5, 7, 9);

        assertThat(registry.compute("percent_beyond_1_std", s)).isEqualTo(0.25);
    }

    @Test
    void skew_symmetricSeries_isZero_constantSeries_isNaN() {
        assertThat(registry.compute("skew", series("sym", 1, 2, 3, 4, 5))).isCloseTo(0.0, within(1e-12));
        assertThat(registry.compute("skew", series("flat", 3, 3, 3))).isNaN();
        assertThat(registry.compute("skew", series("right", 0, 0, 0, 10))).isPositive();
    }

    @Test
    void period_recoversSinePeriod() {
        int n = 501;
        double[] t = new double[n];
        double[] m = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i * 0.1;
            m[i] = Math.sin(2.0 * Math.PI * t[i] / 2.5);
        }

        double period = registry.compute("period", new TimeSeries("sine", null, t, m, null));

        assertThat(period).isCloseTo(2.5, within(0.05));
    }

    @Test
    void period_tooFewSamples_isNaN() {
        assertThat(registry.compute("period", series("short", 1, 2))).isNaN();
    }
}

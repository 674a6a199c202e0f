package com.featurelab.orchestrator.feature;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of computable features.
 *
 * All {@link Feature} beans declared as Spring {@code @Component}s are
 * collected at startup via constructor injection. The catalog is the only
 * source of truth for which feature names a featureset request may select.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Filtering requested names down to known ones ({@link #filterKnown}).</li>
 *   <li>Metrics-instrumented computation ({@link #compute}), timed and
 *       counted per feature with no per-feature boilerplate.</li>
 *   <li>Listing the catalog for clients ({@link #manifests}).</li>
 * </ol>
 */
@Component
public class FeatureRegistry {

    private static final Logger log = LoggerFactory.getLogger(FeatureRegistry.class);

    private final Map<String, Feature> features = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public FeatureRegistry(List<Feature> allFeatures, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Feature feature : allFeatures) {
            Feature previous = features.put(feature.manifest().name(), feature);
            if (previous != null) {
                throw new IllegalStateException("Duplicate feature name: " + feature.manifest().name());
            }
        }
        log.info("Registered {} features: {}", features.size(), names());
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Feature get(String name) {
        Feature feature = features.get(name);
        if (feature == null) {
            throw new UnknownFeatureException(name);
        }
        return feature;
    }

    public boolean isKnown(String name) {
        return name != null && features.containsKey(name);
    }

    /** All registered feature names (sorted). */
    public List<String> names() {
        return features.keySet().stream().sorted().toList();
    }

    /** All manifests, sorted by name. */
    public List<FeatureManifest> manifests() {
        return features.values().stream()
                .map(Feature::manifest)
                .sorted(Comparator.comparing(FeatureManifest::name))
                .toList();
    }

    /**
     * Keep only the registered names, in request order, without duplicates.
     * Unknown names are dropped silently; an empty result is the caller's
     * problem to report.
     */
    public List<String> filterKnown(Collection<String> requested) {
        LinkedHashSet<String> known = new LinkedHashSet<>();
        for (String name : requested) {
            if (isKnown(name)) {
                known.add(name);
            } else {
                log.debug("Ignoring unknown feature '{}'", name);
            }
        }
        return List.copyOf(known);
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented computation
    // ------------------------------------------------------------------

    /**
     * Compute one feature with full observability.
     *
     * <pre>
     *   featurelab.feature.calls{feature, status="success|error"}
     *   featurelab.feature.duration{feature}
     * </pre>
     *
     * @throws UnknownFeatureException if the name is not registered
     * @throws FeatureException        if the feature itself fails
     */
    public double compute(String name, TimeSeries series) {
        Feature feature = get(name);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return feature.compute(series);
        } catch (Exception e) {
            status = "error";
            throw new FeatureException(
                    "Feature '" + name + "' failed on series '" + series.name() + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("featurelab.feature.duration", "feature", name));
            meterRegistry.counter("featurelab.feature.calls",
                    "feature", name, "status", status).increment();
        }
    }
}

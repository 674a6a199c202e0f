package com.featurelab.orchestrator.api.dto;

import com.featurelab.orchestrator.feature.FeatureManifest;

/** One catalog entry returned by GET /features/catalog. */
public record FeatureResponse(String name, String description) {

    public static FeatureResponse from(FeatureManifest manifest) {
        return new FeatureResponse(manifest.name(), manifest.description());
    }
}

package com.featurelab.orchestrator.feature;

/**
 * Identity and documentation of a feature.
 *
 * @param name        Unique identifier; the key clients use to select the feature.
 * @param description One sentence shown in the feature catalog.
 */
public record FeatureManifest(String name, String description) {}

package com.featurelab.orchestrator.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the featurization graph needs, resolved before submission.
 *
 * @param fileUris         storage location of each time series, in dataset order
 * @param features         non-empty list of registered feature names
 * @param customScriptPath script with user-defined features; null when none
 * @param outputPath       where the final artifact is written
 */
public record FeaturizationRequest(
        List<String> fileUris,
        List<String> features,
        Path         customScriptPath,
        Path         outputPath) {

    public FeaturizationRequest {
        fileUris = List.copyOf(fileUris);
        features = List.copyOf(features);
        if (features.isEmpty()) {
            throw new IllegalArgumentException("At least one feature is required");
        }
    }
}

package com.featurelab.orchestrator.api.dto;

import com.featurelab.orchestrator.model.Featureset;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of a featureset returned by the /features endpoints.
 *
 * taskId is an empty string once the computation has resolved, which is
 * what clients test to decide whether a featureset is still running.
 */
public record FeaturesetResponse(
        UUID         id,
        String       name,
        Long         projectId,
        String       fileUri,
        List<String> featuresList,
        String       customFeaturesScript,
        String       taskId,
        String       state,
        String       errorMessage,
        Instant      createdAt,
        Instant      finishedAt
) {
    public static FeaturesetResponse from(Featureset f) {
        return new FeaturesetResponse(
                f.getId(),
                f.getName(),
                f.getProject().getId(),
                f.getFileUri(),
                f.getFeaturesList(),
                f.getCustomFeaturesScript(),
                f.getTaskId() == null ? "" : f.getTaskId(),
                f.getState().name(),
                f.getErrorMessage(),
                f.getCreatedAt(),
                f.getFinishedAt()
        );
    }
}

package com.featurelab.orchestrator.service;

/**
 * Thrown when the requesting user does not own the dataset or featureset
 * they are acting on.
 */
public class FeaturesetAccessException extends RuntimeException {

    public FeaturesetAccessException(String message) {
        super(message);
    }
}

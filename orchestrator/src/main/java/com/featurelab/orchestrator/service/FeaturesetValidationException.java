package com.featurelab.orchestrator.service;

/**
 * Thrown when a featureset request is rejected before anything is created
 * or submitted. The message is shown to the user as-is.
 */
public class FeaturesetValidationException extends RuntimeException {

    public FeaturesetValidationException(String message) {
        super(message);
    }
}

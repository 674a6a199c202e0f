package com.featurelab.orchestrator.feature;

/**
 * Thrown when computing a feature fails for a given series.
 */
public class FeatureException extends RuntimeException {

    public FeatureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.featurelab.orchestrator.feature;

public class UnknownFeatureException extends RuntimeException {
    public UnknownFeatureException(String name) {
        super("No feature registered with name: '" + name + "'");
    }
}

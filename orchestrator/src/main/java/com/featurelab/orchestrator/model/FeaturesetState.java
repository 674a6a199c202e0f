package com.featurelab.orchestrator.model;

/**
 * Lifecycle of a featureset computation.
 *
 * Transitions:
 *   PENDING → COMPLETED  (pipeline resolved, artifact written)
 *   PENDING → FAILED     (only under the MARK_FAILED failure policy;
 *                         the default policy deletes the row instead)
 *
 * COMPLETED and FAILED are terminal.
 */
public enum FeaturesetState {
    PENDING,
    COMPLETED,
    FAILED
}

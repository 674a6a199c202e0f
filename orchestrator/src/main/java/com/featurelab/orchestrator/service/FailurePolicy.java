package com.featurelab.orchestrator.service;

/**
 * What happens to a featureset row when its pipeline fails.
 *
 * DELETE      : the row is removed; clients only learn of the failure
 *               through the error notification.
 * MARK_FAILED : the row is kept in FAILED state with the error message.
 */
public enum FailurePolicy {
    DELETE,
    MARK_FAILED
}

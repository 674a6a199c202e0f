package com.featurelab.orchestrator.service;

import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Result of a featurization pipeline as seen by the watcher:
 * either the artifact was written, or some stage failed.
 * Which stage failed does not matter for reconciliation.
 */
public interface PipelineOutcome {

    record Succeeded(Path artifact) implements PipelineOutcome {}

    record Failed(Throwable cause) implements PipelineOutcome {

        /** Human-readable cause for notifications and the FAILED row. */
        public String describe() {
            String msg = cause.getMessage();
            return (msg == null || msg.isBlank()) ? cause.getClass().getSimpleName() : msg;
        }
    }

    /** Build from the arguments of a {@code whenComplete} callback. */
    static PipelineOutcome of(Path artifact, Throwable error) {
        if (error == null) {
            return new Succeeded(artifact);
        }
        return new Failed(unwrap(error));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cur = error;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException)
                && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}

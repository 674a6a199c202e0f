package com.featurelab.orchestrator.pipeline;

/**
 * Thrown by a pipeline stage when it cannot produce its output
 * (unreadable series file, artifact write failure, ...).
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.featurelab.orchestrator.pipeline;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Returned by {@link FeaturizationPipeline#submit} as soon as the graph is queued.
 *
 * @param taskId key of the terminal (save) task; stored on the featureset row
 * @param result completes with the artifact path, or exceptionally with the
 *               error of whichever stage failed first
 */
public record PipelineHandle(String taskId, CompletableFuture<Path> result) {}

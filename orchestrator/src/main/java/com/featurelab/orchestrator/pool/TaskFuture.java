package com.featurelab.orchestrator.pool;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to one task submitted to a {@link WorkerPool}.
 *
 * @param key    Correlation token assigned at submission time. Readable
 *               immediately, before the task has run.
 * @param result Completes with the task's return value, or exceptionally
 *               with the task's error (or an upstream task's error).
 */
public record TaskFuture<T>(String key, CompletableFuture<T> result) {

    /**
     * Value of an already-completed task.
     * Only call this from a task that declared this future as a dependency.
     */
    public T join() {
        return result.join();
    }
}

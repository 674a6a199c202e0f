package com.featurelab.orchestrator.pool;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A pool of workers that runs graphs of dependent tasks.
 *
 * Every method returns as soon as the tasks are queued; none of them waits
 * for a task to run. A task whose dependency fails is never executed and
 * completes exceptionally with the dependency's error.
 */
public interface WorkerPool {

    /** Run {@code fn} once per item, one task each. */
    <T, R> List<TaskFuture<R>> map(String stage, Function<T, R> fn, List<T> items);

    /** Run {@code fn} on the result of each upstream task, one task each. */
    <T, R> List<TaskFuture<R>> mapResults(String stage, Function<T, R> fn, List<TaskFuture<T>> upstream);

    /**
     * Run {@code fn} once all {@code dependencies} have completed successfully.
     * {@code fn} reads their values with {@link TaskFuture#join()}.
     */
    <R> TaskFuture<R> submit(String stage, Supplier<R> fn, Collection<? extends TaskFuture<?>> dependencies);
}

package com.featurelab.orchestrator.pool;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-process {@link WorkerPool} backed by a fixed thread pool.
 *
 * Dependencies are chained with CompletableFuture, so a worker thread is only
 * occupied while a task is actually running, never while it waits for its
 * inputs. The pool size caps how many pipeline tasks run concurrently.
 *
 * Task keys have the form {@code <stage>-<uuid>}.
 */
@Component
public class LocalWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerPool.class);

    private final ExecutorService workers;

    public LocalWorkerPool(@Value("${featurelab.worker-pool.size:4}") int size) {
        this.workers = Executors.newFixedThreadPool(size, new WorkerThreadFactory());
        log.info("Worker pool started with {} threads", size);
    }

    // ------------------------------------------------------------------
    // WorkerPool
    // ------------------------------------------------------------------

    @Override
    public <T, R> List<TaskFuture<R>> map(String stage, Function<T, R> fn, List<T> items) {
        return items.stream()
                .map(item -> {
                    String key = newKey(stage);
                    CompletableFuture<R> result = CompletableFuture.supplyAsync(
                            () -> run(key, () -> fn.apply(item)), workers);
                    return new TaskFuture<>(key, result);
                })
                .toList();
    }

    @Override
    public <T, R> List<TaskFuture<R>> mapResults(String stage, Function<T, R> fn,
                                                 List<TaskFuture<T>> upstream) {
        return upstream.stream()
                .map(up -> {
                    String key = newKey(stage);
                    CompletableFuture<R> result = up.result().thenApplyAsync(
                            value -> run(key, () -> fn.apply(value)), workers);
                    return new TaskFuture<>(key, result);
                })
                .toList();
    }

    @Override
    public <R> TaskFuture<R> submit(String stage, Supplier<R> fn,
                                    Collection<? extends TaskFuture<?>> dependencies) {
        String key = newKey(stage);
        CompletableFuture<?>[] deps = dependencies.stream()
                .map(TaskFuture::result)
                .toArray(CompletableFuture[]::new);
        CompletableFuture<R> result = CompletableFuture.allOf(deps)
                .thenApplyAsync(ignored -> run(key, fn), workers);
        return new TaskFuture<>(key, result);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Execute one task body with its key in the MDC, so every log line the
     * task emits can be correlated with the featureset that owns it.
     */
    private static <R> R run(String key, Supplier<R> body) {
        MDC.put("taskKey", key);
        long start = System.nanoTime();
        try {
            R value = body.get();
            log.debug("Task {} finished in {} ms", key, (System.nanoTime() - start) / 1_000_000);
            return value;
        } catch (RuntimeException e) {
            log.debug("Task {} failed: {}", key, e.toString());
            throw e;
        } finally {
            MDC.remove("taskKey");
        }
    }

    private static String newKey(String stage) {
        return stage + "-" + UUID.randomUUID();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "featurize-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

package com.featurelab.orchestrator.pool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for LocalWorkerPool: task keys, chaining and error propagation.
 * Uses a real two-thread pool; every wait is bounded.
 */
class LocalWorkerPoolTest {

    private final LocalWorkerPool pool = new LocalWorkerPool(2);

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void map_runsOneTaskPerItem_inItemOrder() {
        List<TaskFuture<Integer>> squares = pool.map("square", (Integer x) -> x * x, List.of(1, 2, 3));

        assertThat(squares).extracting(TaskFuture::join).containsExactly(1, 4, 9);
        assertThat(squares).extracting(TaskFuture::key)
                .allSatisfy(key -> assertThat(key).startsWith("square-"))
                .doesNotHaveDuplicates();
    }

    @Test
    void mapResults_chainsOnUpstreamValues() {
        List<TaskFuture<String>> words = pool.map("load", (String s) -> s, List.of("a", "bb"));

        List<TaskFuture<Integer>> lengths = pool.mapResults("length", String::length, words);

        assertThat(lengths).extracting(TaskFuture::join).containsExactly(1, 2);
    }

    @Test
    void submit_waitsForAllDependencies() {
        List<TaskFuture<Integer>> parts = pool.map("part", (Integer x) -> x, List.of(1, 2, 3));

        TaskFuture<Integer> sum = pool.submit("sum",
                () -> parts.stream().mapToInt(TaskFuture::join).sum(), parts);

        assertThat(sum.key()).startsWith("sum-");
        assertThat(sum.join()).isEqualTo(6);
    }

    @Test
    void submit_returnsBeforeTheTaskRuns() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        List<TaskFuture<String>> blocked = pool.map("blocked", (String s) -> {
            await(gate);
            return s;
        }, List.of("x"));

        TaskFuture<String> downstream = pool.submit("after", () -> blocked.get(0).join() + "!", blocked);

        assertThat(downstream.result()).isNotDone();
        gate.countDown();
        assertThat(downstream.result().get(5, TimeUnit.SECONDS)).isEqualTo("x!");
    }

    @Test
    void failedDependency_failsDownstream_withoutRunningIt() {
        AtomicBoolean ran = new AtomicBoolean();
        List<TaskFuture<Integer>> broken = pool.map("load", (Integer x) -> {
            throw new IllegalStateException("disk on fire");
        }, List.of(1));

        TaskFuture<Integer> downstream = pool.submit("assemble", () -> {
            ran.set(true);
            return 0;
        }, broken);

        assertThatThrownBy(downstream::join)
                .isInstanceOf(CompletionException.class)
                .hasRootCauseMessage("disk on fire");
        assertThat(ran).isFalse();
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}

package com.featurelab.orchestrator.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters for featureset submissions and their outcomes.
 */
@Component
public class PipelineMetrics {

    private final Counter submitted;
    private final Counter completed;
    private final Counter failed;
    private final AtomicInteger inFlight = new AtomicInteger();

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.submitted = Counter.builder("featurelab.featuresets.submitted")
                .description("Featureset computations submitted to the worker pool")
                .register(meterRegistry);
        this.completed = Counter.builder("featurelab.featuresets.completed")
                .description("Featureset computations that produced an artifact")
                .register(meterRegistry);
        this.failed = Counter.builder("featurelab.featuresets.failed")
                .description("Featureset computations whose pipeline failed")
                .register(meterRegistry);
        Gauge.builder("featurelab.featuresets.in_flight", inFlight, AtomicInteger::get)
                .description("Featureset computations awaiting reconciliation")
                .register(meterRegistry);
    }

    public void recordSubmitted() {
        submitted.increment();
        inFlight.incrementAndGet();
    }

    public void recordCompleted() {
        completed.increment();
        inFlight.decrementAndGet();
    }

    public void recordFailed() {
        failed.increment();
        inFlight.decrementAndGet();
    }
}

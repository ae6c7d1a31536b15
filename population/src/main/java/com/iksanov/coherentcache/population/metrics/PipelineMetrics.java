package com.iksanov.coherentcache.population.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class PipelineMetrics {

    private final Counter sourceReads;
    private final Counter degradedReads;
    private final Counter populateFailures;
    private final Counter invalidationFailures;

    public PipelineMetrics(MeterRegistry registry) {
        this.sourceReads = Counter.builder("population.source.reads")
                .description("Queries sent to the source of truth")
                .register(registry);
        this.degradedReads = Counter.builder("population.reads.degraded")
                .description("Cache reads that failed and fell back to the source")
                .register(registry);
        this.populateFailures = Counter.builder("population.populate.failures")
                .description("Cache fills that failed after a source read")
                .register(registry);
        this.invalidationFailures = Counter.builder("population.invalidation.failures")
                .description("Keys whose invalidation failed after a committed update")
                .register(registry);
    }

    public void recordSourceRead() {
        sourceReads.increment();
    }

    public void recordDegradedRead() {
        degradedReads.increment();
    }

    public void recordPopulateFailure() {
        populateFailures.increment();
    }

    public void recordInvalidationFailure() {
        invalidationFailures.increment();
    }
}

package com.iksanov.coherentcache.core.metrics;

import com.iksanov.coherentcache.common.model.WriteOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Protocol metrics backed by Micrometer and exposed in Prometheus format.
 */
public class CoherenceMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter hits;
    private final Counter misses;
    private final Counter setsAccepted;
    private final Counter setsRejected;
    private final Counter invalidationsAccepted;
    private final Counter invalidationsRejected;
    private final Counter retries;
    private final Timer getLatency;
    private final Timer setLatency;
    private final Timer invalidateLatency;
    private final AtomicLong storeSize = new AtomicLong(0);

    public CoherenceMetrics() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public CoherenceMetrics(PrometheusMeterRegistry registry) {
        this.registry = registry;

        this.hits = Counter.builder("coherence.get.hits")
                .description("Reads that returned a fresh value")
                .register(registry);

        this.misses = Counter.builder("coherence.get.misses")
                .description("Reads that found no value or an invalidated one")
                .register(registry);

        this.setsAccepted = outcomeCounter("coherence.set", "accepted", "Conditional writes by outcome");
        this.setsRejected = outcomeCounter("coherence.set", "rejected", "Conditional writes by outcome");
        this.invalidationsAccepted = outcomeCounter("coherence.invalidate", "accepted", "Invalidations by outcome");
        this.invalidationsRejected = outcomeCounter("coherence.invalidate", "rejected", "Invalidations by outcome");

        this.retries = Counter.builder("coherence.retries")
                .description("Operations retried after a transient store failure")
                .register(registry);

        this.getLatency = latencyTimer("coherence.get.duration", "GET operation duration");
        this.setLatency = latencyTimer("coherence.set.duration", "SET operation duration");
        this.invalidateLatency = latencyTimer("coherence.invalidate.duration", "INVALIDATE operation duration");

        Gauge.builder("coherence.store.size", storeSize, AtomicLong::get)
                .description("Records held by the in-process store")
                .register(registry);

        Gauge.builder("coherence.hit.rate", this, CoherenceMetrics::calculateHitRate)
                .description("Read hit rate percentage")
                .register(registry);
    }

    private Counter outcomeCounter(String name, String outcome, String description) {
        return Counter.builder(name)
                .description(description)
                .tag("outcome", outcome)
                .register(registry);
    }

    private Timer latencyTimer(String name, String description) {
        return Timer.builder(name)
                .description(description)
                .publishPercentileHistogram()
                .serviceLevelObjectives(
                        Duration.ofMillis(1),
                        Duration.ofMillis(5),
                        Duration.ofMillis(10),
                        Duration.ofMillis(50),
                        Duration.ofMillis(100),
                        Duration.ofMillis(500)
                )
                .register(registry);
    }

    public void recordHit() {
        hits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordSet(WriteOutcome outcome) {
        (outcome.isAccepted() ? setsAccepted : setsRejected).increment();
    }

    public void recordInvalidate(WriteOutcome outcome) {
        (outcome.isAccepted() ? invalidationsAccepted : invalidationsRejected).increment();
    }

    public void recordError(String operation, Throwable error) {
        Counter.builder("coherence.errors")
                .description("Store failures by operation and exception type")
                .tag("operation", operation)
                .tag("type", error.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void updateSize(int size) {
        storeSize.set(size);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopGetTimer(Timer.Sample sample) {
        sample.stop(getLatency);
    }

    public void stopSetTimer(Timer.Sample sample) {
        sample.stop(setLatency);
    }

    public void stopInvalidateTimer(Timer.Sample sample) {
        sample.stop(invalidateLatency);
    }

    private double calculateHitRate() {
        double hitCount = hits.count();
        double total = hitCount + misses.count();
        return total == 0 ? 0.0 : (hitCount / total) * 100.0;
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}

package com.cityvibe.enrichment;

import com.cityvibe.domain.EnrichmentWarning;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics collector for event enrichment.
 *
 * Tracks:
 * - per-step outcomes (success, failure, skipped)
 * - per-step latency
 * - geocode cache hits and misses
 * - events abandoned at the batch deadline
 * - collaborator API calls and errors
 */
@Component
public class EnrichmentMetrics {

    private static final String STEP_OUTCOME = "cityvibe.enrichment.step";
    private static final String STEP_LATENCY = "cityvibe.enrichment.step.latency";

    private final MeterRegistry registry;
    private final Map<EnrichmentWarning.Step, Counter> successes = new EnumMap<>(EnrichmentWarning.Step.class);
    private final Map<EnrichmentWarning.Step, Counter> failures = new EnumMap<>(EnrichmentWarning.Step.class);
    private final Map<EnrichmentWarning.Step, Counter> skips = new EnumMap<>(EnrichmentWarning.Step.class);
    private final Map<EnrichmentWarning.Step, Timer> latencies = new EnumMap<>(EnrichmentWarning.Step.class);
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter abandoned;

    public EnrichmentMetrics(MeterRegistry registry) {
        this.registry = registry;

        for (EnrichmentWarning.Step step : EnrichmentWarning.Step.values()) {
            if (step == EnrichmentWarning.Step.ABANDONED) {
                continue;
            }
            String name = step.name().toLowerCase();
            successes.put(step, stepCounter(name, "success"));
            failures.put(step, stepCounter(name, "failure"));
            skips.put(step, stepCounter(name, "skipped"));
            latencies.put(step, Timer.builder(STEP_LATENCY)
                .description("Latency of a single enrichment step")
                .tag("step", name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry));
        }

        this.cacheHits = Counter.builder("cityvibe.enrichment.geocode.cache.hits")
            .description("Geocode lookups served from cache")
            .tag("component", "enrichment")
            .register(registry);

        this.cacheMisses = Counter.builder("cityvibe.enrichment.geocode.cache.misses")
            .description("Geocode lookups that went to the provider")
            .tag("component", "enrichment")
            .register(registry);

        this.abandoned = Counter.builder("cityvibe.enrichment.abandoned")
            .description("Events whose enrichment did not finish before the batch deadline")
            .tag("component", "enrichment")
            .register(registry);
    }

    private Counter stepCounter(String step, String result) {
        return Counter.builder(STEP_OUTCOME)
            .description("Enrichment step outcomes")
            .tag("step", step)
            .tag("result", result)
            .register(registry);
    }

    public void recordSuccess(EnrichmentWarning.Step step) {
        successes.get(step).increment();
    }

    public void recordFailure(EnrichmentWarning.Step step) {
        failures.get(step).increment();
    }

    public void recordSkipped(EnrichmentWarning.Step step) {
        skips.get(step).increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordAbandoned(int count) {
        abandoned.increment(count);
    }

    /**
     * Start measuring a step; stop the sample with {@link #recordLatency}
     */
    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordLatency(EnrichmentWarning.Step step, Timer.Sample sample) {
        sample.stop(latencies.get(step));
    }

    /**
     * Count a call to an external enrichment API
     *
     * @param api   short name of the API, e.g. "geocoding"
     * @param error whether the call ended in an error
     */
    public void recordApiCall(String api, boolean error) {
        Counter.builder("cityvibe.enrichment.api.calls")
            .description("Calls made to enrichment APIs")
            .tag("api", api)
            .tag("outcome", error ? "error" : "ok")
            .register(registry)
            .increment();
    }

    /**
     * Geocode cache hit rate as a percentage (0-100)
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        return total == 0 ? 0.0 : (hits / total) * 100.0;
    }
}

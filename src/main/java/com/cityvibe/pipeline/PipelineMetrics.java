package com.cityvibe.pipeline;

import com.cityvibe.domain.BatchResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for batch processing.
 * Tracks dedup decisions, invalid and skipped records, persistence errors,
 * failed batches and end-to-end batch latency.
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry registry;
    private final Counter batchesCompleted;
    private final Counter batchesFailed;
    private final Counter eventsNew;
    private final Counter eventsUpdated;
    private final Counter eventsDuplicate;
    private final Counter eventsInvalid;
    private final Counter eventsSkipped;
    private final Timer batchLatency;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.batchesCompleted = Counter.builder("cityvibe.batch.completed")
            .description("Batches that reached the persisted state")
            .register(registry);

        this.batchesFailed = Counter.builder("cityvibe.batch.failed")
            .description("Batches aborted by a fatal error")
            .register(registry);

        this.eventsNew = decisionCounter("new");
        this.eventsUpdated = decisionCounter("updated");
        this.eventsDuplicate = decisionCounter("duplicate");

        this.eventsInvalid = Counter.builder("cityvibe.events.invalid")
            .description("Records rejected by normalization or validation")
            .register(registry);

        this.eventsSkipped = Counter.builder("cityvibe.events.skipped")
            .description("Records skipped during deduplication")
            .register(registry);

        this.batchLatency = Timer.builder("cityvibe.batch.latency")
            .description("End-to-end latency of a batch")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    private Counter decisionCounter(String decision) {
        return Counter.builder("cityvibe.events.decisions")
            .description("Deduplication decisions")
            .tag("decision", decision)
            .register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    /**
     * Record the counts of a batch that reached the end of the pipeline
     */
    public void recordBatch(BatchResult result, Timer.Sample sample) {
        sample.stop(batchLatency);
        batchesCompleted.increment();
        eventsNew.increment(result.getNewCount());
        eventsUpdated.increment(result.getUpdated());
        eventsDuplicate.increment(result.getDuplicate());
        eventsInvalid.increment(result.getInvalid());
        eventsSkipped.increment(result.getSkipped());
    }

    public void recordFailure(Timer.Sample sample) {
        sample.stop(batchLatency);
        batchesFailed.increment();
    }
}

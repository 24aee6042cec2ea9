package com.cityvibe.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Batch-level limits of the pipeline.
 */
public final class PipelineSettings {

    private final Duration batchDeadline;

    public PipelineSettings(Duration batchDeadline) {
        this.batchDeadline = Objects.requireNonNull(batchDeadline, "batchDeadline");
        if (batchDeadline.isNegative() || batchDeadline.isZero()) {
            throw new IllegalArgumentException("batchDeadline must be positive: " + batchDeadline);
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(Duration.ofMinutes(5));
    }

    /**
     * Time budget from receiving a batch until enrichment must stop
     */
    public Duration getBatchDeadline() {
        return batchDeadline;
    }
}

package com.cityvibe.dedup;

import com.cityvibe.domain.BatchError;
import com.cityvibe.domain.DedupOutcome;

import java.util.List;

/**
 * Decisions for every deduplicated draft, in batch order, plus the drafts that were skipped.
 */
public final class DeduplicationResult {

    private final List<DedupOutcome> outcomes;
    private final List<BatchError> skipped;

    public DeduplicationResult(List<DedupOutcome> outcomes, List<BatchError> skipped) {
        this.outcomes = List.copyOf(outcomes);
        this.skipped = List.copyOf(skipped);
    }

    public List<DedupOutcome> getOutcomes() {
        return outcomes;
    }

    public List<BatchError> getSkipped() {
        return skipped;
    }
}

package com.cityvibe.domain;

/**
 * Lifecycle of a batch inside the pipeline coordinator.
 * RECEIVED -> NORMALIZED -> VALIDATED -> DEDUPLICATED -> ENRICHED -> PERSISTED,
 * or FAILED from any state on a batch-fatal condition.
 */
public enum BatchState {
    RECEIVED,
    NORMALIZED,
    VALIDATED,
    DEDUPLICATED,
    ENRICHED,
    PERSISTED,
    FAILED;

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }
}

package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Non-fatal failure of a single enrichment step for a single event.
 */
public final class EnrichmentWarning {

    public enum Step {
        GEOCODE,
        TAGS,
        EMBEDDING,
        ABANDONED
    }

    @JsonProperty("record_index")
    private final int recordIndex;

    @JsonProperty("step")
    private final Step step;

    @JsonProperty("message")
    private final String message;

    public EnrichmentWarning(int recordIndex, Step step, String message) {
        this.recordIndex = recordIndex;
        this.step = Objects.requireNonNull(step, "step");
        this.message = message;
    }

    public int getRecordIndex() {
        return recordIndex;
    }

    public Step getStep() {
        return step;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "[" + recordIndex + "] " + step + ": " + message;
    }
}

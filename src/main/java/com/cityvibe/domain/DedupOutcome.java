package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A draft paired with its deduplication decision.
 */
public final class DedupOutcome {

    @JsonProperty("draft")
    private final EventDraft draft;

    @JsonProperty("decision")
    private final DedupDecision decision;

    public DedupOutcome(EventDraft draft, DedupDecision decision) {
        this.draft = Objects.requireNonNull(draft, "draft");
        this.decision = Objects.requireNonNull(decision, "decision");
    }

    public EventDraft getDraft() {
        return draft;
    }

    public DedupDecision getDecision() {
        return decision;
    }

    public int getRecordIndex() {
        return draft.getRecordIndex();
    }

    @Override
    public String toString() {
        return "DedupOutcome{" + draft.getRecordIndex() + " -> " + decision + "}";
    }
}

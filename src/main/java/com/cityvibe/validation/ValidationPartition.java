package com.cityvibe.validation;

import com.cityvibe.domain.EventDraft;

import java.util.List;

/**
 * A batch split into valid and rejected drafts, each side in original batch order.
 * Rejected drafts carry their reasons.
 */
public final class ValidationPartition {

    private final List<EventDraft> valid;
    private final List<EventDraft> rejected;

    public ValidationPartition(List<EventDraft> valid, List<EventDraft> rejected) {
        this.valid = List.copyOf(valid);
        this.rejected = List.copyOf(rejected);
    }

    public List<EventDraft> getValid() {
        return valid;
    }

    public List<EventDraft> getRejected() {
        return rejected;
    }
}

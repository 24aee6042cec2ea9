package com.cityvibe.dedup;

import com.cityvibe.domain.EventDraft;

import java.util.Optional;

/**
 * Signature to event id lookup used for exact duplicate detection across runs.
 *
 * Entries are appended only after a batch commits, never while one is being deduplicated.
 */
public interface SignatureIndex {

    default String signatureOf(EventDraft draft) {
        return EventSignature.of(draft);
    }

    Optional<String> lookup(String signature);

    void append(String signature, String eventId);
}

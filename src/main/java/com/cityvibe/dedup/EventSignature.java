package com.cityvibe.dedup;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.normalization.TextNormalizer;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Deterministic identity hash of an event.
 *
 * SHA-256 over {@code lower(title) | start truncated to the minute | venue_id}. The same
 * logical event yields the same signature on every scrape run, whatever the source's
 * timestamp precision.
 */
public final class EventSignature {

    public static final String UNKNOWN_TIME = "unknown-time";

    private static final HashFunction SHA_256 = Hashing.sha256();
    private static final char SEPARATOR = '|';

    private EventSignature() {
    }

    /**
     * Compute the signature of a draft
     *
     * @throws IllegalArgumentException if title or venue id is missing
     */
    public static String of(EventDraft draft) {
        return of(draft.getTitle(), draft.getStartTime(), draft.getVenueId());
    }

    public static String of(String title, Instant startTime, String venueId) {
        String titleKey = TextNormalizer.identityKey(title);
        if (titleKey == null) {
            throw new IllegalArgumentException("Signature requires a title");
        }
        if (venueId == null || venueId.isBlank()) {
            throw new IllegalArgumentException("Signature requires a venue id");
        }
        String timeKey = startTime != null
            ? startTime.truncatedTo(ChronoUnit.MINUTES).toString()
            : UNKNOWN_TIME;

        String material = titleKey + SEPARATOR + timeKey + SEPARATOR + venueId.trim();
        return SHA_256.hashString(material, StandardCharsets.UTF_8).toString();
    }
}

package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity view of an event that already lives in the catalog.
 * Used as deduplication history; the pipeline never modifies it.
 */
public final class PersistedEvent {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("venue_id")
    private final String venueId;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("start_time")
    private final Instant startTime;

    @JsonProperty("signature")
    private final String signature;

    public PersistedEvent(String id, String venueId, String title, Instant startTime, String signature) {
        this.id = Objects.requireNonNull(id, "id");
        this.venueId = venueId;
        this.title = title;
        this.startTime = startTime;
        this.signature = signature;
    }

    public String getId() {
        return id;
    }

    public String getVenueId() {
        return venueId;
    }

    public String getTitle() {
        return title;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return "PersistedEvent{id='" + id + "', title='" + title + "', startTime=" + startTime + "}";
    }
}

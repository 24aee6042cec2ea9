package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Per-venue scraper configuration relevant to the pipeline.
 * The timezone resolves naive timestamps; the time format is an optional
 * {@link java.time.format.DateTimeFormatter} pattern for venue-specific date strings.
 */
public class VenueConfig {

    @JsonProperty("venue_id")
    private final String venueId;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("timezone")
    private final ZoneId timezone;

    @JsonProperty("time_format")
    private final String timeFormat;

    @JsonCreator
    public VenueConfig(
            @JsonProperty("venue_id") String venueId,
            @JsonProperty("name") String name,
            @JsonProperty("timezone") ZoneId timezone,
            @JsonProperty("time_format") String timeFormat) {
        this.venueId = Objects.requireNonNull(venueId, "venueId");
        this.name = name;
        this.timezone = timezone != null ? timezone : ZoneOffset.UTC;
        this.timeFormat = timeFormat;
    }

    /**
     * Config for a venue that is known but has no scraper hints
     */
    public static VenueConfig of(String venueId) {
        return new VenueConfig(venueId, null, ZoneOffset.UTC, null);
    }

    public String getVenueId() {
        return venueId;
    }

    public String getName() {
        return name;
    }

    public ZoneId getTimezone() {
        return timezone;
    }

    public String getTimeFormat() {
        return timeFormat;
    }

    @Override
    public String toString() {
        return "VenueConfig{venueId='" + venueId + "', timezone=" + timezone
            + ", timeFormat='" + timeFormat + "'}";
    }
}

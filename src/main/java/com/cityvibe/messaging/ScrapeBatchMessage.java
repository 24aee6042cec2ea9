package com.cityvibe.messaging;

import com.cityvibe.domain.VenueConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One scraper run's output for one venue, as published on the raw batches topic.
 */
public class ScrapeBatchMessage {

    @JsonProperty("scrape_run_id")
    private String scrapeRunId;

    @JsonProperty("venue_id")
    private String venueId;

    @JsonProperty("raw_events")
    private List<Map<String, Object>> rawEvents = new ArrayList<>();

    /**
     * Optional venue definition; registered before the batch is processed
     */
    @JsonProperty("venue")
    private VenueConfig venue;

    public ScrapeBatchMessage() {
    }

    public ScrapeBatchMessage(String scrapeRunId, String venueId, List<Map<String, Object>> rawEvents) {
        this.scrapeRunId = scrapeRunId;
        this.venueId = venueId;
        this.rawEvents = rawEvents;
    }

    public String getScrapeRunId() {
        return scrapeRunId;
    }

    public void setScrapeRunId(String scrapeRunId) {
        this.scrapeRunId = scrapeRunId;
    }

    public String getVenueId() {
        return venueId;
    }

    public void setVenueId(String venueId) {
        this.venueId = venueId;
    }

    public List<Map<String, Object>> getRawEvents() {
        return rawEvents;
    }

    public void setRawEvents(List<Map<String, Object>> rawEvents) {
        this.rawEvents = rawEvents;
    }

    public VenueConfig getVenue() {
        return venue;
    }

    public void setVenue(VenueConfig venue) {
        this.venue = venue;
    }

    @Override
    public String toString() {
        return "ScrapeBatchMessage{scrapeRunId='" + scrapeRunId + "', venueId='" + venueId
            + "', rawEvents=" + (rawEvents == null ? 0 : rawEvents.size()) + "}";
    }
}

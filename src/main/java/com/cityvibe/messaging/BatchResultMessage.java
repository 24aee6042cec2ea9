package com.cityvibe.messaging;

import com.cityvibe.domain.BatchResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Summary published for every processed batch.
 */
public class BatchResultMessage {

    @JsonProperty("scrape_run_id")
    private final String scrapeRunId;

    @JsonProperty("result")
    private final BatchResult result;

    @JsonProperty("completed_at")
    private final Instant completedAt;

    public BatchResultMessage(String scrapeRunId, BatchResult result) {
        this.scrapeRunId = scrapeRunId;
        this.result = result;
        this.completedAt = Instant.now();
    }

    public String getScrapeRunId() {
        return scrapeRunId;
    }

    public BatchResult getResult() {
        return result;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}

package com.cityvibe.messaging;

import com.cityvibe.domain.BatchResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A batch that could not be processed, kept on the dead-letter topic for
 * debugging and manual reprocessing. Carries the original message unchanged.
 */
public class FailedBatch {

    @JsonProperty("message")
    private final ScrapeBatchMessage message;

    @JsonProperty("error_message")
    private final String errorMessage;

    @JsonProperty("error_type")
    private final String errorType;

    @JsonProperty("partial_result")
    private final BatchResult partialResult;

    @JsonProperty("failed_at")
    private final Instant failedAt;

    public FailedBatch(ScrapeBatchMessage message, Throwable error, BatchResult partialResult) {
        this.message = message;
        Throwable root = error.getCause() != null ? error.getCause() : error;
        this.errorMessage = error.getMessage();
        this.errorType = root.getClass().getSimpleName();
        this.partialResult = partialResult;
        this.failedAt = Instant.now();
    }

    public ScrapeBatchMessage getMessage() {
        return message;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getErrorType() {
        return errorType;
    }

    public BatchResult getPartialResult() {
        return partialResult;
    }

    public Instant getFailedAt() {
        return failedAt;
    }
}

package com.cityvibe.pipeline;

import com.cityvibe.domain.BatchResult;

/**
 * The batch could not be completed. Nothing was committed unless the failure happened
 * after the commit; the partial result shows how far the batch got.
 */
public class BatchFatalException extends RuntimeException {

    private final BatchResult partialResult;

    public BatchFatalException(String message, BatchResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public BatchResult getPartialResult() {
        return partialResult;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (partialResult != null) {
            sb.append(" [Venue: ").append(partialResult.getVenueId()).append("]");
        }
        return sb.toString();
    }
}

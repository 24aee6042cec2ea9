package com.cityvibe.normalization;

/**
 * Exception thrown when a raw record cannot be turned into an event draft.
 * Carries the offending field and the record's position in the batch.
 */
public class NormalizationException extends RuntimeException {

    private final String field;
    private final int recordIndex;

    public NormalizationException(String message, String field, int recordIndex) {
        super(message);
        this.field = field;
        this.recordIndex = recordIndex;
    }

    public NormalizationException(String message, String field, int recordIndex, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.recordIndex = recordIndex;
    }

    public String getField() {
        return field;
    }

    public int getRecordIndex() {
        return recordIndex;
    }
}

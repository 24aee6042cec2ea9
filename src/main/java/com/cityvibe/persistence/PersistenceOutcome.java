package com.cityvibe.persistence;

import java.util.Objects;

/**
 * Per-row result of {@link EventStore#commit}.
 */
public final class PersistenceOutcome {

    private final int recordIndex;
    private final String eventId;
    private final String signature;
    private final String error;

    private PersistenceOutcome(int recordIndex, String eventId, String signature, String error) {
        this.recordIndex = recordIndex;
        this.eventId = eventId;
        this.signature = signature;
        this.error = error;
    }

    public static PersistenceOutcome success(int recordIndex, String eventId, String signature) {
        return new PersistenceOutcome(
            recordIndex,
            Objects.requireNonNull(eventId, "eventId"),
            Objects.requireNonNull(signature, "signature"),
            null);
    }

    public static PersistenceOutcome failure(int recordIndex, String error) {
        return new PersistenceOutcome(recordIndex, null, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public int getRecordIndex() {
        return recordIndex;
    }

    public String getEventId() {
        return eventId;
    }

    public String getSignature() {
        return signature;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "PersistenceOutcome{" + recordIndex + " -> " + eventId + "}"
            : "PersistenceOutcome{" + recordIndex + " failed: " + error + "}";
    }
}

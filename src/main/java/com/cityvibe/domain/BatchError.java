package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Per-record error entry collected into the batch result.
 */
public final class BatchError {

    @JsonProperty("record_index")
    private final int recordIndex;

    @JsonProperty("stage")
    private final BatchStage stage;

    @JsonProperty("reason")
    private final String reason;

    public BatchError(int recordIndex, BatchStage stage, String reason) {
        this.recordIndex = recordIndex;
        this.stage = Objects.requireNonNull(stage, "stage");
        this.reason = reason;
    }

    public int getRecordIndex() {
        return recordIndex;
    }

    public BatchStage getStage() {
        return stage;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BatchError)) {
            return false;
        }
        BatchError that = (BatchError) o;
        return recordIndex == that.recordIndex && stage == that.stage && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordIndex, stage, reason);
    }

    @Override
    public String toString() {
        return "[" + recordIndex + "] " + stage + ": " + reason;
    }
}

package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate result of one pipeline run over a batch.
 *
 * This is the only contract surfaced to the task harness. It is built once by the
 * coordinator and is immutable after {@link Builder#build()}.
 */
public final class BatchResult {

    @JsonProperty("venue_id")
    private final String venueId;

    @JsonProperty("state")
    private final BatchState state;

    @JsonProperty("processed")
    private final int processed;

    @JsonProperty("new")
    private final int newCount;

    @JsonProperty("updated")
    private final int updated;

    @JsonProperty("duplicate")
    private final int duplicate;

    @JsonProperty("invalid")
    private final int invalid;

    @JsonProperty("skipped")
    private final int skipped;

    @JsonProperty("errors")
    private final List<BatchError> errors;

    @JsonProperty("enrichment_warnings")
    private final List<EnrichmentWarning> enrichmentWarnings;

    @JsonIgnore
    private final List<EventDraft> rejected;

    @JsonIgnore
    private final List<DedupOutcome> toPersist;

    @JsonProperty("duration_ms")
    private final long durationMs;

    private BatchResult(Builder builder) {
        this.venueId = builder.venueId;
        this.state = builder.state;
        this.processed = builder.processed;
        this.newCount = builder.newCount;
        this.updated = builder.updated;
        this.duplicate = builder.duplicate;
        this.invalid = builder.invalid;
        this.skipped = builder.skipped;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.enrichmentWarnings = Collections.unmodifiableList(new ArrayList<>(builder.enrichmentWarnings));
        this.rejected = Collections.unmodifiableList(new ArrayList<>(builder.rejected));
        this.toPersist = Collections.unmodifiableList(new ArrayList<>(builder.toPersist));
        this.durationMs = builder.durationMs;
    }

    public static Builder builder(String venueId) {
        return new Builder(venueId);
    }

    public String getVenueId() {
        return venueId;
    }

    public BatchState getState() {
        return state;
    }

    public int getProcessed() {
        return processed;
    }

    public int getNewCount() {
        return newCount;
    }

    public int getUpdated() {
        return updated;
    }

    public int getDuplicate() {
        return duplicate;
    }

    public int getInvalid() {
        return invalid;
    }

    public int getSkipped() {
        return skipped;
    }

    public List<BatchError> getErrors() {
        return errors;
    }

    public List<EnrichmentWarning> getEnrichmentWarnings() {
        return enrichmentWarnings;
    }

    /**
     * Drafts rejected by normalization or validation; reasons are on each draft
     */
    public List<EventDraft> getRejected() {
        return rejected;
    }

    /**
     * Ordered New and UpdateOf outcomes handed to the event store
     */
    public List<DedupOutcome> getToPersist() {
        return toPersist;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "BatchResult{venueId='" + venueId + "', state=" + state
            + ", processed=" + processed
            + ", new=" + newCount
            + ", updated=" + updated
            + ", duplicate=" + duplicate
            + ", invalid=" + invalid
            + ", skipped=" + skipped
            + ", errors=" + errors.size()
            + ", warnings=" + enrichmentWarnings.size()
            + ", durationMs=" + durationMs + "}";
    }

    /**
     * Mutable accumulator used by the coordinator while the batch is in flight.
     */
    public static final class Builder {

        private final String venueId;
        private BatchState state = BatchState.RECEIVED;
        private int processed;
        private int newCount;
        private int updated;
        private int duplicate;
        private int invalid;
        private int skipped;
        private final List<BatchError> errors = new ArrayList<>();
        private final List<EnrichmentWarning> enrichmentWarnings = new ArrayList<>();
        private final List<EventDraft> rejected = new ArrayList<>();
        private final List<DedupOutcome> toPersist = new ArrayList<>();
        private long durationMs;

        private Builder(String venueId) {
            this.venueId = venueId;
        }

        public Builder state(BatchState state) {
            this.state = state;
            return this;
        }

        public BatchState state() {
            return state;
        }

        public Builder processed(int processed) {
            this.processed = processed;
            return this;
        }

        public Builder countDecision(DedupDecision decision) {
            switch (decision.getKind()) {
                case NEW:
                    newCount++;
                    break;
                case UPDATE_OF:
                    updated++;
                    break;
                case DUPLICATE_WITHIN_BATCH:
                    duplicate++;
                    break;
                default:
                    throw new IllegalStateException("Unknown decision kind: " + decision.getKind());
            }
            return this;
        }

        /**
         * Record that failed normalization and never became a draft
         */
        public Builder invalid(int recordIndex, BatchStage stage, String reason) {
            invalid++;
            errors.add(new BatchError(recordIndex, stage, reason));
            return this;
        }

        /**
         * Draft rejected by validation; one error entry per reason
         */
        public Builder rejected(EventDraft draft) {
            invalid++;
            rejected.add(draft);
            for (String reason : draft.getRejectionReasons()) {
                errors.add(new BatchError(draft.getRecordIndex(), BatchStage.VALIDATE, reason));
            }
            return this;
        }

        public Builder skipped(BatchError error) {
            skipped++;
            errors.add(error);
            return this;
        }

        public Builder error(BatchError error) {
            errors.add(error);
            return this;
        }

        public Builder warnings(List<EnrichmentWarning> warnings) {
            enrichmentWarnings.addAll(warnings);
            return this;
        }

        public Builder persist(DedupOutcome outcome) {
            toPersist.add(outcome);
            return this;
        }

        public List<DedupOutcome> pendingPersist() {
            return Collections.unmodifiableList(toPersist);
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public BatchResult build() {
            return new BatchResult(this);
        }
    }
}

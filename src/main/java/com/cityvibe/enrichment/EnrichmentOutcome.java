package com.cityvibe.enrichment;

import com.cityvibe.domain.Coordinates;
import com.cityvibe.domain.EnrichmentWarning;
import com.cityvibe.domain.EventDraft;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What enrichment found for one event. Computed off the draft and applied to it later,
 * so the draft is only ever written by the thread that owns the batch.
 */
public final class EnrichmentOutcome {

    private final int recordIndex;
    private final Coordinates coordinates;
    private final List<String> tags;
    private final float[] embedding;
    private final List<EnrichmentWarning> warnings;

    private EnrichmentOutcome(Builder builder) {
        this.recordIndex = builder.recordIndex;
        this.coordinates = builder.coordinates;
        this.tags = builder.tags == null ? null : List.copyOf(builder.tags);
        this.embedding = builder.embedding != null ? builder.embedding.clone() : null;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
    }

    static Builder builder(int recordIndex) {
        return new Builder(recordIndex);
    }

    public int getRecordIndex() {
        return recordIndex;
    }

    public Coordinates getCoordinates() {
        return coordinates;
    }

    public List<String> getTags() {
        return tags;
    }

    public float[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public List<EnrichmentWarning> getWarnings() {
        return warnings;
    }

    /**
     * Copy every field this outcome resolved onto the draft; unresolved fields are left as they are
     */
    public void applyTo(EventDraft draft) {
        if (coordinates != null) {
            draft.setLatitude(coordinates.getLatitude());
            draft.setLongitude(coordinates.getLongitude());
        }
        if (tags != null) {
            draft.setTags(tags);
        }
        if (embedding != null) {
            draft.setEmbedding(embedding);
        }
    }

    static final class Builder {

        private final int recordIndex;
        private Coordinates coordinates;
        private List<String> tags;
        private float[] embedding;
        private final List<EnrichmentWarning> warnings = new ArrayList<>();

        private Builder(int recordIndex) {
            this.recordIndex = recordIndex;
        }

        int recordIndex() {
            return recordIndex;
        }

        void coordinates(Coordinates coordinates) {
            this.coordinates = coordinates;
        }

        void tags(List<String> tags) {
            this.tags = tags;
        }

        List<String> tags() {
            return tags;
        }

        void embedding(float[] embedding) {
            this.embedding = embedding;
        }

        void warn(EnrichmentWarning.Step step, String message) {
            warnings.add(new EnrichmentWarning(recordIndex, step, message));
        }

        EnrichmentOutcome build() {
            return new EnrichmentOutcome(this);
        }
    }
}

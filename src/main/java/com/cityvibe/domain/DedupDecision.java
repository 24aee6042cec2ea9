package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Outcome of deduplication for a single draft.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DedupDecision {

    public enum Kind {
        NEW,
        UPDATE_OF,
        DUPLICATE_WITHIN_BATCH
    }

    /**
     * How the decision was reached, kept for logs and metrics
     */
    public enum Match {
        NONE,
        EXACT,
        FUZZY
    }

    private static final DedupDecision NEW = new DedupDecision(Kind.NEW, Match.NONE, null, null);

    @JsonProperty("kind")
    private final Kind kind;

    @JsonProperty("match")
    private final Match match;

    @JsonProperty("existing_id")
    private final String existingId;

    @JsonProperty("first_index")
    private final Integer firstIndex;

    private DedupDecision(Kind kind, Match match, String existingId, Integer firstIndex) {
        this.kind = kind;
        this.match = match;
        this.existingId = existingId;
        this.firstIndex = firstIndex;
    }

    public static DedupDecision newEvent() {
        return NEW;
    }

    public static DedupDecision updateOf(String existingId, Match match) {
        return new DedupDecision(Kind.UPDATE_OF, match, Objects.requireNonNull(existingId, "existingId"), null);
    }

    public static DedupDecision duplicateWithinBatch(int firstIndex, Match match) {
        return new DedupDecision(Kind.DUPLICATE_WITHIN_BATCH, match, null, firstIndex);
    }

    public Kind getKind() {
        return kind;
    }

    public Match getMatch() {
        return match;
    }

    public String getExistingId() {
        return existingId;
    }

    public Integer getFirstIndex() {
        return firstIndex;
    }

    public boolean isPersistable() {
        return kind != Kind.DUPLICATE_WITHIN_BATCH;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DedupDecision)) {
            return false;
        }
        DedupDecision that = (DedupDecision) o;
        return kind == that.kind
            && Objects.equals(existingId, that.existingId)
            && Objects.equals(firstIndex, that.firstIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, existingId, firstIndex);
    }

    @Override
    public String toString() {
        switch (kind) {
            case UPDATE_OF:
                return "UpdateOf(" + existingId + ", " + match + ")";
            case DUPLICATE_WITHIN_BATCH:
                return "DuplicateWithinBatch(" + firstIndex + ", " + match + ")";
            default:
                return "New";
        }
    }
}

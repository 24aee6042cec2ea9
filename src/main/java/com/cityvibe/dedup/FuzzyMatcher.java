package com.cityvibe.dedup;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.PersistedEvent;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Near-duplicate test: same venue, similar title and overlapping time window.
 *
 * When either side has no start time the window check is skipped and title + venue
 * decide alone. Every check is symmetric, so {@code matches(a, b) == matches(b, a)}.
 */
public class FuzzyMatcher {

    private final DeduplicationSettings settings;

    public FuzzyMatcher(DeduplicationSettings settings) {
        this.settings = settings;
    }

    public boolean matches(EventDraft a, EventDraft b) {
        return matches(MatchKey.of(a), MatchKey.of(b));
    }

    public boolean matches(EventDraft draft, PersistedEvent event) {
        return matches(MatchKey.of(draft), MatchKey.of(event));
    }

    boolean matches(MatchKey a, MatchKey b) {
        if (a.venueId() == null || !a.venueId().equals(b.venueId())) {
            return false;
        }
        if (!withinTimeWindow(a.startTime(), b.startTime())) {
            return false;
        }
        return TitleSimilarity.ratio(a.title(), b.title()) >= settings.getSimilarityThreshold();
    }

    boolean withinTimeWindow(Instant a, Instant b) {
        if (a == null || b == null) {
            return true;
        }
        switch (settings.getTimeWindow()) {
            case SAME_DAY:
                LocalDate dayA = a.atZone(settings.getZone()).toLocalDate();
                LocalDate dayB = b.atZone(settings.getZone()).toLocalDate();
                return dayA.equals(dayB);
            case TOLERANCE:
                return Duration.between(a, b).abs().compareTo(settings.getTimeTolerance()) <= 0;
            default:
                throw new IllegalStateException("Unknown time window: " + settings.getTimeWindow());
        }
    }
}

package com.cityvibe.dedup;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.PersistedEvent;

import java.time.Instant;

/**
 * The fields fuzzy matching looks at, shared by batch drafts and persisted history.
 */
final class MatchKey {

    private final String title;
    private final String venueId;
    private final Instant startTime;

    MatchKey(String title, String venueId, Instant startTime) {
        this.title = title;
        this.venueId = venueId;
        this.startTime = startTime;
    }

    static MatchKey of(EventDraft draft) {
        return new MatchKey(draft.getTitle(), draft.getVenueId(), draft.getStartTime());
    }

    static MatchKey of(PersistedEvent event) {
        return new MatchKey(event.getTitle(), event.getVenueId(), event.getStartTime());
    }

    String title() {
        return title;
    }

    String venueId() {
        return venueId;
    }

    Instant startTime() {
        return startTime;
    }
}

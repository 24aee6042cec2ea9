package com.cityvibe.dedup;

import com.cityvibe.domain.PersistedEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a venue's recent catalog events, loaded once per batch.
 */
public final class HistorySnapshot {

    private static final HistorySnapshot EMPTY = new HistorySnapshot(List.of());

    private final List<PersistedEvent> events;
    private final Map<String, String> idsBySignature;

    private HistorySnapshot(List<PersistedEvent> events) {
        this.events = List.copyOf(events);
        Map<String, String> signatures = new LinkedHashMap<>();
        for (PersistedEvent event : this.events) {
            if (event.getSignature() != null) {
                signatures.putIfAbsent(event.getSignature(), event.getId());
            }
        }
        this.idsBySignature = Collections.unmodifiableMap(signatures);
    }

    public static HistorySnapshot of(List<PersistedEvent> events) {
        return events.isEmpty() ? EMPTY : new HistorySnapshot(events);
    }

    public static HistorySnapshot empty() {
        return EMPTY;
    }

    /**
     * Events in the order the store returned them; fuzzy matching scans them in this order
     */
    public List<PersistedEvent> getEvents() {
        return events;
    }

    public Optional<String> idForSignature(String signature) {
        return Optional.ofNullable(idsBySignature.get(signature));
    }

    public int size() {
        return events.size();
    }
}

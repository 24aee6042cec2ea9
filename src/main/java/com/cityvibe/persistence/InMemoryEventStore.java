package com.cityvibe.persistence;

import com.cityvibe.domain.DedupDecision;
import com.cityvibe.domain.DedupOutcome;
import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.PersistedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Event store kept in process memory.
 *
 * Backs the service when no database adapter is wired in and is the store used by tests.
 * New rows get a random UUID. Updates replace the row's content in place and keep its id.
 * Signatures are never removed, so a row stays reachable through every signature it was
 * ever stored under.
 */
@Repository
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<StoredEvent> BY_START_TIME = Comparator.comparing(
        StoredEvent::startTime, Comparator.nullsLast(Comparator.naturalOrder()));
    private static final Comparator<StoredEvent> LATEST_FIRST = Comparator.comparing(
        StoredEvent::startTime, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Map<String, StoredEvent> rows = new ConcurrentHashMap<>();
    private final Map<String, String> idsBySignature = new ConcurrentHashMap<>();

    @Override
    public List<PersistedEvent> recentHistory(String venueId, Instant from, Instant until, int limit) {
        return rows.values().stream()
            .filter(row -> row.venueId().equals(venueId))
            .filter(row -> row.startsWithin(from, until))
            .sorted(LATEST_FIRST.thenComparing(StoredEvent::id))
            .limit(limit)
            .sorted(BY_START_TIME.thenComparing(StoredEvent::id))
            .map(StoredEvent::toPersistedEvent)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<String> findIdBySignature(String signature) {
        if (signature == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idsBySignature.get(signature));
    }

    @Override
    public synchronized List<PersistenceOutcome> commit(String venueId, List<DedupOutcome> outcomes) {
        List<PersistenceOutcome> results = new ArrayList<>(outcomes.size());
        for (DedupOutcome outcome : outcomes) {
            results.add(commitOne(venueId, outcome));
        }
        log.debug("Committed {} rows for venue {}", results.size(), venueId);
        return results;
    }

    private PersistenceOutcome commitOne(String venueId, DedupOutcome outcome) {
        EventDraft draft = outcome.getDraft();
        DedupDecision decision = outcome.getDecision();
        int index = outcome.getRecordIndex();

        if (draft.getSignature() == null) {
            return PersistenceOutcome.failure(index, "draft has no signature");
        }
        if (!venueId.equals(draft.getVenueId())) {
            return PersistenceOutcome.failure(index,
                "draft venue " + draft.getVenueId() + " does not belong to batch venue " + venueId);
        }

        String id;
        switch (decision.getKind()) {
            case NEW:
                id = UUID.randomUUID().toString();
                break;
            case UPDATE_OF:
                id = decision.getExistingId();
                if (!rows.containsKey(id)) {
                    return PersistenceOutcome.failure(index, "event " + id + " does not exist");
                }
                break;
            default:
                return PersistenceOutcome.failure(index, "decision " + decision + " is not persistable");
        }

        rows.put(id, new StoredEvent(id, draft.copy()));
        idsBySignature.put(draft.getSignature(), id);
        return PersistenceOutcome.success(index, id, draft.getSignature());
    }

    public Optional<EventDraft> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(row -> row.draft().copy());
    }

    public int size() {
        return rows.size();
    }

    /**
     * One catalog row; holds a private copy of the draft as it was at commit time
     */
    private static final class StoredEvent {

        private final String id;
        private final EventDraft draft;

        private StoredEvent(String id, EventDraft draft) {
            this.id = id;
            this.draft = draft;
        }

        String id() {
            return id;
        }

        String venueId() {
            return draft.getVenueId();
        }

        Instant startTime() {
            return draft.getStartTime();
        }

        boolean startsWithin(Instant from, Instant until) {
            Instant start = draft.getStartTime();
            if (start == null) {
                return true;
            }
            return (from == null || !start.isBefore(from)) && (until == null || !start.isAfter(until));
        }

        EventDraft draft() {
            return draft;
        }

        PersistedEvent toPersistedEvent() {
            return new PersistedEvent(id, draft.getVenueId(), draft.getTitle(), draft.getStartTime(),
                draft.getSignature());
        }
    }
}

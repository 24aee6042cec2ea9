package com.cityvibe.persistence;

import com.cityvibe.domain.DedupOutcome;
import com.cityvibe.domain.PersistedEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Catalog storage as seen by the pipeline.
 *
 * Implementations throw {@link PersistenceUnavailableException} when the store cannot be
 * reached at all. Failures of individual rows during a commit are reported through
 * {@link PersistenceOutcome#failure} instead.
 */
public interface EventStore {

    /**
     * Events of a venue starting within {@code [from, until]}, plus events without a start
     * time, at most {@code limit} of them. A null bound leaves that side open.
     *
     * When more events qualify than {@code limit}, the latest starts are kept: the far past
     * goes first, undated events before any dated one. The result is ordered by start time
     * with undated events last.
     */
    List<PersistedEvent> recentHistory(String venueId, Instant from, Instant until, int limit);

    Optional<String> findIdBySignature(String signature);

    /**
     * Insert NEW outcomes and update the rows named by UPDATE_OF outcomes.
     *
     * @return one outcome per input, in input order
     */
    List<PersistenceOutcome> commit(String venueId, List<DedupOutcome> outcomes);
}

package com.cityvibe.pipeline;

import com.cityvibe.dedup.DeduplicationResult;
import com.cityvibe.dedup.DeduplicationSettings;
import com.cityvibe.dedup.EventDeduplicator;
import com.cityvibe.dedup.HistorySnapshot;
import com.cityvibe.dedup.SignatureIndex;
import com.cityvibe.domain.BatchError;
import com.cityvibe.domain.BatchResult;
import com.cityvibe.domain.BatchStage;
import com.cityvibe.domain.BatchState;
import com.cityvibe.domain.DedupOutcome;
import com.cityvibe.domain.EnrichmentWarning;
import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.PersistedEvent;
import com.cityvibe.domain.RawRecord;
import com.cityvibe.enrichment.EventEnricher;
import com.cityvibe.normalization.EventNormalizer;
import com.cityvibe.normalization.NormalizationException;
import com.cityvibe.persistence.EventStore;
import com.cityvibe.persistence.PersistenceOutcome;
import com.cityvibe.persistence.PersistenceUnavailableException;
import com.cityvibe.validation.EventValidator;
import com.cityvibe.validation.ValidationResult;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs one scraped batch through the pipeline.
 *
 * RECEIVED -> NORMALIZED -> VALIDATED -> DEDUPLICATED -> ENRICHED -> PERSISTED, or FAILED.
 *
 * Per-record problems end up in the {@link BatchResult}; only an unreachable event store
 * (or an unexpected crash) aborts the batch with a {@link BatchFatalException}. Nothing is
 * written before the persist stage.
 */
@Service
public class PipelineCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final EventNormalizer normalizer;
    private final EventValidator validator;
    private final EventDeduplicator deduplicator;
    private final EventEnricher enricher;
    private final EventStore eventStore;
    private final SignatureIndex signatureIndex;
    private final DeduplicationSettings dedupSettings;
    private final PipelineSettings settings;
    private final PipelineMetrics metrics;

    public PipelineCoordinator(
            EventNormalizer normalizer,
            EventValidator validator,
            EventDeduplicator deduplicator,
            EventEnricher enricher,
            EventStore eventStore,
            SignatureIndex signatureIndex,
            DeduplicationSettings dedupSettings,
            PipelineSettings settings,
            PipelineMetrics metrics) {
        this.normalizer = normalizer;
        this.validator = validator;
        this.deduplicator = deduplicator;
        this.enricher = enricher;
        this.eventStore = eventStore;
        this.signatureIndex = signatureIndex;
        this.dedupSettings = dedupSettings;
        this.settings = settings;
        this.metrics = metrics;
    }

    /**
     * Process the raw events one scraper produced for a venue
     *
     * @param venueId venue the batch was scraped for
     * @param rawEvents records in scraper order; the position is the record index
     * @return the batch result in state PERSISTED
     * @throws BatchFatalException if the batch could not be completed
     */
    public BatchResult process(String venueId, List<Map<String, Object>> rawEvents) {
        if (venueId == null || venueId.isBlank()) {
            throw new IllegalArgumentException("venueId must not be blank");
        }

        long started = System.nanoTime();
        Timer.Sample sample = metrics.startTimer();
        BatchResult.Builder result = BatchResult.builder(venueId).processed(rawEvents.size());
        log.info("Processing batch for venue {} with {} records", venueId, rawEvents.size());

        try {
            List<EventDraft> valid = normalizeAndValidate(venueId, rawEvents, result);

            HistorySnapshot snapshot = loadHistory(venueId);
            DeduplicationResult dedup = deduplicator.deduplicate(valid, snapshot);
            dedup.getSkipped().forEach(result::skipped);
            for (DedupOutcome outcome : dedup.getOutcomes()) {
                result.countDecision(outcome.getDecision());
                if (outcome.getDecision().isPersistable()) {
                    result.persist(outcome);
                }
            }
            result.state(BatchState.DEDUPLICATED);

            List<EventDraft> toEnrich = result.pendingPersist().stream()
                .map(DedupOutcome::getDraft)
                .collect(Collectors.toList());
            Duration remaining = settings.getBatchDeadline().minusNanos(System.nanoTime() - started);
            List<EnrichmentWarning> warnings = enricher.enrichBatch(toEnrich, remaining);
            result.warnings(warnings);
            result.state(BatchState.ENRICHED);

            persist(venueId, result);
            result.state(BatchState.PERSISTED);

        } catch (RuntimeException e) {
            BatchState reached = result.state();
            result.state(BatchState.FAILED).durationMs(elapsedMillis(started));
            metrics.recordFailure(sample);
            log.error("Batch for venue {} failed after state {}: {}", venueId, reached, e.getMessage(), e);
            String reason = e instanceof PersistenceUnavailableException
                ? "Event store unavailable after state " + reached
                : "Batch failed after state " + reached;
            throw new BatchFatalException(reason, result.build(), e);
        }

        BatchResult finished = result.durationMs(elapsedMillis(started)).build();
        metrics.recordBatch(finished, sample);
        log.info("Finished batch: {}", finished);
        return finished;
    }

    private List<EventDraft> normalizeAndValidate(
            String venueId, List<Map<String, Object>> rawEvents, BatchResult.Builder result) {
        List<Prepared> prepared = Flux.range(0, rawEvents.size())
            .parallel()
            .runOn(Schedulers.parallel())
            .map(index -> prepare(new RawRecord(index, rawEvents.get(index)), venueId))
            .sequential()
            .collectSortedList(Comparator.comparingInt(Prepared::index))
            .block();

        result.state(BatchState.NORMALIZED);

        // errors are recorded in record order, whichever stage raised them
        List<EventDraft> valid = new ArrayList<>();
        for (Prepared record : prepared) {
            if (record.draft == null) {
                log.warn("Record {} failed normalization: {}", record.index, record.error);
                result.invalid(record.index, BatchStage.NORMALIZE, record.error);
            } else if (record.validation.isValid()) {
                valid.add(record.draft);
            } else {
                log.warn("Record {} rejected: {}", record.index, record.validation.getReasons());
                result.rejected(record.draft);
            }
        }
        result.state(BatchState.VALIDATED);

        log.debug("Batch for venue {}: {} valid drafts out of {} records", venueId, valid.size(), rawEvents.size());
        return valid;
    }

    private Prepared prepare(RawRecord raw, String venueId) {
        try {
            EventDraft draft = normalizer.normalize(raw, venueId);
            return new Prepared(raw.getIndex(), draft, validator.validate(draft), null);
        } catch (NormalizationException e) {
            return new Prepared(raw.getIndex(), null, null, e.getField() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error normalizing record {}", raw.getIndex(), e);
            return new Prepared(raw.getIndex(), null, null,
                "unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private HistorySnapshot loadHistory(String venueId) {
        Instant now = Instant.now();
        Instant from = now.minus(dedupSettings.getHistoryWindow());
        Instant until = now.plus(dedupSettings.getHistoryWindow());
        List<PersistedEvent> history = eventStore.recentHistory(
            venueId, from, until, dedupSettings.getHistoryLimit());
        log.debug("Loaded {} history events for venue {} between {} and {}", history.size(), venueId, from, until);
        return HistorySnapshot.of(history);
    }

    private void persist(String venueId, BatchResult.Builder result) {
        List<DedupOutcome> toPersist = result.pendingPersist();
        if (toPersist.isEmpty()) {
            log.info("Nothing to persist for venue {}", venueId);
            return;
        }

        List<PersistenceOutcome> outcomes = eventStore.commit(venueId, toPersist);
        int failed = 0;
        for (PersistenceOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                signatureIndex.append(outcome.getSignature(), outcome.getEventId());
            } else {
                failed++;
                log.warn("Record {} could not be persisted: {}", outcome.getRecordIndex(), outcome.getError());
                result.error(new BatchError(outcome.getRecordIndex(), BatchStage.PERSIST, outcome.getError()));
            }
        }
        log.info("Persisted {} of {} events for venue {}", outcomes.size() - failed, toPersist.size(), venueId);
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    /**
     * Result of normalizing and validating one record; exactly one of draft and error is set
     */
    private static final class Prepared {

        private final int index;
        private final EventDraft draft;
        private final ValidationResult validation;
        private final String error;

        private Prepared(int index, EventDraft draft, ValidationResult validation, String error) {
            this.index = index;
            this.draft = draft;
            this.validation = validation;
            this.error = error;
        }

        int index() {
            return index;
        }
    }
}

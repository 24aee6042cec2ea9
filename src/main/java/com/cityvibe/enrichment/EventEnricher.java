package com.cityvibe.enrichment;

import com.cityvibe.domain.Coordinates;
import com.cityvibe.domain.EnrichmentWarning;
import com.cityvibe.domain.EnrichmentWarning.Step;
import com.cityvibe.domain.EventDraft;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Adds coordinates, tags and an embedding to validated drafts.
 *
 * Steps run in a fixed order per event: geocode, tags, embedding. Each step is optional,
 * bounded by its own timeout and never fails the event; a failed step leaves its field
 * unset and records a warning. Geocode results are cached by address.
 */
@Component
public class EventEnricher {

    private static final Logger log = LoggerFactory.getLogger(EventEnricher.class);

    static final String ABANDONED_MESSAGE = "enrichment did not finish before the batch deadline";

    private final GeocodingClient geocodingClient;
    private final TaggingClient taggingClient;
    private final EmbeddingClient embeddingClient;
    private final EnrichmentSettings settings;
    private final EnrichmentMetrics metrics;
    private final Cache<String, Coordinates> geocodeCache;

    public EventEnricher(
            GeocodingClient geocodingClient,
            TaggingClient taggingClient,
            EmbeddingClient embeddingClient,
            EnrichmentSettings settings,
            EnrichmentMetrics metrics) {
        this.geocodingClient = geocodingClient;
        this.taggingClient = taggingClient;
        this.embeddingClient = embeddingClient;
        this.settings = settings;
        this.metrics = metrics;
        this.geocodeCache = Caffeine.newBuilder()
            .maximumSize(settings.getGeocodeCacheSize())
            .expireAfterWrite(settings.getGeocodeCacheTtl())
            .recordStats()
            .build();
    }

    /**
     * Enrich a single draft. The draft is read but not modified; apply the outcome with
     * {@link EnrichmentOutcome#applyTo}.
     *
     * @return the outcome; never completes with an error
     */
    public Mono<EnrichmentOutcome> enrich(EventDraft draft) {
        EnrichmentOutcome.Builder outcome = EnrichmentOutcome.builder(draft.getRecordIndex());

        Mono<Void> geocode = runStep(
            Step.GEOCODE,
            settings.isGeocodeEnabled(),
            draft.getAddress() != null && !draft.hasCoordinates(),
            settings.getGeocodeTimeout(),
            () -> geocode(draft.getAddress()),
            outcome::coordinates,
            outcome);

        Mono<Void> tags = runStep(
            Step.TAGS,
            settings.isTagsEnabled(),
            draft.getTags().isEmpty(),
            settings.getTagsTimeout(),
            () -> taggingClient.extractTags(tagText(draft))
                .map(found -> mergeCategories(found, draft.getCategories())),
            found -> {
                if (!found.isEmpty()) {
                    outcome.tags(found);
                }
            },
            outcome);

        Mono<Void> embedding = Mono.defer(() -> runStep(
            Step.EMBEDDING,
            settings.isEmbeddingEnabled(),
            draft.getEmbedding() == null,
            settings.getEmbeddingTimeout(),
            () -> embeddingClient.embed(embeddingText(draft, outcome.tags())),
            outcome::embedding,
            outcome));

        return geocode
            .then(tags)
            .then(embedding)
            .then(Mono.fromSupplier(outcome::build));
    }

    /**
     * Enrich a batch with bounded concurrency and apply the outcomes on the calling thread.
     *
     * When the deadline passes, work still in flight is cancelled; those drafts keep their
     * current fields and get an {@link Step#ABANDONED} warning.
     *
     * @return every warning raised, in draft order
     */
    public List<EnrichmentWarning> enrichBatch(List<EventDraft> drafts, Duration deadline) {
        if (drafts.isEmpty()) {
            return List.of();
        }

        Map<Integer, EnrichmentOutcome> completed = new ConcurrentHashMap<>();
        if (deadline.isNegative() || deadline.isZero()) {
            log.warn("No time left for enrichment of {} events", drafts.size());
        } else {
            Flux.fromIterable(drafts)
                .flatMap(draft -> enrich(draft).subscribeOn(Schedulers.boundedElastic()),
                    settings.getConcurrency())
                .doOnNext(outcome -> completed.put(outcome.getRecordIndex(), outcome))
                .take(deadline)
                .then()
                .block();
        }

        List<EnrichmentWarning> warnings = new ArrayList<>();
        int abandoned = 0;
        for (EventDraft draft : drafts) {
            EnrichmentOutcome outcome = completed.get(draft.getRecordIndex());
            if (outcome == null) {
                abandoned++;
                warnings.add(new EnrichmentWarning(draft.getRecordIndex(), Step.ABANDONED, ABANDONED_MESSAGE));
                continue;
            }
            outcome.applyTo(draft);
            warnings.addAll(outcome.getWarnings());
        }

        if (abandoned > 0) {
            metrics.recordAbandoned(abandoned);
            log.warn("Batch deadline {} reached, enrichment abandoned for {} of {} events",
                deadline, abandoned, drafts.size());
        }
        return warnings;
    }

    private <T> Mono<Void> runStep(
            Step step,
            boolean enabled,
            boolean applicable,
            Duration timeout,
            Supplier<Mono<T>> call,
            Consumer<T> onResult,
            EnrichmentOutcome.Builder outcome) {
        if (!enabled || !applicable) {
            metrics.recordSkipped(step);
            return Mono.empty();
        }

        return Mono.defer(() -> {
            Timer.Sample sample = metrics.startTimer();
            return Mono.defer(call)
                .timeout(timeout)
                .doOnNext(onResult)
                .hasElement()
                .doOnNext(found -> {
                    metrics.recordLatency(step, sample);
                    if (found) {
                        metrics.recordSuccess(step);
                    } else {
                        metrics.recordFailure(step);
                        outcome.warn(step, "no result");
                    }
                })
                .then()
                .onErrorResume(e -> {
                    metrics.recordLatency(step, sample);
                    metrics.recordFailure(step);
                    String message = describe(e, timeout);
                    outcome.warn(step, message);
                    log.warn("Enrichment step {} failed for record {}: {}", step, outcome.recordIndex(), message);
                    return Mono.empty();
                });
        });
    }

    private Mono<Coordinates> geocode(String address) {
        String key = address.toLowerCase(Locale.ROOT);
        Coordinates cached = geocodeCache.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            return Mono.just(cached);
        }
        metrics.recordCacheMiss();
        return geocodingClient.geocode(address)
            .doOnNext(coordinates -> geocodeCache.put(key, coordinates));
    }

    static String tagText(EventDraft draft) {
        return draft.getDescription() == null
            ? draft.getTitle()
            : draft.getTitle() + " " + draft.getDescription();
    }

    static String embeddingText(EventDraft draft, List<String> enrichedTags) {
        StringBuilder text = new StringBuilder(draft.getTitle());
        if (draft.getDescription() != null) {
            text.append(". ").append(draft.getDescription());
        }
        Set<String> tags = enrichedTags != null ? new LinkedHashSet<>(enrichedTags) : draft.getTags();
        if (!tags.isEmpty()) {
            text.append(". ").append(String.join(", ", tags));
        }
        return text.toString();
    }

    private static List<String> mergeCategories(List<String> found, Set<String> categories) {
        Set<String> merged = new LinkedHashSet<>(found);
        categories.stream()
            .map(category -> category.toLowerCase(Locale.ROOT))
            .forEach(merged::add);
        return merged.stream().collect(Collectors.toList());
    }

    private static String describe(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        if (error instanceof EnrichmentException) {
            return ((EnrichmentException) error).getKind().name().toLowerCase(Locale.ROOT) + ": " + error.getMessage();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    public long getGeocodeCacheSize() {
        return geocodeCache.estimatedSize();
    }
}

package com.cityvibe.enrichment;

import com.cityvibe.domain.EnrichmentWarning;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;

/**
 * REST implementation of EmbeddingClient against an embeddings endpoint
 * ({@code POST /v1/embeddings} with {@code {"model", "input"}}).
 */
@Component
public class EmbeddingClientRestImpl implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingClientRestImpl.class);

    private static final String API = "embedding";

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final EnrichmentMetrics metrics;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final int maxRetries;

    public EmbeddingClientRestImpl(
            WebClient.Builder webClientBuilder,
            EnrichmentMetrics metrics,
            @Value("${cityvibe.embedding.url:https://embeddings.example.com}") String baseUrl,
            @Value("${cityvibe.embedding.api-key:}") String apiKey,
            @Value("${cityvibe.embedding.model:text-embedding-small}") String model,
            @Value("${cityvibe.embedding.timeout:PT8S}") Duration timeout,
            @Value("${cityvibe.embedding.max-retries:2}") int maxRetries,
            @Value("${cityvibe.embedding.requests-per-second:20}") int requestsPerSecond) {
        this.metrics = metrics;
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.webClient = webClientBuilder
            .baseUrl(baseUrl)
            .build();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .ignoreException(e -> ClientErrors.classify(e) == EnrichmentException.Kind.PERMANENT)
            .build();
        this.circuitBreaker = CircuitBreaker.of("embeddingClient", cbConfig);

        RateLimiterConfig rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(requestsPerSecond)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ofMillis(250))
            .build();
        this.rateLimiter = RateLimiter.of("embeddingClient", rlConfig);
    }

    @Override
    public Mono<float[]> embed(String text) {
        return webClient.post()
            .uri("/v1/embeddings")
            .header("Authorization", "Bearer " + apiKey)
            .bodyValue(Map.of("model", model, "input", text))
            .retrieve()
            .bodyToMono(EmbeddingResponse.class)
            .timeout(timeout)
            .flatMap(response -> response.embedding == null || response.embedding.length == 0
                ? Mono.error(new EnrichmentException(EnrichmentException.Kind.PERMANENT,
                    EnrichmentWarning.Step.EMBEDDING, "provider returned no embedding"))
                : Mono.just(response.embedding))
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(200))
                .filter(ClientErrors::isRetryable))
            .doOnNext(vector -> {
                metrics.recordApiCall(API, false);
                log.debug("Embedded {} chars into {} dimensions", text.length(), vector.length);
            })
            .onErrorMap(e -> {
                metrics.recordApiCall(API, true);
                return ClientErrors.toEnrichmentException(EnrichmentWarning.Step.EMBEDDING, e);
            });
    }

    static final class EmbeddingResponse {

        @JsonProperty("embedding")
        float[] embedding;
    }
}

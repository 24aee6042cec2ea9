package com.cityvibe.enrichment;

import com.cityvibe.domain.Coordinates;
import com.cityvibe.domain.EnrichmentWarning;
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
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * REST implementation of GeocodingClient.
 *
 * Features:
 * - Circuit breaker around the provider
 * - Rate limiting to stay within the provider's quota
 * - Retry with exponential backoff for transient failures
 * - 404 from the provider means the address is unknown and yields an empty result
 */
@Component
public class GeocodingClientRestImpl implements GeocodingClient {

    private static final Logger log = LoggerFactory.getLogger(GeocodingClientRestImpl.class);

    private static final String API = "geocoding";

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final EnrichmentMetrics metrics;
    private final String apiKey;
    private final Duration timeout;
    private final int maxRetries;

    public GeocodingClientRestImpl(
            WebClient.Builder webClientBuilder,
            EnrichmentMetrics metrics,
            @Value("${cityvibe.geocoding.url:https://geocoding.example.com}") String baseUrl,
            @Value("${cityvibe.geocoding.api-key:}") String apiKey,
            @Value("${cityvibe.geocoding.timeout:PT3S}") Duration timeout,
            @Value("${cityvibe.geocoding.max-retries:2}") int maxRetries,
            @Value("${cityvibe.geocoding.requests-per-second:50}") int requestsPerSecond) {
        this.metrics = metrics;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.webClient = webClientBuilder
            .baseUrl(baseUrl)
            .build();

        // Opens at 50% failures over the last 10 calls, half-open after 30 seconds
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .ignoreException(e -> ClientErrors.classify(e) == EnrichmentException.Kind.PERMANENT)
            .build();
        this.circuitBreaker = CircuitBreaker.of("geocodingClient", cbConfig);

        RateLimiterConfig rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(requestsPerSecond)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ofMillis(100))
            .build();
        this.rateLimiter = RateLimiter.of("geocodingClient", rlConfig);
    }

    @Override
    public Mono<Coordinates> geocode(String address) {
        return webClient.get()
            .uri(uri -> uri.path("/v1/geocode").queryParam("address", address).build())
            .header("X-API-Key", apiKey)
            .retrieve()
            .bodyToMono(Coordinates.class)
            .timeout(timeout)
            .onErrorResume(this::isNotFound, e -> Mono.empty())
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(100))
                .filter(ClientErrors::isRetryable))
            .doOnSuccess(coordinates -> {
                metrics.recordApiCall(API, false);
                log.debug("Geocoded '{}' to {}", address, coordinates);
            })
            .onErrorMap(e -> {
                metrics.recordApiCall(API, true);
                return ClientErrors.toEnrichmentException(EnrichmentWarning.Step.GEOCODE, e);
            });
    }

    private boolean isNotFound(Throwable throwable) {
        return throwable instanceof WebClientResponseException
            && ((WebClientResponseException) throwable).getStatusCode().value() == 404;
    }
}

package com.cityvibe.enrichment;

import com.cityvibe.domain.EnrichmentWarning.Step;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientErrors Tests")
class ClientErrorsTest {

    private static WebClientResponseException http(int status) {
        return WebClientResponseException.create(status, "status " + status, HttpHeaders.EMPTY,
            new byte[0], StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503})
    @DisplayName("Should treat throttling and server errors as transient")
    void shouldClassifyTransientStatuses(int status) {
        assertThat(ClientErrors.classify(http(status))).isEqualTo(EnrichmentException.Kind.TRANSIENT);
        assertThat(ClientErrors.isRetryable(http(status))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 422})
    @DisplayName("Should treat other client errors as permanent")
    void shouldClassifyPermanentStatuses(int status) {
        assertThat(ClientErrors.classify(http(status))).isEqualTo(EnrichmentException.Kind.PERMANENT);
        assertThat(ClientErrors.isRetryable(http(status))).isFalse();
    }

    @Test
    @DisplayName("Should treat unreadable bodies as permanent and network errors as transient")
    void shouldClassifyOtherFailures() {
        assertThat(ClientErrors.classify(new DecodingException("bad json"))).isEqualTo(EnrichmentException.Kind.PERMANENT);
        assertThat(ClientErrors.classify(new IOException("connection reset"))).isEqualTo(EnrichmentException.Kind.TRANSIENT);
    }

    @Test
    @DisplayName("Should not retry when the circuit is open or the rate limit is exhausted")
    void shouldNotRetryRejectedCalls() {
        CallNotPermittedException open = CallNotPermittedException
            .createCallNotPermittedException(CircuitBreaker.ofDefaults("geocoding"));
        RequestNotPermitted limited = RequestNotPermitted
            .createRequestNotPermitted(RateLimiter.ofDefaults("geocoding"));

        assertThat(ClientErrors.classify(open)).isEqualTo(EnrichmentException.Kind.TRANSIENT);
        assertThat(ClientErrors.isRetryable(open)).isFalse();
        assertThat(ClientErrors.isRetryable(limited)).isFalse();
    }

    @Test
    @DisplayName("Should unwrap exhausted retries to the last failure")
    void shouldUnwrapRetryExhausted() {
        RuntimeException exhausted = Exceptions.retryExhausted("Retries exhausted: 2/2", http(503));

        EnrichmentException mapped = ClientErrors.toEnrichmentException(Step.GEOCODE, exhausted);

        assertThat(mapped.getKind()).isEqualTo(EnrichmentException.Kind.TRANSIENT);
        assertThat(mapped.getStep()).isEqualTo(Step.GEOCODE);
        assertThat(mapped.getMessage()).isEqualTo("HTTP 503 from provider");
        assertThat(mapped.getCause()).isInstanceOf(WebClientResponseException.class);
    }

    @Test
    @DisplayName("Should pass enrichment exceptions through unchanged")
    void shouldKeepEnrichmentExceptions() {
        EnrichmentException original = new EnrichmentException(
            EnrichmentException.Kind.PERMANENT, Step.EMBEDDING, "empty embedding");

        assertThat(ClientErrors.toEnrichmentException(Step.EMBEDDING, original)).isSameAs(original);
    }
}

package com.cityvibe.enrichment;

import com.cityvibe.domain.EnrichmentWarning;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/**
 * Maps failures of HTTP enrichment calls onto {@link EnrichmentException} kinds.
 *
 * 429 and 5xx responses, network errors, an open circuit and an exhausted rate limit are
 * TRANSIENT. Any other 4xx and an unreadable body are PERMANENT.
 */
final class ClientErrors {

    private ClientErrors() {
    }

    static boolean isRetryable(Throwable throwable) {
        return classify(throwable) == EnrichmentException.Kind.TRANSIENT
            && !(throwable instanceof CallNotPermittedException)
            && !(throwable instanceof RequestNotPermitted);
    }

    static EnrichmentException.Kind classify(Throwable throwable) {
        if (throwable instanceof EnrichmentException) {
            return ((EnrichmentException) throwable).getKind();
        }
        if (throwable instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) throwable).getStatusCode().value();
            return status == 429 || status >= 500
                ? EnrichmentException.Kind.TRANSIENT
                : EnrichmentException.Kind.PERMANENT;
        }
        if (throwable instanceof CodecException || throwable instanceof IllegalArgumentException) {
            return EnrichmentException.Kind.PERMANENT;
        }
        return EnrichmentException.Kind.TRANSIENT;
    }

    static EnrichmentException toEnrichmentException(EnrichmentWarning.Step step, Throwable throwable) {
        if (throwable instanceof EnrichmentException) {
            return (EnrichmentException) throwable;
        }
        Throwable cause = Exceptions.unwrap(throwable);
        if (Exceptions.isRetryExhausted(throwable) && throwable.getCause() != null) {
            cause = throwable.getCause();
        }
        return new EnrichmentException(classify(cause), step, describe(cause), cause);
    }

    private static String describe(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            WebClientResponseException ex = (WebClientResponseException) throwable;
            return "HTTP " + ex.getStatusCode().value() + " from provider";
        }
        return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
    }
}

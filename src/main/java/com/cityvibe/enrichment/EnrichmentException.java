package com.cityvibe.enrichment;

import com.cityvibe.domain.EnrichmentWarning;

/**
 * Failure reported by an enrichment collaborator.
 *
 * TRANSIENT failures may succeed on a later attempt (timeouts, throttling, 5xx); the
 * collaborator decides whether to retry. PERMANENT failures will not (bad input, 4xx).
 */
public class EnrichmentException extends RuntimeException {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final Kind kind;
    private final EnrichmentWarning.Step step;

    public EnrichmentException(Kind kind, EnrichmentWarning.Step step, String message) {
        super(message);
        this.kind = kind;
        this.step = step;
    }

    public EnrichmentException(Kind kind, EnrichmentWarning.Step step, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.step = step;
    }

    public Kind getKind() {
        return kind;
    }

    public EnrichmentWarning.Step getStep() {
        return step;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}

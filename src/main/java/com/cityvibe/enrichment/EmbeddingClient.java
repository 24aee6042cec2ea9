package com.cityvibe.enrichment;

import reactor.core.publisher.Mono;

/**
 * Computes a semantic embedding vector for an event's text.
 */
public interface EmbeddingClient {

    Mono<float[]> embed(String text);
}

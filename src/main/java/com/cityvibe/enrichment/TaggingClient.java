package com.cityvibe.enrichment;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Derives descriptive tags from an event's text.
 */
public interface TaggingClient {

    Mono<List<String>> extractTags(String text);
}

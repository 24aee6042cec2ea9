package com.cityvibe.enrichment;

import com.cityvibe.domain.Coordinates;
import reactor.core.publisher.Mono;

/**
 * Resolves a postal address to coordinates.
 */
public interface GeocodingClient {

    /**
     * Geocode an address.
     *
     * @param address free-form address as scraped
     * @return the coordinates, empty if the provider knows no match, or an
     *         {@link EnrichmentException} on failure
     */
    Mono<Coordinates> geocode(String address);
}

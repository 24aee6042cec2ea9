package com.cityvibe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the CityVibe event ETL service.
 *
 * Takes raw event records produced by venue scrapers and turns them into clean,
 * deduplicated, enriched catalog events:
 * - normalization of scraper-specific shapes into one canonical draft
 * - validation of business rules
 * - duplicate detection within the batch and against the catalog
 * - geocoding, tagging and embedding enrichment
 * - a single commit per batch
 *
 * Batches arrive over Kafka, one message per venue and scraper run.
 */
@SpringBootApplication
public class CityVibeEtlApplication {

    public static void main(String[] args) {
        SpringApplication.run(CityVibeEtlApplication.class, args);
    }
}

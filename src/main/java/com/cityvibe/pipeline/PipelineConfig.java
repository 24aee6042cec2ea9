package com.cityvibe.pipeline;

import com.cityvibe.dedup.DeduplicationSettings;
import com.cityvibe.enrichment.EnrichmentSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Builds the pipeline's settings objects from the {@code cityvibe.*} properties.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public DeduplicationSettings deduplicationSettings(
            @Value("${cityvibe.dedup.similarity-threshold:0.85}") double similarityThreshold,
            @Value("${cityvibe.dedup.time-window:SAME_DAY}") DeduplicationSettings.TimeWindow timeWindow,
            @Value("${cityvibe.dedup.time-tolerance:PT3H}") Duration timeTolerance,
            @Value("${cityvibe.dedup.zone:UTC}") ZoneId zone,
            @Value("${cityvibe.dedup.history-window:P30D}") Duration historyWindow,
            @Value("${cityvibe.dedup.history-limit:5000}") int historyLimit) {
        DeduplicationSettings settings = new DeduplicationSettings(
            similarityThreshold, timeWindow, timeTolerance, zone, historyWindow, historyLimit);
        log.info("Deduplication configured: {}", settings);
        return settings;
    }

    @Bean
    public EnrichmentSettings enrichmentSettings(
            @Value("${cityvibe.enrichment.geocode.enabled:true}") boolean geocodeEnabled,
            @Value("${cityvibe.enrichment.geocode.timeout:PT5S}") Duration geocodeTimeout,
            @Value("${cityvibe.enrichment.tags.enabled:true}") boolean tagsEnabled,
            @Value("${cityvibe.enrichment.tags.timeout:PT2S}") Duration tagsTimeout,
            @Value("${cityvibe.enrichment.embedding.enabled:true}") boolean embeddingEnabled,
            @Value("${cityvibe.enrichment.embedding.timeout:PT10S}") Duration embeddingTimeout,
            @Value("${cityvibe.enrichment.concurrency:8}") int concurrency,
            @Value("${cityvibe.enrichment.geocode.cache.size:10000}") long geocodeCacheSize,
            @Value("${cityvibe.enrichment.geocode.cache.ttl:PT24H}") Duration geocodeCacheTtl) {
        return EnrichmentSettings.builder()
            .geocode(geocodeEnabled, geocodeTimeout)
            .tags(tagsEnabled, tagsTimeout)
            .embedding(embeddingEnabled, embeddingTimeout)
            .concurrency(concurrency)
            .geocodeCache(geocodeCacheSize, geocodeCacheTtl)
            .build();
    }

    @Bean
    public PipelineSettings pipelineSettings(
            @Value("${cityvibe.pipeline.batch-deadline:PT5M}") Duration batchDeadline) {
        return new PipelineSettings(batchDeadline);
    }
}

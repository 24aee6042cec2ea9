package com.cityvibe.enrichment;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-step switches and timeouts for enrichment, plus batch concurrency and geocode caching.
 */
public final class EnrichmentSettings {

    private final boolean geocodeEnabled;
    private final Duration geocodeTimeout;
    private final boolean tagsEnabled;
    private final Duration tagsTimeout;
    private final boolean embeddingEnabled;
    private final Duration embeddingTimeout;
    private final int concurrency;
    private final long geocodeCacheSize;
    private final Duration geocodeCacheTtl;

    private EnrichmentSettings(Builder builder) {
        if (builder.concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive: " + builder.concurrency);
        }
        this.geocodeEnabled = builder.geocodeEnabled;
        this.geocodeTimeout = Objects.requireNonNull(builder.geocodeTimeout, "geocodeTimeout");
        this.tagsEnabled = builder.tagsEnabled;
        this.tagsTimeout = Objects.requireNonNull(builder.tagsTimeout, "tagsTimeout");
        this.embeddingEnabled = builder.embeddingEnabled;
        this.embeddingTimeout = Objects.requireNonNull(builder.embeddingTimeout, "embeddingTimeout");
        this.concurrency = builder.concurrency;
        this.geocodeCacheSize = builder.geocodeCacheSize;
        this.geocodeCacheTtl = Objects.requireNonNull(builder.geocodeCacheTtl, "geocodeCacheTtl");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EnrichmentSettings defaults() {
        return builder().build();
    }

    public boolean isGeocodeEnabled() {
        return geocodeEnabled;
    }

    public Duration getGeocodeTimeout() {
        return geocodeTimeout;
    }

    public boolean isTagsEnabled() {
        return tagsEnabled;
    }

    public Duration getTagsTimeout() {
        return tagsTimeout;
    }

    public boolean isEmbeddingEnabled() {
        return embeddingEnabled;
    }

    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public long getGeocodeCacheSize() {
        return geocodeCacheSize;
    }

    public Duration getGeocodeCacheTtl() {
        return geocodeCacheTtl;
    }

    public static final class Builder {

        private boolean geocodeEnabled = true;
        private Duration geocodeTimeout = Duration.ofSeconds(5);
        private boolean tagsEnabled = true;
        private Duration tagsTimeout = Duration.ofSeconds(2);
        private boolean embeddingEnabled = true;
        private Duration embeddingTimeout = Duration.ofSeconds(10);
        private int concurrency = 8;
        private long geocodeCacheSize = 10_000;
        private Duration geocodeCacheTtl = Duration.ofHours(24);

        private Builder() {
        }

        public Builder geocode(boolean enabled, Duration timeout) {
            this.geocodeEnabled = enabled;
            this.geocodeTimeout = timeout;
            return this;
        }

        public Builder tags(boolean enabled, Duration timeout) {
            this.tagsEnabled = enabled;
            this.tagsTimeout = timeout;
            return this;
        }

        public Builder embedding(boolean enabled, Duration timeout) {
            this.embeddingEnabled = enabled;
            this.embeddingTimeout = timeout;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder geocodeCache(long maximumSize, Duration ttl) {
            this.geocodeCacheSize = maximumSize;
            this.geocodeCacheTtl = ttl;
            return this;
        }

        public EnrichmentSettings build() {
            return new EnrichmentSettings(this);
        }
    }
}

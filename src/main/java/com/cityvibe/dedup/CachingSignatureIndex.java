package com.cityvibe.dedup;

import com.cityvibe.persistence.EventStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Signature index backed by the event store with a Caffeine cache in front.
 *
 * Only hits are cached. A miss always goes to the store, so a signature committed by
 * another instance is found on the next lookup.
 */
@Component
public class CachingSignatureIndex implements SignatureIndex {

    private static final Logger log = LoggerFactory.getLogger(CachingSignatureIndex.class);

    private final EventStore eventStore;
    private final Cache<String, String> cache;

    public CachingSignatureIndex(
            EventStore eventStore,
            @Value("${cityvibe.dedup.signature-cache.size:100000}") long maximumSize,
            @Value("${cityvibe.dedup.signature-cache.ttl:PT1H}") Duration ttl) {
        this.eventStore = eventStore;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    @Override
    public Optional<String> lookup(String signature) {
        String cached = cache.getIfPresent(signature);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> found = eventStore.findIdBySignature(signature);
        found.ifPresent(id -> cache.put(signature, id));
        return found;
    }

    @Override
    public void append(String signature, String eventId) {
        cache.put(signature, eventId);
        log.trace("Indexed signature {} -> {}", signature, eventId);
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }
}

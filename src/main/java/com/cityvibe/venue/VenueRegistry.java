package com.cityvibe.venue;

import com.cityvibe.domain.VenueConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of venues the pipeline can resolve.
 * Supplies timezone and time-format hints to the normalizer and answers
 * resolvability for the validator.
 */
@Component
public class VenueRegistry {

    private static final Logger log = LoggerFactory.getLogger(VenueRegistry.class);

    private final Map<String, VenueConfig> venues = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final String venuesFile;

    public VenueRegistry(
            ObjectMapper objectMapper,
            @Value("${cityvibe.venues.file:}") String venuesFile) {
        this.objectMapper = objectMapper;
        this.venuesFile = venuesFile;
    }

    /**
     * Load venue definitions from the configured JSON file, if any
     */
    @PostConstruct
    public void registerVenues() {
        if (venuesFile == null || venuesFile.isBlank()) {
            log.info("No venue file configured, venues are registered at runtime");
            return;
        }

        Path path = Path.of(venuesFile);
        try {
            List<VenueConfig> configs = objectMapper.readValue(
                Files.readAllBytes(path), new TypeReference<List<VenueConfig>>() { });
            configs.forEach(this::register);
            log.info("Registered {} venues from {}", configs.size(), path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load venue definitions from " + path, e);
        }
    }

    /**
     * Registers or replaces the configuration of a venue
     *
     * @param config the venue configuration
     */
    public void register(VenueConfig config) {
        VenueConfig previous = venues.put(config.getVenueId(), config);
        if (previous == null) {
            log.debug("Registered venue {}", config);
        }
    }

    public Optional<VenueConfig> find(String venueId) {
        if (venueId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(venues.get(venueId));
    }

    public boolean isResolvable(String venueId) {
        return venueId != null && venues.containsKey(venueId);
    }

    public int size() {
        return venues.size();
    }
}

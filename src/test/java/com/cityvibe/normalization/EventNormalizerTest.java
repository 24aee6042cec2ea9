package com.cityvibe.normalization;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.RawRecord;
import com.cityvibe.domain.VenueConfig;
import com.cityvibe.venue.VenueRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventNormalizer Tests")
class EventNormalizerTest {

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        VenueRegistry registry = new VenueRegistry(new ObjectMapper(), "");
        registry.register(new VenueConfig("venue-1", "Blue Note", ZoneId.of("Europe/Berlin"), null));
        normalizer = new EventNormalizer(registry);
    }

    @Test
    @DisplayName("Should map canonical field names onto the draft")
    void shouldNormalizeCanonicalRecord() {
        Map<String, Object> data = new HashMap<>();
        data.put("title", "  Jazz   Night ");
        data.put("description", "Live quartet");
        data.put("start_time", "2024-06-01T20:00:00Z");
        data.put("end_time", "2024-06-01T23:00:00Z");
        data.put("source_url", "https://bluenote.example.com/events/1");
        data.put("price_min", "12,50");
        data.put("price_max", 20);
        data.put("currency", "eur");
        data.put("sold_out", "no");
        data.put("categories", List.of("Jazz", Map.of("name", "Live Music")));

        EventDraft draft = normalizer.normalize(new RawRecord(3, data), "venue-1");

        assertThat(draft.getRecordIndex()).isEqualTo(3);
        assertThat(draft.getTitle()).isEqualTo("Jazz Night");
        assertThat(draft.getVenueId()).isEqualTo("venue-1");
        assertThat(draft.getStartTime()).isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
        assertThat(draft.getEndTime()).isEqualTo(Instant.parse("2024-06-01T23:00:00Z"));
        assertThat(draft.getPriceMin()).isEqualByComparingTo(new BigDecimal("12.50"));
        assertThat(draft.getPriceMax()).isEqualByComparingTo(new BigDecimal("20"));
        assertThat(draft.getCurrency()).isEqualTo("EUR");
        assertThat(draft.getSoldOut()).isFalse();
        assertThat(draft.getCategories()).containsExactly("Jazz", "Live Music");
        assertThat(draft.getRejectionReasons()).isEmpty();
    }

    @Test
    @DisplayName("Should accept scraper aliases and resolve naive times in the venue zone")
    void shouldNormalizeAliases() {
        Map<String, Object> data = new HashMap<>();
        data.put("name", "Open Mic");
        data.put("intro", "Bring your guitar");
        data.put("dates", List.of(Map.of("startDate", "2024-06-01T20:00", "endDate", "2024-06-01T22:00")));
        data.put("url", "https://example.com/open-mic");
        data.put("slug", "open-mic-june");

        EventDraft draft = normalizer.normalize(new RawRecord(0, data), "venue-1");

        assertThat(draft.getTitle()).isEqualTo("Open Mic");
        assertThat(draft.getDescription()).isEqualTo("Bring your guitar");
        assertThat(draft.getStartTime()).isEqualTo(Instant.parse("2024-06-01T18:00:00Z"));
        assertThat(draft.getEndTime()).isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
        assertThat(draft.getSourceUrl()).isEqualTo("https://example.com/open-mic");
        assertThat(draft.getExternalId()).isEqualTo("open-mic-june");
    }

    @Test
    @DisplayName("Should fall through blank values to the next populated alias")
    void shouldSkipBlankAliases() {
        Map<String, Object> data = new HashMap<>();
        data.put("title", "   ");
        data.put("name", "Jazz Night");
        data.put("start_time", "");
        data.put("start", "2024-06-01T20:00:00Z");
        data.put("coordinates", Map.of("lat", "", "latitude", 52.52, "lng", 13.405));

        EventDraft draft = normalizer.normalize(new RawRecord(0, data), "venue-1");

        assertThat(draft.getTitle()).isEqualTo("Jazz Night");
        assertThat(draft.getStartTime()).isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
        assertThat(draft.getLatitude()).isEqualTo(52.52);
    }

    @Test
    @DisplayName("Should build address from parts and read nested coordinates")
    void shouldExtractLocation() {
        Map<String, Object> data = new HashMap<>();
        data.put("title", "Street Festival");
        data.put("address", Map.of("street", "Hauptstr.", "houseNumber", "5", "zipcode", "10115", "city", "Berlin"));
        data.put("coordinates", Map.of("lat", "52.52", "lng", 13.405));

        EventDraft draft = normalizer.normalize(new RawRecord(0, data), "venue-1");

        assertThat(draft.getAddress()).isEqualTo("Hauptstr. 5 10115 Berlin");
        assertThat(draft.getLatitude()).isEqualTo(52.52);
        assertThat(draft.getLongitude()).isEqualTo(13.405);
        assertThat(draft.hasCoordinates()).isTrue();
    }

    @Test
    @DisplayName("Should drop half-known or out-of-range coordinates")
    void shouldDropInvalidCoordinates() {
        Map<String, Object> halfKnown = Map.of("title", "A", "lat", 52.5);
        Map<String, Object> outOfRange = Map.of("title", "B", "lat", 95.0, "lng", 13.4);

        assertThat(normalizer.normalize(new RawRecord(0, halfKnown), "venue-1").hasCoordinates()).isFalse();
        assertThat(normalizer.normalize(new RawRecord(1, outOfRange), "venue-1").hasCoordinates()).isFalse();
    }

    @Test
    @DisplayName("Should use a single price for both bounds")
    void shouldUseSinglePrice() {
        EventDraft draft = normalizer.normalize(new RawRecord(0, Map.of("title", "Gig", "price", "€ 15")), "venue-1");

        assertThat(draft.getPriceMin()).isEqualByComparingTo("15");
        assertThat(draft.getPriceMax()).isEqualByComparingTo("15");
    }

    @Test
    @DisplayName("Should prefer the record's own venue id over the batch venue")
    void shouldPreferRecordVenue() {
        EventDraft draft = normalizer.normalize(
            new RawRecord(0, Map.of("title", "Gig", "venue_id", "venue-2")), "venue-1");

        assertThat(draft.getVenueId()).isEqualTo("venue-2");
    }

    @Test
    @DisplayName("Should keep unparsable times as absent rather than failing")
    void shouldTolerateUnparsableTime() {
        EventDraft draft = normalizer.normalize(
            new RawRecord(0, Map.of("title", "Gig", "start_time", "sometime soon")), "venue-1");

        assertThat(draft.getStartTime()).isNull();
    }

    @Test
    @DisplayName("Should fail with field context when the title is missing")
    void shouldFailWithoutTitle() {
        RawRecord record = new RawRecord(7, Map.of("description", "no title here"));

        assertThatThrownBy(() -> normalizer.normalize(record, "venue-1"))
            .isInstanceOf(NormalizationException.class)
            .satisfies(e -> {
                NormalizationException ne = (NormalizationException) e;
                assertThat(ne.getField()).isEqualTo("title");
                assertThat(ne.getRecordIndex()).isEqualTo(7);
            });
    }

    @Test
    @DisplayName("Should fail when neither record nor batch has a venue")
    void shouldFailWithoutVenue() {
        assertThatThrownBy(() -> normalizer.normalize(new RawRecord(0, Map.of("title", "Gig")), null))
            .isInstanceOf(NormalizationException.class)
            .extracting(e -> ((NormalizationException) e).getField())
            .isEqualTo("venue_id");
    }

    @Test
    @DisplayName("Should treat a null record as having no title")
    void shouldHandleNullRecord() {
        assertThatThrownBy(() -> normalizer.normalize(new RawRecord(0, null), "venue-1"))
            .isInstanceOf(NormalizationException.class);
    }
}

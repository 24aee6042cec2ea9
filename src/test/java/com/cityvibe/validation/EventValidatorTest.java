package com.cityvibe.validation;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.VenueConfig;
import com.cityvibe.venue.VenueRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventValidator Tests")
class EventValidatorTest {

    private EventValidator validator;

    @BeforeEach
    void setUp() {
        VenueRegistry registry = new VenueRegistry(new ObjectMapper(), "");
        registry.register(VenueConfig.of("venue-1"));
        validator = new EventValidator(registry);
    }

    private static EventDraft validDraft(int index) {
        EventDraft draft = new EventDraft(index);
        draft.setTitle("Jazz Night");
        draft.setVenueId("venue-1");
        draft.setStartTime(Instant.parse("2024-06-01T20:00:00Z"));
        draft.setEndTime(Instant.parse("2024-06-01T23:00:00Z"));
        draft.setPriceMin(new BigDecimal("10"));
        draft.setPriceMax(new BigDecimal("20"));
        draft.setSourceUrl("https://bluenote.example.com/jazz");
        return draft;
    }

    @Test
    @DisplayName("Should accept a well-formed draft")
    void shouldAcceptValidDraft() {
        EventDraft draft = validDraft(0);

        ValidationResult result = validator.validate(draft);

        assertThat(result.isValid()).isTrue();
        assertThat(draft.isRejected()).isFalse();
    }

    @Test
    @DisplayName("Should accept a draft without optional fields")
    void shouldAcceptMinimalDraft() {
        EventDraft draft = new EventDraft(0);
        draft.setTitle("Gig");
        draft.setVenueId("venue-1");

        assertThat(validator.validate(draft).isValid()).isTrue();
    }

    @Test
    @DisplayName("Should report every failing rule, not just the first")
    void shouldCollectAllReasons() {
        EventDraft draft = validDraft(0);
        draft.setTitle("  ");
        draft.setEndTime(Instant.parse("2024-06-01T19:00:00Z"));
        draft.setPriceMin(new BigDecimal("30"));
        draft.setSourceUrl("not a url");

        ValidationResult result = validator.validate(draft);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getReasons())
            .extracting(reason -> reason.substring(0, reason.indexOf(':')))
            .containsExactly(
                EventValidator.TITLE_REQUIRED,
                EventValidator.END_BEFORE_START,
                EventValidator.PRICE_RANGE_INVERTED,
                EventValidator.SOURCE_URL_INVALID);
        assertThat(draft.getRejectionReasons()).isEqualTo(result.getReasons());
    }

    @Test
    @DisplayName("Should reject drafts whose venue is not registered")
    void shouldRejectUnknownVenue() {
        EventDraft draft = validDraft(0);
        draft.setVenueId("nowhere");

        ValidationResult result = validator.validate(draft);

        assertThat(result.getReasons()).singleElement()
            .asString().startsWith(EventValidator.VENUE_UNRESOLVED);
    }

    @Test
    @DisplayName("Should describe inverted price range with both bounds")
    void shouldDescribePriceRange() {
        EventDraft draft = validDraft(0);
        draft.setPriceMin(new BigDecimal("25.00"));

        assertThat(validator.validate(draft).getReasons())
            .containsExactly("price_range_inverted: price_min 25.00 exceeds price_max 20");
    }

    @Test
    @DisplayName("Should allow end equal to start")
    void shouldAllowZeroLengthEvent() {
        EventDraft draft = validDraft(0);
        draft.setEndTime(draft.getStartTime());

        assertThat(validator.validate(draft).isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"/events/1", "mailto:info@example.com", "http://", "https://exa mple.com"})
    @DisplayName("Should reject relative or host-less source URLs")
    void shouldRejectBadUrls(String url) {
        EventDraft draft = validDraft(0);
        draft.setSourceUrl(url);

        assertThat(validator.validate(draft).getReasons())
            .singleElement().asString().startsWith(EventValidator.SOURCE_URL_INVALID);
    }

    @Test
    @DisplayName("Should partition a batch preserving order")
    void shouldPartitionBatch() {
        EventDraft first = validDraft(0);
        EventDraft bad = validDraft(1);
        bad.setTitle(null);
        EventDraft third = validDraft(2);

        ValidationPartition partition = validator.validateBatch(List.of(first, bad, third));

        assertThat(partition.getValid()).containsExactly(first, third);
        assertThat(partition.getRejected()).containsExactly(bad);
    }
}

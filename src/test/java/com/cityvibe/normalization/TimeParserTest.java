package com.cityvibe.normalization;

import com.cityvibe.domain.VenueConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeParser Tests")
class TimeParserTest {

    private static final VenueConfig BERLIN = new VenueConfig("v1", "Club", ZoneId.of("Europe/Berlin"), null);
    private static final VenueConfig UTC = VenueConfig.of("v2");

    private final TimeParser parser = new TimeParser();

    @Test
    @DisplayName("Should parse ISO instant with offset")
    void shouldParseIsoWithOffset() {
        assertThat(parser.parse("2024-06-01T20:00:00+02:00", UTC))
            .isEqualTo(Instant.parse("2024-06-01T18:00:00Z"));
        assertThat(parser.parse("2024-06-01T20:00:00Z", BERLIN))
            .isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
    }

    @Test
    @DisplayName("Should resolve naive local time in the venue timezone")
    void shouldResolveNaiveTimeInVenueZone() {
        assertThat(parser.parse("2024-06-01T20:00", BERLIN))
            .isEqualTo(Instant.parse("2024-06-01T18:00:00Z"));
        assertThat(parser.parse("2024-06-01 20:00:00", UTC))
            .isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
    }

    @Test
    @DisplayName("Should treat a bare date as start of day")
    void shouldParseBareDate() {
        assertThat(parser.parse("2024-06-01", BERLIN))
            .isEqualTo(Instant.parse("2024-05-31T22:00:00Z"));
    }

    @Test
    @DisplayName("Should parse zoned value with region id")
    void shouldParseRegionId() {
        assertThat(parser.parse("2024-01-15T10:00:00+01:00[Europe/Berlin]", UTC))
            .isEqualTo(Instant.parse("2024-01-15T09:00:00Z"));
    }

    @Test
    @DisplayName("Should distinguish epoch seconds from epoch millis")
    void shouldParseEpochValues() {
        assertThat(parser.parse(1717272000L, UTC)).isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
        assertThat(parser.parse(1717272000000L, UTC)).isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
        assertThat(parser.parse("1717272000", UTC)).isEqualTo(Instant.parse("2024-06-01T20:00:00Z"));
    }

    @Test
    @DisplayName("Should prefer the venue pattern for compact numeric dates")
    void shouldUseVenuePatternForNumericText() {
        VenueConfig compact = new VenueConfig("v3", "Hall", ZoneId.of("UTC"), "yyyyMMdd");

        assertThat(parser.parse("20240601", compact)).isEqualTo(Instant.parse("2024-06-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should fall back to the venue pattern for non-ISO text")
    void shouldUseVenuePattern() {
        VenueConfig german = new VenueConfig("v4", "Theater", ZoneId.of("Europe/Berlin"), "dd.MM.yyyy HH:mm");

        assertThat(parser.parse("01.06.2024 20:00", german)).isEqualTo(Instant.parse("2024-06-01T18:00:00Z"));
    }

    @Test
    @DisplayName("Should accept java.time values")
    void shouldAcceptJavaTimeValues() {
        Instant instant = Instant.parse("2024-06-01T20:00:00Z");

        assertThat(parser.parse(instant, UTC)).isEqualTo(instant);
        assertThat(parser.parse(LocalDateTime.of(2024, 6, 1, 20, 0), BERLIN))
            .isEqualTo(Instant.parse("2024-06-01T18:00:00Z"));
        assertThat(parser.parse(LocalDate.of(2024, 6, 1), UTC))
            .isEqualTo(Instant.parse("2024-06-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should return null for unparsable values instead of throwing")
    void shouldReturnNullForGarbage() {
        assertThat(parser.parse("next friday", UTC)).isNull();
        assertThat(parser.parse("", UTC)).isNull();
        assertThat(parser.parse(null, UTC)).isNull();
        assertThat(parser.parse(new Object(), UTC)).isNull();
        assertThat(parser.parse("01.06.2024", new VenueConfig("v5", null, null, "not a [pattern"))).isNull();
    }
}

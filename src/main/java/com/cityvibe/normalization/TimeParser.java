package com.cityvibe.normalization;

import com.cityvibe.domain.VenueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Lenient timestamp parser for scraped values.
 *
 * Accepts ISO-8601 (zoned, offset, local or date-only), epoch seconds/millis and a
 * venue-specific pattern. Naive values are resolved in the venue timezone.
 * Anything unparsable yields null; this class never throws on bad input.
 */
public class TimeParser {

    private static final Logger log = LoggerFactory.getLogger(TimeParser.class);

    // Values above this are epoch millis, below are epoch seconds (year 5138 in seconds)
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    // ISO date, optionally followed by 'T' or ' ', a local time, an offset and a [region]
    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .optionalStart().appendLiteral('[').parseCaseSensitive().appendZoneRegionId().appendLiteral(']').optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT);

    private final Map<String, DateTimeFormatter> formatterCache = new ConcurrentHashMap<>();

    /**
     * Parse a raw time value
     *
     * @param value raw value from the scraper (string, number or java.time object)
     * @param venue venue config supplying timezone and format hint
     * @return the resolved instant, or null if the value cannot be parsed
     */
    public Instant parse(Object value, VenueConfig venue) {
        if (value == null) {
            return null;
        }
        ZoneId zone = venue != null ? venue.getTimezone() : ZoneId.of("UTC");

        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone).toInstant();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone).toInstant();
        }
        if (value instanceof Number) {
            return fromEpoch(((Number) value).doubleValue());
        }
        if (!(value instanceof CharSequence)) {
            log.debug("Unsupported time value type: {}", value.getClass().getSimpleName());
            return null;
        }

        String text = TextNormalizer.clean(value.toString());
        if (text == null) {
            return null;
        }
        if (NUMERIC.matcher(text).matches()) {
            // a compact venue pattern such as yyyyMMdd takes precedence over epoch
            Instant hinted = venue != null && venue.getTimeFormat() != null
                ? parseWithPattern(text, venue.getTimeFormat(), zone)
                : null;
            return hinted != null ? hinted : fromEpoch(Double.parseDouble(text));
        }

        Instant iso = parseIso(text, zone);
        if (iso != null) {
            return iso;
        }

        if (venue != null && venue.getTimeFormat() != null) {
            Instant hinted = parseWithPattern(text, venue.getTimeFormat(), zone);
            if (hinted != null) {
                return hinted;
            }
        }

        log.debug("Unparsable time value '{}' for venue {}", text, venue != null ? venue.getVenueId() : null);
        return null;
    }

    private Instant fromEpoch(double epoch) {
        if (Double.isNaN(epoch) || Double.isInfinite(epoch)) {
            return null;
        }
        try {
            if (Math.abs(epoch) >= EPOCH_MILLIS_THRESHOLD) {
                return Instant.ofEpochMilli((long) epoch);
            }
            long seconds = (long) Math.floor(epoch);
            long nanos = Math.round((epoch - seconds) * 1_000_000_000L);
            return Instant.ofEpochSecond(seconds, nanos);
        } catch (DateTimeException e) {
            log.debug("Epoch value out of range: {}", epoch);
            return null;
        }
    }

    private Instant parseIso(String text, ZoneId zone) {
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(
                text, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).toInstant();
            }
            if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).atZone(zone).toInstant();
            }
            return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("Not an ISO-8601 value: '{}'", text);
            return null;
        }
    }

    private Instant parseWithPattern(String text, String pattern, ZoneId zone) {
        DateTimeFormatter formatter;
        try {
            formatter = formatterCache.computeIfAbsent(pattern, this::buildFormatter);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid venue time format '{}': {}", pattern, e.getMessage());
            return null;
        }

        try {
            TemporalAccessor parsed = formatter.parse(text);
            ZoneId parsedZone = parsed.query(TemporalQueries.zone());
            ZoneId effectiveZone = parsedZone != null ? parsedZone : zone;
            LocalDate date = parsed.query(TemporalQueries.localDate());
            if (date == null) {
                return null;
            }
            LocalTime time = parsed.query(TemporalQueries.localTime());
            LocalDateTime dateTime = time != null ? date.atTime(time) : date.atStartOfDay();
            return dateTime.atZone(effectiveZone).toInstant();
        } catch (DateTimeException e) {
            log.trace("Value '{}' does not match venue pattern '{}'", text, pattern);
            return null;
        }
    }

    private DateTimeFormatter buildFormatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }
}

package com.cityvibe.normalization;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.RawRecord;
import com.cityvibe.domain.VenueConfig;
import com.cityvibe.venue.VenueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Maps heterogeneous scraper output onto the canonical {@link EventDraft}.
 *
 * Each canonical field is looked up under a list of known aliases, first non-null wins.
 * Only a missing title or venue id is fatal; every other field degrades to null.
 * The normalizer is a pure function of the record and the venue configuration.
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    private static final String[] TITLE_KEYS = {"title", "name", "seo_title"};
    private static final String[] DESCRIPTION_KEYS = {"description", "intro", "seo_description"};
    private static final String[] START_KEYS = {"start_time", "startTime", "start", "date", "dates"};
    private static final String[] END_KEYS = {"end_time", "endTime", "end"};
    private static final String[] RANGE_START_KEYS = {"start", "startDate", "from"};
    private static final String[] RANGE_END_KEYS = {"end", "endDate", "to"};
    private static final String[] SOURCE_URL_KEYS = {"source_url", "url", "link"};
    private static final String[] VENUE_KEYS = {"venue_id", "venueId"};
    private static final String[] EXTERNAL_ID_KEYS = {"external_id", "id", "slug"};
    private static final String[] IMAGE_KEYS = {"main_image", "image_url", "image"};
    private static final String[] SOLD_OUT_KEYS = {"sold_out", "soldOut"};
    private static final String[] CATEGORY_KEYS = {"category", "categories"};
    private static final String[] ADDRESS_PARTS = {"street", "houseNumber", "zipcode", "city"};

    private final VenueRegistry venueRegistry;
    private final TimeParser timeParser;

    public EventNormalizer(VenueRegistry venueRegistry) {
        this.venueRegistry = venueRegistry;
        this.timeParser = new TimeParser();
    }

    /**
     * Normalize a raw record into an event draft
     *
     * @param raw the raw scraper record
     * @param batchVenueId venue the batch was scraped for, used when the record carries none
     * @return the normalized draft
     * @throws NormalizationException if no title or venue id can be derived
     */
    public EventDraft normalize(RawRecord raw, String batchVenueId) throws NormalizationException {
        int index = raw.getIndex();

        String title = TextNormalizer.cleanScalar(raw.first(TITLE_KEYS));
        if (title == null) {
            throw new NormalizationException("Record has no usable title", "title", index);
        }

        String venueId = TextNormalizer.cleanScalar(raw.first(VENUE_KEYS));
        if (venueId == null) {
            venueId = TextNormalizer.clean(batchVenueId);
        }
        if (venueId == null) {
            throw new NormalizationException("Record has no venue id and none was supplied for the batch",
                "venue_id", index);
        }

        // unknown venues normalize with UTC defaults; the validator decides resolvability
        String resolvedVenueId = venueId;
        VenueConfig venue = venueRegistry.find(venueId).orElseGet(() -> VenueConfig.of(resolvedVenueId));

        EventDraft draft = new EventDraft(index);
        draft.setTitle(title);
        draft.setVenueId(venueId);
        draft.setDescription(TextNormalizer.cleanScalar(raw.first(DESCRIPTION_KEYS)));
        draft.setSourceUrl(TextNormalizer.cleanScalar(raw.first(SOURCE_URL_KEYS)));
        draft.setExternalId(TextNormalizer.cleanScalar(raw.first(EXTERNAL_ID_KEYS)));
        draft.setImageUrl(TextNormalizer.cleanScalar(raw.first(IMAGE_KEYS)));
        draft.setSoldOut(toBoolean(raw.first(SOLD_OUT_KEYS)));
        draft.setCurrency(upper(TextNormalizer.cleanScalar(raw.first("currency"))));
        draft.setCategories(toStrings(raw.first(CATEGORY_KEYS)));

        extractTimes(raw, venue, draft);
        extractLocation(raw, draft);
        extractPrices(raw, draft);

        log.debug("Normalized record {} into {}", index, draft);
        return draft;
    }

    private void extractTimes(RawRecord raw, VenueConfig venue, EventDraft draft) {
        Object start = raw.first(START_KEYS);
        Object end = raw.first(END_KEYS);

        // "dates" may be a list of occurrences or a {start, end} range
        if (start instanceof List) {
            List<?> occurrences = (List<?>) start;
            start = occurrences.isEmpty() ? null : occurrences.get(0);
        }
        if (start instanceof Map) {
            Map<?, ?> range = (Map<?, ?>) start;
            if (end == null) {
                end = firstOf(range, RANGE_END_KEYS);
            }
            start = firstOf(range, RANGE_START_KEYS);
        }

        draft.setStartTime(timeParser.parse(start, venue));
        draft.setEndTime(timeParser.parse(end, venue));
    }

    private void extractLocation(RawRecord raw, EventDraft draft) {
        Object address = raw.first("address", "location");
        if (address instanceof Map) {
            Map<?, ?> parts = (Map<?, ?>) address;
            StringJoiner joiner = new StringJoiner(" ");
            for (String key : ADDRESS_PARTS) {
                String part = TextNormalizer.cleanScalar(parts.get(key));
                if (part != null) {
                    joiner.add(part);
                }
            }
            draft.setAddress(TextNormalizer.clean(joiner.toString()));
        } else {
            draft.setAddress(TextNormalizer.cleanScalar(address));
        }

        Object lat = raw.first("latitude", "lat");
        Object lng = raw.first("longitude", "lng", "lon");
        Object coordinates = raw.first("coordinates");
        if (coordinates instanceof Map) {
            Map<?, ?> coords = (Map<?, ?>) coordinates;
            if (lat == null) {
                lat = firstOf(coords, "lat", "latitude");
            }
            if (lng == null) {
                lng = firstOf(coords, "lng", "longitude", "lon");
            }
        }

        Double latitude = toDouble(lat);
        Double longitude = toDouble(lng);
        // a half-known or out-of-range pair is treated as absent so geocoding can fill it
        if (latitude != null && longitude != null
                && Math.abs(latitude) <= 90 && Math.abs(longitude) <= 180) {
            draft.setLatitude(latitude);
            draft.setLongitude(longitude);
        }
    }

    private void extractPrices(RawRecord raw, EventDraft draft) {
        BigDecimal min = toDecimal(raw.first("price_min", "priceMin"));
        BigDecimal max = toDecimal(raw.first("price_max", "priceMax"));
        if (min == null && max == null) {
            BigDecimal single = toDecimal(raw.first("price"));
            min = single;
            max = single;
        }
        draft.setPriceMin(min);
        draft.setPriceMax(max);
    }

    private static Object firstOf(Map<?, ?> map, String... keys) {
        return RawRecord.firstUsable(map, keys);
    }

    private static Double toDouble(Object value) {
        BigDecimal decimal = toDecimal(value);
        return decimal != null ? decimal.doubleValue() : null;
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? new BigDecimal(value.toString()) : null;
        }
        String text = TextNormalizer.cleanScalar(value);
        if (text == null) {
            return null;
        }
        // tolerate currency symbols and decimal commas ("€ 12,50")
        String numeric = text.replaceAll("[^0-9,.\\-]", "").replace(',', '.');
        try {
            return numeric.isEmpty() ? null : new BigDecimal(numeric);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric value '{}'", text);
            return null;
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = TextNormalizer.cleanScalar(value);
        if (text == null) {
            return null;
        }
        switch (text.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "0":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static List<String> toStrings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                String text = item instanceof Map
                    ? TextNormalizer.cleanScalar(firstOf((Map<?, ?>) item, "name", "title", "label"))
                    : TextNormalizer.cleanScalar(item);
                if (text != null) {
                    result.add(text);
                }
            }
        } else {
            String text = TextNormalizer.cleanScalar(value);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}

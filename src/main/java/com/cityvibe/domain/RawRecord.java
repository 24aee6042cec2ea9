package com.cityvibe.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a raw, unparsed event as produced by a venue scraper.
 * The shape is scraper-specific; only the position in the submitted batch is guaranteed.
 */
public class RawRecord {

    private final int index;
    private final Map<String, Object> data;

    public RawRecord(int index, Map<String, Object> data) {
        this.index = index;
        this.data = data != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
            : Collections.emptyMap();
    }

    public int getIndex() {
        return index;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * Value of the first alias that holds something usable, or null.
     * Blank strings and empty lists or maps do not shadow later aliases.
     */
    public Object first(String... keys) {
        return firstUsable(data, keys);
    }

    public boolean has(String key) {
        return isUsable(data.get(key));
    }

    public static Object firstUsable(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (isUsable(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isUsable(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence) {
            return !value.toString().isBlank();
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    @Override
    public String toString() {
        return "RawRecord{index=" + index + ", keys=" + data.keySet() + "}";
    }
}

package com.cityvibe.normalization;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * String cleanup shared by the normalizer and the signature/similarity code.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Trim and collapse internal whitespace; blank strings become null
     */
    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = WHITESPACE.matcher(value).replaceAll(" ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    /**
     * Clean any scalar value; non-scalar values (maps, lists) yield null
     */
    public static String cleanScalar(Object value) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return clean(value.toString());
        }
        return null;
    }

    /**
     * Identity form of a title: cleaned and lower-cased
     */
    public static String identityKey(String title) {
        String cleaned = clean(title);
        return cleaned == null ? null : cleaned.toLowerCase(Locale.ROOT);
    }
}

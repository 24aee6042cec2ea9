package com.cityvibe.dedup;

import com.cityvibe.normalization.TextNormalizer;

/**
 * Edit-distance based title similarity.
 *
 * ratio = 1 - levenshtein(a, b) / max(len(a), len(b)) over the identity form of each
 * title (lower-cased, whitespace collapsed). The ratio is symmetric and lies in [0, 1].
 */
public final class TitleSimilarity {

    private TitleSimilarity() {
    }

    public static double ratio(String a, String b) {
        String left = TextNormalizer.identityKey(a);
        String right = TextNormalizer.identityKey(b);
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        int longest = Math.max(left.length(), right.length());
        return 1.0 - (double) levenshtein(left, right) / longest;
    }

    /**
     * Classic two-row Levenshtein distance (insert, delete, substitute all cost 1)
     */
    static int levenshtein(String a, String b) {
        if (a.length() < b.length()) {
            String tmp = a;
            a = b;
            b = tmp;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}

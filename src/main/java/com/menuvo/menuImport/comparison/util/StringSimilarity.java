package com.menuvo.menuImport.comparison.util;

import java.util.Locale;

/**
 * Utility class for normalized string similarity based on Levenshtein distance.
 */
public class StringSimilarity {

    private StringSimilarity() {}

    /**
     * Similarity of two strings, compared lower-cased and trimmed:
     * {@code 1 - distance / max(length)}. Equal strings score 1.0; if exactly one is empty the
     * score is 0.0. Null is treated as empty.
     *
     * @return A value between 0.0 and 1.0
     */
    public static double similarity(String a, String b) {
        String s1 = normalize(a);
        String s2 = normalize(b);

        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int distance = levenshteinDistance(s1, s2);
        return 1.0 - (double) distance / Math.max(s1.length(), s2.length());
    }

    /**
     * Minimum number of single-character insertions, deletions and substitutions turning
     * {@code a} into {@code b}. Uses two rows of the usual dynamic programming table.
     */
    public static int levenshteinDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(previous[j] + 1, current[j - 1] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[b.length()];
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }
}

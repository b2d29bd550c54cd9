package com.z254.sentinel.correlation.strategy;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Text similarity helpers used by pattern correlation.
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * Jaccard similarity over lower-cased whitespace token sets. Two empty texts are identical.
     */
    public static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    /**
     * {@code 1 - distance / max(length)} over the normalized texts.
     */
    public static double levenshteinSimilarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / maxLength;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    static Set<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }

    static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }
}

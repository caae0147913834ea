package com.metricsentinel.core.knowledge;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Word-overlap similarity used when vector search is unavailable.
 *
 * <p>
 * Both texts are lower-cased and split on whitespace into word sets. The
 * score is {@code |query ∩ text| / max(|query|, 1)}, so it measures how much
 * of the query is covered and lies in [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
public final class KeywordSimilarity {

    private KeywordSimilarity() {
        // utility class
    }

    public static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());
    }

    public static double score(String query, String text) {
        return score(words(query), text);
    }

    static double score(Set<String> queryWords, String text) {
        Set<String> textWords = words(text);
        long overlap = queryWords.stream().filter(textWords::contains).count();
        return (double) overlap / Math.max(queryWords.size(), 1);
    }
}

package de.mirkosertic.profileranker.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Additive bonus for verbatim query matches: a full bonus when the whole lower-cased query occurs in
 * the lower-cased document text, plus a bigram bonus for every consecutive pair of query words
 * (each longer than two characters) that occurs verbatim.
 */
public final class ExactMatchBonus {

    private ExactMatchBonus() {
    }

    public static double compute(final String query, final String documentText,
                                 final double fullBonus, final double bigramBonus) {
        final String queryLower = query.trim().toLowerCase(Locale.ROOT);
        if (queryLower.isEmpty() || documentText.isEmpty()) {
            return 0.0;
        }
        final String textLower = documentText.toLowerCase(Locale.ROOT);

        double bonus = 0.0;
        if (textLower.contains(queryLower)) {
            bonus += fullBonus;
        }
        for (final String bigram : bigrams(queryLower)) {
            if (textLower.contains(bigram)) {
                bonus += bigramBonus;
            }
        }
        return bonus;
    }

    static List<String> bigrams(final String queryLower) {
        final List<String> words = new ArrayList<>();
        for (final String word : queryLower.split("\\s+")) {
            if (word.length() > 2) {
                words.add(word);
            }
        }
        final List<String> bigrams = new ArrayList<>();
        for (int i = 0; i + 1 < words.size(); i++) {
            bigrams.add(words.get(i) + " " + words.get(i + 1));
        }
        return bigrams;
    }
}

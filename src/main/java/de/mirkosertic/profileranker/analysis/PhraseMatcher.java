package de.mirkosertic.profileranker.analysis;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Case- and punctuation-insensitive phrase matching on plain text.
 *
 * <p>Both sides are first brought into a canonical form with {@link #normalize(String)}: lower case,
 * every character that is neither a letter nor a digit (hyphens included) replaced by a space, and
 * whitespace collapsed. Matching then works on word boundaries, so "pci" never matches inside
 * "specialist".</p>
 */
public final class PhraseMatcher {

    private PhraseMatcher() {
    }

    public static String normalize(@Nullable final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        final StringBuilder result = new StringBuilder(lower.length());
        boolean pendingSpace = false;
        for (int i = 0; i < lower.length(); i++) {
            final char c = lower.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                if (pendingSpace && !result.isEmpty()) {
                    result.append(' ');
                }
                pendingSpace = false;
                result.append(c);
            } else {
                pendingSpace = true;
            }
        }
        return result.toString();
    }

    /**
     * Whether {@code phrase} occurs in {@code text} with a word boundary on both sides. Both
     * arguments must already be {@link #normalize(String) normalized}.
     */
    public static boolean containsWholePhrase(final String text, final String phrase) {
        return indexOf(text, phrase, true) >= 0;
    }

    /**
     * Whether {@code phrase} occurs in {@code text} starting at a word boundary. The phrase may end
     * inside a word, so "stent" matches "stents" and "stenting". Both arguments must already be
     * {@link #normalize(String) normalized}.
     */
    public static boolean containsPhraseStart(final String text, final String phrase) {
        return indexOf(text, phrase, false) >= 0;
    }

    private static int indexOf(final String text, final String phrase, final boolean requireEndBoundary) {
        if (phrase.isEmpty() || text.length() < phrase.length()) {
            return -1;
        }
        int from = 0;
        while (true) {
            final int index = text.indexOf(phrase, from);
            if (index < 0) {
                return -1;
            }
            final boolean startOk = index == 0 || text.charAt(index - 1) == ' ';
            final int end = index + phrase.length();
            final boolean endOk = !requireEndBoundary || end == text.length() || text.charAt(end) == ' ';
            if (startOk && endOk) {
                return index;
            }
            from = index + 1;
        }
    }
}

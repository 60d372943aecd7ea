package de.mirkosertic.profileranker.rescoring;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Locale;

/**
 * Case-insensitive containment in either direction.
 *
 * <p>Equal strings always match. Otherwise the shorter of the two must have at least
 * {@code minLength} characters, so that a two-letter abbreviation does not match every longer word
 * it happens to be part of.</p>
 */
public final class FuzzyMatcher {

    private final int minLength;

    public FuzzyMatcher(final int minLength) {
        this.minLength = minLength;
    }

    public boolean matches(@Nullable final String a, @Nullable final String b) {
        if (a == null || b == null) {
            return false;
        }
        final String left = a.trim().toLowerCase(Locale.ROOT);
        final String right = b.trim().toLowerCase(Locale.ROOT);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        if (left.equals(right)) {
            return true;
        }
        if (Math.min(left.length(), right.length()) < minLength) {
            return false;
        }
        return left.contains(right) || right.contains(left);
    }

    public boolean matchesAny(@Nullable final String value, final Collection<String> candidates) {
        for (final String candidate : candidates) {
            if (matches(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code needle} occurs in {@code haystack}, case-insensitively, respecting the minimum
     * length.
     */
    public boolean occursIn(@Nullable final String needle, @Nullable final String haystack) {
        if (needle == null || haystack == null) {
            return false;
        }
        final String n = needle.trim().toLowerCase(Locale.ROOT);
        if (n.length() < minLength) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(n);
    }
}

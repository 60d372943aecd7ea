package de.mirkosertic.profileranker.progressive;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * How well a candidate fits the patient query, as judged externally.
 */
public enum FitCategory {

    EXCELLENT("excellent"),
    GOOD("good"),
    ILL_FIT("ill-fit");

    private final String wireName;

    FitCategory(final String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Maps a judge label to a category. Accepts the wire names as well as {@code ill_fit} and
     * {@code illfit}; anything else yields {@code null}.
     */
    public static @Nullable FitCategory fromWireName(@Nullable final String value) {
        if (value == null) {
            return null;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (final FitCategory category : values()) {
            if (category.wireName.equals(normalized)) {
                return category;
            }
        }
        return "illfit".equals(normalized) ? ILL_FIT : null;
    }
}

package de.mirkosertic.profileranker.rescoring;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Which match categories fired for one candidate, how often, and what they contributed.
 *
 * <p>Only categories with at least one match are present. For additive effects the contribution is
 * the amount added to the score; for multiplicative effects it is {@code factor - 1}. A category's
 * contribution is therefore zero exactly when its match count is zero.</p>
 */
public final class RescoringBreakdown {

    public static final RescoringBreakdown EMPTY = new RescoringBreakdown(new EnumMap<>(MatchCategory.class));

    public record Entry(int count, double contribution, ContributionKind kind) {
    }

    private final Map<MatchCategory, Entry> entries;

    RescoringBreakdown(final Map<MatchCategory, Entry> entries) {
        final Map<MatchCategory, Entry> copy = new EnumMap<>(MatchCategory.class);
        copy.putAll(entries);
        this.entries = Collections.unmodifiableMap(copy);
    }

    public int count(final MatchCategory category) {
        final Entry entry = entries.get(category);
        return entry == null ? 0 : entry.count();
    }

    public double contribution(final MatchCategory category) {
        final Entry entry = entries.get(category);
        return entry == null ? 0.0 : entry.contribution();
    }

    public Set<MatchCategory> categories() {
        return entries.keySet();
    }

    public Map<MatchCategory, Entry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof RescoringBreakdown other && entries.equals(other.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "RescoringBreakdown" + entries;
    }
}

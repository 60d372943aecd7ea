package de.mirkosertic.profileranker.query;

import java.util.List;

/**
 * Result of query normalization.
 *
 * @param original       the raw query, trimmed
 * @param normalized     the raw query with the applied expansions appended
 * @param appliedAliases the aliases that fired, in application order
 */
public record NormalizedQuery(String original, String normalized, List<AppliedAlias> appliedAliases) {

    public record AppliedAlias(String term, String expansion) {
        @Override
        public String toString() {
            return term + " -> " + expansion;
        }
    }

    public NormalizedQuery {
        appliedAliases = List.copyOf(appliedAliases);
    }

    public static NormalizedQuery unchanged(final String query) {
        return new NormalizedQuery(query, query, List.of());
    }

    public List<String> describeAliases() {
        return appliedAliases.stream().map(AppliedAlias::toString).toList();
    }
}

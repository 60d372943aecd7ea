package de.mirkosertic.profileranker.query;

import de.mirkosertic.profileranker.analysis.PhraseMatcher;

import java.util.List;

/**
 * One direction of an equivalence: when {@code term} occurs in a query, {@code expansion} may be
 * appended. If {@code requiredContext} is not empty, at least one of its words must occur in the
 * query as well.
 */
public record AliasRule(
        String term,
        String expansion,
        List<String> requiredContext,
        Priority priority
) {

    /**
     * Secondary ordering between aliases matching terms of the same length.
     */
    public enum Priority {
        NORMAL,
        LOW
    }

    public AliasRule {
        term = PhraseMatcher.normalize(term);
        expansion = PhraseMatcher.normalize(expansion);
        if (term.isEmpty() || expansion.isEmpty()) {
            throw new IllegalArgumentException("Alias term and expansion must not be empty");
        }
        requiredContext = requiredContext == null
                ? List.of()
                : requiredContext.stream().map(PhraseMatcher::normalize).filter(c -> !c.isEmpty()).toList();
        if (priority == null) {
            priority = Priority.NORMAL;
        }
    }

    public static AliasRule of(final String term, final String expansion) {
        return new AliasRule(term, expansion, List.of(), Priority.NORMAL);
    }

    /**
     * Both directions of an equivalence, abbreviation first.
     */
    public static List<AliasRule> bidirectional(final String term, final String expansion) {
        return List.of(of(term, expansion), of(expansion, term));
    }

    boolean matches(final String normalizedQuery) {
        if (!PhraseMatcher.containsWholePhrase(normalizedQuery, term)) {
            return false;
        }
        if (requiredContext.isEmpty()) {
            return true;
        }
        for (final String context : requiredContext) {
            if (PhraseMatcher.containsWholePhrase(normalizedQuery, context)) {
                return true;
            }
        }
        return false;
    }
}

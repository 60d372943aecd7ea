package de.mirkosertic.profileranker.pipeline;

import de.mirkosertic.profileranker.rescoring.CombinationMode;
import de.mirkosertic.profileranker.rescoring.RescoringStrategy;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * What a ranking call actually did with its query bundle. For observability only; nothing
 * downstream depends on it.
 */
public record QueryDiagnostics(
        String originalQuery,
        String normalizedQuery,
        List<String> appliedAliases,
        String retrievalQuery,
        @Nullable String intentRetrievalQuery,
        List<String> retrievalTerms,
        List<String> rescoringTerms,
        RescoringStrategy requestedStrategy,
        RescoringStrategy resolvedStrategy,
        CombinationMode combinationMode,
        int poolSize,
        int filteredCount,
        int retrievedCount
) {

    public QueryDiagnostics {
        appliedAliases = List.copyOf(appliedAliases);
        retrievalTerms = List.copyOf(retrievalTerms);
        rescoringTerms = List.copyOf(rescoringTerms);
    }
}

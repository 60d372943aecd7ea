package de.mirkosertic.profileranker.query;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The lexical queries of one ranking call.
 *
 * @param text                 the retrieval query handed to the lexical scorer
 * @param normalization        how the base of {@code text} was normalized
 * @param safeLaneTermsUsed    safe-lane terms that made it into the query
 * @param anchorPhrasesAppended anchor phrases appended after normalization
 * @param intentTermsInjected  intent terms injected into {@code text}
 * @param intentQuery          the separate intent-only query of two-query retrieval, if enabled
 */
public record RetrievalQuery(
        String text,
        NormalizedQuery normalization,
        List<String> safeLaneTermsUsed,
        List<String> anchorPhrasesAppended,
        List<String> intentTermsInjected,
        @Nullable String intentQuery
) {

    public RetrievalQuery {
        safeLaneTermsUsed = List.copyOf(safeLaneTermsUsed);
        anchorPhrasesAppended = List.copyOf(anchorPhrasesAppended);
        intentTermsInjected = List.copyOf(intentTermsInjected);
    }

    public boolean isTwoQuery() {
        return intentQuery != null;
    }
}

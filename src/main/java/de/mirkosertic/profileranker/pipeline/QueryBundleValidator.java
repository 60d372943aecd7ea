package de.mirkosertic.profileranker.pipeline;

import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.model.SubspecialtyHint;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects malformed query bundles. Missing signals are not an error (the engine degrades), but a
 * bundle without query, filter shape or strategy, or with {@code null} list entries, is.
 */
final class QueryBundleValidator {

    private QueryBundleValidator() {
    }

    static void validate(final QueryBundle bundle) {
        if (bundle == null) {
            throw new InvalidQueryBundleException("Query bundle must not be null");
        }
        final List<String> problems = new ArrayList<>();
        if (bundle.patientQuery() == null) {
            problems.add("patientQuery is missing");
        }
        if (bundle.filters() == null) {
            problems.add("filters are missing");
        }
        if (bundle.strategy() == null) {
            problems.add("strategy is missing");
        }
        if (bundle.combinationMode() == null) {
            problems.add("combinationMode is missing");
        }
        checkEntries("safeLaneTerms", bundle.safeLaneTerms(), problems);
        checkEntries("intentTerms", bundle.intentTerms(), problems);
        checkEntries("anchorPhrases", bundle.anchorPhrases(), problems);
        checkEntries("negativeTerms", bundle.negativeTerms(), problems);
        checkEntries("checklistTerms", bundle.checklistTerms(), problems);
        for (final SubspecialtyHint hint : bundle.likelySubspecialties()) {
            if (hint == null) {
                problems.add("likelySubspecialties contains a null entry");
                break;
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidQueryBundleException("Invalid query bundle: " + String.join(", ", problems));
        }
    }

    private static void checkEntries(final String name, final List<String> values, final List<String> problems) {
        for (final String value : values) {
            if (value == null) {
                problems.add(name + " contains a null entry");
                return;
            }
        }
    }
}

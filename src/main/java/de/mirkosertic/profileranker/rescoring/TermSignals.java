package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.analysis.PhraseMatcher;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.model.SubspecialtyHint;

import java.util.ArrayList;
import java.util.List;

/**
 * The term signals of a query bundle, normalized once per call and with intent terms split into
 * tiers.
 */
record TermSignals(
        List<String> highSignal,
        List<String> procedure,
        List<String> pathway,
        List<String> anchors,
        List<String> safeLane,
        List<String> negative,
        List<SubspecialtyHint> subspecialties
) {

    static TermSignals of(final QueryBundle bundle, final TermVocabulary vocabulary) {
        final List<String> highSignal = new ArrayList<>();
        final List<String> procedure = new ArrayList<>();
        final List<String> pathway = new ArrayList<>();
        for (final String term : normalizedDistinct(bundle.intentTerms())) {
            switch (vocabulary.classify(term)) {
                case HIGH_SIGNAL -> highSignal.add(term);
                case PROCEDURE -> procedure.add(term);
                default -> pathway.add(term);
            }
        }
        final List<SubspecialtyHint> hints = bundle.likelySubspecialties().stream()
                .filter(hint -> hint.confidence() > 0.0)
                .toList();
        return new TermSignals(List.copyOf(highSignal), List.copyOf(procedure), List.copyOf(pathway),
                normalizedDistinct(bundle.anchorPhrases()),
                normalizedDistinct(bundle.safeLaneTerms()),
                normalizedDistinct(bundle.negativeTerms()),
                hints);
    }

    private static List<String> normalizedDistinct(final List<String> terms) {
        return terms.stream()
                .map(PhraseMatcher::normalize)
                .filter(term -> !term.isEmpty())
                .distinct()
                .toList();
    }

    boolean isEmpty() {
        return highSignal.isEmpty() && procedure.isEmpty() && pathway.isEmpty() && anchors.isEmpty()
                && safeLane.isEmpty() && negative.isEmpty() && subspecialties.isEmpty();
    }
}

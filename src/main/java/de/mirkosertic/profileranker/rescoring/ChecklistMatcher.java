package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.analysis.PhraseMatcher;
import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.config.RankingParameter;
import de.mirkosertic.profileranker.model.ChecklistProfile;

import java.util.List;

/**
 * Matches competency checklist terms against a candidate's {@link ChecklistProfile}.
 *
 * <p>A term found as a whole phrase in the procedures, conditions or specialties set is an exact
 * match; a term that is only contained (or contains a whole set) is a partial match. The match
 * ratio is {@code (exact * exactWeight + partial * partialWeight) / (terms * exactWeight)}. Below
 * {@code checklist-match-threshold} there is no boost; above it the score is multiplied by
 * {@code min(1 + (boostWeight - 1) * ratio, boostWeight)}.</p>
 */
public final class ChecklistMatcher {

    public record Match(int exact, int partial, double ratio, double boost) {

        public static final Match NONE = new Match(0, 0, 0.0, 1.0);

        public int matches() {
            return exact + partial;
        }

        public boolean boosted() {
            return boost > 1.0;
        }
    }

    private ChecklistMatcher() {
    }

    public static Match match(final List<String> terms, final ChecklistProfile profile, final RankingConfig config) {
        final List<String> normalizedTerms = terms.stream()
                .map(PhraseMatcher::normalize)
                .filter(term -> !term.isEmpty())
                .distinct()
                .toList();
        if (normalizedTerms.isEmpty() || profile.isEmpty()) {
            return Match.NONE;
        }

        final List<String> sets = List.of(
                PhraseMatcher.normalize(profile.proceduresSet()),
                PhraseMatcher.normalize(profile.conditionsSet()),
                PhraseMatcher.normalize(profile.specialties()));

        int exact = 0;
        int partial = 0;
        for (final String term : normalizedTerms) {
            if (sets.stream().anyMatch(set -> PhraseMatcher.containsWholePhrase(set, term))) {
                exact++;
            } else if (sets.stream().anyMatch(set -> !set.isEmpty() && (set.contains(term) || term.contains(set)))) {
                partial++;
            }
        }

        final double exactWeight = config.value(RankingParameter.CHECKLIST_EXACT_WEIGHT);
        final double partialWeight = config.value(RankingParameter.CHECKLIST_PARTIAL_WEIGHT);
        final double raw = exact * exactWeight + partial * partialWeight;
        final double maxPossible = normalizedTerms.size() * exactWeight;
        final double ratio = maxPossible > 0.0 ? raw / maxPossible : 0.0;

        final double boostWeight = config.value(RankingParameter.CHECKLIST_BOOST_WEIGHT);
        double boost = 1.0;
        if (ratio > 0.0 && ratio >= config.value(RankingParameter.CHECKLIST_MATCH_THRESHOLD)) {
            boost = Math.min(1.0 + (boostWeight - 1.0) * ratio, boostWeight);
        }
        return new Match(exact, partial, ratio, boost);
    }
}

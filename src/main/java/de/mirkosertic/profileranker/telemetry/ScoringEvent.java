package de.mirkosertic.profileranker.telemetry;

import de.mirkosertic.profileranker.rescoring.ContributionKind;
import de.mirkosertic.profileranker.rescoring.MatchCategory;
import de.mirkosertic.profileranker.rescoring.RescoringStrategy;

/**
 * One application of a boost or penalty to one candidate.
 *
 * @param candidateId  the candidate the effect was applied to
 * @param strategy     the strategy that applied it
 * @param category     the match category it is attributed to
 * @param matches      how many matches of that category were found
 * @param contribution the added amount, or {@code factor - 1} for multiplicative effects
 * @param kind         whether the effect was added or multiplied
 */
public record ScoringEvent(
        String candidateId,
        RescoringStrategy strategy,
        MatchCategory category,
        int matches,
        double contribution,
        ContributionKind kind
) {
}

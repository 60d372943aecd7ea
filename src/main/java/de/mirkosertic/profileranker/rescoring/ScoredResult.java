package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.model.Candidate;
import org.jspecify.annotations.Nullable;

/**
 * A candidate with its scores after rescoring.
 *
 * @param candidate      the ranked candidate, unchanged
 * @param lexicalScore   the lexical retrieval score
 * @param rescoringScore the separate rescoring score, or {@code null} when the strategy only scales
 *                       the lexical score
 * @param finalScore     the combined score, never negative
 * @param breakdown      which match categories contributed
 * @param inputIndex     position in the rescoring input, the last tie-break
 */
public record ScoredResult(
        Candidate candidate,
        double lexicalScore,
        @Nullable Double rescoringScore,
        double finalScore,
        RescoringBreakdown breakdown,
        int inputIndex
) {

    public ScoredResult {
        if (Double.isNaN(finalScore) || finalScore < 0.0) {
            throw new IllegalArgumentException("Final score must be >= 0, was " + finalScore);
        }
    }

    public String candidateId() {
        return candidate.id();
    }
}

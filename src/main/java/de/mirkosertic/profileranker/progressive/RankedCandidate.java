package de.mirkosertic.profileranker.progressive;

import de.mirkosertic.profileranker.rescoring.ScoredResult;
import org.jspecify.annotations.Nullable;

/**
 * A shortlisted candidate with its judged fit.
 *
 * @param fit                 the judged category, {@link FitCategory#GOOD} when never classified
 * @param classified          whether the judge actually classified this candidate
 * @param iterationFound      the iteration whose fetch brought the candidate into the pool
 * @param classifiedIteration the iteration of the first classification, {@code -1} if none
 */
public record RankedCandidate(
        ScoredResult result,
        FitCategory fit,
        boolean classified,
        int iterationFound,
        int classifiedIteration,
        @Nullable String reason
) {

    public String candidateId() {
        return result.candidateId();
    }
}

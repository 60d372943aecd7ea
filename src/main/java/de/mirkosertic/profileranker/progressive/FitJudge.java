package de.mirkosertic.profileranker.progressive;

import java.util.List;

/**
 * External quality judge consulted by the {@link ProgressiveRanker}.
 *
 * <p>Implementations may return fewer judgements than candidates; candidates without a judgement
 * stay unclassified. Judgements for ids that were not submitted are ignored.</p>
 */
@FunctionalInterface
public interface FitJudge {

    List<FitJudgement> classify(String query, List<CandidateSummary> candidates) throws JudgeException;
}

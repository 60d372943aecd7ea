package de.mirkosertic.profileranker.progressive;

import de.mirkosertic.profileranker.rescoring.RescoringStrategy;

import java.util.List;
import java.util.Map;

/**
 * Shortlist and session metadata of a progressive ranking run.
 *
 * @param qualityBreakdown number of shortlisted candidates per fit category
 */
public record ProgressiveResult(
        List<RankedCandidate> results,
        TerminationReason terminationReason,
        int iterations,
        int profilesReviewed,
        int profilesFetched,
        Map<FitCategory, Integer> qualityBreakdown,
        List<IterationDetail> iterationDetails,
        RescoringStrategy resolvedStrategy
) {

    public ProgressiveResult {
        results = List.copyOf(results);
        qualityBreakdown = Map.copyOf(qualityBreakdown);
        iterationDetails = List.copyOf(iterationDetails);
    }
}

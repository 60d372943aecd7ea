package de.mirkosertic.profileranker.pipeline;

import de.mirkosertic.profileranker.rescoring.ScoredResult;

import java.util.List;

/**
 * Output of a ranking call: the ordered results and how they were produced.
 */
public record RankingResponse(List<ScoredResult> results, QueryDiagnostics diagnostics) {

    public RankingResponse {
        results = List.copyOf(results);
    }
}

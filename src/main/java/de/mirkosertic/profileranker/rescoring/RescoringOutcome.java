package de.mirkosertic.profileranker.rescoring;

import java.util.List;

/**
 * Ordered rescoring results together with the strategy that actually produced them.
 */
public record RescoringOutcome(
        RescoringStrategy requestedStrategy,
        RescoringStrategy resolvedStrategy,
        List<ScoredResult> results
) {

    public RescoringOutcome {
        results = List.copyOf(results);
    }

    public boolean degraded() {
        return requestedStrategy != resolvedStrategy;
    }
}

package de.mirkosertic.profileranker.telemetry;

import de.mirkosertic.profileranker.rescoring.RescoringStrategy;

/**
 * Receives structured events from the rescoring stage.
 *
 * <p>Implementations are called synchronously from the scoring thread and must not throw.</p>
 */
public interface RankingTelemetry {

    RankingTelemetry NOOP = new RankingTelemetry() {
        @Override
        public void onScoringEvent(final ScoringEvent event) {
            // discarded
        }
    };

    void onScoringEvent(ScoringEvent event);

    /**
     * Called when the requested strategy had no usable signal and a lower-information strategy was
     * used instead.
     */
    default void onStrategyFallback(final RescoringStrategy requested, final RescoringStrategy resolved,
                                    final String reason) {
        // optional
    }
}

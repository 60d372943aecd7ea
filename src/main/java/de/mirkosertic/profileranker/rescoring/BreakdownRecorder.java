package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.telemetry.RankingTelemetry;
import de.mirkosertic.profileranker.telemetry.ScoringEvent;

import java.util.EnumMap;
import java.util.Map;

/**
 * Collects the breakdown of one candidate and emits a telemetry event for every effect applied.
 * Effects with zero matches are not recorded.
 */
final class BreakdownRecorder {

    private final String candidateId;
    private final RescoringStrategy strategy;
    private final RankingTelemetry telemetry;
    private final Map<MatchCategory, RescoringBreakdown.Entry> entries = new EnumMap<>(MatchCategory.class);

    BreakdownRecorder(final String candidateId, final RescoringStrategy strategy, final RankingTelemetry telemetry) {
        this.candidateId = candidateId;
        this.strategy = strategy;
        this.telemetry = telemetry;
    }

    void additive(final MatchCategory category, final int matches, final double amount) {
        record(category, matches, amount, ContributionKind.ADDITIVE);
    }

    void multiplicative(final MatchCategory category, final int matches, final double factor) {
        record(category, matches, factor - 1.0, ContributionKind.MULTIPLICATIVE);
    }

    private void record(final MatchCategory category, final int matches, final double contribution,
                        final ContributionKind kind) {
        if (matches <= 0) {
            return;
        }
        entries.merge(category, new RescoringBreakdown.Entry(matches, contribution, kind),
                (a, b) -> new RescoringBreakdown.Entry(a.count() + b.count(), a.contribution() + b.contribution(), a.kind()));
        telemetry.onScoringEvent(new ScoringEvent(candidateId, strategy, category, matches, contribution, kind));
    }

    RescoringBreakdown build() {
        return entries.isEmpty() ? RescoringBreakdown.EMPTY : new RescoringBreakdown(entries);
    }
}

package de.mirkosertic.profileranker.telemetry;

import de.mirkosertic.profileranker.rescoring.RescoringStrategy;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every event in memory, so breakdowns can be reconstructed without parsing log output.
 */
public class CollectingRankingTelemetry implements RankingTelemetry {

    public record Fallback(RescoringStrategy requested, RescoringStrategy resolved, String reason) {
    }

    private final List<ScoringEvent> events = new CopyOnWriteArrayList<>();
    private final List<Fallback> fallbacks = new CopyOnWriteArrayList<>();

    @Override
    public void onScoringEvent(final ScoringEvent event) {
        events.add(event);
    }

    @Override
    public void onStrategyFallback(final RescoringStrategy requested, final RescoringStrategy resolved,
                                   final String reason) {
        fallbacks.add(new Fallback(requested, resolved, reason));
    }

    public List<ScoringEvent> events() {
        return List.copyOf(events);
    }

    public List<ScoringEvent> eventsFor(final String candidateId) {
        return events.stream()
                .filter(event -> event.candidateId().equals(candidateId))
                .toList();
    }

    public List<Fallback> fallbacks() {
        return List.copyOf(fallbacks);
    }

    public void clear() {
        events.clear();
        fallbacks.clear();
    }
}

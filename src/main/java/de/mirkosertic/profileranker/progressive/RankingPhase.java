package de.mirkosertic.profileranker.progressive;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of a progressive ranking session.
 */
public enum RankingPhase {

    IDLE,
    FETCHING,
    EVALUATING,
    DECIDING,
    TERMINATED;

    boolean canTransitionTo(final RankingPhase next) {
        return successors().contains(next);
    }

    private Set<RankingPhase> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(FETCHING, TERMINATED);
            case FETCHING -> EnumSet.of(EVALUATING, TERMINATED);
            case EVALUATING -> EnumSet.of(DECIDING, TERMINATED);
            case DECIDING -> EnumSet.of(FETCHING, TERMINATED);
            case TERMINATED -> EnumSet.noneOf(RankingPhase.class);
        };
    }
}

package de.mirkosertic.profileranker.rescoring;

/**
 * The rescoring strategy applied to the lexically retrieved candidates.
 */
public enum RescoringStrategy {

    /** Tiered boosts and penalties from term matches, combined according to a {@link CombinationMode}. */
    TERM_BOOST,

    /** Additive term scoring where the rescoring score, not the lexical score, is the primary sort key. */
    AMBIGUITY_PRIMARY,

    /** Profile-to-profile matching against the ideal profile of the query. */
    IDEAL_PROFILE_MATCH,

    /**
     * No rescoring signal: candidates keep their lexical order. Never requested explicitly in normal
     * use; the engine falls back to it when the requested strategy has nothing to work with.
     */
    LEXICAL_ONLY
}

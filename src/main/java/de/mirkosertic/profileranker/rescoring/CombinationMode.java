package de.mirkosertic.profileranker.rescoring;

/**
 * How term-boost effects are combined with the lexical score.
 *
 * <p>Callers pick the mode from how clear the query is. Clear queries trust the lexical score and
 * only scale it ({@link #MULTIPLICATIVE}); ambiguous queries let the term signals carry the ranking
 * ({@link #ADDITIVE}).</p>
 */
public enum CombinationMode {

    /** A separate rescoring score is computed and added to the lexical score. Penalties subtract. */
    ADDITIVE,

    /** The lexical score is scaled by boost factors. Penalties scale it down by a factor below one. */
    MULTIPLICATIVE
}

package de.mirkosertic.profileranker.rescoring;

/**
 * How a category contribution was applied to the score.
 */
public enum ContributionKind {

    /** The contribution was added to the score. */
    ADDITIVE,

    /** The score was multiplied by {@code 1 + contribution}. */
    MULTIPLICATIVE
}

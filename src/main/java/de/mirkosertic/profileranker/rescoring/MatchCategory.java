package de.mirkosertic.profileranker.rescoring;

/**
 * The kinds of evidence a rescoring strategy can find in a candidate. Every boost or penalty is
 * attributed to exactly one category.
 */
public enum MatchCategory {

    // Term boost
    HIGH_SIGNAL,
    PATHWAY,
    PROCEDURE,
    ANCHOR,
    SAFE_LANE,
    SUBSPECIALTY,
    NEGATIVE,

    // Ideal profile matching
    IDEAL_SUBCATEGORY,
    IDEAL_PROCEDURE,
    IDEAL_CONDITION,
    IDEAL_MISSING_REQUIRED,
    IDEAL_EXPERTISE_AREA,
    IDEAL_DESCRIPTION_KEYWORD,
    IDEAL_AVOID,
    IDEAL_PREFERENCE,

    // Applied after every strategy
    CHECKLIST
}

package de.mirkosertic.profileranker.config;

import java.util.Locale;

/**
 * Every scalar constant of the ranking pipeline, with its configuration key, its default and the
 * range it is validated against.
 *
 * <p>The defaults are the tuned baseline. Boost values must stay positive, penalties negative and
 * multiplicative factors away from 1.0, so that a match category contributes a non-zero amount
 * exactly when it matched.</p>
 */
public enum RankingParameter {

    // Term boost, additive combination
    HIGH_SIGNAL_1(2.0, Constraint.POSITIVE),
    HIGH_SIGNAL_2(4.0, Constraint.POSITIVE),
    PATHWAY_1(1.0, Constraint.POSITIVE),
    PATHWAY_2(2.0, Constraint.POSITIVE),
    PATHWAY_3(3.0, Constraint.POSITIVE),
    PROCEDURE_PER_MATCH(0.5, Constraint.POSITIVE),
    ANCHOR_PER_MATCH(0.2, Constraint.POSITIVE),
    ANCHOR_CAP(0.6, Constraint.POSITIVE),
    SAFE_LANE_1(1.0, Constraint.POSITIVE),
    SAFE_LANE_2(2.0, Constraint.POSITIVE),
    SAFE_LANE_3(3.0, Constraint.POSITIVE),
    SUBSPECIALTY_FACTOR(0.3, Constraint.POSITIVE),
    SUBSPECIALTY_CAP(0.5, Constraint.POSITIVE),
    NEGATIVE_1(-1.0, Constraint.NEGATIVE),
    NEGATIVE_2(-2.0, Constraint.NEGATIVE),
    NEGATIVE_4(-3.0, Constraint.NEGATIVE),

    // Term boost, multiplicative combination
    HIGH_SIGNAL_MULT_1(1.2, Constraint.FACTOR_ABOVE_ONE),
    HIGH_SIGNAL_MULT_2(1.4, Constraint.FACTOR_ABOVE_ONE),
    PATHWAY_MULT_1(1.05, Constraint.FACTOR_ABOVE_ONE),
    PATHWAY_MULT_2(1.15, Constraint.FACTOR_ABOVE_ONE),
    PATHWAY_MULT_3(1.3, Constraint.FACTOR_ABOVE_ONE),
    PROCEDURE_MULT(1.05, Constraint.FACTOR_ABOVE_ONE),
    NEGATIVE_MULT_1(0.95, Constraint.FACTOR_BELOW_ONE),
    NEGATIVE_MULT_2(0.85, Constraint.FACTOR_BELOW_ONE),
    NEGATIVE_MULT_4(0.70, Constraint.FACTOR_BELOW_ONE),

    // Lexical scoring
    K1(1.5, Constraint.NON_NEGATIVE),
    B(0.75, Constraint.UNIT_INTERVAL),
    EXACT_MATCH_FULL(2.0, Constraint.NON_NEGATIVE),
    EXACT_MATCH_BIGRAM(1.0, Constraint.NON_NEGATIVE),
    QUALITY_VERIFIED_FACTOR(1.1, Constraint.FACTOR_AT_LEAST_ONE),

    // Retrieval ("stage A")
    STAGE_A_TOP_N(100, Constraint.COUNT),
    SAFE_LANE_QUERY_CAP(4, Constraint.COUNT_OR_ZERO),
    INTENT_TERMS_IN_RETRIEVAL(0, Constraint.FLAG),
    INTENT_TERMS_IN_RETRIEVAL_MAX(12, Constraint.INTENT_CAP),
    STAGE_A_TWO_QUERY(0, Constraint.FLAG),
    STAGE_A_PATIENT_TOP_N(50, Constraint.COUNT),
    STAGE_A_INTENT_TOP_N(30, Constraint.COUNT),
    STAGE_A_UNION_MAX(100, Constraint.COUNT),
    STAGE_A_INTENT_TERMS_CAP(10, Constraint.INTENT_CAP),
    STAGE_A_NEGATIVE_PENALTY(0, Constraint.FLAG),

    // Checklist boost
    CHECKLIST_MATCH_THRESHOLD(0.3, Constraint.UNIT_INTERVAL),
    CHECKLIST_BOOST_WEIGHT(1.2, Constraint.FACTOR_ABOVE_ONE),
    CHECKLIST_EXACT_WEIGHT(1.0, Constraint.POSITIVE),
    CHECKLIST_PARTIAL_WEIGHT(0.5, Constraint.POSITIVE),

    // Ideal profile matching
    IDEAL_SUBCATEGORY_REQUIRED(5.0, Constraint.POSITIVE),
    IDEAL_SUBCATEGORY_PREFERRED(3.0, Constraint.POSITIVE),
    IDEAL_SUBCATEGORY_OPTIONAL(1.0, Constraint.POSITIVE),
    IDEAL_SUBCATEGORY_MISSING(-2.0, Constraint.NEGATIVE),
    IDEAL_PROCEDURE_REQUIRED(4.0, Constraint.POSITIVE),
    IDEAL_PROCEDURE_PREFERRED(2.0, Constraint.POSITIVE),
    IDEAL_PROCEDURE_OPTIONAL(0.5, Constraint.POSITIVE),
    IDEAL_PROCEDURE_MISSING(-1.0, Constraint.NEGATIVE),
    IDEAL_CONDITION_REQUIRED(3.0, Constraint.POSITIVE),
    IDEAL_CONDITION_PREFERRED(1.5, Constraint.POSITIVE),
    IDEAL_CONDITION_OPTIONAL(1.5, Constraint.POSITIVE),
    IDEAL_CONDITION_MISSING(-1.0, Constraint.NEGATIVE),
    IDEAL_EXPERTISE_AREA(2.0, Constraint.POSITIVE),
    IDEAL_DESCRIPTION_KEYWORD(1.0, Constraint.POSITIVE),
    IDEAL_AVOID_SUBCATEGORY(-3.0, Constraint.NEGATIVE),
    IDEAL_AVOID_PROCEDURE(-2.0, Constraint.NEGATIVE),
    IDEAL_QUALIFICATION(1.0, Constraint.POSITIVE),
    IDEAL_AGE_GROUP(1.5, Constraint.POSITIVE),
    IDEAL_LANGUAGE(1.0, Constraint.POSITIVE),
    IDEAL_GENDER(1.0, Constraint.POSITIVE),
    FUZZY_MIN_LENGTH(3, Constraint.COUNT);

    /** Hard upper bound for the number of intent terms injected into any retrieval query. */
    public static final int MAX_INTENT_TERMS_IN_RETRIEVAL = 20;

    enum Constraint {
        POSITIVE,
        NEGATIVE,
        NON_NEGATIVE,
        UNIT_INTERVAL,
        FACTOR_ABOVE_ONE,
        FACTOR_AT_LEAST_ONE,
        FACTOR_BELOW_ONE,
        COUNT,
        COUNT_OR_ZERO,
        INTENT_CAP,
        FLAG
    }

    private final double defaultValue;
    private final Constraint constraint;

    RankingParameter(final double defaultValue, final Constraint constraint) {
        this.defaultValue = defaultValue;
        this.constraint = constraint;
    }

    public double defaultValue() {
        return defaultValue;
    }

    public boolean isFlag() {
        return constraint == Constraint.FLAG;
    }

    /**
     * Configuration key, e.g. {@code stage-a-top-n}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static RankingParameter fromKey(final String key) {
        final String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (final RankingParameter parameter : values()) {
            if (parameter.name().equals(normalized)) {
                return parameter;
            }
        }
        throw new IllegalArgumentException("Unknown ranking parameter: " + key);
    }

    /**
     * Rejects values outside this parameter's range with an {@link IllegalArgumentException}
     * naming the key.
     */
    void validate(final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw invalid(value, "a finite number");
        }
        switch (constraint) {
            case POSITIVE -> require(value > 0.0, value, "> 0");
            case NEGATIVE -> require(value < 0.0, value, "< 0");
            case NON_NEGATIVE -> require(value >= 0.0, value, ">= 0");
            case UNIT_INTERVAL -> require(value >= 0.0 && value <= 1.0, value, "within [0, 1]");
            case FACTOR_ABOVE_ONE -> require(value > 1.0, value, "> 1");
            case FACTOR_AT_LEAST_ONE -> require(value >= 1.0, value, ">= 1");
            case FACTOR_BELOW_ONE -> require(value > 0.0 && value < 1.0, value, "within (0, 1)");
            case COUNT -> require(isWhole(value) && value >= 1, value, "a whole number >= 1");
            case COUNT_OR_ZERO -> require(isWhole(value) && value >= 0, value, "a whole number >= 0");
            case INTENT_CAP -> require(isWhole(value) && value >= 0 && value <= MAX_INTENT_TERMS_IN_RETRIEVAL,
                    value, "a whole number within [0, " + MAX_INTENT_TERMS_IN_RETRIEVAL + "]");
            case FLAG -> require(value == 0.0 || value == 1.0, value, "a boolean");
        }
    }

    private static boolean isWhole(final double value) {
        return value == Math.rint(value);
    }

    private void require(final boolean condition, final double value, final String expectation) {
        if (!condition) {
            throw invalid(value, expectation);
        }
    }

    private IllegalArgumentException invalid(final double value, final String expectation) {
        return new IllegalArgumentException(
                "Ranking parameter '" + key() + "' must be " + expectation + ", was " + value);
    }
}

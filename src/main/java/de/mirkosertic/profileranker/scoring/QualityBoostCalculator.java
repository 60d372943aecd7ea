package de.mirkosertic.profileranker.scoring;

import de.mirkosertic.profileranker.config.QualityTier;
import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.config.RankingParameter;
import de.mirkosertic.profileranker.model.Candidate;

/**
 * Multiplicative quality factor from rating, review count, experience and verification.
 *
 * <p>Each signal contributes the factor of the highest tier it reaches; the factors multiply. With the
 * default tiers a verified candidate rated 4.9 with 150 reviews and 25 years of experience gets
 * {@code 1.3 * 1.2 * 1.15 * 1.1}.</p>
 */
public final class QualityBoostCalculator {

    private QualityBoostCalculator() {
    }

    public static double boostFor(final Candidate candidate, final RankingConfig config) {
        double boost = 1.0;
        boost *= QualityTier.factorFor(config.ratingTiers(), sanitize(candidate.ratingValue()));
        boost *= QualityTier.factorFor(config.reviewTiers(), candidate.reviewCount());
        boost *= QualityTier.factorFor(config.experienceTiers(), candidate.yearsExperience());
        if (candidate.verified()) {
            boost *= config.value(RankingParameter.QUALITY_VERIFIED_FACTOR);
        }
        return boost;
    }

    private static double sanitize(final double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }
}

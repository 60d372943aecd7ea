package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.config.RankingParameter;
import de.mirkosertic.profileranker.document.ClinicalExpertise;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.IdealProfile;
import de.mirkosertic.profileranker.model.Importance;
import de.mirkosertic.profileranker.model.ProfileCriterion;
import de.mirkosertic.profileranker.scoring.LexicalScore;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_AGE_GROUP;
import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_AVOID_PROCEDURE;
import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_AVOID_SUBCATEGORY;
import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_DESCRIPTION_KEYWORD;
import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_EXPERTISE_AREA;
import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_GENDER;
import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_LANGUAGE;
import static de.mirkosertic.profileranker.config.RankingParameter.IDEAL_QUALIFICATION;

/**
 * Scores a candidate by how well it matches the ideal profile of the query.
 *
 * <p>Per criterion category (sub-categories, procedures, conditions) a hit scores according to the
 * criterion's importance, and a missed {@code REQUIRED} criterion is a penalty rather than zero.
 * Expertise areas, description keywords and soft preferences add fixed amounts; avoid-list hits
 * subtract. The profile score is floored at zero and added to the lexical score, so a candidate
 * matching nothing keeps exactly its lexical score.</p>
 *
 * <p>Matching is {@link FuzzyMatcher fuzzy containment}; no stemming is involved.</p>
 */
final class IdealProfileRescorer {

    record Result(double profileScore, double finalScore) {
    }

    private enum CriterionGroup {
        SUBCATEGORY(RankingParameter.IDEAL_SUBCATEGORY_REQUIRED, RankingParameter.IDEAL_SUBCATEGORY_PREFERRED,
                RankingParameter.IDEAL_SUBCATEGORY_OPTIONAL, RankingParameter.IDEAL_SUBCATEGORY_MISSING,
                MatchCategory.IDEAL_SUBCATEGORY),
        PROCEDURE(RankingParameter.IDEAL_PROCEDURE_REQUIRED, RankingParameter.IDEAL_PROCEDURE_PREFERRED,
                RankingParameter.IDEAL_PROCEDURE_OPTIONAL, RankingParameter.IDEAL_PROCEDURE_MISSING,
                MatchCategory.IDEAL_PROCEDURE),
        CONDITION(RankingParameter.IDEAL_CONDITION_REQUIRED, RankingParameter.IDEAL_CONDITION_PREFERRED,
                RankingParameter.IDEAL_CONDITION_OPTIONAL, RankingParameter.IDEAL_CONDITION_MISSING,
                MatchCategory.IDEAL_CONDITION);

        private final RankingParameter required;
        private final RankingParameter preferred;
        private final RankingParameter optional;
        private final RankingParameter missing;
        private final MatchCategory category;

        CriterionGroup(final RankingParameter required, final RankingParameter preferred,
                       final RankingParameter optional, final RankingParameter missing,
                       final MatchCategory category) {
            this.required = required;
            this.preferred = preferred;
            this.optional = optional;
            this.missing = missing;
            this.category = category;
        }
    }

    Result evaluate(final LexicalScore lexical, final IdealProfile profile, final RankingConfig config,
                    final BreakdownRecorder recorder) {
        final Candidate candidate = lexical.candidate();
        final FuzzyMatcher matcher = new FuzzyMatcher(config.intValue(RankingParameter.FUZZY_MIN_LENGTH));
        final ClinicalExpertise expertise = ClinicalExpertise.parse(candidate.clinicalExpertise());

        final List<String> procedures = new ArrayList<>(candidate.procedureTags());
        procedures.addAll(expertise.procedures());
        final List<String> conditions = new ArrayList<>(expertise.conditions());
        conditions.addAll(expertise.interests());

        double score = 0.0;
        score += scoreCriteria(CriterionGroup.SUBCATEGORY, profile.subCategories(), candidate.subCategories(),
                matcher, config, recorder);
        score += scoreCriteria(CriterionGroup.PROCEDURE, profile.procedures(), procedures, matcher, config, recorder);
        score += scoreCriteria(CriterionGroup.CONDITION, profile.conditions(), conditions, matcher, config, recorder);

        final String expertiseText = expertise.raw();
        int expertiseHits = 0;
        for (final String area : profile.expertiseAreas()) {
            if (matcher.occursIn(area, expertiseText)) {
                expertiseHits++;
            }
        }
        final double expertiseScore = expertiseHits * config.value(IDEAL_EXPERTISE_AREA);
        recorder.additive(MatchCategory.IDEAL_EXPERTISE_AREA, expertiseHits, expertiseScore);
        score += expertiseScore;

        final String descriptionText = join(candidate.description(), candidate.biography());
        int keywordHits = 0;
        for (final String keyword : profile.descriptionKeywords()) {
            if (matcher.occursIn(keyword, descriptionText)) {
                keywordHits++;
            }
        }
        final double keywordScore = keywordHits * config.value(IDEAL_DESCRIPTION_KEYWORD);
        recorder.additive(MatchCategory.IDEAL_DESCRIPTION_KEYWORD, keywordHits, keywordScore);
        score += keywordScore;

        int avoidHits = 0;
        double avoidScore = 0.0;
        for (final String avoid : profile.avoidSubCategories()) {
            if (matcher.matchesAny(avoid, candidate.subCategories())) {
                avoidHits++;
                avoidScore += config.value(IDEAL_AVOID_SUBCATEGORY);
            }
        }
        for (final String avoid : profile.avoidProcedures()) {
            if (matcher.matchesAny(avoid, procedures)) {
                avoidHits++;
                avoidScore += config.value(IDEAL_AVOID_PROCEDURE);
            }
        }
        recorder.additive(MatchCategory.IDEAL_AVOID, avoidHits, avoidScore);
        score += avoidScore;

        int preferenceHits = 0;
        double preferenceScore = 0.0;
        for (final String qualification : profile.preferredQualifications()) {
            if (hasQualification(candidate, qualification)) {
                preferenceHits++;
                preferenceScore += config.value(IDEAL_QUALIFICATION);
            }
        }
        if (anyMatch(profile.ageGroups(), candidate.ageGroups(), matcher)) {
            preferenceHits++;
            preferenceScore += config.value(IDEAL_AGE_GROUP);
        }
        if (anyMatch(profile.languages(), candidate.languages(), matcher)) {
            preferenceHits++;
            preferenceScore += config.value(IDEAL_LANGUAGE);
        }
        if (profile.genderPreference() != null && candidate.gender() != null
                && profile.genderPreference().trim().equalsIgnoreCase(candidate.gender().trim())) {
            preferenceHits++;
            preferenceScore += config.value(IDEAL_GENDER);
        }
        recorder.additive(MatchCategory.IDEAL_PREFERENCE, preferenceHits, preferenceScore);
        score += preferenceScore;

        final double profileScore = Math.max(0.0, score);
        return new Result(profileScore, Math.max(0.0, lexical.score() + profileScore));
    }

    private static double scoreCriteria(final CriterionGroup group, final List<ProfileCriterion> criteria,
                                        final List<String> candidateValues, final FuzzyMatcher matcher,
                                        final RankingConfig config, final BreakdownRecorder recorder) {
        int hits = 0;
        double hitScore = 0.0;
        int missing = 0;
        double missingScore = 0.0;
        for (final ProfileCriterion criterion : criteria) {
            if (matcher.matchesAny(criterion.name(), candidateValues)) {
                hits++;
                hitScore += switch (criterion.importance()) {
                    case REQUIRED -> config.value(group.required);
                    case PREFERRED -> config.value(group.preferred);
                    case OPTIONAL -> config.value(group.optional);
                };
            } else if (criterion.importance() == Importance.REQUIRED) {
                missing++;
                missingScore += config.value(group.missing);
            }
        }
        recorder.additive(group.category, hits, hitScore);
        recorder.additive(MatchCategory.IDEAL_MISSING_REQUIRED, missing, missingScore);
        return hitScore + missingScore;
    }

    private static boolean hasQualification(final Candidate candidate, final String qualification) {
        final String wanted = qualification.trim().toUpperCase(Locale.ROOT);
        if (wanted.isEmpty()) {
            return false;
        }
        for (final String held : candidate.qualifications()) {
            if (held.toUpperCase(Locale.ROOT).contains(wanted)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyMatch(final List<String> wanted, final List<String> actual, final FuzzyMatcher matcher) {
        for (final String value : wanted) {
            if (matcher.matchesAny(value, actual)) {
                return true;
            }
        }
        return false;
    }

    private static String join(@Nullable final String first, @Nullable final String second) {
        return (first == null ? "" : first) + " " + (second == null ? "" : second);
    }
}

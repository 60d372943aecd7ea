package de.mirkosertic.profileranker.model;

import de.mirkosertic.profileranker.rescoring.CombinationMode;
import de.mirkosertic.profileranker.rescoring.RescoringStrategy;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A ranking request as produced by the upstream intent extraction.
 *
 * <p>Only {@code patientQuery} and a small capped set of safe-lane terms feed the retrieval query.
 * Everything else is a rescoring signal. Absent signal lists are empty, never {@code null}; list
 * entries themselves are checked by the engine before a call is accepted.</p>
 *
 * @param patientQuery        the clean retrieval string
 * @param safeLaneTerms       high-confidence symptom or condition terms, ordered by confidence
 * @param intentTerms         terms used for rescoring boosts only
 * @param anchorPhrases       explicitly stated conditions or procedures
 * @param negativeTerms       terms indicating a wrong-category candidate
 * @param likelySubspecialties sub-categories the query most likely refers to
 * @param idealProfile        target profile for {@link RescoringStrategy#IDEAL_PROFILE_MATCH}
 * @param filters             hard filters applied before scoring
 * @param strategy            the requested rescoring strategy
 * @param combinationMode     how term boosts combine, used by {@link RescoringStrategy#TERM_BOOST}
 * @param nameHint            a practitioner name mentioned in the query, appended to retrieval
 * @param checklistTerms      competency checklist values matched against checklist profiles
 */
public record QueryBundle(
        String patientQuery,
        List<String> safeLaneTerms,
        List<String> intentTerms,
        List<String> anchorPhrases,
        List<String> negativeTerms,
        List<SubspecialtyHint> likelySubspecialties,
        @Nullable IdealProfile idealProfile,
        FilterCriteria filters,
        RescoringStrategy strategy,
        CombinationMode combinationMode,
        @Nullable String nameHint,
        List<String> checklistTerms
) {

    public QueryBundle {
        safeLaneTerms = copyOf(safeLaneTerms);
        intentTerms = copyOf(intentTerms);
        anchorPhrases = copyOf(anchorPhrases);
        negativeTerms = copyOf(negativeTerms);
        likelySubspecialties = copyOf(likelySubspecialties);
        checklistTerms = copyOf(checklistTerms);
    }

    // List.copyOf would reject null entries with an NPE; they are reported as input errors instead
    private static <T> List<T> copyOf(@Nullable final List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Builder builder(final String patientQuery) {
        return new Builder(patientQuery);
    }

    public static class Builder {
        private final String patientQuery;
        private List<String> safeLaneTerms = List.of();
        private List<String> intentTerms = List.of();
        private List<String> anchorPhrases = List.of();
        private List<String> negativeTerms = List.of();
        private List<SubspecialtyHint> likelySubspecialties = List.of();
        private IdealProfile idealProfile;
        private FilterCriteria filters = FilterCriteria.NONE;
        private RescoringStrategy strategy = RescoringStrategy.TERM_BOOST;
        private CombinationMode combinationMode = CombinationMode.MULTIPLICATIVE;
        private String nameHint;
        private List<String> checklistTerms = List.of();

        private Builder(final String patientQuery) {
            this.patientQuery = patientQuery;
        }

        public Builder safeLaneTerms(final String... terms) { this.safeLaneTerms = List.of(terms); return this; }
        public Builder safeLaneTerms(final List<String> terms) { this.safeLaneTerms = terms; return this; }
        public Builder intentTerms(final String... terms) { this.intentTerms = List.of(terms); return this; }
        public Builder intentTerms(final List<String> terms) { this.intentTerms = terms; return this; }
        public Builder anchorPhrases(final String... phrases) { this.anchorPhrases = List.of(phrases); return this; }
        public Builder anchorPhrases(final List<String> phrases) { this.anchorPhrases = phrases; return this; }
        public Builder negativeTerms(final String... terms) { this.negativeTerms = List.of(terms); return this; }
        public Builder negativeTerms(final List<String> terms) { this.negativeTerms = terms; return this; }
        public Builder likelySubspecialties(final SubspecialtyHint... hints) { this.likelySubspecialties = List.of(hints); return this; }
        public Builder likelySubspecialties(final List<SubspecialtyHint> hints) { this.likelySubspecialties = hints; return this; }
        public Builder idealProfile(final IdealProfile idealProfile) { this.idealProfile = idealProfile; return this; }
        public Builder filters(final FilterCriteria filters) { this.filters = filters; return this; }
        public Builder strategy(final RescoringStrategy strategy) { this.strategy = strategy; return this; }
        public Builder combinationMode(final CombinationMode combinationMode) { this.combinationMode = combinationMode; return this; }
        public Builder nameHint(final String nameHint) { this.nameHint = nameHint; return this; }
        public Builder checklistTerms(final String... terms) { this.checklistTerms = List.of(terms); return this; }
        public Builder checklistTerms(final List<String> terms) { this.checklistTerms = terms; return this; }

        public QueryBundle build() {
            return new QueryBundle(patientQuery, safeLaneTerms, intentTerms, anchorPhrases, negativeTerms,
                    likelySubspecialties, idealProfile, filters, strategy, combinationMode, nameHint, checklistTerms);
        }
    }
}

package de.mirkosertic.profileranker.pipeline;

import de.mirkosertic.profileranker.analysis.PhraseMatcher;
import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.config.RankingParameter;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.query.RetrievalQuery;
import de.mirkosertic.profileranker.scoring.LexicalScore;
import de.mirkosertic.profileranker.scoring.LexicalScorer;
import de.mirkosertic.profileranker.scoring.ScoreOrdering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexical retrieval of the candidates that go on to rescoring.
 *
 * <p>By default the filtered pool is scored with the retrieval query and truncated to the pool size.
 * With {@code stage-a-two-query} the patient query and the intent-only query are scored separately;
 * the patient top {@code stage-a-patient-top-n} and the intent top {@code stage-a-intent-top-n} are
 * unioned by candidate id, patient hits first (by patient score, then intent score), intent-only
 * hits after them, and capped at {@code stage-a-union-max}.</p>
 *
 * <p>With {@code stage-a-negative-penalty} the patient scores are scaled by the multiplicative
 * negative-term factors before truncation, so wrong-category candidates are less likely to take a
 * slot in the pool.</p>
 */
public class RetrievalStage {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalStage.class);

    private final LexicalScorer scorer;

    public RetrievalStage(final LexicalScorer scorer) {
        this.scorer = scorer;
    }

    public List<LexicalScore> retrieve(final List<Candidate> filtered, final RetrievalQuery query,
                                       final QueryBundle bundle, final RankingConfig config, final int poolSize) {
        List<LexicalScore> patient = scorer.score(query.text(), filtered, config);
        if (config.flag(RankingParameter.STAGE_A_NEGATIVE_PENALTY)) {
            patient = applyNegativePenalty(patient, bundle.negativeTerms(), config);
        }

        if (!query.isTwoQuery()) {
            return truncate(patient, poolSize);
        }

        final List<LexicalScore> intent = scorer.score(query.intentQuery(), filtered, config);
        return union(truncate(patient, config.intValue(RankingParameter.STAGE_A_PATIENT_TOP_N)),
                truncate(intent, config.intValue(RankingParameter.STAGE_A_INTENT_TOP_N)),
                config.intValue(RankingParameter.STAGE_A_UNION_MAX));
    }

    private record UnionEntry(LexicalScore representative, double patientScore, double intentScore) {
    }

    static List<LexicalScore> union(final List<LexicalScore> patient, final List<LexicalScore> intent,
                                    final int unionMax) {
        final Map<String, UnionEntry> entries = new LinkedHashMap<>();
        for (final LexicalScore score : patient) {
            entries.put(score.candidateId(), new UnionEntry(score, score.score(), -1.0));
        }
        for (final LexicalScore score : intent) {
            entries.merge(score.candidateId(), new UnionEntry(score, -1.0, score.score()),
                    (existing, added) -> new UnionEntry(existing.representative(), existing.patientScore(),
                            added.intentScore()));
        }

        final List<UnionEntry> ordered = new ArrayList<>(entries.values());
        ordered.sort(Comparator
                .<UnionEntry>comparingLong(e -> -ScoreOrdering.key(e.patientScore()))
                .thenComparingLong(e -> -ScoreOrdering.key(e.intentScore()))
                .thenComparingInt(e -> e.representative().inputIndex()));

        final List<LexicalScore> result = ordered.stream()
                .limit(unionMax)
                .map(UnionEntry::representative)
                .toList();
        logger.debug("Two-query union: {} patient, {} intent, {} after union", patient.size(), intent.size(),
                result.size());
        return result;
    }

    static List<LexicalScore> applyNegativePenalty(final List<LexicalScore> scores, final List<String> negativeTerms,
                                                   final RankingConfig config) {
        final List<String> terms = negativeTerms.stream()
                .map(PhraseMatcher::normalize)
                .filter(term -> !term.isEmpty())
                .distinct()
                .toList();
        if (terms.isEmpty()) {
            return scores;
        }
        final List<LexicalScore> penalized = new ArrayList<>(scores.size());
        for (final LexicalScore score : scores) {
            final String text = PhraseMatcher.normalize(score.documentText());
            int matches = 0;
            for (final String term : terms) {
                if (PhraseMatcher.containsPhraseStart(text, term)) {
                    matches++;
                }
            }
            penalized.add(matches == 0 ? score : score.withScore(score.score() * negativeFactor(matches, config)));
        }
        penalized.sort(ScoreOrdering.descending(LexicalScore::score, LexicalScore::inputIndex));
        return penalized;
    }

    private static double negativeFactor(final int matches, final RankingConfig config) {
        if (matches == 1) {
            return config.value(RankingParameter.NEGATIVE_MULT_1);
        }
        return matches <= 3
                ? config.value(RankingParameter.NEGATIVE_MULT_2)
                : config.value(RankingParameter.NEGATIVE_MULT_4);
    }

    private static List<LexicalScore> truncate(final List<LexicalScore> scores, final int size) {
        return scores.size() <= size ? scores : List.copyOf(scores.subList(0, size));
    }
}

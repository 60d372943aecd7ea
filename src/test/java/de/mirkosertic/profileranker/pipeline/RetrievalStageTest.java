package de.mirkosertic.profileranker.pipeline;

import de.mirkosertic.profileranker.analysis.ProfileTextAnalyzer;
import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.document.DocumentTextProjector;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.query.QueryNormalizer;
import de.mirkosertic.profileranker.query.RetrievalQuery;
import de.mirkosertic.profileranker.query.RetrievalQueryBuilder;
import de.mirkosertic.profileranker.scoring.LexicalScore;
import de.mirkosertic.profileranker.scoring.LexicalScorer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RetrievalStage}.
 */
class RetrievalStageTest {

    private final RetrievalStage stage = new RetrievalStage(
            new LexicalScorer(new ProfileTextAnalyzer(), new DocumentTextProjector()));
    private final RetrievalQueryBuilder queryBuilder = new RetrievalQueryBuilder(new QueryNormalizer());

    private static LexicalScore score(final String id, final int index, final double value) {
        return score(id, index, "", value);
    }

    private static LexicalScore score(final String id, final int index, final String text, final double value) {
        return new LexicalScore(Candidate.builder(id).build(), index, text, value, 1.0, 0.0, value, Map.of());
    }

    private static List<String> ids(final List<LexicalScore> scores) {
        return scores.stream().map(LexicalScore::candidateId).toList();
    }

    // ========== Union ==========

    @Test
    void testUnionKeepsPatientHitsFirst() {
        final List<LexicalScore> patient = List.of(score("p1", 0, 3.0), score("p2", 1, 2.0));
        final List<LexicalScore> intent = List.of(score("p2", 1, 5.0), score("i1", 2, 4.0));

        assertThat(ids(RetrievalStage.union(patient, intent, 100))).containsExactly("p1", "p2", "i1");
        assertThat(ids(RetrievalStage.union(patient, intent, 2))).containsExactly("p1", "p2");
    }

    @Test
    void testUnionOrdersIntentOnlyHitsByIntentScore() {
        final List<LexicalScore> intent = List.of(score("i1", 3, 1.0), score("i2", 1, 4.0));

        assertThat(ids(RetrievalStage.union(List.of(), intent, 10))).containsExactly("i2", "i1");
    }

    // ========== Negative penalty ==========

    @Test
    void testNegativePenaltyReorders() {
        final List<LexicalScore> scores = List.of(
                score("wrong", 0, "Coronary angiography", 10.0),
                score("right", 1, "ablation", 9.8));

        final List<LexicalScore> penalized = RetrievalStage.applyNegativePenalty(scores,
                List.of("coronary angiography"), RankingConfig.defaults());

        assertThat(ids(penalized)).containsExactly("right", "wrong");
        assertThat(penalized.get(1).score()).isCloseTo(9.5, within(1e-9));
    }

    @Test
    void testNoNegativeTermsIsNoOp() {
        final List<LexicalScore> scores = List.of(score("a", 0, 1.0));

        assertThat(RetrievalStage.applyNegativePenalty(scores, List.of(" "), RankingConfig.defaults()))
                .isSameAs(scores);
    }

    // ========== Retrieval ==========

    @Test
    void testSingleQueryTruncatesToPoolSize() {
        final List<Candidate> pool = List.of(
                Candidate.builder("a").description("pacemaker").build(),
                Candidate.builder("b").description("ablation").build(),
                Candidate.builder("c").description("pacemaker clinic").build());
        final QueryBundle bundle = QueryBundle.builder("pacemaker").build();
        final RetrievalQuery query = queryBuilder.build(bundle, RankingConfig.defaults());

        final List<LexicalScore> retrieved = stage.retrieve(pool, query, bundle, RankingConfig.defaults(), 2);

        assertThat(retrieved).hasSize(2);
        assertThat(ids(retrieved)).doesNotContain("b");
    }

    @Test
    void testTwoQueryRetrieval() {
        final RankingConfig config = RankingConfig.defaults().withOverrides(Map.of(
                "stage-a-two-query", true,
                "stage-a-patient-top-n", 1,
                "stage-a-intent-top-n", 1));
        final List<Candidate> pool = List.of(
                Candidate.builder("derm").description("dermatology").build(),
                Candidate.builder("svt").description("svt ablation").build(),
                Candidate.builder("racing").description("racing heart palpitations").build());
        final QueryBundle bundle = QueryBundle.builder("racing heart").intentTerms("svt").build();
        final RetrievalQuery query = queryBuilder.build(bundle, config);

        final List<LexicalScore> retrieved = stage.retrieve(pool, query, bundle, config, 100);

        assertThat(query.isTwoQuery()).isTrue();
        assertThat(ids(retrieved)).containsExactly("racing", "svt");
    }
}

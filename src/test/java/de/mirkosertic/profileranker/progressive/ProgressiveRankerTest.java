package de.mirkosertic.profileranker.progressive;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.pipeline.RankingEngine;
import de.mirkosertic.profileranker.telemetry.RankingTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ProgressiveRanker}.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProgressiveRanker")
class ProgressiveRankerTest {

    private static final String QUERY = "pacemaker";

    @Mock
    private FitJudge judge;

    private ProgressiveRanker ranker;

    @BeforeEach
    void setUp() {
        ranker = new ProgressiveRanker(new RankingEngine(RankingConfig.defaults(), RankingTelemetry.NOOP), judge);
    }

    @AfterEach
    void tearDown() {
        ranker.close();
    }

    private static List<Candidate> pool(final int size) {
        final List<Candidate> pool = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            pool.add(Candidate.builder(String.format("c%02d", i))
                    .name("Dr " + i)
                    .primaryCategory("Cardiology")
                    .description("Pacemaker clinic")
                    .build());
        }
        return pool;
    }

    private static QueryBundle bundle() {
        return QueryBundle.builder(QUERY).build();
    }

    private static Answer<List<FitJudgement>> judgeAll(final Function<String, FitCategory> categoryById) {
        return invocation -> {
            final List<CandidateSummary> summaries = invocation.getArgument(1);
            return summaries.stream()
                    .map(summary -> new FitJudgement(summary.candidateId(), categoryById.apply(summary.candidateId()),
                            "judged"))
                    .toList();
        };
    }

    // ========== Termination ==========

    @Test
    @DisplayName("Stops after the first wave when the leading candidates are all excellent")
    void testTopKExcellent() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(judgeAll(id -> FitCategory.EXCELLENT));

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), ProgressiveOptions.defaults());

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.TOP_K_EXCELLENT);
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.profilesReviewed()).isEqualTo(12);
        assertThat(result.profilesFetched()).isEqualTo(12);
        assertThat(result.results()).hasSize(12).allSatisfy(candidate -> {
            assertThat(candidate.fit()).isEqualTo(FitCategory.EXCELLENT);
            assertThat(candidate.classified()).isTrue();
            assertThat(candidate.iterationFound()).isEqualTo(1);
            assertThat(candidate.classifiedIteration()).isEqualTo(1);
            assertThat(candidate.reason()).isEqualTo("judged");
        });
        assertThat(result.qualityBreakdown()).containsExactlyInAnyOrderEntriesOf(Map.of(
                FitCategory.EXCELLENT, 12, FitCategory.GOOD, 0, FitCategory.ILL_FIT, 0));

        @SuppressWarnings("unchecked")
        final ArgumentCaptor<List<CandidateSummary>> captor = ArgumentCaptor.forClass(List.class);
        verify(judge, times(1)).classify(eq(QUERY), captor.capture());
        assertThat(captor.getValue()).extracting(CandidateSummary::candidateId)
                .containsExactly("c00", "c01", "c02", "c03", "c04", "c05", "c06", "c07", "c08", "c09", "c10", "c11");
    }

    @Test
    @DisplayName("An ill-fit leader does not hide the excellent candidates behind it")
    void testTopKExcellentUsesQualityGroupedOrder() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(
                judgeAll(id -> "c00".equals(id) ? FitCategory.ILL_FIT : FitCategory.EXCELLENT));
        final ProgressiveOptions options = ProgressiveOptions.builder().groupByFit(true).build();

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), options);

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.TOP_K_EXCELLENT);
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.profilesReviewed()).isEqualTo(12);
        assertThat(result.iterationDetails()).singleElement()
                .extracting(IterationDetail::topKExcellent)
                .isEqualTo(true);
        assertThat(result.results().get(0).candidateId()).isEqualTo("c01");
        assertThat(result.results().get(result.results().size() - 1).candidateId()).isEqualTo("c00");
    }

    @Test
    void testTopKExcellentIgnoresOutputOrder() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(
                judgeAll(id -> "c00".equals(id) ? FitCategory.ILL_FIT : FitCategory.EXCELLENT));

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), ProgressiveOptions.defaults());

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.TOP_K_EXCELLENT);
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.results().get(0).candidateId()).isEqualTo("c00");
    }

    @Test
    void testTopKExcellentNeedsEnoughExcellentCandidates() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(
                judgeAll(id -> "c05".equals(id) || "c07".equals(id) ? FitCategory.EXCELLENT : FitCategory.GOOD));
        final ProgressiveOptions options = ProgressiveOptions.builder().maxIterations(1).build();

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), options);

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
        assertThat(result.iterationDetails()).singleElement()
                .extracting(IterationDetail::topKExcellent)
                .isEqualTo(false);
    }

    @Test
    @DisplayName("The review budget caps the last batch and ends the session")
    void testMaxProfilesReviewed() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(judgeAll(id -> FitCategory.ILL_FIT));

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), ProgressiveOptions.defaults());

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.MAX_PROFILES_REVIEWED);
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.profilesReviewed()).isEqualTo(30);
        assertThat(result.profilesFetched()).isEqualTo(36);
        assertThat(result.iterationDetails()).extracting(IterationDetail::submitted).containsExactly(12, 12, 6);
        assertThat(result.iterationDetails()).extracting(IterationDetail::poolSize).containsExactly(12, 24, 36);
        assertThat(result.iterationDetails().get(2).illFit()).isEqualTo(30);
        assertThat(result.qualityBreakdown()).containsEntry(FitCategory.ILL_FIT, 12);
    }

    @Test
    void testMaxIterations() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(judgeAll(id -> FitCategory.GOOD));
        final ProgressiveOptions options = ProgressiveOptions.builder().maxIterations(2).build();

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), options);

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(result.profilesReviewed()).isEqualTo(24);
        assertThat(result.results()).extracting(RankedCandidate::iterationFound).containsOnly(1);
    }

    @Test
    void testPoolExhausted() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(judgeAll(id -> FitCategory.ILL_FIT));

        final ProgressiveResult result = ranker.rank(pool(5), bundle(), ProgressiveOptions.defaults());

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.POOL_EXHAUSTED);
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.profilesReviewed()).isEqualTo(5);
        assertThat(result.results()).hasSize(5);
    }

    @Test
    void testEmptyPool() {
        final ProgressiveResult result = ranker.rank(List.of(), bundle(), ProgressiveOptions.defaults());

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.POOL_EXHAUSTED);
        assertThat(result.iterations()).isZero();
        assertThat(result.results()).isEmpty();
        verifyNoInteractions(judge);
    }

    // ========== Judge failures ==========

    @Test
    @DisplayName("A failing judge leaves candidates unclassified and does not consume the review budget")
    void testJudgeFailureIsNotCountedAsReviewed() throws Exception {
        when(judge.classify(anyString(), anyList())).thenThrow(new JudgeException("service unavailable"));
        final ProgressiveOptions options = ProgressiveOptions.builder().maxIterations(3).build();

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), options);

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
        assertThat(result.profilesReviewed()).isZero();
        assertThat(result.profilesFetched()).isEqualTo(36);
        assertThat(result.iterationDetails()).allSatisfy(detail -> {
            assertThat(detail.judgeSucceeded()).isFalse();
            assertThat(detail.classified()).isZero();
        });
        assertThat(result.results()).allSatisfy(candidate -> {
            assertThat(candidate.classified()).isFalse();
            assertThat(candidate.fit()).isEqualTo(FitCategory.GOOD);
            assertThat(candidate.classifiedIteration()).isEqualTo(-1);
        });
        verify(judge, times(3)).classify(anyString(), anyList());
    }

    @Test
    void testJudgeTimeout() {
        final CountDownLatch never = new CountDownLatch(1);
        final FitJudge slowJudge = (query, summaries) -> {
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JudgeException("interrupted", e);
            }
            return List.of();
        };
        final ProgressiveOptions options = ProgressiveOptions.builder()
                .maxIterations(1)
                .judgeTimeout(Duration.ofMillis(50))
                .build();

        try (ProgressiveRanker slowRanker = new ProgressiveRanker(
                new RankingEngine(RankingConfig.defaults(), RankingTelemetry.NOOP), slowJudge)) {
            final ProgressiveResult result = slowRanker.rank(pool(20), bundle(), options);

            assertThat(result.terminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
            assertThat(result.profilesReviewed()).isZero();
            assertThat(result.iterationDetails()).singleElement()
                    .extracting(IterationDetail::judgeSucceeded)
                    .isEqualTo(false);
        }
    }

    @Test
    @DisplayName("Judgements for candidates that were not submitted are ignored")
    void testUnknownJudgementsAreIgnored() throws Exception {
        when(judge.classify(anyString(), anyList())).thenReturn(List.of(
                FitJudgement.of("c00", FitCategory.EXCELLENT),
                FitJudgement.of("stranger", FitCategory.EXCELLENT)));
        final ProgressiveOptions options = ProgressiveOptions.builder().maxIterations(1).build();

        final ProgressiveResult result = ranker.rank(pool(20), bundle(), options);

        assertThat(result.iterationDetails()).singleElement()
                .extracting(IterationDetail::classified)
                .isEqualTo(1);
        assertThat(result.profilesReviewed()).isEqualTo(12);
        assertThat(result.results()).extracting(RankedCandidate::candidateId).doesNotContain("stranger");
        assertThat(result.results().get(0).fit()).isEqualTo(FitCategory.EXCELLENT);
        assertThat(result.results().get(1).classified()).isFalse();
    }

    @Test
    @DisplayName("A candidate the judge skips is resubmitted but reviewed only once")
    void testSkippedCandidateCountsAsReviewedOnce() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(invocation -> {
            final List<CandidateSummary> summaries = invocation.getArgument(1);
            return summaries.stream()
                    .filter(summary -> !"c00".equals(summary.candidateId()))
                    .map(summary -> FitJudgement.of(summary.candidateId(), FitCategory.GOOD))
                    .toList();
        });

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), ProgressiveOptions.defaults());

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.MAX_PROFILES_REVIEWED);
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.profilesReviewed()).isEqualTo(30);
        assertThat(result.profilesFetched()).isEqualTo(36);
        assertThat(result.iterationDetails()).extracting(IterationDetail::submitted).containsExactly(12, 12, 8);

        @SuppressWarnings("unchecked")
        final ArgumentCaptor<List<CandidateSummary>> captor = ArgumentCaptor.forClass(List.class);
        verify(judge, times(3)).classify(eq(QUERY), captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(batch ->
                assertThat(batch).extracting(CandidateSummary::candidateId).contains("c00"));
        assertThat(result.results()).filteredOn(candidate -> "c00".equals(candidate.candidateId()))
                .singleElement()
                .extracting(RankedCandidate::classified)
                .isEqualTo(false);
    }

    // ========== Cancellation ==========

    @Test
    void testCancelledBeforeStart() {
        final RankingCancellation cancellation = new RankingCancellation();
        cancellation.cancel();

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), null, ProgressiveOptions.defaults(),
                cancellation);

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(result.iterations()).isZero();
        assertThat(result.results()).isEmpty();
        verifyNoInteractions(judge);
    }

    @Test
    void testCancelledBetweenIterations() throws Exception {
        final RankingCancellation cancellation = new RankingCancellation();
        when(judge.classify(anyString(), anyList())).thenAnswer(invocation -> {
            cancellation.cancel();
            return judgeAll(id -> FitCategory.GOOD).answer(invocation);
        });

        final ProgressiveResult result = ranker.rank(pool(40), bundle(), null, ProgressiveOptions.defaults(),
                cancellation);

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.profilesReviewed()).isEqualTo(12);
        assertThat(result.results()).hasSize(12);
    }

    // ========== Shortlist ==========

    @Test
    void testShortlistKeepsScoreOrderByDefault() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(judgeAll(ProgressiveRankerTest::mixedFit));
        final ProgressiveOptions options = ProgressiveOptions.builder()
                .maxIterations(1)
                .batchSize(4)
                .shortlistSize(4)
                .build();

        final ProgressiveResult result = ranker.rank(pool(4), bundle(), options);

        assertThat(result.results()).extracting(RankedCandidate::candidateId)
                .containsExactly("c00", "c01", "c02", "c03");
    }

    @Test
    void testShortlistGroupedByFit() throws Exception {
        when(judge.classify(anyString(), anyList())).thenAnswer(judgeAll(ProgressiveRankerTest::mixedFit));
        final ProgressiveOptions options = ProgressiveOptions.builder()
                .maxIterations(1)
                .batchSize(4)
                .shortlistSize(3)
                .groupByFit(true)
                .build();

        final ProgressiveResult result = ranker.rank(pool(4), bundle(), options);

        assertThat(result.results()).extracting(RankedCandidate::candidateId).containsExactly("c01", "c03", "c02");
        assertThat(result.qualityBreakdown()).containsExactlyInAnyOrderEntriesOf(Map.of(
                FitCategory.EXCELLENT, 2, FitCategory.GOOD, 1, FitCategory.ILL_FIT, 0));
    }

    private static FitCategory mixedFit(final String id) {
        return switch (id) {
            case "c00" -> FitCategory.ILL_FIT;
            case "c02" -> FitCategory.GOOD;
            default -> FitCategory.EXCELLENT;
        };
    }

    // ========== Options ==========

    @Test
    void testOptionsValidation() {
        final ProgressiveOptions defaults = ProgressiveOptions.defaults();
        assertThat(defaults.maxIterations()).isEqualTo(5);
        assertThat(defaults.maxProfilesReviewed()).isEqualTo(30);
        assertThat(defaults.batchSize()).isEqualTo(12);
        assertThat(defaults.targetTopK()).isEqualTo(3);

        assertThatThrownBy(() -> ProgressiveOptions.builder().batchSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");
        assertThatThrownBy(
                        () -> ProgressiveOptions.builder().judgeTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}

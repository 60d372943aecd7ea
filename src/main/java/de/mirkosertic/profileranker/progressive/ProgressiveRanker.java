package de.mirkosertic.profileranker.progressive;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.pipeline.PreparedRanking;
import de.mirkosertic.profileranker.pipeline.RankingEngine;
import de.mirkosertic.profileranker.rescoring.RescoringOutcome;
import de.mirkosertic.profileranker.rescoring.RescoringStrategy;
import de.mirkosertic.profileranker.rescoring.ScoredResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Iterative ranking that expands the candidate pool in waves and lets an external {@link FitJudge}
 * classify the leading candidates after every wave.
 *
 * <p>Each iteration runs {@code FETCHING -> EVALUATING -> DECIDING}:</p>
 * <ol>
 *   <li>the next {@code batchSize} unseen candidates of the lexical order join the pool and the
 *       whole pool is rescored;</li>
 *   <li>the first {@code batchSize} not yet classified candidates of the rescored order, capped by
 *       the remaining review budget, are sent to the judge;</li>
 *   <li>the session stops when the top {@code targetTopK} of the quality-grouped order are all
 *       excellent, when
 *       {@code maxIterations} is reached, or when {@code maxProfilesReviewed} is reached, checked
 *       in that order.</li>
 * </ol>
 * <p>A fetch that returns nothing ends the session with {@link TerminationReason#POOL_EXHAUSTED};
 * cancellation is checked before every iteration.</p>
 *
 * <p>Judge calls run on the executor with the configured timeout. Failures and timeouts are logged
 * and leave the batch unclassified; such batches do not count as reviewed. A candidate counts as
 * reviewed once, however often it is submitted. Iterations of one
 * session are strictly sequential, separate sessions share nothing but the engine.</p>
 */
public class ProgressiveRanker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ProgressiveRanker.class);

    private final RankingEngine engine;
    private final FitJudge judge;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Creates a ranker with its own single daemon thread for judge calls, released by {@link #close()}.
     */
    public ProgressiveRanker(final RankingEngine engine, final FitJudge judge) {
        this(engine, judge, Executors.newSingleThreadExecutor(r -> {
            final Thread thread = new Thread(r, "progressive-judge");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    /**
     * Creates a ranker that runs judge calls on a caller-owned executor.
     */
    public ProgressiveRanker(final RankingEngine engine, final FitJudge judge, final ExecutorService executor) {
        this(engine, judge, executor, false);
    }

    private ProgressiveRanker(final RankingEngine engine, final FitJudge judge, final ExecutorService executor,
                              final boolean ownsExecutor) {
        this.engine = engine;
        this.judge = judge;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    public ProgressiveResult rank(final List<Candidate> pool, final QueryBundle bundle,
                                  final ProgressiveOptions options) {
        return rank(pool, bundle, null, options, new RankingCancellation());
    }

    /**
     * Runs one progressive ranking session.
     *
     * @throws de.mirkosertic.profileranker.pipeline.InvalidQueryBundleException if the bundle is malformed
     * @throws IllegalArgumentException if the override is invalid
     */
    public ProgressiveResult rank(final List<Candidate> pool, final QueryBundle bundle,
                                  @Nullable final Map<String, ?> overrides, final ProgressiveOptions options,
                                  final RankingCancellation cancellation) {
        final RankingConfig config = engine.resolveConfig(overrides);
        final PreparedRanking prepared = engine.prepare(pool, bundle, config, Integer.MAX_VALUE);
        final ProgressiveState state = new ProgressiveState(prepared.lexicalOrder());

        logger.info("Progressive ranking for '{}' over {} retrieved candidates (batch {}, target top {})",
                bundle.patientQuery(), prepared.lexicalOrder().size(), options.batchSize(), options.targetTopK());

        List<ScoredResult> ranking = List.of();
        RescoringStrategy resolvedStrategy = bundle.strategy();
        final List<IterationDetail> details = new ArrayList<>();

        while (state.phase() != RankingPhase.TERMINATED) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                state.terminate(TerminationReason.CANCELLED);
                break;
            }

            state.transitionTo(RankingPhase.FETCHING);
            final int fetched = state.beginIteration(options.batchSize());
            if (fetched == 0) {
                state.terminate(TerminationReason.POOL_EXHAUSTED);
                break;
            }
            final RescoringOutcome outcome = engine.rescore(state.accumulated(), bundle, config);
            ranking = outcome.results();
            resolvedStrategy = outcome.resolvedStrategy();

            state.transitionTo(RankingPhase.EVALUATING);
            final List<ScoredResult> batch = selectBatch(ranking, state, options);
            final BatchOutcome evaluated = evaluate(bundle.patientQuery(), batch, state, options.judgeTimeout());

            state.transitionTo(RankingPhase.DECIDING);
            final boolean topKExcellent = topKExcellent(ranking, state, options.targetTopK());
            details.add(detail(state, fetched, ranking, batch.size(), evaluated, topKExcellent));
            logger.info("Iteration {}: fetched {}, pool {}, judged {}/{}, reviewed {}",
                    state.iteration(), fetched, ranking.size(), evaluated.classified(), batch.size(),
                    state.profilesReviewed());

            if (topKExcellent) {
                state.terminate(TerminationReason.TOP_K_EXCELLENT);
            } else if (state.iteration() >= options.maxIterations()) {
                state.terminate(TerminationReason.MAX_ITERATIONS);
            } else if (state.profilesReviewed() >= options.maxProfilesReviewed()) {
                state.terminate(TerminationReason.MAX_PROFILES_REVIEWED);
            }
        }

        final List<RankedCandidate> shortlist = shortlist(ranking, state, options);
        final TerminationReason reason = state.terminationReason();
        logger.info("Progressive ranking terminated ({}) after {} iterations, {} reviewed, {} fetched",
                reason.key(), state.iteration(), state.profilesReviewed(), state.profilesFetched());
        return new ProgressiveResult(shortlist, reason, state.iteration(), state.profilesReviewed(),
                state.profilesFetched(), qualityBreakdown(shortlist), details, resolvedStrategy);
    }

    private record BatchOutcome(boolean succeeded, int classified) {
    }

    private static List<ScoredResult> selectBatch(final List<ScoredResult> ranking, final ProgressiveState state,
                                                  final ProgressiveOptions options) {
        // Resubmitting a candidate the judge skipped costs no budget
        int budget = Math.max(0, options.maxProfilesReviewed() - state.profilesReviewed());
        final List<ScoredResult> batch = new ArrayList<>();
        for (final ScoredResult result : ranking) {
            if (batch.size() >= options.batchSize()) {
                break;
            }
            if (state.isClassified(result.candidateId())) {
                continue;
            }
            if (state.isReviewed(result.candidateId())) {
                batch.add(result);
            } else if (budget > 0) {
                batch.add(result);
                budget--;
            }
        }
        return batch;
    }

    private BatchOutcome evaluate(final String query, final List<ScoredResult> batch, final ProgressiveState state,
                                  @Nullable final Duration timeout) {
        if (batch.isEmpty()) {
            return new BatchOutcome(true, 0);
        }
        final List<CandidateSummary> summaries = batch.stream()
                .map(result -> CandidateSummary.of(result.candidate()))
                .toList();
        final Future<List<FitJudgement>> future = executor.submit(() -> judge.classify(query, summaries));

        final List<FitJudgement> judgements;
        try {
            judgements = timeout == null
                    ? future.get()
                    : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            logger.warn("Judge timed out after {} for {} candidates in iteration {}", timeout, batch.size(),
                    state.iteration());
            return new BatchOutcome(false, 0);
        } catch (final ExecutionException e) {
            logger.warn("Judge failed for {} candidates in iteration {}", batch.size(), state.iteration(),
                    e.getCause());
            return new BatchOutcome(false, 0);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the judge in iteration {}", state.iteration());
            return new BatchOutcome(false, 0);
        }

        final Set<String> submitted = new HashSet<>();
        for (final ScoredResult result : batch) {
            submitted.add(result.candidateId());
        }
        int classified = 0;
        if (judgements != null) {
            for (final FitJudgement judgement : judgements) {
                if (judgement != null && submitted.remove(judgement.candidateId())) {
                    state.classify(judgement);
                    classified++;
                }
            }
        }
        if (!submitted.isEmpty()) {
            logger.debug("Judge left {} of {} candidates unclassified", submitted.size(), batch.size());
        }
        state.addReviewed(batch.stream().map(ScoredResult::candidateId).toList());
        return new BatchOutcome(true, classified);
    }

    /**
     * Whether the top {@code targetTopK} of the quality-grouped order (excellent, then good and
     * unclassified, then ill-fit, by score within each group) are all excellent. The check uses that
     * order regardless of {@link ProgressiveOptions#groupByFit()}, so it holds exactly when at least
     * {@code targetTopK} candidates of the pool are judged excellent.
     */
    static boolean topKExcellent(final List<ScoredResult> ranking, final ProgressiveState state, final int targetTopK) {
        int excellent = 0;
        for (final ScoredResult result : ranking) {
            final ProgressiveState.Classification classification = state.classification(result.candidateId());
            if (classification != null && classification.fit() == FitCategory.EXCELLENT && ++excellent >= targetTopK) {
                return true;
            }
        }
        return false;
    }

    private static IterationDetail detail(final ProgressiveState state, final int fetched,
                                          final List<ScoredResult> ranking, final int submitted,
                                          final BatchOutcome outcome, final boolean topKExcellent) {
        final Map<FitCategory, Integer> counts = new EnumMap<>(FitCategory.class);
        for (final ScoredResult result : ranking) {
            final ProgressiveState.Classification classification = state.classification(result.candidateId());
            if (classification != null) {
                counts.merge(classification.fit(), 1, Integer::sum);
            }
        }
        return new IterationDetail(state.iteration(), fetched, ranking.size(), submitted, outcome.classified(),
                outcome.succeeded(), topKExcellent,
                counts.getOrDefault(FitCategory.EXCELLENT, 0),
                counts.getOrDefault(FitCategory.GOOD, 0),
                counts.getOrDefault(FitCategory.ILL_FIT, 0));
    }

    static List<RankedCandidate> shortlist(final List<ScoredResult> ranking, final ProgressiveState state,
                                           final ProgressiveOptions options) {
        final List<RankedCandidate> annotated = new ArrayList<>(ranking.size());
        for (final ScoredResult result : ranking) {
            final ProgressiveState.Classification classification = state.classification(result.candidateId());
            annotated.add(classification == null
                    ? new RankedCandidate(result, FitCategory.GOOD, false,
                            state.iterationFound(result.candidateId()), -1, null)
                    : new RankedCandidate(result, classification.fit(), true,
                            state.iterationFound(result.candidateId()), classification.iteration(),
                            classification.reason()));
        }
        if (options.groupByFit()) {
            // List.sort is stable, so the rescoring order survives within each group
            annotated.sort(Comparator.comparing(RankedCandidate::fit));
        }
        return annotated.size() <= options.shortlistSize()
                ? annotated
                : List.copyOf(annotated.subList(0, options.shortlistSize()));
    }

    private static Map<FitCategory, Integer> qualityBreakdown(final List<RankedCandidate> shortlist) {
        final Map<FitCategory, Integer> breakdown = new EnumMap<>(FitCategory.class);
        for (final FitCategory category : FitCategory.values()) {
            breakdown.put(category, 0);
        }
        for (final RankedCandidate candidate : shortlist) {
            breakdown.merge(candidate.fit(), 1, Integer::sum);
        }
        return breakdown;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

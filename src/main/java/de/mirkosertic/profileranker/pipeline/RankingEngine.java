package de.mirkosertic.profileranker.pipeline;

import de.mirkosertic.profileranker.analysis.ProfileTextAnalyzer;
import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.config.RankingParameter;
import de.mirkosertic.profileranker.document.DocumentTextProjector;
import de.mirkosertic.profileranker.filter.FilterStage;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.model.SubspecialtyHint;
import de.mirkosertic.profileranker.query.QueryNormalizer;
import de.mirkosertic.profileranker.query.RetrievalQuery;
import de.mirkosertic.profileranker.query.RetrievalQueryBuilder;
import de.mirkosertic.profileranker.rescoring.RescoringEngine;
import de.mirkosertic.profileranker.rescoring.RescoringOutcome;
import de.mirkosertic.profileranker.rescoring.ScoredResult;
import de.mirkosertic.profileranker.scoring.LexicalScore;
import de.mirkosertic.profileranker.scoring.LexicalScorer;
import de.mirkosertic.profileranker.telemetry.RankingTelemetry;
import de.mirkosertic.profileranker.telemetry.Slf4jRankingTelemetry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of a single ranking call:
 * {@code FilterStage -> LexicalScorer (retrieval query) -> RescoringEngine}.
 *
 * <p>Each call builds its own {@link RankingConfig} from the engine's base configuration and the
 * caller's partial override; nothing is shared between calls except read-only configuration, so
 * one engine can serve concurrent calls. Scoring within a call is single-threaded and
 * deterministic: identical inputs produce identical orderings and scores.</p>
 */
public class RankingEngine {

    private static final Logger logger = LoggerFactory.getLogger(RankingEngine.class);

    private static final int MIN_POOL_SIZE = 50;
    private static final int POOL_SIZE_PER_RESULT = 10;

    private final RankingConfig baseConfig;
    private final FilterStage filterStage;
    private final RetrievalQueryBuilder queryBuilder;
    private final RetrievalStage retrievalStage;
    private final RescoringEngine rescoringEngine;

    public RankingEngine() {
        this(RankingConfig.defaults(), new Slf4jRankingTelemetry());
    }

    public RankingEngine(final RankingConfig baseConfig, final RankingTelemetry telemetry) {
        this.baseConfig = baseConfig;
        this.filterStage = new FilterStage();
        this.queryBuilder = new RetrievalQueryBuilder(new QueryNormalizer());
        this.retrievalStage = new RetrievalStage(new LexicalScorer(new ProfileTextAnalyzer(), new DocumentTextProjector()));
        this.rescoringEngine = new RescoringEngine(telemetry);
    }

    public RankingConfig baseConfig() {
        return baseConfig;
    }

    /**
     * Merges a per-call override onto the base configuration.
     *
     * @throws IllegalArgumentException if the override contains unknown keys or invalid values
     */
    public RankingConfig resolveConfig(@Nullable final Map<String, ?> overrides) {
        return baseConfig.withOverrides(overrides);
    }

    public RankingResponse rank(final List<Candidate> pool, final QueryBundle bundle, final int resultSize) {
        return rank(pool, bundle, null, resultSize);
    }

    /**
     * Ranks {@code pool} against {@code bundle} and returns the best {@code resultSize} results.
     *
     * @throws InvalidQueryBundleException if the bundle is malformed
     * @throws IllegalArgumentException    if the override or the result size is invalid
     */
    public RankingResponse rank(final List<Candidate> pool, final QueryBundle bundle,
                                @Nullable final Map<String, ?> overrides, final int resultSize) {
        if (resultSize < 1) {
            throw new IllegalArgumentException("Result size must be >= 1, was " + resultSize);
        }
        final RankingConfig config = resolveConfig(overrides);
        final PreparedRanking prepared = prepare(pool, bundle, config, retrievalPoolSize(config, resultSize));

        final RescoringOutcome outcome = rescore(prepared.lexicalOrder(), bundle, config);
        final List<ScoredResult> results = outcome.results().size() <= resultSize
                ? outcome.results()
                : outcome.results().subList(0, resultSize);

        final QueryDiagnostics diagnostics = diagnostics(prepared, outcome);
        logger.info("Ranked {} of {} candidates for '{}' with {} (pool {}, returned {})",
                prepared.filteredCount(), pool.size(), bundle.patientQuery(), outcome.resolvedStrategy(),
                prepared.lexicalOrder().size(), results.size());
        return new RankingResponse(results, diagnostics);
    }

    /**
     * Validates the bundle, filters the pool and retrieves up to {@code poolSize} candidates in
     * lexical order.
     */
    public PreparedRanking prepare(final List<Candidate> pool, final QueryBundle bundle, final RankingConfig config,
                                   final int poolSize) {
        QueryBundleValidator.validate(bundle);
        if (pool == null) {
            throw new InvalidQueryBundleException("Candidate pool must not be null");
        }
        final List<Candidate> filtered = filterStage.apply(pool, bundle.filters());
        final RetrievalQuery retrievalQuery = queryBuilder.build(bundle, config);
        final List<LexicalScore> lexical = retrievalStage.retrieve(filtered, retrievalQuery, bundle, config, poolSize);
        return new PreparedRanking(bundle, config, retrievalQuery, poolSize, filtered.size(), lexical);
    }

    public RescoringOutcome rescore(final List<LexicalScore> lexical, final QueryBundle bundle,
                                    final RankingConfig config) {
        return rescoringEngine.rescore(lexical, bundle, config);
    }

    /**
     * {@code max(stage-a-top-n, max(resultSize * 10, 50))}.
     */
    public static int retrievalPoolSize(final RankingConfig config, final int resultSize) {
        final int perResult = Math.max(resultSize * POOL_SIZE_PER_RESULT, MIN_POOL_SIZE);
        return Math.max(config.intValue(RankingParameter.STAGE_A_TOP_N), perResult);
    }

    static QueryDiagnostics diagnostics(final PreparedRanking prepared, final RescoringOutcome outcome) {
        final RetrievalQuery query = prepared.retrievalQuery();
        final QueryBundle bundle = prepared.bundle();

        final List<String> retrievalTerms = new ArrayList<>();
        if (bundle.patientQuery() != null && !bundle.patientQuery().isBlank()) {
            retrievalTerms.add(bundle.patientQuery().trim());
        }
        retrievalTerms.addAll(query.safeLaneTermsUsed());
        if (bundle.nameHint() != null && !bundle.nameHint().isBlank()) {
            retrievalTerms.add(bundle.nameHint().trim());
        }
        retrievalTerms.addAll(query.anchorPhrasesAppended());
        retrievalTerms.addAll(query.intentTermsInjected());

        final List<String> rescoringTerms = new ArrayList<>();
        rescoringTerms.addAll(bundle.intentTerms());
        rescoringTerms.addAll(bundle.anchorPhrases());
        rescoringTerms.addAll(bundle.safeLaneTerms());
        rescoringTerms.addAll(bundle.negativeTerms());
        for (final SubspecialtyHint hint : bundle.likelySubspecialties()) {
            rescoringTerms.add(hint.name());
        }
        rescoringTerms.addAll(bundle.checklistTerms());

        return new QueryDiagnostics(
                query.normalization().original(),
                query.normalization().normalized(),
                query.normalization().describeAliases(),
                query.text(),
                query.intentQuery(),
                retrievalTerms,
                rescoringTerms,
                outcome.requestedStrategy(),
                outcome.resolvedStrategy(),
                bundle.combinationMode(),
                prepared.poolSize(),
                prepared.filteredCount(),
                prepared.lexicalOrder().size());
    }
}

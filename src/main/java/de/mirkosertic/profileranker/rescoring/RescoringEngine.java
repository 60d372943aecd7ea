package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.QueryBundle;
import de.mirkosertic.profileranker.scoring.LexicalScore;
import de.mirkosertic.profileranker.scoring.ScoreOrdering;
import de.mirkosertic.profileranker.telemetry.RankingTelemetry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Re-scores and re-orders lexically retrieved candidates with one of the
 * {@link RescoringStrategy rescoring strategies}.
 *
 * <p>Strategy resolution happens once per call. A strategy without usable signal degrades instead
 * of failing: {@link RescoringStrategy#IDEAL_PROFILE_MATCH} without an ideal profile falls back to
 * {@link RescoringStrategy#TERM_BOOST}, and the term strategies without any term signal fall back
 * to {@link RescoringStrategy#LEXICAL_ONLY}, which keeps the lexical order.</p>
 *
 * <p>Sort keys, each compared at four decimals, with the input position as the last tie-break:</p>
 * <ul>
 *   <li>{@code TERM_BOOST} additive: final score, then rescoring score</li>
 *   <li>{@code TERM_BOOST} multiplicative and {@code LEXICAL_ONLY}: final score, then lexical score</li>
 *   <li>{@code AMBIGUITY_PRIMARY}: rescoring score, then lexical score</li>
 *   <li>{@code IDEAL_PROFILE_MATCH}: final score, then profile score</li>
 * </ul>
 *
 * <p>When the bundle carries checklist terms, candidates with a checklist profile get the
 * {@link ChecklistMatcher checklist boost} on top of every strategy.</p>
 *
 * <p>The engine is stateless between calls; inputs are never modified.</p>
 */
public class RescoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(RescoringEngine.class);

    private final RankingTelemetry telemetry;
    private final TermVocabulary vocabulary;
    private final TermBoostRescorer termBoostRescorer = new TermBoostRescorer();
    private final IdealProfileRescorer idealProfileRescorer = new IdealProfileRescorer();

    public RescoringEngine(final RankingTelemetry telemetry) {
        this(telemetry, TermVocabulary.defaults());
    }

    public RescoringEngine(final RankingTelemetry telemetry, final TermVocabulary vocabulary) {
        this.telemetry = telemetry;
        this.vocabulary = vocabulary;
    }

    private record Ranked(ScoredResult result, double primary, double secondary) {
    }

    public RescoringOutcome rescore(final List<LexicalScore> lexical, final QueryBundle bundle,
                                    final RankingConfig config) {
        final TermSignals signals = TermSignals.of(bundle, vocabulary);
        final RescoringStrategy requested = bundle.strategy();
        final RescoringStrategy resolved = resolveStrategy(requested, bundle, signals);

        final List<Ranked> ranked = new ArrayList<>(lexical.size());
        for (int i = 0; i < lexical.size(); i++) {
            ranked.add(rescoreOne(lexical.get(i), i, resolved, bundle, signals, config));
        }
        ranked.sort(Comparator.<Ranked>comparingLong(r -> -ScoreOrdering.key(r.primary()))
                .thenComparingLong(r -> -ScoreOrdering.key(r.secondary()))
                .thenComparingInt(r -> r.result().inputIndex()));

        final List<ScoredResult> results = ranked.stream().map(Ranked::result).toList();
        logger.debug("Rescored {} candidates with {} (requested {})", results.size(), resolved, requested);
        return new RescoringOutcome(requested, resolved, results);
    }

    private Ranked rescoreOne(final LexicalScore lexical, final int inputIndex, final RescoringStrategy strategy,
                              final QueryBundle bundle, final TermSignals signals, final RankingConfig config) {
        final BreakdownRecorder recorder = new BreakdownRecorder(lexical.candidateId(), strategy, telemetry);

        Double rescoring = null;
        double finalScore;
        switch (strategy) {
            case TERM_BOOST -> {
                final TermBoostRescorer.Result result = termBoostRescorer.evaluate(lexical, signals,
                        bundle.combinationMode(), config, recorder);
                rescoring = result.rescoringScore();
                finalScore = result.finalScore();
            }
            case AMBIGUITY_PRIMARY -> {
                final TermBoostRescorer.Result result = termBoostRescorer.evaluate(lexical, signals,
                        CombinationMode.ADDITIVE, config, recorder);
                rescoring = result.rescoringScore();
                finalScore = Math.max(0.0, rescoring);
            }
            case IDEAL_PROFILE_MATCH -> {
                final IdealProfileRescorer.Result result = idealProfileRescorer.evaluate(lexical,
                        bundle.idealProfile(), config, recorder);
                rescoring = result.profileScore();
                finalScore = result.finalScore();
            }
            default -> finalScore = lexical.score();
        }

        final ChecklistMatcher.Match checklist = checklistMatch(lexical.candidate(), bundle, config);
        if (checklist.boosted()) {
            recorder.multiplicative(MatchCategory.CHECKLIST, checklist.matches(), checklist.boost());
            finalScore *= checklist.boost();
            if (strategy == RescoringStrategy.AMBIGUITY_PRIMARY && rescoring > 0.0) {
                rescoring = rescoring * checklist.boost();
            }
        }

        final ScoredResult result = new ScoredResult(lexical.candidate(), lexical.score(), rescoring,
                finalScore, recorder.build(), inputIndex);
        return switch (strategy) {
            case AMBIGUITY_PRIMARY -> new Ranked(result, rescoring, lexical.score());
            case TERM_BOOST -> new Ranked(result, finalScore, rescoring != null ? rescoring : lexical.score());
            case IDEAL_PROFILE_MATCH -> new Ranked(result, finalScore, rescoring);
            default -> new Ranked(result, finalScore, lexical.score());
        };
    }

    private static ChecklistMatcher.Match checklistMatch(final Candidate candidate, final QueryBundle bundle,
                                                         final RankingConfig config) {
        if (bundle.checklistTerms().isEmpty() || candidate.checklistProfile() == null) {
            return ChecklistMatcher.Match.NONE;
        }
        return ChecklistMatcher.match(bundle.checklistTerms(), candidate.checklistProfile(), config);
    }

    private RescoringStrategy resolveStrategy(final RescoringStrategy requested, final QueryBundle bundle,
                                              final TermSignals signals) {
        RescoringStrategy resolved = requested;
        String reason = null;
        if (resolved == RescoringStrategy.IDEAL_PROFILE_MATCH && bundle.idealProfile() == null) {
            resolved = RescoringStrategy.TERM_BOOST;
            reason = "no ideal profile";
        }
        if ((resolved == RescoringStrategy.TERM_BOOST || resolved == RescoringStrategy.AMBIGUITY_PRIMARY)
                && signals.isEmpty()) {
            resolved = RescoringStrategy.LEXICAL_ONLY;
            reason = reason == null ? "no term signals" : reason + " and no term signals";
        }
        if (resolved != requested) {
            reportFallback(requested, resolved, reason);
        }
        return resolved;
    }

    private void reportFallback(final RescoringStrategy requested, final RescoringStrategy resolved,
                                @Nullable final String reason) {
        final String effectiveReason = reason == null ? "no signal" : reason;
        logger.warn("Rescoring strategy {} degraded to {}: {}", requested, resolved, effectiveReason);
        telemetry.onStrategyFallback(requested, resolved, effectiveReason);
    }
}

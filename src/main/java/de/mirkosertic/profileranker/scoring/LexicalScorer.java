package de.mirkosertic.profileranker.scoring;

import de.mirkosertic.profileranker.analysis.ProfileTextAnalyzer;
import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.config.RankingParameter;
import de.mirkosertic.profileranker.document.DocumentTextProjector;
import de.mirkosertic.profileranker.model.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BM25 scoring of a candidate pool against a query.
 *
 * <p>The corpus is the pool handed in: document frequencies and the average document length are
 * computed per call, so scores are only comparable within one call. For every distinct query term</p>
 * <pre>
 *   idf  = max(0, ln((N - df + 0.5) / (df + 0.5)))
 *   term = idf * tf * (k1 + 1) / (tf + k1 * (1 - b + b * dl / avgdl))
 * </pre>
 * <p>The clamp matters after category filtering: a term present in every document of the pool
 * discriminates nothing and would otherwise get a negative IDF and penalize exactly the documents
 * that contain it. Clamped, it contributes exactly zero.</p>
 *
 * <p>The final score is {@code max(0, bm25 * qualityBoost + exactMatchBonus)}, see
 * {@link QualityBoostCalculator} and {@link ExactMatchBonus}.</p>
 *
 * <p>Degenerate inputs never divide by zero: an empty pool yields an empty result, and a query
 * without indexable tokens or a pool whose documents are all empty yields every candidate in input
 * order with a score of zero. Every candidate of the pool is returned, ordered by descending score
 * with input order breaking ties.</p>
 */
public class LexicalScorer {

    private static final Logger logger = LoggerFactory.getLogger(LexicalScorer.class);

    private final ProfileTextAnalyzer analyzer;
    private final DocumentTextProjector projector;

    public LexicalScorer(final ProfileTextAnalyzer analyzer, final DocumentTextProjector projector) {
        this.analyzer = analyzer;
        this.projector = projector;
    }

    public List<LexicalScore> score(final String query, final List<Candidate> candidates, final RankingConfig config) {
        if (candidates.isEmpty()) {
            return List.of();
        }

        final int n = candidates.size();
        final List<String> texts = new ArrayList<>(n);
        final List<Map<String, Integer>> termFrequencies = new ArrayList<>(n);
        final int[] lengths = new int[n];
        long totalLength = 0;
        for (int i = 0; i < n; i++) {
            final String text = projector.project(candidates.get(i), config.fieldWeights());
            final List<String> tokens = analyzer.tokenize(text);
            final Map<String, Integer> tf = new HashMap<>();
            for (final String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            texts.add(text);
            termFrequencies.add(tf);
            lengths[i] = tokens.size();
            totalLength += tokens.size();
        }

        final Set<String> queryTerms = new LinkedHashSet<>(analyzer.tokenize(query));
        final double avgLength = (double) totalLength / n;
        if (queryTerms.isEmpty() || avgLength <= 0.0) {
            logger.debug("Degenerate lexical scoring (queryTerms={}, avgLength={}), keeping input order",
                    queryTerms.size(), avgLength);
            final List<LexicalScore> zeros = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                zeros.add(LexicalScore.zero(candidates.get(i), i, texts.get(i)));
            }
            return zeros;
        }

        final Map<String, Double> idf = new LinkedHashMap<>();
        for (final String term : queryTerms) {
            int df = 0;
            for (final Map<String, Integer> tf : termFrequencies) {
                if (tf.containsKey(term)) {
                    df++;
                }
            }
            idf.put(term, inverseDocumentFrequency(n, df));
        }

        final double k1 = config.value(RankingParameter.K1);
        final double b = config.value(RankingParameter.B);
        final double fullBonus = config.value(RankingParameter.EXACT_MATCH_FULL);
        final double bigramBonus = config.value(RankingParameter.EXACT_MATCH_BIGRAM);

        final List<LexicalScore> scores = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final Candidate candidate = candidates.get(i);
            final Map<String, Integer> tf = termFrequencies.get(i);
            final Map<String, Double> termScores = new LinkedHashMap<>();
            double bm25 = 0.0;
            for (final Map.Entry<String, Double> entry : idf.entrySet()) {
                final int frequency = tf.getOrDefault(entry.getKey(), 0);
                final double contribution = termScore(entry.getValue(), frequency, lengths[i], avgLength, k1, b);
                termScores.put(entry.getKey(), contribution);
                bm25 += contribution;
            }
            final double quality = QualityBoostCalculator.boostFor(candidate, config);
            final double bonus = ExactMatchBonus.compute(query, texts.get(i), fullBonus, bigramBonus);
            final double score = clamp(bm25 * quality + bonus);
            scores.add(new LexicalScore(candidate, i, texts.get(i), bm25, quality, bonus, score, termScores));
        }

        scores.sort(ScoreOrdering.descending(LexicalScore::score, LexicalScore::inputIndex));
        return scores;
    }

    /**
     * BM25 inverse document frequency, clamped at zero.
     */
    static double inverseDocumentFrequency(final int documentCount, final int documentFrequency) {
        final double idf = Math.log((documentCount - documentFrequency + 0.5) / (documentFrequency + 0.5));
        return Math.max(0.0, idf);
    }

    static double termScore(final double idf, final int tf, final int documentLength, final double avgLength,
                            final double k1, final double b) {
        if (tf == 0 || idf == 0.0) {
            return 0.0;
        }
        final double norm = tf + k1 * (1.0 - b + b * documentLength / avgLength);
        return idf * (tf * (k1 + 1.0)) / norm;
    }

    private static double clamp(final double score) {
        if (Double.isNaN(score) || score < 0.0) {
            return 0.0;
        }
        return score;
    }
}

package de.mirkosertic.profileranker.scoring;

import de.mirkosertic.profileranker.model.Candidate;

import java.util.Map;

/**
 * Lexical relevance of one candidate.
 *
 * @param candidate     the scored candidate
 * @param inputIndex    position of the candidate in the scored pool, the final tie-break
 * @param documentText  the projected text the candidate was scored on
 * @param bm25          raw BM25 sum over the query terms
 * @param qualityBoost  multiplicative quality factor, {@code >= 1}
 * @param exactBonus    additive exact-match bonus
 * @param score         {@code max(0, bm25 * qualityBoost + exactBonus)}
 * @param termScores    BM25 contribution per distinct query term
 */
public record LexicalScore(
        Candidate candidate,
        int inputIndex,
        String documentText,
        double bm25,
        double qualityBoost,
        double exactBonus,
        double score,
        Map<String, Double> termScores
) {

    public LexicalScore {
        termScores = Map.copyOf(termScores);
    }

    public static LexicalScore zero(final Candidate candidate, final int inputIndex, final String documentText) {
        return new LexicalScore(candidate, inputIndex, documentText, 0.0, 1.0, 0.0, 0.0, Map.of());
    }

    public String candidateId() {
        return candidate.id();
    }

    public LexicalScore withScore(final double newScore) {
        return new LexicalScore(candidate, inputIndex, documentText, bm25, qualityBoost, exactBonus, newScore, termScores);
    }

    public LexicalScore withInputIndex(final int newInputIndex) {
        return new LexicalScore(candidate, newInputIndex, documentText, bm25, qualityBoost, exactBonus, score, termScores);
    }
}

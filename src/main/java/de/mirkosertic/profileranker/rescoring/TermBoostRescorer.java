package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.analysis.PhraseMatcher;
import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.SubspecialtyHint;
import de.mirkosertic.profileranker.scoring.LexicalScore;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

import static de.mirkosertic.profileranker.config.RankingParameter.ANCHOR_CAP;
import static de.mirkosertic.profileranker.config.RankingParameter.ANCHOR_PER_MATCH;
import static de.mirkosertic.profileranker.config.RankingParameter.HIGH_SIGNAL_1;
import static de.mirkosertic.profileranker.config.RankingParameter.HIGH_SIGNAL_2;
import static de.mirkosertic.profileranker.config.RankingParameter.HIGH_SIGNAL_MULT_1;
import static de.mirkosertic.profileranker.config.RankingParameter.HIGH_SIGNAL_MULT_2;
import static de.mirkosertic.profileranker.config.RankingParameter.NEGATIVE_1;
import static de.mirkosertic.profileranker.config.RankingParameter.NEGATIVE_2;
import static de.mirkosertic.profileranker.config.RankingParameter.NEGATIVE_4;
import static de.mirkosertic.profileranker.config.RankingParameter.NEGATIVE_MULT_1;
import static de.mirkosertic.profileranker.config.RankingParameter.NEGATIVE_MULT_2;
import static de.mirkosertic.profileranker.config.RankingParameter.NEGATIVE_MULT_4;
import static de.mirkosertic.profileranker.config.RankingParameter.PATHWAY_1;
import static de.mirkosertic.profileranker.config.RankingParameter.PATHWAY_2;
import static de.mirkosertic.profileranker.config.RankingParameter.PATHWAY_3;
import static de.mirkosertic.profileranker.config.RankingParameter.PATHWAY_MULT_1;
import static de.mirkosertic.profileranker.config.RankingParameter.PATHWAY_MULT_2;
import static de.mirkosertic.profileranker.config.RankingParameter.PATHWAY_MULT_3;
import static de.mirkosertic.profileranker.config.RankingParameter.PROCEDURE_MULT;
import static de.mirkosertic.profileranker.config.RankingParameter.PROCEDURE_PER_MATCH;
import static de.mirkosertic.profileranker.config.RankingParameter.SAFE_LANE_1;
import static de.mirkosertic.profileranker.config.RankingParameter.SAFE_LANE_2;
import static de.mirkosertic.profileranker.config.RankingParameter.SAFE_LANE_3;
import static de.mirkosertic.profileranker.config.RankingParameter.SUBSPECIALTY_CAP;
import static de.mirkosertic.profileranker.config.RankingParameter.SUBSPECIALTY_FACTOR;

/**
 * Term-count rescoring in either {@link CombinationMode}.
 *
 * <p>Both modes count the same matches against the candidate's projected text; they differ only in
 * how each category's effect is applied:</p>
 * <table>
 *   <caption>Effects per category</caption>
 *   <tr><th>Category</th><th>ADDITIVE</th><th>MULTIPLICATIVE</th></tr>
 *   <tr><td>high-signal</td><td>+2.0 / +4.0 (1 / 2+)</td><td>x1.2 / x1.4</td></tr>
 *   <tr><td>pathway</td><td>+1 / +2 / +3 (1 / 2 / 3+)</td><td>x1.05 / x1.15 / x1.3</td></tr>
 *   <tr><td>procedure</td><td>+0.5 per match</td><td>x1.05 if any</td></tr>
 *   <tr><td>anchor</td><td colspan="2">+0.2 per match, capped at 0.6</td></tr>
 *   <tr><td>safe-lane</td><td colspan="2">+1 / +2 / +3 (1 / 2 / 3+)</td></tr>
 *   <tr><td>subspecialty</td><td>+min(sum(confidence) * 0.3, 0.5)</td><td>x(1 + same)</td></tr>
 *   <tr><td>negative</td><td>-1 / -2 / -3 (1 / 2-3 / 4+)</td><td>x0.95 / x0.85 / x0.70</td></tr>
 * </table>
 *
 * <p>In additive mode the effects sum to a separate rescoring score and the final score is
 * {@code max(0, lexical + rescoring)}. In multiplicative mode there is no separate rescoring score:
 * {@code final = max(0, (lexical * hs * pathway * procedure + anchor + safeLane) * subspecialty * negative)}.
 * All numbers are the defaults of {@link de.mirkosertic.profileranker.config.RankingParameter}.</p>
 */
final class TermBoostRescorer {

    record Result(@Nullable Double rescoringScore, double finalScore) {
    }

    Result evaluate(final LexicalScore lexical, final TermSignals signals, final CombinationMode mode,
                    final RankingConfig config, final BreakdownRecorder recorder) {
        final String text = PhraseMatcher.normalize(lexical.documentText());

        final int highSignal = countMatches(text, signals.highSignal());
        final int pathway = countMatches(text, signals.pathway());
        final int procedure = countMatches(text, signals.procedure());
        final int anchors = countMatches(text, signals.anchors());
        final int safeLane = countMatches(text, signals.safeLane());
        final int negative = countMatches(text, signals.negative());
        final SubspecialtyMatch subspecialty = matchSubspecialties(lexical.candidate(), signals.subspecialties());

        final boolean additive = mode == CombinationMode.ADDITIVE;

        // Effects that are additive in both modes
        final double anchorBoost = anchors == 0 ? 0.0
                : Math.min(anchors * config.value(ANCHOR_PER_MATCH), config.value(ANCHOR_CAP));
        final double safeLaneBoost = tier(safeLane, config.value(SAFE_LANE_1), config.value(SAFE_LANE_2),
                config.value(SAFE_LANE_3));
        final double subspecialtyBoost = subspecialty.matches() == 0 ? 0.0
                : Math.min(subspecialty.confidenceSum() * config.value(SUBSPECIALTY_FACTOR), config.value(SUBSPECIALTY_CAP));
        recorder.additive(MatchCategory.ANCHOR, anchors, anchorBoost);
        recorder.additive(MatchCategory.SAFE_LANE, safeLane, safeLaneBoost);

        if (additive) {
            final double highSignalBoost = highSignal == 0 ? 0.0
                    : highSignal == 1 ? config.value(HIGH_SIGNAL_1) : config.value(HIGH_SIGNAL_2);
            final double pathwayBoost = tier(pathway, config.value(PATHWAY_1), config.value(PATHWAY_2),
                    config.value(PATHWAY_3));
            final double procedureBoost = procedure * config.value(PROCEDURE_PER_MATCH);
            final double negativePenalty = negativeTier(negative, config.value(NEGATIVE_1), config.value(NEGATIVE_2),
                    config.value(NEGATIVE_4));

            recorder.additive(MatchCategory.HIGH_SIGNAL, highSignal, highSignalBoost);
            recorder.additive(MatchCategory.PATHWAY, pathway, pathwayBoost);
            recorder.additive(MatchCategory.PROCEDURE, procedure, procedureBoost);
            recorder.additive(MatchCategory.SUBSPECIALTY, subspecialty.matches(), subspecialtyBoost);
            recorder.additive(MatchCategory.NEGATIVE, negative, negativePenalty);

            final double rescoring = highSignalBoost + pathwayBoost + procedureBoost + anchorBoost + safeLaneBoost
                    + subspecialtyBoost + negativePenalty;
            return new Result(rescoring, Math.max(0.0, lexical.score() + rescoring));
        }

        final double highSignalFactor = highSignal == 0 ? 1.0
                : highSignal == 1 ? config.value(HIGH_SIGNAL_MULT_1) : config.value(HIGH_SIGNAL_MULT_2);
        final double pathwayFactor = pathway == 0 ? 1.0 : tier(pathway, config.value(PATHWAY_MULT_1),
                config.value(PATHWAY_MULT_2), config.value(PATHWAY_MULT_3));
        final double procedureFactor = procedure == 0 ? 1.0 : config.value(PROCEDURE_MULT);
        final double subspecialtyFactor = 1.0 + subspecialtyBoost;
        final double negativeFactor = negative == 0 ? 1.0 : negativeTier(negative, config.value(NEGATIVE_MULT_1),
                config.value(NEGATIVE_MULT_2), config.value(NEGATIVE_MULT_4));

        recorder.multiplicative(MatchCategory.HIGH_SIGNAL, highSignal, highSignalFactor);
        recorder.multiplicative(MatchCategory.PATHWAY, pathway, pathwayFactor);
        recorder.multiplicative(MatchCategory.PROCEDURE, procedure, procedureFactor);
        recorder.multiplicative(MatchCategory.SUBSPECIALTY, subspecialty.matches(), subspecialtyFactor);
        recorder.multiplicative(MatchCategory.NEGATIVE, negative, negativeFactor);

        final double boosted = lexical.score() * highSignalFactor * pathwayFactor * procedureFactor
                + anchorBoost + safeLaneBoost;
        return new Result(null, Math.max(0.0, boosted * subspecialtyFactor * negativeFactor));
    }

    /**
     * Number of distinct terms occurring in {@code normalizedText}. Terms must start on a word
     * boundary but may end inside a word.
     */
    static int countMatches(final String normalizedText, final List<String> normalizedTerms) {
        int count = 0;
        for (final String term : normalizedTerms) {
            if (PhraseMatcher.containsPhraseStart(normalizedText, term)) {
                count++;
            }
        }
        return count;
    }

    private static double tier(final int count, final double one, final double two, final double threeOrMore) {
        if (count <= 0) {
            return 0.0;
        }
        if (count == 1) {
            return one;
        }
        return count == 2 ? two : threeOrMore;
    }

    private static double negativeTier(final int count, final double one, final double twoToThree,
                                       final double fourOrMore) {
        if (count <= 0) {
            return 0.0;
        }
        if (count == 1) {
            return one;
        }
        return count <= 3 ? twoToThree : fourOrMore;
    }

    record SubspecialtyMatch(int matches, double confidenceSum) {
    }

    static SubspecialtyMatch matchSubspecialties(final Candidate candidate, final List<SubspecialtyHint> hints) {
        int matches = 0;
        double confidenceSum = 0.0;
        for (final SubspecialtyHint hint : hints) {
            for (final String subCategory : candidate.subCategories()) {
                if (subspecialtyMatches(hint.name(), subCategory)) {
                    matches++;
                    confidenceSum += hint.confidence();
                    break;
                }
            }
        }
        return new SubspecialtyMatch(matches, confidenceSum);
    }

    /**
     * Equal, contained in either direction, or sharing a word longer than three characters.
     */
    static boolean subspecialtyMatches(final String hint, final String subCategory) {
        final String a = hint.trim().toLowerCase(Locale.ROOT);
        final String b = subCategory.trim().toLowerCase(Locale.ROOT);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equals(b) || a.contains(b) || b.contains(a)) {
            return true;
        }
        final List<String> wordsOfB = List.of(PhraseMatcher.normalize(b).split(" "));
        for (final String word : PhraseMatcher.normalize(a).split(" ")) {
            if (word.length() > 3 && wordsOfB.contains(word)) {
                return true;
            }
        }
        return false;
    }
}

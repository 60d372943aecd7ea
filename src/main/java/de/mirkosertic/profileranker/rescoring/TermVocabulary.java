package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.analysis.PhraseMatcher;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splits intent terms into tiers by exact membership: a term is high-signal when it is one of the
 * high-signal phrases, a procedure when it is one of the procedure phrases, and a pathway term
 * otherwise. Terms are compared after case folding and punctuation removal, so "stable angina" is
 * a pathway term even though it mentions "angina".
 */
public final class TermVocabulary {

    static final List<String> DEFAULT_HIGH_SIGNAL = List.of(
            "chest pain",
            "angina",
            "coronary artery disease",
            "ischaemic heart disease",
            "ct coronary angiography",
            "stress echo",
            "chest pain clinic");

    static final List<String> DEFAULT_PROCEDURE = List.of(
            "interventional cardiology",
            "coronary angiography",
            "pci",
            "stent",
            "percutaneous coronary intervention");

    private static final TermVocabulary DEFAULTS = new TermVocabulary(DEFAULT_HIGH_SIGNAL, DEFAULT_PROCEDURE);

    private final Set<String> highSignal;
    private final Set<String> procedure;

    public TermVocabulary(final List<String> highSignal, final List<String> procedure) {
        this.highSignal = normalizeAll(highSignal);
        this.procedure = normalizeAll(procedure);
    }

    private static Set<String> normalizeAll(final List<String> phrases) {
        return phrases.stream()
                .map(PhraseMatcher::normalize)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static TermVocabulary defaults() {
        return DEFAULTS;
    }

    /**
     * The tier of an intent term: {@link MatchCategory#HIGH_SIGNAL}, {@link MatchCategory#PROCEDURE}
     * or {@link MatchCategory#PATHWAY}.
     */
    public MatchCategory classify(final String intentTerm) {
        final String normalized = PhraseMatcher.normalize(intentTerm);
        if (highSignal.contains(normalized)) {
            return MatchCategory.HIGH_SIGNAL;
        }
        if (procedure.contains(normalized)) {
            return MatchCategory.PROCEDURE;
        }
        return MatchCategory.PATHWAY;
    }
}

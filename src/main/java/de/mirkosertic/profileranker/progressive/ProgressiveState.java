package de.mirkosertic.profileranker.progressive;

import de.mirkosertic.profileranker.scoring.LexicalScore;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one progressive ranking session. Confined to the thread running the session
 * and discarded once the shortlist is built.
 */
public final class ProgressiveState {

    /**
     * First classification of a candidate. Later judgements replace category and reason but keep
     * the iteration.
     */
    public record Classification(FitCategory fit, @Nullable String reason, int iteration) {
    }

    private final List<LexicalScore> lexicalOrder;
    private final List<LexicalScore> accumulated = new ArrayList<>();
    private final Map<String, Integer> iterationFound = new HashMap<>();
    private final Map<String, Classification> classifications = new HashMap<>();

    private final Set<String> reviewed = new LinkedHashSet<>();

    private int cursor;
    private int iteration;
    private RankingPhase phase = RankingPhase.IDLE;
    private @Nullable TerminationReason terminationReason;

    ProgressiveState(final List<LexicalScore> lexicalOrder) {
        this.lexicalOrder = List.copyOf(lexicalOrder);
    }

    /**
     * Starts the next iteration by appending the next {@code batchSize} unseen candidates of the
     * lexical order to the pool, tagged with the new iteration number. When nothing is left to
     * fetch the iteration count stays unchanged.
     *
     * @return the number of candidates added
     */
    int beginIteration(final int batchSize) {
        final int next = iteration + 1;
        int added = 0;
        while (cursor < lexicalOrder.size() && added < batchSize) {
            final LexicalScore score = lexicalOrder.get(cursor++);
            if (iterationFound.putIfAbsent(score.candidateId(), next) == null) {
                accumulated.add(score.withInputIndex(accumulated.size()));
                added++;
            }
        }
        if (added > 0) {
            iteration = next;
        }
        return added;
    }

    void classify(final FitJudgement judgement) {
        classifications.merge(judgement.candidateId(),
                new Classification(judgement.fit(), judgement.reason(), iteration),
                (existing, added) -> new Classification(added.fit(), added.reason(), existing.iteration()));
    }

    /**
     * Marks the submitted candidates as reviewed. A candidate the judge left unclassified may be
     * submitted again later but counts towards the review budget only once.
     *
     * @return the number of candidates reviewed for the first time
     */
    int addReviewed(final Collection<String> candidateIds) {
        final int before = reviewed.size();
        reviewed.addAll(candidateIds);
        return reviewed.size() - before;
    }

    void transitionTo(final RankingPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition " + phase + " -> " + next);
        }
        phase = next;
    }

    void terminate(final TerminationReason reason) {
        transitionTo(RankingPhase.TERMINATED);
        terminationReason = reason;
    }

    public List<LexicalScore> accumulated() {
        return Collections.unmodifiableList(accumulated);
    }

    public Set<String> fetchedIds() {
        return Collections.unmodifiableSet(iterationFound.keySet());
    }

    public int iterationFound(final String candidateId) {
        return iterationFound.getOrDefault(candidateId, -1);
    }

    public @Nullable Classification classification(final String candidateId) {
        return classifications.get(candidateId);
    }

    public boolean isClassified(final String candidateId) {
        return classifications.containsKey(candidateId);
    }

    public int iteration() {
        return iteration;
    }

    public int profilesReviewed() {
        return reviewed.size();
    }

    public boolean isReviewed(final String candidateId) {
        return reviewed.contains(candidateId);
    }

    public int profilesFetched() {
        return accumulated.size();
    }

    public RankingPhase phase() {
        return phase;
    }

    public @Nullable TerminationReason terminationReason() {
        return terminationReason;
    }
}

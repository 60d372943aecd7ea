package de.mirkosertic.profileranker.progressive;

/**
 * What happened in one progressive iteration.
 *
 * @param judgeSucceeded  {@code false} when the judge call failed or timed out
 * @param topKExcellent   whether the leading candidates were all excellent after this iteration
 */
public record IterationDetail(
        int iteration,
        int fetched,
        int poolSize,
        int submitted,
        int classified,
        boolean judgeSucceeded,
        boolean topKExcellent,
        int excellent,
        int good,
        int illFit
) {
}

package de.mirkosertic.profileranker.scoring;

import java.util.Comparator;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Deterministic descending orderings over scores.
 *
 * <p>Scores are compared at a precision of four decimals, so values that differ only by floating
 * point noise count as ties and fall through to the next key. The last key is always the input
 * position, which makes every ordering total and stable.</p>
 */
public final class ScoreOrdering {

    private static final double PRECISION = 10_000.0;

    private ScoreOrdering() {
    }

    /**
     * The comparison key of a score at four decimals.
     */
    public static long key(final double score) {
        return Math.round(score * PRECISION);
    }

    /**
     * Descending by {@code primary}, then descending by {@code secondary}, then ascending by
     * {@code inputIndex}.
     */
    public static <T> Comparator<T> descending(final ToDoubleFunction<T> primary,
                                               final ToDoubleFunction<T> secondary,
                                               final ToIntFunction<T> inputIndex) {
        return Comparator
                .<T>comparingLong(t -> -key(primary.applyAsDouble(t)))
                .thenComparingLong(t -> -key(secondary.applyAsDouble(t)))
                .thenComparingInt(inputIndex);
    }

    public static <T> Comparator<T> descending(final ToDoubleFunction<T> primary,
                                               final ToIntFunction<T> inputIndex) {
        return Comparator
                .<T>comparingLong(t -> -key(primary.applyAsDouble(t)))
                .thenComparingInt(inputIndex);
    }
}

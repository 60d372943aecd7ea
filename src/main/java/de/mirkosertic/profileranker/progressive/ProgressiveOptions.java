package de.mirkosertic.profileranker.progressive;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Budgets and targets of a progressive ranking session.
 *
 * @param maxIterations       upper bound on fetch/evaluate rounds
 * @param maxProfilesReviewed upper bound on candidates submitted to the judge
 * @param batchSize           candidates fetched and judged per round
 * @param targetTopK          how many leading candidates must be excellent to stop early
 * @param shortlistSize       number of candidates returned
 * @param judgeTimeout        per-batch judge timeout, {@code null} waits indefinitely
 * @param groupByFit          order the shortlist excellent, good, ill-fit instead of by score
 */
public record ProgressiveOptions(
        int maxIterations,
        int maxProfilesReviewed,
        int batchSize,
        int targetTopK,
        int shortlistSize,
        @Nullable Duration judgeTimeout,
        boolean groupByFit
) {

    public static final int DEFAULT_MAX_ITERATIONS = 5;
    public static final int DEFAULT_MAX_PROFILES_REVIEWED = 30;
    public static final int DEFAULT_BATCH_SIZE = 12;
    public static final int DEFAULT_TARGET_TOP_K = 3;
    public static final int DEFAULT_SHORTLIST_SIZE = 12;
    public static final Duration DEFAULT_JUDGE_TIMEOUT = Duration.ofSeconds(60);

    public ProgressiveOptions {
        requirePositive("maxIterations", maxIterations);
        requirePositive("maxProfilesReviewed", maxProfilesReviewed);
        requirePositive("batchSize", batchSize);
        requirePositive("targetTopK", targetTopK);
        requirePositive("shortlistSize", shortlistSize);
        if (judgeTimeout != null && (judgeTimeout.isNegative() || judgeTimeout.isZero())) {
            throw new IllegalArgumentException("judgeTimeout must be positive, was " + judgeTimeout);
        }
    }

    private static void requirePositive(final String name, final int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, was " + value);
        }
    }

    public static ProgressiveOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private int maxProfilesReviewed = DEFAULT_MAX_PROFILES_REVIEWED;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int targetTopK = DEFAULT_TARGET_TOP_K;
        private int shortlistSize = DEFAULT_SHORTLIST_SIZE;
        private @Nullable Duration judgeTimeout = DEFAULT_JUDGE_TIMEOUT;
        private boolean groupByFit;

        public Builder maxIterations(final int maxIterations) { this.maxIterations = maxIterations; return this; }
        public Builder maxProfilesReviewed(final int maxProfilesReviewed) { this.maxProfilesReviewed = maxProfilesReviewed; return this; }
        public Builder batchSize(final int batchSize) { this.batchSize = batchSize; return this; }
        public Builder targetTopK(final int targetTopK) { this.targetTopK = targetTopK; return this; }
        public Builder shortlistSize(final int shortlistSize) { this.shortlistSize = shortlistSize; return this; }
        public Builder judgeTimeout(@Nullable final Duration judgeTimeout) { this.judgeTimeout = judgeTimeout; return this; }
        public Builder groupByFit(final boolean groupByFit) { this.groupByFit = groupByFit; return this; }

        public ProgressiveOptions build() {
            return new ProgressiveOptions(maxIterations, maxProfilesReviewed, batchSize, targetTopK, shortlistSize,
                    judgeTimeout, groupByFit);
        }
    }
}

package de.mirkosertic.profileranker.progressive;

/**
 * Why a progressive ranking session stopped.
 */
public enum TerminationReason {

    /** The top {@code targetTopK} candidates are all classified excellent. */
    TOP_K_EXCELLENT("top-k-excellent"),
    MAX_ITERATIONS("max-iterations"),
    MAX_PROFILES_REVIEWED("max-profiles-reviewed"),
    /** A fetch returned no unseen candidates. */
    POOL_EXHAUSTED("pool-exhausted"),
    CANCELLED("cancelled");

    private final String key;

    TerminationReason(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}

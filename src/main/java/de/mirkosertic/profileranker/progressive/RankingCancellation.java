package de.mirkosertic.profileranker.progressive;

/**
 * Cancellation flag for a progressive ranking session. It is checked at the top of every
 * iteration; a judge call already in flight runs until it completes or times out.
 */
public final class RankingCancellation {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}

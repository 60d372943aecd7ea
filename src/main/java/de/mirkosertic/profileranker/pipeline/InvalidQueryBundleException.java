package de.mirkosertic.profileranker.pipeline;

/**
 * A ranking request was malformed and was rejected before any scoring took place.
 */
public class InvalidQueryBundleException extends RuntimeException {

    public InvalidQueryBundleException(final String message) {
        super(message);
    }
}

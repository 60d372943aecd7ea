package de.mirkosertic.profileranker.progressive;

/**
 * Raised by a {@link FitJudge} or {@link JudgeTransport} when a batch could not be classified.
 */
public class JudgeException extends Exception {

    public JudgeException(final String message) {
        super(message);
    }

    public JudgeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

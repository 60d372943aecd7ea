package de.mirkosertic.profileranker.progressive;

/**
 * Sends a prompt to a completion service and returns the raw reply text.
 */
@FunctionalInterface
public interface JudgeTransport {

    String complete(String systemPrompt, String userPrompt) throws JudgeException;
}

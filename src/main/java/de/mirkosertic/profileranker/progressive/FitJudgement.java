package de.mirkosertic.profileranker.progressive;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * One classification returned by a {@link FitJudge}.
 */
public record FitJudgement(String candidateId, FitCategory fit, @Nullable String reason) {

    public FitJudgement {
        Objects.requireNonNull(candidateId, "candidateId");
        Objects.requireNonNull(fit, "fit");
    }

    public static FitJudgement of(final String candidateId, final FitCategory fit) {
        return new FitJudgement(candidateId, fit, null);
    }
}

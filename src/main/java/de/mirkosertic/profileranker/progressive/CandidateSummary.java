package de.mirkosertic.profileranker.progressive;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.profileranker.model.Candidate;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The short profile a {@link FitJudge} sees for one candidate.
 */
public record CandidateSummary(
        @JsonIgnore String candidateId,
        String name,
        String specialty,
        List<String> subspecialties,
        List<String> procedures,
        @JsonProperty("clinical_expertise") @Nullable String clinicalExpertise,
        @JsonProperty("description_snippet") @Nullable String descriptionSnippet
) {

    static final int MAX_PROCEDURES = 25;
    static final int MAX_EXPERTISE_LENGTH = 600;
    static final int MAX_DESCRIPTION_LENGTH = 400;

    private static final String UNKNOWN_NAME = "Unknown";

    public CandidateSummary {
        subspecialties = List.copyOf(subspecialties);
        procedures = List.copyOf(procedures);
    }

    public static CandidateSummary of(final Candidate candidate) {
        final List<String> procedures = candidate.procedureTags().stream()
                .filter(p -> !p.isBlank())
                .limit(MAX_PROCEDURES)
                .toList();
        final String description = candidate.description() != null && !candidate.description().isBlank()
                ? candidate.description()
                : candidate.biography();
        return new CandidateSummary(
                candidate.id(),
                candidate.name() == null || candidate.name().isBlank() ? UNKNOWN_NAME : candidate.name(),
                candidate.primaryCategory() == null ? "" : candidate.primaryCategory(),
                candidate.subCategories(),
                procedures,
                truncate(candidate.clinicalExpertise(), MAX_EXPERTISE_LENGTH),
                truncate(description, MAX_DESCRIPTION_LENGTH));
    }

    private static @Nullable String truncate(@Nullable final String value, final int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}

package de.mirkosertic.profileranker.model;

import org.jspecify.annotations.Nullable;

/**
 * Precomputed tag sets of a candidate, each flattened into one lower-case string.
 */
public record ChecklistProfile(
        String proceduresSet,
        String conditionsSet,
        String specialties
) {

    public ChecklistProfile(@Nullable final String proceduresSet,
                            @Nullable final String conditionsSet,
                            @Nullable final String specialties) {
        this.proceduresSet = proceduresSet == null ? "" : proceduresSet.toLowerCase();
        this.conditionsSet = conditionsSet == null ? "" : conditionsSet.toLowerCase();
        this.specialties = specialties == null ? "" : specialties.toLowerCase();
    }

    public boolean isEmpty() {
        return proceduresSet.isBlank() && conditionsSet.isBlank() && specialties.isBlank();
    }
}

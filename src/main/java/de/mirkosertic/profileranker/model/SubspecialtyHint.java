package de.mirkosertic.profileranker.model;

/**
 * A sub-category the query most likely refers to, with a confidence in {@code [0, 1]}.
 */
public record SubspecialtyHint(String name, double confidence) {

    public SubspecialtyHint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Subspecialty hint name must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Subspecialty confidence must be within [0, 1], was " + confidence);
        }
    }
}

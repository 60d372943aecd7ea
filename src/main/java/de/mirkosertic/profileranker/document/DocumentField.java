package de.mirkosertic.profileranker.document;

import java.util.Locale;

/**
 * The fields that make up the projected text of a candidate, in projection order, with their
 * default duplication weights.
 */
public enum DocumentField {

    EXPERTISE_PROCEDURES(2.0),
    EXPERTISE_CONDITIONS(2.0),
    EXPERTISE_INTERESTS(1.5),
    /** The clinical expertise blob, used verbatim only when it carries no recognized labels. */
    CLINICAL_EXPERTISE_RAW(2.0),
    PROCEDURE_TAGS(2.8),
    PRIMARY_CATEGORY(2.5),
    SUB_CATEGORIES(2.2),
    DESCRIPTION(1.5),
    BIOGRAPHY(1.0),
    NAME(1.0),
    MEMBERSHIPS(0.8),
    LOCALITY(0.5),
    TITLE(0.3);

    private final double defaultWeight;

    DocumentField(final double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    /**
     * Configuration key of this field, e.g. {@code procedure-tags}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static DocumentField fromKey(final String key) {
        final String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (final DocumentField field : values()) {
            if (field.name().equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown document field: " + key);
    }

    /**
     * Number of times a field's content is repeated for the given weight: {@code max(1, round(weight))}.
     */
    public static int repeatsFor(final double weight) {
        return (int) Math.max(1, Math.round(weight));
    }
}

package de.mirkosertic.profileranker.model;

/**
 * A single named attribute of an ideal profile, tagged with its importance.
 */
public record ProfileCriterion(String name, Importance importance) {

    public ProfileCriterion {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Profile criterion name must not be blank");
        }
        if (importance == null) {
            importance = Importance.OPTIONAL;
        }
    }

    public static ProfileCriterion required(final String name) {
        return new ProfileCriterion(name, Importance.REQUIRED);
    }

    public static ProfileCriterion preferred(final String name) {
        return new ProfileCriterion(name, Importance.PREFERRED);
    }

    public static ProfileCriterion optional(final String name) {
        return new ProfileCriterion(name, Importance.OPTIONAL);
    }
}

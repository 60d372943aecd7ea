package de.mirkosertic.profileranker.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A profile that is ranked against a query.
 *
 * <p>Candidates are owned by the caller and never modified by the engine. All list-valued
 * attributes are defensively copied into immutable lists; {@code null} lists become empty
 * lists and {@code null} strings stay {@code null} (meaning "attribute not present").</p>
 */
public record Candidate(
        String id,
        @Nullable String name,
        @Nullable String title,
        @Nullable String primaryCategory,
        List<String> subCategories,
        @Nullable String description,
        @Nullable String biography,
        @Nullable String clinicalExpertise,
        List<String> procedureTags,
        List<String> memberships,
        List<String> languages,
        List<String> ageGroups,
        List<String> qualifications,
        @Nullable String gender,
        @Nullable String locality,
        double ratingValue,
        int reviewCount,
        int yearsExperience,
        boolean verified,
        @Nullable ChecklistProfile checklistProfile
) {

    public Candidate {
        Objects.requireNonNull(id, "Candidate id must not be null");
        subCategories = copyOf(subCategories);
        procedureTags = copyOf(procedureTags);
        memberships = copyOf(memberships);
        languages = copyOf(languages);
        ageGroups = copyOf(ageGroups);
        qualifications = copyOf(qualifications);
    }

    private static List<String> copyOf(@Nullable final List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    public static Builder builder(final String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String title;
        private String primaryCategory;
        private List<String> subCategories = List.of();
        private String description;
        private String biography;
        private String clinicalExpertise;
        private List<String> procedureTags = List.of();
        private List<String> memberships = List.of();
        private List<String> languages = List.of();
        private List<String> ageGroups = List.of();
        private List<String> qualifications = List.of();
        private String gender;
        private String locality;
        private double ratingValue;
        private int reviewCount;
        private int yearsExperience;
        private boolean verified;
        private ChecklistProfile checklistProfile;

        private Builder(final String id) {
            this.id = id;
        }

        public Builder name(final String name) { this.name = name; return this; }
        public Builder title(final String title) { this.title = title; return this; }
        public Builder primaryCategory(final String primaryCategory) { this.primaryCategory = primaryCategory; return this; }
        public Builder subCategories(final List<String> subCategories) { this.subCategories = subCategories; return this; }
        public Builder subCategories(final String... subCategories) { this.subCategories = List.of(subCategories); return this; }
        public Builder description(final String description) { this.description = description; return this; }
        public Builder biography(final String biography) { this.biography = biography; return this; }
        public Builder clinicalExpertise(final String clinicalExpertise) { this.clinicalExpertise = clinicalExpertise; return this; }
        public Builder procedureTags(final List<String> procedureTags) { this.procedureTags = procedureTags; return this; }
        public Builder procedureTags(final String... procedureTags) { this.procedureTags = List.of(procedureTags); return this; }
        public Builder memberships(final List<String> memberships) { this.memberships = memberships; return this; }
        public Builder languages(final List<String> languages) { this.languages = languages; return this; }
        public Builder languages(final String... languages) { this.languages = List.of(languages); return this; }
        public Builder ageGroups(final List<String> ageGroups) { this.ageGroups = ageGroups; return this; }
        public Builder ageGroups(final String... ageGroups) { this.ageGroups = List.of(ageGroups); return this; }
        public Builder qualifications(final List<String> qualifications) { this.qualifications = qualifications; return this; }
        public Builder gender(final String gender) { this.gender = gender; return this; }
        public Builder locality(final String locality) { this.locality = locality; return this; }
        public Builder ratingValue(final double ratingValue) { this.ratingValue = ratingValue; return this; }
        public Builder reviewCount(final int reviewCount) { this.reviewCount = reviewCount; return this; }
        public Builder yearsExperience(final int yearsExperience) { this.yearsExperience = yearsExperience; return this; }
        public Builder verified(final boolean verified) { this.verified = verified; return this; }
        public Builder checklistProfile(final ChecklistProfile checklistProfile) { this.checklistProfile = checklistProfile; return this; }

        public Candidate build() {
            return new Candidate(id, name, title, primaryCategory, subCategories, description, biography,
                    clinicalExpertise, procedureTags, memberships, languages, ageGroups, qualifications,
                    gender, locality, ratingValue, reviewCount, yearsExperience, verified, checklistProfile);
        }
    }
}

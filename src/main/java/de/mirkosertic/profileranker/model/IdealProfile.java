package de.mirkosertic.profileranker.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Structured description of the profile a query is looking for. Used for profile-to-profile
 * matching instead of term counting.
 */
public record IdealProfile(
        List<ProfileCriterion> subCategories,
        List<ProfileCriterion> procedures,
        List<ProfileCriterion> conditions,
        List<String> expertiseAreas,
        List<String> descriptionKeywords,
        List<String> avoidSubCategories,
        List<String> avoidProcedures,
        List<String> preferredQualifications,
        List<String> ageGroups,
        List<String> languages,
        @Nullable String genderPreference
) {

    public IdealProfile {
        subCategories = copyOf(subCategories);
        procedures = copyOf(procedures);
        conditions = copyOf(conditions);
        expertiseAreas = copyOf(expertiseAreas);
        descriptionKeywords = copyOf(descriptionKeywords);
        avoidSubCategories = copyOf(avoidSubCategories);
        avoidProcedures = copyOf(avoidProcedures);
        preferredQualifications = copyOf(preferredQualifications);
        ageGroups = copyOf(ageGroups);
        languages = copyOf(languages);
    }

    private static <T> List<T> copyOf(@Nullable final List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<ProfileCriterion> subCategories = List.of();
        private List<ProfileCriterion> procedures = List.of();
        private List<ProfileCriterion> conditions = List.of();
        private List<String> expertiseAreas = List.of();
        private List<String> descriptionKeywords = List.of();
        private List<String> avoidSubCategories = List.of();
        private List<String> avoidProcedures = List.of();
        private List<String> preferredQualifications = List.of();
        private List<String> ageGroups = List.of();
        private List<String> languages = List.of();
        private String genderPreference;

        public Builder subCategories(final ProfileCriterion... subCategories) { this.subCategories = List.of(subCategories); return this; }
        public Builder procedures(final ProfileCriterion... procedures) { this.procedures = List.of(procedures); return this; }
        public Builder conditions(final ProfileCriterion... conditions) { this.conditions = List.of(conditions); return this; }
        public Builder expertiseAreas(final String... expertiseAreas) { this.expertiseAreas = List.of(expertiseAreas); return this; }
        public Builder descriptionKeywords(final String... descriptionKeywords) { this.descriptionKeywords = List.of(descriptionKeywords); return this; }
        public Builder avoidSubCategories(final String... avoidSubCategories) { this.avoidSubCategories = List.of(avoidSubCategories); return this; }
        public Builder avoidProcedures(final String... avoidProcedures) { this.avoidProcedures = List.of(avoidProcedures); return this; }
        public Builder preferredQualifications(final String... preferredQualifications) { this.preferredQualifications = List.of(preferredQualifications); return this; }
        public Builder ageGroups(final String... ageGroups) { this.ageGroups = List.of(ageGroups); return this; }
        public Builder languages(final String... languages) { this.languages = List.of(languages); return this; }
        public Builder genderPreference(final String genderPreference) { this.genderPreference = genderPreference; return this; }

        public IdealProfile build() {
            return new IdealProfile(subCategories, procedures, conditions, expertiseAreas, descriptionKeywords,
                    avoidSubCategories, avoidProcedures, preferredQualifications, ageGroups, languages,
                    genderPreference);
        }
    }
}

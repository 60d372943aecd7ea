package de.mirkosertic.profileranker.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hard inclusion predicates applied before scoring. A {@code null} or blank value places no
 * constraint on its dimension.
 *
 * @param specialty a category the candidate must practise, matched against specialty, sub-categories,
 *                  clinical expertise and title
 */
public record FilterCriteria(
        @Nullable String ageGroup,
        List<String> languages,
        @Nullable String gender,
        @Nullable String specialty
) {

    public static final FilterCriteria NONE = new FilterCriteria(null, List.of(), null, null);

    public FilterCriteria {
        languages = languages == null
                ? List.of()
                : languages.stream().filter(Objects::nonNull).filter(l -> !l.isBlank()).toList();
    }

    public FilterCriteria(@Nullable final String ageGroup, final List<String> languages,
                          @Nullable final String gender) {
        this(ageGroup, languages, gender, null);
    }

    public boolean isEmpty() {
        return isBlank(ageGroup) && languages.isEmpty() && isBlank(gender) && isBlank(specialty);
    }

    private static boolean isBlank(@Nullable final String value) {
        return value == null || value.isBlank();
    }

    /**
     * Parses the filter shape {@code {age_group, languages, gender, specialty}} as delivered by callers that
     * speak JSON. Malformed shapes are rejected so the ranking call fails before any scoring.
     */
    public static FilterCriteria fromMap(@Nullable final Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return NONE;
        }
        final Object ageGroup = map.get("age_group");
        final Object gender = map.get("gender");
        final Object languages = map.get("languages");
        final Object specialty = map.get("specialty");

        if (ageGroup != null && !(ageGroup instanceof String)) {
            throw new IllegalArgumentException("Filter 'age_group' must be a string");
        }
        if (gender != null && !(gender instanceof String)) {
            throw new IllegalArgumentException("Filter 'gender' must be a string");
        }
        if (specialty != null && !(specialty instanceof String)) {
            throw new IllegalArgumentException("Filter 'specialty' must be a string");
        }

        final List<String> languageList;
        if (languages == null) {
            languageList = List.of();
        } else if (languages instanceof String single) {
            languageList = List.of(single);
        } else if (languages instanceof List<?> rawList) {
            languageList = rawList.stream()
                    .map(Object::toString)
                    .toList();
        } else {
            throw new IllegalArgumentException("Filter 'languages' must be a string or a list of strings");
        }
        return new FilterCriteria((String) ageGroup, languageList, (String) gender, (String) specialty);
    }
}

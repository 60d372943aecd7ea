package de.mirkosertic.profileranker.filter;

import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.FilterCriteria;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hard inclusion filters applied before scoring.
 *
 * <ul>
 *   <li><b>Age group</b>: a candidate age group matches when it equals the wanted group or one
 *       contains the other, case-insensitively. Paediatric care has its own synonym group: a wanted
 *       value mentioning "paediatric", "pediatric" or "child" accepts any candidate group mentioning
 *       one of them.</li>
 *   <li><b>Languages</b>: at least one wanted language equals, or is contained in, or contains a
 *       candidate language.</li>
 *   <li><b>Gender</b>: exact, case-insensitive.</li>
 *   <li><b>Specialty</b>: names are compared lower-cased with punctuation removed. The candidate's
 *       specialty matches when one name contains the other, so "Physiotherapy" and
 *       "Physiotherapist" accept each other. Failing that, a sub-category, the clinical expertise
 *       or the title matches when it contains the wanted name or one of its words longer than two
 *       characters.</li>
 * </ul>
 *
 * <p>Restricting the pool to one category before lexical scoring also makes the category's own
 * name appear in most documents, which drives its inverse document frequency to zero.</p>
 *
 * <p>Absent or blank predicates do not constrain their dimension. The input list is never modified;
 * an empty result is valid.</p>
 */
public class FilterStage {

    private static final Logger logger = LoggerFactory.getLogger(FilterStage.class);

    private static final List<String> PAEDIATRIC_SYNONYMS = List.of("paediatric", "pediatric", "child");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_SPECIALTY_WORD_LENGTH = 3;

    public List<Candidate> apply(final List<Candidate> candidates, @Nullable final FilterCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return List.copyOf(candidates);
        }
        final List<Candidate> filtered = candidates.stream()
                .filter(candidate -> matches(candidate, criteria))
                .toList();
        logger.debug("Filter {} kept {} of {} candidates", criteria, filtered.size(), candidates.size());
        return filtered;
    }

    public boolean matches(final Candidate candidate, final FilterCriteria criteria) {
        return matchesAgeGroup(candidate, criteria.ageGroup())
                && matchesLanguages(candidate, criteria.languages())
                && matchesGender(candidate, criteria.gender())
                && matchesSpecialty(candidate, criteria.specialty());
    }

    static boolean matchesAgeGroup(final Candidate candidate, @Nullable final String wanted) {
        if (wanted == null || wanted.isBlank()) {
            return true;
        }
        final String wantedLower = wanted.trim().toLowerCase(Locale.ROOT);
        final boolean paediatric = mentionsAny(wantedLower, PAEDIATRIC_SYNONYMS);
        for (final String group : candidate.ageGroups()) {
            final String groupLower = group.trim().toLowerCase(Locale.ROOT);
            if (groupLower.isEmpty()) {
                continue;
            }
            if (containsEitherWay(groupLower, wantedLower)) {
                return true;
            }
            if (paediatric && mentionsAny(groupLower, PAEDIATRIC_SYNONYMS)) {
                return true;
            }
        }
        return false;
    }

    static boolean matchesLanguages(final Candidate candidate, final List<String> wanted) {
        if (wanted.isEmpty()) {
            return true;
        }
        for (final String language : wanted) {
            final String wantedLower = language.trim().toLowerCase(Locale.ROOT);
            for (final String spoken : candidate.languages()) {
                final String spokenLower = spoken.trim().toLowerCase(Locale.ROOT);
                if (!spokenLower.isEmpty() && containsEitherWay(spokenLower, wantedLower)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean matchesGender(final Candidate candidate, @Nullable final String wanted) {
        if (wanted == null || wanted.isBlank()) {
            return true;
        }
        return candidate.gender() != null && candidate.gender().trim().equalsIgnoreCase(wanted.trim());
    }

    static boolean matchesSpecialty(final Candidate candidate, @Nullable final String wanted) {
        if (wanted == null || wanted.isBlank()) {
            return true;
        }
        final String wantedName = normalizeSpecialty(wanted);
        if (wantedName.isEmpty()) {
            return true;
        }
        final List<String> words = WHITESPACE.splitAsStream(wantedName)
                .filter(word -> word.length() >= MIN_SPECIALTY_WORD_LENGTH)
                .toList();

        final String specialty = normalizeSpecialty(candidate.primaryCategory());
        if (!specialty.isEmpty() && containsEitherWay(specialty, wantedName)) {
            return true;
        }
        for (final String subCategory : candidate.subCategories()) {
            if (containsNameOrWord(normalizeSpecialty(subCategory), wantedName, words)) {
                return true;
            }
        }
        return containsNameOrWord(lower(candidate.clinicalExpertise()), wantedName, words)
                || containsNameOrWord(lower(candidate.title()), wantedName, words);
    }

    static String normalizeSpecialty(@Nullable final String name) {
        if (name == null) {
            return "";
        }
        return PUNCTUATION.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("").trim();
    }

    private static boolean containsNameOrWord(final String text, final String name, final List<String> words) {
        if (text.isEmpty()) {
            return false;
        }
        if (text.contains(name)) {
            return true;
        }
        for (final String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(@Nullable final String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static boolean containsEitherWay(final String a, final String b) {
        return a.equals(b) || a.contains(b) || b.contains(a);
    }

    private static boolean mentionsAny(final String value, final List<String> words) {
        for (final String word : words) {
            if (value.contains(word)) {
                return true;
            }
        }
        return false;
    }
}

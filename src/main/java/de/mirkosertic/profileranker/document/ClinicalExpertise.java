package de.mirkosertic.profileranker.document;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The structured parts of a semicolon-delimited clinical expertise field.
 *
 * <p>Segments use a {@code Label: value} grammar, for example
 * {@code "Procedure: SVT ablation; Condition: Atrial fibrillation; Clinical Interests: Syncope"}.
 * Recognized labels are {@code Procedure:}, {@code Condition:} and {@code Clinical Interests:},
 * matched case-insensitively. Segments without a recognized label are kept as interests once at
 * least one labelled segment was found. When no segment carries a recognized label the field is
 * {@link #isStructured() unstructured} and must be used verbatim.</p>
 */
public record ClinicalExpertise(
        List<String> procedures,
        List<String> conditions,
        List<String> interests,
        String raw
) {

    public static final ClinicalExpertise EMPTY = new ClinicalExpertise(List.of(), List.of(), List.of(), "");

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\s*;\\s*");

    private static final String PROCEDURE_LABEL = "procedure:";
    private static final String CONDITION_LABEL = "condition:";
    private static final String INTERESTS_LABEL = "clinical interests:";

    public ClinicalExpertise {
        procedures = List.copyOf(procedures);
        conditions = List.copyOf(conditions);
        interests = List.copyOf(interests);
    }

    public static ClinicalExpertise parse(@Nullable final String field) {
        if (field == null || field.isBlank()) {
            return EMPTY;
        }

        final List<String> procedures = new ArrayList<>();
        final List<String> conditions = new ArrayList<>();
        final List<String> interests = new ArrayList<>();
        final List<String> unlabelled = new ArrayList<>();

        for (final String segment : SEGMENT_SEPARATOR.split(field.trim())) {
            if (segment.isBlank()) {
                continue;
            }
            final String lower = segment.toLowerCase(Locale.ROOT);
            if (lower.startsWith(PROCEDURE_LABEL)) {
                addValue(procedures, segment.substring(PROCEDURE_LABEL.length()));
            } else if (lower.startsWith(CONDITION_LABEL)) {
                addValue(conditions, segment.substring(CONDITION_LABEL.length()));
            } else if (lower.startsWith(INTERESTS_LABEL)) {
                addValue(interests, segment.substring(INTERESTS_LABEL.length()));
            } else {
                unlabelled.add(segment.trim());
            }
        }

        if (procedures.isEmpty() && conditions.isEmpty() && interests.isEmpty()) {
            return new ClinicalExpertise(List.of(), List.of(), List.of(), field.trim());
        }
        interests.addAll(unlabelled);
        return new ClinicalExpertise(procedures, conditions, interests, field.trim());
    }

    private static void addValue(final List<String> target, final String value) {
        final String trimmed = value.trim();
        if (!trimmed.isEmpty()) {
            target.add(trimmed);
        }
    }

    public boolean isStructured() {
        return !procedures.isEmpty() || !conditions.isEmpty() || !interests.isEmpty();
    }
}

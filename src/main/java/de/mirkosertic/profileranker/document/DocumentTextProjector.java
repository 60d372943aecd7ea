package de.mirkosertic.profileranker.document;

import de.mirkosertic.profileranker.model.Candidate;
import org.jspecify.annotations.Nullable;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the searchable text of a candidate.
 *
 * <p>Every non-empty field is appended {@code max(1, round(weight))} times. Repeating a field is how
 * the lexical scorer is biased towards it without a field-aware similarity: a term in a field with
 * weight 2.8 contributes three occurrences to the term frequency, a term in the title only one.</p>
 *
 * <p>The clinical expertise field is split into procedures, conditions and interests, each with
 * its own weight. If it carries no recognized label it is appended verbatim under
 * {@link DocumentField#CLINICAL_EXPERTISE_RAW}, so unstructured free text stays searchable.</p>
 *
 * <p>Instances are stateless and may be shared.</p>
 */
public class DocumentTextProjector {

    private static final Map<DocumentField, Double> DEFAULT_WEIGHTS = defaultWeights();

    private static Map<DocumentField, Double> defaultWeights() {
        final Map<DocumentField, Double> weights = new EnumMap<>(DocumentField.class);
        for (final DocumentField field : DocumentField.values()) {
            weights.put(field, field.defaultWeight());
        }
        return weights;
    }

    public String project(final Candidate candidate) {
        return project(candidate, DEFAULT_WEIGHTS);
    }

    /**
     * Projects a candidate using the given weights. Fields missing from {@code weights} use their
     * default weight.
     */
    public String project(final Candidate candidate, @Nullable final Map<DocumentField, Double> weights) {
        final Map<DocumentField, Double> effective = weights == null ? DEFAULT_WEIGHTS : weights;
        final ClinicalExpertise expertise = ClinicalExpertise.parse(candidate.clinicalExpertise());

        final StringBuilder text = new StringBuilder();
        for (final DocumentField field : DocumentField.values()) {
            final String content = contentOf(field, candidate, expertise);
            if (content.isBlank()) {
                continue;
            }
            final int repeats = DocumentField.repeatsFor(effective.getOrDefault(field, field.defaultWeight()));
            for (int i = 0; i < repeats; i++) {
                if (!text.isEmpty()) {
                    text.append(' ');
                }
                text.append(content);
            }
        }
        return text.toString();
    }

    static String contentOf(final DocumentField field, final Candidate candidate, final ClinicalExpertise expertise) {
        return switch (field) {
            case EXPERTISE_PROCEDURES -> join(expertise.procedures());
            case EXPERTISE_CONDITIONS -> join(expertise.conditions());
            case EXPERTISE_INTERESTS -> join(expertise.interests());
            case CLINICAL_EXPERTISE_RAW -> expertise.isStructured() ? "" : expertise.raw();
            case PROCEDURE_TAGS -> join(candidate.procedureTags());
            case PRIMARY_CATEGORY -> nullToEmpty(candidate.primaryCategory());
            case SUB_CATEGORIES -> join(candidate.subCategories());
            case DESCRIPTION -> nullToEmpty(candidate.description());
            case BIOGRAPHY -> nullToEmpty(candidate.biography());
            case NAME -> nullToEmpty(candidate.name());
            case MEMBERSHIPS -> join(candidate.memberships());
            case LOCALITY -> nullToEmpty(candidate.locality());
            case TITLE -> nullToEmpty(candidate.title());
        };
    }

    private static String join(final List<String> values) {
        return String.join(" ", values).trim();
    }

    private static String nullToEmpty(@Nullable final String value) {
        return value == null ? "" : value.trim();
    }
}

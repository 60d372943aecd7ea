package de.mirkosertic.profileranker.filter;

import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.FilterCriteria;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilterStage")
class FilterStageTest {

    private final FilterStage filterStage = new FilterStage();

    private static final Candidate ADULT_ENGLISH_FEMALE = Candidate.builder("a")
            .ageGroups("Adults (18+)")
            .languages("English", "Spanish")
            .gender("Female")
            .build();

    private static final Candidate CHILDREN_FRENCH_MALE = Candidate.builder("b")
            .ageGroups("Children")
            .languages("French")
            .gender("male")
            .build();

    private static final Candidate NO_ATTRIBUTES = Candidate.builder("c").build();

    // ========== Age group ==========

    @Test
    void testAgeGroupContainment() {
        assertThat(FilterStage.matchesAgeGroup(ADULT_ENGLISH_FEMALE, "adults")).isTrue();
        assertThat(FilterStage.matchesAgeGroup(ADULT_ENGLISH_FEMALE, "Children")).isFalse();
    }

    @Test
    @DisplayName("Paediatric spellings and 'child' are interchangeable")
    void testPaediatricSynonyms() {
        assertThat(FilterStage.matchesAgeGroup(CHILDREN_FRENCH_MALE, "paediatric")).isTrue();
        assertThat(FilterStage.matchesAgeGroup(CHILDREN_FRENCH_MALE, "Pediatrics")).isTrue();
        assertThat(FilterStage.matchesAgeGroup(ADULT_ENGLISH_FEMALE, "paediatric")).isFalse();
    }

    @Test
    void testBlankAgeGroupDoesNotConstrain() {
        assertThat(FilterStage.matchesAgeGroup(NO_ATTRIBUTES, null)).isTrue();
        assertThat(FilterStage.matchesAgeGroup(NO_ATTRIBUTES, " ")).isTrue();
        assertThat(FilterStage.matchesAgeGroup(NO_ATTRIBUTES, "adults")).isFalse();
    }

    // ========== Languages and gender ==========

    @Test
    void testAnyWantedLanguageMatches() {
        assertThat(FilterStage.matchesLanguages(ADULT_ENGLISH_FEMALE, List.of("French", "spanish"))).isTrue();
        assertThat(FilterStage.matchesLanguages(ADULT_ENGLISH_FEMALE, List.of("German"))).isFalse();
        assertThat(FilterStage.matchesLanguages(NO_ATTRIBUTES, List.of("English"))).isFalse();
        assertThat(FilterStage.matchesLanguages(NO_ATTRIBUTES, List.of())).isTrue();
    }

    @Test
    void testGenderIsExactAndCaseInsensitive() {
        assertThat(FilterStage.matchesGender(ADULT_ENGLISH_FEMALE, "female")).isTrue();
        assertThat(FilterStage.matchesGender(CHILDREN_FRENCH_MALE, "Female")).isFalse();
        assertThat(FilterStage.matchesGender(NO_ATTRIBUTES, "female")).isFalse();
    }

    // ========== Specialty ==========

    @Test
    @DisplayName("Specialty names match in either direction after punctuation is removed")
    void testSpecialtyMatchesBidirectionally() {
        final Candidate physiotherapist = Candidate.builder("p").primaryCategory("Physiotherapy").build();
        final Candidate cardiologist = Candidate.builder("k").primaryCategory("Cardiology (Adult)").build();

        assertThat(FilterStage.matchesSpecialty(physiotherapist, "Physiotherapy")).isTrue();
        assertThat(FilterStage.matchesSpecialty(physiotherapist, "physio")).isTrue();
        assertThat(FilterStage.matchesSpecialty(physiotherapist, "Physiotherapy, sports")).isTrue();
        assertThat(FilterStage.matchesSpecialty(cardiologist, "cardiology adult")).isTrue();
        assertThat(FilterStage.matchesSpecialty(cardiologist, "Dermatology")).isFalse();
        assertThat(FilterStage.matchesSpecialty(NO_ATTRIBUTES, "Dermatology")).isFalse();
    }

    @Test
    void testSpecialtyFallsBackToSubCategoriesExpertiseAndTitle() {
        final Candidate bySubCategory = Candidate.builder("s")
                .primaryCategory("Internal Medicine")
                .subCategories("Cardiac Electrophysiology")
                .build();
        final Candidate byExpertise = Candidate.builder("e")
                .primaryCategory("Surgery")
                .clinicalExpertise("Procedure: Cardiac ablation")
                .build();
        final Candidate byTitle = Candidate.builder("t")
                .title("Consultant Cardiac Surgeon")
                .build();

        assertThat(FilterStage.matchesSpecialty(bySubCategory, "Cardiac Surgery")).isTrue();
        assertThat(FilterStage.matchesSpecialty(byExpertise, "cardiac")).isTrue();
        assertThat(FilterStage.matchesSpecialty(byTitle, "Cardiac")).isTrue();
        // "ph" occurs in "electrophysiology" but words of two characters never match on their own
        assertThat(FilterStage.matchesSpecialty(bySubCategory, "PH Neurology")).isFalse();
    }

    @Test
    void testBlankSpecialtyDoesNotConstrain() {
        assertThat(FilterStage.matchesSpecialty(NO_ATTRIBUTES, null)).isTrue();
        assertThat(FilterStage.matchesSpecialty(NO_ATTRIBUTES, "  ")).isTrue();
        assertThat(FilterStage.normalizeSpecialty(" Ear, Nose & Throat ")).isEqualTo("ear nose  throat");
    }

    @Test
    void testApplyBySpecialty() {
        final Candidate cardiologist = Candidate.builder("k").primaryCategory("Cardiology").build();
        final List<Candidate> pool = List.of(ADULT_ENGLISH_FEMALE, cardiologist, NO_ATTRIBUTES);

        final List<Candidate> filtered = filterStage.apply(pool,
                new FilterCriteria(null, List.of(), null, "cardiology"));

        assertThat(filtered).containsExactly(cardiologist);
    }

    // ========== apply ==========

    @Test
    void testApplyCombinesPredicates() {
        final List<Candidate> pool = List.of(ADULT_ENGLISH_FEMALE, CHILDREN_FRENCH_MALE, NO_ATTRIBUTES);

        final List<Candidate> filtered = filterStage.apply(pool,
                new FilterCriteria("adult", List.of("english"), "female"));

        assertThat(filtered).containsExactly(ADULT_ENGLISH_FEMALE);
    }

    @Test
    void testEmptyCriteriaKeepsEverythingAndNeverModifiesInput() {
        final List<Candidate> pool = new ArrayList<>(List.of(ADULT_ENGLISH_FEMALE, CHILDREN_FRENCH_MALE));

        final List<Candidate> unfiltered = filterStage.apply(pool, FilterCriteria.NONE);
        final List<Candidate> none = filterStage.apply(pool, new FilterCriteria(null, List.of(), "other"));

        assertThat(unfiltered).containsExactly(ADULT_ENGLISH_FEMALE, CHILDREN_FRENCH_MALE);
        assertThat(none).isEmpty();
        assertThat(pool).hasSize(2);
    }
}

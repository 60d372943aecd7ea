package de.mirkosertic.profileranker.rescoring;

import de.mirkosertic.profileranker.model.Candidate;
import de.mirkosertic.profileranker.model.SubspecialtyHint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TermBoostRescorerTest {

    @Test
    void testCountMatchesRequiresWordStart() {
        final String text = "catheter ablation and stenting specialist";

        assertThat(TermBoostRescorer.countMatches(text, List.of("ablation", "stent", "pci"))).isEqualTo(2);
        assertThat(TermBoostRescorer.countMatches(text, List.of("lation", "cialist"))).isZero();
    }

    @Test
    void testSubspecialtyMatching() {
        assertThat(TermBoostRescorer.subspecialtyMatches("Heart Failure", "Advanced heart failure")).isTrue();
        assertThat(TermBoostRescorer.subspecialtyMatches("Interventional Cardiology", "Cardiology imaging")).isTrue();
        assertThat(TermBoostRescorer.subspecialtyMatches("Heart Failure", "Electrophysiology")).isFalse();
        assertThat(TermBoostRescorer.subspecialtyMatches(" ", "Heart Rhythm")).isFalse();
    }

    @Test
    void testEachHintCountsOnce() {
        final Candidate candidate = Candidate.builder("c")
                .subCategories("Electrophysiology", "Cardiac Electrophysiology", "Heart Failure")
                .build();

        final TermBoostRescorer.SubspecialtyMatch match = TermBoostRescorer.matchSubspecialties(candidate, List.of(
                new SubspecialtyHint("electrophysiology", 0.5),
                new SubspecialtyHint("heart failure", 0.25),
                new SubspecialtyHint("imaging", 1.0)));

        assertThat(match.matches()).isEqualTo(2);
        assertThat(match.confidenceSum()).isCloseTo(0.75, within(1e-9));
    }
}

package de.mirkosertic.profileranker.progressive;

import de.mirkosertic.profileranker.model.Candidate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSummaryTest {

    @Test
    void testTruncation() {
        final List<String> procedures = new ArrayList<>();
        procedures.add(" ");
        for (int i = 0; i < 30; i++) {
            procedures.add("procedure " + i);
        }
        final Candidate candidate = Candidate.builder("c")
                .name("Dr Jane Doe")
                .procedureTags(procedures)
                .clinicalExpertise("x".repeat(700))
                .description("y".repeat(500))
                .build();

        final CandidateSummary summary = CandidateSummary.of(candidate);

        assertThat(summary.procedures()).hasSize(CandidateSummary.MAX_PROCEDURES).first().isEqualTo("procedure 0");
        assertThat(summary.clinicalExpertise()).hasSize(CandidateSummary.MAX_EXPERTISE_LENGTH);
        assertThat(summary.descriptionSnippet()).hasSize(CandidateSummary.MAX_DESCRIPTION_LENGTH);
    }

    @Test
    void testFallbacks() {
        final CandidateSummary summary = CandidateSummary.of(Candidate.builder("c")
                .description(" ")
                .biography("Trained in London")
                .build());

        assertThat(summary.candidateId()).isEqualTo("c");
        assertThat(summary.name()).isEqualTo("Unknown");
        assertThat(summary.specialty()).isEmpty();
        assertThat(summary.descriptionSnippet()).isEqualTo("Trained in London");
        assertThat(summary.clinicalExpertise()).isNull();
    }
}

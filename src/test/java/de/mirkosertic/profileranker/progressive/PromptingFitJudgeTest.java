package de.mirkosertic.profileranker.progressive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.profileranker.model.Candidate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PromptingFitJudge}.
 */
@ExtendWith(MockitoExtension.class)
class PromptingFitJudgeTest {

    @Mock
    private JudgeTransport transport;

    private static final List<CandidateSummary> CANDIDATES = List.of(CandidateSummary.of(
            Candidate.builder("id-1")
                    .name("Dr Jane Doe")
                    .primaryCategory("Cardiology")
                    .subCategories("Electrophysiology")
                    .procedureTags("Catheter ablation")
                    .description("Heart rhythm specialist")
                    .build()));

    @Test
    void testClassifyRoundTrip() throws Exception {
        when(transport.complete(anyString(), anyString())).thenReturn(
                "{\"per_doctor\": [{\"practitioner_name\": \"Dr Jane Doe\", \"fit_category\": \"excellent\"}]}");
        final PromptingFitJudge judge = new PromptingFitJudge(transport);

        final List<FitJudgement> judgements = judge.classify("racing heart", CANDIDATES);

        assertThat(judgements).containsExactly(FitJudgement.of("id-1", FitCategory.EXCELLENT));
        final ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(transport).complete(eq(PromptingFitJudge.SYSTEM_PROMPT), userPrompt.capture());
        assertThat(userPrompt.getValue()).contains("racing heart", "Dr Jane Doe");
    }

    @Test
    void testUserPromptShape() throws Exception {
        final PromptingFitJudge judge = new PromptingFitJudge(transport);

        final JsonNode prompt = new ObjectMapper().readTree(judge.userPrompt("racing heart", CANDIDATES));

        assertThat(prompt.get("patient_query").asText()).isEqualTo("racing heart");
        final JsonNode practitioner = prompt.get("practitioners").get(0);
        assertThat(practitioner.get("name").asText()).isEqualTo("Dr Jane Doe");
        assertThat(practitioner.get("specialty").asText()).isEqualTo("Cardiology");
        assertThat(practitioner.get("procedures").get(0).asText()).isEqualTo("Catheter ablation");
        assertThat(practitioner.get("description_snippet").asText()).isEqualTo("Heart rhythm specialist");
        assertThat(practitioner.has("candidateId")).isFalse();
        assertThat(practitioner.has("clinical_expertise")).isFalse();
    }

    @Test
    void testEmptyBatchSkipsTransport() throws Exception {
        assertThat(new PromptingFitJudge(transport).classify("racing heart", List.of())).isEmpty();
        verifyNoInteractions(transport);
    }

    @Test
    void testTransportFailurePropagates() throws Exception {
        when(transport.complete(anyString(), anyString())).thenThrow(new JudgeException("HTTP 503"));

        assertThatThrownBy(() -> new PromptingFitJudge(transport).classify("racing heart", CANDIDATES))
                .isInstanceOf(JudgeException.class)
                .hasMessage("HTTP 503");
    }
}

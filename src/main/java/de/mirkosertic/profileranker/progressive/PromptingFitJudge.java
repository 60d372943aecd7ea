package de.mirkosertic.profileranker.progressive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link FitJudge} that asks a completion service through a {@link JudgeTransport}. The candidates
 * are rendered as JSON next to the patient query; the reply is read by {@link JudgeResponseParser}.
 */
public class PromptingFitJudge implements FitJudge {

    static final String SYSTEM_PROMPT = """
            You are a medical search quality evaluator. You will receive a patient query and a list of \
            recommended practitioners, each with a short profile: name, specialty, subspecialties, procedures, \
            clinical expertise and a description snippet.

            Categorize every practitioner into one fit level for this patient query. Base your judgment only \
            on the profile fields provided; do not invent facts.

            Return ONLY a JSON object with this structure:
            {
              "overall_reason": "One sentence on how well the results match the query overall.",
              "per_doctor": [
                {
                  "practitioner_name": "exact name as given",
                  "fit_category": "excellent" | "good" | "ill-fit",
                  "brief_reason": "One sentence explaining the category."
                }
              ]
            }

            - "excellent": right specialty and subspecialty, relevant procedures or expertise, clearly addresses the query.
            - "good": reasonable match with limitations, such as the right specialty but not the ideal subspecialty focus.
            - "ill-fit": wrong specialty or subspecialty focus, or not relevant to the query.

            Include exactly one entry per practitioner, in the order given, using the exact names.""";

    private final JudgeTransport transport;
    private final JudgeResponseParser parser;
    private final ObjectMapper objectMapper;

    public PromptingFitJudge(final JudgeTransport transport) {
        this(transport, new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL));
    }

    public PromptingFitJudge(final JudgeTransport transport, final ObjectMapper objectMapper) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.parser = new JudgeResponseParser(objectMapper);
    }

    @Override
    public List<FitJudgement> classify(final String query, final List<CandidateSummary> candidates)
            throws JudgeException {
        if (candidates.isEmpty()) {
            return List.of();
        }
        final String reply = transport.complete(SYSTEM_PROMPT, userPrompt(query, candidates));
        return parser.parse(reply, candidates);
    }

    String userPrompt(final String query, final List<CandidateSummary> candidates) throws JudgeException {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("patient_query", query);
        payload.put("practitioners", candidates);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (final JsonProcessingException e) {
            throw new JudgeException("Could not render judge prompt", e);
        }
    }
}

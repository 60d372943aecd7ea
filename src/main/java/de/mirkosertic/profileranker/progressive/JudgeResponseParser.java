package de.mirkosertic.profileranker.progressive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses a judge reply of the form
 * <pre>{@code
 * {"overall_reason": "...",
 *  "per_doctor": [{"practitioner_name": "...", "fit_category": "excellent|good|ill-fit", "brief_reason": "..."}]}
 * }</pre>
 * into {@link FitJudgement}s.
 *
 * <p>Markdown code fences around the JSON are stripped. Entries are matched to the submitted
 * candidates by name, case-insensitively. The legacy boolean {@code excellent_fit} maps to
 * excellent or ill-fit; an entry without a recognizable category counts as good. A reply that is
 * not valid JSON yields no judgements.</p>
 */
public class JudgeResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(JudgeResponseParser.class);

    private final ObjectMapper objectMapper;

    public JudgeResponseParser() {
        this(new ObjectMapper());
    }

    public JudgeResponseParser(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<FitJudgement> parse(@Nullable final String reply, final List<CandidateSummary> submitted) {
        if (reply == null || reply.isBlank()) {
            logger.warn("Empty judge reply");
            return List.of();
        }
        final JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFences(reply));
        } catch (final JsonProcessingException e) {
            logger.warn("Judge reply is not valid JSON: {}", e.getOriginalMessage());
            return List.of();
        }
        final JsonNode perDoctor = root == null ? null : root.get("per_doctor");
        if (perDoctor == null || !perDoctor.isArray()) {
            logger.warn("Judge reply has no per_doctor array");
            return List.of();
        }

        final Map<String, String> idsByName = new HashMap<>();
        for (final CandidateSummary summary : submitted) {
            idsByName.putIfAbsent(nameKey(summary.name()), summary.candidateId());
        }

        final List<FitJudgement> judgements = new ArrayList<>();
        for (final JsonNode entry : perDoctor) {
            final String id = idsByName.remove(nameKey(entry.path("practitioner_name").asText("")));
            if (id == null) {
                continue;
            }
            final String reason = entry.path("brief_reason").asText("");
            judgements.add(new FitJudgement(id, category(entry), reason.isBlank() ? null : reason));
        }
        return judgements;
    }

    private static FitCategory category(final JsonNode entry) {
        final FitCategory category = FitCategory.fromWireName(entry.path("fit_category").asText(null));
        if (category != null) {
            return category;
        }
        final JsonNode legacy = entry.get("excellent_fit");
        if (legacy != null && legacy.isBoolean()) {
            return legacy.booleanValue() ? FitCategory.EXCELLENT : FitCategory.ILL_FIT;
        }
        return FitCategory.GOOD;
    }

    static String stripCodeFences(final String reply) {
        String text = reply.trim();
        if (text.startsWith("```")) {
            final int firstLineEnd = text.indexOf('\n');
            text = firstLineEnd < 0 ? "" : text.substring(firstLineEnd + 1);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }

    private static String nameKey(final String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}

package de.mirkosertic.profileranker.query;

import de.mirkosertic.profileranker.config.RankingConfig;
import de.mirkosertic.profileranker.config.RankingParameter;
import de.mirkosertic.profileranker.model.QueryBundle;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the "clean" retrieval query of a ranking call.
 *
 * <p>The retrieval query deliberately carries little beyond what the user said: the patient query,
 * the first {@code safe-lane-query-cap} safe-lane terms and an optional practitioner name are
 * normalized together, then the anchor phrases are appended. Intent terms are rescoring signals and
 * only reach retrieval when {@code intent-terms-in-retrieval} is switched on, capped at
 * {@code intent-terms-in-retrieval-max}. With {@code stage-a-two-query} the intent terms instead form
 * a second, separate query whose results are unioned with the patient results.</p>
 */
public class RetrievalQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalQueryBuilder.class);

    private final QueryNormalizer normalizer;

    public RetrievalQueryBuilder(final QueryNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public RetrievalQuery build(final QueryBundle bundle, final RankingConfig config) {
        final List<String> safeLane = firstNonBlank(bundle.safeLaneTerms(),
                config.intValue(RankingParameter.SAFE_LANE_QUERY_CAP));

        final List<String> baseParts = new ArrayList<>();
        addIfPresent(baseParts, bundle.patientQuery());
        baseParts.addAll(safeLane);
        addIfPresent(baseParts, bundle.nameHint());

        final NormalizedQuery normalization = normalizer.normalize(String.join(" ", baseParts));

        final StringBuilder text = new StringBuilder(normalization.normalized());
        final List<String> anchors = firstNonBlank(bundle.anchorPhrases(), Integer.MAX_VALUE);
        for (final String anchor : anchors) {
            appendPart(text, anchor);
        }

        final boolean twoQuery = config.flag(RankingParameter.STAGE_A_TWO_QUERY);
        List<String> injected = List.of();
        if (!twoQuery && config.flag(RankingParameter.INTENT_TERMS_IN_RETRIEVAL)) {
            injected = firstNonBlank(bundle.intentTerms(), config.intValue(RankingParameter.INTENT_TERMS_IN_RETRIEVAL_MAX));
            for (final String term : injected) {
                appendPart(text, term);
            }
        }

        String intentQuery = null;
        if (twoQuery) {
            final List<String> intentTerms = firstNonBlank(bundle.intentTerms(),
                    config.intValue(RankingParameter.STAGE_A_INTENT_TERMS_CAP));
            if (!intentTerms.isEmpty()) {
                intentQuery = normalizer.normalize(String.join(" ", intentTerms)).normalized();
            }
        }

        final RetrievalQuery query = new RetrievalQuery(text.toString(), normalization, safeLane, anchors,
                injected, intentQuery);
        logger.debug("Retrieval query: '{}', aliases={}, intentQuery={}", query.text(),
                normalization.describeAliases(), intentQuery);
        return query;
    }

    private static List<String> firstNonBlank(final List<String> values, final int limit) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .limit(limit)
                .toList();
    }

    private static void addIfPresent(final List<String> parts, @Nullable final String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }

    private static void appendPart(final StringBuilder text, final String part) {
        if (!text.isEmpty()) {
            text.append(' ');
        }
        text.append(part);
    }
}

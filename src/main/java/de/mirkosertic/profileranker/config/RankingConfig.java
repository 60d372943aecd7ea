package de.mirkosertic.profileranker.config;

import de.mirkosertic.profileranker.document.DocumentField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of constants controlling every boost, penalty, cap and retrieval setting.
 *
 * <p>A configuration is built once per ranking call from {@link #defaults()} and an optional partial
 * override, see {@link #withOverrides(Map)}. Override maps use the kebab-case keys of
 * {@link RankingParameter}, plus two nested sections:</p>
 * <pre>
 * field-weights:
 *   procedure-tags: 3.0
 * quality-tiers:
 *   rating:     [{threshold: 4.8, factor: 1.3}, ...]
 *   reviews:    [...]
 *   experience: [...]
 * </pre>
 *
 * <p>All values are validated on construction; an invalid value fails with an
 * {@link IllegalArgumentException} naming its key.</p>
 */
public final class RankingConfig {

    public static final String FIELD_WEIGHTS_KEY = "field-weights";
    public static final String QUALITY_TIERS_KEY = "quality-tiers";

    private static final List<QualityTier> DEFAULT_RATING_TIERS = List.of(
            new QualityTier(4.8, 1.3),
            new QualityTier(4.5, 1.2),
            new QualityTier(4.0, 1.1));
    private static final List<QualityTier> DEFAULT_REVIEW_TIERS = List.of(
            new QualityTier(100, 1.2),
            new QualityTier(50, 1.15),
            new QualityTier(20, 1.1));
    private static final List<QualityTier> DEFAULT_EXPERIENCE_TIERS = List.of(
            new QualityTier(20, 1.15),
            new QualityTier(10, 1.1));

    private static final RankingConfig DEFAULTS = builder().build();

    private final Map<RankingParameter, Double> values;
    private final Map<DocumentField, Double> fieldWeights;
    private final List<QualityTier> ratingTiers;
    private final List<QualityTier> reviewTiers;
    private final List<QualityTier> experienceTiers;

    private RankingConfig(final Builder builder) {
        final Map<RankingParameter, Double> copy = new EnumMap<>(RankingParameter.class);
        for (final RankingParameter parameter : RankingParameter.values()) {
            final double value = builder.values.getOrDefault(parameter, parameter.defaultValue());
            parameter.validate(value);
            copy.put(parameter, value);
        }
        final Map<DocumentField, Double> weights = new EnumMap<>(DocumentField.class);
        for (final DocumentField field : DocumentField.values()) {
            final double weight = builder.fieldWeights.getOrDefault(field, field.defaultWeight());
            if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
                throw new IllegalArgumentException(
                        "Field weight '" + field.key() + "' must be a finite number >= 0, was " + weight);
            }
            weights.put(field, weight);
        }
        this.values = Collections.unmodifiableMap(copy);
        this.fieldWeights = Collections.unmodifiableMap(weights);
        this.ratingTiers = QualityTier.sortedDescending(builder.ratingTiers);
        this.reviewTiers = QualityTier.sortedDescending(builder.reviewTiers);
        this.experienceTiers = QualityTier.sortedDescending(builder.experienceTiers);
    }

    /**
     * The documented, tuned baseline.
     */
    public static RankingConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        final Builder builder = new Builder();
        builder.values.putAll(values);
        builder.fieldWeights.putAll(fieldWeights);
        builder.ratingTiers = ratingTiers;
        builder.reviewTiers = reviewTiers;
        builder.experienceTiers = experienceTiers;
        return builder;
    }

    /**
     * Merges a partial override onto this configuration and returns the validated result. This
     * instance is left untouched. A {@code null} or empty override returns {@code this}.
     */
    public RankingConfig withOverrides(final Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        final Builder builder = toBuilder();
        for (final Map.Entry<String, ?> entry : overrides.entrySet()) {
            final String key = entry.getKey();
            final Object value = entry.getValue();
            if (FIELD_WEIGHTS_KEY.equals(key)) {
                applyFieldWeights(builder, value);
            } else if (QUALITY_TIERS_KEY.equals(key)) {
                applyQualityTiers(builder, value);
            } else {
                final RankingParameter parameter = RankingParameter.fromKey(key);
                builder.set(parameter, toDouble(parameter, value));
            }
        }
        return builder.build();
    }

    private static void applyFieldWeights(final Builder builder, final Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("'" + FIELD_WEIGHTS_KEY + "' must be a map of field to weight");
        }
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            final DocumentField field = DocumentField.fromKey(String.valueOf(entry.getKey()));
            if (!(entry.getValue() instanceof Number number)) {
                throw new IllegalArgumentException("Field weight '" + field.key() + "' must be numeric");
            }
            builder.fieldWeight(field, number.doubleValue());
        }
    }

    private static void applyQualityTiers(final Builder builder, final Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("'" + QUALITY_TIERS_KEY + "' must be a map");
        }
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            final String signal = String.valueOf(entry.getKey());
            final List<QualityTier> tiers = QualityTier.listFromYaml(signal, entry.getValue());
            switch (signal) {
                case "rating" -> builder.ratingTiers(tiers);
                case "reviews" -> builder.reviewTiers(tiers);
                case "experience" -> builder.experienceTiers(tiers);
                default -> throw new IllegalArgumentException("Unknown quality signal: " + signal);
            }
        }
    }

    private static double toDouble(final RankingParameter parameter, final Object value) {
        if (value instanceof Boolean flag) {
            if (!parameter.isFlag()) {
                throw new IllegalArgumentException("Ranking parameter '" + parameter.key() + "' is not a boolean");
            }
            return flag ? 1.0 : 0.0;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            final String trimmed = text.trim();
            if (parameter.isFlag() && ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed))) {
                return Boolean.parseBoolean(trimmed) ? 1.0 : 0.0;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Ranking parameter '" + parameter.key() + "' is not numeric: " + text, e);
            }
        }
        throw new IllegalArgumentException("Ranking parameter '" + parameter.key() + "' has no value");
    }

    public double value(final RankingParameter parameter) {
        return values.get(parameter);
    }

    public int intValue(final RankingParameter parameter) {
        return (int) Math.round(values.get(parameter));
    }

    public boolean flag(final RankingParameter parameter) {
        return values.get(parameter) != 0.0;
    }

    public Map<DocumentField, Double> fieldWeights() {
        return fieldWeights;
    }

    public List<QualityTier> ratingTiers() {
        return ratingTiers;
    }

    public List<QualityTier> reviewTiers() {
        return reviewTiers;
    }

    public List<QualityTier> experienceTiers() {
        return experienceTiers;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RankingConfig other)) {
            return false;
        }
        return values.equals(other.values)
                && fieldWeights.equals(other.fieldWeights)
                && ratingTiers.equals(other.ratingTiers)
                && reviewTiers.equals(other.reviewTiers)
                && experienceTiers.equals(other.experienceTiers);
    }

    @Override
    public int hashCode() {
        return values.hashCode() * 31 + fieldWeights.hashCode();
    }

    @Override
    public String toString() {
        return "RankingConfig" + values;
    }

    public static class Builder {
        private final Map<RankingParameter, Double> values = new EnumMap<>(RankingParameter.class);
        private final Map<DocumentField, Double> fieldWeights = new EnumMap<>(DocumentField.class);
        private List<QualityTier> ratingTiers = DEFAULT_RATING_TIERS;
        private List<QualityTier> reviewTiers = DEFAULT_REVIEW_TIERS;
        private List<QualityTier> experienceTiers = DEFAULT_EXPERIENCE_TIERS;

        public Builder set(final RankingParameter parameter, final double value) {
            values.put(parameter, value);
            return this;
        }

        public Builder flag(final RankingParameter parameter, final boolean enabled) {
            if (!parameter.isFlag()) {
                throw new IllegalArgumentException("Ranking parameter '" + parameter.key() + "' is not a boolean");
            }
            values.put(parameter, enabled ? 1.0 : 0.0);
            return this;
        }

        public Builder fieldWeight(final DocumentField field, final double weight) {
            fieldWeights.put(field, weight);
            return this;
        }

        public Builder ratingTiers(final List<QualityTier> tiers) { this.ratingTiers = List.copyOf(tiers); return this; }
        public Builder reviewTiers(final List<QualityTier> tiers) { this.reviewTiers = List.copyOf(tiers); return this; }
        public Builder experienceTiers(final List<QualityTier> tiers) { this.experienceTiers = List.copyOf(tiers); return this; }

        public RankingConfig build() {
            return new RankingConfig(this);
        }
    }
}

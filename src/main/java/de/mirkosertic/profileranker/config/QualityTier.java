package de.mirkosertic.profileranker.config;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One breakpoint of a quality signal: values {@code >= threshold} earn {@code factor}.
 */
public record QualityTier(double threshold, double factor) {

    public QualityTier {
        if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Quality tier threshold must be finite, was " + threshold);
        }
        if (Double.isNaN(factor) || factor < 1.0 || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Quality tier factor must be >= 1, was " + factor);
        }
    }

    /**
     * Returns the factor of the highest tier reached by {@code value}, or 1.0 when no tier is reached.
     * {@code tiers} must be sorted by descending threshold.
     */
    public static double factorFor(final List<QualityTier> tiers, final double value) {
        for (final QualityTier tier : tiers) {
            if (value >= tier.threshold()) {
                return tier.factor();
            }
        }
        return 1.0;
    }

    static List<QualityTier> sortedDescending(final List<QualityTier> tiers) {
        return tiers.stream()
                .sorted(Comparator.comparingDouble(QualityTier::threshold).reversed())
                .toList();
    }

    static List<QualityTier> listFromYaml(final String key, final Object value) {
        if (!(value instanceof List<?> rawList)) {
            throw new IllegalArgumentException("Quality tiers '" + key + "' must be a list");
        }
        return rawList.stream()
                .map(entry -> {
                    if (!(entry instanceof Map<?, ?> map)) {
                        throw new IllegalArgumentException("Quality tier in '" + key + "' must be a map with threshold and factor");
                    }
                    final Object threshold = map.get("threshold");
                    final Object factor = map.get("factor");
                    if (!(threshold instanceof Number) || !(factor instanceof Number)) {
                        throw new IllegalArgumentException("Quality tier in '" + key + "' needs numeric threshold and factor");
                    }
                    return new QualityTier(((Number) threshold).doubleValue(), ((Number) factor).doubleValue());
                })
                .toList();
    }
}

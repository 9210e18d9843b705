package com.trendwatch.core.metric;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves {@link MetricExtractor} variants from their configuration tag.
 *
 * <p>
 * This is the single point of extension when adding a new trended
 * statistic: implement {@code MetricExtractor} and register its tag here.
 * Trend definitions and registries never need to change.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricExtractors {

    /** Configuration tags of the built-in variants. */
    public static final List<String> SUPPORTED = List.of(
            MeanExtractor.NAME, StdDevExtractor.NAME, MaximumExtractor.NAME);

    private MetricExtractors() {
        // not instantiable
    }

    /**
     * Look up an extractor by tag (case-insensitive).
     *
     * @param name metric tag, e.g. {@code "mean"}; may be {@code null}
     * @return the matching extractor, or empty for {@code null} or unknown tags
     */
    public static Optional<MetricExtractor> forName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "mean" -> Optional.of(new MeanExtractor());
            case "stddev" -> Optional.of(new StdDevExtractor());
            case "maximum", "max" -> Optional.of(new MaximumExtractor());
            default -> Optional.empty();
        };
    }
}

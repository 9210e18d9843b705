package com.trendwatch.core.metric;

import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.model.Sample;

import java.util.Objects;

/**
 * Trends the largest bin content. A maximum carries no statistical error,
 * so the error is always {@code 0}.
 *
 * <p>
 * An all-zero histogram is valid and yields {@code (0, 0)}; only a
 * histogram without bins fails.
 * </p>
 *
 * @since 1.0.0
 */
public class MaximumExtractor implements MetricExtractor {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "maximum";

    @Override
    public Sample extract(HistogramSnapshot histogram) throws ExtractionException {
        Objects.requireNonNull(histogram, "Histogram must not be null");
        if (histogram.getBinCount() == 0) {
            throw new ExtractionException(histogram.getName(),
                    "Cannot extract maximum from histogram '" + histogram.getName() + "' without bins");
        }
        double maximum = histogram.getMaximum();
        if (!Double.isFinite(maximum)) {
            throw new ExtractionException(histogram.getName(),
                    "Histogram '" + histogram.getName() + "' reports a non-finite maximum: " + maximum);
        }
        return Sample.of(maximum, 0);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String toString() {
        return NAME;
    }
}

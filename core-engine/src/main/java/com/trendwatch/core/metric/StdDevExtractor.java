package com.trendwatch.core.metric;

import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.model.Sample;

import java.util.Objects;

/**
 * Trends the standard deviation of a histogram together with its own
 * statistical error.
 *
 * @since 1.0.0
 */
public class StdDevExtractor implements MetricExtractor {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "stdDev";

    @Override
    public Sample extract(HistogramSnapshot histogram) throws ExtractionException {
        Objects.requireNonNull(histogram, "Histogram must not be null");
        if (!(histogram.getEntries() > 0)) {
            throw new ExtractionException(histogram.getName(),
                    "Cannot extract standard deviation from empty histogram '" + histogram.getName() + "'");
        }
        double stdDev = histogram.getStdDev();
        double error = histogram.getStdDevError();
        if (!Double.isFinite(stdDev) || !Double.isFinite(error)) {
            throw new ExtractionException(histogram.getName(), String.format(
                    "Histogram '%s' reports a non-finite standard deviation: %s ± %s",
                    histogram.getName(), stdDev, error));
        }
        return Sample.of(stdDev, error);
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

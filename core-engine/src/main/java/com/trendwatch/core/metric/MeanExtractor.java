package com.trendwatch.core.metric;

import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.model.Sample;

import java.util.Objects;

/**
 * Trends the mean of a histogram, with the error of the mean as error bar.
 *
 * @since 1.0.0
 */
public class MeanExtractor implements MetricExtractor {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "mean";

    @Override
    public Sample extract(HistogramSnapshot histogram) throws ExtractionException {
        Objects.requireNonNull(histogram, "Histogram must not be null");
        if (!(histogram.getEntries() > 0)) {
            throw new ExtractionException(histogram.getName(),
                    "Cannot extract mean from empty histogram '" + histogram.getName() + "'");
        }
        double mean = histogram.getMean();
        double error = histogram.getMeanError();
        if (!Double.isFinite(mean) || !Double.isFinite(error)) {
            throw new ExtractionException(histogram.getName(), String.format(
                    "Histogram '%s' reports a non-finite mean: %s ± %s", histogram.getName(), mean, error));
        }
        return Sample.of(mean, error);
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

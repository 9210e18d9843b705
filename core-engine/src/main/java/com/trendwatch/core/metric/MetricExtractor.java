package com.trendwatch.core.metric;

import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.model.Sample;

import java.io.Serializable;

/**
 * Contract for all trended statistics.
 *
 * <p>
 * An extractor is <strong>stateless</strong>: it reads one histogram
 * snapshot and turns it into a {@link Sample}. It never mutates the
 * snapshot. All buffering is done by the
 * {@link com.trendwatch.core.trend.TrendState} that owns the extractor's
 * output.
 * </p>
 *
 * <p>
 * Extractors must be {@link Serializable} because trend definitions travel
 * inside Flink keyed state.
 * </p>
 */
public interface MetricExtractor extends Serializable {

    /**
     * Extract one sample from the snapshot.
     *
     * @param histogram the snapshot to read; never modified
     * @return the extracted {@code (value, error)} pair
     * @throws ExtractionException if the snapshot lacks the statistics this
     *                             metric needs
     */
    Sample extract(HistogramSnapshot histogram) throws ExtractionException;

    /**
     * Return the configuration tag of this metric ({@code mean},
     * {@code stdDev}, ...).
     *
     * @return metric name
     */
    String getName();
}

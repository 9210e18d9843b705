package com.trendwatch.core.model;

/**
 * Read-only view of one histogram at one processing cycle.
 *
 * <p>
 * The trending engine never looks at the binary layout of a histogram. It
 * only needs the accumulated statistics below, which is what every
 * {@link com.trendwatch.core.metric.MetricExtractor} consumes.
 * </p>
 *
 * <p>
 * Implementations must be effectively immutable: extracting a statistic
 * must never change the answer to a later query.
 * </p>
 *
 * @since 1.0.0
 */
public interface HistogramSnapshot {

    /**
     * @return histogram name, as referenced by trend definitions
     */
    String getName();

    /**
     * @return number of (effective) entries accumulated in the histogram
     */
    double getEntries();

    /**
     * @return number of bins, excluding under/overflow
     */
    int getBinCount();

    double getMean();

    double getMeanError();

    double getStdDev();

    double getStdDevError();

    /**
     * @return the largest bin content
     */
    double getMaximum();
}

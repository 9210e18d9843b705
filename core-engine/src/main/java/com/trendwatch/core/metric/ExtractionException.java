package com.trendwatch.core.metric;

/**
 * Raised when a histogram snapshot cannot provide the statistic a metric
 * needs, for instance the mean of an empty histogram.
 *
 * <p>
 * The failure concerns a single trend in a single cycle. Callers log it and
 * carry on with the remaining trends.
 * </p>
 *
 * @since 1.0.0
 */
public class ExtractionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String histogramName;

    public ExtractionException(String histogramName, String message) {
        super(message);
        this.histogramName = histogramName;
    }

    /**
     * @return name of the histogram that could not be read
     */
    public String getHistogramName() {
        return histogramName;
    }
}

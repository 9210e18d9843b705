/**
 * Statistics that can be trended.
 *
 * <p>
 * All variants implement {@link com.trendwatch.core.metric.MetricExtractor}
 * and are resolved from configuration via
 * {@link com.trendwatch.core.metric.MetricExtractors}:
 * </p>
 * <ul>
 * <li>{@link com.trendwatch.core.metric.MeanExtractor} - mean ± error of
 * the mean</li>
 * <li>{@link com.trendwatch.core.metric.StdDevExtractor} - standard
 * deviation ± its error</li>
 * <li>{@link com.trendwatch.core.metric.MaximumExtractor} - largest bin
 * content, no error</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendwatch.core.metric;

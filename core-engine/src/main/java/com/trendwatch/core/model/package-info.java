/**
 * Value types shared by the trending engine and the Flink job.
 *
 * <ul>
 * <li>{@link com.trendwatch.core.model.HistogramSnapshot} - the statistics
 * view a metric extractor reads</li>
 * <li>{@link com.trendwatch.core.model.BinnedHistogram} - JSON-friendly
 * histogram implementation</li>
 * <li>{@link com.trendwatch.core.model.HistogramBatch} - one ingestion cycle
 * for one subsystem</li>
 * <li>{@link com.trendwatch.core.model.Sample},
 * {@link com.trendwatch.core.model.SeriesPoint},
 * {@link com.trendwatch.core.model.AlarmRef}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendwatch.core.model;

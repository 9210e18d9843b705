/**
 * Apache Flink streaming job for Trend Watch.
 *
 * <p>
 * Consumes histogram batches from Kafka, keys them by subsystem, runs one
 * trending cycle per batch against the subsystem's registry held in keyed
 * state, and publishes a cycle report per batch.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.trendwatch.flink.TrendingJob} - main entry point</li>
 * <li>{@link com.trendwatch.flink.TrendProcessFunction} - keyed process
 * function</li>
 * <li>{@link com.trendwatch.flink.JobConfig} - environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendwatch.flink;

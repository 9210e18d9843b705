/**
 * Loading and validation of the trending YAML configuration.
 *
 * <p>
 * {@link com.trendwatch.core.config.TrendingConfigLoader} binds the file to
 * {@link com.trendwatch.core.config.TrendingConfig} and validates every
 * trend definition before anything runs.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendwatch.core.config;

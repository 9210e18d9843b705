/**
 * The trend-state engine.
 *
 * <p>
 * A validated {@link com.trendwatch.core.trend.TrendDefinition} describes a
 * trend; a {@link com.trendwatch.core.trend.TrendState} holds its bounded
 * history; a {@link com.trendwatch.core.trend.TrendRegistry} groups the
 * states of one subsystem and drives extraction, rendering and
 * persistence.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendwatch.core.trend;

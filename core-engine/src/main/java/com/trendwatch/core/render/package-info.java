/**
 * Rendering of trend artifacts.
 *
 * <p>
 * A {@link com.trendwatch.core.trend.TrendState} builds a
 * {@link com.trendwatch.core.render.RenderRequest}; an
 * {@link com.trendwatch.core.render.ArtifactRenderer} encodes it and an
 * {@link com.trendwatch.core.render.ArtifactSink} stores the bytes at the
 * paths computed by {@link com.trendwatch.core.render.ArtifactPaths}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendwatch.core.render;

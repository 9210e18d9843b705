package com.trendwatch.core.render;

/**
 * Turns a trend's series into an image and a JSON description.
 *
 * <p>
 * Renderers produce bytes only; writing them is the job of an
 * {@link ArtifactSink}.
 * </p>
 */
public interface ArtifactRenderer {

    /**
     * @param request the series, title and target paths
     * @return the encoded artifacts
     * @throws RenderException if encoding fails
     */
    RenderedArtifacts render(RenderRequest request) throws RenderException;
}

package com.trendwatch.core.render;

import java.io.IOException;

/**
 * Destination of rendered artifacts.
 */
public interface ArtifactSink {

    /**
     * Store both artifacts at the paths they carry.
     *
     * @param artifacts what to store
     * @throws IOException if writing fails
     */
    void write(RenderedArtifacts artifacts) throws IOException;
}

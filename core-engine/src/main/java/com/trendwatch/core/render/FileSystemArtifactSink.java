package com.trendwatch.core.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes artifacts to the local file system, creating the
 * {@code img/} and {@code json/} directories on demand.
 *
 * @since 1.0.0
 */
public class FileSystemArtifactSink implements ArtifactSink {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemArtifactSink.class);

    @Override
    public void write(RenderedArtifacts artifacts) throws IOException {
        Objects.requireNonNull(artifacts, "Artifacts must not be null");
        writeFile(artifacts.getImagePath(), artifacts.getImage());
        writeFile(artifacts.getJsonPath(), artifacts.getJson());
        LOG.debug("Wrote artifacts of trend [{}] to {} and {}",
                artifacts.getTrendName(), artifacts.getImagePath(), artifacts.getJsonPath());
    }

    private static void writeFile(Path path, byte[] content) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, content);
    }
}

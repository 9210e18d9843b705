package com.trendwatch.core.render;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Output of one render: the image and JSON bytes and where they belong.
 *
 * @since 1.0.0
 */
public final class RenderedArtifacts {

    private final String trendName;
    private final Path imagePath;
    private final byte[] image;
    private final Path jsonPath;
    private final byte[] json;

    public RenderedArtifacts(String trendName, Path imagePath, byte[] image, Path jsonPath, byte[] json) {
        this.trendName = Objects.requireNonNull(trendName, "trendName must not be null");
        this.imagePath = Objects.requireNonNull(imagePath, "imagePath must not be null");
        this.image = Objects.requireNonNull(image, "image must not be null").clone();
        this.jsonPath = Objects.requireNonNull(jsonPath, "jsonPath must not be null");
        this.json = Objects.requireNonNull(json, "json must not be null").clone();
    }

    public String getTrendName() {
        return trendName;
    }

    public Path getImagePath() {
        return imagePath;
    }

    /**
     * @return a copy of the encoded image
     */
    public byte[] getImage() {
        return image.clone();
    }

    public Path getJsonPath() {
        return jsonPath;
    }

    /**
     * @return a copy of the JSON document
     */
    public byte[] getJson() {
        return json.clone();
    }

    @Override
    public String toString() {
        return "RenderedArtifacts{" +
                "trendName='" + trendName + '\'' +
                ", imagePath=" + imagePath +
                ", imageBytes=" + image.length +
                ", jsonPath=" + jsonPath +
                ", jsonBytes=" + json.length +
                '}';
    }
}

package com.trendwatch.core.render;

import com.trendwatch.core.model.SeriesPoint;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything an {@link ArtifactRenderer} needs to draw one trend.
 *
 * @since 1.0.0
 */
public final class RenderRequest {

    private final String trendName;
    private final String title;
    private final String subsystemName;
    private final List<SeriesPoint> series;
    private final String imageExtension;
    private final Path imagePath;
    private final Path jsonPath;

    public RenderRequest(String trendName, String title, String subsystemName, List<SeriesPoint> series,
            String imageExtension, Path imagePath, Path jsonPath) {
        this.trendName = Objects.requireNonNull(trendName, "trendName must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.subsystemName = Objects.requireNonNull(subsystemName, "subsystemName must not be null");
        this.series = List.copyOf(Objects.requireNonNull(series, "series must not be null"));
        this.imageExtension = Objects.requireNonNull(imageExtension, "imageExtension must not be null");
        this.imagePath = Objects.requireNonNull(imagePath, "imagePath must not be null");
        this.jsonPath = Objects.requireNonNull(jsonPath, "jsonPath must not be null");
    }

    public String getTrendName() {
        return trendName;
    }

    /**
     * @return chart title, the trend's description
     */
    public String getTitle() {
        return title;
    }

    public String getSubsystemName() {
        return subsystemName;
    }

    /**
     * @return unmodifiable series, oldest point first
     */
    public List<SeriesPoint> getSeries() {
        return series;
    }

    public String getImageExtension() {
        return imageExtension;
    }

    public Path getImagePath() {
        return imagePath;
    }

    public Path getJsonPath() {
        return jsonPath;
    }

    @Override
    public String toString() {
        return "RenderRequest{" +
                "trendName='" + trendName + '\'' +
                ", subsystem='" + subsystemName + '\'' +
                ", points=" + series.size() +
                '}';
    }
}

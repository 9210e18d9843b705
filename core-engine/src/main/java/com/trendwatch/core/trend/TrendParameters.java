package com.trendwatch.core.trend;

import java.io.Serializable;
import java.util.Locale;
import java.util.Set;

/**
 * Runtime parameters applied to every trend of a registry.
 *
 * <ul>
 * <li>{@code capacity} - samples kept per trend (default
 * {@value #DEFAULT_CAPACITY})</li>
 * <li>{@code dirPrefix} - root directory of rendered artifacts
 * (required)</li>
 * <li>{@code imageExtension} - image format, {@code png} or
 * {@code jpg}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TrendParameters implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_CAPACITY = 100;
    public static final String DEFAULT_IMAGE_EXTENSION = "png";
    public static final Set<String> SUPPORTED_IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg");

    private final int capacity;
    private final String dirPrefix;
    private final String imageExtension;

    private TrendParameters(Builder b) {
        this.capacity = b.capacity;
        this.dirPrefix = b.dirPrefix;
        this.imageExtension = b.imageExtension.toLowerCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getCapacity() {
        return capacity;
    }

    public String getDirPrefix() {
        return dirPrefix;
    }

    public String getImageExtension() {
        return imageExtension;
    }

    /**
     * Fluent builder; {@link #build()} checks ranges.
     */
    public static class Builder {
        private int capacity = DEFAULT_CAPACITY;
        private String dirPrefix;
        private String imageExtension = DEFAULT_IMAGE_EXTENSION;

        public Builder capacity(int v) {
            this.capacity = v;
            return this;
        }

        public Builder dirPrefix(String v) {
            this.dirPrefix = v;
            return this;
        }

        public Builder imageExtension(String v) {
            this.imageExtension = v;
            return this;
        }

        /**
         * @return validated parameters
         * @throws IllegalArgumentException if capacity is not positive, the
         *                                  prefix is blank or the image format
         *                                  is unsupported
         */
        public TrendParameters build() {
            if (capacity < 1) {
                throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
            }
            if (dirPrefix == null || dirPrefix.isBlank()) {
                throw new IllegalArgumentException("dirPrefix must not be null or blank");
            }
            if (imageExtension == null
                    || !SUPPORTED_IMAGE_EXTENSIONS.contains(imageExtension.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("imageExtension must be one of "
                        + SUPPORTED_IMAGE_EXTENSIONS + ", got: " + imageExtension);
            }
            return new TrendParameters(this);
        }
    }

    @Override
    public String toString() {
        return "TrendParameters{" +
                "capacity=" + capacity +
                ", dirPrefix='" + dirPrefix + '\'' +
                ", imageExtension='" + imageExtension + '\'' +
                '}';
    }
}

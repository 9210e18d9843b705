package com.trendwatch.core.render;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Output layout of rendered trend artifacts.
 *
 * <pre>
 * &lt;dirPrefix&gt;/&lt;subsystem&gt;/img/&lt;trend&gt;.&lt;ext&gt;
 * &lt;dirPrefix&gt;/&lt;subsystem&gt;/json/&lt;trend&gt;.json
 * </pre>
 *
 * <p>
 * Slashes in trend names are replaced by underscores so every trend maps to
 * a single file. Subsystem names become directories; {@link #isUsableName}
 * tells whether a name can take part in the layout at all.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArtifactPaths {

    public static final String IMAGE_DIR = "img";
    public static final String JSON_DIR = "json";

    private ArtifactPaths() {
        // not instantiable
    }

    /**
     * @param trendName trend name, possibly containing {@code /}
     * @return the name usable as a file name
     */
    public static String fileName(String trendName) {
        Objects.requireNonNull(trendName, "Trend name must not be null");
        return trendName.replace('/', '_');
    }

    /**
     * A name is usable when it holds no control characters or backslashes
     * and none of its {@code /}-separated segments is {@code .} or
     * {@code ..}.
     *
     * @param name trend or subsystem name; may be {@code null}
     * @return {@code true} if the name can be part of an artifact path
     */
    public static boolean isUsableName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isISOControl(c) || c == '\\') {
                return false;
            }
        }
        for (String segment : name.split("/", -1)) {
            if (segment.equals(".") || segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    public static Path imagePath(String dirPrefix, String subsystemName, String trendName, String extension) {
        return Path.of(dirPrefix, subsystemName, IMAGE_DIR, fileName(trendName) + "." + extension);
    }

    public static Path jsonPath(String dirPrefix, String subsystemName, String trendName) {
        return Path.of(dirPrefix, subsystemName, JSON_DIR, fileName(trendName) + ".json");
    }
}

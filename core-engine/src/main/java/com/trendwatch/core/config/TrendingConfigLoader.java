package com.trendwatch.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@code trending.yml} into a validated {@link TrendingConfig}.
 *
 * <p>
 * {@link #load(String)} takes an explicit path first, then the file named by
 * {@value #ENV_CONFIG_PATH}, then {@value #DEFAULT_RESOURCE} on the
 * classpath. Parsing is followed by {@link TrendingConfig#validate()}, so a
 * broken trend definition stops start-up instead of failing a cycle later.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendingConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TrendingConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "TRENDING_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "trending.yml";

    private TrendingConfigLoader() {
        // not instantiable
    }

    /**
     * @param explicitPath file to read; {@code null} or blank falls back to
     *                     {@link #load()}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the explicit file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static TrendingConfig load(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading trending configuration from {}", explicitPath);
            return fromFile(explicitPath);
        }
        return load();
    }

    /**
     * Load using automatic resolution: {@code TRENDING_CONFIG_PATH} if it
     * names an existing file, otherwise {@code trending.yml} on the
     * classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static TrendingConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading trending configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading trending configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static TrendingConfig fromFile(String path) {
        Objects.requireNonNull(path, "Trending config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Trending config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read trending config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static TrendingConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = TrendingConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static TrendingConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(TrendingConfig.class, options));
        TrendingConfig config = yaml.load(is);

        if (config == null) {
            throw new IllegalStateException("Trending configuration is empty");
        }
        config.validate();

        if (config.getSubsystems().isEmpty()) {
            LOG.warn("No subsystems defined in trending configuration");
        }
        int trends = config.getSubsystems().stream().mapToInt(s -> s.getTrends().size()).sum();
        LOG.info("Loaded {} trend(s) across {} subsystem(s)", trends, config.getSubsystems().size());
        return config;
    }
}

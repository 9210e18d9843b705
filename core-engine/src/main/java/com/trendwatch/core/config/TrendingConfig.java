package com.trendwatch.core.config;

import com.trendwatch.core.render.ArtifactPaths;
import com.trendwatch.core.trend.TrendDefinition;
import com.trendwatch.core.trend.TrendParameters;
import com.trendwatch.core.trend.TrendValidationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Top-level POJO for the trending YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * entries: 100
 * dirPrefix: data/trending
 * imageExtension: png
 * storePath: data/store
 * subsystems:
 *   - name: EMC
 *     trends:
 *       - name: EMCTRQA_ampMean
 *         description: Mean amplitude
 *         metric: mean
 *         histograms: [EMCTRQA_histAmp]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the parameters and every
 * trend.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendingConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int entries = TrendParameters.DEFAULT_CAPACITY;
    private String dirPrefix;
    private String imageExtension = TrendParameters.DEFAULT_IMAGE_EXTENSION;
    private String storePath = "data/store";
    private List<SubsystemConfig> subsystems = new ArrayList<>();

    /**
     * Validate parameters, subsystem names and every trend definition.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            toParameters();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (storePath == null || storePath.isBlank()) {
            errors.add("'storePath' must not be blank");
        }

        Set<String> subsystemNames = new HashSet<>();
        for (int i = 0; i < subsystems.size(); i++) {
            SubsystemConfig subsystem = subsystems.get(i);
            if (subsystem == null) {
                errors.add("Subsystem at index " + i + " is null");
                continue;
            }
            String name = subsystem.getName();
            if (name == null || name.isBlank()) {
                errors.add("Subsystem at index " + i + " requires 'name'");
            } else if (!ArtifactPaths.isUsableName(name)) {
                errors.add("Subsystem '" + name + "' contains control characters, backslashes "
                        + "or '.'/'..' segments");
            } else if (!subsystemNames.add(name)) {
                errors.add("Subsystem '" + name + "' is defined twice");
            }

            Set<String> trendNames = new HashSet<>();
            List<TrendConfig> trends = subsystem.getTrends();
            for (int j = 0; j < trends.size(); j++) {
                TrendConfig trend = trends.get(j);
                if (trend == null) {
                    errors.add("Subsystem '" + name + "': trend at index " + j + " is null");
                    continue;
                }
                try {
                    trend.toDefinition();
                } catch (TrendValidationException e) {
                    errors.add("Subsystem '" + name + "': " + e.getMessage());
                }
                if (trend.getName() != null && !trendNames.add(trend.getName())) {
                    errors.add("Subsystem '" + name + "': " + TrendValidationException.Kind.DUPLICATE_NAME
                            + ": trend '" + trend.getName() + "' is defined twice");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Trending configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return the runtime parameters shared by all registries
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public TrendParameters toParameters() {
        return TrendParameters.builder()
                .capacity(entries)
                .dirPrefix(dirPrefix)
                .imageExtension(imageExtension)
                .build();
    }

    /**
     * @param subsystemName subsystem to look up
     * @return the subsystem's entry, if configured
     */
    public Optional<SubsystemConfig> getSubsystem(String subsystemName) {
        return subsystems.stream()
                .filter(s -> s.getName() != null && s.getName().equals(subsystemName))
                .findFirst();
    }

    /**
     * @param subsystemName subsystem to look up
     * @return its trend definitions, or an empty list when not configured
     * @throws TrendValidationException if a trend is invalid
     */
    public List<TrendDefinition> definitionsFor(String subsystemName) throws TrendValidationException {
        Optional<SubsystemConfig> subsystem = getSubsystem(subsystemName);
        return subsystem.isPresent() ? subsystem.get().toDefinitions() : List.of();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getEntries() {
        return entries;
    }

    public void setEntries(int entries) {
        this.entries = entries;
    }

    public String getDirPrefix() {
        return dirPrefix;
    }

    public void setDirPrefix(String dirPrefix) {
        this.dirPrefix = dirPrefix;
    }

    public String getImageExtension() {
        return imageExtension;
    }

    public void setImageExtension(String imageExtension) {
        this.imageExtension = imageExtension;
    }

    public String getStorePath() {
        return storePath;
    }

    public void setStorePath(String storePath) {
        this.storePath = storePath;
    }

    /**
     * @return unmodifiable list of subsystem entries
     */
    public List<SubsystemConfig> getSubsystems() {
        return Collections.unmodifiableList(subsystems);
    }

    public void setSubsystems(List<SubsystemConfig> subsystems) {
        this.subsystems = subsystems != null ? new ArrayList<>(subsystems) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "TrendingConfig{" +
                "entries=" + entries +
                ", dirPrefix='" + dirPrefix + '\'' +
                ", imageExtension='" + imageExtension + '\'' +
                ", storePath='" + storePath + '\'' +
                ", subsystems=" + subsystems +
                '}';
    }
}

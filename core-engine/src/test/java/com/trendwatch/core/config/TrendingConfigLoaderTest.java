package com.trendwatch.core.config;

import com.trendwatch.core.metric.MaximumExtractor;
import com.trendwatch.core.model.AlarmRef;
import com.trendwatch.core.trend.TrendDefinition;
import com.trendwatch.core.trend.TrendParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TrendingConfigLoader}.
 */
class TrendingConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        TrendingConfig config = TrendingConfigLoader.fromClasspath("test-trending.yml");

        assertThat(config.getEntries()).isEqualTo(5);
        assertThat(config.getStorePath()).isEqualTo("build/store");
        assertThat(config.getSubsystems()).extracting(SubsystemConfig::getName)
                .containsExactly("tracker", "muon");
        assertThat(config.getSubsystem("tracker").orElseThrow().getTrends()).hasSize(2);
    }

    @Test
    @DisplayName("Should turn trend entries into validated definitions")
    void shouldBuildDefinitions() throws Exception {
        TrendingConfig config = TrendingConfigLoader.fromClasspath("test-trending.yml");

        List<TrendDefinition> defs = config.definitionsFor("tracker");

        assertThat(defs).extracting(TrendDefinition::getName).containsExactly("hits/mean", "hits/max");
        TrendDefinition max = defs.get(1);
        assertThat(max.getMetric()).isInstanceOf(MaximumExtractor.class);
        assertThat(max.getHistogramNames()).containsExactly("hits", "events");
        assertThat(max.getAlarms()).containsExactly(AlarmRef.of("hits_alarm"));
        assertThat(config.definitionsFor("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should map global settings to trend parameters")
    void shouldBuildParameters() {
        TrendParameters params = TrendingConfigLoader.fromClasspath("test-trending.yml").toParameters();

        assertThat(params.getCapacity()).isEqualTo(5);
        assertThat(params.getDirPrefix()).isEqualTo("build/trends");
        assertThat(params.getImageExtension()).isEqualTo("png");
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> TrendingConfigLoader.fromClasspath("invalid-trending.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("capacity")
                .hasMessageContaining("WRONG_METRIC")
                .hasMessageContaining("DUPLICATE_NAME");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile() throws Exception {
        Path file = tempDir.resolve("trending.yml");
        Files.writeString(file, String.join("\n",
                "dirPrefix: \"" + tempDir.resolve("out").toString().replace("\\", "/") + "\"",
                "subsystems:",
                "  - name: \"calo\"",
                "    trends:",
                "      - name: \"energy\"",
                "        description: \"Energy\"",
                "        metric: \"mean\"",
                "        histograms: [\"e\"]",
                ""));

        TrendingConfig config = TrendingConfigLoader.fromFile(file.toString());

        assertThat(config.getEntries()).isEqualTo(TrendParameters.DEFAULT_CAPACITY);
        assertThat(config.definitionsFor("calo")).hasSize(1);
    }

    @Test
    @DisplayName("An explicit path should take precedence over the classpath")
    void explicitPathShouldWin() throws Exception {
        Path file = writeConfig("calo", "      - name: \"energy\"",
                "        description: \"Energy\"",
                "        metric: \"mean\"",
                "        histograms: [\"e\"]");

        TrendingConfig config = TrendingConfigLoader.load(file.toString());

        assertThat(config.getSubsystem("calo")).isPresent();
        assertThat(config.getSubsystem("tracker")).isEmpty();
    }

    @Test
    @DisplayName("Should report an empty trend entry instead of failing with a NullPointerException")
    void shouldReportNullTrendEntry() throws Exception {
        Path file = writeConfig("calo", "      - ~");

        assertThatThrownBy(() -> TrendingConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Subsystem 'calo': trend at index 0 is null");
    }

    @Test
    @DisplayName("Should reject a subsystem name that escapes the output directory")
    void shouldRejectTraversingSubsystemName() throws Exception {
        Path file = writeConfig("../calo", "      - name: \"energy\"",
                "        description: \"Energy\"",
                "        metric: \"mean\"",
                "        histograms: [\"e\"]");

        assertThatThrownBy(() -> TrendingConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Subsystem '../calo' contains control characters");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> TrendingConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> TrendingConfigLoader.fromFile(tempDir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    private Path writeConfig(String subsystemName, String... trendLines) throws Exception {
        Path file = tempDir.resolve("trending-" + System.nanoTime() + ".yml");
        StringBuilder yaml = new StringBuilder()
                .append("dirPrefix: \"out\"\n")
                .append("subsystems:\n")
                .append("  - name: \"").append(subsystemName).append("\"\n")
                .append("    trends:\n");
        for (String line : trendLines) {
            yaml.append(line).append('\n');
        }
        Files.writeString(file, yaml.toString());
        return file;
    }
}

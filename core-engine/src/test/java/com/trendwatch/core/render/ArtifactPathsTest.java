package com.trendwatch.core.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactPathsTest {

    @Test
    @DisplayName("Should replace slashes in trend names")
    void shouldFlattenTrendName() {
        assertThat(ArtifactPaths.fileName("a/b/c")).isEqualTo("a_b_c");
        assertThat(ArtifactPaths.fileName("plain")).isEqualTo("plain");
    }

    @Test
    @DisplayName("Should place images and JSON in separate directories")
    void shouldBuildPaths() {
        assertThat(ArtifactPaths.imagePath("/data", "tracker", "hits/mean", "jpg"))
                .isEqualTo(Path.of("/data/tracker/img/hits_mean.jpg"));
        assertThat(ArtifactPaths.jsonPath("/data", "tracker", "hits/mean"))
                .isEqualTo(Path.of("/data/tracker/json/hits_mean.json"));
    }

    @Test
    @DisplayName("Should reject names with control characters, backslashes or dot segments")
    void shouldRejectUnusableNames() {
        assertThat(ArtifactPaths.isUsableName("hits/mean")).isTrue();
        assertThat(ArtifactPaths.isUsableName("EMC.A")).isTrue();
        assertThat(ArtifactPaths.isUsableName(null)).isFalse();
        assertThat(ArtifactPaths.isUsableName("  ")).isFalse();
        assertThat(ArtifactPaths.isUsableName("bad\u0000name")).isFalse();
        assertThat(ArtifactPaths.isUsableName("line\nbreak")).isFalse();
        assertThat(ArtifactPaths.isUsableName("a\\b")).isFalse();
        assertThat(ArtifactPaths.isUsableName("..")).isFalse();
        assertThat(ArtifactPaths.isUsableName("hits/../../etc")).isFalse();
        assertThat(ArtifactPaths.isUsableName("./hits")).isFalse();
    }
}

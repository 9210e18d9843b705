package com.trendwatch.core.store;

import com.trendwatch.core.model.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileTrendStore} and {@link InMemoryTrendStore}.
 */
class FileTrendStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should return empty when nothing was committed")
    void shouldReturnEmptyWhenMissing() throws PersistenceException {
        assertThat(new FileTrendStore(tempDir).load("tracker")).isEmpty();
    }

    @Test
    @DisplayName("Should load exactly what was committed")
    void shouldRoundTripCommit() throws PersistenceException {
        FileTrendStore store = new FileTrendStore(tempDir.resolve("store"));
        RegistrySnapshot snapshot = snapshot(Sample.of(1.5, 0.1), Sample.of(2.5, 0.2));

        store.commit("tracker", snapshot);
        Optional<RegistrySnapshot> loaded = store.load("tracker");

        assertThat(loaded).isPresent();
        assertThat(loaded.get().getSubsystemName()).isEqualTo("tracker");
        assertThat(loaded.get().getTrends()).isEqualTo(snapshot.getTrends());
        assertThat(loaded.get().getTakenAt()).isEqualTo(snapshot.getTakenAt());
    }

    @Test
    @DisplayName("A second commit should replace the first and leave no temp file")
    void shouldReplaceRecord() throws Exception {
        FileTrendStore store = new FileTrendStore(tempDir);
        store.commit("tracker", snapshot(Sample.of(1, 0)));
        store.commit("tracker", snapshot(Sample.of(1, 0), Sample.of(2, 0)));

        assertThat(store.load("tracker").orElseThrow().getTrend("hits/mean").orElseThrow().getSamples())
                .hasSize(2);
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("tracker.json");
        }
    }

    @Test
    @DisplayName("Subsystems differing only in '/' and '_' should keep separate records")
    void shouldKeepSlashAndUnderscoreNamesApart() throws Exception {
        FileTrendStore store = new FileTrendStore(tempDir);
        store.commit("EMC/A", snapshotOf("EMC/A", Sample.of(1, 0)));
        store.commit("EMC_A", snapshotOf("EMC_A", Sample.of(7, 0), Sample.of(8, 0)));

        RegistrySnapshot slash = store.load("EMC/A").orElseThrow();
        RegistrySnapshot underscore = store.load("EMC_A").orElseThrow();

        assertThat(slash.getSubsystemName()).isEqualTo("EMC/A");
        assertThat(slash.getTrend("hits/mean").orElseThrow().getSamples()).containsExactly(Sample.of(1, 0));
        assertThat(underscore.getSubsystemName()).isEqualTo("EMC_A");
        assertThat(underscore.getTrend("hits/mean").orElseThrow().getSamples())
                .containsExactly(Sample.of(7, 0), Sample.of(8, 0));
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder("EMC%2FA.json", "EMC_A.json");
        }
    }

    @Test
    @DisplayName("Should report an unreadable record as a persistence failure")
    void shouldFailOnCorruptRecord() throws Exception {
        Files.writeString(tempDir.resolve("tracker.json"), "{ not json");

        assertThatThrownBy(() -> new FileTrendStore(tempDir).load("tracker"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("tracker");
    }

    @Test
    @DisplayName("Should report an unwritable directory as a persistence failure")
    void shouldFailWhenDirectoryIsAFile() throws Exception {
        Path notADir = Files.writeString(tempDir.resolve("blocked"), "x");

        assertThatThrownBy(() -> new FileTrendStore(notADir).commit("tracker", snapshot()))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("In-memory store should keep the latest commit per subsystem")
    void inMemoryStoreShouldKeepLatest() {
        InMemoryTrendStore store = new InMemoryTrendStore();
        store.commit("tracker", snapshot(Sample.of(1, 0)));
        RegistrySnapshot latest = snapshot(Sample.of(2, 0));
        store.commit("tracker", latest);

        assertThat(store.load("tracker")).contains(latest);
        assertThat(store.load("muon")).isEmpty();
    }

    private static RegistrySnapshot snapshot(Sample... samples) {
        return snapshotOf("tracker", samples);
    }

    private static RegistrySnapshot snapshotOf(String subsystemName, Sample... samples) {
        return new RegistrySnapshot(subsystemName, Instant.parse("2024-03-01T10:15:30Z"),
                List.of(new TrendSnapshot("hits/mean", 10, samples.length, List.of(samples))));
    }
}

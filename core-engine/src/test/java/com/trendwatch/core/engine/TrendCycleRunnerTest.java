package com.trendwatch.core.engine;

import com.trendwatch.core.model.BinnedHistogram;
import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.render.ArtifactRenderer;
import com.trendwatch.core.store.InMemoryTrendStore;
import com.trendwatch.core.store.PersistenceException;
import com.trendwatch.core.store.RegistrySnapshot;
import com.trendwatch.core.store.TrendStore;
import com.trendwatch.core.trend.TrendDefinition;
import com.trendwatch.core.trend.TrendParameters;
import com.trendwatch.core.trend.TrendRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TrendCycleRunner}.
 */
class TrendCycleRunnerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Map<String, HistogramSnapshot> HISTOGRAMS = Map.of(
            "hits", BinnedHistogram.of("hits", 0, 2, 1, 3));

    private TrendRegistry registry;
    private RecordingSink sink;
    private InMemoryTrendStore store;

    @BeforeEach
    void setUp() throws Exception {
        registry = TrendRegistry.createFrom(List.of(
                TrendDefinition.create("hits/mean", "Mean hits", List.of("hits"), "mean"),
                TrendDefinition.create("tracks/mean", "Mean tracks", List.of("tracks"), "mean")),
                "tracker", TrendParameters.builder().capacity(4).dirPrefix("out").build());
        sink = new RecordingSink();
        store = new InMemoryTrendStore();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Should process, render and commit a cycle")
    void shouldRunFullCycle() throws PersistenceException {
        CycleReport report = runner(store).run(registry, HISTOGRAMS);

        assertThat(report.getSubsystem()).isEqualTo("tracker");
        assertThat(report.getFinishedAt()).isEqualTo(NOW);
        assertThat(report.getUpdated()).containsExactly("hits/mean");
        assertThat(report.getSkipped()).containsExactly("tracks/mean");
        assertThat(report.isCommitted()).isTrue();
        assertThat(report.isCancelled()).isFalse();
        assertThat(sink.getWritten()).containsExactly("hits/mean");
        assertThat(store.load("tracker").orElseThrow().getTrend("hits/mean").orElseThrow().getSamples())
                .hasSize(1);
    }

    @Test
    @DisplayName("Unchecked render failure should be reported and the cycle still committed")
    void uncheckedRenderFailureShouldStillCommit() throws PersistenceException {
        ArtifactRenderer exploding = request -> {
            throw new IllegalStateException("boom");
        };
        TrendCycleRunner runner = new TrendCycleRunner(exploding, sink, store, Clock.fixed(NOW, ZoneOffset.UTC));

        CycleReport report = runner.run(registry, HISTOGRAMS);

        assertThat(report.getUpdated()).containsExactly("hits/mean");
        assertThat(report.getRenderFailures()).containsEntry("hits/mean", "boom");
        assertThat(report.isCommitted()).isTrue();
        assertThat(sink.getWritten()).isEmpty();
        assertThat(store.load("tracker").orElseThrow().getTrend("hits/mean").orElseThrow().getSamples())
                .hasSize(1);
    }

    @Test
    @DisplayName("Failed commit should be reported and retried with the next cycle")
    void failedCommitShouldBeRetried() {
        FlakyStore flaky = new FlakyStore(1);
        TrendCycleRunner runner = runner(flaky);

        CycleReport first = runner.run(registry, HISTOGRAMS);
        CycleReport second = runner.run(registry, HISTOGRAMS);

        assertThat(first.isCommitted()).isFalse();
        assertThat(first.getCommitError()).contains("store offline");
        assertThat(second.isCommitted()).isTrue();
        assertThat(flaky.delegate.load("tracker").orElseThrow()
                .getTrend("hits/mean").orElseThrow().getSamples()).hasSize(2);
    }

    @Test
    @DisplayName("Interrupted cycle should be discarded and not committed")
    void interruptedCycleShouldBeDiscarded() throws PersistenceException {
        TrendCycleRunner runner = runner(store);
        runner.run(registry, HISTOGRAMS);

        Thread.currentThread().interrupt();
        CycleReport report = runner.run(registry, HISTOGRAMS);

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.isCommitted()).isFalse();
        assertThat(registry.get("hits/mean").orElseThrow().size()).isEqualTo(1);
        assertThat(store.load("tracker").orElseThrow().getTrend("hits/mean").orElseThrow().getSamples())
                .hasSize(1);
    }

    private TrendCycleRunner runner(TrendStore target) {
        return new TrendCycleRunner(RecordingSink.RENDERER, sink, target, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /** Fails the first {@code failures} commits. */
    private static final class FlakyStore implements TrendStore {
        private final InMemoryTrendStore delegate = new InMemoryTrendStore();
        private final AtomicInteger remainingFailures;

        FlakyStore(int failures) {
            this.remainingFailures = new AtomicInteger(failures);
        }

        @Override
        public void commit(String subsystemName, RegistrySnapshot snapshot) throws PersistenceException {
            if (remainingFailures.getAndDecrement() > 0) {
                throw new PersistenceException("store offline");
            }
            delegate.commit(subsystemName, snapshot);
        }

        @Override
        public Optional<RegistrySnapshot> load(String subsystemName) {
            return delegate.load(subsystemName);
        }
    }
}

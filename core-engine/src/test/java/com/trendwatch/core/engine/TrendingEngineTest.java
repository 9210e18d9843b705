package com.trendwatch.core.engine;

import com.trendwatch.core.config.TrendingConfig;
import com.trendwatch.core.config.TrendingConfigLoader;
import com.trendwatch.core.model.BinnedHistogram;
import com.trendwatch.core.model.HistogramBatch;
import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.store.InMemoryTrendStore;
import com.trendwatch.core.trend.TrendRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TrendingEngine}.
 */
class TrendingEngineTest {

    private TrendingConfig config;
    private InMemoryTrendStore store;
    private TrendingEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        config = TrendingConfigLoader.fromClasspath("test-trending.yml");
        store = new InMemoryTrendStore();
        engine = newEngine();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        engine.close();
    }

    @Test
    @DisplayName("Should create one registry per configured subsystem")
    void shouldCreateRegistries() {
        assertThat(engine.getSubsystemNames()).containsExactly("tracker", "muon");
        assertThat(engine.getRegistry("tracker")).hasValueSatisfying(r -> assertThat(r.size()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should ignore batches of unknown subsystems")
    void shouldIgnoreUnknownSubsystem() {
        HistogramBatch batch = new HistogramBatch("pixel", Instant.now(),
                Map.of("hits", BinnedHistogram.of("hits", 0, 1, 1)));

        assertThat(engine.process(batch)).isEmpty();
    }

    @Test
    @DisplayName("Should run a cycle for a batch")
    void shouldProcessBatch() {
        HistogramBatch batch = new HistogramBatch("tracker", Instant.now(), Map.of(
                "hits", BinnedHistogram.of("hits", 0, 2, 1, 3)));

        Optional<CycleReport> report = engine.process(batch);

        assertThat(report).isPresent();
        assertThat(report.get().getUpdated()).containsExactly("hits/mean");
        assertThat(report.get().getSkipped()).containsExactly("hits/max");
        assertThat(report.get().isCommitted()).isTrue();
    }

    @Test
    @DisplayName("Should run subsystems concurrently and report each")
    void shouldRunCyclesForAllSubsystems() throws InterruptedException {
        Map<String, Map<String, HistogramSnapshot>> input = Map.of(
                "tracker", Map.of("hits", BinnedHistogram.of("hits", 0, 2, 1, 3),
                        "events", BinnedHistogram.of("events", 0, 1, 1)),
                "muon", Map.of("chambers", BinnedHistogram.of("chambers", 0, 3, 1, 2, 1)),
                "pixel", Map.of());

        Map<String, CycleReport> reports = engine.runCycles(input);

        assertThat(reports).containsOnlyKeys("tracker", "muon");
        assertThat(reports.get("tracker").getUpdated()).containsExactly("hits/mean", "hits/max");
        assertThat(reports.get("muon").getUpdated()).containsExactly("chambers/width");
    }

    @Test
    @DisplayName("Cycles of one subsystem should never overlap")
    void cyclesOfOneSubsystemShouldBeSerialised() throws Exception {
        int cycles = 50;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<CycleReport>>> futures = new ArrayList<>();
        for (int i = 0; i < cycles; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return engine.runCycle("tracker", Map.of("hits", BinnedHistogram.of("hits", 0, 2, 1, 3)));
            }));
        }
        start.countDown();
        for (Future<Optional<CycleReport>> f : futures) {
            assertThat(f.get(30, TimeUnit.SECONDS)).isPresent();
        }
        pool.shutdown();

        TrendRegistry registry = engine.getRegistry("tracker").orElseThrow();
        assertThat(registry.get("hits/mean").orElseThrow().getWriteCount()).isEqualTo(cycles);
        assertThat(registry.get("hits/mean").orElseThrow().size()).isEqualTo(config.getEntries());
    }

    @Test
    @DisplayName("Should restore committed state on start-up")
    void shouldRestoreOnStartup() throws Exception {
        engine.runCycle("tracker", Map.of("hits", BinnedHistogram.of("hits", 0, 2, 1, 3)));
        engine.runCycle("tracker", Map.of("hits", BinnedHistogram.of("hits", 0, 2, 3, 1)));
        engine.close();

        engine = newEngine();

        TrendRegistry restored = engine.getRegistry("tracker").orElseThrow();
        assertThat(restored.get("hits/mean").orElseThrow().size()).isEqualTo(2);
        assertThat(restored.get("hits/max").orElseThrow().isEmpty()).isTrue();
    }

    private TrendingEngine newEngine() throws Exception {
        return TrendingEngine.create(config,
                new TrendCycleRunner(RecordingSink.RENDERER, new RecordingSink(), store), store);
    }
}

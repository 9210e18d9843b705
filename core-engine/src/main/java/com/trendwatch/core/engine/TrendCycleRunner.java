package com.trendwatch.core.engine;

import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.render.ArtifactRenderer;
import com.trendwatch.core.render.ArtifactSink;
import com.trendwatch.core.store.PersistenceException;
import com.trendwatch.core.store.TrendStore;
import com.trendwatch.core.trend.StepResult;
import com.trendwatch.core.trend.TrendRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one complete cycle on a registry: extraction and buffer update,
 * rendering, then commit.
 *
 * <h3>Failure semantics</h3>
 * <ul>
 * <li>Extraction and render failures are per trend and never stop the
 * cycle.</li>
 * <li>A failed commit leaves the updated buffers in memory; the next cycle
 * commits them together with its own samples.</li>
 * <li>If the calling thread is interrupted before the commit, the pending
 * mutations are discarded and nothing is committed.</li>
 * </ul>
 *
 * <p>
 * The runner holds no per-subsystem state. Callers must not run two cycles
 * on the same registry at the same time.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendCycleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(TrendCycleRunner.class);

    private final ArtifactRenderer renderer;
    private final ArtifactSink sink;
    private final TrendStore store;
    private final Clock clock;

    public TrendCycleRunner(ArtifactRenderer renderer, ArtifactSink sink, TrendStore store) {
        this(renderer, sink, store, Clock.systemUTC());
    }

    public TrendCycleRunner(ArtifactRenderer renderer, ArtifactSink sink, TrendStore store, Clock clock) {
        this.renderer = Objects.requireNonNull(renderer, "ArtifactRenderer must not be null");
        this.sink = Objects.requireNonNull(sink, "ArtifactSink must not be null");
        this.store = Objects.requireNonNull(store, "TrendStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * @param registry   the subsystem's registry
     * @param histograms this cycle's histograms keyed by name
     * @return what happened to each trend and whether the cycle is durable
     */
    public CycleReport run(TrendRegistry registry, Map<String, ? extends HistogramSnapshot> histograms) {
        Objects.requireNonNull(registry, "TrendRegistry must not be null");
        Objects.requireNonNull(histograms, "Histogram map must not be null");
        String subsystem = registry.getSubsystemName();

        StepResult processing = registry.processSnapshot(histograms);
        StepResult rendering = registry.renderAll(renderer, sink);

        CycleReport.Builder report = CycleReport.builder()
                .subsystem(subsystem)
                .processing(processing)
                .rendering(rendering);

        if (Thread.currentThread().isInterrupted()) {
            LOG.warn("Cycle of subsystem [{}] interrupted before commit – discarding", subsystem);
            registry.discardPendingCycle();
            return report.cancelled(true).finishedAt(clock.instant()).build();
        }

        try {
            registry.persist(store);
            report.committed(true);
        } catch (PersistenceException e) {
            LOG.error("Commit of subsystem [{}] failed – state kept in memory for the next cycle",
                    subsystem, e);
            report.committed(false).commitError(e.getMessage());
        }

        CycleReport result = report.finishedAt(clock.instant()).build();
        LOG.info("Cycle of subsystem [{}]: updated={} skipped={} extractionFailures={} renderFailures={} committed={}",
                subsystem, processing.getSucceeded().size(), processing.getSkipped().size(),
                processing.getFailed().size(), rendering.getFailed().size(), result.isCommitted());
        return result;
    }
}

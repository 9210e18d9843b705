package com.trendwatch.core.engine;

import com.trendwatch.core.config.SubsystemConfig;
import com.trendwatch.core.config.TrendingConfig;
import com.trendwatch.core.model.HistogramBatch;
import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.store.PersistenceException;
import com.trendwatch.core.store.RegistrySnapshot;
import com.trendwatch.core.store.TrendStore;
import com.trendwatch.core.trend.TrendParameters;
import com.trendwatch.core.trend.TrendRegistry;
import com.trendwatch.core.trend.TrendValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the registries of every configured subsystem and runs their cycles.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Subsystems share no mutable state, so their cycles run in parallel on an
 * internal thread pool. Cycles of the <em>same</em> subsystem are
 * serialised by a per-subsystem lock: a cycle only starts once the previous
 * one has committed (or failed to).
 * </p>
 *
 * <h3>Start-up</h3>
 * <p>
 * {@link #create} builds each registry from configuration and restores it
 * from the store when a committed record exists.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendingEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TrendingEngine.class);

    private final Map<String, TrendRegistry> registries;
    private final Map<String, ReentrantLock> locks;
    private final TrendCycleRunner runner;
    private final ExecutorService executor;

    TrendingEngine(Map<String, TrendRegistry> registries, TrendCycleRunner runner, ExecutorService executor) {
        this.registries = Collections.unmodifiableMap(new LinkedHashMap<>(registries));
        this.runner = Objects.requireNonNull(runner, "TrendCycleRunner must not be null");
        this.executor = Objects.requireNonNull(executor, "ExecutorService must not be null");
        Map<String, ReentrantLock> lockMap = new LinkedHashMap<>();
        registries.keySet().forEach(name -> lockMap.put(name, new ReentrantLock()));
        this.locks = Collections.unmodifiableMap(lockMap);
    }

    /**
     * Build an engine for every subsystem in the configuration.
     *
     * @param config validated configuration
     * @param runner cycle runner holding renderer, sink and store
     * @param store  store to restore registries from; usually the runner's
     * @return a ready engine
     * @throws TrendValidationException if a subsystem's definitions are
     *                                  invalid
     * @throws PersistenceException     if a stored record cannot be read
     */
    public static TrendingEngine create(TrendingConfig config, TrendCycleRunner runner, TrendStore store)
            throws TrendValidationException, PersistenceException {
        Objects.requireNonNull(config, "TrendingConfig must not be null");
        Objects.requireNonNull(store, "TrendStore must not be null");
        TrendParameters parameters = config.toParameters();

        Map<String, TrendRegistry> registries = new LinkedHashMap<>();
        for (SubsystemConfig subsystem : config.getSubsystems()) {
            TrendRegistry registry = TrendRegistry.createFrom(
                    subsystem.toDefinitions(), subsystem.getName(), parameters);
            Optional<RegistrySnapshot> committed = store.load(subsystem.getName());
            committed.ifPresent(registry::restore);
            registries.put(subsystem.getName(), registry);
        }

        int threads = Math.max(1, Math.min(registries.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "trending-cycle");
            t.setDaemon(true);
            return t;
        });
        LOG.info("Trending engine started for {} subsystem(s) on {} thread(s)", registries.size(), threads);
        return new TrendingEngine(registries, runner, executor);
    }

    /**
     * Run one cycle for the batch's subsystem on the calling thread.
     *
     * @param batch histograms of one subsystem
     * @return the cycle report, or empty if the subsystem is not configured
     */
    public Optional<CycleReport> process(HistogramBatch batch) {
        Objects.requireNonNull(batch, "HistogramBatch must not be null");
        return runCycle(batch.getSubsystem(), batch.getHistograms());
    }

    /**
     * Run one cycle for a subsystem on the calling thread, waiting for any
     * cycle of the same subsystem that is still in flight.
     *
     * @param subsystemName subsystem to update
     * @param histograms    histograms keyed by name
     * @return the cycle report, or empty if the subsystem is not configured
     */
    public Optional<CycleReport> runCycle(String subsystemName,
            Map<String, ? extends HistogramSnapshot> histograms) {
        TrendRegistry registry = registries.get(subsystemName);
        if (registry == null) {
            LOG.debug("Subsystem [{}] has no configured trends – ignoring", subsystemName);
            return Optional.empty();
        }
        ReentrantLock lock = locks.get(subsystemName);
        lock.lock();
        try {
            return Optional.of(runner.run(registry, histograms));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run one cycle per subsystem concurrently and wait for all of them. A
     * failing subsystem does not affect the others.
     *
     * @param histogramsBySubsystem histograms keyed by subsystem, then name
     * @return reports of the configured subsystems that completed
     * @throws InterruptedException if interrupted while waiting
     */
    public Map<String, CycleReport> runCycles(
            Map<String, ? extends Map<String, ? extends HistogramSnapshot>> histogramsBySubsystem)
            throws InterruptedException {
        Objects.requireNonNull(histogramsBySubsystem, "Histogram map must not be null");
        Map<String, Future<Optional<CycleReport>>> futures = new LinkedHashMap<>();
        histogramsBySubsystem.forEach((subsystem, histograms) ->
                futures.put(subsystem, executor.submit(() -> runCycle(subsystem, histograms))));

        Map<String, CycleReport> reports = new LinkedHashMap<>();
        for (Map.Entry<String, Future<Optional<CycleReport>>> entry : futures.entrySet()) {
            try {
                entry.getValue().get().ifPresent(report -> reports.put(entry.getKey(), report));
            } catch (ExecutionException e) {
                LOG.error("Cycle of subsystem [{}] failed – continuing with other subsystems",
                        entry.getKey(), e.getCause());
            }
        }
        return reports;
    }

    /**
     * @param subsystemName subsystem to look up
     * @return its registry, if configured
     */
    public Optional<TrendRegistry> getRegistry(String subsystemName) {
        return Optional.ofNullable(registries.get(subsystemName));
    }

    /**
     * @return configured subsystem names in configuration order
     */
    public Set<String> getSubsystemNames() {
        return registries.keySet();
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            LOG.warn("Trending cycles still running after 30s – forcing shutdown");
            executor.shutdownNow();
        }
        LOG.info("Trending engine stopped");
    }
}

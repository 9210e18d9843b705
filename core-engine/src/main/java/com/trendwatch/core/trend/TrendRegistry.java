package com.trendwatch.core.trend;

import com.trendwatch.core.metric.ExtractionException;
import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.render.ArtifactPaths;
import com.trendwatch.core.render.ArtifactRenderer;
import com.trendwatch.core.render.ArtifactSink;
import com.trendwatch.core.render.RenderException;
import com.trendwatch.core.render.RenderedArtifacts;
import com.trendwatch.core.store.PersistenceException;
import com.trendwatch.core.store.RegistrySnapshot;
import com.trendwatch.core.store.TrendSnapshot;
import com.trendwatch.core.store.TrendStore;
import com.trendwatch.core.trend.TrendValidationException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * All trends of one subsystem, keyed by name in definition order.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>{@link #createFrom} at configuration time, optionally followed by
 * {@link #restore} from the store</li>
 * <li>per cycle: {@link #processSnapshot}, {@link #renderAll},
 * {@link #persist}</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Extraction and render failures are confined to the trend that raised
 * them. They are logged and returned in a {@link StepResult}; the remaining
 * trends are processed normally.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Callers must run one cycle at a time per registry, see
 * {@code com.trendwatch.core.engine.TrendingEngine}.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendRegistry implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TrendRegistry.class);

    private final String subsystemName;
    private final LinkedHashMap<String, TrendState> trends;

    /** State as of the last successful commit, {@code null} before the first. */
    private RegistrySnapshot lastCommitted;

    private TrendRegistry(String subsystemName, LinkedHashMap<String, TrendState> trends) {
        this.subsystemName = subsystemName;
        this.trends = trends;
    }

    /**
     * Create one {@link TrendState} per definition.
     *
     * @param definitions   trends of the subsystem, in rendering order
     * @param subsystemName subsystem name; must be usable as a directory, see
     *                      {@link ArtifactPaths#isUsableName}
     * @param parameters    capacity and output settings shared by all trends
     * @return a new, empty registry
     * @throws TrendValidationException with {@link Kind#DUPLICATE_NAME} if two
     *                                  definitions share a name
     */
    public static TrendRegistry createFrom(List<TrendDefinition> definitions, String subsystemName,
            TrendParameters parameters) throws TrendValidationException {
        Objects.requireNonNull(definitions, "Trend definitions must not be null");
        Objects.requireNonNull(parameters, "TrendParameters must not be null");
        if (!ArtifactPaths.isUsableName(subsystemName)) {
            throw new IllegalArgumentException("subsystemName must be non-blank without control characters, "
                    + "backslashes or '.'/'..' segments, got: '" + subsystemName + "'");
        }

        LinkedHashMap<String, TrendState> states = new LinkedHashMap<>();
        for (TrendDefinition definition : definitions) {
            Objects.requireNonNull(definition, "Trend definition must not be null");
            if (states.containsKey(definition.getName())) {
                throw new TrendValidationException(Kind.DUPLICATE_NAME,
                        "Trend '" + definition.getName() + "' is defined twice in subsystem '"
                                + subsystemName + "'");
            }
            states.put(definition.getName(), new TrendState(definition, subsystemName, parameters));
        }
        LOG.info("Created registry for subsystem [{}] with {} trend(s)", subsystemName, states.size());
        return new TrendRegistry(subsystemName, states);
    }

    // ---------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------

    /**
     * Append one sample to every trend whose required histograms are all
     * present. The sample is extracted from the trend's primary histogram.
     *
     * @param histogramsByName histograms of this cycle keyed by name
     * @return updated, skipped and failed trends
     */
    public StepResult processSnapshot(Map<String, ? extends HistogramSnapshot> histogramsByName) {
        Objects.requireNonNull(histogramsByName, "Histogram map must not be null");
        StepResult.Collector result = new StepResult.Collector();

        for (TrendState state : trends.values()) {
            TrendDefinition definition = state.getDefinition();
            if (!histogramsByName.keySet().containsAll(definition.getHistogramNames())) {
                LOG.trace("Trend [{}/{}]: required histograms missing – skipping", subsystemName, state.getName());
                result.skipped(state.getName());
                continue;
            }
            try {
                state.appendSample(histogramsByName.get(definition.getPrimaryHistogramName()));
                result.succeeded(state.getName());
            } catch (ExtractionException e) {
                LOG.warn("Trend [{}/{}]: extraction failed – continuing with next trend: {}",
                        subsystemName, state.getName(), e.getMessage());
                result.failed(state.getName(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Trend [{}/{}] threw an exception – continuing with next trend",
                        subsystemName, state.getName(), e);
                result.failed(state.getName(), String.valueOf(e.getMessage()));
            }
        }
        return result.build();
    }

    /**
     * Render every trend that holds samples and hand the artifacts to the
     * sink. Trends without samples are skipped.
     *
     * @param renderer renderer for images and JSON
     * @param sink     destination of the artifacts
     * @return rendered, skipped and failed trends
     */
    public StepResult renderAll(ArtifactRenderer renderer, ArtifactSink sink) {
        Objects.requireNonNull(renderer, "ArtifactRenderer must not be null");
        Objects.requireNonNull(sink, "ArtifactSink must not be null");
        StepResult.Collector result = new StepResult.Collector();

        for (TrendState state : trends.values()) {
            if (state.isEmpty()) {
                result.skipped(state.getName());
                continue;
            }
            try {
                RenderedArtifacts artifacts = state.renderArtifacts(renderer);
                sink.write(artifacts);
                result.succeeded(state.getName());
            } catch (RenderException | IOException e) {
                LOG.warn("Trend [{}/{}]: rendering failed – continuing with next trend: {}",
                        subsystemName, state.getName(), e.getMessage());
                result.failed(state.getName(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Trend [{}/{}] threw while rendering – continuing with next trend",
                        subsystemName, state.getName(), e);
                result.failed(state.getName(), String.valueOf(e.getMessage()));
            }
        }
        return result.build();
    }

    /**
     * Commit the complete registry state. On success it becomes the state
     * {@link #discardPendingCycle()} rolls back to.
     *
     * @param store transactional store
     * @throws PersistenceException if the commit failed; in-memory state is
     *                              kept so the next cycle can retry
     */
    public void persist(TrendStore store) throws PersistenceException {
        Objects.requireNonNull(store, "TrendStore must not be null");
        RegistrySnapshot snapshot = snapshot();
        store.commit(subsystemName, snapshot);
        lastCommitted = snapshot;
        LOG.debug("Persisted registry of subsystem [{}]", subsystemName);
    }

    // ---------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------

    /**
     * @return immutable copy of every trend's buffer
     */
    public RegistrySnapshot snapshot() {
        List<TrendSnapshot> snapshots = new ArrayList<>(trends.size());
        for (TrendState state : trends.values()) {
            snapshots.add(state.snapshot());
        }
        return new RegistrySnapshot(subsystemName, Instant.now(), snapshots);
    }

    /**
     * Load buffers from a committed snapshot, typically at start-up.
     * Recorded trends that are no longer configured are ignored; configured
     * trends without a record start empty.
     *
     * @param snapshot committed state of this subsystem
     * @throws IllegalArgumentException if the snapshot belongs to another
     *                                  subsystem
     */
    public void restore(RegistrySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "RegistrySnapshot must not be null");
        if (!snapshot.getSubsystemName().equals(subsystemName)) {
            throw new IllegalArgumentException("Snapshot of subsystem '" + snapshot.getSubsystemName()
                    + "' cannot restore subsystem '" + subsystemName + "'");
        }
        for (TrendSnapshot trend : snapshot.getTrends()) {
            TrendState state = trends.get(trend.getName());
            if (state == null) {
                LOG.info("Subsystem [{}]: stored trend '{}' is no longer configured – ignoring",
                        subsystemName, trend.getName());
                continue;
            }
            state.restore(trend);
        }
        for (TrendState state : trends.values()) {
            if (snapshot.getTrend(state.getName()).isEmpty()) {
                state.clear();
            }
        }
        lastCommitted = snapshot;
        LOG.info("Restored subsystem [{}] from snapshot taken at {}", subsystemName, snapshot.getTakenAt());
    }

    /**
     * Roll every buffer back to the last committed state, discarding the
     * mutations of an unfinished cycle. Without a prior commit all buffers
     * are emptied.
     */
    public void discardPendingCycle() {
        if (lastCommitted != null) {
            restore(lastCommitted);
        } else {
            trends.values().forEach(TrendState::clear);
        }
        LOG.info("Subsystem [{}]: discarded uncommitted cycle", subsystemName);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSubsystemName() {
        return subsystemName;
    }

    public Optional<TrendState> get(String trendName) {
        return Optional.ofNullable(trends.get(trendName));
    }

    /**
     * @return unmodifiable view of the trends in definition order
     */
    public Collection<TrendState> getTrends() {
        return Collections.unmodifiableCollection(trends.values());
    }

    public int size() {
        return trends.size();
    }

    /**
     * @return the last successfully committed snapshot, if any
     */
    public Optional<RegistrySnapshot> getLastCommitted() {
        return Optional.ofNullable(lastCommitted);
    }

    @Override
    public String toString() {
        return "TrendRegistry{" +
                "subsystem='" + subsystemName + '\'' +
                ", trends=" + trends.keySet() +
                '}';
    }
}

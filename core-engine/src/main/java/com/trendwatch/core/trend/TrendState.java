package com.trendwatch.core.trend;

import com.trendwatch.core.metric.ExtractionException;
import com.trendwatch.core.model.HistogramSnapshot;
import com.trendwatch.core.model.Sample;
import com.trendwatch.core.model.SeriesPoint;
import com.trendwatch.core.render.ArtifactPaths;
import com.trendwatch.core.render.ArtifactRenderer;
import com.trendwatch.core.render.RenderException;
import com.trendwatch.core.render.RenderRequest;
import com.trendwatch.core.render.RenderedArtifacts;
import com.trendwatch.core.store.TrendSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runtime state of one trend in one subsystem: a fixed-capacity history of
 * extracted samples.
 *
 * <h3>Buffer</h3>
 * <p>
 * Samples live in a ring buffer of {@code capacity} slots. {@code head}
 * points at the oldest sample. Once the buffer is full, every append
 * overwrites the oldest slot and advances {@code head}, which is the same
 * as evicting index 0 and appending at the end. Logical order is always
 * oldest first.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. A state belongs to one registry, and a registry
 * processes one cycle at a time.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendState implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TrendState.class);

    private final TrendDefinition definition;
    private final String subsystemName;
    private final int capacity;
    private final String outputPathPrefix;
    private final String imageExtension;

    private final double[] values;
    private final double[] errors;
    private int head;
    private int size;
    private long writeCount;

    /**
     * @param definition    the definition this state tracks; shared, never
     *                      modified
     * @param subsystemName owning subsystem
     * @param parameters    capacity and output settings
     */
    public TrendState(TrendDefinition definition, String subsystemName, TrendParameters parameters) {
        this.definition = Objects.requireNonNull(definition, "TrendDefinition must not be null");
        this.subsystemName = Objects.requireNonNull(subsystemName, "subsystemName must not be null");
        Objects.requireNonNull(parameters, "TrendParameters must not be null");
        this.capacity = parameters.getCapacity();
        this.outputPathPrefix = parameters.getDirPrefix();
        this.imageExtension = parameters.getImageExtension();
        this.values = new double[capacity];
        this.errors = new double[capacity];
    }

    // ---------------------------------------------------------------
    // Buffer operations
    // ---------------------------------------------------------------

    /**
     * Extract a sample from the histogram and append it, evicting the oldest
     * sample when the buffer is full.
     *
     * @param histogram snapshot of the trend's primary histogram
     * @throws ExtractionException if the metric cannot be extracted; the
     *                             buffer is left untouched
     */
    public void appendSample(HistogramSnapshot histogram) throws ExtractionException {
        Objects.requireNonNull(histogram, "Histogram must not be null");
        Sample sample = definition.getMetric().extract(histogram);
        append(sample);
        LOG.trace("Trend [{}/{}] appended {} (size={}, writeCount={})",
                subsystemName, definition.getName(), sample, size, writeCount);
    }

    void append(Sample sample) {
        int slot;
        if (size == capacity) {
            slot = head;
            head = (head + 1) % capacity;
        } else {
            slot = (head + size) % capacity;
            size++;
        }
        values[slot] = sample.getValue();
        errors[slot] = sample.getError();
        writeCount++;
    }

    /**
     * @return the buffered samples, oldest first (a copy)
     */
    public List<Sample> getSamples() {
        List<Sample> samples = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int slot = (head + i) % capacity;
            samples.add(Sample.of(values[slot], errors[slot]));
        }
        return Collections.unmodifiableList(samples);
    }

    /**
     * Index-paired view of the buffer for plotting. The index is the
     * position inside the current buffer, not the write count.
     *
     * @return points {@code (i, value, error)} oldest first
     */
    public List<SeriesPoint> currentSeries() {
        List<SeriesPoint> series = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int slot = (head + i) % capacity;
            series.add(SeriesPoint.of(i, values[slot], errors[slot]));
        }
        return Collections.unmodifiableList(series);
    }

    // ---------------------------------------------------------------
    // Rendering
    // ---------------------------------------------------------------

    /**
     * Render the current series. The buffer is only read.
     *
     * @param renderer the renderer to use
     * @return the rendered image and JSON document with their target paths
     * @throws RenderException if the renderer fails
     */
    public RenderedArtifacts renderArtifacts(ArtifactRenderer renderer) throws RenderException {
        Objects.requireNonNull(renderer, "ArtifactRenderer must not be null");
        RenderRequest request = new RenderRequest(definition.getName(), definition.getDescription(),
                subsystemName, currentSeries(), imageExtension, getImagePath(), getJsonPath());
        return renderer.render(request);
    }

    public Path getImagePath() {
        return ArtifactPaths.imagePath(outputPathPrefix, subsystemName, definition.getName(), imageExtension);
    }

    public Path getJsonPath() {
        return ArtifactPaths.jsonPath(outputPathPrefix, subsystemName, definition.getName());
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * @return an immutable copy of the buffer for the store
     */
    public TrendSnapshot snapshot() {
        return new TrendSnapshot(definition.getName(), capacity, writeCount, getSamples());
    }

    /**
     * Replace the buffer with a persisted one. When the snapshot holds more
     * samples than this state's capacity, only the newest are kept.
     *
     * @param snapshot persisted buffer of the same trend
     * @throws IllegalArgumentException if the snapshot belongs to another
     *                                  trend
     */
    public void restore(TrendSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "TrendSnapshot must not be null");
        if (!snapshot.getName().equals(definition.getName())) {
            throw new IllegalArgumentException("Snapshot of trend '" + snapshot.getName()
                    + "' cannot restore trend '" + definition.getName() + "'");
        }
        List<Sample> samples = snapshot.getSamples();
        int skip = Math.max(0, samples.size() - capacity);
        head = 0;
        size = 0;
        for (int i = skip; i < samples.size(); i++) {
            values[size] = samples.get(i).getValue();
            errors[size] = samples.get(i).getError();
            size++;
        }
        writeCount = Math.max(snapshot.getWriteCount(), samples.size());
    }

    /**
     * Drop every sample and reset the write count.
     */
    void clear() {
        head = 0;
        size = 0;
        writeCount = 0;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public TrendDefinition getDefinition() {
        return definition;
    }

    public String getName() {
        return definition.getName();
    }

    public String getSubsystemName() {
        return subsystemName;
    }

    public int getCapacity() {
        return capacity;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return samples appended over the lifetime of the trend, including
     *         evicted ones
     */
    public long getWriteCount() {
        return writeCount;
    }

    public String getOutputPathPrefix() {
        return outputPathPrefix;
    }

    @Override
    public String toString() {
        return "TrendState{" +
                "name='" + definition.getName() + '\'' +
                ", subsystem='" + subsystemName + '\'' +
                ", size=" + size +
                ", capacity=" + capacity +
                ", writeCount=" + writeCount +
                '}';
    }
}

package com.trendwatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * All histograms of one subsystem available at one processing cycle.
 *
 * <p>
 * Expected JSON shape:
 * </p>
 *
 * <pre>
 * {
 *   "subsystem": "EMC",
 *   "createdAt": "2024-05-01T12:00:00Z",
 *   "histograms": {
 *     "EMCTRQA_histAmp": {"name": "EMCTRQA_histAmp", "lowEdge": 0, "highEdge": 10, "contents": [1, 2]}
 *   }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistogramBatch implements Serializable {

    private static final long serialVersionUID = 1L;

    private String subsystem;

    private Instant createdAt;

    private Map<String, BinnedHistogram> histograms = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public HistogramBatch() {
    }

    public HistogramBatch(String subsystem, Instant createdAt, Map<String, BinnedHistogram> histograms) {
        this.subsystem = Objects.requireNonNull(subsystem, "subsystem must not be null");
        this.createdAt = createdAt;
        setHistograms(histograms);
    }

    public String getSubsystem() {
        return subsystem;
    }

    public void setSubsystem(String subsystem) {
        this.subsystem = subsystem;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * @return unmodifiable view of the histograms keyed by name
     */
    public Map<String, BinnedHistogram> getHistograms() {
        return Collections.unmodifiableMap(histograms);
    }

    public void setHistograms(Map<String, BinnedHistogram> histograms) {
        this.histograms = histograms != null ? new LinkedHashMap<>(histograms) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "HistogramBatch{" +
                "subsystem='" + subsystem + '\'' +
                ", createdAt=" + createdAt +
                ", histograms=" + histograms.keySet() +
                '}';
    }
}

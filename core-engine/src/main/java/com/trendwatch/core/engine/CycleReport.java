package com.trendwatch.core.engine;

import com.trendwatch.core.trend.StepResult;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one processing cycle of one subsystem.
 *
 * <p>
 * Serialized to JSON by the Flink job and published to the trend-updates
 * topic.
 * </p>
 *
 * @since 1.0.0
 */
public class CycleReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private String subsystem;
    private Instant finishedAt;
    private List<String> updated = new ArrayList<>();
    private List<String> skipped = new ArrayList<>();
    private Map<String, String> extractionFailures = new LinkedHashMap<>();
    private Map<String, String> renderFailures = new LinkedHashMap<>();
    private boolean committed;
    private String commitError;
    private boolean cancelled;

    /** No-arg constructor required by Jackson. */
    public CycleReport() {
    }

    private CycleReport(Builder b) {
        this.subsystem = Objects.requireNonNull(b.subsystem, "subsystem must not be null");
        this.finishedAt = Objects.requireNonNull(b.finishedAt, "finishedAt must not be null");
        if (b.processing != null) {
            this.updated = new ArrayList<>(b.processing.getSucceeded());
            this.skipped = new ArrayList<>(b.processing.getSkipped());
            this.extractionFailures = new LinkedHashMap<>(b.processing.getFailed());
        }
        if (b.rendering != null) {
            this.renderFailures = new LinkedHashMap<>(b.rendering.getFailed());
        }
        this.committed = b.committed;
        this.commitError = b.commitError;
        this.cancelled = b.cancelled;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder. {@code subsystem} and {@code finishedAt} are required.
     */
    public static class Builder {
        private String subsystem;
        private Instant finishedAt;
        private StepResult processing;
        private StepResult rendering;
        private boolean committed;
        private String commitError;
        private boolean cancelled;

        public Builder subsystem(String subsystem) {
            this.subsystem = subsystem;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder processing(StepResult processing) {
            this.processing = processing;
            return this;
        }

        public Builder rendering(StepResult rendering) {
            this.rendering = rendering;
            return this;
        }

        public Builder committed(boolean committed) {
            this.committed = committed;
            return this;
        }

        public Builder commitError(String commitError) {
            this.commitError = commitError;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public CycleReport build() {
            return new CycleReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getSubsystem() {
        return subsystem;
    }

    public void setSubsystem(String subsystem) {
        this.subsystem = subsystem;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public List<String> getUpdated() {
        return Collections.unmodifiableList(updated);
    }

    public void setUpdated(List<String> updated) {
        this.updated = updated != null ? new ArrayList<>(updated) : new ArrayList<>();
    }

    public List<String> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    public void setSkipped(List<String> skipped) {
        this.skipped = skipped != null ? new ArrayList<>(skipped) : new ArrayList<>();
    }

    public Map<String, String> getExtractionFailures() {
        return Collections.unmodifiableMap(extractionFailures);
    }

    public void setExtractionFailures(Map<String, String> extractionFailures) {
        this.extractionFailures = extractionFailures != null
                ? new LinkedHashMap<>(extractionFailures)
                : new LinkedHashMap<>();
    }

    public Map<String, String> getRenderFailures() {
        return Collections.unmodifiableMap(renderFailures);
    }

    public void setRenderFailures(Map<String, String> renderFailures) {
        this.renderFailures = renderFailures != null
                ? new LinkedHashMap<>(renderFailures)
                : new LinkedHashMap<>();
    }

    /**
     * @return {@code true} once the cycle's state is durably stored
     */
    public boolean isCommitted() {
        return committed;
    }

    public void setCommitted(boolean committed) {
        this.committed = committed;
    }

    public String getCommitError() {
        return commitError;
    }

    public void setCommitError(String commitError) {
        this.commitError = commitError;
    }

    /**
     * @return {@code true} if the cycle was interrupted and rolled back
     */
    public boolean isCancelled() {
        return cancelled;
    }

    public void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    @Override
    public String toString() {
        return "CycleReport{" +
                "subsystem='" + subsystem + '\'' +
                ", updated=" + updated.size() +
                ", skipped=" + skipped.size() +
                ", extractionFailures=" + extractionFailures.keySet() +
                ", renderFailures=" + renderFailures.keySet() +
                ", committed=" + committed +
                ", cancelled=" + cancelled +
                '}';
    }
}

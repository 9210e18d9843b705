package com.trendwatch.core.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted form of a whole subsystem registry. This is the unit of commit:
 * a store records all of it or none of it.
 *
 * @since 1.0.0
 */
public final class RegistrySnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String subsystemName;
    private final Instant takenAt;
    private final List<TrendSnapshot> trends;

    @JsonCreator
    public RegistrySnapshot(@JsonProperty("subsystemName") String subsystemName,
            @JsonProperty("takenAt") Instant takenAt,
            @JsonProperty("trends") List<TrendSnapshot> trends) {
        this.subsystemName = Objects.requireNonNull(subsystemName, "subsystemName must not be null");
        this.takenAt = takenAt;
        this.trends = trends != null ? List.copyOf(trends) : List.of();
    }

    public String getSubsystemName() {
        return subsystemName;
    }

    public Instant getTakenAt() {
        return takenAt;
    }

    /**
     * @return unmodifiable trend snapshots in registry order
     */
    public List<TrendSnapshot> getTrends() {
        return trends;
    }

    /**
     * @param trendName trend to look up
     * @return that trend's snapshot, if recorded
     */
    @JsonIgnore
    public Optional<TrendSnapshot> getTrend(String trendName) {
        return trends.stream().filter(t -> t.getName().equals(trendName)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegistrySnapshot that))
            return false;
        return subsystemName.equals(that.subsystemName)
                && Objects.equals(takenAt, that.takenAt)
                && trends.equals(that.trends);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subsystemName, takenAt, trends);
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{" +
                "subsystemName='" + subsystemName + '\'' +
                ", takenAt=" + takenAt +
                ", trends=" + trends.size() +
                '}';
    }
}

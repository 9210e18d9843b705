package com.trendwatch.core.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trendwatch.core.model.Sample;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Persisted form of one trend's buffer: samples oldest first plus the total
 * number of samples ever written.
 *
 * @since 1.0.0
 */
public final class TrendSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final int capacity;
    private final long writeCount;
    private final List<Sample> samples;

    @JsonCreator
    public TrendSnapshot(@JsonProperty("name") String name,
            @JsonProperty("capacity") int capacity,
            @JsonProperty("writeCount") long writeCount,
            @JsonProperty("samples") List<Sample> samples) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.capacity = capacity;
        this.writeCount = writeCount;
        this.samples = samples != null ? List.copyOf(samples) : List.of();
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getWriteCount() {
        return writeCount;
    }

    /**
     * @return unmodifiable samples, oldest first
     */
    public List<Sample> getSamples() {
        return samples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendSnapshot that))
            return false;
        return capacity == that.capacity
                && writeCount == that.writeCount
                && name.equals(that.name)
                && samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, capacity, writeCount, samples);
    }

    @Override
    public String toString() {
        return "TrendSnapshot{" +
                "name='" + name + '\'' +
                ", capacity=" + capacity +
                ", writeCount=" + writeCount +
                ", samples=" + samples.size() +
                '}';
    }
}

package com.trendwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One {@code (value, error)} pair extracted from a single histogram snapshot.
 *
 * @since 1.0.0
 */
public final class Sample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double value;
    private final double error;

    @JsonCreator
    public Sample(@JsonProperty("value") double value, @JsonProperty("error") double error) {
        this.value = value;
        this.error = error;
    }

    public static Sample of(double value, double error) {
        return new Sample(value, error);
    }

    public double getValue() {
        return value;
    }

    public double getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(value, that.value) == 0 && Double.compare(error, that.error) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(value) + Double.hashCode(error);
    }

    @Override
    public String toString() {
        return "(" + value + ", " + error + ")";
    }
}

package com.trendwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A plotted point of a trend: {@code x} is the position inside the current
 * buffer (oldest first), {@code y} the extracted value and {@code yError}
 * its error bar.
 *
 * @since 1.0.0
 */
public final class SeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int x;
    private final double y;
    private final double yError;

    @JsonCreator
    public SeriesPoint(@JsonProperty("x") int x,
            @JsonProperty("y") double y,
            @JsonProperty("yError") double yError) {
        this.x = x;
        this.y = y;
        this.yError = yError;
    }

    public static SeriesPoint of(int x, double y, double yError) {
        return new SeriesPoint(x, y, yError);
    }

    @JsonProperty("x")
    public int getX() {
        return x;
    }

    @JsonProperty("y")
    public double getY() {
        return y;
    }

    @JsonProperty("yError")
    public double getYError() {
        return yError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesPoint that))
            return false;
        return x == that.x
                && Double.compare(y, that.y) == 0
                && Double.compare(yError, that.yError) == 0;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        return 31 * result + Double.hashCode(yError);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + " ± " + yError + ")";
    }
}

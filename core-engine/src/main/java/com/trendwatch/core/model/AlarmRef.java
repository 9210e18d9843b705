package com.trendwatch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Opaque reference to an alarm attached to a trend.
 *
 * <p>
 * Alarm evaluation lives outside the trending engine; a trend only stores
 * which alarms belong to it, in attachment order.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlarmRef implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    private AlarmRef(String name) {
        this.name = name;
    }

    /**
     * @param name alarm name; must not be {@code null} or blank
     * @return a reference to the named alarm
     * @throws IllegalArgumentException if {@code name} is null or blank
     */
    public static AlarmRef of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Alarm name must not be null or blank");
        }
        return new AlarmRef(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlarmRef that))
            return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "AlarmRef{" + name + '}';
    }
}

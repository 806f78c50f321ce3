package com.powersentinel.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single parsed reading before it is placed on a regular grid.
 * {@code value} is {@code NaN} when the source marked it missing.
 *
 * @since 1.0.0
 */
public final class RawReading {

    private final LocalDateTime timestamp;
    private final double value;

    public RawReading(LocalDateTime timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public boolean isMissing() {
        return Double.isNaN(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawReading that))
            return false;
        return timestamp.equals(that.timestamp)
                && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "RawReading{" + timestamp + "=" + value + '}';
    }
}

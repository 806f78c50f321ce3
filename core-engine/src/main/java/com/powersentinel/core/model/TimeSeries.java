package com.powersentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Univariate series on a regular time grid.
 *
 * <p>
 * Timestamps are never stored: row {@code i} sits at
 * {@code start + i × step}, so the index is strictly increasing, uniformly
 * spaced and free of duplicates by construction. Missing values are
 * represented as {@link Double#NaN} and queried through
 * {@link #isMissing(int)}.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * The value array is copied on the way in and on the way out. Every
 * transformation returns a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final LocalDateTime start;
    private final Duration step;
    private final double[] values;

    /**
     * @param name   signal name, used as the CSV column header
     * @param start  timestamp of row 0
     * @param step   spacing between rows; must be positive
     * @param values row values, {@code NaN} for missing
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if {@code step} is not positive
     */
    public TimeSeries(String name, LocalDateTime start, Duration step, double[] values) {
        this.name = Objects.requireNonNull(name, "Series name must not be null");
        this.start = Objects.requireNonNull(start, "Series start must not be null");
        this.step = Objects.requireNonNull(step, "Series step must not be null");
        Objects.requireNonNull(values, "Series values must not be null");
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Series step must be positive, got: " + step);
        }
        this.values = values.clone();
    }

    public static TimeSeries of(String name, LocalDateTime start, Duration step, double... values) {
        return new TimeSeries(name, start, step, values);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public LocalDateTime getStart() {
        return start;
    }

    public Duration getStep() {
        return step;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    /**
     * @return a copy of the values, {@code NaN} marking missing rows
     */
    public double[] getValues() {
        return values.clone();
    }

    public double valueAt(int index) {
        return values[index];
    }

    public boolean isMissing(int index) {
        return Double.isNaN(values[index]);
    }

    public LocalDateTime timestampAt(int index) {
        if (index < 0 || index >= values.length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for size " + values.length);
        }
        return start.plus(step.multipliedBy(index));
    }

    /**
     * @return timestamp of the last row
     * @throws IllegalStateException if the series is empty
     */
    public LocalDateTime getEnd() {
        if (values.length == 0) {
            throw new IllegalStateException("Empty series '" + name + "' has no end timestamp");
        }
        return timestampAt(values.length - 1);
    }

    public List<LocalDateTime> getTimestamps() {
        List<LocalDateTime> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            out.add(timestampAt(i));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Locate a timestamp on this grid.
     *
     * @param timestamp timestamp to look up
     * @return row index, or {@code -1} if the timestamp is off-grid or out of
     *         range
     */
    public int indexOf(LocalDateTime timestamp) {
        Duration offset = Duration.between(start, timestamp);
        if (offset.isNegative()) {
            return -1;
        }
        long stepNanos = step.toNanos();
        long offsetNanos = offset.toNanos();
        if (offsetNanos % stepNanos != 0) {
            return -1;
        }
        long index = offsetNanos / stepNanos;
        return index < values.length ? (int) index : -1;
    }

    public int missingCount() {
        int count = 0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Number of rows at the head of the series that are missing. Forward-fill
     * cannot repair these rows because nothing precedes them.
     */
    public int leadingMissingCount() {
        int count = 0;
        while (count < values.length && Double.isNaN(values[count])) {
            count++;
        }
        return count;
    }

    // ---------------------------------------------------------------
    // Derivations
    // ---------------------------------------------------------------

    /**
     * Same grid and name, new values.
     *
     * @throws IllegalArgumentException if the length differs
     */
    public TimeSeries withValues(double[] newValues) {
        if (newValues.length != values.length) {
            throw new IllegalArgumentException("Expected " + values.length
                    + " values for series '" + name + "', got: " + newValues.length);
        }
        return new TimeSeries(name, start, step, newValues);
    }

    public TimeSeries withName(String newName) {
        return new TimeSeries(newName, start, step, values);
    }

    /** First {@code count} rows. */
    public TimeSeries head(int count) {
        if (count < 0 || count > values.length) {
            throw new IllegalArgumentException("head(" + count + ") out of range for size " + values.length);
        }
        return new TimeSeries(name, start, step, Arrays.copyOfRange(values, 0, count));
    }

    /** Rows from {@code fromIndex} (inclusive) to the end. */
    public TimeSeries tail(int fromIndex) {
        if (fromIndex < 0 || fromIndex > values.length) {
            throw new IllegalArgumentException("tail(" + fromIndex + ") out of range for size " + values.length);
        }
        return new TimeSeries(name, start.plus(step.multipliedBy(fromIndex)), step,
                Arrays.copyOfRange(values, fromIndex, values.length));
    }

    /**
     * Rows whose timestamp lies in {@code [from, to]}. An empty range yields
     * an empty series anchored at {@code from}.
     */
    public TimeSeries slice(LocalDateTime from, LocalDateTime to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        int first = 0;
        while (first < values.length && timestampAt(first).isBefore(from)) {
            first++;
        }
        int last = values.length - 1;
        while (last >= first && timestampAt(last).isAfter(to)) {
            last--;
        }
        if (last < first) {
            return new TimeSeries(name, from, step, new double[0]);
        }
        return new TimeSeries(name, timestampAt(first), step, Arrays.copyOfRange(values, first, last + 1));
    }

    public TimeSeries dropLeadingMissing() {
        int leading = leadingMissingCount();
        return leading == 0 ? this : tail(leading);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return name.equals(that.name)
                && start.equals(that.start)
                && step.equals(that.step)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, start, step, Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return "TimeSeries{" +
                "name='" + name + '\'' +
                ", start=" + start +
                ", step=" + step +
                ", size=" + values.length +
                '}';
    }
}

package com.powersentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A base {@link TimeSeries} extended with derived columns on the same grid.
 *
 * <p>
 * Column order is insertion order. Rows where a derived value is undefined
 * (the head of a lag or rolling column) hold {@code NaN}; nothing is
 * fabricated. Every column has exactly as many rows as the base series.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureFrame {

    private final TimeSeries base;
    private final Map<String, double[]> columns;

    public FeatureFrame(TimeSeries base) {
        this(base, new LinkedHashMap<>());
    }

    private FeatureFrame(TimeSeries base, LinkedHashMap<String, double[]> columns) {
        this.base = Objects.requireNonNull(base, "Base series must not be null");
        this.columns = columns;
    }

    public TimeSeries getBase() {
        return base;
    }

    public int size() {
        return base.size();
    }

    /**
     * @return derived column names in insertion order (the base column is
     *         not included)
     */
    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public boolean hasColumn(String name) {
        return base.getName().equals(name) || columns.containsKey(name);
    }

    /**
     * @param name base or derived column name
     * @return a copy of the column values
     * @throws IllegalArgumentException if the column does not exist
     */
    public double[] column(String name) {
        if (base.getName().equals(name)) {
            return base.getValues();
        }
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: '" + name + "'");
        }
        return values.clone();
    }

    /** View a column as a series on the base grid. */
    public TimeSeries columnAsSeries(String name) {
        return new TimeSeries(name, base.getStart(), base.getStep(), column(name));
    }

    /**
     * Return a new frame with one more column.
     *
     * @throws IllegalArgumentException if the name is taken or the length
     *                                  differs from the base series
     */
    public FeatureFrame withColumn(String name, double[] values) {
        Objects.requireNonNull(name, "Column name must not be null");
        Objects.requireNonNull(values, "Column values must not be null");
        if (hasColumn(name)) {
            throw new IllegalArgumentException("Duplicate column: '" + name + "'");
        }
        if (values.length != base.size()) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                    + " rows, base series has " + base.size());
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.put(name, values.clone());
        return new FeatureFrame(base, copy);
    }

    @Override
    public String toString() {
        return "FeatureFrame{" +
                "base=" + base.getName() +
                ", rows=" + base.size() +
                ", columns=" + columns.keySet() +
                '}';
    }
}

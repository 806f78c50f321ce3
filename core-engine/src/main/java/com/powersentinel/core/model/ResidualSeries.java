package com.powersentinel.core.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Residuals ({@code actual − forecast}) over the timestamps shared by an
 * actual and a forecast series.
 *
 * <p>
 * Only timestamps present in both series with a defined value on both sides
 * take part. Everything else is excluded from the residuals and from the
 * universe of points a detector may flag; nothing is imputed.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResidualSeries {

    private final List<LocalDateTime> timestamps;
    private final double[] actual;
    private final double[] forecast;
    private final double[] residuals;

    private ResidualSeries(List<LocalDateTime> timestamps, double[] actual, double[] forecast) {
        this.timestamps = Collections.unmodifiableList(timestamps);
        this.actual = actual;
        this.forecast = forecast;
        this.residuals = new double[actual.length];
        for (int i = 0; i < actual.length; i++) {
            residuals[i] = actual[i] - forecast[i];
        }
    }

    /**
     * Restrict both series to their common, defined index and subtract.
     *
     * @param actual   observed series
     * @param forecast predicted series
     * @return aligned residuals, possibly empty
     */
    public static ResidualSeries align(TimeSeries actual, TimeSeries forecast) {
        Objects.requireNonNull(actual, "Actual series must not be null");
        Objects.requireNonNull(forecast, "Forecast series must not be null");

        List<LocalDateTime> shared = new ArrayList<>();
        double[] a = new double[actual.size()];
        double[] f = new double[actual.size()];
        int n = 0;
        for (int i = 0; i < actual.size(); i++) {
            if (actual.isMissing(i)) {
                continue;
            }
            LocalDateTime ts = actual.timestampAt(i);
            int j = forecast.indexOf(ts);
            if (j < 0 || forecast.isMissing(j)) {
                continue;
            }
            shared.add(ts);
            a[n] = actual.valueAt(i);
            f[n] = forecast.valueAt(j);
            n++;
        }
        return new ResidualSeries(shared, Arrays.copyOf(a, n), Arrays.copyOf(f, n));
    }

    public int size() {
        return residuals.length;
    }

    public boolean isEmpty() {
        return residuals.length == 0;
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public LocalDateTime timestampAt(int index) {
        return timestamps.get(index);
    }

    public double actualAt(int index) {
        return actual[index];
    }

    public double forecastAt(int index) {
        return forecast[index];
    }

    public double residualAt(int index) {
        return residuals[index];
    }

    /** @return a copy of the residual values */
    public double[] getResiduals() {
        return residuals.clone();
    }

    @Override
    public String toString() {
        return "ResidualSeries{size=" + residuals.length
                + (residuals.length > 0 ? ", from=" + timestamps.get(0) + ", to=" + timestamps.get(residuals.length - 1) : "")
                + '}';
    }
}

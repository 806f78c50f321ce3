package com.powersentinel.core.feature;

import com.powersentinel.core.config.FeatureSettings;
import com.powersentinel.core.model.FeatureFrame;
import com.powersentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Derives lag, rolling-mean, Fourier and calendar columns from a base series.
 *
 * <h3>Column naming</h3>
 * <ul>
 * <li>{@code <name>_lag_<k>}: value shifted by {@code k} rows</li>
 * <li>{@code <name>_rolling_mean_<w>}: trailing mean over {@code w} rows</li>
 * <li>{@code sin_<i>} / {@code cos_<i>}: harmonic {@code i} of the seasonal
 * period, evaluated at the zero-based row index</li>
 * <li>{@code hour} / {@code day_of_week}: calendar position of the row
 * (Monday = 0)</li>
 * </ul>
 *
 * <p>
 * Columns are appended in the order the lists are given. Rows that a lag or
 * window cannot reach hold {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureAugmenter {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureAugmenter.class);

    public static final String HOUR_COLUMN = "hour";
    public static final String DAY_OF_WEEK_COLUMN = "day_of_week";

    private FeatureAugmenter() {
        // utility class — not instantiable
    }

    /**
     * Apply every feature family configured in {@code settings}.
     */
    public static FeatureFrame augment(TimeSeries series, FeatureSettings settings) {
        Objects.requireNonNull(settings, "FeatureSettings must not be null");
        FeatureFrame frame = augment(series, settings.getLags(), settings.getRollingWindows(),
                settings.getFourierPeriod(), settings.getFourierOrder());
        if (settings.isCalendarFeatures()) {
            frame = addCalendarFeatures(frame);
        }
        return frame;
    }

    public static FeatureFrame augment(TimeSeries series, List<Integer> lags, List<Integer> windows,
            int fourierPeriod, int fourierOrder) {
        Objects.requireNonNull(series, "Series must not be null");
        FeatureFrame frame = new FeatureFrame(series);
        frame = addLagFeatures(frame, lags);
        frame = addRollingFeatures(frame, windows);
        frame = addFourierFeatures(frame, fourierPeriod, fourierOrder);
        LOG.debug("Augmented '{}' with {} derived column(s)", series.getName(), frame.getColumnNames().size());
        return frame;
    }

    public static FeatureFrame addLagFeatures(FeatureFrame frame, List<Integer> lags) {
        TimeSeries base = frame.getBase();
        FeatureFrame result = frame;
        for (int k : lags) {
            result = result.withColumn(base.getName() + "_lag_" + k, lag(base.getValues(), k));
        }
        return result;
    }

    public static FeatureFrame addRollingFeatures(FeatureFrame frame, List<Integer> windows) {
        TimeSeries base = frame.getBase();
        FeatureFrame result = frame;
        for (int w : windows) {
            result = result.withColumn(base.getName() + "_rolling_mean_" + w, rollingMean(base.getValues(), w));
        }
        return result;
    }

    /**
     * @param period seasonal period in rows, &gt; 0
     * @param order  number of harmonics, &gt;= 0; zero adds nothing
     */
    public static FeatureFrame addFourierFeatures(FeatureFrame frame, int period, int order) {
        if (period <= 0) {
            throw new IllegalArgumentException("Fourier period must be > 0, got: " + period);
        }
        if (order < 0) {
            throw new IllegalArgumentException("Fourier order must be >= 0, got: " + order);
        }
        int n = frame.size();
        FeatureFrame result = frame;
        for (int i = 1; i <= order; i++) {
            double[] sin = new double[n];
            double[] cos = new double[n];
            for (int t = 0; t < n; t++) {
                double angle = 2 * Math.PI * i * t / period;
                sin[t] = Math.sin(angle);
                cos[t] = Math.cos(angle);
            }
            result = result.withColumn("sin_" + i, sin).withColumn("cos_" + i, cos);
        }
        return result;
    }

    public static FeatureFrame addCalendarFeatures(FeatureFrame frame) {
        TimeSeries base = frame.getBase();
        double[] hour = new double[base.size()];
        double[] dayOfWeek = new double[base.size()];
        for (int i = 0; i < base.size(); i++) {
            LocalDateTime ts = base.timestampAt(i);
            hour[i] = ts.getHour();
            dayOfWeek[i] = ts.getDayOfWeek().getValue() - 1;
        }
        return frame.withColumn(HOUR_COLUMN, hour).withColumn(DAY_OF_WEEK_COLUMN, dayOfWeek);
    }

    // ---------------------------------------------------------------
    // Column kernels
    // ---------------------------------------------------------------

    /**
     * Shift {@code values} forward by {@code k} rows; the first {@code k}
     * rows are {@code NaN}.
     */
    public static double[] lag(double[] values, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("Lag must be > 0, got: " + k);
        }
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        for (int i = k; i < values.length; i++) {
            out[i] = values[i - k];
        }
        return out;
    }

    /**
     * Trailing mean over {@code window} rows ending at each row. Undefined
     * (NaN) for the first {@code window - 1} rows and wherever the window
     * contains a missing value.
     */
    public static double[] rollingMean(double[] values, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Rolling window must be > 0, got: " + window);
        }
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        double sum = 0;
        int missing = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                missing++;
            } else {
                sum += values[i];
            }
            if (i >= window) {
                double dropped = values[i - window];
                if (Double.isNaN(dropped)) {
                    missing--;
                } else {
                    sum -= dropped;
                }
            }
            if (i >= window - 1 && missing == 0) {
                out[i] = sum / window;
            }
        }
        return out;
    }
}

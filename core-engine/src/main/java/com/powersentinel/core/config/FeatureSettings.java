package com.powersentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Which derived columns the feature stage adds.
 *
 * @since 1.0.0
 */
public class FeatureSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Lag offsets in periods. */
    private List<Integer> lags = new ArrayList<>(List.of(1, 2, 3, 24));

    /** Trailing rolling-mean window sizes in periods. */
    private List<Integer> rollingWindows = new ArrayList<>(List.of(3, 6, 24));

    /** Seasonal period of the Fourier terms, in periods. */
    private int fourierPeriod = 24;

    /** Number of sin/cos harmonic pairs; 0 disables Fourier terms. */
    private int fourierOrder = 3;

    /** Add {@code hour} and {@code day_of_week} columns. */
    private boolean calendarFeatures = true;

    /**
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkPositiveDistinct("lags", lags, errors);
        checkPositiveDistinct("rollingWindows", rollingWindows, errors);
        if (fourierPeriod <= 0) {
            errors.add("'fourierPeriod' must be > 0, got: " + fourierPeriod);
        }
        if (fourierOrder < 0) {
            errors.add("'fourierOrder' must be >= 0, got: " + fourierOrder);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid feature settings: " + String.join("; ", errors));
        }
    }

    private static void checkPositiveDistinct(String name, List<Integer> values, List<String> errors) {
        if (values == null) {
            errors.add("'" + name + "' must not be null");
            return;
        }
        for (Integer v : values) {
            if (v == null || v <= 0) {
                errors.add("'" + name + "' entries must be > 0, got: " + v);
            }
        }
        if (new HashSet<>(values).size() != values.size()) {
            errors.add("'" + name + "' contains duplicates: " + values);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<Integer> getLags() {
        return lags;
    }

    public void setLags(List<Integer> lags) {
        this.lags = lags != null ? new ArrayList<>(lags) : new ArrayList<>();
    }

    public List<Integer> getRollingWindows() {
        return rollingWindows;
    }

    public void setRollingWindows(List<Integer> rollingWindows) {
        this.rollingWindows = rollingWindows != null ? new ArrayList<>(rollingWindows) : new ArrayList<>();
    }

    public int getFourierPeriod() {
        return fourierPeriod;
    }

    public void setFourierPeriod(int fourierPeriod) {
        this.fourierPeriod = fourierPeriod;
    }

    public int getFourierOrder() {
        return fourierOrder;
    }

    public void setFourierOrder(int fourierOrder) {
        this.fourierOrder = fourierOrder;
    }

    public boolean isCalendarFeatures() {
        return calendarFeatures;
    }

    public void setCalendarFeatures(boolean calendarFeatures) {
        this.calendarFeatures = calendarFeatures;
    }

    @Override
    public String toString() {
        return "FeatureSettings{" +
                "lags=" + lags +
                ", rollingWindows=" + rollingWindows +
                ", fourierPeriod=" + fourierPeriod +
                ", fourierOrder=" + fourierOrder +
                ", calendarFeatures=" + calendarFeatures +
                '}';
    }
}

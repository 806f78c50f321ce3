package com.powersentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parameters shared by the anomaly strategies.
 *
 * <p>
 * Supported strategy names:
 * </p>
 * <ul>
 * <li>{@code residual} — |actual − forecast| above
 * {@code thresholdMultiplier × σ}</li>
 * <li>{@code isolation_forest} — isolation forest on the residuals with the
 * given {@code contamination}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> strategies = new ArrayList<>(List.of("residual", "isolation_forest"));

    /** Lower values flag more points. */
    private double thresholdMultiplier = 3.0;

    /** Expected fraction of outliers, in (0, 0.5]. */
    private double contamination = 0.01;

    /** Isolation forest seed; fixed so that reruns flag the same points. */
    private long seed = 42L;

    private int trees = 100;

    /** Sub-sample drawn for each isolation tree (capped at the data size). */
    private int sampleSize = 256;

    /**
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (strategies == null || strategies.isEmpty()) {
            errors.add("'strategies' must name at least one strategy");
        } else {
            for (String s : strategies) {
                if (s == null || s.isBlank()) {
                    errors.add("'strategies' entries must not be blank");
                }
            }
        }
        if (!(thresholdMultiplier > 0) || Double.isInfinite(thresholdMultiplier)) {
            errors.add("'thresholdMultiplier' must be a finite value > 0, got: " + thresholdMultiplier);
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            errors.add("'contamination' must be in (0, 0.5], got: " + contamination);
        }
        if (trees < 1) {
            errors.add("'trees' must be >= 1, got: " + trees);
        }
        if (sampleSize < 2) {
            errors.add("'sampleSize' must be >= 2, got: " + sampleSize);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid detection settings: " + String.join("; ", errors));
        }
    }

    /** Default settings with a different threshold multiplier. */
    public static DetectionSettings withThresholdMultiplier(double multiplier) {
        DetectionSettings settings = new DetectionSettings();
        settings.setThresholdMultiplier(multiplier);
        settings.validate();
        return settings;
    }

    /** Default settings with a different contamination. */
    public static DetectionSettings withContamination(double contamination) {
        DetectionSettings settings = new DetectionSettings();
        settings.setContamination(contamination);
        settings.validate();
        return settings;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<String> getStrategies() {
        return strategies;
    }

    /**
     * Set the strategy names, normalised to lowercase.
     */
    public void setStrategies(List<String> strategies) {
        this.strategies = new ArrayList<>();
        if (strategies != null) {
            for (String s : strategies) {
                this.strategies.add(s != null ? s.toLowerCase(Locale.ROOT) : null);
            }
        }
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    public void setThresholdMultiplier(double thresholdMultiplier) {
        this.thresholdMultiplier = thresholdMultiplier;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getTrees() {
        return trees;
    }

    public void setTrees(int trees) {
        this.trees = trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "strategies=" + strategies +
                ", thresholdMultiplier=" + thresholdMultiplier +
                ", contamination=" + contamination +
                ", seed=" + seed +
                ", trees=" + trees +
                ", sampleSize=" + sampleSize +
                '}';
    }
}

package com.powersentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Grid-search space and fitting budget of the ARIMA stage.
 *
 * @since 1.0.0
 */
public class ForecastSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Candidate autoregressive orders (p). */
    private List<Integer> arOrders = new ArrayList<>(List.of(0, 1, 2));
    /** Candidate differencing orders (d). */
    private List<Integer> differencingOrders = new ArrayList<>(List.of(0, 1));
    /** Candidate moving-average orders (q). */
    private List<Integer> maOrders = new ArrayList<>(List.of(0, 1, 2));

    /** Fraction of the series used for training; the rest is the test window. */
    private double trainFraction = 0.8;

    /** Worker threads for the grid search. */
    private int searchParallelism = 1;

    /** Objective evaluations allowed per fit before it counts as non-convergent. */
    private int maxEvaluations = 5000;

    /** Per-candidate wall-clock limit; 0 disables it. */
    private long trialTimeoutSeconds = 0;

    /**
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkNonNegative("arOrders", arOrders, errors);
        checkNonNegative("differencingOrders", differencingOrders, errors);
        checkNonNegative("maOrders", maOrders, errors);
        if (!(trainFraction > 0 && trainFraction < 1)) {
            errors.add("'trainFraction' must be in (0, 1), got: " + trainFraction);
        }
        if (searchParallelism < 1) {
            errors.add("'searchParallelism' must be >= 1, got: " + searchParallelism);
        }
        if (maxEvaluations < 1) {
            errors.add("'maxEvaluations' must be >= 1, got: " + maxEvaluations);
        }
        if (trialTimeoutSeconds < 0) {
            errors.add("'trialTimeoutSeconds' must be >= 0, got: " + trialTimeoutSeconds);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid forecast settings: " + String.join("; ", errors));
        }
    }

    private static void checkNonNegative(String name, List<Integer> values, List<String> errors) {
        if (values == null || values.isEmpty()) {
            errors.add("'" + name + "' must contain at least one value");
            return;
        }
        for (Integer v : values) {
            if (v == null || v < 0) {
                errors.add("'" + name + "' entries must be >= 0, got: " + v);
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<Integer> getArOrders() {
        return arOrders;
    }

    public void setArOrders(List<Integer> arOrders) {
        this.arOrders = arOrders != null ? new ArrayList<>(arOrders) : new ArrayList<>();
    }

    public List<Integer> getDifferencingOrders() {
        return differencingOrders;
    }

    public void setDifferencingOrders(List<Integer> differencingOrders) {
        this.differencingOrders = differencingOrders != null ? new ArrayList<>(differencingOrders) : new ArrayList<>();
    }

    public List<Integer> getMaOrders() {
        return maOrders;
    }

    public void setMaOrders(List<Integer> maOrders) {
        this.maOrders = maOrders != null ? new ArrayList<>(maOrders) : new ArrayList<>();
    }

    public double getTrainFraction() {
        return trainFraction;
    }

    public void setTrainFraction(double trainFraction) {
        this.trainFraction = trainFraction;
    }

    public int getSearchParallelism() {
        return searchParallelism;
    }

    public void setSearchParallelism(int searchParallelism) {
        this.searchParallelism = searchParallelism;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    public void setMaxEvaluations(int maxEvaluations) {
        this.maxEvaluations = maxEvaluations;
    }

    public long getTrialTimeoutSeconds() {
        return trialTimeoutSeconds;
    }

    public void setTrialTimeoutSeconds(long trialTimeoutSeconds) {
        this.trialTimeoutSeconds = trialTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "ForecastSettings{" +
                "arOrders=" + arOrders +
                ", differencingOrders=" + differencingOrders +
                ", maOrders=" + maOrders +
                ", trainFraction=" + trainFraction +
                ", searchParallelism=" + searchParallelism +
                ", maxEvaluations=" + maxEvaluations +
                ", trialTimeoutSeconds=" + trialTimeoutSeconds +
                '}';
    }
}

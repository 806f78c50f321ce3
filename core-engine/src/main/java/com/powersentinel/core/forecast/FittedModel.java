package com.powersentinel.core.forecast;

import com.powersentinel.core.model.ModelOrder;

import java.io.Serializable;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;

/**
 * An ARIMA model fitted to one training series.
 *
 * <p>
 * Immutable. Holds the estimated coefficients together with the tail of the
 * training data that the forecast recursion and the integration of the
 * differenced predictions need, so the training series itself is not
 * retained.
 * </p>
 *
 * @since 1.0.0
 */
public final class FittedModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ModelOrder order;
    private final String seriesName;
    private final LocalDateTime trainingEnd;
    private final Duration step;
    private final int observations;

    private final double intercept;
    private final double[] arCoefficients;
    private final double[] maCoefficients;
    private final double sigma2;
    private final double logLikelihood;
    private final double aic;

    /** Last p values of the differenced series, oldest first. */
    private final double[] lastDifferenced;
    /** Last q in-sample innovations, oldest first. */
    private final double[] lastInnovations;
    /** Last value of each differencing level 0..d-1. */
    private final double[] integrationTail;

    FittedModel(ModelOrder order, String seriesName, LocalDateTime trainingEnd, Duration step, int observations,
            double intercept, double[] arCoefficients, double[] maCoefficients, double sigma2,
            double logLikelihood, double aic, double[] lastDifferenced, double[] lastInnovations,
            double[] integrationTail) {
        this.order = order;
        this.seriesName = seriesName;
        this.trainingEnd = trainingEnd;
        this.step = step;
        this.observations = observations;
        this.intercept = intercept;
        this.arCoefficients = arCoefficients.clone();
        this.maCoefficients = maCoefficients.clone();
        this.sigma2 = sigma2;
        this.logLikelihood = logLikelihood;
        this.aic = aic;
        this.lastDifferenced = lastDifferenced.clone();
        this.lastInnovations = lastInnovations.clone();
        this.integrationTail = integrationTail.clone();
    }

    /**
     * Point predictions for the next {@code horizon} steps; future
     * innovations are taken as zero.
     */
    double[] predict(int horizon) {
        int p = order.getP();
        int q = order.getQ();

        double[] w = new double[p + horizon];
        System.arraycopy(lastDifferenced, 0, w, 0, p);
        double[] e = new double[q + horizon];
        System.arraycopy(lastInnovations, 0, e, 0, q);

        double[] differenced = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            double value = intercept;
            for (int i = 1; i <= p; i++) {
                value += arCoefficients[i - 1] * (w[p + h - i] - intercept);
            }
            for (int j = 1; j <= q; j++) {
                value += maCoefficients[j - 1] * e[q + h - j];
            }
            w[p + h] = value;
            differenced[h] = value;
        }

        double[] level = differenced;
        for (int k = integrationTail.length - 1; k >= 0; k--) {
            double[] integrated = new double[horizon];
            double previous = integrationTail[k];
            for (int h = 0; h < horizon; h++) {
                previous += level[h];
                integrated[h] = previous;
            }
            level = integrated;
        }
        return level;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public ModelOrder getOrder() {
        return order;
    }

    public String getSeriesName() {
        return seriesName;
    }

    public LocalDateTime getTrainingEnd() {
        return trainingEnd;
    }

    public Duration getStep() {
        return step;
    }

    /** Number of training observations the model was fitted on. */
    public int getObservations() {
        return observations;
    }

    /** Mean of the differenced series; always 0 when d &gt; 0. */
    public double getIntercept() {
        return intercept;
    }

    public double[] getArCoefficients() {
        return arCoefficients.clone();
    }

    public double[] getMaCoefficients() {
        return maCoefficients.clone();
    }

    /** Innovation variance; the basis for interval bounds. */
    public double sigma2() {
        return sigma2;
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    public double getAic() {
        return aic;
    }

    @Override
    public String toString() {
        return "FittedModel{order=" + order
                + ", series='" + seriesName + '\''
                + ", intercept=" + intercept
                + ", ar=" + Arrays.toString(arCoefficients)
                + ", ma=" + Arrays.toString(maCoefficients)
                + ", sigma2=" + sigma2
                + ", aic=" + aic
                + '}';
    }
}

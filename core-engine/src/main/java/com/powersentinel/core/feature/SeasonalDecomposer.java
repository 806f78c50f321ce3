package com.powersentinel.core.feature;

import com.powersentinel.core.error.InsufficientDataException;
import com.powersentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Classical moving-average seasonal decomposition.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Trend: centred moving average of length {@code period}; for an even
 * period the outer two weights are halved (a 2&times;{@code period} MA), so
 * {@code period / 2} rows at each edge are undefined.</li>
 * <li>Detrend: observed &minus; trend (additive) or observed / trend
 * (multiplicative).</li>
 * <li>Seasonal: mean of the detrended values per phase
 * ({@code row mod period}), centred to sum zero (additive) or mean one
 * (multiplicative), then tiled over the series.</li>
 * <li>Residual: what remains after removing trend and seasonal.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecomposer.class);

    private SeasonalDecomposer() {
        // utility class — not instantiable
    }

    /**
     * @param series observed series, fully defined
     * @param period seasonal period in rows, &gt;= 2
     * @param model  additive or multiplicative combination
     * @throws InsufficientDataException if the series is shorter than two
     *                                   full periods
     * @throws IllegalArgumentException  if the series has missing values, the
     *                                   period is invalid, or a
     *                                   multiplicative decomposition sees a
     *                                   non-positive value
     */
    public static Decomposition decompose(TimeSeries series, int period, DecompositionModel model) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(model, "DecompositionModel must not be null");
        if (period < 2) {
            throw new IllegalArgumentException("Decomposition period must be >= 2, got: " + period);
        }
        if (series.size() < 2 * period) {
            throw new InsufficientDataException("Seasonal decomposition with period " + period,
                    series.size(), 2 * period);
        }
        if (series.missingCount() > 0) {
            throw new IllegalArgumentException("Series '" + series.getName() + "' has "
                    + series.missingCount() + " missing value(s); fill before decomposing");
        }
        double[] observed = series.getValues();
        boolean multiplicative = model == DecompositionModel.MULTIPLICATIVE;
        if (multiplicative) {
            for (double v : observed) {
                if (v <= 0) {
                    throw new IllegalArgumentException(
                            "Multiplicative decomposition requires strictly positive values, got: " + v);
                }
            }
        }

        int n = observed.length;
        double[] trend = centredMovingAverage(observed, period);

        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = multiplicative ? observed[i] / trend[i] : observed[i] - trend[i];
        }

        double[] phaseMeans = new double[period];
        for (int phase = 0; phase < period; phase++) {
            double sum = 0;
            int count = 0;
            for (int i = phase; i < n; i += period) {
                if (!Double.isNaN(detrended[i])) {
                    sum += detrended[i];
                    count++;
                }
            }
            phaseMeans[phase] = count == 0 ? Double.NaN : sum / count;
        }
        double centre = Arrays.stream(phaseMeans).average().orElse(multiplicative ? 1 : 0);
        for (int phase = 0; phase < period; phase++) {
            phaseMeans[phase] = multiplicative ? phaseMeans[phase] / centre : phaseMeans[phase] - centre;
        }

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = phaseMeans[i % period];
            residual[i] = multiplicative
                    ? observed[i] / (trend[i] * seasonal[i])
                    : observed[i] - trend[i] - seasonal[i];
        }

        LOG.debug("Decomposed '{}' ({} rows, period {}, {})", series.getName(), n, period, model);
        String name = series.getName();
        return new Decomposition(model, period, series,
                new TimeSeries(name + "_trend", series.getStart(), series.getStep(), trend),
                new TimeSeries(name + "_seasonal", series.getStart(), series.getStep(), seasonal),
                new TimeSeries(name + "_residual", series.getStart(), series.getStep(), residual));
    }

    static double[] centredMovingAverage(double[] values, int period) {
        double[] weights;
        if (period % 2 == 0) {
            weights = new double[period + 1];
            Arrays.fill(weights, 1.0 / period);
            weights[0] = 0.5 / period;
            weights[period] = 0.5 / period;
        } else {
            weights = new double[period];
            Arrays.fill(weights, 1.0 / period);
        }
        int half = weights.length / 2;
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        for (int i = half; i < values.length - half; i++) {
            double sum = 0;
            for (int j = 0; j < weights.length; j++) {
                sum += weights[j] * values[i - half + j];
            }
            out[i] = sum;
        }
        return out;
    }
}

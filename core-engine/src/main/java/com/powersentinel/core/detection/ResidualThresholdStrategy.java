package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionSettings;
import com.powersentinel.core.error.InsufficientDataException;
import com.powersentinel.core.model.Anomaly;
import com.powersentinel.core.model.AnomalySet;
import com.powersentinel.core.model.ResidualSeries;
import com.powersentinel.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags residuals larger than a multiple of their own standard deviation.
 *
 * <p>
 * The deviation is the sample standard deviation (n − 1 denominator) of the
 * residuals over the aligned window. A point is anomalous when
 * {@code |residual| > thresholdMultiplier × σ}; its score is
 * {@code |residual| / σ}.
 * </p>
 *
 * <h3>Minimum data</h3>
 * <p>
 * At least {@value #MIN_POINTS} aligned points are required, since σ is
 * undefined below that; fewer raise {@link InsufficientDataException}
 * instead of silently returning nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class ResidualThresholdStrategy implements AnomalyStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ResidualThresholdStrategy.class);

    public static final String NAME = "residual";

    static final int MIN_POINTS = 2;

    @Override
    public AnomalySet detect(TimeSeries actual, TimeSeries forecast, DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        double multiplier = settings.getThresholdMultiplier();
        if (!(multiplier > 0)) {
            throw new IllegalArgumentException("thresholdMultiplier must be > 0, got: " + multiplier);
        }

        ResidualSeries residuals = ResidualSeries.align(actual, forecast);
        if (residuals.size() < MIN_POINTS) {
            throw new InsufficientDataException("Residual standard deviation", residuals.size(), MIN_POINTS);
        }

        double std = new StandardDeviation().evaluate(residuals.getResiduals());
        double threshold = multiplier * std;

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < residuals.size(); i++) {
            double residual = residuals.residualAt(i);
            double magnitude = Math.abs(residual);
            if (magnitude > threshold) {
                double score = std > 0 ? magnitude / std : Double.POSITIVE_INFINITY;
                LOG.trace("Residual anomaly at {}: residual={} threshold={}", residuals.timestampAt(i), residual,
                        threshold);
                anomalies.add(new Anomaly(residuals.timestampAt(i), residuals.actualAt(i),
                        residuals.forecastAt(i), residual, score));
            }
        }

        LOG.info("Strategy [{}]: {} of {} aligned point(s) flagged (std={}, multiplier={})",
                NAME, anomalies.size(), residuals.size(), std, multiplier);
        return new AnomalySet(NAME, residuals.size(), anomalies);
    }

    @Override
    public String getName() {
        return NAME;
    }
}

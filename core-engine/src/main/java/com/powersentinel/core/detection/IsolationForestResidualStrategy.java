package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionSettings;
import com.powersentinel.core.error.InsufficientDataException;
import com.powersentinel.core.model.Anomaly;
import com.powersentinel.core.model.AnomalySet;
import com.powersentinel.core.model.ResidualSeries;
import com.powersentinel.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags residuals that an isolation forest isolates unusually quickly.
 *
 * <p>
 * The forest is grown on the one-dimensional residual series itself. The
 * decision offset is the {@code contamination} quantile (linear
 * interpolation) of the negated anomaly scores; points whose negated score
 * falls below it are outliers, so roughly a {@code contamination} fraction of
 * the aligned points is flagged. Each anomaly's score is its forest score in
 * (0, 1].
 * </p>
 *
 * <h3>Reproducibility</h3>
 * <p>
 * Tree growth is driven by {@link DetectionSettings#getSeed()}; the same
 * inputs and settings always yield the same set.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestResidualStrategy implements AnomalyStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestResidualStrategy.class);

    public static final String NAME = "isolation_forest";

    static final int MIN_POINTS = 2;

    @Override
    public AnomalySet detect(TimeSeries actual, TimeSeries forecast, DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        double contamination = settings.getContamination();
        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }

        ResidualSeries residuals = ResidualSeries.align(actual, forecast);
        if (residuals.size() < MIN_POINTS) {
            throw new InsufficientDataException("Isolation forest detection", residuals.size(), MIN_POINTS);
        }

        double[] values = residuals.getResiduals();
        IsolationForest forest = IsolationForest.fit(values, settings.getTrees(), settings.getSampleSize(),
                settings.getSeed());

        double[] scores = new double[values.length];
        double[] negated = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = forest.score(values[i]);
            negated[i] = -scores[i];
        }
        double offset = new Percentile(100 * contamination)
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(negated);

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (negated[i] < offset) {
                anomalies.add(new Anomaly(residuals.timestampAt(i), residuals.actualAt(i),
                        residuals.forecastAt(i), values[i], scores[i]));
            }
        }

        LOG.info("Strategy [{}]: {} of {} aligned point(s) flagged (contamination={}, offset={})",
                NAME, anomalies.size(), residuals.size(), contamination, offset);
        return new AnomalySet(NAME, residuals.size(), anomalies);
    }

    @Override
    public String getName() {
        return NAME;
    }
}

package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionSettings;
import com.powersentinel.core.model.AnomalySet;
import com.powersentinel.core.model.ResidualSeries;
import com.powersentinel.core.model.TimeSeries;

/**
 * Contract for all anomaly strategies.
 * <p>
 * A strategy compares an actual series with a forecast of it and flags the
 * timestamps whose residual looks anomalous. Both inputs are first
 * restricted to their common, fully defined timestamps
 * ({@link ResidualSeries#align}); anything outside that intersection is
 * neither a residual nor an anomaly candidate.
 * </p>
 * <p>
 * Strategies are stateless and independent of one another; running several
 * over the same inputs implies no precedence between their results.
 * </p>
 */
public interface AnomalyStrategy {

    /**
     * Flag anomalous points of {@code actual} relative to {@code forecast}.
     *
     * @param actual   observed series
     * @param forecast predictions, aligned to {@code actual} by timestamp
     * @param settings strategy parameters
     * @return the flagged points, in timestamp order
     */
    AnomalySet detect(TimeSeries actual, TimeSeries forecast, DetectionSettings settings);

    /**
     * Return the registered name of this strategy.
     *
     * @return strategy name
     */
    String getName();
}

package com.powersentinel.core.detection;

import com.powersentinel.core.config.DetectionSettings;
import com.powersentinel.core.error.InsufficientDataException;
import com.powersentinel.core.model.AnomalySet;
import com.powersentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForestResidualStrategy} and
 * {@link IsolationForest}.
 */
class IsolationForestResidualStrategyTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2007, 6, 1, 0, 0);
    private static final Duration HOUR = Duration.ofHours(1);
    private static final int SPIKE = 120;

    private final IsolationForestResidualStrategy strategy = new IsolationForestResidualStrategy();

    @Test
    @DisplayName("Should flag an isolated residual spike")
    void shouldFlagSpike() {
        AnomalySet anomalies = strategy.detect(actualWithSpike(), flatForecast(), new DetectionSettings());

        assertThat(anomalies.getStrategy()).isEqualTo(IsolationForestResidualStrategy.NAME);
        assertThat(anomalies.getEligibleCount()).isEqualTo(200);
        assertThat(anomalies.contains(T0.plusHours(SPIKE))).isTrue();
        assertThat(anomalies.size()).isBetween(1, 4);
        assertThat(anomalies.getAnomalies()).allSatisfy(a -> assertThat(a.getScore()).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("Should yield the same anomaly set for the same inputs and seed")
    void shouldBeReproducible() {
        DetectionSettings settings = DetectionSettings.withContamination(0.05);

        AnomalySet first = strategy.detect(actualWithSpike(), flatForecast(), settings);
        AnomalySet second = strategy.detect(actualWithSpike(), flatForecast(), settings);

        assertThat(second.getAnomalies()).isEqualTo(first.getAnomalies());
    }

    @Test
    @DisplayName("Should flag roughly the contamination fraction of points")
    void shouldRespectContamination() {
        AnomalySet anomalies = strategy.detect(actualWithSpike(), flatForecast(),
                DetectionSettings.withContamination(0.1));

        assertThat(anomalies.size()).isBetween(15, 25);
    }

    @Test
    @DisplayName("Should fail when fewer than two points align")
    void shouldRequireTwoAlignedPoints() {
        TimeSeries actual = TimeSeries.of("kw", T0, HOUR, 1.0);

        assertThatThrownBy(() -> strategy.detect(actual, actual, new DetectionSettings()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Should use the standard average path length normalisation")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    @DisplayName("Should score an extreme value higher than a typical one")
    void shouldScoreOutlierHigher() {
        double[] data = new double[100];
        for (int i = 0; i < data.length; i++) {
            data[i] = i % 10;
        }
        data[99] = 1_000;

        IsolationForest forest = IsolationForest.fit(data, 100, 64, 42L);

        assertThat(forest.score(1_000)).isGreaterThan(forest.score(5));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TimeSeries actualWithSpike() {
        Random random = new Random(3L);
        double[] values = new double[200];
        for (int i = 0; i < values.length; i++) {
            values[i] = 5 + 0.2 * random.nextGaussian();
        }
        values[SPIKE] = 25;
        return new TimeSeries("kw", T0, HOUR, values);
    }

    private static TimeSeries flatForecast() {
        double[] values = new double[200];
        Arrays.fill(values, 5);
        return new TimeSeries("kw", T0, HOUR, values);
    }
}

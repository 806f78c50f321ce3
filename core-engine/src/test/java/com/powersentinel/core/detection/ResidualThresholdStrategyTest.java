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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ResidualThresholdStrategy}.
 */
class ResidualThresholdStrategyTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2007, 6, 1, 0, 0);
    private static final Duration HOUR = Duration.ofHours(1);

    private final ResidualThresholdStrategy strategy = new ResidualThresholdStrategy();

    @Test
    @DisplayName("Should flag only the point whose residual exceeds 1x the residual std")
    void shouldFlagLargeResidual() {
        TimeSeries actual = series(T0, 10, 10, 10, 50);
        TimeSeries forecast = series(T0, 10, 10, 10, 10);

        AnomalySet anomalies = strategy.detect(actual, forecast, DetectionSettings.withThresholdMultiplier(1.0));

        assertThat(anomalies.getStrategy()).isEqualTo(ResidualThresholdStrategy.NAME);
        assertThat(anomalies.getEligibleCount()).isEqualTo(4);
        assertThat(anomalies.getTimestamps()).containsExactly(T0.plusHours(3));
        assertThat(anomalies.getAnomalies().get(0).getResidual()).isEqualTo(40.0);
        // sample std of [0, 0, 0, 40] is 20
        assertThat(anomalies.getAnomalies().get(0).getScore()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should compute residuals only over the common index")
    void shouldIgnoreNonOverlappingTimestamps() {
        TimeSeries actual = series(T0, 10, 10, 10, 10, 50);
        TimeSeries forecast = series(T0.plusHours(2), 10, 10, 10, 10, 10);

        AnomalySet anomalies = strategy.detect(actual, forecast, DetectionSettings.withThresholdMultiplier(1.0));

        assertThat(anomalies.getEligibleCount()).isEqualTo(3);
        assertThat(anomalies.contains(T0.plusHours(4))).isTrue();
        assertThat(anomalies.contains(T0)).isFalse();
    }

    @Test
    @DisplayName("Should fail instead of returning nothing when fewer than two points align")
    void shouldRequireTwoAlignedPoints() {
        TimeSeries actual = series(T0, 10, 10, 10);
        TimeSeries forecast = series(T0.plusHours(2), 10, 10);

        assertThatThrownBy(() -> strategy.detect(actual, forecast, new DetectionSettings()))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> {
                    InsufficientDataException ex = (InsufficientDataException) e;
                    assertThat(ex.getAvailable()).isEqualTo(1);
                    assertThat(ex.getRequired()).isEqualTo(2);
                });
    }

    @Test
    @DisplayName("Should flag an injected step anomaly at multiplier 3 but not at multiplier 10")
    void shouldDetectInjectedAnomalyEndToEnd() {
        int n = 200;
        int spike = 9;
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 10 + 1.4 * Math.sin(0.7 * i);
        }
        values[spike] += 8;
        TimeSeries actual = new TimeSeries("kw", T0, HOUR, values);

        // trivial constant-mean model
        double mean = Arrays.stream(values).average().orElseThrow();
        double[] constant = new double[n];
        Arrays.fill(constant, mean);
        TimeSeries forecast = new TimeSeries("kw", T0, HOUR, constant);

        AnomalySet sensitive = strategy.detect(actual, forecast, DetectionSettings.withThresholdMultiplier(3.0));
        AnomalySet strict = strategy.detect(actual, forecast, DetectionSettings.withThresholdMultiplier(10.0));

        assertThat(sensitive.contains(T0.plusHours(spike))).isTrue();
        assertThat(sensitive.size()).isEqualTo(1);
        assertThat(strict.contains(T0.plusHours(spike))).isFalse();
    }

    @Test
    @DisplayName("Should reject a non-positive multiplier")
    void shouldRejectNonPositiveMultiplier() {
        DetectionSettings settings = new DetectionSettings();
        settings.setThresholdMultiplier(0);

        assertThatThrownBy(() -> strategy.detect(series(T0, 1, 2), series(T0, 1, 2), settings))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TimeSeries series(LocalDateTime start, double... values) {
        return TimeSeries.of("kw", start, HOUR, values);
    }
}

package com.powersentinel.core.feature;

import com.powersentinel.core.config.FeatureSettings;
import com.powersentinel.core.model.FeatureFrame;
import com.powersentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureAugmenter}.
 */
class FeatureAugmenterTest {

    private static final double NAN = Double.NaN;

    @Test
    @DisplayName("Should shift values by the lag and mark the first rows missing")
    void shouldComputeLag() {
        assertThat(FeatureAugmenter.lag(new double[] {1, 2, 3, 4, 5}, 2))
                .containsExactly(NAN, NAN, 1, 2, 3);
    }

    @Test
    @DisplayName("Should compute the trailing mean and mark incomplete windows missing")
    void shouldComputeRollingMean() {
        assertThat(FeatureAugmenter.rollingMean(new double[] {1, 2, 3, 4}, 2))
                .containsExactly(NAN, 1.5, 2.5, 3.5);
    }

    @Test
    @DisplayName("Should mark a rolling window containing a missing value as missing")
    void shouldNotAverageOverGaps() {
        assertThat(FeatureAugmenter.rollingMean(new double[] {1, NAN, 3, 5, 7}, 2))
                .containsExactly(NAN, NAN, NAN, 4, 6);
    }

    @Test
    @DisplayName("Should add columns in request order with one row per base row")
    void shouldAddColumnsInOrder() {
        FeatureFrame frame = FeatureAugmenter.augment(series(1, 2, 3, 4, 5, 6), List.of(3, 1), List.of(2),
                4, 2);

        assertThat(frame.getColumnNames()).containsExactly(
                "kw_lag_3", "kw_lag_1", "kw_rolling_mean_2", "sin_1", "cos_1", "sin_2", "cos_2");
        for (String column : frame.getColumnNames()) {
            assertThat(frame.column(column)).hasSize(6);
        }
        assertThat(frame.column("kw")).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    @DisplayName("Should expose a derived column as a series on the base grid")
    void shouldViewColumnAsSeries() {
        TimeSeries base = series(1, 2, 3, 4);
        FeatureFrame frame = FeatureAugmenter.augment(base, List.of(), List.of(2), 4, 0);

        TimeSeries rolling = frame.columnAsSeries("kw_rolling_mean_2");

        assertThat(rolling.getName()).isEqualTo("kw_rolling_mean_2");
        assertThat(rolling.getTimestamps()).isEqualTo(base.getTimestamps());
        assertThat(rolling.isMissing(0)).isTrue();
        assertThat(rolling.getValues()).containsExactly(NAN, 1.5, 2.5, 3.5);
        assertThatThrownBy(() -> frame.columnAsSeries("kw_lag_9"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should derive Fourier terms from the row index and never leave them missing")
    void shouldComputeFourierTerms() {
        FeatureFrame frame = FeatureAugmenter.addFourierFeatures(new FeatureFrame(series(0, 0, 0, 0, 0)), 4, 1);

        assertThat(frame.column("sin_1")).containsExactly(new double[] {0, 1, 0, -1, 0}, within(1e-12));
        assertThat(frame.column("cos_1")).containsExactly(new double[] {1, 0, -1, 0, 1}, within(1e-12));
    }

    @Test
    @DisplayName("Should add hour and day of week with Monday as zero")
    void shouldAddCalendarFeatures() {
        // 2007-01-01 was a Monday
        TimeSeries series = TimeSeries.of("kw", LocalDateTime.of(2007, 1, 1, 22, 0), Duration.ofHours(1), 1, 2, 3);

        FeatureFrame frame = FeatureAugmenter.addCalendarFeatures(new FeatureFrame(series));

        assertThat(frame.column(FeatureAugmenter.HOUR_COLUMN)).containsExactly(22, 23, 0);
        assertThat(frame.column(FeatureAugmenter.DAY_OF_WEEK_COLUMN)).containsExactly(0, 0, 1);
    }

    @Test
    @DisplayName("Should apply every configured family from settings")
    void shouldAugmentFromSettings() {
        FeatureFrame frame = FeatureAugmenter.augment(series(new double[48]), new FeatureSettings());

        assertThat(frame.getColumnNames()).containsExactly(
                "kw_lag_1", "kw_lag_2", "kw_lag_3", "kw_lag_24",
                "kw_rolling_mean_3", "kw_rolling_mean_6", "kw_rolling_mean_24",
                "sin_1", "cos_1", "sin_2", "cos_2", "sin_3", "cos_3",
                "hour", "day_of_week");
    }

    @Test
    @DisplayName("Should reject non-positive lags, windows and periods")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> FeatureAugmenter.lag(new double[] {1}, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureAugmenter.rollingMean(new double[] {1}, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureAugmenter.addFourierFeatures(new FeatureFrame(series(1)), 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureAugmenter.augment(series(1, 2), List.of(1, 1), List.of(), 4, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TimeSeries series(double... values) {
        return TimeSeries.of("kw", LocalDateTime.of(2007, 1, 1, 0, 0), Duration.ofHours(1), values);
    }
}

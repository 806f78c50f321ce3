package com.powersentinel.core.ingest;

import com.powersentinel.core.model.RawReading;
import com.powersentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Resampler}.
 */
class ResamplerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2006, 12, 16, 17, 0);
    private static final Duration HOUR = Duration.ofHours(1);

    @Test
    @DisplayName("Should return an identical series when resampling at its own frequency")
    void shouldBeIdempotentAtSameFrequency() {
        TimeSeries series = TimeSeries.of("kw", T0, HOUR, 1.5, 2.5, Double.NaN, 4.0);

        TimeSeries resampled = Resampler.resample(series, HOUR);

        assertThat(resampled).isEqualTo(series);
        assertThat(Resampler.resample(resampled, HOUR)).isEqualTo(series);
    }

    @Test
    @DisplayName("Should average finer readings within each bucket")
    void shouldDownsampleByMean() {
        List<RawReading> readings = List.of(
                new RawReading(T0.plusMinutes(24), 4.0),
                new RawReading(T0.plusMinutes(44), 6.0),
                new RawReading(T0.plusMinutes(64), 3.0),
                new RawReading(T0.plusMinutes(84), Double.NaN),
                new RawReading(T0.plusMinutes(104), 5.0));

        TimeSeries series = Resampler.resample(readings, "kw", HOUR);

        assertThat(series.getStart()).isEqualTo(T0);
        assertThat(series.getStep()).isEqualTo(HOUR);
        assertThat(series.getValues()).containsExactly(new double[] {5.0, 4.0}, within(1e-12));
    }

    @Test
    @DisplayName("Should leave buckets without readings missing")
    void shouldMarkEmptyBucketsMissing() {
        List<RawReading> readings = List.of(
                new RawReading(T0, 1.0),
                new RawReading(T0.plusHours(3), 4.0));

        TimeSeries series = Resampler.resample(readings, "kw", HOUR);

        assertThat(series.size()).isEqualTo(4);
        assertThat(series.isMissing(1)).isTrue();
        assertThat(series.isMissing(2)).isTrue();
        assertThat(series.valueAt(3)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should re-bucket a regular series at a coarser frequency")
    void shouldResampleRegularSeries() {
        TimeSeries halfHourly = TimeSeries.of("kw", T0, Duration.ofMinutes(30), 1, 3, 5, 7);

        TimeSeries hourly = Resampler.resample(halfHourly, HOUR);

        assertThat(hourly.getValues()).containsExactly(2, 6);
    }
}

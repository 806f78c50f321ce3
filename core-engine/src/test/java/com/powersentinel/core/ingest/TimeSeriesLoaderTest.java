package com.powersentinel.core.ingest;

import com.powersentinel.core.config.LoaderSettings;
import com.powersentinel.core.error.InsufficientDataException;
import com.powersentinel.core.error.SeriesParseException;
import com.powersentinel.core.model.RawReading;
import com.powersentinel.core.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TimeSeriesLoader}.
 */
class TimeSeriesLoaderTest {

    private TimeSeriesLoader loader;

    @BeforeEach
    void setUp() {
        loader = new TimeSeriesLoader(new LoaderSettings());
    }

    @Test
    @DisplayName("Should merge date and time, average per hour and forward-fill empty hours")
    void shouldLoadRawFile() throws URISyntaxException {
        TimeSeries series = loader.load(resource("raw/household_sample.txt"));

        assertThat(series.getName()).isEqualTo("Global_active_power");
        assertThat(series.getStart()).isEqualTo(LocalDateTime.of(2006, 12, 16, 17, 0));
        assertThat(series.getStep()).isEqualTo(Duration.ofHours(1));
        assertThat(series.getValues())
                .containsExactly(new double[] {4.788, 4.0, 4.0, 2.0}, within(1e-9));
        assertThat(series.missingCount()).isZero();
    }

    @Test
    @DisplayName("Should treat the sentinel token as missing, not zero")
    void shouldParseSentinelAsMissing() {
        List<RawReading> readings = loader.readRaw(new StringReader(
                "Date;Time;Global_active_power\n"
                        + "1/2/2007;0:05:00;?\n"
                        + "1/2/2007;0:06:00;0.5\n"), "inline");

        assertThat(readings).hasSize(2);
        assertThat(readings.get(0).isMissing()).isTrue();
        assertThat(readings.get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2007, 2, 1, 0, 5));
        assertThat(readings.get(1).getValue()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should keep a leading missing prefix missing after forward-fill")
    void shouldReportLeadingMissingPrefix() {
        TimeSeries series = loader.load(new StringReader(
                "Date;Time;Global_active_power\n"
                        + "1/2/2007;0:00:00;?\n"
                        + "1/2/2007;1:00:00;?\n"
                        + "1/2/2007;2:00:00;1.0\n"
                        + "1/2/2007;3:00:00;?\n"), "inline");

        assertThat(series.leadingMissingCount()).isEqualTo(2);
        assertThat(series.valueAt(3)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should accept a pre-merged Datetime column")
    void shouldAcceptMergedTimestamp() {
        TimeSeries series = loader.load(new StringReader(
                "Datetime;Global_active_power\n"
                        + "2007-02-01 00:00:00;1.0\n"
                        + "2007-02-01 01:00:00;3.0\n"), "inline");

        assertThat(series.getStart()).isEqualTo(LocalDateTime.of(2007, 2, 1, 0, 0));
        assertThat(series.getValues()).containsExactly(1, 3);
    }

    @Test
    @DisplayName("Should fail with the line number on an unparseable timestamp")
    void shouldRejectBadTimestamp() {
        StringReader input = new StringReader(
                "Date;Time;Global_active_power\n"
                        + "1/2/2007;0:00:00;1.0\n"
                        + "yesterday;0:01:00;1.0\n");

        assertThatThrownBy(() -> loader.readRaw(input, "inline"))
                .isInstanceOf(SeriesParseException.class)
                .hasMessageContaining("yesterday")
                .satisfies(e -> assertThat(((SeriesParseException) e).getLine()).isEqualTo(3));
    }

    @Test
    @DisplayName("Should reject an impossible calendar date instead of clamping it")
    void shouldRejectImpossibleDate() {
        StringReader input = new StringReader(
                "Date;Time;Global_active_power\n"
                        + "31/2/2007;12:00:00;1.0\n");

        assertThatThrownBy(() -> loader.readRaw(input, "inline"))
                .isInstanceOf(SeriesParseException.class)
                .hasMessageContaining("31/2/2007")
                .satisfies(e -> assertThat(((SeriesParseException) e).getLine()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should reject a 24:00:00 time instead of rolling over to the next day")
    void shouldRejectEndOfDayTime() {
        StringReader input = new StringReader(
                "Date;Time;Global_active_power\n"
                        + "29/4/2007;23:00:00;1.0\n"
                        + "30/4/2007;24:00:00;1.0\n");

        assertThatThrownBy(() -> loader.readRaw(input, "inline"))
                .isInstanceOf(SeriesParseException.class)
                .satisfies(e -> assertThat(((SeriesParseException) e).getLine()).isEqualTo(3));
    }

    @Test
    @DisplayName("Should accept 29 February in a leap year")
    void shouldAcceptLeapDay() {
        List<RawReading> readings = loader.readRaw(new StringReader(
                "Date;Time;Global_active_power\n"
                        + "29/2/2008;12:00:00;1.0\n"), "inline");

        assertThat(readings).hasSize(1);
        assertThat(readings.get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2008, 2, 29, 12, 0));
    }

    @Test
    @DisplayName("Should fail on a non-numeric measurement instead of dropping the row")
    void shouldRejectBadNumber() {
        StringReader input = new StringReader(
                "Date;Time;Global_active_power\n"
                        + "1/2/2007;0:00:00;abc\n");

        assertThatThrownBy(() -> loader.readRaw(input, "inline"))
                .isInstanceOf(SeriesParseException.class)
                .satisfies(e -> assertThat(((SeriesParseException) e).getColumn())
                        .isEqualTo("Global_active_power"));
    }

    @Test
    @DisplayName("Should fail when the value column is absent")
    void shouldRejectMissingColumn() {
        StringReader input = new StringReader("Date;Time;Voltage\n1/2/2007;0:00:00;240\n");

        assertThatThrownBy(() -> loader.readRaw(input, "inline"))
                .isInstanceOf(SeriesParseException.class)
                .hasMessageContaining("Global_active_power");
    }

    @Test
    @DisplayName("Should fail with a count when the source has no readings")
    void shouldRejectEmptySource() {
        StringReader input = new StringReader("Date;Time;Global_active_power\n");

        assertThatThrownBy(() -> loader.load(input, "inline"))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> assertThat(((InsufficientDataException) e).getAvailable()).isZero());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(TimeSeriesLoaderTest.class.getClassLoader().getResource(name).toURI());
    }
}

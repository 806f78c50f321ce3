package com.powersentinel.core.io;

import com.powersentinel.core.error.SeriesParseException;
import com.powersentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesCsvReader}.
 */
class SeriesCsvReaderTest {

    private static final Duration HOUR = Duration.ofHours(1);

    private final SeriesCsvReader reader = new SeriesCsvReader();

    @Test
    @DisplayName("Should infer the step from the first two rows")
    void shouldInferStep() throws IOException {
        TimeSeries series = read("""
                Datetime,kw,lag_1
                2007-01-01 00:00:00,1.0,
                2007-01-01 00:30:00,2.0,1.0
                2007-01-01 01:00:00,3.0,2.0
                """, "lag_1");

        assertThat(series.getName()).isEqualTo("lag_1");
        assertThat(series.getStart()).isEqualTo(LocalDateTime.of(2007, 1, 1, 0, 0));
        assertThat(series.getStep()).isEqualTo(Duration.ofMinutes(30));
        assertThat(series.isMissing(0)).isTrue();
        assertThat(series.valueAt(2)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should accept ISO timestamps")
    void shouldAcceptIsoTimestamps() throws IOException {
        TimeSeries series = read("""
                Datetime,kw
                2007-01-01T00:00,1.0
                2007-01-01T01:00,2.0
                """, "kw");

        assertThat(series.getStep()).isEqualTo(HOUR);
    }

    @Test
    @DisplayName("Should use the given step for a single-row file")
    void shouldUseGivenStepForSingleRow() throws IOException {
        TimeSeries series = read("""
                Datetime,kw
                2007-01-01 00:00:00,1.0
                """, "kw");

        assertThat(series.size()).isEqualTo(1);
        assertThat(series.getStep()).isEqualTo(HOUR);
    }

    @Test
    @DisplayName("Should reject an irregular index")
    void shouldRejectIrregularIndex() {
        assertThatThrownBy(() -> read("""
                Datetime,kw
                2007-01-01 00:00:00,1.0
                2007-01-01 01:00:00,2.0
                2007-01-01 03:00:00,3.0
                """, "kw"))
                .isInstanceOf(SeriesParseException.class)
                .hasMessageContaining("Irregular index")
                .satisfies(e -> assertThat(((SeriesParseException) e).getLine()).isEqualTo(4));
    }

    @Test
    @DisplayName("Should reject an impossible calendar date in the index")
    void shouldRejectImpossibleDate() {
        assertThatThrownBy(() -> read("""
                Datetime,kw
                2007-02-31 12:00:00,1.0
                """, "kw"))
                .isInstanceOf(SeriesParseException.class)
                .satisfies(e -> {
                    SeriesParseException ex = (SeriesParseException) e;
                    assertThat(ex.getLine()).isEqualTo(2);
                    assertThat(ex.getColumn()).isEqualTo("Datetime");
                });
    }

    @Test
    @DisplayName("Should report the line and column of a bad value")
    void shouldReportBadValue() {
        assertThatThrownBy(() -> read("""
                Datetime,kw
                2007-01-01 00:00:00,1.0
                2007-01-01 01:00:00,abc
                """, "kw"))
                .isInstanceOf(SeriesParseException.class)
                .satisfies(e -> {
                    SeriesParseException ex = (SeriesParseException) e;
                    assertThat(ex.getLine()).isEqualTo(3);
                    assertThat(ex.getColumn()).isEqualTo("kw");
                });
    }

    @Test
    @DisplayName("Should reject a file without the requested column")
    void shouldRejectMissingColumn() {
        assertThatThrownBy(() -> read("""
                Datetime,kw
                2007-01-01 00:00:00,1.0
                """, "voltage"))
                .isInstanceOf(SeriesParseException.class)
                .hasMessageContaining("voltage");
    }

    @Test
    @DisplayName("Should reject a file with no rows")
    void shouldRejectEmptyFile() {
        assertThatThrownBy(() -> read("Datetime,kw\n", "kw"))
                .isInstanceOf(SeriesParseException.class)
                .hasMessageContaining("No rows");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TimeSeries read(String csv, String column) throws IOException {
        return reader.read(new StringReader(csv), "test.csv", column, HOUR);
    }
}

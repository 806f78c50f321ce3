package com.powersentinel.core.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.powersentinel.core.config.LoaderSettings;
import com.powersentinel.core.error.InsufficientDataException;
import com.powersentinel.core.error.SeriesParseException;
import com.powersentinel.core.io.SeriesCsvFormat;
import com.powersentinel.core.model.RawReading;
import com.powersentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw delimited readings into a regular, gap-filled {@link TimeSeries}.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Parse every row. The timestamp comes from the date and time columns
 * joined by a space (fixed pattern, strictly resolved so that impossible
 * dates such as 31/2 or a 24:00 time are rejected), or from a pre-merged
 * timestamp column.
 * The measurement token equal to the missing marker, or an empty cell,
 * becomes a missing value. Any other unparseable field aborts the load with
 * a {@link SeriesParseException}.</li>
 * <li>Resample to the configured frequency by bucket mean
 * ({@link Resampler}).</li>
 * <li>Forward-fill ({@link Filler}). A leading run of missing rows cannot be
 * filled; it is logged and stays visible through
 * {@link TimeSeries#leadingMissingCount()}.</li>
 * </ol>
 *
 * <p>
 * The loader has no side effects beyond the returned series.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesLoader.class);

    private final LoaderSettings settings;
    private final DateTimeFormatter splitFormatter;
    private final CsvMapper mapper = new CsvMapper();

    /**
     * @param settings parsing and resampling settings; validated here
     * @throws IllegalStateException if the settings are invalid
     */
    public TimeSeriesLoader(LoaderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "LoaderSettings must not be null");
        settings.validate();
        this.splitFormatter = settings.dateTimeFormatter();
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load, resample and forward-fill a raw readings file.
     *
     * @throws SeriesParseException       if any row is malformed
     * @throws InsufficientDataException if the file holds no readings
     * @throws UncheckedIOException       if the file cannot be read
     */
    public TimeSeries load(Path path) {
        Objects.requireNonNull(path, "Path must not be null");
        LOG.info("Loading raw readings from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read raw readings: " + path, e);
        }
    }

    /**
     * Load, resample and forward-fill raw readings from a reader.
     *
     * @param reader     source, not closed by this method
     * @param sourceName label used in log and error messages
     */
    public TimeSeries load(Reader reader, String sourceName) {
        List<RawReading> readings = readRaw(reader, sourceName);
        return toRegularSeries(readings);
    }

    /**
     * Parse rows without resampling.
     *
     * @throws SeriesParseException if any row is malformed or the header lacks
     *                              the required columns
     */
    public List<RawReading> readRaw(Reader reader, String sourceName) {
        Objects.requireNonNull(reader, "Reader must not be null");
        CsvSchema schema = CsvSchema.emptySchema()
                .withHeader()
                .withColumnSeparator(settings.delimiterChar());
        ObjectReader rowReader = mapper.readerForMapOf(String.class).with(schema);

        List<RawReading> readings = new ArrayList<>();
        long line = 1;
        try (MappingIterator<Map<String, String>> rows = rowReader.readValues(reader)) {
            Boolean splitTimestamp = null;
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                line++;
                if (splitTimestamp == null) {
                    splitTimestamp = hasSplitTimestamp(row, sourceName);
                }
                readings.add(new RawReading(parseTimestamp(row, splitTimestamp, line), parseValue(row, line)));
            }
        } catch (IOException e) {
            throw new SeriesParseException("Malformed delimited input in " + sourceName + ": "
                    + e.getMessage(), line, null, e);
        }

        LOG.debug("Parsed {} reading(s) from {}", readings.size(), sourceName);
        return readings;
    }

    /**
     * Resample to the configured frequency and forward-fill.
     *
     * @throws InsufficientDataException if {@code readings} is empty
     */
    public TimeSeries toRegularSeries(List<RawReading> readings) {
        if (readings.isEmpty()) {
            throw new InsufficientDataException("Loading a series", 0, 1);
        }
        TimeSeries resampled = Resampler.resample(readings, settings.getValueColumn(), settings.frequency());
        TimeSeries filled = Filler.forwardFill(resampled);

        int leading = filled.leadingMissingCount();
        if (leading > 0) {
            LOG.warn("Series '{}' starts with {} missing row(s) that forward-fill cannot repair (until {})",
                    filled.getName(), leading, filled.timestampAt(leading - 1));
        }
        LOG.info("Loaded series '{}': {} reading(s) -> {} row(s) at {} from {} to {}",
                filled.getName(), readings.size(), filled.size(), filled.getStep(),
                filled.getStart(), filled.getEnd());
        return filled;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * @return {@code true} for separate date and time columns, {@code false}
     *         for a pre-merged timestamp column
     */
    private boolean hasSplitTimestamp(Map<String, String> firstRow, String sourceName) {
        if (!firstRow.containsKey(settings.getValueColumn())) {
            throw new SeriesParseException("Column '" + settings.getValueColumn()
                    + "' not found in " + sourceName + "; header: " + firstRow.keySet());
        }
        if (firstRow.containsKey(settings.getDateColumn()) && firstRow.containsKey(settings.getTimeColumn())) {
            return true;
        }
        if (firstRow.containsKey(settings.getDatetimeColumn())) {
            return false;
        }
        throw new SeriesParseException("No timestamp columns in " + sourceName + ": expected '"
                + settings.getDateColumn() + "' + '" + settings.getTimeColumn() + "' or '"
                + settings.getDatetimeColumn() + "'; header: " + firstRow.keySet());
    }

    private LocalDateTime parseTimestamp(Map<String, String> row, boolean split, long line) {
        if (split) {
            String date = row.get(settings.getDateColumn());
            String time = row.get(settings.getTimeColumn());
            String merged = (date == null ? "" : date) + " " + (time == null ? "" : time);
            try {
                return LocalDateTime.parse(merged, splitFormatter);
            } catch (DateTimeParseException e) {
                throw new SeriesParseException("Unparseable timestamp '" + merged + "'", line,
                        settings.getDateColumn() + "+" + settings.getTimeColumn(), e);
            }
        }
        String raw = row.get(settings.getDatetimeColumn());
        try {
            return SeriesCsvFormat.parseTimestamp(raw == null ? "" : raw);
        } catch (DateTimeParseException e) {
            throw new SeriesParseException("Unparseable timestamp '" + raw + "'", line,
                    settings.getDatetimeColumn(), e);
        }
    }

    private double parseValue(Map<String, String> row, long line) {
        String raw = row.get(settings.getValueColumn());
        if (raw == null || raw.isEmpty() || raw.equals(settings.getMissingToken())) {
            return Double.NaN;
        }
        try {
            double value = Double.parseDouble(raw);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException("non-finite value");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new SeriesParseException("Unparseable numeric value '" + raw + "'", line,
                    settings.getValueColumn(), e);
        }
    }
}

package com.powersentinel.core.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.powersentinel.core.error.SeriesParseException;
import com.powersentinel.core.model.TimeSeries;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads one column of a {@value SeriesCsvFormat#INDEX_COLUMN}-indexed CSV
 * file back into a {@link TimeSeries}.
 *
 * <p>
 * The step is taken from the first two rows; every later row must keep that
 * spacing, otherwise the file is rejected.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesCsvReader {

    private final CsvMapper mapper = new CsvMapper();

    /**
     * @param path   CSV file written by {@link SeriesCsvWriter} or an
     *               equivalent tool
     * @param column column to extract; becomes the series name
     * @param step   spacing to assume when the file has a single row
     * @throws SeriesParseException if the file is malformed or irregular
     * @throws IOException          if the file cannot be read
     */
    public TimeSeries read(Path path, String column, Duration step) throws IOException {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in, path.toString(), column, step);
        }
    }

    public TimeSeries read(Reader in, String sourceName, String column, Duration step) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<LocalDateTime> timestamps = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        long line = 1;
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                line++;
                if (!row.containsKey(SeriesCsvFormat.INDEX_COLUMN) || !row.containsKey(column)) {
                    throw new SeriesParseException("Expected columns '" + SeriesCsvFormat.INDEX_COLUMN + "' and '"
                            + column + "' in " + sourceName + "; header: " + row.keySet());
                }
                String rawTs = row.get(SeriesCsvFormat.INDEX_COLUMN);
                try {
                    timestamps.add(SeriesCsvFormat.parseTimestamp(rawTs));
                } catch (DateTimeParseException e) {
                    throw new SeriesParseException("Unparseable timestamp '" + rawTs + "' in " + sourceName,
                            line, SeriesCsvFormat.INDEX_COLUMN, e);
                }
                String rawValue = row.get(column);
                try {
                    values.add(SeriesCsvFormat.parseValue(rawValue));
                } catch (NumberFormatException e) {
                    throw new SeriesParseException("Unparseable numeric value '" + rawValue + "' in " + sourceName,
                            line, column, e);
                }
            }
        }

        if (timestamps.isEmpty()) {
            throw new SeriesParseException("No rows in " + sourceName);
        }
        Duration actualStep = timestamps.size() > 1
                ? Duration.between(timestamps.get(0), timestamps.get(1))
                : step;
        for (int i = 1; i < timestamps.size(); i++) {
            if (!Duration.between(timestamps.get(i - 1), timestamps.get(i)).equals(actualStep)) {
                throw new SeriesParseException("Irregular index in " + sourceName + ": "
                        + timestamps.get(i - 1) + " -> " + timestamps.get(i) + " (expected step " + actualStep + ")",
                        i + 2, SeriesCsvFormat.INDEX_COLUMN, null);
            }
        }
        if (actualStep.isZero() || actualStep.isNegative()) {
            throw new SeriesParseException("Index of " + sourceName + " is not strictly increasing");
        }

        double[] data = new double[values.size()];
        for (int i = 0; i < data.length; i++) {
            data[i] = values.get(i);
        }
        return new TimeSeries(column, timestamps.get(0), actualStep, data);
    }
}

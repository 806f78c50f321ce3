package com.powersentinel.core.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.powersentinel.core.model.Anomaly;
import com.powersentinel.core.model.AnomalySet;
import com.powersentinel.core.model.FeatureFrame;
import com.powersentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes series, feature frames and anomaly sets as CSV with an explicit
 * {@value SeriesCsvFormat#INDEX_COLUMN} index column so that
 * {@link SeriesCsvReader} reads them back without ambiguity.
 *
 * @since 1.0.0
 */
public class SeriesCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCsvWriter.class);

    // quote only cells holding a separator, quote or line break
    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public void write(TimeSeries series, Path path) throws IOException {
        write(new FeatureFrame(series), path);
    }

    /**
     * Write the base column followed by every derived column.
     */
    public void write(FeatureFrame frame, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(frame, out);
        }
        LOG.debug("Wrote {} row(s) x {} column(s) to {}", frame.size(), frame.getColumnNames().size() + 1, path);
    }

    public void write(FeatureFrame frame, Writer out) throws IOException {
        TimeSeries base = frame.getBase();
        List<String> columns = new ArrayList<>();
        columns.add(base.getName());
        columns.addAll(frame.getColumnNames());

        List<double[]> data = new ArrayList<>(columns.size());
        for (String column : columns) {
            data.add(frame.column(column));
        }

        List<String> header = new ArrayList<>();
        header.add(SeriesCsvFormat.INDEX_COLUMN);
        header.addAll(columns);

        try (SequenceWriter rows = mapper.writer(schemaFor(header)).writeValues(out)) {
            rows.write(headerRow(header));
            for (int i = 0; i < base.size(); i++) {
                Map<String, String> row = new LinkedHashMap<>();
                row.put(SeriesCsvFormat.INDEX_COLUMN, SeriesCsvFormat.formatTimestamp(base.timestampAt(i)));
                for (int c = 0; c < columns.size(); c++) {
                    row.put(columns.get(c), SeriesCsvFormat.formatValue(data.get(c)[i]));
                }
                rows.write(row);
            }
        }
    }

    /**
     * One row per flagged point: timestamp, actual, forecast, residual, score.
     */
    public void write(AnomalySet anomalies, Path path) throws IOException {
        List<String> header = List.of(SeriesCsvFormat.INDEX_COLUMN, "actual", "forecast", "residual", "score");
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                SequenceWriter rows = mapper.writer(schemaFor(header)).writeValues(out)) {
            rows.write(headerRow(header));
            for (Anomaly anomaly : anomalies.getAnomalies()) {
                Map<String, String> row = new LinkedHashMap<>();
                row.put(SeriesCsvFormat.INDEX_COLUMN, SeriesCsvFormat.formatTimestamp(anomaly.getTimestamp()));
                row.put("actual", SeriesCsvFormat.formatValue(anomaly.getActual()));
                row.put("forecast", SeriesCsvFormat.formatValue(anomaly.getForecast()));
                row.put("residual", SeriesCsvFormat.formatValue(anomaly.getResidual()));
                row.put("score", SeriesCsvFormat.formatValue(anomaly.getScore()));
                rows.write(row);
            }
        }
        LOG.debug("Wrote {} anomaly row(s) to {}", anomalies.size(), path);
    }

    private static CsvSchema schemaFor(List<String> header) {
        CsvSchema.Builder builder = CsvSchema.builder();
        header.forEach(builder::addColumn);
        return builder.setUseHeader(false).build();
    }

    // written as a data row so that an empty set still gets its header
    private static Map<String, String> headerRow(List<String> header) {
        Map<String, String> row = new LinkedHashMap<>();
        header.forEach(name -> row.put(name, name));
        return row;
    }
}

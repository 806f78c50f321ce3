package com.powersentinel.core.io;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Shared conventions of the processed, enhanced and forecast CSV files: a
 * header row, a leading {@value #INDEX_COLUMN} column, empty cells for
 * missing values.
 *
 * @since 1.0.0
 */
public final class SeriesCsvFormat {

    /** Name of the timestamp index column. */
    public static final String INDEX_COLUMN = "Datetime";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private SeriesCsvFormat() {
        // utility class — not instantiable
    }

    public static String formatTimestamp(LocalDateTime timestamp) {
        return TIMESTAMP.format(timestamp);
    }

    /**
     * Parse {@code uuuu-MM-dd HH:mm:ss}; the ISO {@code T} separator and a
     * missing seconds field are accepted as well.
     *
     * @throws DateTimeParseException if the text matches neither form
     */
    public static LocalDateTime parseTimestamp(String text) {
        String trimmed = text.trim();
        if (trimmed.indexOf('T') > 0) {
            return LocalDateTime.parse(trimmed);
        }
        if (trimmed.length() == "uuuu-MM-dd HH:mm".length()) {
            return LocalDateTime.parse(trimmed.replace(' ', 'T'));
        }
        return LocalDateTime.parse(trimmed, TIMESTAMP);
    }

    public static String formatValue(double value) {
        return Double.isNaN(value) ? "" : Double.toString(value);
    }

    /**
     * @throws NumberFormatException if the cell is neither empty nor a number
     */
    public static double parseValue(String cell) {
        if (cell == null || cell.isBlank()) {
            return Double.NaN;
        }
        return Double.parseDouble(cell.trim());
    }
}

package com.powersentinel.core.config;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * How raw readings are parsed and placed on the regular grid.
 *
 * <pre>
 * loader:
 *   valueColumn: Global_active_power
 *   delimiter: ";"
 *   missingToken: "?"
 *   dateTimePattern: d/M/uuuu H:mm:ss
 *   frequencyMinutes: 60
 * </pre>
 *
 * @since 1.0.0
 */
public class LoaderSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final LocalDateTime PATTERN_CHECK = LocalDateTime.of(2007, 12, 16, 17, 24, 5);

    /** Measurement column to extract. */
    private String valueColumn = "Global_active_power";

    /** Date column of the raw readings; merged with {@link #timeColumn}. */
    private String dateColumn = "Date";

    private String timeColumn = "Time";

    /** Pre-merged timestamp column, used when the date/time pair is absent. */
    private String datetimeColumn = "Datetime";

    private String delimiter = ";";

    /** Token the source uses for a missing measurement. */
    private String missingToken = "?";

    /**
     * Pattern applied to {@code date + ' ' + time}; resolved strictly, so the
     * year must be {@code uuuu} (or {@code yyyy} together with an era).
     */
    private String dateTimePattern = "d/M/uuuu H:mm:ss";

    /** Target grid spacing in minutes. */
    private int frequencyMinutes = 60;

    /**
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (valueColumn == null || valueColumn.isBlank()) {
            errors.add("'valueColumn' is required");
        }
        if (delimiter == null || delimiter.length() != 1) {
            errors.add("'delimiter' must be a single character, got: '" + delimiter + "'");
        }
        if (missingToken == null) {
            errors.add("'missingToken' is required");
        }
        if (frequencyMinutes <= 0) {
            errors.add("'frequencyMinutes' must be > 0, got: " + frequencyMinutes);
        }
        if (dateTimePattern == null || dateTimePattern.isBlank()) {
            errors.add("'dateTimePattern' is required");
        } else {
            try {
                DateTimeFormatter formatter = dateTimeFormatter();
                LocalDateTime.parse(formatter.format(PATTERN_CHECK), formatter);
            } catch (IllegalArgumentException e) {
                errors.add("'dateTimePattern' is not a valid pattern: " + e.getMessage());
            } catch (DateTimeException e) {
                errors.add("'dateTimePattern' must resolve a full date and time strictly"
                        + " (use 'uuuu' for the year), got: " + dateTimePattern);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid loader settings: " + String.join("; ", errors));
        }
    }

    /** Strict formatter for {@link #getDateTimePattern()}. */
    public DateTimeFormatter dateTimeFormatter() {
        return DateTimeFormatter.ofPattern(dateTimePattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /** Grid spacing as a {@link Duration}. */
    public Duration frequency() {
        return Duration.ofMinutes(frequencyMinutes);
    }

    public char delimiterChar() {
        return delimiter.charAt(0);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getValueColumn() {
        return valueColumn;
    }

    public void setValueColumn(String valueColumn) {
        this.valueColumn = valueColumn;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
        this.dateColumn = dateColumn;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    public void setTimeColumn(String timeColumn) {
        this.timeColumn = timeColumn;
    }

    public String getDatetimeColumn() {
        return datetimeColumn;
    }

    public void setDatetimeColumn(String datetimeColumn) {
        this.datetimeColumn = datetimeColumn;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    public String getMissingToken() {
        return missingToken;
    }

    public void setMissingToken(String missingToken) {
        this.missingToken = missingToken;
    }

    public String getDateTimePattern() {
        return dateTimePattern;
    }

    public void setDateTimePattern(String dateTimePattern) {
        this.dateTimePattern = dateTimePattern;
    }

    public int getFrequencyMinutes() {
        return frequencyMinutes;
    }

    public void setFrequencyMinutes(int frequencyMinutes) {
        this.frequencyMinutes = frequencyMinutes;
    }

    @Override
    public String toString() {
        return "LoaderSettings{" +
                "valueColumn='" + valueColumn + '\'' +
                ", delimiter='" + delimiter + '\'' +
                ", missingToken='" + missingToken + '\'' +
                ", dateTimePattern='" + dateTimePattern + '\'' +
                ", frequencyMinutes=" + frequencyMinutes +
                '}';
    }
}

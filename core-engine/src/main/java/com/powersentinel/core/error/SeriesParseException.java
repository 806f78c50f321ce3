package com.powersentinel.core.error;

/**
 * Raised when a timestamp or numeric field of the raw readings cannot be
 * parsed. Rows are never dropped silently; the first bad row aborts the load.
 *
 * @since 1.0.0
 */
public class SeriesParseException extends PowerSentinelException {

    private static final long serialVersionUID = 1L;

    /** 1-based line number in the source, header included; 0 if unknown. */
    private final long line;

    /** Column that failed to parse, or {@code null} for structural errors. */
    private final String column;

    public SeriesParseException(String message) {
        this(message, 0, null, null);
    }

    public SeriesParseException(String message, long line, String column, Throwable cause) {
        super(line > 0
                ? String.format("%s (line %d%s)", message, line,
                        column != null ? ", column '" + column + "'" : "")
                : message, cause);
        this.line = line;
        this.column = column;
    }

    public long getLine() {
        return line;
    }

    public String getColumn() {
        return column;
    }
}

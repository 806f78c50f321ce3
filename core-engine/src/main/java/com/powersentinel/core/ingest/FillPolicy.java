package com.powersentinel.core.ingest;

/**
 * Gap-filling policy applied to a regular series.
 *
 * @since 1.0.0
 */
public enum FillPolicy {
    /** Leave missing values in place. */
    NONE,
    /** Copy the last known value forward. */
    FFILL,
    /** Copy the next known value backward. */
    BFILL
}

/**
 * Ingestion of raw readings onto a regular time grid.
 *
 * <p>
 * {@link com.powersentinel.core.ingest.TimeSeriesLoader} parses delimited
 * readings and delegates to
 * {@link com.powersentinel.core.ingest.Resampler} (bucket mean) and
 * {@link com.powersentinel.core.ingest.Filler} (forward-fill). Both helpers
 * are usable on their own.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.ingest;

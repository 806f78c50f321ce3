/**
 * CSV persistence of series, feature frames and anomaly sets.
 *
 * <p>
 * Files carry a header row and a leading
 * {@value com.powersentinel.core.io.SeriesCsvFormat#INDEX_COLUMN} column so
 * that a forecast file can be aligned directly with the series it predicts.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.io;

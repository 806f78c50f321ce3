/**
 * Domain model classes for Power Sentinel.
 *
 * <p>
 * Immutable value types passed between the pipeline stages:
 * </p>
 * <ul>
 * <li>{@link com.powersentinel.core.model.TimeSeries} — regular-frequency
 * series; missing values are {@code NaN}</li>
 * <li>{@link com.powersentinel.core.model.RawReading} — one reading before
 * resampling</li>
 * <li>{@link com.powersentinel.core.model.FeatureFrame} — series plus
 * derived feature columns</li>
 * <li>{@link com.powersentinel.core.model.ModelOrder} — ARIMA (p, d, q)</li>
 * <li>{@link com.powersentinel.core.model.ResidualSeries} — actual minus
 * forecast over the common timestamps</li>
 * <li>{@link com.powersentinel.core.model.AnomalySet} — points flagged by one
 * strategy</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.model;

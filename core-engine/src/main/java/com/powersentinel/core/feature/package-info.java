/**
 * Feature engineering on top of a cleaned series.
 *
 * <p>
 * {@link com.powersentinel.core.feature.FeatureAugmenter} builds the
 * enhanced frame (lags, rolling means, Fourier terms, calendar columns);
 * {@link com.powersentinel.core.feature.SeasonalDecomposer} splits a series
 * into trend, seasonal and residual components. Neither feeds the ARIMA
 * stage, which trains on the base signal only.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.feature;

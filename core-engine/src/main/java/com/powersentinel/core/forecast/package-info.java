/**
 * ARIMA model selection, estimation and forecasting.
 *
 * <p>
 * {@link com.powersentinel.core.forecast.ForecastEngine} is the entry point;
 * estimation is by conditional sum of squares with Apache Commons Math's
 * Nelder–Mead simplex, and candidates are ranked by AIC.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.forecast;

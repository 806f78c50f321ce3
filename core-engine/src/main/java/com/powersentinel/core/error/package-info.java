/**
 * Failure types of the forecasting and anomaly pipeline.
 *
 * <p>
 * Every type extends
 * {@link com.powersentinel.core.error.PowerSentinelException}, which is
 * unchecked. Only {@link com.powersentinel.core.error.ModelFitException}
 * is recovered locally (by the grid search); all others propagate to the
 * caller.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.error;

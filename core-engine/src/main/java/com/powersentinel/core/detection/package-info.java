/**
 * Residual-based anomaly detection.
 *
 * <p>
 * Strategies implement {@link com.powersentinel.core.detection.AnomalyStrategy}
 * and are created by name through
 * {@link com.powersentinel.core.detection.StrategyFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.detection;

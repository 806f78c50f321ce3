package com.powersentinel.core.error;

/**
 * Base type for every failure raised by the forecasting and anomaly pipeline.
 *
 * <p>
 * All pipeline failures are unchecked. Argument and configuration mistakes
 * keep using {@link IllegalArgumentException} and
 * {@link IllegalStateException}; subclasses of this type describe failures
 * of the data or of the numerical procedures.
 * </p>
 *
 * @since 1.0.0
 */
public class PowerSentinelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PowerSentinelException(String message) {
        super(message);
    }

    public PowerSentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}

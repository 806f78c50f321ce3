package com.powersentinel.core.error;

/**
 * Raised when a forecast is requested for a non-positive number of steps.
 *
 * @since 1.0.0
 */
public class InvalidHorizonException extends PowerSentinelException {

    private static final long serialVersionUID = 1L;

    private final int horizon;

    public InvalidHorizonException(int horizon) {
        super("Forecast horizon must be > 0, got: " + horizon);
        this.horizon = horizon;
    }

    public int getHorizon() {
        return horizon;
    }
}

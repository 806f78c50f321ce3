package com.powersentinel.core.error;

/**
 * Raised when a statistic needs more aligned points than are available.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends PowerSentinelException {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(String what, int available, int required) {
        super(String.format("%s requires at least %d point(s), got %d", what, required, available));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}

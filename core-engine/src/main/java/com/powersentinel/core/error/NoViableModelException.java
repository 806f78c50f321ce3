package com.powersentinel.core.error;

/**
 * Raised when every candidate of a grid search failed to fit.
 *
 * @since 1.0.0
 */
public class NoViableModelException extends PowerSentinelException {

    private static final long serialVersionUID = 1L;

    private final int candidates;

    public NoViableModelException(int candidates) {
        super("Grid search exhausted all " + candidates + " candidate order(s) without a convergent fit");
        this.candidates = candidates;
    }

    public int getCandidates() {
        return candidates;
    }
}

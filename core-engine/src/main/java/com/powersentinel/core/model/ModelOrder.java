package com.powersentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * ARIMA order: autoregressive terms {@code p}, differencing {@code d} and
 * moving-average terms {@code q}.
 *
 * @since 1.0.0
 */
public final class ModelOrder implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int p;
    private final int d;
    private final int q;

    private ModelOrder(int p, int d, int q) {
        this.p = p;
        this.d = d;
        this.q = q;
    }

    /**
     * @throws IllegalArgumentException if any component is negative
     */
    public static ModelOrder of(int p, int d, int q) {
        if (p < 0 || d < 0 || q < 0) {
            throw new IllegalArgumentException(
                    "ARIMA order components must be >= 0, got: (" + p + "," + d + "," + q + ")");
        }
        return new ModelOrder(p, d, q);
    }

    public int getP() {
        return p;
    }

    public int getD() {
        return d;
    }

    public int getQ() {
        return q;
    }

    /** {@code p + d + q}; a training series must be longer than this. */
    public int total() {
        return p + d + q;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelOrder that))
            return false;
        return p == that.p && d == that.d && q == that.q;
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, d, q);
    }

    @Override
    public String toString() {
        return "(" + p + "," + d + "," + q + ")";
    }
}

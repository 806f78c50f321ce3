package com.powersentinel.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One flagged observation.
 *
 * @since 1.0.0
 */
public final class Anomaly {

    private final LocalDateTime timestamp;
    private final double actual;
    private final double forecast;
    private final double residual;

    /** Strategy-specific score: |residual| / std, or the isolation score. */
    private final double score;

    public Anomaly(LocalDateTime timestamp, double actual, double forecast, double residual, double score) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.actual = actual;
        this.forecast = forecast;
        this.residual = residual;
        this.score = score;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public double getActual() {
        return actual;
    }

    public double getForecast() {
        return forecast;
    }

    public double getResidual() {
        return residual;
    }

    public double getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return timestamp.equals(that.timestamp)
                && Double.compare(residual, that.residual) == 0
                && Double.compare(score, that.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, residual, score);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "timestamp=" + timestamp +
                ", actual=" + actual +
                ", forecast=" + forecast +
                ", residual=" + residual +
                ", score=" + score +
                '}';
    }
}

package com.powersentinel.core.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Anomalies flagged by one detection strategy over one aligned window.
 *
 * @since 1.0.0
 */
public final class AnomalySet {

    private final String strategy;
    private final int eligibleCount;
    private final List<Anomaly> anomalies;

    /**
     * @param strategy      name of the strategy that produced the set
     * @param eligibleCount number of aligned points the strategy examined
     * @param anomalies     flagged points in timestamp order
     */
    public AnomalySet(String strategy, int eligibleCount, List<Anomaly> anomalies) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.eligibleCount = eligibleCount;
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(anomalies, "anomalies must not be null")));
    }

    public String getStrategy() {
        return strategy;
    }

    public int getEligibleCount() {
        return eligibleCount;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public int size() {
        return anomalies.size();
    }

    public boolean isEmpty() {
        return anomalies.isEmpty();
    }

    public List<LocalDateTime> getTimestamps() {
        return anomalies.stream().map(Anomaly::getTimestamp).toList();
    }

    public boolean contains(LocalDateTime timestamp) {
        for (Anomaly anomaly : anomalies) {
            if (anomaly.getTimestamp().equals(timestamp)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "AnomalySet{" +
                "strategy='" + strategy + '\'' +
                ", eligible=" + eligibleCount +
                ", flagged=" + anomalies.size() +
                '}';
    }
}

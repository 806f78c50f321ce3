package com.powersentinel.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Machine-readable summary of one pipeline run, written as
 * {@code run-summary.json} next to the CSV artifacts.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"series", "source", "completedAt", "processedRows", "droppedLeadingRows",
        "trainRows", "testRows", "trainEnd", "order", "aic", "candidates", "skippedCandidates",
        "anomalies"})
public class RunSummary {

    private String series;
    private String source;
    private Instant completedAt;
    private int processedRows;
    private int droppedLeadingRows;
    private int trainRows;
    private int testRows;
    private LocalDateTime trainEnd;
    private String order;
    private double aic;
    private int candidates;
    private int skippedCandidates;
    private Map<String, Integer> anomalies = new LinkedHashMap<>();

    public String getSeries() {
        return series;
    }

    public void setSeries(String series) {
        this.series = series;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public int getProcessedRows() {
        return processedRows;
    }

    public void setProcessedRows(int processedRows) {
        this.processedRows = processedRows;
    }

    public int getDroppedLeadingRows() {
        return droppedLeadingRows;
    }

    public void setDroppedLeadingRows(int droppedLeadingRows) {
        this.droppedLeadingRows = droppedLeadingRows;
    }

    public int getTrainRows() {
        return trainRows;
    }

    public void setTrainRows(int trainRows) {
        this.trainRows = trainRows;
    }

    public int getTestRows() {
        return testRows;
    }

    public void setTestRows(int testRows) {
        this.testRows = testRows;
    }

    public LocalDateTime getTrainEnd() {
        return trainEnd;
    }

    public void setTrainEnd(LocalDateTime trainEnd) {
        this.trainEnd = trainEnd;
    }

    /** ARIMA order as {@code (p,d,q)}. */
    public String getOrder() {
        return order;
    }

    public void setOrder(String order) {
        this.order = order;
    }

    public double getAic() {
        return aic;
    }

    public void setAic(double aic) {
        this.aic = aic;
    }

    public int getCandidates() {
        return candidates;
    }

    public void setCandidates(int candidates) {
        this.candidates = candidates;
    }

    public int getSkippedCandidates() {
        return skippedCandidates;
    }

    public void setSkippedCandidates(int skippedCandidates) {
        this.skippedCandidates = skippedCandidates;
    }

    /** Anomaly count per strategy name, in execution order. */
    public Map<String, Integer> getAnomalies() {
        return Collections.unmodifiableMap(anomalies);
    }

    public void setAnomalies(Map<String, Integer> anomalies) {
        this.anomalies = anomalies != null ? new LinkedHashMap<>(anomalies) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "RunSummary{series='" + series + "', order=" + order + ", aic=" + aic
                + ", train=" + trainRows + ", test=" + testRows + ", anomalies=" + anomalies + '}';
    }
}

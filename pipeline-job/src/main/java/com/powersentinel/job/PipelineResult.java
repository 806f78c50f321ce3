package com.powersentinel.job;

import com.powersentinel.core.forecast.FittedModel;
import com.powersentinel.core.forecast.GridSearchResult;
import com.powersentinel.core.model.AnomalySet;
import com.powersentinel.core.model.FeatureFrame;
import com.powersentinel.core.model.TimeSeries;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one successful run produced, in memory and on disk.
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final TimeSeries processed;
    private final FeatureFrame features;
    private final TimeSeries train;
    private final TimeSeries test;
    private final GridSearchResult search;
    private final FittedModel model;
    private final TimeSeries forecast;
    private final Map<String, AnomalySet> anomalies;
    private final RunSummary summary;
    private final List<Path> artifacts;

    PipelineResult(TimeSeries processed, FeatureFrame features, TimeSeries train, TimeSeries test,
            GridSearchResult search, FittedModel model, TimeSeries forecast, Map<String, AnomalySet> anomalies,
            RunSummary summary, List<Path> artifacts) {
        this.processed = processed;
        this.features = features;
        this.train = train;
        this.test = test;
        this.search = search;
        this.model = model;
        this.forecast = forecast;
        this.anomalies = Collections.unmodifiableMap(new LinkedHashMap<>(anomalies));
        this.summary = summary;
        this.artifacts = List.copyOf(artifacts);
    }

    public TimeSeries getProcessed() {
        return processed;
    }

    public FeatureFrame getFeatures() {
        return features;
    }

    public TimeSeries getTrain() {
        return train;
    }

    public TimeSeries getTest() {
        return test;
    }

    public GridSearchResult getSearch() {
        return search;
    }

    public FittedModel getModel() {
        return model;
    }

    public TimeSeries getForecast() {
        return forecast;
    }

    /** Anomaly sets keyed by strategy name, in execution order. */
    public Map<String, AnomalySet> getAnomalies() {
        return anomalies;
    }

    public RunSummary getSummary() {
        return summary;
    }

    public List<Path> getArtifacts() {
        return artifacts;
    }
}

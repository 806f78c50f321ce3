package com.powersentinel.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.powersentinel.core.config.PipelineConfig;
import com.powersentinel.core.detection.AnomalyStrategy;
import com.powersentinel.core.detection.StrategyFactory;
import com.powersentinel.core.error.InsufficientDataException;
import com.powersentinel.core.feature.FeatureAugmenter;
import com.powersentinel.core.forecast.FittedModel;
import com.powersentinel.core.forecast.ForecastEngine;
import com.powersentinel.core.forecast.GridSearchResult;
import com.powersentinel.core.ingest.TimeSeriesLoader;
import com.powersentinel.core.io.SeriesCsvWriter;
import com.powersentinel.core.model.AnomalySet;
import com.powersentinel.core.model.FeatureFrame;
import com.powersentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the batch pipeline end to end.
 *
 * <h3>Stages</h3>
 *
 * <pre>
 *   load      raw readings → hourly, forward-filled series (memoized)
 *   augment   series → feature frame
 *   split     prefix/suffix at floor(n × trainFraction)
 *   search    grid search over (p, d, q) by AIC
 *   fit       best order on the training prefix
 *   forecast  one step per test row
 *   detect    every configured strategy on test vs forecast
 *   persist   CSV and JSON artifacts, staged then published
 * </pre>
 *
 * <h3>Failure</h3>
 * <p>
 * The first failing stage aborts the run with a
 * {@link PipelineStageException} naming the stage and its inputs. Artifacts
 * are only written in the final stage and only published once all of them
 * are written, so a failed run never leaves a partial artifact set.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String FORECAST_FILE = "arima_forecast.csv";
    static final String SUMMARY_FILE = "run-summary.json";

    private final PipelineConfig config;
    private final TimeSeriesLoader loader;
    private final ForecastEngine engine;
    private final List<AnomalyStrategy> strategies;
    private final SeriesCsvWriter csvWriter = new SeriesCsvWriter();
    private final SeriesCache cache;
    private final ObjectMapper mapper;

    public PipelineOrchestrator(PipelineConfig config) {
        this(config, new SeriesCache());
    }

    /**
     * @param cache memoization layer for loaded series; shared across runs
     *              of this orchestrator
     * @throws IllegalStateException if the configuration is invalid
     */
    public PipelineOrchestrator(PipelineConfig config, SeriesCache cache) {
        this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.cache = Objects.requireNonNull(cache, "SeriesCache must not be null");
        config.validate();
        this.loader = new TimeSeriesLoader(config.getLoader());
        this.engine = new ForecastEngine(config.getForecast());
        this.strategies = StrategyFactory.createAll(config.getDetection().getStrategies());
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Run every stage on {@code rawData} and publish the artifacts into
     * {@code outputDir}.
     *
     * @param rawData        delimited raw readings
     * @param outputDir      artifact directory; created if absent
     * @param artifactPrefix file-name stem of the processed and enhanced CSVs
     * @throws PipelineStageException if any stage fails
     */
    public PipelineResult run(Path rawData, Path outputDir, String artifactPrefix) {
        Objects.requireNonNull(rawData, "Raw data path must not be null");
        Objects.requireNonNull(outputDir, "Output directory must not be null");
        Objects.requireNonNull(artifactPrefix, "Artifact prefix must not be null");
        LOG.info("Pipeline run: source={} output={}", rawData, outputDir);

        TimeSeries processed = stage("load", "source=" + rawData,
                () -> cache.get(rawData, loader::load));

        FeatureFrame features = stage("augment", describe(processed),
                () -> FeatureAugmenter.augment(processed, config.getFeatures()));

        TimeSeries usable = processed.dropLeadingMissing();
        int dropped = processed.size() - usable.size();
        if (dropped > 0) {
            LOG.warn("Dropping {} leading row(s) with no value before the train/test split", dropped);
        }
        double fraction = config.getForecast().getTrainFraction();
        TimeSeries[] split = stage("split", describe(usable) + ", trainFraction=" + fraction,
                () -> split(usable, fraction));
        TimeSeries train = split[0];
        TimeSeries test = split[1];

        GridSearchResult search = stage("search", describe(train),
                () -> engine.gridSearch(train));

        FittedModel model = stage("fit", describe(train) + ", order=" + search.getBestOrder(),
                () -> engine.fit(train, search.getBestOrder()));

        TimeSeries forecast = stage("forecast", "model=ARIMA" + model.getOrder() + ", horizon=" + test.size(),
                () -> engine.forecast(model, test.size()));

        Map<String, AnomalySet> anomalies = new LinkedHashMap<>();
        for (AnomalyStrategy strategy : strategies) {
            AnomalySet set = stage("detect", "strategy=" + strategy.getName() + ", actual=" + describe(test)
                    + ", forecast=" + describe(forecast),
                    () -> strategy.detect(test, forecast, config.getDetection()));
            anomalies.put(strategy.getName(), set);
        }

        RunSummary summary = summarize(rawData, processed, dropped, train, test, search, anomalies);

        List<Path> artifacts = stage("persist", "outputDir=" + outputDir, () -> {
            try (ArtifactStager stager = new ArtifactStager(outputDir)) {
                csvWriter.write(processed, stager.stage(artifactPrefix + "_processed.csv"));
                csvWriter.write(features, stager.stage(artifactPrefix + "_enhanced.csv"));
                csvWriter.write(forecast, stager.stage(FORECAST_FILE));
                for (AnomalySet set : anomalies.values()) {
                    csvWriter.write(set, stager.stage("anomalies_" + set.getStrategy() + ".csv"));
                }
                summary.setCompletedAt(Instant.now());
                mapper.writeValue(stager.stage(SUMMARY_FILE).toFile(), summary);
                return stager.commit();
            }
        });

        LOG.info("Pipeline finished: {}", summary);
        return new PipelineResult(processed, features, train, test, search, model, forecast, anomalies,
                summary, artifacts);
    }

    public SeriesCache getCache() {
        return cache;
    }

    // ---------------------------------------------------------------
    // Stage helpers
    // ---------------------------------------------------------------

    @FunctionalInterface
    interface StageAction<T> {
        T run() throws IOException;
    }

    private static <T> T stage(String name, String inputs, StageAction<T> action) {
        LOG.info("Stage [{}] starting ({})", name, inputs);
        long started = System.nanoTime();
        try {
            T result = action.run();
            LOG.info("Stage [{}] done in {} ms", name, (System.nanoTime() - started) / 1_000_000);
            return result;
        } catch (IOException | RuntimeException e) {
            LOG.error("Stage [{}] failed ({}): {}", name, inputs, e.getMessage());
            throw new PipelineStageException(name, inputs, e);
        }
    }

    /**
     * Deterministic prefix/suffix split; both parts must be non-empty.
     */
    static TimeSeries[] split(TimeSeries series, double trainFraction) {
        int trainSize = (int) Math.floor(series.size() * trainFraction);
        if (trainSize < 1 || trainSize >= series.size()) {
            throw new InsufficientDataException("Train/test split at " + trainFraction, series.size(), 2);
        }
        return new TimeSeries[] {series.head(trainSize), series.tail(trainSize)};
    }

    private static RunSummary summarize(Path rawData, TimeSeries processed, int dropped, TimeSeries train,
            TimeSeries test, GridSearchResult search, Map<String, AnomalySet> anomalies) {
        RunSummary summary = new RunSummary();
        summary.setSeries(processed.getName());
        summary.setSource(rawData.toString());
        summary.setProcessedRows(processed.size());
        summary.setDroppedLeadingRows(dropped);
        summary.setTrainRows(train.size());
        summary.setTestRows(test.size());
        summary.setTrainEnd(train.getEnd());
        summary.setOrder(search.getBestOrder().toString());
        summary.setAic(search.getBestAic());
        summary.setCandidates(search.getCandidateCount());
        summary.setSkippedCandidates(search.getSkippedCount());
        Map<String, Integer> counts = new LinkedHashMap<>();
        anomalies.forEach((name, set) -> counts.put(name, set.size()));
        summary.setAnomalies(counts);
        return summary;
    }

    private static String describe(TimeSeries series) {
        if (series.isEmpty()) {
            return "series='" + series.getName() + "', rows=0";
        }
        return "series='" + series.getName() + "', rows=" + series.size()
                + ", span=" + series.getStart() + ".." + series.getEnd();
    }
}

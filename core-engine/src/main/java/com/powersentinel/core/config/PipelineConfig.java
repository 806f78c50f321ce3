package com.powersentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section and key is optional; omitted values
 * keep their defaults):
 * </p>
 *
 * <pre>
 * loader:
 *   valueColumn: Global_active_power
 *   frequencyMinutes: 60
 * features:
 *   lags: [1, 2, 3, 24]
 *   rollingWindows: [3, 6, 24]
 *   fourierPeriod: 24
 *   fourierOrder: 3
 * forecast:
 *   arOrders: [0, 1, 2]
 *   differencingOrders: [0, 1]
 *   maOrders: [0, 1, 2]
 *   trainFraction: 0.8
 * detection:
 *   strategies: [residual, isolation_forest]
 *   thresholdMultiplier: 3.0
 *   contamination: 0.01
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private LoaderSettings loader = new LoaderSettings();
    private FeatureSettings features = new FeatureSettings();
    private ForecastSettings forecast = new ForecastSettings();
    private DetectionSettings detection = new DetectionSettings();

    /**
     * Validate every section.
     *
     * <p>
     * Collects the errors of all sections and throws a single exception if
     * any section is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        collect(loader::validate, errors);
        collect(features::validate, errors);
        collect(forecast::validate, errors);
        collect(detection::validate, errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collect(Runnable check, List<String> errors) {
        try {
            check.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (null resets a section to its defaults)
    // ---------------------------------------------------------------

    public LoaderSettings getLoader() {
        return loader;
    }

    public void setLoader(LoaderSettings loader) {
        this.loader = loader != null ? loader : new LoaderSettings();
    }

    public FeatureSettings getFeatures() {
        return features;
    }

    public void setFeatures(FeatureSettings features) {
        this.features = features != null ? features : new FeatureSettings();
    }

    public ForecastSettings getForecast() {
        return forecast;
    }

    public void setForecast(ForecastSettings forecast) {
        this.forecast = forecast != null ? forecast : new ForecastSettings();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "loader=" + loader +
                ", features=" + features +
                ", forecast=" + forecast +
                ", detection=" + detection +
                '}';
    }
}

package com.powersentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link PipelineConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link PipelineConfig#validate()} after
 * parsing so that a run <strong>fails fast</strong> on an invalid knob
 * instead of failing halfway through the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "PIPELINE_CONFIG_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private PipelineConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code PIPELINE_CONFIG_PATH} is set and the file exists, load
     * from there.</li>
     * <li>Otherwise, {@code pipeline.yml} on the classpath if present.</li>
     * <li>Otherwise, the built-in defaults.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static PipelineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading pipeline configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (PipelineConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading pipeline configuration from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No pipeline configuration found, using defaults");
        return defaults();
    }

    /**
     * @return the built-in defaults, validated
     */
    public static PipelineConfig defaults() {
        PipelineConfig config = new PipelineConfig();
        config.validate();
        return config;
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Pipeline config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Pipeline config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pipeline config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static PipelineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static PipelineConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PipelineConfig.class, options));

        PipelineConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed pipeline configuration in " + source + ": "
                    + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Pipeline configuration {} is empty, using defaults", source);
            config = new PipelineConfig();
        }
        // Fail fast if any knob is out of range
        config.validate();

        LOG.info("Loaded pipeline configuration: {}", config);
        return config;
    }
}

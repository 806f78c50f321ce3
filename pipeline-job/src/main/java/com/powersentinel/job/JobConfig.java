package com.powersentinel.job;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Power Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults;
 * the first two command-line arguments, when present, override the raw data
 * path and the output directory.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment(String[])} for production, or the
 * {@link Builder} for programmatic / test scenarios. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_RAW_DATA_PATH = "RAW_DATA_PATH";
    public static final String ENV_OUTPUT_DIR = "OUTPUT_DIR";
    public static final String ENV_PIPELINE_CONFIG_PATH = "PIPELINE_CONFIG_PATH";
    public static final String ENV_ARTIFACT_PREFIX = "ARTIFACT_PREFIX";

    static final String DEFAULT_RAW_DATA_PATH = "data/raw/household_power_consumption.txt";
    static final String DEFAULT_OUTPUT_DIR = "data/processed";
    static final String DEFAULT_ARTIFACT_PREFIX = "household_power_consumption";

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String rawDataPath;
    private final String outputDir;
    private final String artifactPrefix;

    // ---------------------------------------------------------------
    // Pipeline parameters
    // ---------------------------------------------------------------
    private final String pipelineConfigPath;

    private JobConfig(Builder b) {
        this.rawDataPath = b.rawDataPath;
        this.outputDir = b.outputDir;
        this.artifactPrefix = b.artifactPrefix;
        this.pipelineConfigPath = b.pipelineConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables and arguments.
     *
     * @param args optional {@code [rawDataPath [outputDir]]}
     * @return fully populated configuration
     * @throws IllegalArgumentException if a validated field is invalid
     */
    public static JobConfig fromEnvironment(String[] args) {
        return fromEnvironment(System.getenv(), args);
    }

    static JobConfig fromEnvironment(Map<String, String> env, String[] args) {
        Builder builder = new Builder()
                .rawDataPath(env(env, ENV_RAW_DATA_PATH, DEFAULT_RAW_DATA_PATH))
                .outputDir(env(env, ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR))
                .artifactPrefix(env(env, ENV_ARTIFACT_PREFIX, DEFAULT_ARTIFACT_PREFIX))
                .pipelineConfigPath(env(env, ENV_PIPELINE_CONFIG_PATH, ""));
        if (args != null && args.length > 0 && !args[0].isBlank()) {
            builder.rawDataPath(args[0]);
        }
        if (args != null && args.length > 1 && !args[1].isBlank()) {
            builder.outputDir(args[1]);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getRawDataPath() {
        return Paths.get(rawDataPath);
    }

    public Path getOutputDir() {
        return Paths.get(outputDir);
    }

    public String getArtifactPrefix() {
        return artifactPrefix;
    }

    /** @return YAML pipeline configuration path, or empty for the classpath default */
    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    public boolean hasPipelineConfigPath() {
        return !pipelineConfigPath.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the paths are non-blank and
     * that the artifact prefix is a plain file-name stem.
     * </p>
     */
    public static class Builder {
        private String rawDataPath = DEFAULT_RAW_DATA_PATH;
        private String outputDir = DEFAULT_OUTPUT_DIR;
        private String artifactPrefix = DEFAULT_ARTIFACT_PREFIX;
        private String pipelineConfigPath = "";

        public Builder rawDataPath(String v) {
            this.rawDataPath = v;
            return this;
        }

        public Builder outputDir(String v) {
            this.outputDir = v;
            return this;
        }

        public Builder artifactPrefix(String v) {
            this.artifactPrefix = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(rawDataPath, "rawDataPath");
            requireNonBlank(outputDir, "outputDir");
            requireNonBlank(artifactPrefix, "artifactPrefix");
            Objects.requireNonNull(pipelineConfigPath, "pipelineConfigPath must not be null");

            if (artifactPrefix.contains("/") || artifactPrefix.contains("\\")) {
                throw new IllegalArgumentException(
                        "artifactPrefix must not contain path separators, got: " + artifactPrefix);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "rawDataPath='" + rawDataPath + '\'' +
                ", outputDir='" + outputDir + '\'' +
                ", artifactPrefix='" + artifactPrefix + '\'' +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                '}';
    }
}

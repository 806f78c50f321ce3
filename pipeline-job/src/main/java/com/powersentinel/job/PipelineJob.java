package com.powersentinel.job;

import com.powersentinel.core.config.PipelineConfig;
import com.powersentinel.core.config.PipelineConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Power Sentinel batch job.
 *
 * <h3>Usage</h3>
 *
 * <pre>
 *   java -jar pipeline-job.jar [rawDataPath [outputDir]]
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Paths come from {@link JobConfig}; pipeline parameters from the YAML file
 * named by {@value JobConfig#ENV_PIPELINE_CONFIG_PATH}, or the classpath
 * {@code pipeline.yml}. A failed stage ends the process with exit code 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineJob {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineJob.class);

    private PipelineJob() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) {
        // 1. Resolve job configuration
        JobConfig jobConfig = JobConfig.fromEnvironment(args);
        LOG.info("Starting Power Sentinel with config: {}", jobConfig);

        // 2. Load pipeline parameters
        PipelineConfig pipelineConfig = jobConfig.hasPipelineConfigPath()
                ? PipelineConfigLoader.fromFile(jobConfig.getPipelineConfigPath())
                : PipelineConfigLoader.load();

        // 3. Run
        try {
            PipelineResult result = new PipelineOrchestrator(pipelineConfig)
                    .run(jobConfig.getRawDataPath(), jobConfig.getOutputDir(), jobConfig.getArtifactPrefix());
            LOG.info("Wrote {} artifact(s): {}", result.getArtifacts().size(), result.getArtifacts());
        } catch (PipelineStageException e) {
            LOG.error("Pipeline aborted at stage '{}' ({})", e.getStage(), e.getInputs(), e.getCause());
            System.exit(1);
        }
    }
}

/**
 * Configuration loading and validation for the forecasting pipeline.
 *
 * <p>
 * Knobs are defined in YAML and loaded by
 * {@link com.powersentinel.core.config.PipelineConfigLoader} into a
 * {@link com.powersentinel.core.config.PipelineConfig} instance with one
 * section per stage. Validation is performed automatically after parsing to
 * ensure fail-fast behaviour. Library entry points take the section objects
 * as plain parameters; nothing in the core reads global state.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.config;

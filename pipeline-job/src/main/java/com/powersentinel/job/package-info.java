/**
 * Batch job that runs the forecasting and anomaly pipeline over a raw
 * consumption file and publishes its artifacts.
 *
 * <p>
 * {@link com.powersentinel.job.PipelineJob} is the command-line entry point;
 * {@link com.powersentinel.job.PipelineOrchestrator} sequences the stages and
 * can be embedded directly, for example behind a dashboard.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.job;

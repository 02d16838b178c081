/**
 * One-shot batch job running the weekly volume check: environment-driven
 * {@link com.volumesentinel.job.JobConfig}, JSON ingestion and output, and
 * exit-code signalling in {@link com.volumesentinel.job.VolumeMonitorJob}.
 *
 * @since 1.0.0
 */
package com.volumesentinel.job;

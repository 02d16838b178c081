/**
 * Configuration loading and validation for Volume Sentinel.
 *
 * <p>
 * Sensitivity presets and per-combination threshold overrides are defined in
 * YAML and loaded by {@link com.volumesentinel.core.config.ConfigLoader} into
 * a {@link com.volumesentinel.core.config.MonitoringConfig}. Validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.config;

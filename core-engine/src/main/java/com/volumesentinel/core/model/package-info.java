/**
 * Domain model classes for Volume Sentinel.
 *
 * <p>
 * Raw input is a set of
 * {@link com.volumesentinel.core.model.VolumeObservation} rows, grouped per
 * {@link com.volumesentinel.core.model.CombinationKey} into a
 * {@link com.volumesentinel.core.model.CombinationSeries}. Everything else in
 * this package is derived by an analysis run and owned by it:
 * </p>
 * <ul>
 * <li>{@link com.volumesentinel.core.model.FrequencyProfile}: occurrence
 * cadence</li>
 * <li>{@link com.volumesentinel.core.model.ThresholdRecord}: lower-bound
 * volume threshold</li>
 * <li>{@link com.volumesentinel.core.model.TrendRecord}: per-window
 * trend</li>
 * <li>{@link com.volumesentinel.core.model.Alert}: check-week verdict</li>
 * <li>{@link com.volumesentinel.core.model.MonitoringResult}: the whole run
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.model;

/**
 * Baseline and detection engine.
 *
 * <p>
 * A combination's training volumes pass through three stateless stages:
 * </p>
 * <ul>
 * <li>{@link com.volumesentinel.core.detection.FrequencyDetector}: occurrence
 * cadence via the ordered
 * {@link com.volumesentinel.core.detection.FrequencyRuleTable}</li>
 * <li>{@link com.volumesentinel.core.detection.ThresholdCalculator}: z-score,
 * percentile and IQR lower bounds, widened for irregular cadence and
 * replaced by a configured override</li>
 * <li>{@link com.volumesentinel.core.detection.AlertClassifier}: check-week
 * verdict and severity</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To recognise a new cadence, add a
 * {@link com.volumesentinel.core.detection.FrequencyRule} to the table passed
 * to {@code FrequencyDetector}. Rules are evaluated in order.
 * </p>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.detection;

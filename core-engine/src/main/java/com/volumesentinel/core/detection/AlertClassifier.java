package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.Alert;
import com.volumesentinel.core.model.AlertType;
import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.Severity;
import com.volumesentinel.core.model.ThresholdRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Compares a check week's volume with the combination's threshold and
 * assigns a severity.
 *
 * <h3>Rules (first match wins)</h3>
 * <ol>
 * <li>No observation for the check week: {@link Severity#CRITICAL}
 * {@link AlertType#NO_DATA}, whatever the threshold state.</li>
 * <li>No usable threshold (insufficient history, no override): no alert.</li>
 * <li>Volume at or above the threshold: no alert.</li>
 * <li>Otherwise {@link AlertType#VOLUME_DROP} with severity from
 * {@code dropPct = (mean - volume) / mean * 100} via
 * {@link Severity#fromDropPercent(double)}. With a mean of (almost) zero the
 * ratio is meaningless, so the alert is raised on the absolute comparison
 * alone at {@link Severity#LOW} with {@code dropPct = 0}.</li>
 * </ol>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(AlertClassifier.class);

    /** Means at or below this are treated as zero. */
    static final double MEAN_EPSILON = 1e-9;

    static final String NO_DATA_MESSAGE = "No data received this week - possible system failure";

    /**
     * @param key           the combination
     * @param checkWeek     week being checked
     * @param currentVolume observed volume, or empty if no row exists
     * @param threshold     the combination's threshold record
     * @param recentAverage mean of the last training weeks, for context; may
     *                      be {@code null}
     * @return an alert, or empty if the week is healthy or not assessable
     */
    public Optional<Alert> classify(CombinationKey key, LocalDate checkWeek, OptionalLong currentVolume,
            ThresholdRecord threshold, Double recentAverage) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(checkWeek, "checkWeek must not be null");
        Objects.requireNonNull(currentVolume, "currentVolume must not be null");
        Objects.requireNonNull(threshold, "threshold must not be null");

        Alert.Builder alert = Alert.builder()
                .key(key)
                .checkWeek(checkWeek)
                .threshold(threshold.getFinalThreshold())
                .mean(threshold.getMean())
                .recentAverage(recentAverage);

        if (currentVolume.isEmpty()) {
            LOG.debug("{}: no observation for week {} - NO_DATA", key, checkWeek);
            return Optional.of(alert
                    .currentVolume(0)
                    .severity(Severity.CRITICAL)
                    .alertType(AlertType.NO_DATA)
                    .dropPct(100.0)
                    .message(NO_DATA_MESSAGE)
                    .build());
        }

        if (!threshold.isUsable()) {
            LOG.trace("{}: insufficient history - drop alerting suppressed", key);
            return Optional.empty();
        }

        long volume = currentVolume.getAsLong();
        double limit = threshold.getFinalThreshold();
        if (volume >= limit) {
            return Optional.empty();
        }

        double mean = threshold.getMean();
        alert.currentVolume(volume).alertType(AlertType.VOLUME_DROP);

        if (mean <= MEAN_EPSILON) {
            LOG.debug("{}: volume {} below threshold {} with no historical baseline", key, volume, limit);
            return Optional.of(alert
                    .severity(Severity.LOW)
                    .dropPct(0.0)
                    .message(String.format(Locale.ROOT,
                            "Volume %d below threshold %.0f (no historical baseline)", volume, limit))
                    .build());
        }

        double dropPct = dropPercent(mean, volume);
        Severity severity = Severity.fromDropPercent(dropPct);
        LOG.debug("{}: volume {} below threshold {} - drop {}% -> {}", key, volume, limit, dropPct, severity);
        return Optional.of(alert
                .severity(severity)
                .dropPct(dropPct)
                .message(String.format(Locale.ROOT, "Volume dropped %.1f%% below historical mean", dropPct))
                .build());
    }

    /**
     * @return relative shortfall of {@code volume} below {@code mean}, in
     *         percent
     */
    public static double dropPercent(double mean, double volume) {
        return (mean - volume) / mean * 100.0;
    }
}

package com.volumesentinel.core.detection;

import com.volumesentinel.core.config.SensitivityPreset;
import com.volumesentinel.core.config.ThresholdOverride;
import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.FrequencyProfile;
import com.volumesentinel.core.model.ThresholdRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes one conservative lower-bound volume threshold per combination.
 *
 * <h3>Estimators</h3>
 * <ul>
 * <li>Z-score: {@code mean - adjustedZ * stdDev}, where
 * {@code adjustedZ = zScore * (1 + (1 - regularity) * 0.5)} widens the band
 * for irregular combinations</li>
 * <li>Percentile: the preset's percentile of the training volumes</li>
 * <li>IQR: {@code Q1 - 1.5 * (Q3 - Q1)}</li>
 * </ul>
 *
 * <p>
 * The final threshold is the highest of the three, clamped into
 * {@code [0, mean]}. Zero-volume weeks take part as legitimate low
 * observations; missing weeks are simply not in the input.
 * </p>
 *
 * <h3>Insufficient history</h3>
 * <p>
 * With fewer than {@code minWeeks} values no numeric threshold is computed
 * and the record is flagged, which suppresses drop alerting. An operator
 * override still applies and makes the combination alertable.
 * </p>
 *
 * <p>
 * Pure and thread-safe, provided the injected
 * {@link ThresholdOverrideProvider} is.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdCalculator.class);

    /** Maximum relative widening of z for a fully irregular combination. */
    static final double REGULARITY_WIDENING = 0.5;

    static final double IQR_MULTIPLIER = 1.5;

    private final ThresholdOverrideProvider overrides;

    public ThresholdCalculator() {
        this(ThresholdOverrideProvider.none());
    }

    public ThresholdCalculator(ThresholdOverrideProvider overrides) {
        this.overrides = Objects.requireNonNull(overrides, "overrides must not be null");
    }

    /**
     * @param key     the combination
     * @param volumes training volumes, zero weeks included
     * @param profile the combination's occurrence profile
     * @param preset  sensitivity parameters
     * @return the threshold record, flagged when history is insufficient
     */
    public ThresholdRecord calculate(CombinationKey key, double[] volumes, FrequencyProfile profile,
            SensitivityPreset preset) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(volumes, "volumes must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(preset, "preset must not be null");

        int sampleCount = volumes.length;
        double mean = VolumeStatistics.mean(volumes);
        double stdDev = VolumeStatistics.stdDev(volumes, mean);
        Optional<ThresholdOverride> override = overrides.find(key);

        ThresholdRecord.Builder record = ThresholdRecord.builder()
                .key(key)
                .mean(mean)
                .stdDev(stdDev)
                .cv(mean > 0 ? stdDev / mean : 0.0)
                .sampleCount(sampleCount)
                .sensitivityLevel(preset.getName())
                .frequencyProfile(profile);

        if (sampleCount < preset.getMinWeeks()) {
            LOG.debug("{}: insufficient history ({} < {} weeks)", key, sampleCount, preset.getMinWeeks());
            record.sufficientHistory(false).adjustedZ(preset.getZScore());
            override.ifPresent(o -> applyOverride(record, o));
            return record.build();
        }

        double adjustedZ = adjustedZ(preset.getZScore(), profile.getRegularity());
        double zThreshold = Math.max(0.0, mean - adjustedZ * stdDev);

        double[] sorted = volumes.clone();
        Arrays.sort(sorted);
        double percentileThreshold = Math.max(0.0,
                VolumeStatistics.percentileOfSorted(sorted, preset.getPercentile()));
        double q1 = VolumeStatistics.percentileOfSorted(sorted, 25);
        double q3 = VolumeStatistics.percentileOfSorted(sorted, 75);
        double iqrThreshold = Math.max(0.0, q1 - IQR_MULTIPLIER * (q3 - q1));

        double finalThreshold = Math.min(mean, Math.max(zThreshold, Math.max(percentileThreshold, iqrThreshold)));

        record.sufficientHistory(true)
                .adjustedZ(adjustedZ)
                .regularityAdjustmentApplied(adjustedZ != preset.getZScore())
                .zThreshold(zThreshold)
                .percentileThreshold(percentileThreshold)
                .iqrThreshold(iqrThreshold)
                .finalThreshold(Math.max(0.0, finalThreshold));
        override.ifPresent(o -> applyOverride(record, o));

        ThresholdRecord result = record.build();
        LOG.debug("{}: threshold={} (z={}, percentile={}, iqr={}, mean={}, adjustedZ={})",
                key, result.getFinalThreshold(), zThreshold, percentileThreshold, iqrThreshold, mean, adjustedZ);
        return result;
    }

    /**
     * Widen z for irregular combinations. Identity at {@code regularity == 1},
     * {@code 1.5 * zScore} at {@code regularity == 0}.
     */
    public static double adjustedZ(double zScore, double regularity) {
        double clamped = Math.max(0.0, Math.min(1.0, regularity));
        return zScore * (1 + (1 - clamped) * REGULARITY_WIDENING);
    }

    private static void applyOverride(ThresholdRecord.Builder record, ThresholdOverride override) {
        LOG.debug("Applying threshold override {}", override);
        record.finalThreshold(override.getThreshold())
                .overrideApplied(true)
                .overrideJustification(override.getJustification());
    }
}

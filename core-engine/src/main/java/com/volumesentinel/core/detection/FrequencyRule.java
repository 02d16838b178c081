package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.FrequencyPattern;

import java.util.Objects;

/**
 * One row of the {@link FrequencyRuleTable}: average gaps up to
 * {@code maxGapDays} belong to {@code pattern}, provided regularity reaches
 * {@code minRegularity}.
 *
 * <p>
 * {@code nominalGapDays} is the gap a textbook series of this pattern would
 * show; confidence peaks there and falls off towards the bucket edges.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrequencyRule {

    private final double maxGapDays;
    private final double minRegularity;
    private final double nominalGapDays;
    private final FrequencyPattern pattern;

    public FrequencyRule(double maxGapDays, double minRegularity, double nominalGapDays, FrequencyPattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        if (!(maxGapDays > 0)) {
            throw new IllegalArgumentException("maxGapDays must be > 0, got: " + maxGapDays);
        }
        if (minRegularity < 0 || minRegularity > 1) {
            throw new IllegalArgumentException("minRegularity must be in [0, 1], got: " + minRegularity);
        }
        if (nominalGapDays > maxGapDays) {
            throw new IllegalArgumentException(
                    "nominalGapDays must not exceed maxGapDays for " + pattern + ", got: " + nominalGapDays);
        }
        this.maxGapDays = maxGapDays;
        this.minRegularity = minRegularity;
        this.nominalGapDays = nominalGapDays;
    }

    public double getMaxGapDays() {
        return maxGapDays;
    }

    public double getMinRegularity() {
        return minRegularity;
    }

    public double getNominalGapDays() {
        return nominalGapDays;
    }

    public FrequencyPattern getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "FrequencyRule{" + pattern + " <= " + maxGapDays + "d, regularity >= " + minRegularity + '}';
    }
}

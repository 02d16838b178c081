package com.volumesentinel.core.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * Occurrence pattern of one combination.
 *
 * <p>
 * {@code regularity} is {@code 1 - min(cv, 1)} of the inter-occurrence gaps;
 * {@code confidence} expresses how well {@code avgGapDays} fits the chosen
 * bucket, discounted by low regularity. Both lie in {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrequencyProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    private final FrequencyPattern pattern;
    private final double confidence;
    private final double regularity;
    private final double avgGapDays;
    private final int occurrences;

    public FrequencyProfile(FrequencyPattern pattern, double confidence, double regularity,
            double avgGapDays, int occurrences) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.confidence = clampUnit(confidence);
        this.regularity = clampUnit(regularity);
        this.avgGapDays = avgGapDays;
        this.occurrences = occurrences;
    }

    /**
     * Lowest-confidence profile used when fewer than two occurrences exist.
     *
     * @param occurrences number of non-zero weeks seen (0 or 1)
     * @return an {@link FrequencyPattern#IRREGULAR} profile with zero confidence
     */
    public static FrequencyProfile insufficient(int occurrences) {
        return new FrequencyProfile(FrequencyPattern.IRREGULAR, 0.0, 0.0, 0.0, occurrences);
    }

    public FrequencyPattern getPattern() {
        return pattern;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getRegularity() {
        return regularity;
    }

    public double getAvgGapDays() {
        return avgGapDays;
    }

    public int getOccurrences() {
        return occurrences;
    }

    /**
     * One-line human-readable summary, e.g.
     * {@code DAILY pattern (confidence: high, regular) | Avg gap: 7.0 days | 52 occurrences}.
     *
     * @return summary text
     */
    public String describe() {
        String confidenceText = confidence > 0.7 ? "high" : confidence > 0.4 ? "medium" : "low";
        String regularityText = regularity > 0.7 ? "regular" : regularity > 0.4 ? "somewhat regular" : "irregular";
        return String.format(Locale.ROOT, "%s pattern (confidence: %s, %s) | Avg gap: %.1f days | %d occurrences",
                pattern.name(), confidenceText, regularityText, avgGapDays, occurrences);
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FrequencyProfile that))
            return false;
        return pattern == that.pattern
                && Double.compare(confidence, that.confidence) == 0
                && Double.compare(regularity, that.regularity) == 0
                && Double.compare(avgGapDays, that.avgGapDays) == 0
                && occurrences == that.occurrences;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, confidence, regularity, avgGapDays, occurrences);
    }

    @Override
    public String toString() {
        return "FrequencyProfile{" +
                "pattern=" + pattern +
                ", confidence=" + confidence +
                ", regularity=" + regularity +
                ", avgGapDays=" + avgGapDays +
                ", occurrences=" + occurrences +
                '}';
    }
}

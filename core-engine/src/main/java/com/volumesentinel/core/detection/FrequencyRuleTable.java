package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.FrequencyPattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered {@code (maxGap, minRegularity) -> pattern} policy used by
 * {@link FrequencyDetector}.
 *
 * <p>
 * Rules are evaluated top to bottom. The first rule whose {@code maxGapDays}
 * covers the average gap owns the bucket; its lower edge is the previous
 * rule's {@code maxGapDays}. If regularity is below the owning rule's
 * minimum, or no rule covers the gap, the pattern is
 * {@link FrequencyPattern#IRREGULAR}.
 * </p>
 *
 * <h3>Scattered gaps</h3>
 * <p>
 * Regularity alone cannot reject gaps drawn at random from a wide range: a
 * uniform spread has a gap CV near 0.55 and so a regularity near 0.45. The
 * table therefore also takes the cadence share, the fraction of gaps that
 * fall on the two most common gap lengths. A series with a real cadence keeps
 * its gaps on one or two lengths (every week, or every week with the odd skip)
 * even when regularity is middling; a random one spreads them thinly. A share
 * below {@link #DEFAULT_MIN_CADENCE_SHARE} makes an otherwise bucketed series
 * {@link FrequencyPattern#IRREGULAR}.
 * </p>
 *
 * <h3>Daily versus weekly</h3>
 * <p>
 * Observations are weekly aggregates, so a combination that trades every day
 * and one that trades once a week both show a 7-day gap. The split is the
 * policy constant {@link #DEFAULT_DAILY_WEEKLY_SPLIT_DAYS}: a combination
 * present in every week ({@code avgGap <= 7.5}) is {@code DAILY}; one that
 * skips the odd week ({@code 7.5 < avgGap <= 10}) is {@code WEEKLY}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrequencyRuleTable {

    public static final double DEFAULT_DAILY_WEEKLY_SPLIT_DAYS = 7.5;

    /** Below this regularity no cadence is trusted. */
    public static final double DEFAULT_MIN_REGULARITY = 0.3;

    /** Below this cadence share the gaps are scattered rather than periodic. */
    public static final double DEFAULT_MIN_CADENCE_SHARE = 0.5;

    /** Why a gap was (or was not) assigned to a bucket. */
    public enum Reason {
        BUCKET,
        LOW_REGULARITY,
        SCATTERED,
        OUT_OF_RANGE
    }

    /**
     * Outcome of a table lookup.
     */
    public static final class Match {
        private final FrequencyPattern pattern;
        private final Reason reason;
        private final double bucketFit;

        Match(FrequencyPattern pattern, Reason reason, double bucketFit) {
            this.pattern = pattern;
            this.reason = reason;
            this.bucketFit = bucketFit;
        }

        public FrequencyPattern getPattern() {
            return pattern;
        }

        public Reason getReason() {
            return reason;
        }

        /**
         * @return 1 at the bucket's nominal gap, falling linearly to 0 at its
         *         edges; 0 when no bucket was assigned
         */
        public double getBucketFit() {
            return bucketFit;
        }
    }

    private final List<FrequencyRule> rules;
    private final double minCadenceShare;

    /**
     * @param rules rules in evaluation order, strictly ascending by
     *              {@code maxGapDays}
     * @throws IllegalArgumentException if the rules are empty or unordered
     */
    public FrequencyRuleTable(List<FrequencyRule> rules) {
        this(rules, DEFAULT_MIN_CADENCE_SHARE);
    }

    /**
     * @param rules           rules in evaluation order, strictly ascending by
     *                        {@code maxGapDays}
     * @param minCadenceShare smallest cadence share still treated as periodic,
     *                        in [0, 1]; 0 disables the check
     * @throws IllegalArgumentException if the rules are empty or unordered, or
     *                                  the share is out of range
     */
    public FrequencyRuleTable(List<FrequencyRule> rules, double minCadenceShare) {
        Objects.requireNonNull(rules, "rules must not be null");
        if (minCadenceShare < 0 || minCadenceShare > 1) {
            throw new IllegalArgumentException("minCadenceShare must be in [0, 1], got: " + minCadenceShare);
        }
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Frequency rule table must not be empty");
        }
        double previous = 0;
        for (FrequencyRule rule : rules) {
            Objects.requireNonNull(rule, "rule must not be null");
            if (rule.getMaxGapDays() <= previous) {
                throw new IllegalArgumentException(
                        "Rules must be strictly ascending by maxGapDays, offending rule: " + rule);
            }
            if (rule.getNominalGapDays() < previous) {
                throw new IllegalArgumentException(
                        "nominalGapDays lies below the bucket's lower edge " + previous + ": " + rule);
            }
            previous = rule.getMaxGapDays();
        }
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.minCadenceShare = minCadenceShare;
    }

    public static FrequencyRuleTable standard() {
        return standard(DEFAULT_DAILY_WEEKLY_SPLIT_DAYS);
    }

    /**
     * Standard buckets with a custom daily/weekly split.
     *
     * @param dailyWeeklySplitDays largest average gap still classified as
     *                             daily; must lie in [7, 10)
     */
    public static FrequencyRuleTable standard(double dailyWeeklySplitDays) {
        if (dailyWeeklySplitDays < 7 || dailyWeeklySplitDays >= 10) {
            throw new IllegalArgumentException(
                    "dailyWeeklySplitDays must be in [7, 10), got: " + dailyWeeklySplitDays);
        }
        double r = DEFAULT_MIN_REGULARITY;
        return new FrequencyRuleTable(List.of(
                new FrequencyRule(dailyWeeklySplitDays, r, 7, FrequencyPattern.DAILY),
                new FrequencyRule(10, r, (dailyWeeklySplitDays + 10) / 2, FrequencyPattern.WEEKLY),
                new FrequencyRule(20, r, 14, FrequencyPattern.BIWEEKLY),
                new FrequencyRule(45, r, 30, FrequencyPattern.MONTHLY),
                new FrequencyRule(120, r, 91, FrequencyPattern.QUARTERLY),
                new FrequencyRule(220, r, 182, FrequencyPattern.SEMI_ANNUAL)));
    }

    public List<FrequencyRule> getRules() {
        return rules;
    }

    public double getMinCadenceShare() {
        return minCadenceShare;
    }

    /**
     * Lookup for a series whose gaps all sit on a cadence.
     *
     * @param avgGapDays mean gap between occurrences
     * @param regularity gap regularity in [0, 1]
     * @return the matched pattern with the reason and bucket fit
     */
    public Match classify(double avgGapDays, double regularity) {
        return classify(avgGapDays, regularity, 1.0);
    }

    /**
     * @param avgGapDays   mean gap between occurrences
     * @param regularity   gap regularity in [0, 1]
     * @param cadenceShare fraction of gaps on the two most common gap lengths
     * @return the matched pattern with the reason and bucket fit
     */
    public Match classify(double avgGapDays, double regularity, double cadenceShare) {
        double lowerEdge = 0;
        for (FrequencyRule rule : rules) {
            if (avgGapDays <= rule.getMaxGapDays()) {
                if (regularity < rule.getMinRegularity()) {
                    return new Match(FrequencyPattern.IRREGULAR, Reason.LOW_REGULARITY, 0.0);
                }
                if (cadenceShare < minCadenceShare) {
                    return new Match(FrequencyPattern.IRREGULAR, Reason.SCATTERED, 0.0);
                }
                return new Match(rule.getPattern(), Reason.BUCKET, bucketFit(rule, lowerEdge, avgGapDays));
            }
            lowerEdge = rule.getMaxGapDays();
        }
        return new Match(FrequencyPattern.IRREGULAR, Reason.OUT_OF_RANGE, 0.0);
    }

    private static double bucketFit(FrequencyRule rule, double lowerEdge, double gap) {
        double nominal = rule.getNominalGapDays();
        double fit;
        if (gap <= nominal) {
            fit = nominal > lowerEdge ? 1 - (nominal - gap) / (nominal - lowerEdge) : 1.0;
        } else {
            fit = 1 - (gap - nominal) / (rule.getMaxGapDays() - nominal);
        }
        return Math.max(0.0, Math.min(1.0, fit));
    }
}

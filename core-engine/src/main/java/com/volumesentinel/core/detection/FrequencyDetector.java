package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.CombinationSeries;
import com.volumesentinel.core.model.FrequencyProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies how often a combination actually occurs, from the spacing of
 * its non-zero weeks rather than from how many weeks it appears in.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Gaps in days between consecutive occurrence dates.</li>
 * <li>{@code cv = std(gaps) / mean(gaps)}, taken as 0 when the mean gap is 0;
 * {@code regularity = 1 - min(cv, 1)}.</li>
 * <li>Cadence share: the fraction of gaps, rounded to whole weeks, that fall
 * on the two most common gap lengths. Taken as 1 below
 * {@value #MIN_GAPS_FOR_CADENCE_SHARE} gaps.</li>
 * <li>The average gap, regularity and cadence share are looked up in a
 * {@link FrequencyRuleTable}.</li>
 * <li>Confidence is the bucket fit scaled into {@code [0.5, 1]} and
 * multiplied by regularity. An irregular verdict caused by varying gaps
 * carries {@code 1 - regularity}; one caused by scattered gap lengths carries
 * {@code 1 - cadenceShare}; one caused by gaps beyond every bucket carries
 * {@code regularity / 2}.</li>
 * </ol>
 *
 * <p>
 * Never throws for well-formed input: fewer than two occurrences yield
 * {@link FrequencyProfile#insufficient(int)}. Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class FrequencyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(FrequencyDetector.class);

    /** Fewer gaps than this cannot show whether their lengths cluster. */
    static final int MIN_GAPS_FOR_CADENCE_SHARE = 6;

    private final FrequencyRuleTable ruleTable;

    public FrequencyDetector() {
        this(FrequencyRuleTable.standard());
    }

    public FrequencyDetector(FrequencyRuleTable ruleTable) {
        this.ruleTable = Objects.requireNonNull(ruleTable, "ruleTable must not be null");
    }

    /**
     * @param series the combination's history; zero-volume weeks count as
     *               absence
     * @return the occurrence profile
     */
    public FrequencyProfile detect(CombinationSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        FrequencyProfile profile = detect(series.occurrenceDates());
        LOG.debug("Profiled {}: {}", series.getKey(), profile.describe());
        return profile;
    }

    /**
     * @param occurrenceDates dates with traffic, in any order
     * @return the occurrence profile
     */
    public FrequencyProfile detect(List<LocalDate> occurrenceDates) {
        Objects.requireNonNull(occurrenceDates, "occurrenceDates must not be null");
        int occurrences = occurrenceDates.size();
        if (occurrences < 2) {
            return FrequencyProfile.insufficient(occurrences);
        }

        List<LocalDate> dates = new ArrayList<>(occurrenceDates);
        dates.sort(null);
        double[] gaps = new double[dates.size() - 1];
        for (int i = 0; i < gaps.length; i++) {
            gaps[i] = ChronoUnit.DAYS.between(dates.get(i), dates.get(i + 1));
        }

        double avgGap = VolumeStatistics.mean(gaps);
        double cv = avgGap > 0 ? VolumeStatistics.stdDev(gaps, avgGap) / avgGap : 0.0;
        double regularity = regularity(cv);
        double cadenceShare = cadenceShare(gaps);

        FrequencyRuleTable.Match match = ruleTable.classify(avgGap, regularity, cadenceShare);
        double confidence = switch (match.getReason()) {
            case BUCKET -> (0.5 + 0.5 * match.getBucketFit()) * regularity;
            case LOW_REGULARITY -> 1 - regularity;
            case SCATTERED -> 1 - cadenceShare;
            case OUT_OF_RANGE -> regularity * 0.5;
        };

        return new FrequencyProfile(match.getPattern(), confidence, regularity, avgGap, occurrences);
    }

    /**
     * @param cv coefficient of variation of the gaps
     * @return {@code 1 - min(cv, 1)}, non-increasing in {@code cv}
     */
    static double regularity(double cv) {
        return 1 - Math.min(Math.max(cv, 0.0), 1.0);
    }

    /**
     * @param gapsDays gaps between consecutive occurrences, in days
     * @return fraction of gaps on the two most common whole-week lengths, or
     *         1 when there are too few gaps to tell
     */
    static double cadenceShare(double[] gapsDays) {
        if (gapsDays.length < MIN_GAPS_FOR_CADENCE_SHARE) {
            return 1.0;
        }
        Map<Long, Integer> counts = new HashMap<>();
        for (double gap : gapsDays) {
            counts.merge(Math.round(gap / 7.0), 1, Integer::sum);
        }
        int first = 0;
        int second = 0;
        for (int count : counts.values()) {
            if (count > first) {
                second = first;
                first = count;
            } else if (count > second) {
                second = count;
            }
        }
        return (double) (first + second) / gapsDays.length;
    }

    public FrequencyRuleTable getRuleTable() {
        return ruleTable;
    }
}

package com.volumesentinel.core.trend;

import com.volumesentinel.core.detection.VolumeStatistics;
import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.CombinationSeries;
import com.volumesentinel.core.model.ComparisonStatus;
import com.volumesentinel.core.model.RecentComparison;
import com.volumesentinel.core.model.TrendDirection;
import com.volumesentinel.core.model.TrendRecord;
import com.volumesentinel.core.model.VolumeObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Describes how a combination's volume is moving over several trailing
 * windows.
 *
 * <p>
 * For each {@link TrendWindow} the weeks in {@code (reference - days,
 * reference]} are taken in order and summarised: mean, total, extremes,
 * median, least-squares slope over the week index, half-over-half growth and
 * volatility (coefficient of variation). A window with fewer than two points
 * is {@link TrendDirection#UNDETERMINED}.
 * </p>
 *
 * <p>
 * Output is diagnostic only and never feeds into thresholds. Stateless and
 * thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    /** Growth within plus or minus this percentage counts as stable. */
    static final double STABLE_BAND_PCT = 5.0;

    /** Recent change within plus or minus this percentage counts as normal. */
    static final double NORMAL_BAND_PCT = 10.0;

    public static final int DEFAULT_RECENT_WEEKS = 4;

    private final List<TrendWindow> windows;

    public TrendAnalyzer() {
        this(Arrays.asList(TrendWindow.values()));
    }

    public TrendAnalyzer(List<TrendWindow> windows) {
        Objects.requireNonNull(windows, "windows must not be null");
        if (windows.isEmpty()) {
            throw new IllegalArgumentException("At least one trend window is required");
        }
        this.windows = List.copyOf(windows);
    }

    public List<TrendWindow> getWindows() {
        return windows;
    }

    /**
     * Analyse every configured window, anchored on the latest observed week.
     *
     * @param series the combination's history
     * @return one record per window, in menu order
     */
    public List<TrendRecord> analyze(CombinationSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        return analyze(series, series.latestWeek().orElse(null));
    }

    /**
     * @param series    the combination's history
     * @param reference last week included in every window; {@code null}
     *                  for an empty series
     * @return one record per window, in menu order
     */
    public List<TrendRecord> analyze(CombinationSeries series, LocalDate reference) {
        Objects.requireNonNull(series, "series must not be null");
        List<TrendRecord> records = new ArrayList<>(windows.size());
        for (TrendWindow window : windows) {
            double[] volumes = reference == null ? new double[0] : windowVolumes(series, reference, window);
            records.add(summarise(series.getKey(), window, volumes));
        }
        LOG.debug("Analysed {} trend window(s) for {}", records.size(), series.getKey());
        return records;
    }

    /**
     * Compare the mean of the last {@code recentWeeks} observations with the
     * mean of the whole series.
     *
     * @param series      the combination's history
     * @param recentWeeks number of trailing observations; must be positive
     * @return the comparison, {@link ComparisonStatus#INSUFFICIENT_DATA} with
     *         fewer than {@code recentWeeks + 4} observations
     */
    public RecentComparison compareRecentToHistorical(CombinationSeries series, int recentWeeks) {
        Objects.requireNonNull(series, "series must not be null");
        if (recentWeeks < 1) {
            throw new IllegalArgumentException("recentWeeks must be >= 1, got: " + recentWeeks);
        }
        CombinationKey key = series.getKey();
        double[] volumes = series.volumes();
        if (volumes.length < recentWeeks + 4) {
            return RecentComparison.insufficient(key, recentWeeks);
        }

        double recentAvg = VolumeStatistics.mean(Arrays.copyOfRange(volumes, volumes.length - recentWeeks,
                volumes.length));
        double historicalAvg = VolumeStatistics.mean(volumes);
        double changePct = historicalAvg > 0 ? (recentAvg - historicalAvg) / historicalAvg * 100.0 : 0.0;

        ComparisonStatus status;
        if (changePct > NORMAL_BAND_PCT) {
            status = ComparisonStatus.INCREASING;
        } else if (changePct < -NORMAL_BAND_PCT) {
            status = ComparisonStatus.DECREASING;
        } else {
            status = ComparisonStatus.NORMAL;
        }
        return new RecentComparison(key, recentWeeks, recentAvg, historicalAvg, changePct, status);
    }

    public RecentComparison compareRecentToHistorical(CombinationSeries series) {
        return compareRecentToHistorical(series, DEFAULT_RECENT_WEEKS);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double[] windowVolumes(CombinationSeries series, LocalDate reference, TrendWindow window) {
        LocalDate cutoff = reference.minusDays(window.getDays());
        return series.getObservations().stream()
                .filter(o -> o.getWeekStartDate().isAfter(cutoff) && !o.getWeekStartDate().isAfter(reference))
                .mapToDouble(VolumeObservation::getVolume)
                .toArray();
    }

    private static TrendRecord summarise(CombinationKey key, TrendWindow window, double[] volumes) {
        TrendRecord.Builder record = TrendRecord.builder()
                .key(key)
                .windowLabel(window.getLabel())
                .dataPoints(volumes.length);

        if (volumes.length == 0) {
            return record.trendDirection(TrendDirection.UNDETERMINED).build();
        }

        double mean = VolumeStatistics.mean(volumes);
        double total = Arrays.stream(volumes).sum();
        record.avgVolume(mean)
                .totalVolume(total)
                .minVolume(Arrays.stream(volumes).min().orElse(0))
                .maxVolume(Arrays.stream(volumes).max().orElse(0))
                .medianVolume(VolumeStatistics.median(volumes))
                .volatility(mean > 0 ? VolumeStatistics.stdDev(volumes, mean) / mean : 0.0);

        if (volumes.length < 2) {
            return record.trendDirection(TrendDirection.UNDETERMINED).build();
        }

        int half = volumes.length / 2;
        double firstHalf = VolumeStatistics.mean(Arrays.copyOfRange(volumes, 0, half));
        double secondHalf = VolumeStatistics.mean(Arrays.copyOfRange(volumes, half, volumes.length));
        double growthRate = firstHalf > 0 ? (secondHalf - firstHalf) / firstHalf * 100.0 : 0.0;

        return record.slope(VolumeStatistics.slope(volumes))
                .growthRatePct(growthRate)
                .trendDirection(direction(growthRate))
                .build();
    }

    static TrendDirection direction(double growthRatePct) {
        if (growthRatePct > STABLE_BAND_PCT) {
            return TrendDirection.INCREASING;
        }
        if (growthRatePct < -STABLE_BAND_PCT) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }
}

package com.volumesentinel.core.trend;

import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.CombinationSeries;
import com.volumesentinel.core.model.ComparisonStatus;
import com.volumesentinel.core.model.RecentComparison;
import com.volumesentinel.core.model.TrendDirection;
import com.volumesentinel.core.model.TrendRecord;
import com.volumesentinel.core.model.VolumeObservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToLongFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendAnalyzer}.
 */
class TrendAnalyzerTest {

    private static final CombinationKey KEY = CombinationKey.of("SYS_A", "MT103");
    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    @Test
    @DisplayName("Should emit one record per window in menu order")
    void shouldCoverEveryWindow() {
        List<TrendRecord> records = analyzer.analyze(weekly(52, i -> 1000));

        assertThat(records).extracting(TrendRecord::getWindowLabel).containsExactly(
                "2_weeks", "1_month", "3_months", "6_months", "9_months", "12_months", "18_months");
        assertThat(records).extracting(TrendRecord::getDataPoints).containsExactly(2, 4, 13, 26, 39, 52, 52);
    }

    @Test
    @DisplayName("Steady growth is increasing over long windows and stable over short ones")
    void shouldDetectGrowth() {
        List<TrendRecord> records = analyzer.analyze(weekly(52, i -> 1000 + 100L * i));
        TrendRecord twoWeeks = records.get(0);
        TrendRecord year = records.get(5);

        assertThat(twoWeeks.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(year.getTrendDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(year.getSlope()).isCloseTo(100.0, within(1e-6));
        assertThat(year.getMinVolume()).isEqualTo(1000.0);
        assertThat(year.getMaxVolume()).isEqualTo(6100.0);
        assertThat(year.getMedianVolume()).isCloseTo(3550.0, within(1e-9));
        assertThat(year.getTotalVolume()).isEqualTo(52 * 1000 + 100.0 * (51 * 52 / 2));
    }

    @Test
    @DisplayName("Declining volume is decreasing")
    void shouldDetectDecline() {
        TrendRecord quarter = analyzer.analyze(weekly(13, i -> 2000 - 100L * i)).get(2);

        assertThat(quarter.getTrendDirection()).isEqualTo(TrendDirection.DECREASING);
        assertThat(quarter.getGrowthRatePct()).isNegative();
    }

    @Test
    @DisplayName("Constant volume is stable with zero volatility")
    void shouldReportStableConstantVolume() {
        TrendRecord quarter = analyzer.analyze(weekly(13, i -> 500)).get(2);

        assertThat(quarter.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(quarter.getVolatility()).isZero();
        assertThat(quarter.getGrowthRatePct()).isZero();
    }

    @Test
    @DisplayName("Windows with fewer than two points are undetermined")
    void shouldLeaveSparseWindowsUndetermined() {
        List<TrendRecord> single = analyzer.analyze(weekly(1, i -> 700));
        List<TrendRecord> empty = analyzer.analyze(CombinationSeries.empty(KEY));

        assertThat(single).allSatisfy(r -> {
            assertThat(r.getTrendDirection()).isEqualTo(TrendDirection.UNDETERMINED);
            assertThat(r.getDataPoints()).isEqualTo(1);
            assertThat(r.getAvgVolume()).isEqualTo(700.0);
        });
        assertThat(empty).hasSize(TrendWindow.values().length)
                .allSatisfy(r -> assertThat(r.getDataPoints()).isZero());
    }

    @Test
    @DisplayName("A zero first half yields zero growth instead of dividing by zero")
    void shouldGuardZeroFirstHalf() {
        TrendRecord month = analyzer.analyze(weekly(4, i -> i < 2 ? 0 : 10)).get(1);

        assertThat(month.getGrowthRatePct()).isZero();
        assertThat(month.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    @DisplayName("Windows are anchored on the given reference week")
    void shouldAnchorOnReference() {
        CombinationSeries series = weekly(52, i -> 1000);

        TrendRecord twoWeeks = analyzer.analyze(series, START.plusWeeks(10)).get(0);

        assertThat(twoWeeks.getDataPoints()).isEqualTo(2);
    }

    @Test
    @DisplayName("The stable band is inclusive at plus or minus five percent")
    void shouldClassifyDirectionBand() {
        assertThat(TrendAnalyzer.direction(5.0)).isEqualTo(TrendDirection.STABLE);
        assertThat(TrendAnalyzer.direction(-5.0)).isEqualTo(TrendDirection.STABLE);
        assertThat(TrendAnalyzer.direction(5.01)).isEqualTo(TrendDirection.INCREASING);
        assertThat(TrendAnalyzer.direction(-5.01)).isEqualTo(TrendDirection.DECREASING);
    }

    @Test
    @DisplayName("A recent slump is reported as decreasing against the full history")
    void shouldCompareRecentToHistorical() {
        RecentComparison comparison = analyzer.compareRecentToHistorical(weekly(20, i -> i < 16 ? 1000 : 500));

        assertThat(comparison.getRecentAvg()).isEqualTo(500.0);
        assertThat(comparison.getHistoricalAvg()).isEqualTo(900.0);
        assertThat(comparison.getChangePct()).isCloseTo(-44.44, within(0.01));
        assertThat(comparison.getStatus()).isEqualTo(ComparisonStatus.DECREASING);
    }

    @Test
    @DisplayName("Comparison needs at least recent weeks plus four")
    void shouldRequireEnoughWeeksForComparison() {
        assertThat(analyzer.compareRecentToHistorical(weekly(7, i -> 100)).getStatus())
                .isEqualTo(ComparisonStatus.INSUFFICIENT_DATA);
        assertThat(analyzer.compareRecentToHistorical(weekly(8, i -> 100)).getStatus())
                .isEqualTo(ComparisonStatus.NORMAL);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static CombinationSeries weekly(int weeks, IntToLongFunction volume) {
        List<VolumeObservation> rows = new ArrayList<>(weeks);
        for (int i = 0; i < weeks; i++) {
            rows.add(new VolumeObservation("SYS_A", "MT103", START.plusWeeks(i), volume.applyAsLong(i)));
        }
        return CombinationSeries.of(KEY, rows);
    }
}

package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.FrequencyPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FrequencyRuleTable}.
 */
class FrequencyRuleTableTest {

    private final FrequencyRuleTable table = FrequencyRuleTable.standard();

    @Test
    @DisplayName("Bucket upper edges are inclusive")
    void shouldTreatUpperEdgesAsInclusive() {
        assertThat(table.classify(7.5, 1.0).getPattern()).isEqualTo(FrequencyPattern.DAILY);
        assertThat(table.classify(7.6, 1.0).getPattern()).isEqualTo(FrequencyPattern.WEEKLY);
        assertThat(table.classify(10, 1.0).getPattern()).isEqualTo(FrequencyPattern.WEEKLY);
        assertThat(table.classify(20, 1.0).getPattern()).isEqualTo(FrequencyPattern.BIWEEKLY);
        assertThat(table.classify(45, 1.0).getPattern()).isEqualTo(FrequencyPattern.MONTHLY);
        assertThat(table.classify(120, 1.0).getPattern()).isEqualTo(FrequencyPattern.QUARTERLY);
        assertThat(table.classify(220, 1.0).getPattern()).isEqualTo(FrequencyPattern.SEMI_ANNUAL);
    }

    @Test
    @DisplayName("Gaps beyond every bucket are out of range")
    void shouldReportOutOfRange() {
        FrequencyRuleTable.Match match = table.classify(220.5, 1.0);

        assertThat(match.getPattern()).isEqualTo(FrequencyPattern.IRREGULAR);
        assertThat(match.getReason()).isEqualTo(FrequencyRuleTable.Reason.OUT_OF_RANGE);
    }

    @Test
    @DisplayName("The owning bucket rejects low regularity without falling through")
    void shouldRejectLowRegularityInOwningBucket() {
        FrequencyRuleTable.Match match = table.classify(30, 0.29);

        assertThat(match.getPattern()).isEqualTo(FrequencyPattern.IRREGULAR);
        assertThat(match.getReason()).isEqualTo(FrequencyRuleTable.Reason.LOW_REGULARITY);
        assertThat(table.classify(30, 0.3).getPattern()).isEqualTo(FrequencyPattern.MONTHLY);
    }

    @Test
    @DisplayName("Scattered gap lengths make an otherwise bucketed series irregular")
    void shouldRejectScatteredGaps() {
        FrequencyRuleTable.Match match = table.classify(94, 0.45, 0.2);

        assertThat(match.getPattern()).isEqualTo(FrequencyPattern.IRREGULAR);
        assertThat(match.getReason()).isEqualTo(FrequencyRuleTable.Reason.SCATTERED);
        assertThat(table.classify(94, 0.45, 0.5).getPattern()).isEqualTo(FrequencyPattern.QUARTERLY);
        assertThat(table.classify(94, 0.45).getPattern()).isEqualTo(FrequencyPattern.QUARTERLY);
    }

    @Test
    @DisplayName("A zero minimum cadence share disables the scatter check")
    void shouldAllowDisablingScatterCheck() {
        FrequencyRuleTable lenient = new FrequencyRuleTable(table.getRules(), 0.0);

        assertThat(lenient.classify(94, 0.45, 0.1).getPattern()).isEqualTo(FrequencyPattern.QUARTERLY);
        assertThatThrownBy(() -> new FrequencyRuleTable(table.getRules(), 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minCadenceShare");
    }

    @Test
    @DisplayName("Bucket fit is 1 at the nominal gap and 0 at the far edge")
    void shouldComputeBucketFit() {
        assertThat(table.classify(14, 1.0).getBucketFit()).isEqualTo(1.0);
        assertThat(table.classify(20, 1.0).getBucketFit()).isEqualTo(0.0);
        assertThat(table.classify(17, 1.0).getBucketFit()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("The daily/weekly split is configurable")
    void shouldHonourCustomSplit() {
        FrequencyRuleTable wide = FrequencyRuleTable.standard(9.0);

        assertThat(table.classify(8.0, 1.0).getPattern()).isEqualTo(FrequencyPattern.WEEKLY);
        assertThat(wide.classify(8.0, 1.0).getPattern()).isEqualTo(FrequencyPattern.DAILY);
        assertThat(wide.classify(9.5, 1.0).getPattern()).isEqualTo(FrequencyPattern.WEEKLY);
    }

    @Test
    @DisplayName("Should reject a split outside [7, 10)")
    void shouldRejectInvalidSplit() {
        assertThatThrownBy(() -> FrequencyRuleTable.standard(10.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dailyWeeklySplitDays");
        assertThatThrownBy(() -> FrequencyRuleTable.standard(6.9))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject rules that are not strictly ascending")
    void shouldRejectUnorderedRules() {
        List<FrequencyRule> rules = List.of(
                new FrequencyRule(45, 0.3, 30, FrequencyPattern.MONTHLY),
                new FrequencyRule(20, 0.3, 14, FrequencyPattern.BIWEEKLY));

        assertThatThrownBy(() -> new FrequencyRuleTable(rules))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ascending");
        assertThatThrownBy(() -> new FrequencyRuleTable(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

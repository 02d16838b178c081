package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.Alert;
import com.volumesentinel.core.model.AlertType;
import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.FrequencyProfile;
import com.volumesentinel.core.model.Severity;
import com.volumesentinel.core.model.ThresholdRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AlertClassifier}.
 */
class AlertClassifierTest {

    private static final CombinationKey KEY = CombinationKey.of("SYS_A", "MT103");
    private static final LocalDate WEEK = LocalDate.of(2024, 6, 3);

    private final AlertClassifier classifier = new AlertClassifier();

    @Test
    @DisplayName("A volume far below an 8M threshold on a 10M mean is CRITICAL")
    void shouldRaiseCriticalForLargeDrop() {
        Optional<Alert> alert = classifier.classify(KEY, WEEK, OptionalLong.of(2_167_569),
                usable(8_000_000, 10_000_000), 9_500_000.0);

        assertThat(alert).isPresent();
        assertThat(alert.get().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.get().getAlertType()).isEqualTo(AlertType.VOLUME_DROP);
        assertThat(alert.get().getDropPct()).isCloseTo(78.3, within(0.05));
        assertThat(alert.get().getCurrentVolume()).isEqualTo(2_167_569);
        assertThat(alert.get().getThreshold()).isEqualTo(8_000_000.0);
        assertThat(alert.get().getRecentAverage()).isEqualTo(9_500_000.0);
        assertThat(alert.get().isNoData()).isFalse();
        assertThat(alert.get().getMessage()).isEqualTo("Volume dropped 78.3% below historical mean");
    }

    @Test
    @DisplayName("Should assign each severity tier by drop percentage")
    void shouldAssignSeverityTiers() {
        ThresholdRecord threshold = usable(9_500, 10_000);

        assertThat(severityFor(2_500, threshold)).isEqualTo(Severity.CRITICAL); // 75%
        assertThat(severityFor(4_000, threshold)).isEqualTo(Severity.HIGH); // 60%
        assertThat(severityFor(6_000, threshold)).isEqualTo(Severity.MEDIUM); // 40%
        assertThat(severityFor(9_000, threshold)).isEqualTo(Severity.LOW); // 10%
    }

    @Test
    @DisplayName("A missing check week is a CRITICAL NO_DATA alert")
    void shouldRaiseNoDataForMissingWeek() {
        Optional<Alert> alert = classifier.classify(KEY, WEEK, OptionalLong.empty(),
                usable(8_000_000, 10_000_000), null);

        assertThat(alert).isPresent();
        assertThat(alert.get().isNoData()).isTrue();
        assertThat(alert.get().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.get().getDropPct()).isEqualTo(100.0);
        assertThat(alert.get().getCurrentVolume()).isZero();
        assertThat(alert.get().getMessage()).isEqualTo(AlertClassifier.NO_DATA_MESSAGE);
    }

    @Test
    @DisplayName("NO_DATA fires even when the history is insufficient")
    void shouldRaiseNoDataWithInsufficientHistory() {
        Optional<Alert> alert = classifier.classify(KEY, WEEK, OptionalLong.empty(), insufficient(), null);

        assertThat(alert).isPresent();
        assertThat(alert.get().getAlertType()).isEqualTo(AlertType.NO_DATA);
        assertThat(alert.get().getThreshold()).isNull();
    }

    @Test
    @DisplayName("Insufficient history suppresses drop alerts")
    void shouldSuppressDropWithInsufficientHistory() {
        assertThat(classifier.classify(KEY, WEEK, OptionalLong.of(0), insufficient(), null)).isEmpty();
    }

    @Test
    @DisplayName("A volume exactly at the threshold does not alert")
    void shouldNotAlertAtThreshold() {
        ThresholdRecord threshold = usable(8_000, 10_000);

        assertThat(classifier.classify(KEY, WEEK, OptionalLong.of(8_000), threshold, null)).isEmpty();
        assertThat(classifier.classify(KEY, WEEK, OptionalLong.of(12_000), threshold, null)).isEmpty();
        assertThat(classifier.classify(KEY, WEEK, OptionalLong.of(7_999), threshold, null)).isPresent();
    }

    @Test
    @DisplayName("A zero mean raises LOW on the absolute comparison without dividing")
    void shouldHandleZeroMean() {
        Optional<Alert> alert = classifier.classify(KEY, WEEK, OptionalLong.of(10), usable(50, 0), null);

        assertThat(alert).isPresent();
        assertThat(alert.get().getSeverity()).isEqualTo(Severity.LOW);
        assertThat(alert.get().getDropPct()).isZero();
        assertThat(alert.get().getMessage()).isEqualTo("Volume 10 below threshold 50 (no historical baseline)");
    }

    @Test
    @DisplayName("Drop percentage is relative to the mean")
    void shouldComputeDropPercent() {
        assertThat(AlertClassifier.dropPercent(200, 50)).isEqualTo(75.0);
        assertThat(AlertClassifier.dropPercent(200, 200)).isZero();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Severity severityFor(long volume, ThresholdRecord threshold) {
        return classifier.classify(KEY, WEEK, OptionalLong.of(volume), threshold, null)
                .map(Alert::getSeverity)
                .orElseThrow();
    }

    private static ThresholdRecord usable(double finalThreshold, double mean) {
        return ThresholdRecord.builder()
                .key(KEY)
                .sufficientHistory(true)
                .finalThreshold(finalThreshold)
                .mean(mean)
                .sampleCount(20)
                .sensitivityLevel("medium")
                .adjustedZ(2.0)
                .frequencyProfile(FrequencyProfile.insufficient(0))
                .build();
    }

    private static ThresholdRecord insufficient() {
        return ThresholdRecord.builder()
                .key(KEY)
                .sufficientHistory(false)
                .sampleCount(2)
                .sensitivityLevel("medium")
                .adjustedZ(2.0)
                .frequencyProfile(FrequencyProfile.insufficient(2))
                .build();
    }
}

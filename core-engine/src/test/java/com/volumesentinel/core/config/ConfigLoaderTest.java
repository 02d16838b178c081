package com.volumesentinel.core.config;

import com.volumesentinel.core.detection.ThresholdCalculator;
import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.FrequencyProfile;
import com.volumesentinel.core.model.ThresholdRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load presets and overrides from classpath")
    void shouldLoadFromClasspath() {
        MonitoringConfig config = ConfigLoader.fromClasspath("test-monitoring.yml");

        assertThat(config.getSensitivity()).isEqualTo("strict");
        assertThat(config.getPresets()).hasSize(1);
        assertThat(config.getOverrides()).hasSize(1);

        SensitivityPreset strict = config.resolveDefaultPreset();
        assertThat(strict.getName()).isEqualTo("strict");
        assertThat(strict.getZScore()).isEqualTo(1.2);
        assertThat(strict.getPercentile()).isEqualTo(15);
        assertThat(strict.getMinWeeks()).isEqualTo(4);

        assertThat(config.overrideProvider().find(CombinationKey.of("SYS_A", "MT103")))
                .hasValueSatisfying(o -> {
                    assertThat(o.getThreshold()).isEqualTo(5000.0);
                    assertThat(o.getJustification()).isEqualTo("Contractual minimum volume");
                });
    }

    @Test
    @DisplayName("Built-in presets stay available next to declared ones")
    void shouldKeepBuiltInsAvailable() {
        MonitoringConfig config = ConfigLoader.fromClasspath("test-monitoring.yml");

        assertThat(config.availablePresets()).containsKeys("high", "medium", "low", "strict");
        assertThat(config.resolvePreset("LOW")).isEqualTo(SensitivityPreset.low());
    }

    @Test
    @DisplayName("A mixed-case preset name reaches threshold records lowercased")
    void shouldReportLowercasePresetNameInRecords() {
        MonitoringConfig config = ConfigLoader.fromClasspath("test-monitoring.yml");

        assertThat(config.getPresets().get(0).getName()).isEqualTo("strict");

        ThresholdRecord record = new ThresholdCalculator().calculate(CombinationKey.of("SYS_B", "MT202"),
                new double[] { 100, 110, 90, 105, 95 }, FrequencyProfile.insufficient(5),
                config.resolveDefaultPreset());
        assertThat(record.getSensitivityLevel()).isEqualTo("strict");
    }

    @Test
    @DisplayName("Should report every invalid preset and override at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-monitoring.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("zScore")
                .hasMessageContaining("percentile")
                .hasMessageContaining("minWeeks")
                .hasMessageContaining("threshold")
                .hasMessageContaining("justification");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the config file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("An empty file falls back to the built-in presets")
    void shouldTreatEmptyFileAsDefaults(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("empty.yml"), "");

        MonitoringConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.resolveDefaultPreset()).isEqualTo(SensitivityPreset.medium());
        assertThat(config.getOverrides()).isEmpty();
    }

    @Test
    @DisplayName("A default sensitivity naming no preset is rejected")
    void shouldRejectUnknownDefaultSensitivity(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("unknown.yml"), "sensitivity: paranoid\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("paranoid");
    }
}

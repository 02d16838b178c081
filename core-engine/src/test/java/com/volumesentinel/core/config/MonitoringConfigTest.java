package com.volumesentinel.core.config;

import com.volumesentinel.core.model.CombinationKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitoringConfig}.
 */
class MonitoringConfigTest {

    private MonitoringConfig config;

    @BeforeEach
    void setUp() {
        config = new MonitoringConfig();
    }

    @Test
    @DisplayName("Defaults to the medium preset with no overrides")
    void shouldDefaultToMedium() {
        config.validate();

        assertThat(config.resolveDefaultPreset()).isEqualTo(SensitivityPreset.medium());
        assertThat(config.overrideProvider().find(CombinationKey.of("SYS_A", "MT103"))).isEmpty();
    }

    @Test
    @DisplayName("Should reject an unknown preset name")
    void shouldRejectUnknownPreset() {
        assertThatThrownBy(() -> config.resolvePreset("extreme"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("extreme")
                .hasMessageContaining("Available");
    }

    @Test
    @DisplayName("A declared preset may replace a built-in of the same name")
    void shouldLetDeclaredPresetReplaceBuiltIn() {
        SensitivityPreset tighterMedium = SensitivityPreset.custom("medium", 1.8, 5, 6);
        config.setPresets(List.of(tighterMedium));

        assertThat(config.resolvePreset("medium").getZScore()).isEqualTo(1.8);
    }

    @Test
    @DisplayName("Should reject two overrides for the same combination")
    void shouldRejectDuplicateOverrides() {
        config.setOverrides(List.of(
                new ThresholdOverride("SYS_A", "MT103", 100, "first"),
                new ThresholdOverride("SYS_A", "MT103", 200, "second")));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate override for SYS_A/MT103");
    }

    @Test
    @DisplayName("Overrides require a justification")
    void shouldRequireJustification() {
        config.setOverrides(List.of(new ThresholdOverride("SYS_A", "MT103", 100, " ")));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("justification");
    }
}

package com.volumesentinel.core.config;

import com.volumesentinel.core.detection.ThresholdOverrideProvider;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the monitoring YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * sensitivity: medium
 * presets:
 *   - name: strict
 *     zScore: 1.2
 *     percentile: 15
 *     minWeeks: 4
 * overrides:
 *   - systemId: SYS_A
 *     messageType: MT103
 *     threshold: 5000
 *     justification: Contractual minimum volume
 * </pre>
 *
 * <p>
 * Presets declared here are added to the built-in {@code high},
 * {@code medium} and {@code low} presets; a declared preset with a built-in
 * name replaces it. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the preset used when the caller does not ask for one. */
    private String sensitivity = SensitivityPreset.MEDIUM;

    private List<SensitivityPreset> presets = new ArrayList<>();

    private List<ThresholdOverride> overrides = new ArrayList<>();

    public String getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(String sensitivity) {
        this.sensitivity = sensitivity != null ? sensitivity.toLowerCase(Locale.ROOT) : null;
    }

    /**
     * @return unmodifiable list of presets declared in the configuration
     */
    public List<SensitivityPreset> getPresets() {
        return Collections.unmodifiableList(presets);
    }

    public void setPresets(List<SensitivityPreset> presets) {
        this.presets = presets != null ? new ArrayList<>(presets) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of per-combination threshold overrides
     */
    public List<ThresholdOverride> getOverrides() {
        return Collections.unmodifiableList(overrides);
    }

    public void setOverrides(List<ThresholdOverride> overrides) {
        this.overrides = overrides != null ? new ArrayList<>(overrides) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------

    /**
     * @return built-in presets overlaid with the declared ones, by name
     */
    public Map<String, SensitivityPreset> availablePresets() {
        Map<String, SensitivityPreset> all = new LinkedHashMap<>();
        for (SensitivityPreset preset : SensitivityPreset.builtIns()) {
            all.put(preset.getName(), preset);
        }
        for (SensitivityPreset preset : presets) {
            all.put(preset.getName().toLowerCase(Locale.ROOT), preset);
        }
        return Collections.unmodifiableMap(all);
    }

    /**
     * Resolve a preset by name.
     *
     * @param name preset name, case-insensitive; {@code null} selects the
     *             configured default
     * @return the preset
     * @throws IllegalArgumentException if no preset has that name
     */
    public SensitivityPreset resolvePreset(String name) {
        String wanted = (name == null || name.isBlank() ? sensitivity : name).toLowerCase(Locale.ROOT);
        Map<String, SensitivityPreset> all = availablePresets();
        SensitivityPreset preset = all.get(wanted);
        if (preset == null) {
            throw new IllegalArgumentException(
                    "Unknown sensitivity preset: '" + wanted + "'. Available: " + all.keySet());
        }
        return preset;
    }

    public SensitivityPreset resolveDefaultPreset() {
        return resolvePreset(null);
    }

    public ThresholdOverrideProvider overrideProvider() {
        return overrides.isEmpty()
                ? ThresholdOverrideProvider.none()
                : ThresholdOverrideProvider.of(overrides);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every preset and override, collecting all errors into a single
     * exception.
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < presets.size(); i++) {
            SensitivityPreset preset = Objects.requireNonNull(presets.get(i),
                    "Preset at index " + i + " is null");
            try {
                preset.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < overrides.size(); i++) {
            ThresholdOverride override = Objects.requireNonNull(overrides.get(i),
                    "Override at index " + i + " is null");
            try {
                override.validate();
                if (!seen.add(override.getSystemId() + "/" + override.getMessageType())) {
                    errors.add("Duplicate override for " + override.getSystemId()
                            + "/" + override.getMessageType());
                }
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (errors.isEmpty()) {
            try {
                resolveDefaultPreset();
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitoring configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "MonitoringConfig{sensitivity='" + sensitivity + '\'' +
                ", presets=" + presets +
                ", overrides=" + overrides.size() + '}';
    }
}

package com.volumesentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Named bundle of threshold strictness parameters.
 *
 * <p>
 * Three built-in presets are always available:
 * </p>
 * <ul>
 * <li>{@code high}: z 1.5, 10th percentile, 4 weeks minimum; more alerts,
 * catches smaller drops</li>
 * <li>{@code medium}: z 2.0, 5th percentile, 6 weeks minimum; balanced
 * (recommended)</li>
 * <li>{@code low}: z 2.5, 2nd percentile, 8 weeks minimum; only significant
 * drops</li>
 * </ul>
 *
 * <p>
 * Ad-hoc presets are created with {@link #custom(String, double, int, int)}
 * or loaded from YAML; call {@link #validate()} after deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class SensitivityPreset implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String HIGH = "high";
    public static final String MEDIUM = "medium";
    public static final String LOW = "low";

    /** Unique preset name, normalised to lowercase. */
    private String name;

    /** Number of standard deviations below the mean for the z-score method. */
    private double zScore;

    /** Percentile used by the percentile method, in (0, 50). */
    private int percentile;

    /** Minimum training weeks before a numeric threshold is computed. */
    private int minWeeks;

    private String description;

    /** No-arg constructor required by SnakeYAML. */
    public SensitivityPreset() {
    }

    private SensitivityPreset(String name, double zScore, int percentile, int minWeeks, String description) {
        setName(name);
        this.zScore = zScore;
        this.percentile = percentile;
        this.minWeeks = minWeeks;
        this.description = description;
    }

    // ---------------------------------------------------------------
    // Built-ins
    // ---------------------------------------------------------------

    public static SensitivityPreset high() {
        return new SensitivityPreset(HIGH, 1.5, 10, 4,
                "High sensitivity - more alerts, catches smaller drops");
    }

    public static SensitivityPreset medium() {
        return new SensitivityPreset(MEDIUM, 2.0, 5, 6,
                "Medium sensitivity - balanced approach (recommended)");
    }

    public static SensitivityPreset low() {
        return new SensitivityPreset(LOW, 2.5, 2, 8,
                "Low sensitivity - fewer alerts, only significant drops");
    }

    /**
     * @return fresh copies of the three built-in presets, most sensitive first
     */
    public static List<SensitivityPreset> builtIns() {
        return List.of(high(), medium(), low());
    }

    /**
     * Create and validate an ad-hoc preset.
     *
     * @throws IllegalStateException if any parameter is out of range
     */
    public static SensitivityPreset custom(String name, double zScore, int percentile, int minWeeks) {
        SensitivityPreset preset = new SensitivityPreset(name, zScore, percentile, minWeeks, "Custom preset");
        preset.validate();
        return preset;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check the parameter ranges and lowercase the name, which field-level
     * YAML binding leaves as written.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        setName(name);
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Preset 'name' is required");
        }
        if (!(zScore > 0) || Double.isInfinite(zScore)) {
            errors.add("Preset '" + name + "' requires 'zScore' > 0, got: " + zScore);
        }
        if (percentile <= 0 || percentile >= 50) {
            errors.add("Preset '" + name + "' requires 'percentile' in (0, 50), got: " + percentile);
        }
        if (minWeeks < 2) {
            errors.add("Preset '" + name + "' requires 'minWeeks' >= 2, got: " + minWeeks);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid SensitivityPreset: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name.toLowerCase(Locale.ROOT) : null;
    }

    public double getZScore() {
        return zScore;
    }

    public void setZScore(double zScore) {
        this.zScore = zScore;
    }

    public int getPercentile() {
        return percentile;
    }

    public void setPercentile(int percentile) {
        this.percentile = percentile;
    }

    public int getMinWeeks() {
        return minWeeks;
    }

    public void setMinWeeks(int minWeeks) {
        this.minWeeks = minWeeks;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SensitivityPreset that))
            return false;
        return Double.compare(zScore, that.zScore) == 0
                && percentile == that.percentile
                && minWeeks == that.minWeeks
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, zScore, percentile, minWeeks);
    }

    @Override
    public String toString() {
        return "SensitivityPreset{" +
                "name='" + name + '\'' +
                ", zScore=" + zScore +
                ", percentile=" + percentile +
                ", minWeeks=" + minWeeks +
                '}';
    }
}

package com.volumesentinel.core.orchestration;

import com.volumesentinel.core.config.SensitivityPreset;
import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.VolumeObservation;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * What to check: the week, the sensitivity, and optionally the combinations
 * that must receive a verdict even if they never appear in the input.
 *
 * @since 1.0.0
 */
public final class MonitoringRequest {

    private final LocalDate checkDate;
    private final SensitivityPreset preset;
    private final Set<CombinationKey> expectedCombinations;
    private final boolean includeTrends;

    private MonitoringRequest(Builder b) {
        this.checkDate = Objects.requireNonNull(b.checkDate, "checkDate must not be null");
        this.preset = Objects.requireNonNull(b.preset, "preset must not be null");
        if (checkDate.getDayOfWeek() != VolumeObservation.CANONICAL_WEEKDAY) {
            throw new IllegalArgumentException("checkDate must fall on "
                    + VolumeObservation.CANONICAL_WEEKDAY + ", got: " + checkDate + " (" + checkDate.getDayOfWeek() + ")");
        }
        preset.validate();
        this.expectedCombinations = Set.copyOf(b.expectedCombinations);
        this.includeTrends = b.includeTrends;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalDate checkDate;
        private SensitivityPreset preset = SensitivityPreset.medium();
        private final Set<CombinationKey> expectedCombinations = new TreeSet<>();
        private boolean includeTrends = true;

        public Builder checkDate(LocalDate v) {
            this.checkDate = v;
            return this;
        }

        public Builder preset(SensitivityPreset v) {
            this.preset = v;
            return this;
        }

        public Builder expectedCombinations(Collection<CombinationKey> v) {
            this.expectedCombinations.addAll(Objects.requireNonNull(v, "expectedCombinations must not be null"));
            return this;
        }

        public Builder includeTrends(boolean v) {
            this.includeTrends = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the check date is not on the
         *                                  canonical weekday
         * @throws IllegalStateException    if the preset is invalid
         */
        public MonitoringRequest build() {
            return new MonitoringRequest(this);
        }
    }

    public LocalDate getCheckDate() {
        return checkDate;
    }

    public SensitivityPreset getPreset() {
        return preset;
    }

    public Set<CombinationKey> getExpectedCombinations() {
        return expectedCombinations;
    }

    public boolean isIncludeTrends() {
        return includeTrends;
    }

    @Override
    public String toString() {
        return "MonitoringRequest{checkDate=" + checkDate +
                ", preset=" + preset.getName() +
                ", expectedCombinations=" + expectedCombinations.size() +
                ", includeTrends=" + includeTrends + '}';
    }
}

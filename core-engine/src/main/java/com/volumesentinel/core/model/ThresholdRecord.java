package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Lower-bound volume threshold of one combination, with the three estimates
 * it was chosen from.
 *
 * <p>
 * When fewer than {@code minWeeks} training weeks exist the record is marked
 * as insufficient: every numeric threshold is {@code null} and the
 * combination must not raise ordinary drop alerts. Mean, standard deviation
 * and sample count are always reported so the threshold table stays complete.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ThresholdRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String systemId;
    private final String messageType;
    private final boolean sufficientHistory;

    private final Double zThreshold;
    private final Double percentileThreshold;
    private final Double iqrThreshold;
    private final Double finalThreshold;

    private final double mean;
    private final double stdDev;
    private final double cv;
    private final int sampleCount;

    private final String sensitivityLevel;
    private final double adjustedZ;
    private final boolean regularityAdjustmentApplied;

    private final boolean overrideApplied;
    private final String overrideJustification;

    private final FrequencyProfile frequencyProfile;

    private ThresholdRecord(Builder b) {
        this.systemId = Objects.requireNonNull(b.systemId, "systemId must not be null");
        this.messageType = Objects.requireNonNull(b.messageType, "messageType must not be null");
        this.sensitivityLevel = Objects.requireNonNull(b.sensitivityLevel, "sensitivityLevel must not be null");
        this.frequencyProfile = Objects.requireNonNull(b.frequencyProfile, "frequencyProfile must not be null");
        this.sufficientHistory = b.sufficientHistory;
        this.zThreshold = b.zThreshold;
        this.percentileThreshold = b.percentileThreshold;
        this.iqrThreshold = b.iqrThreshold;
        this.finalThreshold = b.finalThreshold;
        this.mean = b.mean;
        this.stdDev = b.stdDev;
        this.cv = b.cv;
        this.sampleCount = b.sampleCount;
        this.adjustedZ = b.adjustedZ;
        this.regularityAdjustmentApplied = b.regularityAdjustmentApplied;
        this.overrideApplied = b.overrideApplied;
        this.overrideJustification = b.overrideJustification;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ThresholdRecord}.
     */
    public static class Builder {
        private String systemId;
        private String messageType;
        private boolean sufficientHistory;
        private Double zThreshold;
        private Double percentileThreshold;
        private Double iqrThreshold;
        private Double finalThreshold;
        private double mean;
        private double stdDev;
        private double cv;
        private int sampleCount;
        private String sensitivityLevel;
        private double adjustedZ;
        private boolean regularityAdjustmentApplied;
        private boolean overrideApplied;
        private String overrideJustification;
        private FrequencyProfile frequencyProfile;

        public Builder key(CombinationKey key) {
            this.systemId = key.getSystemId();
            this.messageType = key.getMessageType();
            return this;
        }

        public Builder sufficientHistory(boolean v) {
            this.sufficientHistory = v;
            return this;
        }

        public Builder zThreshold(Double v) {
            this.zThreshold = v;
            return this;
        }

        public Builder percentileThreshold(Double v) {
            this.percentileThreshold = v;
            return this;
        }

        public Builder iqrThreshold(Double v) {
            this.iqrThreshold = v;
            return this;
        }

        public Builder finalThreshold(Double v) {
            this.finalThreshold = v;
            return this;
        }

        public Builder mean(double v) {
            this.mean = v;
            return this;
        }

        public Builder stdDev(double v) {
            this.stdDev = v;
            return this;
        }

        public Builder cv(double v) {
            this.cv = v;
            return this;
        }

        public Builder sampleCount(int v) {
            this.sampleCount = v;
            return this;
        }

        public Builder sensitivityLevel(String v) {
            this.sensitivityLevel = v;
            return this;
        }

        public Builder adjustedZ(double v) {
            this.adjustedZ = v;
            return this;
        }

        public Builder regularityAdjustmentApplied(boolean v) {
            this.regularityAdjustmentApplied = v;
            return this;
        }

        public Builder overrideApplied(boolean v) {
            this.overrideApplied = v;
            return this;
        }

        public Builder overrideJustification(String v) {
            this.overrideJustification = v;
            return this;
        }

        public Builder frequencyProfile(FrequencyProfile v) {
            this.frequencyProfile = v;
            return this;
        }

        public ThresholdRecord build() {
            return new ThresholdRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSystemId() {
        return systemId;
    }

    public String getMessageType() {
        return messageType;
    }

    @JsonIgnore
    public CombinationKey getKey() {
        return new CombinationKey(systemId, messageType);
    }

    public boolean isSufficientHistory() {
        return sufficientHistory;
    }

    /**
     * @return {@code true} if a threshold is available for drop alerting,
     *         either computed from sufficient history or supplied by an
     *         override
     */
    @JsonIgnore
    public boolean isUsable() {
        return finalThreshold != null;
    }

    @JsonProperty("zThreshold")
    public Double getZThreshold() {
        return zThreshold;
    }

    public Double getPercentileThreshold() {
        return percentileThreshold;
    }

    public Double getIqrThreshold() {
        return iqrThreshold;
    }

    public Double getFinalThreshold() {
        return finalThreshold;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getCv() {
        return cv;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public String getSensitivityLevel() {
        return sensitivityLevel;
    }

    public double getAdjustedZ() {
        return adjustedZ;
    }

    public boolean isRegularityAdjustmentApplied() {
        return regularityAdjustmentApplied;
    }

    public boolean isOverrideApplied() {
        return overrideApplied;
    }

    public String getOverrideJustification() {
        return overrideJustification;
    }

    public FrequencyProfile getFrequencyProfile() {
        return frequencyProfile;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdRecord that))
            return false;
        return sufficientHistory == that.sufficientHistory
                && Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && sampleCount == that.sampleCount
                && Double.compare(adjustedZ, that.adjustedZ) == 0
                && overrideApplied == that.overrideApplied
                && systemId.equals(that.systemId)
                && messageType.equals(that.messageType)
                && Objects.equals(zThreshold, that.zThreshold)
                && Objects.equals(percentileThreshold, that.percentileThreshold)
                && Objects.equals(iqrThreshold, that.iqrThreshold)
                && Objects.equals(finalThreshold, that.finalThreshold)
                && sensitivityLevel.equals(that.sensitivityLevel)
                && frequencyProfile.equals(that.frequencyProfile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, messageType, sufficientHistory, zThreshold, percentileThreshold,
                iqrThreshold, finalThreshold, mean, stdDev, sampleCount, sensitivityLevel, adjustedZ,
                overrideApplied, frequencyProfile);
    }

    @Override
    public String toString() {
        return "ThresholdRecord{" +
                systemId + "/" + messageType +
                ", sufficientHistory=" + sufficientHistory +
                ", finalThreshold=" + finalThreshold +
                ", z=" + zThreshold +
                ", percentile=" + percentileThreshold +
                ", iqr=" + iqrThreshold +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", sampleCount=" + sampleCount +
                ", sensitivity='" + sensitivityLevel + '\'' +
                ", overrideApplied=" + overrideApplied +
                '}';
    }
}

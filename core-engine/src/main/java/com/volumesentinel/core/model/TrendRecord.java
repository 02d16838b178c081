package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Objects;

/**
 * Descriptive trend of one combination over one trailing window.
 *
 * <p>
 * Purely diagnostic: trend records never feed into thresholds.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String systemId;
    private final String messageType;
    private final String windowLabel;
    private final int dataPoints;
    private final double avgVolume;
    private final double totalVolume;
    private final double minVolume;
    private final double maxVolume;
    private final double medianVolume;
    private final TrendDirection trendDirection;
    private final double growthRatePct;
    private final double slope;
    private final double volatility;

    private TrendRecord(Builder b) {
        this.systemId = Objects.requireNonNull(b.systemId, "systemId must not be null");
        this.messageType = Objects.requireNonNull(b.messageType, "messageType must not be null");
        this.windowLabel = Objects.requireNonNull(b.windowLabel, "windowLabel must not be null");
        this.trendDirection = Objects.requireNonNull(b.trendDirection, "trendDirection must not be null");
        this.dataPoints = b.dataPoints;
        this.avgVolume = b.avgVolume;
        this.totalVolume = b.totalVolume;
        this.minVolume = b.minVolume;
        this.maxVolume = b.maxVolume;
        this.medianVolume = b.medianVolume;
        this.growthRatePct = b.growthRatePct;
        this.slope = b.slope;
        this.volatility = b.volatility;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String systemId;
        private String messageType;
        private String windowLabel;
        private int dataPoints;
        private double avgVolume;
        private double totalVolume;
        private double minVolume;
        private double maxVolume;
        private double medianVolume;
        private TrendDirection trendDirection;
        private double growthRatePct;
        private double slope;
        private double volatility;

        public Builder key(CombinationKey key) {
            this.systemId = key.getSystemId();
            this.messageType = key.getMessageType();
            return this;
        }

        public Builder windowLabel(String v) {
            this.windowLabel = v;
            return this;
        }

        public Builder dataPoints(int v) {
            this.dataPoints = v;
            return this;
        }

        public Builder avgVolume(double v) {
            this.avgVolume = v;
            return this;
        }

        public Builder totalVolume(double v) {
            this.totalVolume = v;
            return this;
        }

        public Builder minVolume(double v) {
            this.minVolume = v;
            return this;
        }

        public Builder maxVolume(double v) {
            this.maxVolume = v;
            return this;
        }

        public Builder medianVolume(double v) {
            this.medianVolume = v;
            return this;
        }

        public Builder trendDirection(TrendDirection v) {
            this.trendDirection = v;
            return this;
        }

        public Builder growthRatePct(double v) {
            this.growthRatePct = v;
            return this;
        }

        public Builder slope(double v) {
            this.slope = v;
            return this;
        }

        public Builder volatility(double v) {
            this.volatility = v;
            return this;
        }

        public TrendRecord build() {
            return new TrendRecord(this);
        }
    }

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

    public String getWindowLabel() {
        return windowLabel;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public double getAvgVolume() {
        return avgVolume;
    }

    public double getTotalVolume() {
        return totalVolume;
    }

    public double getMinVolume() {
        return minVolume;
    }

    public double getMaxVolume() {
        return maxVolume;
    }

    public double getMedianVolume() {
        return medianVolume;
    }

    public TrendDirection getTrendDirection() {
        return trendDirection;
    }

    public double getGrowthRatePct() {
        return growthRatePct;
    }

    public double getSlope() {
        return slope;
    }

    public double getVolatility() {
        return volatility;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendRecord that))
            return false;
        return dataPoints == that.dataPoints
                && Double.compare(avgVolume, that.avgVolume) == 0
                && Double.compare(growthRatePct, that.growthRatePct) == 0
                && Double.compare(slope, that.slope) == 0
                && Double.compare(volatility, that.volatility) == 0
                && systemId.equals(that.systemId)
                && messageType.equals(that.messageType)
                && windowLabel.equals(that.windowLabel)
                && trendDirection == that.trendDirection;
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, messageType, windowLabel, dataPoints, avgVolume,
                trendDirection, growthRatePct, slope, volatility);
    }

    @Override
    public String toString() {
        return "TrendRecord{" + systemId + "/" + messageType +
                ", window=" + windowLabel +
                ", points=" + dataPoints +
                ", avg=" + avgVolume +
                ", direction=" + trendDirection +
                ", growth=" + growthRatePct +
                "%, slope=" + slope +
                ", volatility=" + volatility +
                '}';
    }
}

package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Objects;

/**
 * Mean of the most recent weeks compared with the mean of the whole
 * available history, as a percentage change.
 *
 * @since 1.0.0
 */
public final class RecentComparison implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String systemId;
    private final String messageType;
    private final int recentWeeks;
    private final double recentAvg;
    private final double historicalAvg;
    private final double changePct;
    private final ComparisonStatus status;

    public RecentComparison(CombinationKey key, int recentWeeks, double recentAvg,
            double historicalAvg, double changePct, ComparisonStatus status) {
        Objects.requireNonNull(key, "key must not be null");
        this.systemId = key.getSystemId();
        this.messageType = key.getMessageType();
        this.recentWeeks = recentWeeks;
        this.recentAvg = recentAvg;
        this.historicalAvg = historicalAvg;
        this.changePct = changePct;
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public static RecentComparison insufficient(CombinationKey key, int recentWeeks) {
        return new RecentComparison(key, recentWeeks, 0.0, 0.0, 0.0, ComparisonStatus.INSUFFICIENT_DATA);
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

    public int getRecentWeeks() {
        return recentWeeks;
    }

    public double getRecentAvg() {
        return recentAvg;
    }

    public double getHistoricalAvg() {
        return historicalAvg;
    }

    public double getChangePct() {
        return changePct;
    }

    public ComparisonStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecentComparison that))
            return false;
        return recentWeeks == that.recentWeeks
                && Double.compare(recentAvg, that.recentAvg) == 0
                && Double.compare(historicalAvg, that.historicalAvg) == 0
                && Double.compare(changePct, that.changePct) == 0
                && systemId.equals(that.systemId)
                && messageType.equals(that.messageType)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, messageType, recentWeeks, recentAvg, historicalAvg, changePct, status);
    }

    @Override
    public String toString() {
        return "RecentComparison{" + systemId + "/" + messageType +
                ", recentAvg=" + recentAvg +
                ", historicalAvg=" + historicalAvg +
                ", changePct=" + changePct +
                ", status=" + status +
                '}';
    }
}

package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One weekly volume counter for a combination.
 *
 * <p>
 * Immutable. Uniquely keyed by {@code (systemId, messageType, weekStartDate)}.
 * A missing row means "no data that week" and is never the same thing as a
 * row with {@code volume == 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class VolumeObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Anchor weekday every {@code weekStartDate} must fall on. */
    public static final DayOfWeek CANONICAL_WEEKDAY = DayOfWeek.MONDAY;

    private final String systemId;
    private final String messageType;
    private final LocalDate weekStartDate;
    private final long volume;

    /**
     * @throws NullPointerException     if any identifying field is {@code null}
     * @throws IllegalArgumentException if {@code volume} is negative
     */
    @JsonCreator
    public VolumeObservation(@JsonProperty("systemId") String systemId,
            @JsonProperty("messageType") String messageType,
            @JsonProperty("weekStartDate") LocalDate weekStartDate,
            @JsonProperty("volume") long volume) {
        this.systemId = Objects.requireNonNull(systemId, "systemId must not be null");
        this.messageType = Objects.requireNonNull(messageType, "messageType must not be null");
        this.weekStartDate = Objects.requireNonNull(weekStartDate, "weekStartDate must not be null");
        if (volume < 0) {
            throw new IllegalArgumentException(
                    "volume must be >= 0 for " + systemId + "/" + messageType
                            + " week " + weekStartDate + ", got: " + volume);
        }
        this.volume = volume;
    }

    public String getSystemId() {
        return systemId;
    }

    public String getMessageType() {
        return messageType;
    }

    public LocalDate getWeekStartDate() {
        return weekStartDate;
    }

    public long getVolume() {
        return volume;
    }

    @JsonIgnore
    public CombinationKey getKey() {
        return new CombinationKey(systemId, messageType);
    }

    /**
     * @return {@code true} if the week starts on {@link #CANONICAL_WEEKDAY}
     */
    @JsonIgnore
    public boolean isCanonicalWeek() {
        return weekStartDate.getDayOfWeek() == CANONICAL_WEEKDAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof VolumeObservation that))
            return false;
        return volume == that.volume
                && systemId.equals(that.systemId)
                && messageType.equals(that.messageType)
                && weekStartDate.equals(that.weekStartDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, messageType, weekStartDate, volume);
    }

    @Override
    public String toString() {
        return "VolumeObservation{" + systemId + "/" + messageType
                + ", week=" + weekStartDate + ", volume=" + volume + '}';
    }
}

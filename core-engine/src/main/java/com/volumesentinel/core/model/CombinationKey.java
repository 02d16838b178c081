package com.volumesentinel.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a monitored (system, message-type) pair.
 *
 * <p>
 * Natural ordering is {@code systemId} then {@code messageType}; every output
 * table is emitted in this order so that reports and diffs are stable.
 * </p>
 *
 * @since 1.0.0
 */
public final class CombinationKey implements Comparable<CombinationKey>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<CombinationKey> ORDER = Comparator
            .comparing(CombinationKey::getSystemId)
            .thenComparing(CombinationKey::getMessageType);

    private final String systemId;
    private final String messageType;

    public CombinationKey(String systemId, String messageType) {
        this.systemId = Objects.requireNonNull(systemId, "systemId must not be null");
        this.messageType = Objects.requireNonNull(messageType, "messageType must not be null");
    }

    public static CombinationKey of(String systemId, String messageType) {
        return new CombinationKey(systemId, messageType);
    }

    public String getSystemId() {
        return systemId;
    }

    public String getMessageType() {
        return messageType;
    }

    @Override
    public int compareTo(CombinationKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CombinationKey that))
            return false;
        return systemId.equals(that.systemId) && messageType.equals(that.messageType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, messageType);
    }

    @Override
    public String toString() {
        return systemId + "/" + messageType;
    }
}

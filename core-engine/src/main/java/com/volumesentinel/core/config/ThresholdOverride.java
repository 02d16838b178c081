package com.volumesentinel.core.config;

import com.volumesentinel.core.model.CombinationKey;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operator-supplied threshold floor for a single combination.
 *
 * <p>
 * When present it takes precedence over the computed threshold. A
 * justification is mandatory so that every override in the threshold table
 * can be traced back to a decision.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdOverride implements Serializable {

    private static final long serialVersionUID = 1L;

    private String systemId;
    private String messageType;
    private double threshold;
    private String justification;

    /** No-arg constructor required by SnakeYAML. */
    public ThresholdOverride() {
    }

    public ThresholdOverride(String systemId, String messageType, double threshold, String justification) {
        this.systemId = systemId;
        this.messageType = messageType;
        this.threshold = threshold;
        this.justification = justification;
    }

    /**
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (systemId == null || systemId.isBlank()) {
            errors.add("Override 'systemId' is required");
        }
        if (messageType == null || messageType.isBlank()) {
            errors.add("Override 'messageType' is required");
        }
        if (!(threshold >= 0) || Double.isInfinite(threshold)) {
            errors.add("Override for " + systemId + "/" + messageType
                    + " requires a finite 'threshold' >= 0, got: " + threshold);
        }
        if (justification == null || justification.isBlank()) {
            errors.add("Override for " + systemId + "/" + messageType + " requires a 'justification'");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ThresholdOverride: " + String.join("; ", errors));
        }
    }

    public CombinationKey key() {
        return new CombinationKey(systemId, messageType);
    }

    public String getSystemId() {
        return systemId;
    }

    public void setSystemId(String systemId) {
        this.systemId = systemId;
    }

    public String getMessageType() {
        return messageType;
    }

    public void setMessageType(String messageType) {
        this.messageType = messageType;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getJustification() {
        return justification;
    }

    public void setJustification(String justification) {
        this.justification = justification;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdOverride that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && Objects.equals(systemId, that.systemId)
                && Objects.equals(messageType, that.messageType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, messageType, threshold);
    }

    @Override
    public String toString() {
        return "ThresholdOverride{" + systemId + "/" + messageType +
                ", threshold=" + threshold +
                ", justification='" + justification + '\'' +
                '}';
    }
}

package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Alert raised for one combination and one check week.
 *
 * <p>
 * Created only when the observed volume is below the combination's threshold
 * or when no observation exists for the check week at all. Alerts live only
 * in the output of the run that produced them.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code systemId}, {@code messageType},
 * {@code checkWeek}, {@code severity} and {@code alertType} are required;
 * omitting any of them throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String systemId;
    private final String messageType;
    private final LocalDate checkWeek;

    /** Observed volume; {@code 0} for a NO_DATA alert. */
    private final long currentVolume;

    /** Effective threshold, or {@code null} when the history was insufficient. */
    private final Double threshold;

    private final double mean;
    private final Severity severity;
    private final AlertType alertType;
    private final double dropPct;

    /** Mean of the last four training weeks, for context; may be {@code null}. */
    private final Double recentAverage;

    private final String message;

    private Alert(Builder builder) {
        this.systemId = Objects.requireNonNull(builder.systemId, "systemId must not be null");
        this.messageType = Objects.requireNonNull(builder.messageType, "messageType must not be null");
        this.checkWeek = Objects.requireNonNull(builder.checkWeek, "checkWeek must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.alertType = Objects.requireNonNull(builder.alertType, "alertType must not be null");
        this.currentVolume = builder.currentVolume;
        this.threshold = builder.threshold;
        this.mean = builder.mean;
        this.dropPct = builder.dropPct;
        this.recentAverage = builder.recentAverage;
        this.message = builder.message;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String systemId;
        private String messageType;
        private LocalDate checkWeek;
        private long currentVolume;
        private Double threshold;
        private double mean;
        private Severity severity;
        private AlertType alertType;
        private double dropPct;
        private Double recentAverage;
        private String message;

        public Builder key(CombinationKey key) {
            this.systemId = key.getSystemId();
            this.messageType = key.getMessageType();
            return this;
        }

        public Builder systemId(String systemId) {
            this.systemId = systemId;
            return this;
        }

        public Builder messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder checkWeek(LocalDate checkWeek) {
            this.checkWeek = checkWeek;
            return this;
        }

        public Builder currentVolume(long currentVolume) {
            this.currentVolume = currentVolume;
            return this;
        }

        public Builder threshold(Double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder alertType(AlertType alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder dropPct(double dropPct) {
            this.dropPct = dropPct;
            return this;
        }

        public Builder recentAverage(Double recentAverage) {
            this.recentAverage = recentAverage;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
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

    public CombinationKey key() {
        return new CombinationKey(systemId, messageType);
    }

    public LocalDate getCheckWeek() {
        return checkWeek;
    }

    public long getCurrentVolume() {
        return currentVolume;
    }

    public Double getThreshold() {
        return threshold;
    }

    public double getMean() {
        return mean;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    public boolean isNoData() {
        return alertType == AlertType.NO_DATA;
    }

    public double getDropPct() {
        return dropPct;
    }

    public Double getRecentAverage() {
        return recentAverage;
    }

    public String getMessage() {
        return message;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return currentVolume == alert.currentVolume
                && Double.compare(mean, alert.mean) == 0
                && Double.compare(dropPct, alert.dropPct) == 0
                && systemId.equals(alert.systemId)
                && messageType.equals(alert.messageType)
                && checkWeek.equals(alert.checkWeek)
                && Objects.equals(threshold, alert.threshold)
                && severity == alert.severity
                && alertType == alert.alertType
                && Objects.equals(recentAverage, alert.recentAverage)
                && Objects.equals(message, alert.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(systemId, messageType, checkWeek, currentVolume, threshold, mean,
                severity, alertType, dropPct, recentAverage, message);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "systemId='" + systemId + '\'' +
                ", messageType='" + messageType + '\'' +
                ", checkWeek=" + checkWeek +
                ", currentVolume=" + currentVolume +
                ", threshold=" + threshold +
                ", severity=" + severity +
                ", alertType=" + alertType +
                ", dropPct=" + dropPct +
                '}';
    }
}

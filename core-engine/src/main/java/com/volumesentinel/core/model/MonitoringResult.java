package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Everything one monitoring run produces for a check week: the alert set,
 * the threshold table, and optionally the trend table.
 *
 * <p>
 * The constructor sorts every list by {@link CombinationKey}. The sort is
 * stable, so trend records keep their window order within a combination.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoringResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate checkDate;
    private final String sensitivityLevel;
    private final List<Alert> alerts;
    private final List<ThresholdRecord> thresholds;
    private final List<TrendRecord> trends;
    private final List<RecentComparison> recentComparisons;
    private final Map<Severity, Integer> severityCounts;

    public MonitoringResult(LocalDate checkDate, String sensitivityLevel, List<Alert> alerts,
            List<ThresholdRecord> thresholds, List<TrendRecord> trends,
            List<RecentComparison> recentComparisons) {
        this.checkDate = Objects.requireNonNull(checkDate, "checkDate must not be null");
        this.sensitivityLevel = Objects.requireNonNull(sensitivityLevel, "sensitivityLevel must not be null");
        this.alerts = sortedByKey(Objects.requireNonNull(alerts, "alerts must not be null"), Alert::key);
        this.thresholds = sortedByKey(
                Objects.requireNonNull(thresholds, "thresholds must not be null"), ThresholdRecord::getKey);
        this.trends = sortedByKey(Objects.requireNonNull(trends, "trends must not be null"), TrendRecord::getKey);
        this.recentComparisons = sortedByKey(
                Objects.requireNonNull(recentComparisons, "recentComparisons must not be null"),
                RecentComparison::getKey);

        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        for (Alert alert : this.alerts) {
            counts.merge(alert.getSeverity(), 1, Integer::sum);
        }
        this.severityCounts = Collections.unmodifiableMap(counts);
    }

    private static <T> List<T> sortedByKey(List<T> records, Function<T, CombinationKey> key) {
        List<T> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(key));
        return List.copyOf(sorted);
    }

    public LocalDate getCheckDate() {
        return checkDate;
    }

    public String getSensitivityLevel() {
        return sensitivityLevel;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public List<ThresholdRecord> getThresholds() {
        return thresholds;
    }

    public List<TrendRecord> getTrends() {
        return trends;
    }

    public List<RecentComparison> getRecentComparisons() {
        return recentComparisons;
    }

    /**
     * @return alert count for every severity tier, zero-filled
     */
    public Map<Severity, Integer> getSeverityCounts() {
        return severityCounts;
    }

    public int getAlertCount() {
        return alerts.size();
    }

    /**
     * Status signal for calling automation.
     *
     * @return {@code true} if at least one alert was raised
     */
    @JsonProperty("hasAlerts")
    public boolean hasAlerts() {
        return !alerts.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitoringResult that))
            return false;
        return checkDate.equals(that.checkDate)
                && sensitivityLevel.equals(that.sensitivityLevel)
                && alerts.equals(that.alerts)
                && thresholds.equals(that.thresholds)
                && trends.equals(that.trends)
                && recentComparisons.equals(that.recentComparisons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkDate, sensitivityLevel, alerts, thresholds, trends, recentComparisons);
    }

    @Override
    public String toString() {
        return "MonitoringResult{" +
                "checkDate=" + checkDate +
                ", sensitivity='" + sensitivityLevel + '\'' +
                ", alerts=" + alerts.size() +
                ", thresholds=" + thresholds.size() +
                ", trends=" + trends.size() +
                ", severityCounts=" + severityCounts +
                '}';
    }
}

package com.volumesentinel.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Chronologically ordered observations of one combination.
 *
 * <p>
 * Weeks without a row stay absent; nothing is interpolated. Series are
 * rebuilt from the raw observations on every run and never persisted.
 * </p>
 *
 * @since 1.0.0
 */
public final class CombinationSeries {

    private static final Logger LOG = LoggerFactory.getLogger(CombinationSeries.class);

    private final CombinationKey key;
    private final List<VolumeObservation> observations;

    private CombinationSeries(CombinationKey key, List<VolumeObservation> sortedObservations) {
        this.key = key;
        this.observations = Collections.unmodifiableList(sortedObservations);
    }

    /**
     * Build a series from observations of a single combination.
     *
     * <p>
     * Observations are sorted by week. When the same week appears twice the
     * first row is kept and the duplicate is logged and dropped.
     * </p>
     *
     * @param key          the combination; must not be {@code null}
     * @param observations rows belonging to {@code key}
     * @return the ordered series
     * @throws IllegalArgumentException if a row belongs to another combination
     */
    public static CombinationSeries of(CombinationKey key, Collection<VolumeObservation> observations) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(observations, "observations must not be null");

        List<VolumeObservation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(VolumeObservation::getWeekStartDate));

        List<VolumeObservation> unique = new ArrayList<>(sorted.size());
        LocalDate previous = null;
        for (VolumeObservation observation : sorted) {
            if (!key.equals(observation.getKey())) {
                throw new IllegalArgumentException(
                        "Observation " + observation + " does not belong to " + key);
            }
            if (observation.getWeekStartDate().equals(previous)) {
                LOG.warn("Duplicate observation for {} week {} - keeping the first row",
                        key, previous);
                continue;
            }
            unique.add(observation);
            previous = observation.getWeekStartDate();
        }
        return new CombinationSeries(key, unique);
    }

    public static CombinationSeries empty(CombinationKey key) {
        return new CombinationSeries(Objects.requireNonNull(key, "key must not be null"), List.of());
    }

    /**
     * Group a flat observation set into one series per combination.
     *
     * @param observations all rows of a run
     * @return series keyed and ordered by {@link CombinationKey}
     */
    public static Map<CombinationKey, CombinationSeries> groupByCombination(
            Collection<VolumeObservation> observations) {
        Objects.requireNonNull(observations, "observations must not be null");
        Map<CombinationKey, List<VolumeObservation>> grouped = observations.stream()
                .collect(Collectors.groupingBy(VolumeObservation::getKey, TreeMap::new, Collectors.toList()));

        Map<CombinationKey, CombinationSeries> series = new TreeMap<>();
        grouped.forEach((key, rows) -> series.put(key, of(key, rows)));
        return series;
    }

    public CombinationKey getKey() {
        return key;
    }

    public List<VolumeObservation> getObservations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /**
     * @return every volume in week order, zero-volume weeks included
     */
    public double[] volumes() {
        return observations.stream().mapToDouble(VolumeObservation::getVolume).toArray();
    }

    /**
     * Weeks in which traffic actually occurred. Zero-volume weeks count as
     * absence for spacing purposes.
     *
     * @return week start dates with {@code volume > 0}, ascending
     */
    public List<LocalDate> occurrenceDates() {
        return observations.stream()
                .filter(o -> o.getVolume() > 0)
                .map(VolumeObservation::getWeekStartDate)
                .toList();
    }

    /**
     * @param date exclusive upper bound
     * @return the sub-series of weeks strictly before {@code date}
     */
    public CombinationSeries before(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return new CombinationSeries(key, observations.stream()
                .filter(o -> o.getWeekStartDate().isBefore(date))
                .collect(Collectors.toCollection(ArrayList::new)));
    }

    /**
     * @param date inclusive upper bound
     * @return the sub-series of weeks on or before {@code date}
     */
    public CombinationSeries upTo(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return new CombinationSeries(key, observations.stream()
                .filter(o -> !o.getWeekStartDate().isAfter(date))
                .collect(Collectors.toCollection(ArrayList::new)));
    }

    public Optional<VolumeObservation> find(LocalDate weekStartDate) {
        return observations.stream()
                .filter(o -> o.getWeekStartDate().equals(weekStartDate))
                .findFirst();
    }

    public Optional<LocalDate> latestWeek() {
        return observations.isEmpty()
                ? Optional.empty()
                : Optional.of(observations.get(observations.size() - 1).getWeekStartDate());
    }

    @Override
    public String toString() {
        return "CombinationSeries{" + key + ", weeks=" + observations.size() + '}';
    }
}

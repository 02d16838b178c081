package com.volumesentinel.core.detection;

import com.volumesentinel.core.config.ThresholdOverride;
import com.volumesentinel.core.model.CombinationKey;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lookup of operator-supplied threshold floors, injected into
 * {@link ThresholdCalculator}.
 *
 * <p>
 * Implementations must be pure and thread-safe: the same key always yields
 * the same answer for the duration of a run, and lookups happen concurrently
 * from the worker pool.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ThresholdOverrideProvider {

    /**
     * @param key the combination being thresholded
     * @return the override for {@code key}, or empty if none is configured
     */
    Optional<ThresholdOverride> find(CombinationKey key);

    /**
     * @return a provider that never overrides anything
     */
    static ThresholdOverrideProvider none() {
        return key -> Optional.empty();
    }

    /**
     * Build an immutable provider from a list of overrides.
     *
     * @param overrides validated overrides; keys must be unique
     * @return provider backed by an immutable map
     * @throws IllegalStateException if two overrides target the same key
     */
    static ThresholdOverrideProvider of(Collection<ThresholdOverride> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<CombinationKey, ThresholdOverride> byKey = overrides.stream()
                .collect(Collectors.toUnmodifiableMap(ThresholdOverride::key, Function.identity()));
        return key -> Optional.ofNullable(byKey.get(key));
    }
}

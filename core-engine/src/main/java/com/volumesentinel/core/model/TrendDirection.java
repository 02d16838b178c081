package com.volumesentinel.core.model;

/**
 * Direction of a trend window, from the half-over-half growth rate.
 */
public enum TrendDirection {
    INCREASING,
    STABLE,
    DECREASING,
    /** Fewer than two points in the window. */
    UNDETERMINED
}

package com.volumesentinel.core.model;

/**
 * Outcome of a recent-versus-historical comparison.
 */
public enum ComparisonStatus {
    NORMAL,
    INCREASING,
    DECREASING,
    INSUFFICIENT_DATA
}

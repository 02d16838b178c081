package com.volumesentinel.core.detection;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics shared by the detection and trend components.
 *
 * <p>
 * Standard deviation is the population form (divide by {@code n}) and
 * percentiles interpolate linearly between closest ranks. Every method
 * returns {@code 0} for an empty input rather than {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class VolumeStatistics {

    private VolumeStatistics() {
        // utility class: not instantiable
    }

    public static double mean(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double stdDev(double[] values) {
        return stdDev(values, mean(values));
    }

    public static double stdDev(double[] values, double mean) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return 0.0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Coefficient of variation, {@code stdDev / mean}.
     *
     * @return {@code 0} when the mean is not positive
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        return mean > 0 ? stdDev(values, mean) / mean : 0.0;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values     sample; not modified
     * @param percentile in {@code [0, 100]}
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double percentile) {
        Objects.requireNonNull(values, "values must not be null");
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got: " + percentile);
        }
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, percentile);
    }

    static double percentileOfSorted(double[] sorted, double percentile) {
        double position = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Least-squares slope of {@code values} against their index
     * {@code 0..n-1}.
     *
     * @return {@code 0} for fewer than two points
     */
    public static double slope(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double xMean = (n - 1) / 2.0;
        double yMean = mean(values);
        double covariance = 0;
        double xVariance = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            covariance += dx * (values[i] - yMean);
            xVariance += dx * dx;
        }
        return covariance / xVariance;
    }
}

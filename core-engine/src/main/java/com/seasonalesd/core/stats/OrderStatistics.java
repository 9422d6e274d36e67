package com.seasonalesd.core.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Median and median-absolute-deviation over {@code double} samples.
 *
 * <p>
 * The median always averages the elements at positions {@code (m - 1) / 2}
 * and {@code m / 2} of the sorted sample, so an odd-length sample yields its
 * middle element and an even-length sample the mean of the two middle ones.
 * </p>
 *
 * @since 1.0.0
 */
public final class OrderStatistics {

    /** Scale factor that makes the MAD a consistent estimator of σ under normality. */
    public static final double MAD_SCALE = 1.4826;

    private OrderStatistics() {
        // utility class, not instantiable
    }

    /**
     * Median of an unsorted sample. The input is not modified.
     *
     * @param values the sample; must not be {@code null} or empty
     * @return the median
     * @throws NullPointerException     if {@code values} is {@code null}
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double median(double[] values) {
        Objects.requireNonNull(values, "Sample must not be null");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return medianOfSorted(sorted, sorted.length);
    }

    /**
     * Median of the first {@code length} elements of an already ascending
     * array. No sorting is performed.
     *
     * @param sorted ascending sample; must not be {@code null}
     * @param length number of leading elements that make up the sample
     * @return the median
     * @throws IllegalArgumentException if {@code length} is not in
     *                                  {@code [1, sorted.length]}
     */
    public static double medianOfSorted(double[] sorted, int length) {
        Objects.requireNonNull(sorted, "Sample must not be null");
        if (length < 1 || length > sorted.length) {
            throw new IllegalArgumentException(
                    "Sample length must be in [1, " + sorted.length + "], got: " + length);
        }
        return (sorted[(length - 1) / 2] + sorted[length / 2]) / 2.0;
    }

    /**
     * Scaled median absolute deviation of the whole sample around
     * {@code center}.
     *
     * @see #mad(double[], int, double)
     */
    public static double mad(double[] values, double center) {
        Objects.requireNonNull(values, "Sample must not be null");
        return mad(values, values.length, center);
    }

    /**
     * Scaled median absolute deviation of the first {@code length} elements
     * around {@code center}: {@code 1.4826 * median(|v - center|)}.
     *
     * <p>
     * Returns exactly {@code 0} when every value equals {@code center}.
     * </p>
     *
     * @param values sample (any order); must not be {@code null}
     * @param length number of leading elements that make up the sample
     * @param center the point deviations are measured from
     * @return the scaled MAD
     */
    public static double mad(double[] values, int length, double center) {
        Objects.requireNonNull(values, "Sample must not be null");
        if (length < 1 || length > values.length) {
            throw new IllegalArgumentException(
                    "Sample length must be in [1, " + values.length + "], got: " + length);
        }
        double[] deviations = new double[length];
        for (int i = 0; i < length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        Arrays.sort(deviations);
        return MAD_SCALE * medianOfSorted(deviations, length);
    }
}

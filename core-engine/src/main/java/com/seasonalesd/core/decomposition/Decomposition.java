package com.seasonalesd.core.decomposition;

import java.util.Objects;

/**
 * Result of a seasonal-trend decomposition.
 *
 * <p>
 * {@code series[i] == seasonal[i] + trend[i] + remainder[i]} for every index.
 * Accessors return copies.
 * </p>
 *
 * @since 1.0.0
 */
public final class Decomposition {

    private final double[] seasonal;
    private final double[] trend;
    private final double[] remainder;
    private final double[] weights;

    /**
     * @param seasonal  seasonal component
     * @param trend     trend component
     * @param remainder what is left after removing seasonal and trend
     * @param weights   final robustness weights (all {@code 1.0} for a
     *                  non-robust fit)
     * @throws IllegalArgumentException if the components differ in length
     */
    public Decomposition(double[] seasonal, double[] trend, double[] remainder, double[] weights) {
        this.seasonal = Objects.requireNonNull(seasonal, "seasonal must not be null").clone();
        this.trend = Objects.requireNonNull(trend, "trend must not be null").clone();
        this.remainder = Objects.requireNonNull(remainder, "remainder must not be null").clone();
        this.weights = Objects.requireNonNull(weights, "weights must not be null").clone();

        int n = seasonal.length;
        if (trend.length != n || remainder.length != n || weights.length != n) {
            throw new IllegalArgumentException("Decomposition components must have equal length");
        }
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getRemainder() {
        return remainder.clone();
    }

    public double[] getWeights() {
        return weights.clone();
    }

    /**
     * @return number of observations covered
     */
    public int size() {
        return seasonal.length;
    }

    @Override
    public String toString() {
        return "Decomposition{size=" + seasonal.length + '}';
    }
}

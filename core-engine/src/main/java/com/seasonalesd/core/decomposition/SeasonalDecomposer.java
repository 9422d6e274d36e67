package com.seasonalesd.core.decomposition;

/**
 * Splits a series into seasonal, trend and remainder components.
 *
 * <p>
 * The ESD detector only consumes {@link Decomposition#getSeasonal()}, which
 * must be aligned index-for-index with the input series. Implementations must
 * not retain the input array.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SeasonalDecomposer {

    /**
     * Decompose {@code series} with the given period.
     *
     * @param series         the raw observations
     * @param period         observations per seasonal cycle, at least 2
     * @param robust         whether to down-weight outliers with robustness
     *                       iterations
     * @param seasonalLength span of the seasonal smoother (odd, at least 3)
     * @return the decomposition, every component of the same length as
     *         {@code series}
     */
    Decomposition decompose(double[] series, int period, boolean robust, int seasonalLength);
}

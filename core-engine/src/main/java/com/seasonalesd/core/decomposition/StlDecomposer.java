package com.seasonalesd.core.decomposition;

import java.util.Objects;

/**
 * {@link SeasonalDecomposer} backed by STL.
 *
 * <p>
 * Robustness and seasonal length come from each call. Trend span, low-pass
 * span and seasonal degree come from the constructor; {@code null} keeps the
 * {@link StlParams} default.
 * </p>
 *
 * @since 1.0.0
 */
public class StlDecomposer implements SeasonalDecomposer {

    private final Integer trendLength;
    private final Integer lowPassLength;
    private final Integer seasonalDegree;

    /** Decomposer with R's default trend and low-pass settings. */
    public StlDecomposer() {
        this(null, null, null);
    }

    /**
     * @param trendLength    trend smoother span, or {@code null} for the default
     * @param lowPassLength  low-pass smoother span, or {@code null} for the
     *                       default
     * @param seasonalDegree seasonal loess degree (0 or 1), or {@code null} for 0
     */
    public StlDecomposer(Integer trendLength, Integer lowPassLength, Integer seasonalDegree) {
        this.trendLength = trendLength;
        this.lowPassLength = lowPassLength;
        this.seasonalDegree = seasonalDegree;
    }

    @Override
    public Decomposition decompose(double[] series, int period, boolean robust, int seasonalLength) {
        Objects.requireNonNull(series, "Series must not be null");

        StlParams.Builder builder = StlParams.builder()
                .robust(robust)
                .seasonalLength(seasonalLength);
        if (trendLength != null) {
            builder.trendLength(trendLength);
        }
        if (lowPassLength != null) {
            builder.lowPassLength(lowPassLength);
        }
        if (seasonalDegree != null) {
            builder.seasonalDegree(seasonalDegree);
        }
        return builder.build().fit(series, period);
    }
}

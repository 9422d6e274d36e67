package com.seasonalesd.core.decomposition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Immutable parameter set for an STL fit.
 *
 * <p>
 * Unset values resolve at {@link #fit(double[], int)} time with the defaults
 * of R's {@code stl()}: trend length
 * {@code nextodd(ceil(1.5 * period / (1 - 1.5 / seasonalLength)))}, low-pass
 * length {@code nextodd(period)}, low-pass degree equal to the trend degree,
 * jumps of {@code ceil(length / 10)}, and 1 inner / 15 outer loops when
 * robust, 2 / 0 otherwise. An unset seasonal length means a periodic fit
 * ({@code 10 * n + 1}).
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder()}. The builder validates explicit values at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class StlParams {

    private static final Logger LOG = LoggerFactory.getLogger(StlParams.class);

    private final Integer seasonalLength;
    private final Integer trendLength;
    private final Integer lowPassLength;
    private final int seasonalDegree;
    private final int trendDegree;
    private final Integer lowPassDegree;
    private final Integer seasonalJump;
    private final Integer trendJump;
    private final Integer lowPassJump;
    private final Integer innerLoops;
    private final Integer outerLoops;
    private final boolean robust;

    private StlParams(Builder b) {
        this.seasonalLength = b.seasonalLength;
        this.trendLength = b.trendLength;
        this.lowPassLength = b.lowPassLength;
        this.seasonalDegree = b.seasonalDegree;
        this.trendDegree = b.trendDegree;
        this.lowPassDegree = b.lowPassDegree;
        this.seasonalJump = b.seasonalJump;
        this.trendJump = b.trendJump;
        this.lowPassJump = b.lowPassJump;
        this.innerLoops = b.innerLoops;
        this.outerLoops = b.outerLoops;
        this.robust = b.robust;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Fitting
    // ---------------------------------------------------------------

    /**
     * Decompose {@code series} with these parameters.
     *
     * @param series observations; must not be {@code null}
     * @param period observations per cycle, at least 2
     * @return the decomposition
     * @throws IllegalArgumentException if {@code period < 2}, the series
     *                                  covers fewer than two periods, or a
     *                                  resolved length is invalid
     */
    public Decomposition fit(double[] series, int period) {
        Objects.requireNonNull(series, "Series must not be null");
        int n = series.length;

        if (period < 2) {
            throw new IllegalArgumentException("period must be at least 2, got: " + period);
        }
        if (n < 2 * period) {
            throw new IllegalArgumentException(
                    "series has less than two periods: length=" + n + ", period=" + period);
        }

        int ns = seasonalLength != null ? seasonalLength : 10 * n + 1;
        int nt = trendLength != null
                ? trendLength
                : nextOdd((int) Math.ceil(1.5 * period / (1.0 - 1.5 / ns)));
        int nl = lowPassLength != null ? lowPassLength : nextOdd(period);
        int ildeg = lowPassDegree != null ? lowPassDegree : trendDegree;
        int nsjump = seasonalJump != null ? seasonalJump : (int) Math.ceil(ns / 10.0);
        int ntjump = trendJump != null ? trendJump : (int) Math.ceil(nt / 10.0);
        int nljump = lowPassJump != null ? lowPassJump : (int) Math.ceil(nl / 10.0);
        int ni = innerLoops != null ? innerLoops : (robust ? 1 : 2);
        int no = outerLoops != null ? outerLoops : (robust ? 15 : 0);

        requireOddSpan(ns, "seasonalLength");
        requireOddSpan(nt, "trendLength");
        requireOddSpan(nl, "lowPassLength");

        LOG.debug("STL fit: n={} period={} ns={} nt={} nl={} inner={} outer={}",
                n, period, ns, nt, nl, ni, no);

        double[] season = new double[n + 2 * period];
        double[] trend = new double[n];
        double[] weights = new double[n];
        StlKernel.stl(series, n, period, ns, nt, nl,
                seasonalDegree, trendDegree, ildeg,
                nsjump, ntjump, nljump, ni, no,
                weights, season, trend);

        double[] seasonal = new double[n];
        double[] remainder = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = season[i];
            remainder[i] = series[i] - seasonal[i] - trend[i];
        }
        return new Decomposition(seasonal, trend, remainder, weights);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Integer getSeasonalLength() {
        return seasonalLength;
    }

    public Integer getTrendLength() {
        return trendLength;
    }

    public Integer getLowPassLength() {
        return lowPassLength;
    }

    public int getSeasonalDegree() {
        return seasonalDegree;
    }

    public int getTrendDegree() {
        return trendDegree;
    }

    public boolean isRobust() {
        return robust;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link StlParams}.
     *
     * <p>
     * {@link #build()} rejects explicit spans below 3 or even, degrees other
     * than 0 or 1, non-positive jumps and negative loop counts.
     * </p>
     */
    public static class Builder {
        private Integer seasonalLength;
        private Integer trendLength;
        private Integer lowPassLength;
        private int seasonalDegree = 0;
        private int trendDegree = 1;
        private Integer lowPassDegree;
        private Integer seasonalJump;
        private Integer trendJump;
        private Integer lowPassJump;
        private Integer innerLoops;
        private Integer outerLoops;
        private boolean robust;

        public Builder seasonalLength(int v) {
            this.seasonalLength = v;
            return this;
        }

        public Builder trendLength(int v) {
            this.trendLength = v;
            return this;
        }

        public Builder lowPassLength(int v) {
            this.lowPassLength = v;
            return this;
        }

        public Builder seasonalDegree(int v) {
            this.seasonalDegree = v;
            return this;
        }

        public Builder trendDegree(int v) {
            this.trendDegree = v;
            return this;
        }

        public Builder lowPassDegree(int v) {
            this.lowPassDegree = v;
            return this;
        }

        public Builder seasonalJump(int v) {
            this.seasonalJump = v;
            return this;
        }

        public Builder trendJump(int v) {
            this.trendJump = v;
            return this;
        }

        public Builder lowPassJump(int v) {
            this.lowPassJump = v;
            return this;
        }

        public Builder innerLoops(int v) {
            this.innerLoops = v;
            return this;
        }

        public Builder outerLoops(int v) {
            this.outerLoops = v;
            return this;
        }

        public Builder robust(boolean v) {
            this.robust = v;
            return this;
        }

        /**
         * Build and validate the parameters.
         *
         * @return validated {@link StlParams}
         * @throws IllegalArgumentException if any explicit value is invalid
         */
        public StlParams build() {
            if (seasonalLength != null) {
                requireOddSpan(seasonalLength, "seasonalLength");
            }
            if (trendLength != null) {
                requireOddSpan(trendLength, "trendLength");
            }
            if (lowPassLength != null) {
                requireOddSpan(lowPassLength, "lowPassLength");
            }
            requireDegree(seasonalDegree, "seasonalDegree");
            requireDegree(trendDegree, "trendDegree");
            if (lowPassDegree != null) {
                requireDegree(lowPassDegree, "lowPassDegree");
            }
            requirePositive(seasonalJump, "seasonalJump");
            requirePositive(trendJump, "trendJump");
            requirePositive(lowPassJump, "lowPassJump");
            if (innerLoops != null && innerLoops < 1) {
                throw new IllegalArgumentException("innerLoops must be >= 1, got: " + innerLoops);
            }
            if (outerLoops != null && outerLoops < 0) {
                throw new IllegalArgumentException("outerLoops must be >= 0, got: " + outerLoops);
            }
            return new StlParams(this);
        }

        private static void requireDegree(int value, String name) {
            if (value != 0 && value != 1) {
                throw new IllegalArgumentException(name + " must be 0 or 1, got: " + value);
            }
        }

        private static void requirePositive(Integer value, String name) {
            if (value != null && value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireOddSpan(int value, String name) {
        if (value < 3) {
            throw new IllegalArgumentException(name + " must be at least 3, got: " + value);
        }
        if (value % 2 != 1) {
            throw new IllegalArgumentException(name + " must be odd, got: " + value);
        }
    }

    private static int nextOdd(int value) {
        return value % 2 == 0 ? value + 1 : value;
    }

    @Override
    public String toString() {
        return "StlParams{" +
                "seasonalLength=" + seasonalLength +
                ", trendLength=" + trendLength +
                ", lowPassLength=" + lowPassLength +
                ", seasonalDegree=" + seasonalDegree +
                ", trendDegree=" + trendDegree +
                ", robust=" + robust +
                '}';
    }
}

package com.seasonalesd.core.model;

import com.seasonalesd.core.exception.InvalidConfigurationException;

import java.util.Objects;

/**
 * Typed, immutable parameters of one detection run.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} or the {@link Builder}. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionParams {

    public static final double DEFAULT_ALPHA = 0.05;
    public static final double DEFAULT_MAX_ANOMS = 0.1;

    private final double alpha;
    private final double maxAnoms;
    private final Direction direction;
    private final boolean verbose;
    private final CancellationToken cancellationToken;

    private DetectionParams(Builder b) {
        this.alpha = b.alpha;
        this.maxAnoms = b.maxAnoms;
        this.direction = b.direction;
        this.verbose = b.verbose;
        this.cancellationToken = b.cancellationToken;
    }

    /**
     * @return alpha 0.05, maxAnoms 0.1, {@link Direction#BOTH}, quiet, never
     *         cancelled
     */
    public static DetectionParams defaults() {
        return builder().build();
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this instance's values
     */
    public Builder toBuilder() {
        return new Builder()
                .alpha(alpha)
                .maxAnoms(maxAnoms)
                .direction(direction)
                .verbose(verbose)
                .cancellationToken(cancellationToken);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** Significance level of each test, in (0, 1]. */
    public double getAlpha() {
        return alpha;
    }

    /** Upper bound on the fraction of the series reported as anomalous, in (0, 1]. */
    public double getMaxAnoms() {
        return maxAnoms;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionParams}.
     *
     * <p>
     * The {@link #build()} method validates that alpha and maxAnoms lie in
     * {@code (0, 1]} and that a direction is set.
     * </p>
     */
    public static class Builder {
        private double alpha = DEFAULT_ALPHA;
        private double maxAnoms = DEFAULT_MAX_ANOMS;
        private Direction direction = Direction.BOTH;
        private boolean verbose;
        private CancellationToken cancellationToken = CancellationToken.NONE;

        public Builder alpha(double v) {
            this.alpha = v;
            return this;
        }

        public Builder maxAnoms(double v) {
            this.maxAnoms = v;
            return this;
        }

        public Builder direction(Direction v) {
            this.direction = v;
            return this;
        }

        public Builder verbose(boolean v) {
            this.verbose = v;
            return this;
        }

        /**
         * @param v token to poll; {@code null} means never cancelled
         */
        public Builder cancellationToken(CancellationToken v) {
            this.cancellationToken = v != null ? v : CancellationToken.NONE;
            return this;
        }

        /**
         * Build and validate the parameters.
         *
         * @return validated {@link DetectionParams}
         * @throws InvalidConfigurationException if any value is invalid
         */
        public DetectionParams build() {
            if (direction == null) {
                throw new InvalidConfigurationException("direction must be pos, neg, or both");
            }
            requireUnitInterval(alpha, "alpha");
            requireUnitInterval(maxAnoms, "maxAnoms");
            return new DetectionParams(this);
        }

        private static void requireUnitInterval(double value, String name) {
            if (!(value > 0 && value <= 1)) {
                throw new InvalidConfigurationException(
                        name + " must be in (0, 1], got: " + value);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionParams that))
            return false;
        return Double.compare(alpha, that.alpha) == 0
                && Double.compare(maxAnoms, that.maxAnoms) == 0
                && direction == that.direction
                && verbose == that.verbose
                && Objects.equals(cancellationToken, that.cancellationToken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alpha, maxAnoms, direction, verbose, cancellationToken);
    }

    @Override
    public String toString() {
        return "DetectionParams{" +
                "alpha=" + alpha +
                ", maxAnoms=" + maxAnoms +
                ", direction=" + direction +
                ", verbose=" + verbose +
                '}';
    }
}

package com.seasonalesd.core.detection;

import com.seasonalesd.core.decomposition.Decomposition;
import com.seasonalesd.core.decomposition.SeasonalDecomposer;
import com.seasonalesd.core.decomposition.StlDecomposer;
import com.seasonalesd.core.exception.InsufficientDataException;
import com.seasonalesd.core.exception.InvalidConfigurationException;
import com.seasonalesd.core.exception.InvalidInputException;
import com.seasonalesd.core.model.CancellationToken;
import com.seasonalesd.core.model.DetectionParams;
import com.seasonalesd.core.model.DetectionResult;
import com.seasonalesd.core.model.Direction;
import com.seasonalesd.core.stats.OrderStatistics;
import com.seasonalesd.core.stats.StudentsTDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Seasonal Hybrid ESD detector.
 *
 * <p>
 * Removes the seasonal component and the median from a series, then runs a
 * generalized Extreme Studentized Deviate test on the residuals: each
 * iteration removes the residual furthest from the current median (scaled by
 * the MAD) and compares it with a Student's t critical value. The number of
 * anomalies is the last iteration whose statistic exceeded its critical
 * value; every iteration up to the budget {@code floor(n * maxAnoms)} is
 * tested, so a later significant removal confirms earlier non-significant
 * ones.
 * </p>
 *
 * <h3>Failure modes</h3>
 * <p>
 * Input problems are reported before any work starts:
 * {@link InsufficientDataException} for fewer than two periods,
 * {@link InvalidInputException} for NaN or infinite samples, and
 * {@link InvalidConfigurationException} for a bad period or an anomaly budget
 * of zero. A zero MAD or an undefined critical value ends the test early and
 * is not an error.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances hold no per-call state and may be shared, provided the
 * {@link SeasonalDecomposer} is itself thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class EsdDetector {

    private static final Logger LOG = LoggerFactory.getLogger(EsdDetector.class);

    /** Seasonal smoother span, relative to the series length, requested from the decomposer. */
    static final int SEASONAL_LENGTH_FACTOR = 10;

    private final SeasonalDecomposer decomposer;

    /** Detector backed by {@link StlDecomposer} with default settings. */
    public EsdDetector() {
        this(new StlDecomposer());
    }

    /**
     * @param decomposer source of the seasonal component; must not be
     *                   {@code null}
     */
    public EsdDetector(SeasonalDecomposer decomposer) {
        this.decomposer = Objects.requireNonNull(decomposer, "SeasonalDecomposer must not be null");
    }

    /**
     * Detect anomalies in {@code series}.
     *
     * @param series observations in time order; must not be {@code null}
     * @param period observations per seasonal cycle; {@code 1} skips the
     *               decomposition
     * @param params run parameters; must not be {@code null}
     * @return completed result, or a canceled one if the token fired
     * @throws InvalidConfigurationException if {@code period < 1} or
     *                                       {@code floor(n * maxAnoms) == 0}
     * @throws InsufficientDataException     if
     *                                       {@code series.length < 2 * period}
     * @throws InvalidInputException         if a sample is NaN or infinite
     */
    public DetectionResult detect(double[] series, int period, DetectionParams params) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(params, "DetectionParams must not be null");

        int n = series.length;
        int maxOutliers = validate(series, period, params);

        double[] residuals = residuals(series, period);
        WorkingSampleSet samples = WorkingSampleSet.sortedFrom(residuals);

        Direction direction = params.getDirection();
        CancellationToken token = params.getCancellationToken();
        double alpha = params.getAlpha();

        List<Integer> removed = new ArrayList<>(maxOutliers);
        int numAnoms = 0;

        // Compute test statistics until maxOutliers values have been removed
        for (int i = 1; i <= maxOutliers; i++) {
            if (token.isCancellationRequested()) {
                LOG.info("Detection canceled at iteration {} / {} with {} confirmed anomaly(ies)",
                        i, maxOutliers, numAnoms);
                return DetectionResult.canceled(removed.subList(0, numAnoms));
            }

            double center = samples.median();

            // Constant remainder: nothing further can be tested
            double sigma = samples.mad(center);
            if (sigma == 0.0) {
                LOG.debug("Stopping at iteration {}: median absolute deviation is zero", i);
                break;
            }

            int position = samples.positionOfMaxDeviation(direction, center);
            double statistic = direction.deviation(samples.valueAt(position), center) / sigma;
            removed.add(samples.originalIndexAt(position));
            samples.removeAt(position);

            double lambda = criticalValue(n, i, alpha, direction);
            if (Double.isNaN(lambda)) {
                LOG.debug("Stopping at iteration {}: critical value undefined for n={}", i, n);
                break;
            }

            if (statistic > lambda) {
                numAnoms = i;
            }
            LOG.trace("Iteration {}: index={} r={} lambda={}",
                    i, removed.get(removed.size() - 1), statistic, lambda);

            if (params.isVerbose()) {
                LOG.info("{} / {} completed", i, maxOutliers);
            } else {
                LOG.debug("{} / {} completed", i, maxOutliers);
            }
        }

        DetectionResult result = DetectionResult.completed(removed.subList(0, numAnoms));
        LOG.debug("Detected {} anomaly(ies) in {} observation(s)", numAnoms, n);
        return result;
    }

    /**
     * Critical value of the {@code i}-th test on a sample that started with
     * {@code n} observations:
     * {@code t (n-i) / sqrt((n-i-1 + t²)(n-i+1))} with {@code t} the Student's
     * t quantile at {@code 1 - alpha/(n-i+1)} (halved alpha when two-tailed)
     * and {@code n-i-1} degrees of freedom.
     *
     * @return the critical value, or NaN when the degrees of freedom fall
     *         below one
     */
    static double criticalValue(int n, int i, double alpha, Direction direction) {
        double remaining = n - i + 1;
        double p = direction.isOneTailed()
                ? 1.0 - alpha / remaining
                : 1.0 - alpha / (2.0 * remaining);
        double df = n - i - 1;
        double t = StudentsTDistribution.ppf(p, df);
        return t * (n - i) / Math.sqrt((df + t * t) * remaining);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static int validate(double[] series, int period, DetectionParams params) {
        int n = series.length;

        if (period < 1) {
            throw new InvalidConfigurationException("period must be at least 1, got: " + period);
        }
        if ((long) n < 2L * period) {
            throw new InsufficientDataException("series must contain at least 2 periods");
        }
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(series[i])) {
                throw new InvalidInputException("series contains NANs");
            }
            if (Double.isInfinite(series[i])) {
                throw new InvalidInputException("series contains infinite values at index " + i);
            }
        }

        int maxOutliers = (int) Math.floor(n * params.getMaxAnoms());
        if (maxOutliers == 0) {
            throw new InvalidConfigurationException(
                    "maxAnoms " + params.getMaxAnoms() + " allows no anomalies in a series of length " + n);
        }
        return maxOutliers;
    }

    private double[] residuals(double[] series, int period) {
        int n = series.length;
        double median = OrderStatistics.median(series);

        double[] seasonal;
        if (period > 1) {
            Decomposition decomposition = decomposer.decompose(
                    series.clone(), period, true, SEASONAL_LENGTH_FACTOR * n + 1);
            seasonal = decomposition.getSeasonal();
            if (seasonal.length != n) {
                throw new IllegalStateException("Seasonal component has length " + seasonal.length
                        + ", expected " + n);
            }
        } else {
            seasonal = new double[n];
        }

        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = series[i] - seasonal[i] - median;
        }
        return residuals;
    }
}

package com.seasonalesd.core.detection;

import com.seasonalesd.core.exception.InvalidConfigurationException;
import com.seasonalesd.core.exception.InvalidInputException;
import com.seasonalesd.core.model.DetectionParams;
import com.seasonalesd.core.model.DetectionProfile;
import com.seasonalesd.core.model.DetectionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Entry points for one-off detection calls.
 *
 * <p>
 * Array input returns positions; keyed input (for example dates mapped to
 * values) is ordered by key and returns the anomalous keys. Each form takes
 * either an explicit period and parameters or a {@link DetectionProfile}
 * that carries both.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyDetection {

    private static final EsdDetector DETECTOR = new EsdDetector();

    private AnomalyDetection() {
        // utility class, not instantiable
    }

    /**
     * Detect with alpha 0.05, maxAnoms 0.1 and both tails.
     *
     * @see EsdDetector#detect(double[], int, DetectionParams)
     */
    public static DetectionResult detect(double[] series, int period) {
        return detect(series, period, DetectionParams.defaults());
    }

    /**
     * @see EsdDetector#detect(double[], int, DetectionParams)
     */
    public static DetectionResult detect(double[] series, int period, DetectionParams params) {
        return DETECTOR.detect(series, period, params);
    }

    /**
     * Detect with the period and parameters of a profile.
     *
     * @param series  observations in time order
     * @param profile detection settings; must not be {@code null}
     * @return positions of the anomalies
     * @throws InvalidConfigurationException if the profile is invalid
     * @see EsdDetector#detect(double[], int, DetectionParams)
     */
    public static DetectionResult detect(double[] series, DetectionProfile profile) {
        return detect(series, checked(profile).getPeriod(), profile.toParams());
    }

    /**
     * Detect anomalies in a keyed series with the settings of a profile.
     *
     * @throws InvalidConfigurationException if the profile is invalid
     * @see #detect(Map, int, DetectionParams)
     */
    public static <K extends Comparable<? super K>> List<K> detect(
            Map<K, ? extends Number> series, DetectionProfile profile) {
        return detect(series, checked(profile).getPeriod(), profile.toParams());
    }

    /**
     * Detect anomalies in a keyed series.
     *
     * @param series keyed observations; keys define the time order
     * @param period observations per seasonal cycle
     * @param params run parameters
     * @param <K>    key type, for example {@link java.time.LocalDate}
     * @return anomalous keys in ascending key order
     * @throws InvalidInputException if a key or a value is {@code null}
     * @throws CancellationException if the run was canceled through the
     *                               parameters' token
     */
    public static <K extends Comparable<? super K>> List<K> detect(
            Map<K, ? extends Number> series, int period, DetectionParams params) {
        Objects.requireNonNull(series, "Series must not be null");

        List<K> keys = new ArrayList<>(series.keySet());
        if (keys.contains(null)) {
            throw new InvalidInputException("series contains a null key");
        }
        keys.sort(null);

        double[] values = new double[keys.size()];
        for (int i = 0; i < values.length; i++) {
            Number value = series.get(keys.get(i));
            if (value == null) {
                throw new InvalidInputException("series has no value for key " + keys.get(i));
            }
            values[i] = value.doubleValue();
        }

        DetectionResult result = detect(values, period, params);
        if (result.isCanceled()) {
            throw new CancellationException("Anomaly detection was canceled");
        }
        return result.mapTo(keys);
    }

    static DetectionProfile checked(DetectionProfile profile) {
        Objects.requireNonNull(profile, "Profile must not be null");
        List<String> problems = profile.problems();
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(String.join("; ", problems));
        }
        return profile;
    }
}

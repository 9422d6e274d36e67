package com.seasonalesd.core.detection;

import com.seasonalesd.core.decomposition.Decomposition;
import com.seasonalesd.core.decomposition.SeasonalDecomposer;
import com.seasonalesd.core.exception.InsufficientDataException;
import com.seasonalesd.core.exception.InvalidConfigurationException;
import com.seasonalesd.core.exception.InvalidInputException;
import com.seasonalesd.core.model.CancellationFlag;
import com.seasonalesd.core.model.DetectionParams;
import com.seasonalesd.core.model.DetectionResult;
import com.seasonalesd.core.model.Direction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EsdDetector}.
 */
class EsdDetectorTest {

    private static final double[] SERIES = {
            5, 9, 2, 9, 0, 6, 3, 8, 5, 18,
            7, 8, 8, 0, 2, -5, 0, 5, 6, 7,
            3, 6, 1, 4, 4, 4, 30, 7, 5, 8
    };

    private EsdDetector detector;

    @BeforeEach
    void setUp() {
        detector = new EsdDetector();
    }

    // ---- Detection

    @Test
    @DisplayName("Should find high and low outliers in a weekly series")
    void shouldDetectBothDirections() {
        DetectionResult result = detector.detect(SERIES, 7, params(0.2, 0.05, Direction.BOTH));

        assertThat(result.isCanceled()).isFalse();
        assertThat(result.getAnomalies()).containsExactly(9, 15, 26);
    }

    @Test
    @DisplayName("Should find only high outliers for the positive direction")
    void shouldDetectPositiveOnly() {
        DetectionResult result = detector.detect(SERIES, 7,
                DetectionParams.builder().direction(Direction.POSITIVE).build());

        assertThat(result.getAnomalies()).containsExactly(9, 26);
    }

    @Test
    @DisplayName("Should find only low outliers for the negative direction")
    void shouldDetectNegativeOnly() {
        DetectionResult result = detector.detect(SERIES, 7,
                DetectionParams.builder().direction(Direction.NEGATIVE).build());

        assertThat(result.getAnomalies()).containsExactly(15);
    }

    @Test
    @DisplayName("Should report more anomalies at a looser significance level")
    void shouldDetectMoreWithLargerAlpha() {
        DetectionResult result = detector.detect(SERIES, 7, params(0.2, 0.5, Direction.BOTH));

        assertThat(result.getAnomalies()).containsExactly(1, 4, 9, 15, 26);
    }

    @Test
    @DisplayName("Should find injected spikes on top of a seasonal pattern")
    void shouldDetectInjectedSpikes() {
        double[] series = spikySeries();

        assertThat(detector.detect(series, 7, params(0.1, 0.05, Direction.BOTH)).getAnomalies())
                .containsExactly(12, 33, 50, 71, 88);
        assertThat(detector.detect(series, 7, params(0.1, 0.05, Direction.POSITIVE)).getAnomalies())
                .containsExactly(12, 50, 88);
        assertThat(detector.detect(series, 7, params(0.1, 0.05, Direction.NEGATIVE)).getAnomalies())
                .containsExactly(33, 71);
    }

    @Test
    @DisplayName("Should skip decomposition for period 1")
    void shouldDetectWithoutSeasonality() {
        DetectionResult result = detector.detect(SERIES, 1, params(0.2, 0.05, Direction.BOTH));

        assertThat(result.getAnomalies()).containsExactly(9, 15, 26);
    }

    @Test
    @DisplayName("Should accept a series of exactly two periods")
    void shouldAcceptTwoPeriods() {
        double[] series = Arrays.copyOf(SERIES, 14);

        assertThat(detector.detect(series, 7, params(0.2, 0.05, Direction.BOTH)).getAnomalies())
                .containsExactly(9);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 7 })
    @DisplayName("Should return no anomalies for a constant series")
    void shouldReturnEmptyForConstantSeries(int period) {
        double[] series = new double[28];
        Arrays.fill(series, 4.0);

        DetectionResult result = detector.detect(series, period, DetectionParams.defaults());

        assertThat(result.isCanceled()).isFalse();
        assertThat(result.getAnomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should return the same result on repeated runs")
    void shouldBeIdempotent() {
        DetectionParams params = params(0.2, 0.05, Direction.BOTH);

        assertThat(detector.detect(SERIES, 7, params)).isEqualTo(detector.detect(SERIES, 7, params));
    }

    @Test
    @DisplayName("Should never report more than floor(n * maxAnoms) anomalies")
    void shouldRespectAnomalyBudget() {
        DetectionResult result = detector.detect(SERIES, 7, params(0.1, 0.5, Direction.BOTH));

        assertThat(result.getAnomalies()).hasSizeLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("Should not modify the input series")
    void shouldNotModifyInput() {
        double[] series = SERIES.clone();

        detector.detect(series, 7, params(0.2, 0.05, Direction.BOTH));

        assertThat(series).containsExactly(SERIES);
    }

    @Test
    @DisplayName("Should log progress without changing the result in verbose mode")
    void shouldRunVerbose() {
        DetectionParams params = DetectionParams.builder().maxAnoms(0.2).verbose(true).build();

        assertThat(detector.detect(SERIES, 7, params).getAnomalies()).containsExactly(9, 15, 26);
    }

    @Test
    @DisplayName("Should keep testing after a removal that is not significant")
    void shouldConfirmLaterSignificantRemoval() {
        // The first removal (index 14) falls below its critical value, the
        // second (index 29) exceeds it, which confirms both.
        double[] series = {
                7, -2, 0, 0, 8, -3, 3, -1, 1, -4,
                -2, -1, 3, 0, -8, 2, 1, 0, -4, 3,
                2, 1, 1, 0, 3, 1, -3, 5, 4, -8
        };

        DetectionResult result = detector.detect(series, 1, params(0.3, 0.05, Direction.BOTH));

        assertThat(result.getAnomalies()).containsExactly(14, 29);
    }

    // ---- Decomposer collaboration

    @Test
    @DisplayName("Should request a robust periodic fit on a copy of the series")
    void shouldCallDecomposerWithPeriodicSettings() {
        int[] seasonalLength = new int[1];
        boolean[] robust = new boolean[1];
        SeasonalDecomposer recording = (input, period, r, ns) -> {
            seasonalLength[0] = ns;
            robust[0] = r;
            input[0] = 1_000.0;
            return zeros(input.length);
        };
        double[] series = SERIES.clone();

        new EsdDetector(recording).detect(series, 7, DetectionParams.defaults());

        assertThat(seasonalLength[0]).isEqualTo(10 * SERIES.length + 1);
        assertThat(robust[0]).isTrue();
        assertThat(series[0]).isEqualTo(SERIES[0]);
    }

    @Test
    @DisplayName("Should test raw deviations from the median when the seasonal part is zero")
    void shouldUseSeasonalComponentFromDecomposer() {
        EsdDetector flat = new EsdDetector((series, period, robust, ns) -> zeros(series.length));

        DetectionResult result = flat.detect(SERIES, 7, params(0.2, 0.05, Direction.BOTH));

        assertThat(result.getAnomalies()).containsExactly(9, 15, 26);
    }

    @Test
    @DisplayName("Should fail when the decomposer returns a component of the wrong length")
    void shouldRejectMisshapenDecomposition() {
        EsdDetector broken = new EsdDetector((series, period, robust, ns) -> zeros(series.length - 1));

        assertThatThrownBy(() -> broken.detect(SERIES, 7, DetectionParams.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected 30");
    }

    // ---- Cancellation

    @Test
    @DisplayName("Should return an empty canceled result when canceled up front")
    void shouldCancelBeforeFirstIteration() {
        CancellationFlag flag = new CancellationFlag();
        flag.cancel();

        DetectionResult result = detector.detect(SERIES, 7,
                DetectionParams.builder().maxAnoms(0.2).cancellationToken(flag).build());

        assertThat(result.isCanceled()).isTrue();
        assertThat(result.getStatus()).isEqualTo(DetectionResult.Status.CANCELED);
        assertThat(result.getAnomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should keep the anomalies confirmed before cancellation")
    void shouldKeepConfirmedAnomaliesOnCancel() {
        AtomicInteger polls = new AtomicInteger();
        DetectionParams params = DetectionParams.builder()
                .maxAnoms(0.2)
                .cancellationToken(() -> polls.incrementAndGet() >= 3)
                .build();

        DetectionResult result = detector.detect(SERIES, 7, params);

        assertThat(result.isCanceled()).isTrue();
        assertThat(result.getAnomalies()).containsExactly(9, 26);
        assertThat(polls.get()).isEqualTo(3);
    }

    // ---- Validation

    @Test
    @DisplayName("Should reject a series shorter than two periods")
    void shouldRejectShortSeries() {
        double[] series = Arrays.copyOf(SERIES, 13);

        assertThatThrownBy(() -> detector.detect(series, 7, DetectionParams.defaults()))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessage("series must contain at least 2 periods");
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 14, 29 })
    @DisplayName("Should reject a NaN at any position")
    void shouldRejectNan(int position) {
        double[] series = SERIES.clone();
        series[position] = Double.NaN;

        assertThatThrownBy(() -> detector.detect(series, 7, DetectionParams.defaults()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("series contains NANs");
    }

    @Test
    @DisplayName("Should reject infinite values")
    void shouldRejectInfinity() {
        double[] series = SERIES.clone();
        series[3] = Double.NEGATIVE_INFINITY;

        assertThatThrownBy(() -> detector.detect(series, 7, DetectionParams.defaults()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("index 3");
    }

    @Test
    @DisplayName("Should reject a period below 1")
    void shouldRejectNonPositivePeriod() {
        assertThatThrownBy(() -> detector.detect(SERIES, 0, DetectionParams.defaults()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("period");
    }

    @Test
    @DisplayName("Should reject an anomaly budget that rounds down to zero")
    void shouldRejectZeroBudget() {
        double[] series = Arrays.copyOf(SERIES, 14);

        assertThatThrownBy(() -> detector.detect(series, 7, params(0.05, 0.05, Direction.BOTH)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("allows no anomalies");
    }

    @Test
    @DisplayName("Should report validation failures as IllegalArgumentException")
    void shouldExposeErrorsAsIllegalArgument() {
        assertThatThrownBy(() -> detector.detect(new double[3], 2, DetectionParams.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---- Critical values

    @Test
    @DisplayName("Should compute one- and two-tailed critical values")
    void shouldComputeCriticalValues() {
        assertThat(EsdDetector.criticalValue(30, 1, 0.05, Direction.BOTH))
                .isCloseTo(2.9084730589, within(1e-8));
        assertThat(EsdDetector.criticalValue(30, 1, 0.05, Direction.POSITIVE))
                .isCloseTo(2.7451317239, within(1e-8));
        assertThat(EsdDetector.criticalValue(30, 5, 0.05, Direction.NEGATIVE))
                .isCloseTo(2.6808994509, within(1e-8));
    }

    @Test
    @DisplayName("Should return NaN when fewer than one degree of freedom remains")
    void shouldReturnNanCriticalValueWithoutDegreesOfFreedom() {
        assertThat(EsdDetector.criticalValue(3, 2, 0.05, Direction.BOTH)).isNaN();
    }

    // ---- Helpers

    private static DetectionParams params(double maxAnoms, double alpha, Direction direction) {
        return DetectionParams.builder()
                .maxAnoms(maxAnoms)
                .alpha(alpha)
                .direction(direction)
                .build();
    }

    private static Decomposition zeros(int n) {
        return new Decomposition(new double[n], new double[n], new double[n], new double[n]);
    }

    private static double[] spikySeries() {
        double[] pattern = { 10, 12, 15, 13, 11, 9, 8 };
        double[] series = new double[100];
        for (int i = 0; i < series.length; i++) {
            series[i] = pattern[i % pattern.length] + 0.3 * Math.sin(i * 1.7);
        }
        series[12] += 25;
        series[33] -= 20;
        series[50] += 30;
        series[71] -= 25;
        series[88] += 22;
        return series;
    }
}

package com.seasonalesd.core.detection;

import com.seasonalesd.core.exception.InvalidConfigurationException;
import com.seasonalesd.core.exception.InvalidInputException;
import com.seasonalesd.core.model.CancellationFlag;
import com.seasonalesd.core.model.DetectionParams;
import com.seasonalesd.core.model.DetectionProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyDetection}.
 */
class AnomalyDetectionTest {

    private static final double[] SERIES = {
            5, 9, 2, 9, 0, 6, 3, 8, 5, 18,
            7, 8, 8, 0, 2, -5, 0, 5, 6, 7,
            3, 6, 1, 4, 4, 4, 30, 7, 5, 8
    };

    private static final LocalDate START = LocalDate.of(2024, 3, 1);

    @Test
    @DisplayName("Should detect with default parameters")
    void shouldDetectWithDefaults() {
        assertThat(AnomalyDetection.detect(SERIES, 7).getAnomalies()).containsExactly(9, 15, 26);
    }

    @Test
    @DisplayName("Should return the anomalous dates of a keyed series")
    void shouldDetectKeyedSeries() {
        List<LocalDate> anomalies = AnomalyDetection.detect(dated(), 7,
                DetectionParams.builder().maxAnoms(0.2).build());

        assertThat(anomalies).containsExactly(START.plusDays(9), START.plusDays(15), START.plusDays(26));
    }

    @Test
    @DisplayName("Should order a keyed series by key regardless of map order")
    void shouldOrderKeyedSeriesByKey() {
        Map<Integer, Double> series = new HashMap<>();
        for (int i = SERIES.length - 1; i >= 0; i--) {
            series.put(1_000 + i * 10, SERIES[i]);
        }

        List<Integer> anomalies = AnomalyDetection.detect(series, 7, DetectionParams.defaults());

        assertThat(anomalies).containsExactly(1_090, 1_150, 1_260);
    }

    @Test
    @DisplayName("Should reject a keyed series with a missing value")
    void shouldRejectNullValue() {
        Map<LocalDate, Double> series = dated();
        series.put(START.plusDays(4), null);

        assertThatThrownBy(() -> AnomalyDetection.detect(series, 7, DetectionParams.defaults()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining(START.plusDays(4).toString());
    }

    @Test
    @DisplayName("Should reject a keyed series with a null key")
    void shouldRejectNullKey() {
        Map<LocalDate, Double> series = dated();
        series.put(null, 4.0);

        assertThatThrownBy(() -> AnomalyDetection.detect(series, 7, DetectionParams.defaults()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("null key");
    }

    @Test
    @DisplayName("Should surface cancellation of a keyed run as CancellationException")
    void shouldThrowOnCancel() {
        CancellationFlag flag = new CancellationFlag();
        flag.cancel();
        DetectionParams params = DetectionParams.builder().cancellationToken(flag).build();

        assertThatThrownBy(() -> AnomalyDetection.detect(dated(), 7, params))
                .isInstanceOf(CancellationException.class);
    }

    // ---- Profiles

    @Test
    @DisplayName("Should take period and parameters from a profile")
    void shouldDetectWithProfile() {
        DetectionProfile weekly = profile("weekly", 7, "both");

        assertThat(AnomalyDetection.detect(SERIES, weekly).getAnomalies()).containsExactly(9, 15, 26);
    }

    @Test
    @DisplayName("Should honor the profile direction")
    void shouldDetectWithProfileDirection() {
        DetectionProfile highs = profile("weekly_highs", 7, "pos");

        assertThat(AnomalyDetection.detect(SERIES, highs).getAnomalies()).containsExactly(9, 26);
    }

    @Test
    @DisplayName("Should return the anomalous dates of a keyed series for a profile")
    void shouldDetectKeyedSeriesWithProfile() {
        List<LocalDate> anomalies = AnomalyDetection.detect(dated(), profile("weekly", 7, "both"));

        assertThat(anomalies).containsExactly(START.plusDays(9), START.plusDays(15), START.plusDays(26));
    }

    @Test
    @DisplayName("Should reject an invalid profile before detecting")
    void shouldRejectInvalidProfile() {
        DetectionProfile broken = profile("broken", 0, "both");

        assertThatThrownBy(() -> AnomalyDetection.detect(SERIES, broken))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("'period' >= 1");
    }

    // ---- Helpers

    private static Map<LocalDate, Double> dated() {
        Map<LocalDate, Double> series = new HashMap<>();
        for (int i = 0; i < SERIES.length; i++) {
            series.put(START.plusDays(i), SERIES[i]);
        }
        return series;
    }

    private static DetectionProfile profile(String name, int period, String direction) {
        DetectionProfile profile = new DetectionProfile();
        profile.setName(name);
        profile.setPeriod(period);
        profile.setMaxAnoms(0.2);
        profile.setDirection(direction);
        return profile;
    }
}

package com.seasonalesd.core.plot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seasonalesd.core.model.DetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link VegaLitePlot}.
 */
class VegaLitePlotTest {

    private static final double[] SERIES = { 1.0, 2.0, 30.0, 3.0 };

    @Test
    @DisplayName("Should emit one data row per observation with the anomaly flag")
    void shouldEmitDataRows() {
        ObjectNode chart = VegaLitePlot.chart(SERIES, DetectionResult.completed(List.of(2)));

        JsonNode rows = chart.path("data").path("values");
        assertThat(rows).hasSize(4);
        assertThat(rows.get(2).path("x").asInt()).isEqualTo(2);
        assertThat(rows.get(2).path("y").asDouble()).isEqualTo(30.0);
        assertThat(rows.get(2).path("anomaly").asBoolean()).isTrue();
        assertThat(rows.get(0).path("anomaly").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Should layer a line with anomaly points")
    void shouldLayerLineAndPoints() {
        ObjectNode chart = VegaLitePlot.chart(SERIES, List.of(2));

        assertThat(chart.path("$schema").asText()).isEqualTo(VegaLitePlot.SCHEMA);
        JsonNode layers = chart.path("layer");
        assertThat(layers).hasSize(2);
        assertThat(layers.get(0).path("mark").path("type").asText()).isEqualTo("line");
        assertThat(layers.get(0).path("encoding").path("y").path("scale").path("zero").asBoolean()).isFalse();
        assertThat(layers.get(1).path("mark").path("type").asText()).isEqualTo("point");
        assertThat(layers.get(1).path("transform").get(0).path("filter").asText())
                .isEqualTo("datum.anomaly == true");
    }

    @Test
    @DisplayName("Should use a quantitative x axis for array series")
    void shouldUseQuantitativeAxisForArrays() {
        ObjectNode chart = VegaLitePlot.chart(SERIES, List.of());

        JsonNode x = chart.path("layer").get(0).path("encoding").path("x");
        assertThat(x.path("type").asText()).isEqualTo("quantitative");
        assertThat(x.has("scale")).isFalse();
    }

    @Test
    @DisplayName("Should write dates as ISO strings on a UTC temporal axis")
    void shouldUseUtcTemporalAxisForDates() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        Map<LocalDate, Double> series = new LinkedHashMap<>();
        series.put(start.plusDays(1), 5.0);
        series.put(start, 4.0);

        ObjectNode chart = VegaLitePlot.chart(series, List.of(start.plusDays(1)));

        JsonNode rows = chart.path("data").path("values");
        assertThat(rows.get(0).path("x").asText()).isEqualTo("2024-03-01");
        assertThat(rows.get(1).path("x").asText()).isEqualTo("2024-03-02");
        assertThat(rows.get(1).path("anomaly").asBoolean()).isTrue();

        JsonNode x = chart.path("layer").get(1).path("encoding").path("x");
        assertThat(x.path("type").asText()).isEqualTo("temporal");
        assertThat(x.path("scale").path("type").asText()).isEqualTo("utc");
    }

    @Test
    @DisplayName("Should use a temporal axis without UTC scale for date-times")
    void shouldUseTemporalAxisForDateTimes() {
        Map<LocalDateTime, Double> series = new TreeMap<>();
        series.put(LocalDateTime.of(2024, 3, 1, 12, 30, 15), 1.0);

        ObjectNode chart = VegaLitePlot.chart(series, List.of());

        assertThat(chart.path("data").path("values").get(0).path("x").asText())
                .isEqualTo("2024-03-01T12:30:15");
        JsonNode x = chart.path("layer").get(0).path("encoding").path("x");
        assertThat(x.path("type").asText()).isEqualTo("temporal");
        assertThat(x.has("scale")).isFalse();
    }

    @Test
    @DisplayName("Should serialize to parseable JSON")
    void shouldSerializeToJson() throws Exception {
        String json = VegaLitePlot.toJson(VegaLitePlot.chart(SERIES, List.of(2)));

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.path("config").path("axis").path("labelFontSize").asInt()).isEqualTo(12);
        assertThat(parsed.path("config").path("axis").path("title").isNull()).isTrue();
    }
}

package com.seasonalesd.core.plot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seasonalesd.core.model.DetectionResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds Vega-Lite chart specifications for a series and its anomalies.
 *
 * <p>
 * The chart has two layers over the same data: a line through every
 * observation and a point on each row whose {@code anomaly} flag is set.
 * Each data row is {@code {"x": ..., "y": ..., "anomaly": true|false}}.
 * </p>
 *
 * <ul>
 * <li>Array series use the zero-based position as a quantitative x.</li>
 * <li>Keyed series are ordered by key. Temporal keys are written as ISO-8601
 * strings through Jackson's {@link JavaTimeModule}; {@link LocalDate} keys
 * also get a {@code utc} scale so days are not shifted by the viewer's time
 * zone. Numeric keys stay quantitative.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class VegaLitePlot {

    /** Vega-Lite schema referenced by every generated chart. */
    public static final String SCHEMA = "https://vega.github.io/schema/vega-lite/v5.json";

    static final String LINE_COLOR = "#fa9088";
    static final String POINT_COLOR = "#19c7ca";
    static final String ANOMALY_FILTER = "datum.anomaly == true";

    private static final ObjectMapper MAPPER = createMapper();

    private VegaLitePlot() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Chart an array series against a detection result.
     *
     * @param series observations in time order; must not be {@code null}
     * @param result detection result for {@code series}; must not be
     *               {@code null}
     * @return the chart specification
     */
    public static ObjectNode chart(double[] series, DetectionResult result) {
        Objects.requireNonNull(result, "DetectionResult must not be null");
        return chart(series, result.getAnomalies());
    }

    /**
     * Chart an array series.
     *
     * @param series    observations in time order; must not be {@code null}
     * @param anomalies zero-based anomalous positions; must not be
     *                  {@code null}
     * @return the chart specification
     */
    public static ObjectNode chart(double[] series, Collection<Integer> anomalies) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(anomalies, "Anomalies must not be null");

        Set<Integer> flagged = new HashSet<>(anomalies);
        ArrayNode rows = MAPPER.createArrayNode();
        for (int i = 0; i < series.length; i++) {
            ObjectNode row = rows.addObject();
            row.put("x", i);
            row.put("y", series[i]);
            row.put("anomaly", flagged.contains(i));
        }
        return layeredChart(rows, axis("quantitative", false));
    }

    /**
     * Chart a keyed series.
     *
     * @param series    keyed observations; must not be {@code null} and must
     *                  not contain {@code null} values
     * @param anomalies anomalous keys; must not be {@code null}
     * @param <K>       key type
     * @return the chart specification
     */
    public static <K extends Comparable<? super K>> ObjectNode chart(
            Map<K, ? extends Number> series, Collection<K> anomalies) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(anomalies, "Anomalies must not be null");

        List<K> keys = new ArrayList<>(series.keySet());
        keys.sort(null);
        Set<K> flagged = new HashSet<>(anomalies);

        ArrayNode rows = MAPPER.createArrayNode();
        for (K key : keys) {
            Number value = Objects.requireNonNull(series.get(key), "No value for key " + key);
            ObjectNode row = rows.addObject();
            row.set("x", MAPPER.valueToTree(key));
            row.put("y", value.doubleValue());
            row.put("anomaly", flagged.contains(key));
        }

        K first = keys.isEmpty() ? null : keys.get(0);
        ObjectNode x = first instanceof Number
                ? axis("quantitative", false)
                : axis("temporal", first instanceof LocalDate);
        return layeredChart(rows, x);
    }

    /**
     * Serialize a chart to a JSON string.
     *
     * @param chart chart from one of the {@code chart} methods
     * @return the JSON text
     * @throws IllegalStateException if serialization fails
     */
    public static String toJson(JsonNode chart) {
        Objects.requireNonNull(chart, "Chart must not be null");
        try {
            return MAPPER.writeValueAsString(chart);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chart: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ObjectNode layeredChart(ArrayNode rows, ObjectNode x) {
        ObjectNode chart = MAPPER.createObjectNode();
        chart.put("$schema", SCHEMA);
        chart.putObject("data").set("values", rows);

        ArrayNode layers = chart.putArray("layer");

        ObjectNode line = layers.addObject();
        line.putObject("mark").put("type", "line");
        ObjectNode lineEncoding = line.putObject("encoding");
        lineEncoding.set("x", x.deepCopy());
        ObjectNode lineY = lineEncoding.putObject("y");
        lineY.put("field", "y");
        lineY.put("type", "quantitative");
        lineY.putObject("scale").put("zero", false);
        lineEncoding.putObject("color").put("value", LINE_COLOR);

        ObjectNode points = layers.addObject();
        points.putArray("transform").addObject().put("filter", ANOMALY_FILTER);
        ObjectNode mark = points.putObject("mark");
        mark.put("type", "point");
        mark.put("size", 200);
        ObjectNode pointEncoding = points.putObject("encoding");
        pointEncoding.set("x", x.deepCopy());
        ObjectNode pointY = pointEncoding.putObject("y");
        pointY.put("field", "y");
        pointY.put("type", "quantitative");
        pointEncoding.putObject("color").put("value", POINT_COLOR);

        ObjectNode axis = chart.putObject("config").putObject("axis");
        axis.putNull("title");
        axis.put("labelFontSize", 12);
        return chart;
    }

    private static ObjectNode axis(String type, boolean utc) {
        ObjectNode x = MAPPER.createObjectNode();
        x.put("field", "x");
        x.put("type", type);
        if (utc) {
            x.putObject("scale").put("type", "utc");
        }
        return x;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}

package com.seasonalesd.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Outcome of one detection run: a status and the anomalous positions.
 *
 * <p>
 * Indices are zero-based positions in the input series, ascending and free of
 * duplicates. An empty list is a valid, completed result. A
 * {@link Status#CANCELED} result holds whatever had been confirmed when the
 * run stopped.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Terminal state of a run. */
    public enum Status {
        COMPLETED,
        CANCELED
    }

    private final Status status;
    private final List<Integer> anomalies;

    private DetectionResult(Status status, List<Integer> anomalies) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        // sorted, de-duplicated defensive copy
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(anomalies)));
    }

    /**
     * @param anomalies confirmed positions, any order
     * @return a completed result
     */
    public static DetectionResult completed(List<Integer> anomalies) {
        return new DetectionResult(Status.COMPLETED, anomalies);
    }

    /**
     * @param anomalies positions confirmed before the run stopped, any order
     * @return a canceled result
     */
    public static DetectionResult canceled(List<Integer> anomalies) {
        return new DetectionResult(Status.CANCELED, anomalies);
    }

    /**
     * @return an empty, completed result
     */
    public static DetectionResult empty() {
        return completed(Collections.emptyList());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCanceled() {
        return status == Status.CANCELED;
    }

    /**
     * @return unmodifiable ascending list of anomalous positions
     */
    public List<Integer> getAnomalies() {
        return anomalies;
    }

    /**
     * Map the anomalous positions onto caller-supplied keys.
     *
     * @param keys one key per series position, in series order
     * @param <K>  key type
     * @return the keys at the anomalous positions, in ascending position order
     * @throws IllegalArgumentException if a position is outside {@code keys}
     */
    public <K> List<K> mapTo(List<K> keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        List<K> mapped = new ArrayList<>(anomalies.size());
        for (int index : anomalies) {
            if (index >= keys.size()) {
                throw new IllegalArgumentException(
                        "Anomaly index " + index + " outside key list of size " + keys.size());
            }
            mapped.add(keys.get(index));
        }
        return Collections.unmodifiableList(mapped);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return status == that.status && anomalies.equals(that.anomalies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, anomalies);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "status=" + status +
                ", anomalies=" + anomalies +
                '}';
    }
}

package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.Direction;
import com.seasonalesd.core.stats.OrderStatistics;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Ascending residual values with a parallel array of their original series
 * positions.
 *
 * <p>
 * {@code indices[i]} is always the series position of {@code values[i]}, and
 * both arrays shrink together by one element per {@link #removeAt(int)}.
 * Removal shifts the tail left, so the live prefix stays sorted and the median
 * needs no re-sort.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by a single detection run.
 * </p>
 */
final class WorkingSampleSet {

    private final double[] values;
    private final int[] indices;
    private int size;

    private WorkingSampleSet(double[] values, int[] indices) {
        this.values = values;
        this.indices = indices;
        this.size = values.length;
    }

    /**
     * Stable-sort {@code residuals}; equal values keep their series order.
     */
    static WorkingSampleSet sortedFrom(double[] residuals) {
        int n = residuals.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        // object sort is a stable merge sort
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> residuals[i]));

        double[] values = new double[n];
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = order[i];
            values[i] = residuals[order[i]];
        }
        return new WorkingSampleSet(values, indices);
    }

    int size() {
        return size;
    }

    double median() {
        return OrderStatistics.medianOfSorted(values, size);
    }

    double mad(double center) {
        return OrderStatistics.mad(values, size, center);
    }

    /**
     * @return first position holding the largest deviation from
     *         {@code center} for the given direction
     */
    int positionOfMaxDeviation(Direction direction, double center) {
        int best = 0;
        double bestDeviation = direction.deviation(values[0], center);
        for (int i = 1; i < size; i++) {
            double deviation = direction.deviation(values[i], center);
            if (deviation > bestDeviation) {
                bestDeviation = deviation;
                best = i;
            }
        }
        return best;
    }

    double valueAt(int position) {
        checkPosition(position);
        return values[position];
    }

    int originalIndexAt(int position) {
        checkPosition(position);
        return indices[position];
    }

    /**
     * Remove one element from both arrays, preserving the order of the rest.
     */
    void removeAt(int position) {
        checkPosition(position);
        int tail = size - position - 1;
        System.arraycopy(values, position + 1, values, position, tail);
        System.arraycopy(indices, position + 1, indices, position, tail);
        size--;
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException(
                    "Position " + position + " outside working set of size " + size);
        }
    }
}

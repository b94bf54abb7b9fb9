package org.merit.grapher;

import org.jetbrains.annotations.NotNull;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <h1>ResultsData</h1>
 * In-memory contents of one results file: parallel sequences of timestamps, measured
 * power (target), predicted power and, when the file provides it, the anomaly flag.
 * <p>
 * All sequences share the same length and the timestamps are expected in ascending order.
 * Instances are immutable; the window replaces its dataset as a whole on every load
 * and never merges two files.
 */
public final class ResultsData {
    private final List<LocalDateTime> times;
    private final double[] target;
    private final double[] predict;
    private final double[] anomalies; // null when the file has no anomaly column

    /**
     * @param times     sample timestamps, ascending
     * @param target    measured power in Watts
     * @param predict   predicted power in Watts
     * @param anomalies anomaly flags (0 or 1) or {@code null} if absent
     * @throws IllegalArgumentException if the sequences differ in length
     */
    public ResultsData(List<LocalDateTime> times, double[] target, double[] predict, double[] anomalies) {
        if (times.size() != target.length || times.size() != predict.length) {
            throw new IllegalArgumentException(String.format(
                    "Series length mismatch: %d times, %d targets, %d predictions",
                    times.size(), target.length, predict.length));
        }
        if (anomalies != null && anomalies.length != times.size()) {
            throw new IllegalArgumentException(String.format(
                    "Series length mismatch: %d times, %d anomaly flags", times.size(), anomalies.length));
        }

        // Copy everything, a loaded dataset never changes afterwards
        this.times = Collections.unmodifiableList(new ArrayList<>(times));
        this.target = target.clone();
        this.predict = predict.clone();
        this.anomalies = anomalies == null ? null : anomalies.clone();
    }

    /**
     * @return an empty dataset, optionally keeping the anomaly column so downstream code sees the same shape.
     */
    public static ResultsData empty(boolean withAnomalies) {
        return new ResultsData(List.of(), new double[0], new double[0], withAnomalies ? new double[0] : null);
    }

    /**
     * Returns the samples in {@code [from, to)} as a new dataset.
     */
    @NotNull
    public ResultsData slice(int from, int to) {
        return new ResultsData(
                times.subList(from, to),
                Arrays.copyOfRange(target, from, to),
                Arrays.copyOfRange(predict, from, to),
                anomalies == null ? null : Arrays.copyOfRange(anomalies, from, to));
    }

    public int size() {
        return times.size();
    }

    public boolean isEmpty() {
        return times.isEmpty();
    }

    public boolean hasAnomalies() {
        return anomalies != null;
    }

    public List<LocalDateTime> getTimes() {
        return times;
    }

    public double[] getTarget() {
        return target.clone();
    }

    public double[] getPredict() {
        return predict.clone();
    }

    /**
     * @return a copy of the anomaly flags, or {@code null} when the file had no anomaly column.
     */
    public double[] getAnomalies() {
        return anomalies == null ? null : anomalies.clone();
    }

    public LocalDateTime getFirstTime() {
        return times.get(0);
    }

    public LocalDateTime getLastTime() {
        return times.get(times.size() - 1);
    }
}

package org.merit.grapher;

import org.jetbrains.annotations.NotNull;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * <h1>DataTransform</h1>
 * Stateless helpers that turn a loaded {@link ResultsData} into what the graph shows:
 * <ul>
 *     <li>{@link #rangeFilter} cuts the samples to the selected start/end dates.</li>
 *     <li>{@link #movingAverage} smooths the target and prediction series.</li>
 *     <li>{@link #anomalyBands} groups the anomaly flags into fixed-size buckets and rates each one.</li>
 * </ul>
 * {@link #prepare} chains the three steps for one redraw.
 */
public final class DataTransform {

    private DataTransform() {
    }

    /**
     * Runs the full pipeline for one redraw: range filter, optional smoothing, optional banding.
     *
     * @param data    the currently loaded dataset
     * @param options user selections for this redraw
     * @return the series and bands to draw; empty when no sample falls in the range
     * @throws GrapherException {@link ErrorKind#INVALID_WINDOW_VALUE} if a window is negative
     */
    @NotNull
    public static GraphView prepare(ResultsData data, GraphOptions options) throws GrapherException {
        checkWindow(options.smoothingWindow(), "Smoothing window");
        checkWindow(options.anomalyWindow(), "Anomaly window");

        ResultsData filtered = rangeFilter(data, options.start(), options.end());

        double[] target = filtered.getTarget();
        double[] predict = filtered.getPredict();
        if (options.smoothingWindow() > 0) {
            target = movingAverage(target, options.smoothingWindow());
            predict = movingAverage(predict, options.smoothingWindow());
        }

        List<AnomalyBand> bands = List.of();
        if (options.anomalyWindow() > 0 && filtered.hasAnomalies()) {
            bands = anomalyBands(filtered.getAnomalies(), filtered.getTimes(), options.anomalyWindow());
        }

        return new GraphView(filtered.getTimes(), target, predict, bands);
    }

    /**
     * Returns the contiguous run of samples with {@code start <= t < end}.
     * <p>
     * The timestamps must be sorted ascending: the first and last matching index are used as
     * slice bounds, so everything between them is kept.
     *
     * @param data  dataset to filter
     * @param start inclusive lower bound
     * @param end   exclusive upper bound
     * @return the matching samples, or an empty dataset if none match
     */
    @NotNull
    public static ResultsData rangeFilter(ResultsData data, LocalDateTime start, LocalDateTime end) {
        List<LocalDateTime> times = data.getTimes();
        int first = -1;
        int last = -1;

        for (int i = 0; i < times.size(); i++) {
            LocalDateTime t = times.get(i);
            if (!t.isBefore(start) && t.isBefore(end)) {
                if (first == -1) first = i;
                last = i;
            }
        }

        if (first == -1) {
            return ResultsData.empty(data.hasAnomalies());
        }
        return data.slice(first, last + 1);
    }

    /**
     * Trailing simple moving average.
     * <p>
     * Element {@code i} of the result is the mean of the last {@code window} inputs ending at {@code i};
     * the first few elements average over the samples available so far. The window is clamped to the
     * series length and the output always has the same length as the input.
     * <p>
     * Example: series = [1, 2, 3, 4], window = 2 gives [1, 1.5, 2.5, 3.5]
     *
     * @param series values to smooth
     * @param window number of samples to average; 0 or 1 returns an unchanged copy
     * @return the smoothed series
     */
    @NotNull
    public static double[] movingAverage(double[] series, int window) {
        if (window <= 1 || series.length == 0) {
            return series.clone();
        }

        int period = Math.min(window, series.length);
        double[] smoothed = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            int startIndex = Math.max(0, i - period + 1);
            smoothed[i] = average(series, startIndex, i + 1);
        }
        return smoothed;
    }

    /**
     * Buckets the anomaly flags into groups of {@code duration} consecutive samples and rates each bucket.
     * <p>
     * Bucket boundaries are counted in samples, not in clock time: with one sample per minute a bucket
     * covers {@code duration} minutes. Each bucket is classified by {@link SeverityTier#classify}.
     * A trailing bucket with fewer than {@code duration} samples is dropped.
     * <p>
     * Example: anomalies = [0, 0, 1, 1, 1, 0], duration = 3 gives LOW (sum 1) then MEDIUM (sum 2)
     *
     * @param anomalies anomaly flags, one per sample
     * @param times     timestamps of the same samples
     * @param duration  bucket length in samples
     * @return one band per complete bucket, NONE buckets included; empty if {@code duration <= 0}
     */
    @NotNull
    public static List<AnomalyBand> anomalyBands(double[] anomalies, List<LocalDateTime> times, int duration) {
        if (anomalies.length != times.size()) {
            throw new IllegalArgumentException(String.format(
                    "Series length mismatch: %d anomaly flags, %d times", anomalies.length, times.size()));
        }

        List<AnomalyBand> bands = new ArrayList<>();
        if (duration <= 0) return bands;

        for (int bucketStart = 0; bucketStart + duration <= anomalies.length; bucketStart += duration) {
            double anomalyCount = 0;
            for (int i = bucketStart; i < bucketStart + duration; i++) {
                anomalyCount += anomalies[i];
            }
            bands.add(new AnomalyBand(times.get(bucketStart), duration, anomalyCount,
                    SeverityTier.classify(anomalyCount, duration)));
        }
        return bands;
    }

    /**
     * Reads a smoothing or anomaly window from a widget value.
     *
     * @param value spinner or text field value
     * @param label name used in the error message, e.g. "Smoothing window"
     * @return the window as a non-negative integer
     * @throws GrapherException {@link ErrorKind#INVALID_WINDOW_VALUE} if the value is not a non-negative integer
     */
    public static int parseWindow(Object value, String label) throws GrapherException {
        int window;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || d != Math.rint(d) || d > Integer.MAX_VALUE) {
                throw invalidWindow(label);
            }
            window = (int) d;
        } else if (value instanceof String) {
            try {
                window = Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new GrapherException(ErrorKind.INVALID_WINDOW_VALUE, label + " must be integer value.", e);
            }
        } else {
            throw invalidWindow(label);
        }

        checkWindow(window, label);
        return window;
    }

    private static void checkWindow(int window, String label) throws GrapherException {
        if (window < 0) {
            throw new GrapherException(ErrorKind.INVALID_WINDOW_VALUE, label + " must not be negative.");
        }
    }

    private static GrapherException invalidWindow(String label) {
        return new GrapherException(ErrorKind.INVALID_WINDOW_VALUE, label + " must be integer value.");
    }

    // Mean of values[startIndex, endIndex)
    private static double average(double[] values, int startIndex, int endIndex) {
        double sum = 0;
        for (int i = startIndex; i < endIndex; i++) {
            sum += values[i];
        }
        return sum / (endIndex - startIndex);
    }
}

package org.merit.grapher;

import java.time.LocalDateTime;

/**
 * User selections that drive one redraw of the results graph.
 *
 * @param start           inclusive lower bound of the plotted range
 * @param end             exclusive upper bound of the plotted range
 * @param smoothingWindow moving average window in samples (minutes), 0 or 1 to disable
 * @param anomalyWindow   anomaly bucket length in samples (minutes), 0 to disable
 */
public record GraphOptions(LocalDateTime start, LocalDateTime end, int smoothingWindow, int anomalyWindow) {

    /**
     * Options that plot the whole dataset without smoothing or anomaly bands.
     * The end bound is moved one second past the last sample because it is exclusive.
     */
    public static GraphOptions fullRange(ResultsData data) {
        return new GraphOptions(data.getFirstTime(), data.getLastTime().plusSeconds(1), 0, 0);
    }
}

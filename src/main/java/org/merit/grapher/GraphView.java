package org.merit.grapher;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Filtered and optionally smoothed series ready to be drawn, plus the anomaly bands
 * computed for the same range.
 *
 * @param times   timestamps of the plotted samples
 * @param target  measured power in Watts
 * @param predict predicted power in Watts
 * @param bands   anomaly bands, empty when banding is off or the file has no anomaly column
 */
public record GraphView(List<LocalDateTime> times, double[] target, double[] predict, List<AnomalyBand> bands) {

    public boolean isEmpty() {
        return times.isEmpty();
    }
}

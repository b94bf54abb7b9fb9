package org.merit.grapher;

import java.time.LocalDateTime;

/**
 * One classified anomaly bucket, drawn as a vertical band starting at {@code start}
 * and spanning {@code durationMinutes}.
 *
 * @param start           timestamp of the first sample in the bucket
 * @param durationMinutes width of the band in minutes (equal to the bucket length in samples)
 * @param anomalyCount    summed anomaly flags inside the bucket
 * @param tier            severity derived from {@code anomalyCount}
 */
public record AnomalyBand(LocalDateTime start, int durationMinutes, double anomalyCount, SeverityTier tier) {

    /**
     * @return the exclusive end of the band.
     */
    public LocalDateTime end() {
        return start.plusMinutes(durationMinutes);
    }
}

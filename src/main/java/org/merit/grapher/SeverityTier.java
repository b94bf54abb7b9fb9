package org.merit.grapher;

import java.awt.*;

/**
 * Anomaly density classification of one banding bucket.
 * <p>
 * A bucket of {@code duration} samples is rated by how many of its samples were
 * flagged as anomalies. The thresholds sit at one third and two thirds of the bucket
 * length, so a bucket of 3 samples with 2 anomalies is MEDIUM while 3 anomalies make it HIGH.
 */
public enum SeverityTier {
    NONE(null),
    LOW(new Color(0, 128, 0)),      // green
    MEDIUM(new Color(255, 165, 0)), // orange
    HIGH(new Color(255, 0, 0));     // red

    private final Color color;

    SeverityTier(Color color) {
        this.color = color;
    }

    /**
     * Classifies a bucket by its summed anomaly count.
     *
     * @param anomalyCount sum of the anomaly flags inside the bucket
     * @param duration     number of samples in the bucket
     * @return HIGH above 2/3 of the bucket, MEDIUM above 1/3, LOW above zero, NONE otherwise
     */
    public static SeverityTier classify(double anomalyCount, int duration) {
        double level2 = duration / 3.0;
        double level3 = level2 * 2;

        if (anomalyCount > level3) return HIGH;
        if (anomalyCount > level2) return MEDIUM;
        if (anomalyCount > 0) return LOW;
        return NONE;
    }

    /**
     * @return the band colour for this tier, or {@code null} for NONE (no band is drawn).
     */
    public Color getColor() {
        return color;
    }
}

package org.merit.grapher;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.Color;
import org.junit.jupiter.api.Test;

class SeverityTierTest {

    @Test
    void tiersSplitTheBucketInThirds() {
        assertThat(SeverityTier.classify(0, 15)).isEqualTo(SeverityTier.NONE);
        assertThat(SeverityTier.classify(1, 15)).isEqualTo(SeverityTier.LOW);
        assertThat(SeverityTier.classify(5, 15)).isEqualTo(SeverityTier.LOW);
        assertThat(SeverityTier.classify(6, 15)).isEqualTo(SeverityTier.MEDIUM);
        assertThat(SeverityTier.classify(10, 15)).isEqualTo(SeverityTier.MEDIUM);
        assertThat(SeverityTier.classify(11, 15)).isEqualTo(SeverityTier.HIGH);
        assertThat(SeverityTier.classify(15, 15)).isEqualTo(SeverityTier.HIGH);
    }

    @Test
    void colorsFollowSeverity() {
        assertThat(SeverityTier.NONE.getColor()).isNull();
        assertThat(SeverityTier.LOW.getColor()).isEqualTo(new Color(0, 128, 0));
        assertThat(SeverityTier.MEDIUM.getColor()).isEqualTo(new Color(255, 165, 0));
        assertThat(SeverityTier.HIGH.getColor()).isEqualTo(Color.RED);
    }
}

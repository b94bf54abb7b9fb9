package org.merit.grapher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DataTransformTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2016, 6, 1, 6, 49, 15);

    @Test
    void movingAverageWithWindowOneIsIdentity() {
        double[] series = {9530, 8635, 8120, 7950};

        assertThat(DataTransform.movingAverage(series, 1)).containsExactly(series);
        assertThat(DataTransform.movingAverage(series, 0)).containsExactly(series);
    }

    @Test
    void movingAverageIsTrailingAndKeepsLength() {
        double[] smoothed = DataTransform.movingAverage(new double[]{1, 2, 3, 4}, 2);

        assertThat(smoothed).containsExactly(new double[]{1, 1.5, 2.5, 3.5}, within(1e-9));
    }

    @Test
    void movingAverageClampsWindowToSeriesLength() {
        double[] smoothed = DataTransform.movingAverage(new double[]{2, 4, 6}, 10);

        assertThat(smoothed).hasSize(3);
        assertThat(smoothed).containsExactly(new double[]{2, 3, 4}, within(1e-9));
    }

    @Test
    void movingAverageDoesNotTouchInput() {
        double[] series = {1, 2, 3};
        DataTransform.movingAverage(series, 3);

        assertThat(series).containsExactly(1, 2, 3);
    }

    @Test
    void anomalyBandsClassifyEachCompleteBucket() {
        List<AnomalyBand> bands = DataTransform.anomalyBands(
                new double[]{0, 0, 1, 1, 1, 0}, minutes(6), 3);

        assertThat(bands).extracting(AnomalyBand::tier)
                .containsExactly(SeverityTier.LOW, SeverityTier.MEDIUM);
        assertThat(bands).extracting(AnomalyBand::anomalyCount).containsExactly(1.0, 2.0);
        assertThat(bands.get(0).start()).isEqualTo(T0);
        assertThat(bands.get(1).start()).isEqualTo(T0.plusMinutes(3));
        assertThat(bands.get(1).end()).isEqualTo(T0.plusMinutes(6));
    }

    @Test
    void anomalyBandsDropTrailingPartialBucket() {
        double[] anomalies = {1, 1, 1, 0, 0, 0, 1, 1};

        List<AnomalyBand> bands = DataTransform.anomalyBands(anomalies, minutes(8), 3);

        assertThat(bands).extracting(AnomalyBand::tier)
                .containsExactly(SeverityTier.HIGH, SeverityTier.NONE);

        // counts over complete buckets equal the flags in the covered prefix
        double bucketSum = bands.stream().mapToDouble(AnomalyBand::anomalyCount).sum();
        double prefixSum = Arrays.stream(anomalies, 0, 6).sum();
        assertThat(bucketSum).isEqualTo(prefixSum);
    }

    @Test
    void anomalyBandsWithoutDurationAreEmpty() {
        assertThat(DataTransform.anomalyBands(new double[]{1, 1}, minutes(2), 0)).isEmpty();
        assertThat(DataTransform.anomalyBands(new double[]{1, 1}, minutes(2), 5)).isEmpty();
    }

    @Test
    void rangeFilterOverWholeRangeReturnsEverything() {
        ResultsData data = sampleData();

        ResultsData filtered = DataTransform.rangeFilter(data, data.getFirstTime(), data.getLastTime().plusSeconds(1));

        assertThat(filtered.getTimes()).isEqualTo(data.getTimes());
        assertThat(filtered.getTarget()).containsExactly(data.getTarget());
        assertThat(filtered.getPredict()).containsExactly(data.getPredict());
        assertThat(filtered.getAnomalies()).containsExactly(data.getAnomalies());
    }

    @Test
    void rangeFilterUsesInclusiveStartAndExclusiveEnd() {
        ResultsData filtered = DataTransform.rangeFilter(sampleData(), T0.plusMinutes(1), T0.plusMinutes(4));

        assertThat(filtered.getTimes()).containsExactly(T0.plusMinutes(1), T0.plusMinutes(2), T0.plusMinutes(3));
        assertThat(filtered.getTarget()).containsExactly(8635, 8120, 7950);
        assertThat(filtered.getAnomalies()).containsExactly(0, 1, 1);
    }

    @Test
    void rangeFilterWithoutMatchesIsEmpty() {
        ResultsData filtered = DataTransform.rangeFilter(sampleData(), T0.plusDays(1), T0.plusDays(2));

        assertThat(filtered.isEmpty()).isTrue();
        assertThat(filtered.hasAnomalies()).isTrue();
    }

    @Test
    void prepareSmoothsAndBandsTheSelectedRange() throws Exception {
        GraphOptions options = new GraphOptions(T0, T0.plusMinutes(6), 2, 3);

        GraphView view = DataTransform.prepare(sampleData(), options);

        assertThat(view.times()).hasSize(6);
        assertThat(view.target()[1]).isCloseTo((9530 + 8635) / 2.0, within(1e-9));
        assertThat(view.bands()).extracting(AnomalyBand::tier)
                .containsExactly(SeverityTier.LOW, SeverityTier.MEDIUM);
    }

    @Test
    void prepareOnEmptyRangeGivesEmptyView() throws Exception {
        GraphView view = DataTransform.prepare(sampleData(), new GraphOptions(T0.minusDays(2), T0.minusDays(1), 5, 3));

        assertThat(view.isEmpty()).isTrue();
        assertThat(view.bands()).isEmpty();
    }

    @Test
    void prepareRejectsNegativeWindow() {
        assertThatThrownBy(() -> DataTransform.prepare(sampleData(), new GraphOptions(T0, T0.plusHours(1), -1, 0)))
                .isInstanceOf(GrapherException.class)
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.INVALID_WINDOW_VALUE));
    }

    @Test
    void parseWindowAcceptsIntegersOnly() throws Exception {
        assertThat(DataTransform.parseWindow(15, "Smoothing window")).isEqualTo(15);
        assertThat(DataTransform.parseWindow(" 30 ", "Smoothing window")).isEqualTo(30);
        assertThat(DataTransform.parseWindow(10.0, "Smoothing window")).isEqualTo(10);

        assertThatThrownBy(() -> DataTransform.parseWindow("ten", "Smoothing window"))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.INVALID_WINDOW_VALUE))
                .hasMessage("Smoothing window must be integer value.");
        assertThatThrownBy(() -> DataTransform.parseWindow(2.5, "Anomaly window"))
                .isInstanceOf(GrapherException.class);
        assertThatThrownBy(() -> DataTransform.parseWindow(-5, "Anomaly window"))
                .isInstanceOf(GrapherException.class);
        assertThatThrownBy(() -> DataTransform.parseWindow(null, "Anomaly window"))
                .isInstanceOf(GrapherException.class);
    }

    private static List<LocalDateTime> minutes(int count) {
        List<LocalDateTime> times = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            times.add(T0.plusMinutes(i));
        }
        return times;
    }

    private static ResultsData sampleData() {
        return new ResultsData(
                minutes(6),
                new double[]{9530, 8635, 8120, 7950, 8830, 9100},
                new double[]{9683, 9150, 9020, 9410, 8790, 9050},
                new double[]{0, 0, 1, 1, 1, 0});
    }
}

package org.merit.grapher;

import org.jetbrains.annotations.NotNull;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.CombinedDomainXYPlot;
import org.jfree.chart.plot.IntervalMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.Layer;
import org.jfree.data.time.FixedMillisecond;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;

import java.awt.*;
import java.text.SimpleDateFormat;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * <h1>ResultsGraph</h1>
 * JFreeChart model behind the grapher window: two stacked plots sharing one date axis.
 * <ul>
 *     <li>The power plot shows the predicted (solid black) and actual (dashed blue) power.</li>
 *     <li>The error plot shows prediction minus target (red).</li>
 * </ul>
 * Anomaly bands are translucent {@link IntervalMarker}s on the power plot. The graph remembers every
 * band it adds so a redraw can remove exactly those and start over; bands are never accumulated
 * across redraws.
 * <p>
 * The class only builds the chart model, the window wraps {@link #getChart()} in a ChartPanel.
 */
public class ResultsGraph {
    private final TimeSeries predictSeries = new TimeSeries("Predicted Value");
    private final TimeSeries targetSeries = new TimeSeries("Actual Value");
    private final TimeSeries errorSeries = new TimeSeries("Error Value");

    private final DateAxis timeAxis;
    private final XYPlot powerPlot;
    private final XYPlot errorPlot;
    private final JFreeChart chart;

    // Bands currently drawn on the power plot
    private final List<IntervalMarker> colorSpans = new ArrayList<>();

    private double powerScale;
    private float bandAlpha;

    /**
     * @param settings display settings (power unit, band opacity, axis date format)
     */
    public ResultsGraph(GrapherSettings settings) {
        this.powerScale = settings.powerScale();
        this.bandAlpha = settings.bandAlpha();

        // Shared time axis for both plots
        timeAxis = new DateAxis("Time");
        timeAxis.setDateFormatOverride(new SimpleDateFormat(settings.dateFormat()));

        // --- Power plot: prediction (series 0) and target (series 1) ---
        TimeSeriesCollection powerDataset = new TimeSeriesCollection();
        powerDataset.addSeries(predictSeries);
        powerDataset.addSeries(targetSeries);

        XYLineAndShapeRenderer powerRenderer = new XYLineAndShapeRenderer(true, false);
        powerRenderer.setSeriesPaint(0, Color.BLACK);
        powerRenderer.setSeriesStroke(0, new BasicStroke(2.0f));
        powerRenderer.setSeriesPaint(1, Color.BLUE);
        powerRenderer.setSeriesStroke(1, new BasicStroke(2.0f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
                10.0f, new float[]{6.0f, 4.0f}, 0.0f)); // dashed

        NumberAxis powerAxis = new NumberAxis(settings.powerLabel());
        powerPlot = new XYPlot(powerDataset, null, powerAxis, powerRenderer);

        // --- Error plot: prediction minus target ---
        TimeSeriesCollection errorDataset = new TimeSeriesCollection();
        errorDataset.addSeries(errorSeries);

        XYLineAndShapeRenderer errorRenderer = new XYLineAndShapeRenderer(true, false);
        errorRenderer.setSeriesPaint(0, Color.RED);
        errorRenderer.setSeriesVisibleInLegend(0, false); // legend only explains the power lines

        NumberAxis errorAxis = new NumberAxis(settings.errorLabel());
        errorPlot = new XYPlot(errorDataset, null, errorAxis, errorRenderer);

        // Stack both plots over the shared time axis, power on top with more room
        CombinedDomainXYPlot combinedPlot = new CombinedDomainXYPlot(timeAxis);
        combinedPlot.setGap(10.0);
        combinedPlot.add(powerPlot, 3);
        combinedPlot.add(errorPlot, 2);

        chart = new JFreeChart(null, JFreeChart.DEFAULT_TITLE_FONT, combinedPlot, true);
        chart.setBackgroundPaint(Color.WHITE);
    }

    /**
     * Applies changed display settings. Already drawn data keeps its scale until the next redraw.
     */
    public void applySettings(GrapherSettings settings) {
        this.powerScale = settings.powerScale();
        this.bandAlpha = settings.bandAlpha();
        timeAxis.setDateFormatOverride(new SimpleDateFormat(settings.dateFormat()));
        powerPlot.getRangeAxis().setLabel(settings.powerLabel());
        errorPlot.getRangeAxis().setLabel(settings.errorLabel());
    }

    /**
     * Redraws the lines and, if requested, replaces the anomaly bands.
     *
     * @param view      filtered and smoothed data
     * @param showBands whether to draw {@link GraphView#bands()}; otherwise all bands are cleared
     */
    public void show(GraphView view, boolean showBands) {
        clearSpans();
        updateData(view.times(), view.target(), view.predict());
        if (showBands) {
            view.bands().forEach(band -> addSpan(band.start(), band.end(), band.tier()));
        }
    }

    /**
     * Replaces the plotted series and rescales the axes to fit them.
     * <p>
     * Values are divided by the power scale (Watts to kW by default). Bounds:
     * time axis from first to last sample, power axis from 0 to 110% of the highest value,
     * error axis from the lowest to the highest error. An empty input clears the lines and
     * leaves the axes untouched.
     *
     * @param times   sample timestamps, ascending
     * @param target  measured power in Watts
     * @param predict predicted power in Watts
     */
    public void updateData(List<LocalDateTime> times, double[] target, double[] predict) {
        if (times.size() != target.length || times.size() != predict.length) {
            throw new IllegalArgumentException("times, target and predict must have the same length");
        }

        // Bulk update without a repaint per point
        predictSeries.setNotify(false);
        targetSeries.setNotify(false);
        errorSeries.setNotify(false);

        double powerMax = Double.NEGATIVE_INFINITY;
        double errorMin = Double.POSITIVE_INFINITY;
        double errorMax = Double.NEGATIVE_INFINITY;

        try {
            predictSeries.clear();
            targetSeries.clear();
            errorSeries.clear();

            for (int i = 0; i < times.size(); i++) {
                // Millisecond periods, so sub-second samples stay separate points
                FixedMillisecond period = new FixedMillisecond(toMillis(times.get(i)));
                double targetValue = target[i] / powerScale;
                double predictValue = predict[i] / powerScale;
                double error = predictValue - targetValue;

                predictSeries.addOrUpdate(period, predictValue);
                targetSeries.addOrUpdate(period, targetValue);
                errorSeries.addOrUpdate(period, error);

                powerMax = Math.max(powerMax, Math.max(targetValue, predictValue));
                errorMin = Math.min(errorMin, error);
                errorMax = Math.max(errorMax, error);
            }
        } finally {
            predictSeries.setNotify(true);
            targetSeries.setNotify(true);
            errorSeries.setNotify(true);
        }

        if (times.isEmpty()) return;

        // --- Axis bounds ---
        long xMin = toMillis(times.get(0));
        long xMax = toMillis(times.get(times.size() - 1));
        if (xMin >= xMax) {
            // Single timestamp, open the axis by half a minute each side
            xMin -= 30_000;
            xMax += 30_000;
        }
        timeAxis.setRange(new Date(xMin), new Date(xMax));

        double yMax = powerMax * 1.1;
        powerPlot.getRangeAxis().setRange(0, yMax > 0 ? yMax : 1.0);

        if (errorMin == errorMax) {
            errorMin -= 1.0;
            errorMax += 1.0;
        }
        errorPlot.getRangeAxis().setRange(errorMin, errorMax);
    }

    /**
     * Adds a translucent vertical band to the power plot.
     *
     * @param start           left edge of the band
     * @param durationMinutes width of the band
     * @param tier            severity, NONE draws nothing
     */
    public void colorSpan(LocalDateTime start, int durationMinutes, SeverityTier tier) {
        addSpan(start, start.plusMinutes(durationMinutes), tier);
    }

    private void addSpan(LocalDateTime start, LocalDateTime end, SeverityTier tier) {
        if (tier == SeverityTier.NONE) return;

        IntervalMarker span = new IntervalMarker(toMillis(start), toMillis(end), tier.getColor());
        span.setAlpha(bandAlpha);
        powerPlot.addDomainMarker(span, Layer.BACKGROUND); // behind the lines
        colorSpans.add(span);
    }

    /**
     * Removes every band previously added by {@link #colorSpan}.
     */
    public void clearSpans() {
        for (IntervalMarker span : colorSpans) {
            powerPlot.removeDomainMarker(span, Layer.BACKGROUND);
        }
        colorSpans.clear();
    }

    /**
     * @return number of bands currently drawn.
     */
    public int getSpanCount() {
        return colorSpans.size();
    }

    @NotNull
    public JFreeChart getChart() {
        return chart;
    }

    public XYPlot getPowerPlot() {
        return powerPlot;
    }

    public XYPlot getErrorPlot() {
        return errorPlot;
    }

    public DateAxis getTimeAxis() {
        return timeAxis;
    }

    // Markers and periods both use the default time zone
    private static long toMillis(LocalDateTime ldt) {
        return ldt.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }
}

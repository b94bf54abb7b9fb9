package org.merit.grapher;

import org.apache.commons.lang3.StringUtils;

import java.time.format.DateTimeFormatter;

/**
 * Typed view of the key-value pairs stored in config.xml.
 *
 * @param dateFormat    pattern for textual timestamps, the date spinners and the time axis
 * @param spinStep      step of the smoothing and anomaly window spinners
 * @param bandAlpha     opacity of the anomaly bands, 0 to 1
 * @param powerScale    divisor applied to Watts before plotting (1000 plots kW)
 * @param lastDirectory directory the file chooser opens in, empty for the user's home
 */
public record GrapherSettings(String dateFormat, int spinStep, float bandAlpha, double powerScale,
                              String lastDirectory) {

    public static final String DEFAULT_DATE_FORMAT = ResultsLoader.DATE_FORMAT;
    public static final int DEFAULT_SPIN_STEP = 5;
    public static final float DEFAULT_BAND_ALPHA = 0.2f;
    public static final double DEFAULT_POWER_SCALE = 1000.0;

    public GrapherSettings {
        if (StringUtils.isBlank(dateFormat)) {
            throw new IllegalArgumentException("Date format must not be empty");
        }
        DateTimeFormatter.ofPattern(dateFormat); // rejects malformed patterns
        if (spinStep < 1) {
            throw new IllegalArgumentException("Spinner step must be at least 1");
        }
        if (bandAlpha < 0f || bandAlpha > 1f) {
            throw new IllegalArgumentException("Band opacity must be between 0 and 1");
        }
        if (!(powerScale > 0)) {
            throw new IllegalArgumentException("Power scale must be positive");
        }
        lastDirectory = StringUtils.defaultString(lastDirectory);
    }

    /**
     * @return a formatter for {@link #dateFormat()}.
     */
    public DateTimeFormatter formatter() {
        return DateTimeFormatter.ofPattern(dateFormat);
    }

    public static GrapherSettings defaults() {
        return new GrapherSettings(DEFAULT_DATE_FORMAT, DEFAULT_SPIN_STEP, DEFAULT_BAND_ALPHA,
                DEFAULT_POWER_SCALE, "");
    }

    /**
     * Builds settings from config entries. Unknown keys are ignored and missing keys keep their default.
     *
     * @param values {key, value} pairs as returned by {@link ConfigHandler#loadConfig()}
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static GrapherSettings fromConfig(String[][] values) {
        String dateFormat = DEFAULT_DATE_FORMAT;
        int spinStep = DEFAULT_SPIN_STEP;
        float bandAlpha = DEFAULT_BAND_ALPHA;
        double powerScale = DEFAULT_POWER_SCALE;
        String lastDirectory = "";

        for (String[] entry : values) {
            String value = entry[1].trim();
            switch (entry[0]) {
                case "dateFormat" -> dateFormat = value;
                case "spinStep" -> spinStep = Integer.parseInt(value);
                case "bandAlpha" -> bandAlpha = Float.parseFloat(value);
                case "powerScale" -> powerScale = Double.parseDouble(value);
                case "lastDirectory" -> lastDirectory = value;
                default -> System.out.println("Unknown config entry ignored: " + entry[0]);
            }
        }

        return new GrapherSettings(dateFormat, spinStep, bandAlpha, powerScale, lastDirectory);
    }

    /**
     * @return the settings as {key, value} pairs for {@link ConfigHandler#saveConfig(String[][])}.
     */
    public String[][] toConfig() {
        return new String[][]{
                {"dateFormat", dateFormat},
                {"spinStep", String.valueOf(spinStep)},
                {"bandAlpha", String.valueOf(bandAlpha)},
                {"powerScale", String.valueOf(powerScale)},
                {"lastDirectory", lastDirectory}
        };
    }

    public GrapherSettings withLastDirectory(String directory) {
        return new GrapherSettings(dateFormat, spinStep, bandAlpha, powerScale, directory);
    }

    /**
     * @return axis label for the power plot, naming the unit implied by the power scale.
     */
    public String powerLabel() {
        return "Power (" + unit() + ")";
    }

    public String errorLabel() {
        return "Error (" + unit() + ")";
    }

    private String unit() {
        if (powerScale == 1.0) return "W";
        if (powerScale == 1000.0) return "kW";
        if (powerScale == 1_000_000.0) return "MW";
        return "W/" + powerScale;
    }
}

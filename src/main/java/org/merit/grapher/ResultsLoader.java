package org.merit.grapher;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * <h1>ResultsLoader</h1>
 * Reads a results CSV produced by the prediction pipeline into a {@link ResultsData}.
 * <p>
 * Expected layout:
 * <pre>
 * Timestamp,Target,Prediction,Anomaly
 * 1464763755,9530,9683,0
 * 1464763815,8635,9150,1
 * </pre>
 * <ul>
 *     <li>The timestamp is either Unix epoch seconds (integer or fractional) or a date-time
 *     string matching the configured pattern ({@value #DATE_FORMAT} by default).</li>
 *     <li>Target and prediction are power values in Watts.</li>
 *     <li>The anomaly column is optional; 1 marks the pair as an anomaly, 0 as normal.</li>
 * </ul>
 * The loader builds the whole dataset before returning it, so a failure part way
 * through the file never hands out partial data.
 */
public class ResultsLoader {
    /**
     * Default textual timestamp pattern, used when a timestamp is not epoch seconds.
     */
    public static final String DATE_FORMAT = "yyyy-MM-dd HH:mm:ss";

    private final DateTimeFormatter formatter;
    private final ZoneId zone;

    /**
     * Creates a loader using the default date pattern and the system time zone.
     */
    public ResultsLoader() {
        this(DateTimeFormatter.ofPattern(DATE_FORMAT), ZoneId.systemDefault());
    }

    /**
     * @param formatter pattern for textual timestamps
     * @param zone      zone used to turn epoch seconds into calendar time
     */
    public ResultsLoader(DateTimeFormatter formatter, ZoneId zone) {
        this.formatter = formatter;
        this.zone = zone;
    }

    /**
     * Validates the file name before any file access happens.
     *
     * @param filename path entered or selected by the user
     * @throws GrapherException {@link ErrorKind#INVALID_FILENAME} for an empty name or a non-.csv extension
     */
    public static void checkFilename(String filename) throws GrapherException {
        if (StringUtils.isBlank(filename)) {
            throw new GrapherException(ErrorKind.INVALID_FILENAME, "Error: no file name given");
        }
        if (!filename.endsWith(".csv")) {
            throw new GrapherException(ErrorKind.INVALID_FILENAME, "Error: file must be '.csv' format");
        }
    }

    /**
     * Loads the results file at {@code filename}.
     *
     * @param filename path of the CSV file
     * @return the parsed dataset, never empty
     * @throws GrapherException if the name is invalid, the file is missing, a numeric field
     *                          cannot be parsed or a timestamp has an unknown format
     */
    @NotNull
    public ResultsData loadFile(String filename) throws GrapherException {
        checkFilename(filename);

        File file = new File(filename);
        if (!file.isFile()) {
            throw new GrapherException(ErrorKind.FILE_NOT_FOUND,
                    String.format("Error: file %s was not found", file.getName()));
        }

        List<LocalDateTime> times = new ArrayList<>();
        List<Double> target = new ArrayList<>();
        List<Double> predict = new ArrayList<>();
        List<Double> anomalies = new ArrayList<>();
        int rows = 0;

        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            // The header names the columns but their order is fixed, so it is only skipped
            String header = reader.readLine();
            if (header == null) {
                throw new GrapherException(ErrorKind.PARSE_ERROR,
                        String.format("Error: file %s is empty", file.getName()));
            }

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (StringUtils.isBlank(line)) continue;

                String[] fields = StringUtils.stripAll(line.split(",", -1));
                if (fields.length < 3) {
                    throw new GrapherException(ErrorKind.PARSE_ERROR, String.format(
                            "Error: line %d has %d fields, expected at least 3", lineNumber, fields.length));
                }

                times.add(parseTimestamp(fields[0]));
                target.add(parseNumber(fields[1], "target", lineNumber));
                predict.add(parseNumber(fields[2], "prediction", lineNumber));

                // Anomaly flag is optional, an empty trailing field counts as missing
                if (fields.length > 3 && !fields[3].isEmpty()) {
                    anomalies.add(parseNumber(fields[3], "anomaly", lineNumber));
                }
                rows++;
            }
        } catch (IOException e) {
            throw new GrapherException(ErrorKind.PARSE_ERROR,
                    String.format("Error: could not read %s: %s", file.getName(), e.getMessage()), e);
        }

        if (rows == 0) {
            throw new GrapherException(ErrorKind.PARSE_ERROR,
                    String.format("Error: file %s contains no data rows", file.getName()));
        }

        // Keep the anomaly series only if every row has one, otherwise the series would not line up
        double[] anomalyArray = null;
        if (anomalies.size() == rows) {
            anomalyArray = ArrayUtils.toPrimitive(anomalies.toArray(new Double[0]));
        } else if (!anomalies.isEmpty()) {
            System.out.println("Anomaly column incomplete in " + file.getName() + " ("
                    + anomalies.size() + " of " + rows + " rows), ignoring it");
        }

        return new ResultsData(times,
                ArrayUtils.toPrimitive(target.toArray(new Double[0])),
                ArrayUtils.toPrimitive(predict.toArray(new Double[0])),
                anomalyArray);
    }

    /**
     * Converts a timestamp field to calendar time.
     * <p>
     * The field is first read as epoch seconds; if that fails it is parsed with the date pattern.
     *
     * @param raw timestamp text from the first column
     * @return the corresponding local date-time
     * @throws GrapherException {@link ErrorKind#FORMAT_ERROR} if neither interpretation works
     */
    @NotNull
    public LocalDateTime parseTimestamp(String raw) throws GrapherException {
        double seconds;
        try {
            seconds = Double.parseDouble(raw);
        } catch (NumberFormatException ignored) {
            // Not epoch seconds, fall through to the date pattern
            seconds = Double.NaN;
        }

        if (Double.isFinite(seconds)) {
            // Milliseconds must fit a long, Math.round would saturate silently
            double millis = seconds * 1000;
            if (millis < Long.MIN_VALUE || millis >= Long.MAX_VALUE) {
                throw new GrapherException(ErrorKind.FORMAT_ERROR,
                        String.format("Error: timestamp '%s' is out of range", raw));
            }
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(Math.round(millis)), zone);
        }

        try {
            return LocalDateTime.parse(raw, formatter);
        } catch (DateTimeParseException e) {
            throw new GrapherException(ErrorKind.FORMAT_ERROR,
                    String.format("Error: timestamp '%s' is neither epoch seconds nor a valid date", raw), e);
        }
    }

    private static double parseNumber(String field, String column, int lineNumber) throws GrapherException {
        try {
            return Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw new GrapherException(ErrorKind.PARSE_ERROR, String.format(
                    "Error: line %d, %s value '%s' is not a number", lineNumber, column, field), e);
        }
    }
}

package org.merit.grapher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultsLoaderTest {

    private final ResultsLoader loader =
            new ResultsLoader(DateTimeFormatter.ofPattern(ResultsLoader.DATE_FORMAT), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void loadsEpochTimestampsAndAnomalies() throws Exception {
        ResultsData data = loader.loadFile(resource("epoch_results.csv"));

        assertThat(data.size()).isEqualTo(6);
        assertThat(data.getFirstTime()).isEqualTo(LocalDateTime.of(2016, 6, 1, 6, 49, 15));
        assertThat(data.getLastTime()).isEqualTo(LocalDateTime.of(2016, 6, 1, 6, 54, 15));
        assertThat(data.getTarget()).startsWith(9530.0, 8635.0);
        assertThat(data.getPredict()).startsWith(9683.0, 9150.0);
        assertThat(data.hasAnomalies()).isTrue();
        assertThat(data.getAnomalies()).containsExactly(0, 0, 1, 1, 1, 0);
    }

    @Test
    void loadsDateStringsWithoutAnomalyColumn() throws Exception {
        ResultsData data = loader.loadFile(resource("dated_results.csv"));

        // the blank line in the fixture is skipped
        assertThat(data.size()).isEqualTo(4);
        assertThat(data.getTimes().get(3)).isEqualTo(LocalDateTime.of(2016, 6, 1, 6, 52, 15));
        assertThat(data.hasAnomalies()).isFalse();
        assertThat(data.getAnomalies()).isNull();
    }

    @Test
    void fractionalEpochKeepsMilliseconds() throws Exception {
        assertThat(loader.parseTimestamp("1464763755.5"))
                .isEqualTo(LocalDateTime.of(2016, 6, 1, 6, 49, 15, 500_000_000));
    }

    @Test
    void epochOutsideTheMillisecondRangeFailsWithFormatError() {
        assertThatThrownBy(() -> loader.parseTimestamp("1e20"))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.FORMAT_ERROR))
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> loader.parseTimestamp("-1e20"))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.FORMAT_ERROR));
    }

    @Test
    void fileIsDecodedAsUtf8() throws Exception {
        Path file = tempDir.resolve("latin1.csv");
        // 0xB5 is the Latin-1 micro sign, never valid on its own in UTF-8
        byte[] header = "Timestamp,Target (\u00b5W),Prediction\n".getBytes(StandardCharsets.ISO_8859_1);
        byte[] row = "1464763755,9530,9683\n".getBytes(StandardCharsets.UTF_8);
        Files.write(file, header);
        Files.write(file, row, StandardOpenOption.APPEND);

        assertThatThrownBy(() -> loader.loadFile(file.toString()))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.PARSE_ERROR))
                .hasMessageContaining("could not read");

        Path utf8 = write("utf8.csv", "Timestamp,Target (\u00b5W),Prediction\n1464763755,9530,9683\n");
        assertThat(loader.loadFile(utf8.toString()).size()).isEqualTo(1);
    }

    @Test
    void rejectsNameWithoutCsvSuffixBeforeOpeningIt() {
        // "data" does not exist either, the name check has to win over the missing file
        assertThatThrownBy(() -> loader.loadFile("data"))
                .isInstanceOf(GrapherException.class)
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.INVALID_FILENAME));
        assertThatThrownBy(() -> loader.loadFile(""))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.INVALID_FILENAME));
    }

    @Test
    void missingFileIsReported() {
        String missing = tempDir.resolve("missing.csv").toString();

        assertThatThrownBy(() -> loader.loadFile(missing))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.FILE_NOT_FOUND))
                .hasMessageContaining("missing.csv");
    }

    @Test
    void nonNumericTargetFailsWithParseError() throws Exception {
        Path file = write("bad_target.csv",
                "Timestamp,Target,Prediction,Anomaly\n"
                        + "1464763695,9400,9500,0\n"
                        + "1464763755,abc,9683,0\n");

        assertThatThrownBy(() -> loader.loadFile(file.toString()))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.PARSE_ERROR))
                .hasMessageContaining("line 3")
                .hasMessageContaining("abc");
    }

    @Test
    void unknownTimestampFormatFailsWithFormatError() throws Exception {
        Path file = write("bad_time.csv",
                "Timestamp,Target,Prediction\n"
                        + "01/06/2016 06:49,9530,9683\n");

        assertThatThrownBy(() -> loader.loadFile(file.toString()))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.FORMAT_ERROR));
    }

    @Test
    void rowWithTooFewFieldsFailsWithParseError() throws Exception {
        Path file = write("short_row.csv",
                "Timestamp,Target,Prediction\n"
                        + "1464763755,9530\n");

        assertThatThrownBy(() -> loader.loadFile(file.toString()))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.PARSE_ERROR));
    }

    @Test
    void headerOnlyFileHasNoData() throws Exception {
        Path file = write("header_only.csv", "Timestamp,Target,Prediction,Anomaly\n");

        assertThatThrownBy(() -> loader.loadFile(file.toString()))
                .satisfies(e -> assertThat(((GrapherException) e).getKind()).isEqualTo(ErrorKind.PARSE_ERROR))
                .hasMessageContaining("no data rows");
    }

    @Test
    void incompleteAnomalyColumnIsDropped() throws Exception {
        Path file = write("partial.csv",
                "Timestamp,Target,Prediction,Anomaly\n"
                        + "1464763755,9530,9683,1\n"
                        + "1464763815,8635,9150\n"
                        + "1464763875,8120,9020,\n");

        ResultsData data = loader.loadFile(file.toString());

        assertThat(data.size()).isEqualTo(3);
        assertThat(data.hasAnomalies()).isFalse();
    }

    private String resource(String name) throws URISyntaxException {
        return Paths.get(getClass().getResource("/results/" + name).toURI()).toString();
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}

package org.ansi4j.format.detect;

import org.ansi4j.charset.BuiltinFontRegistry;
import org.ansi4j.format.codec.ImportOptions;
import org.ansi4j.sauce.SauceDataType;
import org.ansi4j.sauce.SauceRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ColumnDetectorTest {

    private final ColumnDetector detector = new ColumnDetector(new EncodingDetector(new BuiltinFontRegistry()));

    private int detect(String data, SauceRecord sauce, ImportOptions options) {
        byte[] b = data.getBytes(StandardCharsets.ISO_8859_1);
        return detector.detect(b, b.length, sauce, options);
    }

    private int detect(String data) {
        return detect(data, null, ImportOptions.DEFAULTS);
    }

    @ParameterizedTest
    @CsvSource({
        "1, 80",
        "80, 80",
        "81, 100",
        "100, 100",
        "121, 132",
        "133, 160",
        "161, 161",
        "5000, 4096",
    })
    void normalize_snapsToTerminalWidths(int in, int expected) {
        assertEquals(expected, ColumnDetector.normalize(in));
    }

    @Test
    void explicitOption_wins() {
        ImportOptions options = ImportOptions.DEFAULTS.toBuilder().columns(42).build();
        assertEquals(42, detect("\u001B[1;121H", null, options));
    }

    @Test
    void sauceWidth_isNormalized() {
        SauceRecord sauce = SauceRecord.builder().dataType(SauceDataType.CHARACTER).tinfo1(90).build();
        assertEquals(100, detect("\u001B[1;121H", sauce, ImportOptions.DEFAULTS));
    }

    @Test
    void sauceWidth_binaryTextUsesFileType() {
        SauceRecord sauce = SauceRecord.builder().dataType(SauceDataType.BINARY_TEXT).fileType(80).build();
        assertEquals(160, ColumnDetector.sauceColumns(sauce));
        assertEquals(0, ColumnDetector.sauceColumns(null));
    }

    @Test
    void cursorPosition_setsWidth() {
        assertEquals(132, detect("\u001B[1;121HX"));
        assertEquals(132, detect("\u001B[121GX"));
    }

    @Test
    void maxExplicitColumn_ignoresRelativeMotion() {
        byte[] b = "\u001B[200C\u001B[5;40f".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals(40, ColumnDetector.maxExplicitColumn(b, b.length));
    }

    @Test
    void newlineText_usesWidestLine() {
        assertEquals(100, detect("AB\r\n" + "X".repeat(90) + "\r\n"));
        assertEquals(80, detect("short\r\nlines\r\n"));
    }

    @Test
    void trailingSpaces_doNotWidenLines() {
        byte[] b = ("A" + " ".repeat(150) + "\n").getBytes(StandardCharsets.ISO_8859_1);
        assertEquals(0, ColumnDetector.maxColumnWithNewlines(b, b.length, ImportOptions.DEFAULTS, true));
    }

    @Test
    void cursorForward_countsTowardLineWidth() {
        byte[] b = "\u001B[100CX\n".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals(100, ColumnDetector.maxColumnWithNewlines(b, b.length, ImportOptions.DEFAULTS, true));
    }

    @Test
    void noEvidence_defaultsToEighty() {
        assertEquals(ColumnDetector.DEFAULT_COLUMNS, detect("X".repeat(300)));
    }
}

package org.ansi4j.format.codec;

import org.ansi4j.canvas.Attrs;
import org.ansi4j.canvas.CanvasSnapshot;
import org.ansi4j.canvas.CellValue;
import org.ansi4j.canvas.GlyphId;
import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.color.ColorService;
import org.ansi4j.sauce.SauceCodec;
import org.ansi4j.sauce.SauceDataType;
import org.ansi4j.sauce.SauceRecord;
import org.ansi4j.sauce.SauceWriteOptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AnsiImporterTest {

    private final AnsiImporter importer = new AnsiImporter();

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    private CanvasSnapshot importOk(byte[] data, ImportOptions options) {
        ImportResult result = importer.importBytes(data, options);
        assertTrue(result.isSuccess(), () -> "import failed: " + result);
        return result.getSnapshot().orElseThrow();
    }

    private CanvasSnapshot importOk(String data) {
        return importOk(bytes(data), ImportOptions.DEFAULTS);
    }

    @Test
    void xbinHeader_isRejected() {
        ImportResult result = importer.importBytes(bytes("XBIN\u001AP\u0019"), ImportOptions.DEFAULTS);
        assertFalse(result.isSuccess());
        assertEquals(AnsiImporter.XBIN_ERROR, result.getError().orElseThrow());
    }

    @Test
    void emptyInput_yieldsOneBlankRow() {
        CanvasSnapshot s = importOk(new byte[0], ImportOptions.DEFAULTS);
        assertEquals(80, s.getColumns());
        assertEquals(1, s.getRows());
        assertEquals(GlyphId.SPACE, s.getCell(0, 0).glyph());
        assertTrue(s.getSauce().isEmpty());
    }

    @Test
    void sgrColor_appliesToText() {
        CanvasSnapshot s = importOk("\u001B[31mA");
        assertEquals(BuiltinPalette.VGA16, s.getPalette());
        assertEquals(1, s.getRows());
        assertEquals(new CellValue('A', 1, 0, Attrs.NONE), s.getCell(0, 0));
    }

    @Test
    void eraseDisplay_resetsPenAndCanvas() {
        CanvasSnapshot s = importOk("\u001B[31mA\u001B[2JB");
        assertEquals(new CellValue('B', 7, 0, Attrs.NONE), s.getCell(0, 0));
        assertEquals(GlyphId.SPACE, s.getCell(0, 1).glyph());
    }

    @Test
    void sixteenColors_mapToTheirIndices() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            sb.append("\u001B[3").append(i).append("mX");
        }
        for (int i = 0; i < 8; i++) {
            sb.append("\u001B[9").append(i).append("mX");
        }
        CanvasSnapshot s = importOk(sb.toString());
        for (int i = 0; i < 16; i++) {
            assertEquals(i, s.getCell(0, i).fg(), "column " + i);
        }
    }

    @Test
    void boldAndIceBlink_selectBrightIndices() {
        CanvasSnapshot s = importOk("\u001B[1;5;32;44mX");
        CellValue c = s.getCell(0, 0);
        assertEquals(10, c.fg());
        assertEquals(12, c.bg());
        assertEquals(Attrs.BOLD, c.attrs());
    }

    @Test
    void eagerWrap_movesToNextRow() {
        ImportOptions options = ImportOptions.DEFAULTS.toBuilder().columns(4).build();
        CanvasSnapshot s = importOk(bytes("ABCDE"), options);
        assertEquals(2, s.getRows());
        assertEquals('E', s.getCell(1, 0).glyph());
    }

    @Test
    void wrapPolicy_decidesWhereCursorMotionLands() {
        byte[] data = bytes("ABCD\u001B[CX");
        ImportOptions eager = ImportOptions.DEFAULTS.toBuilder().columns(4).build();
        ImportOptions onPut = eager.toBuilder().wrapPolicy(WrapPolicy.ON_PUT).build();

        assertEquals('X', importOk(data, eager).getCell(1, 1).glyph());
        assertEquals('X', importOk(data, onPut).getCell(1, 0).glyph());
    }

    @Test
    void tab_advancesToNextStop() {
        CanvasSnapshot s = importOk("A\tB");
        assertEquals('B', s.getCell(0, 8).glyph());
    }

    @Test
    void newlines_startNewRows() {
        CanvasSnapshot s = importOk("A\r\nB");
        assertEquals(2, s.getRows());
        assertEquals('B', s.getCell(1, 0).glyph());
    }

    @Test
    void finalLineFeed_closesRowWithoutOpeningAnother() {
        assertEquals(2, importOk("A\r\nB\r\n").getRows());
        assertEquals(2, importOk("A\r\n\r\n\u001B[0m").getRows());
        assertEquals(1, importOk("\n").getRows());
    }

    @Test
    void hugeCursorMotion_staysWithinRowLimit() {
        ImportOptions wide = ImportOptions.DEFAULTS.toBuilder().columns(4096).build();
        String down = "\u001B[65535B".repeat(9) + "X";
        ImportResult result = importer.importBytes(bytes(down), wide);
        assertTrue(result.isSuccess());
        CanvasSnapshot s = result.getSnapshot().orElseThrow();
        assertTrue(s.getRows() <= AnsiImporter.MAX_CELLS / 4096, "rows " + s.getRows());

        CanvasSnapshot cup = importOk(bytes("A\u001B[65535;1HX"), ImportOptions.DEFAULTS);
        int limit = AnsiImporter.MAX_CELLS / 80;
        assertTrue(cup.getRows() <= limit, "rows " + cup.getRows());
        assertEquals('A', cup.getCell(0, 0).glyph());
    }

    @Test
    void cursorPosition_isOneBased() {
        CanvasSnapshot s = importOk("\u001B[3;5HX");
        assertEquals('X', s.getCell(2, 4).glyph());
        assertEquals(3, s.getRows());
    }

    @Test
    void saveAndRestoreCursor() {
        CanvasSnapshot s = importOk("A\u001B[sBC\u001B[uX");
        assertEquals('X', s.getCell(0, 1).glyph());
        assertEquals('C', s.getCell(0, 2).glyph());
    }

    @Test
    void sub_endsTheStream() {
        CanvasSnapshot s = importOk("A\u001AB");
        assertEquals('A', s.getCell(0, 0).glyph());
        assertEquals(GlyphId.SPACE, s.getCell(0, 1).glyph());
    }

    @Test
    void unterminatedSequence_isDropped() {
        CanvasSnapshot s = importOk("A\u001B[12");
        assertEquals('A', s.getCell(0, 0).glyph());
        assertEquals(1, s.getRows());
    }

    @Test
    void cp437HighBytes_decodeToUnicode() {
        CanvasSnapshot s = importOk("\u00DB\u00B0");
        assertEquals(0x2588, s.getCell(0, 0).glyph());
        assertEquals(0x2591, s.getCell(0, 1).glyph());
    }

    @Test
    void bitmapIndexPolicy_keepsRawBytes() {
        ImportOptions options = ImportOptions.DEFAULTS.toBuilder().glyphPolicy(GlyphPolicy.BITMAP_INDEX).build();
        CanvasSnapshot s = importOk(bytes("\u00DB"), options);
        int glyph = s.getCell(0, 0).glyph();
        assertTrue(GlyphId.isBitmapIndex(glyph));
        assertEquals(0xDB, GlyphId.index(glyph));
    }

    @Test
    void byteOrderMark_forcesUtf8AndIsSkipped() {
        byte[] data = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'A' };
        ImportResult result = importer.importBytes(data, ImportOptions.DEFAULTS);
        assertTrue(result.isDecodedAsUtf8());
        assertEquals('A', result.getSnapshot().orElseThrow().getCell(0, 0).glyph());
    }

    @Test
    void utf8Option_decodesMultibyteText() {
        ImportOptions options = ImportOptions.DEFAULTS.toBuilder().cp437(false).build();
        CanvasSnapshot s = importOk("\u00E9\u2588".getBytes(StandardCharsets.UTF_8), options);
        assertEquals(0xE9, s.getCell(0, 0).glyph());
        assertEquals(0x2588, s.getCell(0, 1).glyph());
    }

    @Test
    void extendedColors_switchToXtermPalette() {
        CanvasSnapshot s = importOk("\u001B[38;5;202mA");
        assertEquals(BuiltinPalette.XTERM256, s.getPalette());
        assertEquals(202, s.getCell(0, 0).fg());
    }

    @Test
    void pabloTrueColor_setsForeground() {
        CanvasSnapshot s = importOk("\u001B[1;255;95;0tA");
        assertEquals(BuiltinPalette.XTERM256, s.getPalette());
        assertEquals(202, s.getCell(0, 0).fg());
    }

    @Test
    void defaultBackgroundUnset_leavesCellsUnset() {
        ImportOptions options = ImportOptions.DEFAULTS.toBuilder().defaultBgUnset(true).build();
        CanvasSnapshot s = importOk(bytes("A"), options);
        assertEquals(ColorService.UNSET_INDEX, s.getCell(0, 0).bg());
    }

    @Test
    void missingSauce_isSynthesized() {
        CanvasSnapshot s = importOk("A");
        SauceRecord sauce = s.getSauce().orElseThrow();
        assertEquals(AnsiImporter.DEFAULT_BITMAP_FONT, sauce.getTinfos());
    }

    @Test
    void sauceWidth_decidesColumnsAndTrailerIsNotText() {
        SauceRecord record = SauceRecord.builder()
            .title("Test")
            .dataType(SauceDataType.CHARACTER)
            .fileType(1)
            .tinfo1(100)
            .tinfo2(1)
            .build();
        byte[] data = new SauceCodec().write(bytes("AB"), record, SauceWriteOptions.DEFAULTS);

        CanvasSnapshot s = importOk(data, ImportOptions.DEFAULTS);
        assertEquals(100, s.getColumns());
        assertEquals(1, s.getRows());
        assertEquals('B', s.getCell(0, 1).glyph());
        assertEquals(GlyphId.SPACE, s.getCell(0, 2).glyph());
        assertEquals("Test", s.getSauce().orElseThrow().getTitle());
    }

    @Test
    void explicitColumns_overrideDetection() {
        ImportOptions options = ImportOptions.DEFAULTS.toBuilder().columns(40).build();
        assertEquals(40, importOk(bytes("\u001B[1;121HX"), options).getColumns());
    }
}

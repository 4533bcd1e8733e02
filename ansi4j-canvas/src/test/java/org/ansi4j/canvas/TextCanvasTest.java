package org.ansi4j.canvas;

import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.color.ColorService;
import org.ansi4j.sauce.SauceRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextCanvasTest {

    private static final int UNSET = ColorService.UNSET_INDEX;

    @Test
    void newCanvas_hasOneBlankRow() {
        TextCanvas canvas = new TextCanvas(80);
        assertEquals(80, canvas.getColumns());
        assertEquals(1, canvas.getRows());
        assertEquals(1, canvas.getLayerCount());
        assertEquals(CellValue.BLANK, canvas.getCompositeCell(0, 79));
        assertEquals(BuiltinPalette.VGA16, canvas.getPalette());
    }

    @Test
    void constructor_rejectsBadColumns() {
        assertThrows(IllegalArgumentException.class, () -> new TextCanvas(0));
        assertThrows(IllegalArgumentException.class, () -> new TextCanvas(4097));
    }

    @Test
    void ensureRows_rejectsSizeThatOverflows() {
        TextCanvas canvas = new TextCanvas(4096);
        assertThrows(IllegalArgumentException.class, () -> canvas.ensureRows(1 << 20));
        assertEquals(1, canvas.getRows());
        assertEquals(Integer.MAX_VALUE, TextCanvas.cellCount(1, Integer.MAX_VALUE));
    }

    @Test
    void setCell_growsRows() {
        TextCanvas canvas = new TextCanvas(4);
        canvas.setCell(0, 2, 3, new CellValue('X', 1, 2, Attrs.BOLD));
        assertEquals(3, canvas.getRows());
        assertEquals(new CellValue('X', 1, 2, Attrs.BOLD), canvas.getLayerCell(0, 2, 3));
        assertEquals(CellValue.BLANK, canvas.getLayerCell(0, 1, 0));
    }

    @Test
    void outOfRangeRead_isBlank() {
        TextCanvas canvas = new TextCanvas(4);
        assertEquals(CellValue.BLANK, canvas.getCompositeCell(5, 0));
        assertEquals(CellValue.BLANK, canvas.getCompositeCell(0, -1));
    }

    @Test
    void composite_glyphFromTopmostNonBlankLayer() {
        TextCanvas canvas = new TextCanvas(2);
        canvas.setCell(0, 0, 0, new CellValue('A', 1, 4, Attrs.BLINK));
        int top = canvas.addLayer("Top");
        canvas.setCell(top, 0, 0, new CellValue('B', 2, UNSET, Attrs.BOLD));

        CellValue cell = canvas.getCompositeCell(0, 0);
        assertEquals('B', cell.glyph());
        assertEquals(2, cell.fg());
        assertEquals(4, cell.bg());
        assertEquals(Attrs.BOLD, cell.attrs());
    }

    @Test
    void composite_blankTopLayerShowsLowerGlyphButTakesItsBackground() {
        TextCanvas canvas = new TextCanvas(2);
        canvas.setCell(0, 0, 0, new CellValue('A', 1, 4, Attrs.NONE));
        int top = canvas.addLayer("Top");
        canvas.setCell(top, 0, 0, new CellValue(' ', UNSET, 6, Attrs.UNDERLINE));

        CellValue cell = canvas.getCompositeCell(0, 0);
        assertEquals('A', cell.glyph());
        assertEquals(1, cell.fg());
        assertEquals(6, cell.bg());
        assertEquals(Attrs.NONE, cell.attrs());
    }

    @Test
    void composite_hiddenLayerIsSkipped() {
        TextCanvas canvas = new TextCanvas(2);
        canvas.setCell(0, 0, 0, new CellValue('A', 1, 4, Attrs.NONE));
        int top = canvas.addLayer("Top");
        canvas.setCell(top, 0, 0, new CellValue('B', 2, 5, Attrs.NONE));
        canvas.setLayerVisible(top, false);

        assertEquals(new CellValue('A', 1, 4, Attrs.NONE), canvas.getCompositeCell(0, 0));
    }

    @Test
    void composite_noGlyphAnywhereIsSpaceWithBackground() {
        TextCanvas canvas = new TextCanvas(2);
        canvas.setCell(0, 0, 1, new CellValue(' ', 3, 2, Attrs.BOLD));
        assertEquals(new CellValue(' ', UNSET, 2, Attrs.NONE), canvas.getCompositeCell(0, 1));
    }

    @Test
    void replaceWith_dropsLayersAndAdoptsSnapshot() {
        TextCanvas canvas = new TextCanvas(2);
        canvas.addLayer("Extra");
        canvas.setActiveLayer(1);

        int[] glyphs = { 'a', 'b', 'c' };
        int[] fg = { 7, 7, 7 };
        int[] bg = { 0, 0, 1 };
        int[] attrs = { 0, 0, 0 };
        SauceRecord sauce = SauceRecord.builder().title("T").build();
        canvas.replaceWith(new CanvasSnapshot(3, 1, BuiltinPalette.XTERM256, "Xterm 16",
            glyphs, fg, bg, attrs, sauce));

        assertEquals(1, canvas.getLayerCount());
        assertEquals(0, canvas.getActiveLayer());
        assertEquals(3, canvas.getColumns());
        assertEquals(BuiltinPalette.XTERM256, canvas.getPalette());
        assertEquals("Xterm 16", canvas.getPaletteTitle().orElseThrow());
        assertEquals("T", canvas.getSauce().orElseThrow().getTitle());
        assertEquals(new CellValue('c', 7, 1, 0), canvas.getCompositeCell(0, 2));
    }

    @Test
    void snapshot_rejectsMismatchedPlanes() {
        assertThrows(IllegalArgumentException.class, () -> new CanvasSnapshot(2, 1, BuiltinPalette.VGA16, null,
            new int[2], new int[2], new int[1], new int[2], null));
    }

    @Test
    void layerAccess_rejectsUnknownLayer() {
        TextCanvas canvas = new TextCanvas(2);
        assertThrows(IllegalArgumentException.class, () -> canvas.getLayerCell(3, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> canvas.setActiveLayer(-1));
    }
}

package org.ansi4j.canvas;

import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.sauce.SauceRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Complete single-layer document state, used to replace a canvas in one step. Planes are
 * row-major and all {@code columns * rows} long.
 */
public final class CanvasSnapshot {

    private final int columns;
    private final int rows;
    private final BuiltinPalette palette;
    private final String paletteTitle;
    private final int[] glyphs;
    private final int[] fg;
    private final int[] bg;
    private final int[] attrs;
    private final SauceRecord sauce;

    public CanvasSnapshot(int columns, int rows, BuiltinPalette palette, String paletteTitle,
                          int[] glyphs, int[] fg, int[] bg, int[] attrs, SauceRecord sauce) {
        if (columns < 1 || rows < 1) {
            throw new IllegalArgumentException("Snapshot must be at least 1x1, got " + columns + "x" + rows);
        }
        int cells = columns * rows;
        Objects.requireNonNull(glyphs, "glyphs");
        Objects.requireNonNull(fg, "fg");
        Objects.requireNonNull(bg, "bg");
        Objects.requireNonNull(attrs, "attrs");
        if (glyphs.length != cells || fg.length != cells || bg.length != cells || attrs.length != cells) {
            throw new IllegalArgumentException("All planes must hold " + cells + " cells");
        }
        this.columns = columns;
        this.rows = rows;
        this.palette = Objects.requireNonNull(palette, "palette");
        this.paletteTitle = paletteTitle;
        this.glyphs = glyphs;
        this.fg = fg;
        this.bg = bg;
        this.attrs = attrs;
        this.sauce = sauce;
    }

    public int getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }

    public BuiltinPalette getPalette() {
        return palette;
    }

    /**
     * Title of the palette the art appears to be drawn with; may differ from the storage
     * palette.
     */
    public Optional<String> getPaletteTitle() {
        return Optional.ofNullable(paletteTitle);
    }

    public Optional<SauceRecord> getSauce() {
        return Optional.ofNullable(sauce);
    }

    public CellValue getCell(int row, int col) {
        int i = row * columns + col;
        return new CellValue(glyphs[i], fg[i], bg[i], attrs[i]);
    }

    int[] glyphs() {
        return glyphs;
    }

    int[] fg() {
        return fg;
    }

    int[] bg() {
        return bg;
    }

    int[] attrs() {
        return attrs;
    }
}

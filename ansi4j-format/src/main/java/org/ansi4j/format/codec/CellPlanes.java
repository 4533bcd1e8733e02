package org.ansi4j.format.codec;

import java.util.Arrays;

/**
 * Import working storage: four parallel row-major planes over a fixed column count. Colors are
 * packed RGB until the importer quantizes them.
 */
final class CellPlanes {

    private final int columns;
    private int rows;
    private int[] glyphs;
    private int[] fg;
    private int[] bg;
    private int[] attrs;

    CellPlanes(int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be positive: " + columns);
        }
        this.columns = columns;
        this.rows = 0;
        this.glyphs = new int[0];
        this.fg = new int[0];
        this.bg = new int[0];
        this.attrs = new int[0];
    }

    int columns() {
        return columns;
    }

    int rows() {
        return rows;
    }

    /**
     * Grow to at least {@code needed} rows. New cells get {@code blankGlyph}, unset
     * foreground, {@code bgFill} and no attributes.
     */
    void ensureRows(int needed, int blankGlyph, int bgFill) {
        if (needed < 1) needed = 1;
        if (needed <= rows) return;
        int old = rows * columns;
        int cells = needed * columns;
        glyphs = Arrays.copyOf(glyphs, cells);
        fg = Arrays.copyOf(fg, cells);
        bg = Arrays.copyOf(bg, cells);
        attrs = Arrays.copyOf(attrs, cells);
        Arrays.fill(glyphs, old, cells, blankGlyph);
        Arrays.fill(bg, old, cells, bgFill);
        rows = needed;
    }

    /**
     * Drop everything and start over with one blank row.
     */
    void reset(int blankGlyph, int bgFill) {
        rows = 0;
        glyphs = new int[0];
        fg = new int[0];
        bg = new int[0];
        attrs = new int[0];
        ensureRows(1, blankGlyph, bgFill);
    }

    void put(int row, int col, int glyph, int fgColor, int bgColor, int attrBits) {
        int i = row * columns + col;
        glyphs[i] = glyph;
        fg[i] = fgColor;
        bg[i] = bgColor;
        attrs[i] = attrBits;
    }

    int glyphAt(int row, int col) {
        return glyphs[row * columns + col];
    }

    int fgAt(int row, int col) {
        return fg[row * columns + col];
    }

    int bgAt(int row, int col) {
        return bg[row * columns + col];
    }

    int attrsAt(int row, int col) {
        return attrs[row * columns + col];
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

package org.ansi4j.canvas;

import org.ansi4j.color.ColorService;

/**
 * One cell: glyph id, palette indices and attribute bits.
 *
 * @param glyph glyph id (see {@link GlyphId})
 * @param fg    foreground palette index or {@link ColorService#UNSET_INDEX}
 * @param bg    background palette index or {@link ColorService#UNSET_INDEX}
 * @param attrs {@link Attrs} bits
 */
public record CellValue(int glyph, int fg, int bg, int attrs) {

    public static final CellValue BLANK =
        new CellValue(GlyphId.SPACE, ColorService.UNSET_INDEX, ColorService.UNSET_INDEX, Attrs.NONE);

    public boolean hasFg() {
        return fg != ColorService.UNSET_INDEX;
    }

    public boolean hasBg() {
        return bg != ColorService.UNSET_INDEX;
    }
}

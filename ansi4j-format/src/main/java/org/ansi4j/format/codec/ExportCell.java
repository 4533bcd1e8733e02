package org.ansi4j.format.codec;

import org.ansi4j.color.ColorService;

/**
 * One cell as sampled for export.
 *
 * @param glyph     glyph id
 * @param codePoint Unicode stand-in for the glyph
 * @param fgIndex   palette index or {@link ColorService#UNSET_INDEX}
 * @param bgIndex   palette index or {@link ColorService#UNSET_INDEX}
 * @param fg        packed color, filled only for the truecolor modes
 * @param bg        packed color, filled only for the truecolor modes
 * @param attrs     attribute bits
 */
public record ExportCell(int glyph, int codePoint, int fgIndex, int bgIndex, int fg, int bg, int attrs) {

    public boolean fgUnset() {
        return fgIndex == ColorService.UNSET_INDEX;
    }

    public boolean bgUnset() {
        return bgIndex == ColorService.UNSET_INDEX;
    }
}

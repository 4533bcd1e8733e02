package org.ansi4j.canvas;

import org.ansi4j.charset.Cp437;

/**
 * Glyph identifiers stored in canvas cells. Values up to U+10FFFF are Unicode scalars.
 * Values with bit 31 set are tokens: bits 28..30 hold the token kind and the low 12 bits
 * an index into a byte-indexed font.
 */
public final class GlyphId {

    public static final int SPACE = ' ';

    private static final int TOKEN_BIT = 0x80000000;
    private static final int KIND_MASK = 0x70000000;
    private static final int KIND_SHIFT = 28;
    private static final int INDEX_MASK = 0x0FFF;

    private static final int KIND_BITMAP = 1;
    private static final int KIND_EMBEDDED = 2;

    private GlyphId() {
    }

    public static int ofUnicode(int codePoint) {
        return codePoint & 0x1FFFFF;
    }

    public static int ofBitmapIndex(int index) {
        return TOKEN_BIT | (KIND_BITMAP << KIND_SHIFT) | (index & INDEX_MASK);
    }

    public static int ofEmbeddedIndex(int index) {
        return TOKEN_BIT | (KIND_EMBEDDED << KIND_SHIFT) | (index & INDEX_MASK);
    }

    public static boolean isToken(int glyph) {
        return (glyph & TOKEN_BIT) != 0;
    }

    public static boolean isUnicode(int glyph) {
        return !isToken(glyph);
    }

    public static boolean isBitmapIndex(int glyph) {
        return isToken(glyph) && kind(glyph) == KIND_BITMAP;
    }

    public static boolean isEmbeddedIndex(int glyph) {
        return isToken(glyph) && kind(glyph) == KIND_EMBEDDED;
    }

    /**
     * Font index of a bitmap or embedded token.
     */
    public static int index(int glyph) {
        return glyph & INDEX_MASK;
    }

    public static boolean isBlank(int glyph) {
        if (isUnicode(glyph)) {
            return glyph == SPACE;
        }
        return (isBitmapIndex(glyph) || isEmbeddedIndex(glyph)) && index(glyph) == SPACE;
    }

    /**
     * Blank, or the NUL scalar some editors leave in untouched cells.
     */
    public static boolean isBlankish(int glyph) {
        return glyph == 0 || isBlank(glyph);
    }

    /**
     * A Unicode scalar that stands in for the glyph when text output is needed. Index tokens
     * are read through the CP437 table.
     */
    public static int toUnicodeRepresentative(int glyph) {
        if (isUnicode(glyph)) {
            return glyph;
        }
        if (isBitmapIndex(glyph) || isEmbeddedIndex(glyph)) {
            return Cp437.toUnicode(index(glyph) & 0xFF);
        }
        return '?';
    }

    private static int kind(int glyph) {
        return (glyph & KIND_MASK) >>> KIND_SHIFT;
    }
}

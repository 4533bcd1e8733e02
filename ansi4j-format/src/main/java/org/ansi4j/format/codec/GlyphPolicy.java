package org.ansi4j.format.codec;

/**
 * How 8-bit text bytes are stored in cells.
 */
public enum GlyphPolicy {
    /** Keep the byte as a font index token; lossless for byte-indexed fonts. */
    BITMAP_INDEX,
    /** Decode the byte to a Unicode scalar through the active byte encoding. */
    UNICODE
}

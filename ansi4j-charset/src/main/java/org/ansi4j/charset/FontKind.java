package org.ansi4j.charset;

/**
 * Whether a font renders 256 byte-indexed glyphs or Unicode text.
 */
public enum FontKind {
    BITMAP,
    UNICODE
}

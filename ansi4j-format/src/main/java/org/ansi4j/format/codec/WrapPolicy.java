package org.ansi4j.format.codec;

/**
 * When the cursor wraps after reaching the last column.
 */
public enum WrapPolicy {
    /**
     * Wrap before handling the next byte, as legacy renderers do, except when that byte is
     * CR or LF (so a newline at the row boundary does not advance twice).
     */
    EAGER,
    /** Wrap only when the next glyph is written. */
    ON_PUT
}

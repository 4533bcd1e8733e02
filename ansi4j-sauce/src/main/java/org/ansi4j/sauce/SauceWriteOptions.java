package org.ansi4j.sauce;

/**
 * Controls how a record is appended.
 *
 * @param includeEofByte  write 0x1A before the metadata
 * @param includeComments write the COMNT block when the record has comments
 * @param encodeCp437     encode text fields as CP437; otherwise ASCII with '?' for the rest
 */
public record SauceWriteOptions(boolean includeEofByte, boolean includeComments, boolean encodeCp437) {

    public static final SauceWriteOptions DEFAULTS = new SauceWriteOptions(true, true, true);
}

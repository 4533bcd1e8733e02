package org.ansi4j.sauce;

import java.util.Optional;

/**
 * Outcome of scanning a byte buffer for a trailer.
 *
 * @param record           the record, or {@code null} when none was found
 * @param payloadLength    number of leading bytes that belong to the content, excluding
 *                         the EOF marker, comment block and record
 * @param hadCommentBlock  whether a COMNT block preceded the record
 * @param hadEofByte       whether a 0x1A byte preceded the metadata
 */
public record SauceParsed(SauceRecord record, int payloadLength, boolean hadCommentBlock, boolean hadEofByte) {

    public static SauceParsed absent(int length) {
        return new SauceParsed(null, length, false, false);
    }

    public boolean isPresent() {
        return record != null;
    }

    public Optional<SauceRecord> getRecord() {
        return Optional.ofNullable(record);
    }
}

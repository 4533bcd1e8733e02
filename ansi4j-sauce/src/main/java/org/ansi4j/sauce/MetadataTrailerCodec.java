package org.ansi4j.sauce;

/**
 * Reads and writes the metadata trailer appended after a content payload.
 */
public interface MetadataTrailerCodec {

    /**
     * Locate a trailer at the end of {@code bytes}. Never fails: a missing or malformed
     * trailer yields {@link SauceParsed#absent(int)} covering the whole buffer.
     */
    SauceParsed parse(byte[] bytes);

    /**
     * Append {@code record} to {@code payload}. A record file size of 0 is replaced by the
     * payload length.
     */
    byte[] write(byte[] payload, SauceRecord record, SauceWriteOptions options);
}

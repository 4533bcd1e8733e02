package org.ansi4j.format.codec;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an export: the encoded bytes, or a short diagnostic.
 */
public final class ExportResult {

    private final byte[] bytes;
    private final String error;

    private ExportResult(byte[] bytes, String error) {
        this.bytes = bytes;
        this.error = error;
    }

    public static ExportResult success(byte[] bytes) {
        return new ExportResult(Objects.requireNonNull(bytes, "bytes"), null);
    }

    public static ExportResult failure(String error) {
        return new ExportResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return bytes != null;
    }

    public Optional<byte[]> getBytes() {
        return Optional.ofNullable(bytes);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ExportResult{" + bytes.length + " bytes}" : "ExportResult{error='" + error + "'}";
    }
}

package org.ansi4j.format.codec;

import org.ansi4j.canvas.CanvasSnapshot;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an import: a snapshot ready to commit, or a short diagnostic.
 */
public final class ImportResult {

    private final CanvasSnapshot snapshot;
    private final boolean decodedAsUtf8;
    private final String error;

    private ImportResult(CanvasSnapshot snapshot, boolean decodedAsUtf8, String error) {
        this.snapshot = snapshot;
        this.decodedAsUtf8 = decodedAsUtf8;
        this.error = error;
    }

    public static ImportResult success(CanvasSnapshot snapshot, boolean decodedAsUtf8) {
        return new ImportResult(Objects.requireNonNull(snapshot, "snapshot"), decodedAsUtf8, null);
    }

    public static ImportResult failure(String error) {
        return new ImportResult(null, false, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return snapshot != null;
    }

    public Optional<CanvasSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    public boolean isDecodedAsUtf8() {
        return decodedAsUtf8;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ImportResult{" + snapshot.getColumns() + "x" + snapshot.getRows()
                    + (decodedAsUtf8 ? ", utf8" : ", 8-bit") + '}';
        }
        return "ImportResult{error='" + error + "'}";
    }
}

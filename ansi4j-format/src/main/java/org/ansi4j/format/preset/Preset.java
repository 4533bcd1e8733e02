package org.ansi4j.format.preset;

import org.ansi4j.format.codec.ExportOptions;
import org.ansi4j.format.codec.ImportOptions;

import java.util.Objects;

/**
 * A named pairing of import and export options. Override fields through
 * {@code importOptions().toBuilder()} / {@code exportOptions().toBuilder()}.
 */
public record Preset(PresetId id, String name, String description,
                     ImportOptions importOptions, ExportOptions exportOptions) {

    public Preset {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(importOptions, "importOptions");
        Objects.requireNonNull(exportOptions, "exportOptions");
    }

    public String key() {
        return id.key();
    }
}

package org.ansi4j.format.preset;

import java.util.Optional;

/**
 * Identifiers of the built-in interchange presets. Keys are stable and safe to persist.
 */
public enum PresetId {
    SCENE_CLASSIC("scene-classic"),
    MODERN_UTF8_240_SAFE("modern-utf8-240-safe"),
    MODERN_UTF8_256("modern-utf8-256"),
    TRUECOLOR_SGR_UTF8("truecolor-sgr-utf8"),
    TRUECOLOR_PABLO_T_CP437("truecolor-pablo-t-cp437"),
    DURDRAW_UTF8_256("durdraw-utf8-256"),
    MOEBIUS_CLASSIC("moebius-classic"),
    PABLODRAW_CLASSIC("pablodraw-classic"),
    ICYDRAW_MODERN("icydraw-modern");

    private final String key;

    PresetId(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<PresetId> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String k = key.trim();
        for (PresetId id : values()) {
            if (id.key.equalsIgnoreCase(k)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}

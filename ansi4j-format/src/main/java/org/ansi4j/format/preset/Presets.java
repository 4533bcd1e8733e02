package org.ansi4j.format.preset;

import org.ansi4j.format.codec.ExportOptions;
import org.ansi4j.format.codec.ExportOptions.AttributeMode;
import org.ansi4j.format.codec.ExportOptions.BrightMode;
import org.ansi4j.format.codec.ExportOptions.ColorMode;
import org.ansi4j.format.codec.ExportOptions.Newline;
import org.ansi4j.format.codec.ExportOptions.TextEncoding;
import org.ansi4j.format.codec.ImportOptions;
import org.ansi4j.sauce.SauceWriteOptions;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The built-in preset table, in display order.
 */
public final class Presets {

    private static final SauceWriteOptions FULL_SAUCE = new SauceWriteOptions(true, true, true);

    private static final ImportOptions CP437_IMPORT = ImportOptions.DEFAULTS;
    private static final ImportOptions UTF8_IMPORT = ImportOptions.DEFAULTS.toBuilder().cp437(false).build();

    private static final List<Preset> ALL = List.of(
        new Preset(PresetId.SCENE_CLASSIC,
            "Scene Classic (CP437 + ANSI16)",
            "Classic ANSI art interchange: CP437 bytes, 16-color SGR, CRLF, optional SAUCE.",
            CP437_IMPORT,
            classic()
                .iceColors(true)
                .preserveLineLength(true)
                .writeSauce(true)
                .sauceWriteOptions(FULL_SAUCE)
                .build()),
        new Preset(PresetId.MODERN_UTF8_240_SAFE,
            "Modern Terminal (UTF-8 + 240-color safe)",
            "UTF-8 text with xterm indexed colors, remapping low-16 palette to stable 16..255; LF; no SAUCE by default.",
            UTF8_IMPORT,
            modern(TextEncoding.UTF8, ColorMode.XTERM256)
                .xterm240Safe(true)
                .build()),
        new Preset(PresetId.MODERN_UTF8_256,
            "Modern Terminal (UTF-8 + 256-color)",
            "UTF-8 text with xterm indexed colors 0..255; LF; no SAUCE by default.",
            UTF8_IMPORT,
            modern(TextEncoding.UTF8, ColorMode.XTERM256).build()),
        new Preset(PresetId.TRUECOLOR_SGR_UTF8,
            "Truecolor (UTF-8 + 38;2/48;2)",
            "UTF-8 text with standard-ish truecolor SGR; LF; no SAUCE by default.",
            UTF8_IMPORT,
            modern(TextEncoding.UTF8, ColorMode.TRUECOLOR_SGR).build()),
        new Preset(PresetId.TRUECOLOR_PABLO_T_CP437,
            "Pablo/Icy Truecolor (CP437 + ANSI16 fallback + ...t)",
            "Scene-friendly: CP437 + ANSI16 baseline (bold/iCE), with Pablo/Icy `...t` RGB overlay when needed; CRLF; SAUCE on.",
            CP437_IMPORT,
            classic()
                .colorMode(ColorMode.PABLO_T)
                .pabloWithAnsi16Fallback(true)
                .iceColors(true)
                .preserveLineLength(true)
                .writeSauce(true)
                .sauceWriteOptions(FULL_SAUCE)
                .build()),
        new Preset(PresetId.DURDRAW_UTF8_256,
            "Durdraw (UTF-8 + 256-color)",
            "Durdraw-style terminal output: UTF-8 + 38;5/48;5, LF, no SAUCE.",
            UTF8_IMPORT,
            modern(TextEncoding.UTF8, ColorMode.XTERM256)
                .preserveLineLength(true)
                .compress(false)
                .build()),
        new Preset(PresetId.MOEBIUS_CLASSIC,
            "Moebius (Classic)",
            "Moebius classic: CP437 + ANSI16 + CRLF + SAUCE (+^Z).",
            CP437_IMPORT,
            classic()
                .writeSauce(true)
                .build()),
        new Preset(PresetId.PABLODRAW_CLASSIC,
            "PabloDraw (Classic)",
            "PabloDraw-friendly: CP437 + ANSI16; allow cursor-forward compression on safe spaces; CRLF; optional SAUCE.",
            CP437_IMPORT,
            classic()
                .compress(true)
                .useCursorForward(true)
                .writeSauce(true)
                .build()),
        new Preset(PresetId.ICYDRAW_MODERN,
            "Icy Draw (Modern)",
            "Icy-style modern output: UTF-8 (BOM) + xterm256 or truecolor; LF; SAUCE optional.",
            UTF8_IMPORT,
            modern(TextEncoding.UTF8_BOM, ColorMode.XTERM256)
                .compress(true)
                .useCursorForward(true)
                .build()));

    private static final Map<PresetId, Preset> BY_ID = index();

    private Presets() {
    }

    public static List<Preset> all() {
        return ALL;
    }

    public static Preset get(PresetId id) {
        return BY_ID.get(Objects.requireNonNull(id, "id"));
    }

    public static Optional<Preset> find(String key) {
        return PresetId.fromKey(key).map(BY_ID::get);
    }

    private static ExportOptions.Builder classic() {
        return ExportOptions.builder()
            .textEncoding(TextEncoding.CP437)
            .colorMode(ColorMode.ANSI16)
            .attributeMode(AttributeMode.CLASSIC_DOS)
            .brightMode(BrightMode.BOLD_AND_ICE_BLINK)
            .newline(Newline.CRLF);
    }

    private static ExportOptions.Builder modern(TextEncoding encoding, ColorMode colorMode) {
        return ExportOptions.builder()
            .textEncoding(encoding)
            .colorMode(colorMode)
            .attributeMode(AttributeMode.MODERN)
            .newline(Newline.LF)
            .preserveLineLength(false)
            .writeSauce(false);
    }

    private static Map<PresetId, Preset> index() {
        Map<PresetId, Preset> m = new EnumMap<>(PresetId.class);
        for (Preset p : ALL) {
            m.put(p.id(), p);
        }
        return Collections.unmodifiableMap(m);
    }
}

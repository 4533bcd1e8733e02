package org.ansi4j.charset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the fonts the converter knows by name: the Unicode default, the IBM VGA
 * code page family, and the Amiga bitmap fonts.
 */
public final class BuiltinFontRegistry implements FontRegistry {

    private static final String IBM_VGA50 = "ibm vga50";
    private static final String IBM_VGA = "ibm vga";

    private static final FontInfo UNSCII = new FontInfo("unscii", "unscii-16-full", FontKind.UNICODE, ByteEncoding.CP437);
    private static final FontInfo VGA_437 = bitmap("vga437", "IBM VGA 437", ByteEncoding.CP437);
    private static final FontInfo VGA50_437 = bitmap("vga50-437", "IBM VGA50 437", ByteEncoding.CP437);
    private static final FontInfo TOPAZ_2 = bitmap("topaz2", "Amiga Topaz 2", ByteEncoding.AMIGA_LATIN1);
    private static final FontInfo MICROKNIGHT = bitmap("microknight", "Amiga MicroKnight", ByteEncoding.AMIGA_LATIN1);
    private static final FontInfo MICROKNIGHT_PLUS = bitmap("microknight-plus", "Amiga MicroKnight+", ByteEncoding.AMIGA_LATIN1);

    private static final Map<String, FontInfo> ALIASES = Map.of(
        "unscii", UNSCII,
        "cp437", VGA_437,
        "dos", VGA_437,
        "ibm", VGA_437,
        "cp437-80x50", VGA50_437,
        "80x50", VGA50_437,
        "vga50", VGA50_437,
        "topaz", TOPAZ_2,
        "topaz1200", TOPAZ_2,
        "microknight", MICROKNIGHT);

    private final List<FontInfo> fonts;

    public BuiltinFontRegistry() {
        List<FontInfo> list = new ArrayList<>();
        list.add(UNSCII);
        list.add(VGA_437);
        list.add(VGA50_437);
        for (ByteEncoding e : ByteEncoding.values()) {
            if (e.codePage() != 0 && e != ByteEncoding.CP437) {
                list.add(bitmap("vga" + e.codePage(), "IBM VGA " + e.codePage(), e));
            }
        }
        list.add(bitmap("terminus", "Terminus", ByteEncoding.CP437));
        list.add(bitmap("spleen", "Spleen", ByteEncoding.CP437));
        list.add(bitmap("topaz1", "Amiga Topaz 1", ByteEncoding.AMIGA_LATIN1));
        list.add(bitmap("topaz1-plus", "Amiga Topaz 1+", ByteEncoding.AMIGA_LATIN1));
        list.add(TOPAZ_2);
        list.add(bitmap("topaz2-plus", "Amiga Topaz 2+", ByteEncoding.AMIGA_LATIN1));
        list.add(bitmap("pot-noodle", "Amiga P0T-NOoDLE", ByteEncoding.AMIGA_LATIN1));
        list.add(MICROKNIGHT);
        list.add(MICROKNIGHT_PLUS);
        list.add(bitmap("mosoul", "Amiga mOsOul", ByteEncoding.AMIGA_LATIN1));
        this.fonts = Collections.unmodifiableList(list);
    }

    private static FontInfo bitmap(String id, String sauceName, ByteEncoding encoding) {
        return new FontInfo(id, sauceName, FontKind.BITMAP, encoding);
    }

    @Override
    public Optional<FontInfo> find(String declaredName) {
        if (declaredName == null) {
            return Optional.empty();
        }
        String name = declaredName.trim();
        if (name.isEmpty()) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith(IBM_VGA50)) {
            int cp = parseCodePage(lower.substring(IBM_VGA50.length()));
            if (cp <= 0 || cp == 437) {
                return Optional.of(VGA50_437);
            }
            return Optional.of(byCodePage(cp).orElse(VGA50_437));
        }
        if (lower.startsWith(IBM_VGA)) {
            int cp = parseCodePage(lower.substring(IBM_VGA.length()));
            if (cp <= 0) {
                return Optional.of(VGA_437);
            }
            return Optional.of(byCodePage(cp).orElse(VGA_437));
        }
        for (FontInfo f : fonts) {
            if (f.sauceName().equalsIgnoreCase(name)) {
                return Optional.of(f);
            }
        }
        if (lower.equals("microknight+")) {
            return Optional.of(MICROKNIGHT_PLUS);
        }
        return Optional.ofNullable(ALIASES.get(lower));
    }

    private Optional<FontInfo> byCodePage(int codePage) {
        if (codePage == 437) {
            return Optional.of(VGA_437);
        }
        String sauceName = "IBM VGA " + codePage;
        for (FontInfo f : fonts) {
            if (f.sauceName().equals(sauceName)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    private static int parseCodePage(String rest) {
        String s = rest.trim();
        if (s.isEmpty()) {
            return 0;
        }
        int v = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            v = v * 10 + (c - '0');
            if (v > 99999) {
                return -1;
            }
        }
        return v;
    }

    @Override
    public FontInfo defaultUnicodeFont() {
        return UNSCII;
    }

    @Override
    public FontInfo defaultBitmapFont() {
        return VGA_437;
    }

    @Override
    public List<FontInfo> all() {
        return fonts;
    }
}

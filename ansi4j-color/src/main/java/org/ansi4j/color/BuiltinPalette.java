package org.ansi4j.color;

import java.util.Optional;

/**
 * Palettes the converter can address by index.
 */
public enum BuiltinPalette {
    VGA16("VGA 16", vga16()),
    XTERM16("Xterm 16", xterm256(0, 16)),
    XTERM240_SAFE("Xterm 240 Safe", xterm256(16, 256)),
    XTERM256("Xterm 256", xterm256(0, 256));

    private final String title;
    private final int[] colors;

    BuiltinPalette(String title, int[] colors) {
        this.title = title;
        this.colors = colors;
    }

    public String title() {
        return title;
    }

    public int size() {
        return colors.length;
    }

    /**
     * @return packed color, or {@link Rgb#UNSET} when the index is out of range
     */
    public int color(int index) {
        if (index < 0 || index >= colors.length) {
            return Rgb.UNSET;
        }
        return colors[index];
    }

    public int[] colors() {
        return colors.clone();
    }

    public static Optional<BuiltinPalette> fromTitle(String title) {
        for (BuiltinPalette p : values()) {
            if (p.title.equalsIgnoreCase(title)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /** VGA text-mode colors in ANSI (not BIOS) order. */
    private static int[] vga16() {
        return new int[] {
            Rgb.fromHex(0x000000), Rgb.fromHex(0xAA0000), Rgb.fromHex(0x00AA00), Rgb.fromHex(0xAA5500),
            Rgb.fromHex(0x0000AA), Rgb.fromHex(0xAA00AA), Rgb.fromHex(0x00AAAA), Rgb.fromHex(0xAAAAAA),
            Rgb.fromHex(0x555555), Rgb.fromHex(0xFF5555), Rgb.fromHex(0x55FF55), Rgb.fromHex(0xFFFF55),
            Rgb.fromHex(0x5555FF), Rgb.fromHex(0xFF55FF), Rgb.fromHex(0x55FFFF), Rgb.fromHex(0xFFFFFF),
        };
    }

    private static int[] xterm256(int from, int to) {
        int[] levels = { 0, 95, 135, 175, 215, 255 };
        int[] system = {
            0x000000, 0xCD0000, 0x00CD00, 0xCDCD00, 0x0000EE, 0xCD00CD, 0x00CDCD, 0xE5E5E5,
            0x7F7F7F, 0xFF0000, 0x00FF00, 0xFFFF00, 0x5C5CFF, 0xFF00FF, 0x00FFFF, 0xFFFFFF,
        };
        int[] out = new int[to - from];
        for (int i = from; i < to; i++) {
            int c;
            if (i < 16) {
                c = Rgb.fromHex(system[i]);
            } else if (i < 232) {
                int v = i - 16;
                c = Rgb.of(levels[v / 36], levels[(v / 6) % 6], levels[v % 6]);
            } else {
                int gray = 8 + (i - 232) * 10;
                c = Rgb.of(gray, gray, gray);
            }
            out[i - from] = c;
        }
        return out;
    }
}

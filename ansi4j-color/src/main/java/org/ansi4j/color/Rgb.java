package org.ansi4j.color;

/**
 * Packed opaque colors as {@code 0xFFRRGGBB} ints. The value {@link #UNSET} (zero,
 * which has no alpha) means "no explicit color".
 */
public final class Rgb {

    public static final int UNSET = 0;

    private static final int OPAQUE = 0xFF000000;

    private Rgb() {
    }

    public static int of(int r, int g, int b) {
        return OPAQUE | (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
    }

    public static int fromHex(int rgb24) {
        return OPAQUE | (rgb24 & 0xFFFFFF);
    }

    public static boolean isSet(int color) {
        return color != UNSET;
    }

    public static int red(int color) {
        return (color >>> 16) & 0xFF;
    }

    public static int green(int color) {
        return (color >>> 8) & 0xFF;
    }

    public static int blue(int color) {
        return color & 0xFF;
    }

    public static int distanceSq(int a, int b) {
        int dr = red(a) - red(b);
        int dg = green(a) - green(b);
        int db = blue(a) - blue(b);
        return dr * dr + dg * dg + db * db;
    }

    public static String toHex(int color) {
        if (!isSet(color)) {
            return "unset";
        }
        return String.format("#%06X", color & 0xFFFFFF);
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }
}

package org.ansi4j.charset;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed byte to Unicode table of IBM code page 437 as used by text-mode art.
 * <p>
 * Unlike the JDK's IBM437 charset, bytes 0x01..0x1F and 0x7F map to their
 * display glyphs (smileys, arrows, house) instead of control characters.
 */
public final class Cp437 {

    /** Display glyphs for 0x01..0x1F; index 0 is unused. */
    static final String CONTROL_GLYPHS =
        "\u0000☺☻♥♦♣♠•◘○◙♂♀♪♫☼►◄↕‼¶§▬↨↑↓→←∟↔▲▼";

    static final int HOUSE = 0x2302;

    private static final String HIGH_HALF =
        "ÇüéâäàåçêëèïîìÄÅÉæÆôöòûùÿÖÜ¢£¥₧ƒ"
        + "áíóúñÑªº¿⌐¬½¼¡«»░▒▓│┤╡╢╖╕╣║╗╝╜╛┐"
        + "└┴┬├─┼╞╟╚╔╩╦╠═╬╧╨╤╥╙╘╒╓╫╪┘┌█▄▌▐▀"
        + "αßΓπΣσµτΦΘΩδ∞φε∩≡±≥≤⌠⌡÷≈°∙·√ⁿ²■\u00A0";

    private static final int[] TO_UNICODE = new int[256];
    private static final Map<Integer, Integer> FROM_UNICODE = new HashMap<>();

    static {
        for (int b = 0; b < 0x20; b++) {
            TO_UNICODE[b] = CONTROL_GLYPHS.charAt(b);
        }
        for (int b = 0x20; b < 0x7F; b++) {
            TO_UNICODE[b] = b;
        }
        TO_UNICODE[0x7F] = HOUSE;
        for (int b = 0x80; b < 0x100; b++) {
            TO_UNICODE[b] = HIGH_HALF.charAt(b - 0x80);
        }
        for (int b = 0; b < 256; b++) {
            FROM_UNICODE.putIfAbsent(TO_UNICODE[b], b);
        }
    }

    private Cp437() {
    }

    /**
     * Map a byte (0..255) to its Unicode scalar.
     */
    public static int toUnicode(int b) {
        return TO_UNICODE[b & 0xFF];
    }

    /**
     * Reverse lookup; the lowest byte wins when several bytes share a scalar.
     *
     * @return byte value 0..255, or -1 if the scalar has no CP437 representation
     */
    public static int fromUnicode(int codePoint) {
        Integer b = FROM_UNICODE.get(codePoint);
        return b == null ? -1 : b;
    }

    static int[] table() {
        return TO_UNICODE.clone();
    }
}

package org.ansi4j.charset;

import java.nio.charset.Charset;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 8-bit byte encodings a bitmap font can imply. OEM code pages carry the CP437
 * control-glyph overrides for 0x01..0x1F and 0x7F so art drawn with those bytes
 * keeps its shapes regardless of the code page.
 */
public enum ByteEncoding {
    CP437(437, null),
    CP737(737, "x-IBM737"),
    CP775(775, "IBM775"),
    CP850(850, "IBM850"),
    CP852(852, "IBM852"),
    CP855(855, "IBM855"),
    CP857(857, "IBM857"),
    CP860(860, "IBM860"),
    CP861(861, "IBM861"),
    CP862(862, "IBM862"),
    CP863(863, "IBM863"),
    CP865(865, "IBM865"),
    CP866(866, "IBM866"),
    CP869(869, "IBM869"),
    AMIGA_LATIN1(0, "ISO-8859-1");

    private static final Logger LOG = Logger.getLogger(ByteEncoding.class.getName());

    private final int codePage;
    private final String charsetName;

    ByteEncoding(int codePage, String charsetName) {
        this.codePage = codePage;
        this.charsetName = charsetName;
    }

    /**
     * OEM code page number, or 0 for non-OEM encodings.
     */
    public int codePage() {
        return codePage;
    }

    public int toUnicode(int b) {
        return Tables.TO_UNICODE.get(this)[b & 0xFF];
    }

    /**
     * @return byte value, or -1 when this encoding cannot represent the scalar
     */
    public int fromUnicode(int codePoint) {
        Integer b = Tables.FROM_UNICODE.get(this).get(codePoint);
        return b == null ? -1 : b;
    }

    public static Optional<ByteEncoding> forCodePage(int codePage) {
        for (ByteEncoding e : values()) {
            if (e.codePage != 0 && e.codePage == codePage) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    private int[] buildTable() {
        if (charsetName == null) {
            return Cp437.table();
        }
        Charset charset;
        try {
            charset = Charset.forName(charsetName);
        } catch (IllegalArgumentException e) {
            LOG.log(Level.FINE, "Charset " + charsetName + " unavailable, using CP437 table for " + name(), e);
            return Cp437.table();
        }
        int[] table = new int[256];
        for (int b = 0; b < 256; b++) {
            String s = new String(new byte[] { (byte) b }, charset);
            table[b] = s.isEmpty() ? 0xFFFD : s.codePointAt(0);
        }
        if (this == AMIGA_LATIN1) {
            table[0x7F] = Cp437.HOUSE;
        } else {
            for (int b = 1; b < 0x20; b++) {
                table[b] = Cp437.CONTROL_GLYPHS.charAt(b);
            }
            table[0x7F] = Cp437.HOUSE;
        }
        return table;
    }

    private static final class Tables {
        static final Map<ByteEncoding, int[]> TO_UNICODE = new EnumMap<>(ByteEncoding.class);
        static final Map<ByteEncoding, Map<Integer, Integer>> FROM_UNICODE = new EnumMap<>(ByteEncoding.class);

        static {
            for (ByteEncoding e : ByteEncoding.values()) {
                int[] table = e.buildTable();
                Map<Integer, Integer> reverse = new HashMap<>();
                for (int b = 0; b < 256; b++) {
                    reverse.putIfAbsent(table[b], b);
                }
                TO_UNICODE.put(e, table);
                FROM_UNICODE.put(e, reverse);
            }
        }
    }
}

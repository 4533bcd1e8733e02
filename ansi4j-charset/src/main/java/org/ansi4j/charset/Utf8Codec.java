package org.ansi4j.charset;

import java.io.ByteArrayOutputStream;

/**
 * Raw UTF-8 sequence decoder/encoder used on byte streams that interleave text
 * with escape sequences, where a {@link java.nio.charset.CharsetDecoder} would
 * not let the caller resume byte-by-byte after a bad sequence.
 */
public final class Utf8Codec {

    public static final int REPLACEMENT = 0xFFFD;
    public static final int BOM = 0xFEFF;

    private static final double MIN_VALID_RATIO = 0.95;
    private static final int MIN_VALID_SEQUENCES = 4;

    /**
     * Result of decoding one sequence. When {@code valid} is false the code point is
     * {@link #REPLACEMENT} and {@code length} is 1 so the caller resumes at the next byte.
     */
    public record Decoded(int codePoint, int length, boolean valid) {
    }

    private Utf8Codec() {
    }

    /**
     * Decode one sequence starting at {@code offset}, reading no further than {@code limit}.
     * Lead and continuation bits are checked; overlong forms are not rejected.
     */
    public static Decoded decode(byte[] data, int offset, int limit) {
        if (offset >= limit) {
            return new Decoded(REPLACEMENT, 1, false);
        }
        int c = data[offset] & 0xFF;
        if ((c & 0x80) == 0) {
            return new Decoded(c, 1, true);
        }
        int remaining;
        int cp;
        if ((c & 0xE0) == 0xC0) {
            cp = c & 0x1F;
            remaining = 1;
        } else if ((c & 0xF0) == 0xE0) {
            cp = c & 0x0F;
            remaining = 2;
        } else if ((c & 0xF8) == 0xF0) {
            cp = c & 0x07;
            remaining = 3;
        } else {
            return new Decoded(REPLACEMENT, 1, false);
        }
        if (offset + remaining >= limit) {
            return new Decoded(REPLACEMENT, 1, false);
        }
        for (int j = 1; j <= remaining; j++) {
            int cc = data[offset + j] & 0xFF;
            if ((cc & 0xC0) != 0x80) {
                return new Decoded(REPLACEMENT, 1, false);
            }
            cp = (cp << 6) | (cc & 0x3F);
        }
        return new Decoded(cp, 1 + remaining, true);
    }

    public static void encode(int codePoint, ByteArrayOutputStream out) {
        int cp = codePoint;
        if (cp < 0 || cp > 0x10FFFF || (cp >= 0xD800 && cp <= 0xDFFF)) {
            cp = REPLACEMENT;
        }
        if (cp < 0x80) {
            out.write(cp);
        } else if (cp < 0x800) {
            out.write(0xC0 | (cp >> 6));
            out.write(0x80 | (cp & 0x3F));
        } else if (cp < 0x10000) {
            out.write(0xE0 | (cp >> 12));
            out.write(0x80 | ((cp >> 6) & 0x3F));
            out.write(0x80 | (cp & 0x3F));
        } else {
            out.write(0xF0 | (cp >> 18));
            out.write(0x80 | ((cp >> 12) & 0x3F));
            out.write(0x80 | ((cp >> 6) & 0x3F));
            out.write(0x80 | (cp & 0x3F));
        }
    }

    public static boolean startsWithBom(byte[] data) {
        return data.length >= 3
            && (data[0] & 0xFF) == 0xEF && (data[1] & 0xFF) == 0xBB && (data[2] & 0xFF) == 0xBF;
    }

    /**
     * Sniff whether text bytes are UTF-8. Only bytes &gt;= 0x80 carry signal: the text
     * counts as UTF-8 when at least 95% of the sequences starting there decode and
     * at least 4 of them do.
     */
    public static boolean looksLikeUtf8(byte[] text) {
        boolean anyHigh = false;
        for (byte b : text) {
            if ((b & 0x80) != 0) {
                anyHigh = true;
                break;
            }
        }
        if (!anyHigh) {
            return false;
        }
        int ok = 0;
        int bad = 0;
        int i = 0;
        while (i < text.length) {
            if ((text[i] & 0x80) == 0) {
                i++;
                continue;
            }
            Decoded d = decode(text, i, text.length);
            if (d.valid()) {
                ok++;
                i += d.length();
            } else {
                bad++;
                i++;
            }
        }
        int total = ok + bad;
        if (total == 0) {
            return false;
        }
        return (double) ok / total >= MIN_VALID_RATIO && ok >= MIN_VALID_SEQUENCES;
    }
}

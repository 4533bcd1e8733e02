package org.ansi4j.format.detect;

import org.ansi4j.charset.FontInfo;
import org.ansi4j.charset.FontRegistry;
import org.ansi4j.charset.Utf8Codec;
import org.ansi4j.format.codec.CsiSequence;
import org.ansi4j.format.codec.ImportOptions;
import org.ansi4j.sauce.SauceDataType;
import org.ansi4j.sauce.SauceRecord;

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses between 8-bit and UTF-8 text decoding before import.
 * <p>
 * Order of evidence: a caller that turns 8-bit decoding off always gets UTF-8; then a UTF-8
 * BOM opening the text; then a SAUCE data type that is inherently 8-bit (BinaryText, XBin);
 * then the declared SAUCE font (Unicode font means UTF-8, bitmap font means 8-bit); and only
 * then the byte-validity sniff from {@link Utf8Codec#looksLikeUtf8(byte[])}.
 */
public final class EncodingDetector {

    private static final Logger LOG = Logger.getLogger(EncodingDetector.class.getName());

    private static final int ESC = 0x1B;
    private static final int SUB = 0x1A;

    private final FontRegistry fonts;

    public EncodingDetector(FontRegistry fonts) {
        this.fonts = Objects.requireNonNull(fonts, "fonts");
    }

    /**
     * @param bytes  the whole input
     * @param length payload length (input without the SAUCE trailer)
     * @param sauce  parsed trailer record, or null
     */
    public boolean shouldDecodeAsUtf8(byte[] bytes, int length, SauceRecord sauce, ImportOptions options) {
        if (!options.isCp437()) {
            return true;
        }
        byte[] text = extractText(bytes, length);
        if (Utf8Codec.startsWithBom(text)) {
            LOG.log(Level.FINE, "UTF-8 BOM found, decoding as UTF-8");
            return true;
        }
        if (sauce != null) {
            SauceDataType type = sauce.getDataTypeKind();
            if (type == SauceDataType.BINARY_TEXT || type == SauceDataType.XBIN) {
                return false;
            }
            Optional<FontInfo> font = fonts.find(sauce.getTinfos());
            if (font.isPresent()) {
                LOG.log(Level.FINE, "SAUCE font {0} decides text encoding", font.get().id());
                return font.get().isUnicode();
            }
        }
        return Utf8Codec.looksLikeUtf8(text);
    }

    /**
     * Text payload with control sequences removed: stops at SUB, drops {@code ESC [ ... final}
     * sequences and other control bytes, keeps printable ASCII and every high byte.
     */
    public static byte[] extractText(byte[] bytes, int length) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(length, 1 << 20));
        int i = 0;
        while (i < length) {
            int b = bytes[i] & 0xFF;
            if (b == SUB) {
                break;
            }
            if (b != ESC) {
                if (b >= 0x20) {
                    out.write(b);
                }
                i++;
                continue;
            }
            if (i + 1 < length && bytes[i + 1] == '[') {
                int j = i + 2;
                int consumed = 0;
                while (j < length && consumed < CsiSequence.MAX_LENGTH) {
                    int ch = bytes[j] & 0xFF;
                    j++;
                    if (CsiSequence.isFinal(ch)) {
                        break;
                    }
                    consumed++;
                }
                i = j;
                continue;
            }
            i++;
        }
        return out.toByteArray();
    }
}

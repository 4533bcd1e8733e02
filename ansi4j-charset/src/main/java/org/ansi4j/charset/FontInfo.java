package org.ansi4j.charset;

import java.util.Objects;

/**
 * A font known to a {@link FontRegistry}.
 *
 * @param id          stable short identifier
 * @param sauceName   canonical name written into the metadata trailer font field
 * @param kind        bitmap (byte-indexed) or Unicode font
 * @param encoding    byte encoding implied by the font, used for 8-bit text
 */
public record FontInfo(String id, String sauceName, FontKind kind, ByteEncoding encoding) {

    public FontInfo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sauceName, "sauceName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(encoding, "encoding");
    }

    public boolean isUnicode() {
        return kind == FontKind.UNICODE;
    }
}

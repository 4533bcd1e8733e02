package org.ansi4j.charset;

import java.util.List;
import java.util.Optional;

/**
 * Maps declared font names (as found in a metadata trailer) to font descriptions.
 */
public interface FontRegistry {

    /**
     * Resolve a declared font name. Matching is case-insensitive and tolerant of
     * surrounding whitespace.
     */
    Optional<FontInfo> find(String declaredName);

    /**
     * Font used for documents whose text was decoded as Unicode.
     */
    FontInfo defaultUnicodeFont();

    /**
     * Font used for documents whose text was decoded from 8-bit bytes.
     */
    FontInfo defaultBitmapFont();

    List<FontInfo> all();
}

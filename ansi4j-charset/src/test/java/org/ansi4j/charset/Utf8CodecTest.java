package org.ansi4j.charset;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class Utf8CodecTest {

    @Test
    void decode_readsMultiByteSequence() {
        byte[] data = "█".getBytes(StandardCharsets.UTF_8);
        Utf8Codec.Decoded d = Utf8Codec.decode(data, 0, data.length);
        assertTrue(d.valid());
        assertEquals(0x2588, d.codePoint());
        assertEquals(3, d.length());
    }

    @Test
    void decode_invalidLeadAdvancesOneByte() {
        byte[] data = { (byte) 0xDB, 'A' };
        Utf8Codec.Decoded d = Utf8Codec.decode(data, 0, data.length);
        assertFalse(d.valid());
        assertEquals(Utf8Codec.REPLACEMENT, d.codePoint());
        assertEquals(1, d.length());
    }

    @Test
    void decode_truncatedSequenceIsInvalid() {
        byte[] data = { (byte) 0xE2, (byte) 0x96 };
        assertFalse(Utf8Codec.decode(data, 0, data.length).valid());
    }

    @Test
    void encode_writesFourByteForm() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Utf8Codec.encode(0x1F600, out);
        assertArrayEquals("😀".getBytes(StandardCharsets.UTF_8), out.toByteArray());
    }

    @Test
    void encode_replacesSurrogates() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Utf8Codec.encode(0xD800, out);
        assertArrayEquals("\uFFFD".getBytes(StandardCharsets.UTF_8), out.toByteArray());
    }

    @Test
    void looksLikeUtf8_needsFourValidSequences() {
        assertFalse(Utf8Codec.looksLikeUtf8("ab░░░".getBytes(StandardCharsets.UTF_8)));
        assertTrue(Utf8Codec.looksLikeUtf8("ab░░░░".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void looksLikeUtf8_rejectsCp437Shades() {
        byte[] cp437 = { (byte) 0xB0, (byte) 0xB1, (byte) 0xB2, (byte) 0xDB, 'x', (byte) 0xDC, (byte) 0xDF };
        assertFalse(Utf8Codec.looksLikeUtf8(cp437));
    }

    @Test
    void looksLikeUtf8_pureAsciiIsNotEvidence() {
        assertFalse(Utf8Codec.looksLikeUtf8("hello world".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void looksLikeUtf8_toleratesUnderFivePercentGarbage() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            sb.append('▀');
        }
        byte[] valid = sb.toString().getBytes(StandardCharsets.UTF_8);
        byte[] mixed = new byte[valid.length + 1];
        System.arraycopy(valid, 0, mixed, 0, valid.length);
        mixed[valid.length] = (byte) 0xFF;
        assertTrue(Utf8Codec.looksLikeUtf8(mixed));
    }
}

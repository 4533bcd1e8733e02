package org.ansi4j.charset;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Cp437Test {

    @Test
    void toUnicode_mapsControlBytesToDisplayGlyphs() {
        assertEquals(0x0000, Cp437.toUnicode(0x00));
        assertEquals(0x263A, Cp437.toUnicode(0x01));
        assertEquals(0x25BC, Cp437.toUnicode(0x1F));
        assertEquals(0x2302, Cp437.toUnicode(0x7F));
    }

    @Test
    void toUnicode_mapsHighHalfBlocksAndShades() {
        assertEquals(0x00C7, Cp437.toUnicode(0x80));
        assertEquals(0x2591, Cp437.toUnicode(0xB0));
        assertEquals(0x2588, Cp437.toUnicode(0xDB));
        assertEquals(0x25A0, Cp437.toUnicode(0xFE));
        assertEquals(0x00A0, Cp437.toUnicode(0xFF));
    }

    @Test
    void toUnicode_passesAsciiThrough() {
        for (int b = 0x20; b < 0x7F; b++) {
            assertEquals(b, Cp437.toUnicode(b));
        }
    }

    @Test
    void fromUnicode_invertsEveryByte() {
        for (int b = 0; b < 256; b++) {
            assertEquals(b, Cp437.fromUnicode(Cp437.toUnicode(b)));
        }
    }

    @Test
    void fromUnicode_returnsMinusOneForUnmappedScalar() {
        assertEquals(-1, Cp437.fromUnicode(0x4E2D));
    }
}

package org.ansi4j.format.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CsiSequenceTest {

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void scan_splitsParameters() {
        byte[] b = ascii("31;1mX");
        CsiSequence seq = CsiSequence.scan(b, 0, b.length);
        assertTrue(seq.isTerminated());
        assertEquals('m', seq.getFinalByte());
        assertEquals(CsiCommand.SGR, seq.getCommand());
        assertArrayEquals(new int[] { 31, 1 }, seq.getParams());
        assertEquals(5, seq.getNext());
    }

    @Test
    void scan_emptyFieldsReadAsZero() {
        byte[] b = ascii(";5H");
        CsiSequence seq = CsiSequence.scan(b, 0, b.length);
        assertArrayEquals(new int[] { 0, 5 }, seq.getParams());
        assertEquals(0, seq.getParam(0, 1));
        assertEquals(1, seq.getCount(0, 1));
        assertEquals(5, seq.getCount(1, 1));
        assertEquals(7, seq.getCount(2, 7));
    }

    @Test
    void scan_emptyBodyIsSingleZero() {
        byte[] b = ascii("m");
        assertArrayEquals(new int[] { 0 }, CsiSequence.scan(b, 0, b.length).getParams());
    }

    @Test
    void scan_hugeValuesSaturate() {
        byte[] b = ascii("99999999999C");
        assertEquals(CsiSequence.MAX_PARAM_VALUE, CsiSequence.scan(b, 0, b.length).getParam(0, 0));
    }

    @Test
    void scan_unterminatedStopsAtLimit() {
        byte[] b = ascii("12;3");
        CsiSequence seq = CsiSequence.scan(b, 0, b.length);
        assertFalse(seq.isTerminated());
        assertEquals(-1, seq.getFinalByte());
        assertEquals(CsiCommand.UNRECOGNIZED, seq.getCommand());
        assertEquals(4, seq.getNext());
    }

    @Test
    void scan_givesUpAfterMaxLength() {
        byte[] b = ascii("1".repeat(100) + "m");
        CsiSequence seq = CsiSequence.scan(b, 0, b.length);
        assertFalse(seq.isTerminated());
        assertEquals(CsiSequence.MAX_LENGTH + 1, seq.getNext());
    }

    @Test
    void scan_bangTerminates() {
        byte[] b = ascii("0;0!");
        CsiSequence seq = CsiSequence.scan(b, 0, b.length);
        assertEquals(CsiCommand.IGNORED, seq.getCommand());
    }

    @Test
    void getParams_returnsCopy() {
        byte[] b = ascii("1m");
        CsiSequence seq = CsiSequence.scan(b, 0, b.length);
        seq.getParams()[0] = 42;
        assertEquals(1, seq.getParam(0, 0));
    }

    @Test
    void forFinal_mapsKnownCommands() {
        assertEquals(CsiCommand.CURSOR_POSITION, CsiCommand.forFinal('f'));
        assertEquals(CsiCommand.PABLO_TRUECOLOR, CsiCommand.forFinal('t'));
        assertEquals(CsiCommand.IGNORED, CsiCommand.forFinal('K'));
        assertEquals(CsiCommand.UNRECOGNIZED, CsiCommand.forFinal('z'));
    }
}

package org.ansi4j.format.pen;

import org.ansi4j.color.Rgb;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SgrEventTest {

    @Test
    void parse_emptyIsReset() {
        assertEquals(List.of(SgrEvent.RESET), SgrEvent.parse(new int[0]));
    }

    @ParameterizedTest
    @CsvSource({
        "30, FG_16, 0",
        "37, FG_16, 7",
        "90, FG_BRIGHT, 8",
        "97, FG_BRIGHT, 15",
        "40, BG_16, 0",
        "107, BG_BRIGHT, 15",
    })
    void parse_simpleColors(int code, SgrEvent.Kind kind, int value) {
        assertEquals(List.of(new SgrEvent(kind, value)), SgrEvent.parse(new int[] { code }));
    }

    @Test
    void parse_unsupportedCodeIsUnknown() {
        assertEquals(List.of(SgrEvent.of(SgrEvent.Kind.UNKNOWN)), SgrEvent.parse(new int[] { 6 }));
    }

    @Test
    void parse_xterm256ConsumesItsArguments() {
        List<SgrEvent> events = SgrEvent.parse(new int[] { 38, 5, 196, 1 });
        assertEquals(List.of(new SgrEvent(SgrEvent.Kind.FG_256, 196), SgrEvent.of(SgrEvent.Kind.BOLD)), events);
    }

    @Test
    void parse_outOfRangeIndexDroppedButConsumed() {
        assertEquals(List.of(SgrEvent.of(SgrEvent.Kind.BOLD)), SgrEvent.parse(new int[] { 48, 5, 300, 1 }));
    }

    @Test
    void parse_rgbClampsChannels() {
        List<SgrEvent> events = SgrEvent.parse(new int[] { 48, 2, 300, 20, 30 });
        assertEquals(List.of(new SgrEvent(SgrEvent.Kind.BG_RGB, Rgb.of(255, 20, 30))), events);
    }

    @Test
    void parse_truncatedRgbEmitsNothing() {
        assertTrue(SgrEvent.parse(new int[] { 38, 2, 1 }).isEmpty());
    }

    @Test
    void parse_unknownSelectorConsumesNothing() {
        List<SgrEvent> events = SgrEvent.parse(new int[] { 38, 9, 1 });
        assertEquals(List.of(SgrEvent.of(SgrEvent.Kind.STRIKETHROUGH), SgrEvent.of(SgrEvent.Kind.BOLD)), events);
    }

    @Test
    void parsePabloTrueColor_selectsChannel() {
        assertEquals(new SgrEvent(SgrEvent.Kind.FG_RGB, Rgb.of(255, 0, 0)),
            SgrEvent.parsePabloTrueColor(new int[] { 1, 255, 0, 0 }));
        assertEquals(new SgrEvent(SgrEvent.Kind.BG_RGB, Rgb.of(0, 0, 255)),
            SgrEvent.parsePabloTrueColor(new int[] { 0, 0, 0, 255 }));
        assertEquals(SgrEvent.Kind.UNKNOWN, SgrEvent.parsePabloTrueColor(new int[] { 2, 1, 2, 3 }).kind());
        assertEquals(SgrEvent.Kind.UNKNOWN, SgrEvent.parsePabloTrueColor(new int[] { 1, 2, 3 }).kind());
    }
}

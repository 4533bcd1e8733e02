package org.ansi4j.format.pen;

import org.ansi4j.canvas.Attrs;
import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.color.Rgb;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class PenTest {

    private static final PenSettings ICE = PenSettings.DEFAULTS;
    private static final PenSettings NO_ICE = new PenSettings(false, Rgb.UNSET, Rgb.UNSET, false);

    private static Pen sgr(Pen pen, PenSettings settings, int... params) {
        return pen.applyAll(SgrEvent.parse(params), settings);
    }

    @Test
    void defaults_lightGrayOnBlack() {
        Pen pen = Pen.defaults(ICE);
        assertEquals(7, pen.getFgIndex());
        assertEquals(0, pen.getBgIndex());
        assertEquals(BuiltinPalette.VGA16.color(7), pen.getFg());
        assertEquals(BuiltinPalette.VGA16.color(0), pen.getBg());
        assertEquals(Attrs.NONE, pen.attrs());
    }

    @ParameterizedTest
    @CsvSource({
        "30, 0, 000000", "31, 1, AA0000", "32, 2, 00AA00", "33, 3, AA5500",
        "34, 4, 0000AA", "35, 5, AA00AA", "36, 6, 00AAAA", "37, 7, AAAAAA",
        "90, 8, 555555", "91, 9, FF5555", "92, 10, 55FF55", "93, 11, FFFF55",
        "94, 12, 5555FF", "95, 13, FF55FF", "96, 14, 55FFFF", "97, 15, FFFFFF",
    })
    void sixteenForegroundCodes_resolveToVgaRgb(int code, int index, String hex) {
        int expected = Rgb.fromHex(Integer.parseInt(hex, 16));
        Pen pen = sgr(Pen.defaults(ICE), ICE, code);
        assertEquals(index, pen.getFgIndex());
        assertEquals(expected, pen.getFg());
        assertEquals(expected, BuiltinPalette.VGA16.color(index));
    }

    @Test
    void defaults_customColorsAndUnsetBackground() {
        int fg = Rgb.of(1, 2, 3);
        Pen pen = Pen.defaults(new PenSettings(true, fg, Rgb.UNSET, true));
        assertEquals(fg, pen.getFg());
        assertFalse(Rgb.isSet(pen.getBg()));
    }

    @Test
    void bold_brightensAndNormalIntensityRestores() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 1);
        assertEquals(15, pen.getFgIndex());
        assertTrue(pen.isBold());
        assertTrue(pen.isFgBrightFromBold());

        pen = sgr(pen, ICE, 22);
        assertEquals(7, pen.getFgIndex());
        assertEquals(BuiltinPalette.VGA16.color(7), pen.getFg());
        assertFalse(pen.isBold());
    }

    @Test
    void boldThenColor_selectsBrightVariant() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 1, 31);
        assertEquals(9, pen.getFgIndex());
        pen = sgr(pen, ICE, 22);
        assertEquals(1, pen.getFgIndex());
    }

    @Test
    void explicitBrightColor_isNotUndoneByNormalIntensity() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 1, 91, 22);
        assertEquals(9, pen.getFgIndex());
    }

    @Test
    void iceBlink_brightensBackgroundInsteadOfBlinking() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 43, 5);
        assertEquals(11, pen.getBgIndex());
        assertTrue(pen.isIceBg());
        assertFalse(pen.isBlink());

        pen = sgr(pen, ICE, 25);
        assertEquals(3, pen.getBgIndex());
        assertFalse(pen.isIceBg());
    }

    @Test
    void iceLatch_brightensLaterBackgrounds() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 5, 44);
        assertEquals(12, pen.getBgIndex());
    }

    @Test
    void blinkWithoutIce_isRealBlink() {
        Pen pen = sgr(Pen.defaults(NO_ICE), NO_ICE, 43, 5);
        assertEquals(3, pen.getBgIndex());
        assertTrue(pen.isBlink());
        assertTrue(Attrs.has(pen.attrs(), Attrs.BLINK));
    }

    @Test
    void modernAttributes_toggleIndependently() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 2, 3, 4, 7, 9);
        assertEquals(Attrs.DIM | Attrs.ITALIC | Attrs.UNDERLINE | Attrs.REVERSE | Attrs.STRIKETHROUGH, pen.attrs());
        pen = sgr(pen, ICE, 23, 24, 27, 29);
        assertEquals(Attrs.DIM, pen.attrs());
    }

    @Test
    void extendedColors_recordTheirModes() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 38, 5, 196, 48, 2, 10, 20, 30);
        assertEquals(Pen.ColorMode.XTERM256, pen.getFgMode());
        assertEquals(196, pen.getFgIndex());
        assertEquals(BuiltinPalette.XTERM256.color(196), pen.getFg());
        assertEquals(Pen.ColorMode.TRUECOLOR, pen.getBgMode());
        assertEquals(Rgb.of(10, 20, 30), pen.getBg());
        assertTrue(pen.sawXterm256());
        assertTrue(pen.sawTrueColor());
    }

    @Test
    void reset_keepsExtendedColorHistory() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 38, 5, 100, 0);
        assertEquals(Pen.ColorMode.PALETTE16, pen.getFgMode());
        assertEquals(7, pen.getFgIndex());
        assertTrue(pen.sawXterm256());
    }

    @Test
    void defaultColorCodes_resetOneChannel() {
        Pen pen = sgr(Pen.defaults(ICE), ICE, 31, 44, 39);
        assertEquals(7, pen.getFgIndex());
        assertEquals(4, pen.getBgIndex());
        pen = sgr(pen, ICE, 49);
        assertEquals(0, pen.getBgIndex());
    }

    @Test
    void unknownEvent_returnsSamePen() {
        Pen pen = Pen.defaults(ICE);
        assertSame(pen, pen.apply(SgrEvent.of(SgrEvent.Kind.UNKNOWN), ICE));
    }
}

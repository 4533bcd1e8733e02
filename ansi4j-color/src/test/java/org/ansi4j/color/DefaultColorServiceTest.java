package org.ansi4j.color;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultColorServiceTest {

    private final DefaultColorService service = new DefaultColorService();

    @Test
    void toIndex_unsetMapsToSentinel() {
        assertEquals(ColorService.UNSET_INDEX, service.toIndex(BuiltinPalette.VGA16, Rgb.UNSET));
        assertEquals(Rgb.UNSET, service.toRgb(BuiltinPalette.VGA16, ColorService.UNSET_INDEX));
    }

    @Test
    void toIndex_exactColorsRoundTrip() {
        for (int i = 0; i < 16; i++) {
            assertEquals(i, service.toIndex(BuiltinPalette.VGA16, service.toRgb(BuiltinPalette.VGA16, i)));
        }
    }

    @Test
    void toIndex_tiesGoToLowestIndex() {
        // pure black is both xterm 0 and cube entry 16
        assertEquals(0, service.toIndex(BuiltinPalette.XTERM256, Rgb.of(0, 0, 0)));
        assertEquals(15, service.toIndex(BuiltinPalette.XTERM256, Rgb.of(255, 255, 255)));
    }

    @Test
    void toIndex_picksNearest() {
        assertEquals(4, service.toIndex(BuiltinPalette.VGA16, Rgb.of(0, 0, 150)));
        assertEquals(12, service.toIndex(BuiltinPalette.VGA16, Rgb.of(80, 80, 240)));
    }

    @Test
    void remap_derivedSafePaletteMapsToParentOffset() {
        RemapTable table = service.remap(BuiltinPalette.XTERM240_SAFE, BuiltinPalette.XTERM256);
        assertEquals(16, table.map(0));
        assertEquals(255, table.map(239));
        assertEquals(ColorService.UNSET_INDEX, table.map(240));
    }

    @Test
    void remap_isCachedPerPair() {
        RemapTable first = service.remap(BuiltinPalette.XTERM256, BuiltinPalette.VGA16);
        assertSame(first, service.remap(BuiltinPalette.XTERM256, BuiltinPalette.VGA16));
        assertNotSame(first, service.remap(BuiltinPalette.VGA16, BuiltinPalette.XTERM256));
    }

    @Test
    void remap_vga16ToXterm240SafeAvoidsSystemColors() {
        RemapTable table = service.remap(BuiltinPalette.VGA16, BuiltinPalette.XTERM240_SAFE);
        for (int i = 0; i < 16; i++) {
            int mapped = table.map(i);
            assertTrue(mapped >= 0 && mapped < 240);
        }
        // white lands on the cube corner 231 (index 215 of the safe palette)
        assertEquals(215, table.map(15));
    }
}

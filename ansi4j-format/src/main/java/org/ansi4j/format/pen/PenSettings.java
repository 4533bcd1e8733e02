package org.ansi4j.format.pen;

import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.color.Rgb;

/**
 * Conventions a {@link Pen} is applied under.
 *
 * @param iceColors      SGR 5 arms a bright-background latch instead of blinking
 * @param defaultFg      color for SGR 0/39, or {@link Rgb#UNSET} for VGA light gray
 * @param defaultBg      color for SGR 0/49, or {@link Rgb#UNSET} for VGA black
 * @param defaultBgUnset SGR 0/49 leave the background unset instead of painting it
 */
public record PenSettings(boolean iceColors, int defaultFg, int defaultBg, boolean defaultBgUnset) {

    public static final PenSettings DEFAULTS = new PenSettings(true, Rgb.UNSET, Rgb.UNSET, false);

    public int resolvedDefaultFg() {
        return Rgb.isSet(defaultFg) ? defaultFg : BuiltinPalette.VGA16.color(Pen.DEFAULT_FG_INDEX);
    }

    public int resolvedDefaultBg() {
        if (defaultBgUnset) {
            return Rgb.UNSET;
        }
        return Rgb.isSet(defaultBg) ? defaultBg : BuiltinPalette.VGA16.color(Pen.DEFAULT_BG_INDEX);
    }
}

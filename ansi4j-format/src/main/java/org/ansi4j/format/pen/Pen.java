package org.ansi4j.format.pen;

import org.ansi4j.canvas.Attrs;
import org.ansi4j.color.BuiltinPalette;

import java.util.List;
import java.util.Objects;

/**
 * Current color and attribute state while decoding or encoding a stream. Immutable: every
 * {@link SgrEvent} produces a new pen.
 * <p>
 * Two latches record brightness shifts that came from a convention rather than an explicit
 * color: {@code fgBrightFromBold} (SGR 1 moved a low foreground index up by 8) and
 * {@code bgBrightFromIce} (the iCE latch moved a low background index up by 8). A latch is only
 * set while its shift is applied, so clearing the source undoes exactly that shift.
 */
public final class Pen {

    public static final int DEFAULT_FG_INDEX = 7;
    public static final int DEFAULT_BG_INDEX = 0;

    public enum ColorMode {
        PALETTE16,
        XTERM256,
        TRUECOLOR
    }

    private final boolean bold;
    private final boolean dim;
    private final boolean italic;
    private final boolean underline;
    private final boolean blink;
    private final boolean inverse;
    private final boolean strikethrough;
    private final boolean fgBrightFromBold;
    private final boolean iceBg;
    private final boolean bgBrightFromIce;
    private final ColorMode fgMode;
    private final ColorMode bgMode;
    private final int fgIndex;
    private final int bgIndex;
    private final int fg;
    private final int bg;
    private final boolean sawXterm256;
    private final boolean sawTrueColor;

    private Pen(Draft d) {
        this.bold = d.bold;
        this.dim = d.dim;
        this.italic = d.italic;
        this.underline = d.underline;
        this.blink = d.blink;
        this.inverse = d.inverse;
        this.strikethrough = d.strikethrough;
        this.fgBrightFromBold = d.fgBrightFromBold;
        this.iceBg = d.iceBg;
        this.bgBrightFromIce = d.bgBrightFromIce;
        this.fgMode = d.fgMode;
        this.bgMode = d.bgMode;
        this.fgIndex = d.fgIndex;
        this.bgIndex = d.bgIndex;
        this.fg = d.fg;
        this.bg = d.bg;
        this.sawXterm256 = d.sawXterm256;
        this.sawTrueColor = d.sawTrueColor;
    }

    /**
     * Pen after a full reset: light gray on black (or unset background), no attributes.
     */
    public static Pen defaults(PenSettings settings) {
        Draft d = new Draft();
        d.resetAll(settings);
        return new Pen(d);
    }

    public Pen apply(SgrEvent event, PenSettings settings) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(settings, "settings");
        if (event.kind() == SgrEvent.Kind.UNKNOWN) {
            return this;
        }
        Draft d = new Draft(this);
        int v = event.value();
        switch (event.kind()) {
            case RESET -> d.resetAll(settings);
            case BOLD -> {
                if (d.fgMode == ColorMode.PALETTE16 && d.fgIndex >= 0 && d.fgIndex < 8) {
                    d.setFg16(d.fgIndex + 8);
                    d.fgBrightFromBold = true;
                }
                d.bold = true;
            }
            case DIM -> d.dim = true;
            case ITALIC -> d.italic = true;
            case UNDERLINE -> d.underline = true;
            case BLINK -> {
                if (settings.iceColors() && d.bgMode == ColorMode.PALETTE16) {
                    d.iceBg = true;
                    if (d.bgIndex >= 0 && d.bgIndex < 8) {
                        d.setBg16(d.bgIndex + 8);
                        d.bgBrightFromIce = true;
                    } else {
                        d.bgBrightFromIce = false;
                    }
                    d.blink = false;
                } else {
                    d.blink = true;
                }
            }
            case INVERSE -> d.inverse = true;
            case STRIKETHROUGH -> d.strikethrough = true;
            case NORMAL_INTENSITY -> {
                if (d.fgBrightFromBold && d.fgMode == ColorMode.PALETTE16 && d.fgIndex >= 8 && d.fgIndex < 16) {
                    d.setFg16(d.fgIndex - 8);
                }
                d.bold = false;
                d.dim = false;
                d.fgBrightFromBold = false;
            }
            case ITALIC_OFF -> d.italic = false;
            case UNDERLINE_OFF -> d.underline = false;
            case BLINK_OFF -> {
                if (d.iceBg && settings.iceColors()) {
                    d.iceBg = false;
                    if (d.bgBrightFromIce && d.bgMode == ColorMode.PALETTE16 && d.bgIndex >= 8 && d.bgIndex < 16) {
                        d.setBg16(d.bgIndex - 8);
                    }
                    d.bgBrightFromIce = false;
                }
                d.blink = false;
            }
            case INVERSE_OFF -> d.inverse = false;
            case STRIKETHROUGH_OFF -> d.strikethrough = false;
            case DEFAULT_FG -> d.resetFg(settings);
            case DEFAULT_BG -> d.resetBg(settings);
            case FG_16 -> {
                if (d.bold) {
                    d.setFg16(v + 8);
                    d.fgBrightFromBold = true;
                } else {
                    d.setFg16(v);
                    d.fgBrightFromBold = false;
                }
            }
            case FG_BRIGHT -> {
                d.setFg16(v);
                d.fgBrightFromBold = false;
            }
            case BG_16 -> {
                if (d.iceBg && settings.iceColors()) {
                    d.setBg16(v + 8);
                    d.bgBrightFromIce = true;
                } else {
                    d.setBg16(v);
                    d.bgBrightFromIce = false;
                }
            }
            case BG_BRIGHT -> {
                d.setBg16(v);
                d.bgBrightFromIce = false;
            }
            case FG_256 -> {
                d.fgMode = ColorMode.XTERM256;
                d.fgIndex = v;
                d.fg = BuiltinPalette.XTERM256.color(v);
                d.fgBrightFromBold = false;
                d.sawXterm256 = true;
            }
            case BG_256 -> {
                d.bgMode = ColorMode.XTERM256;
                d.bgIndex = v;
                d.bg = BuiltinPalette.XTERM256.color(v);
                d.bgBrightFromIce = false;
                d.sawXterm256 = true;
            }
            case FG_RGB -> {
                d.fgMode = ColorMode.TRUECOLOR;
                d.fg = v;
                d.fgBrightFromBold = false;
                d.sawTrueColor = true;
            }
            case BG_RGB -> {
                d.bgMode = ColorMode.TRUECOLOR;
                d.bg = v;
                d.bgBrightFromIce = false;
                d.sawTrueColor = true;
            }
            default -> {
                return this;
            }
        }
        return new Pen(d);
    }

    public Pen applyAll(List<SgrEvent> events, PenSettings settings) {
        Pen pen = this;
        for (SgrEvent event : events) {
            pen = pen.apply(event, settings);
        }
        return pen;
    }

    /**
     * Attribute bits for a cell written with this pen.
     */
    public int attrs() {
        int a = Attrs.NONE;
        if (bold) a |= Attrs.BOLD;
        if (dim) a |= Attrs.DIM;
        if (italic) a |= Attrs.ITALIC;
        if (underline) a |= Attrs.UNDERLINE;
        if (blink) a |= Attrs.BLINK;
        if (inverse) a |= Attrs.REVERSE;
        if (strikethrough) a |= Attrs.STRIKETHROUGH;
        return a;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isDim() {
        return dim;
    }

    public boolean isItalic() {
        return italic;
    }

    public boolean isUnderline() {
        return underline;
    }

    public boolean isBlink() {
        return blink;
    }

    public boolean isInverse() {
        return inverse;
    }

    public boolean isStrikethrough() {
        return strikethrough;
    }

    public boolean isFgBrightFromBold() {
        return fgBrightFromBold;
    }

    /** Whether the iCE bright-background latch is armed. */
    public boolean isIceBg() {
        return iceBg;
    }

    public boolean isBgBrightFromIce() {
        return bgBrightFromIce;
    }

    public ColorMode getFgMode() {
        return fgMode;
    }

    public ColorMode getBgMode() {
        return bgMode;
    }

    public int getFgIndex() {
        return fgIndex;
    }

    public int getBgIndex() {
        return bgIndex;
    }

    /** Resolved foreground as a packed color. */
    public int getFg() {
        return fg;
    }

    /** Resolved background as a packed color; may be unset. */
    public int getBg() {
        return bg;
    }

    public boolean sawXterm256() {
        return sawXterm256;
    }

    public boolean sawTrueColor() {
        return sawTrueColor;
    }

    @Override
    public String toString() {
        return "Pen{" +
                "fg=" + fgMode + ":" + fgIndex +
                ", bg=" + bgMode + ":" + bgIndex +
                ", attrs=" + attrs() +
                ", fgBrightFromBold=" + fgBrightFromBold +
                ", iceBg=" + iceBg +
                ", bgBrightFromIce=" + bgBrightFromIce +
                '}';
    }

    private static final class Draft {
        boolean bold;
        boolean dim;
        boolean italic;
        boolean underline;
        boolean blink;
        boolean inverse;
        boolean strikethrough;
        boolean fgBrightFromBold;
        boolean iceBg;
        boolean bgBrightFromIce;
        ColorMode fgMode;
        ColorMode bgMode;
        int fgIndex;
        int bgIndex;
        int fg;
        int bg;
        boolean sawXterm256;
        boolean sawTrueColor;

        Draft() {
        }

        Draft(Pen p) {
            bold = p.bold;
            dim = p.dim;
            italic = p.italic;
            underline = p.underline;
            blink = p.blink;
            inverse = p.inverse;
            strikethrough = p.strikethrough;
            fgBrightFromBold = p.fgBrightFromBold;
            iceBg = p.iceBg;
            bgBrightFromIce = p.bgBrightFromIce;
            fgMode = p.fgMode;
            bgMode = p.bgMode;
            fgIndex = p.fgIndex;
            bgIndex = p.bgIndex;
            fg = p.fg;
            bg = p.bg;
            sawXterm256 = p.sawXterm256;
            sawTrueColor = p.sawTrueColor;
        }

        // Extended-color sightings describe the document and survive resets.
        void resetAll(PenSettings settings) {
            bold = false;
            dim = false;
            italic = false;
            underline = false;
            blink = false;
            inverse = false;
            strikethrough = false;
            iceBg = false;
            resetFg(settings);
            resetBg(settings);
        }

        void resetFg(PenSettings settings) {
            fgMode = ColorMode.PALETTE16;
            fgIndex = DEFAULT_FG_INDEX;
            fg = settings.resolvedDefaultFg();
            fgBrightFromBold = false;
        }

        void resetBg(PenSettings settings) {
            bgMode = ColorMode.PALETTE16;
            bgIndex = DEFAULT_BG_INDEX;
            bg = settings.resolvedDefaultBg();
            bgBrightFromIce = false;
        }

        void setFg16(int index) {
            fgMode = ColorMode.PALETTE16;
            fgIndex = index;
            fg = BuiltinPalette.VGA16.color(index);
        }

        void setBg16(int index) {
            bgMode = ColorMode.PALETTE16;
            bgIndex = index;
            bg = BuiltinPalette.VGA16.color(index);
        }
    }
}

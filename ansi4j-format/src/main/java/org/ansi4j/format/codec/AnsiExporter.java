package org.ansi4j.format.codec;

import org.ansi4j.canvas.Attrs;
import org.ansi4j.canvas.CanvasDocument;
import org.ansi4j.canvas.CellValue;
import org.ansi4j.canvas.GlyphId;
import org.ansi4j.charset.Utf8Codec;
import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.color.ColorService;
import org.ansi4j.color.DefaultColorService;
import org.ansi4j.color.RemapTable;
import org.ansi4j.color.Rgb;
import org.ansi4j.format.codec.ExportOptions.AttributeMode;
import org.ansi4j.format.codec.ExportOptions.BrightMode;
import org.ansi4j.format.codec.ExportOptions.ColorMode;
import org.ansi4j.sauce.MetadataTrailerCodec;
import org.ansi4j.sauce.SauceCodec;
import org.ansi4j.sauce.SauceDataType;
import org.ansi4j.sauce.SauceRecord;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encodes a {@link CanvasDocument} as an ANSI art byte stream.
 * <p>
 * Each cell's wanted state is diffed against the state last written, so only the SGR
 * parameters that change are emitted. Color lookups that cannot be resolved fall back to
 * index 7 (foreground) or 0 (background); export itself never fails.
 */
public final class AnsiExporter {

    private static final Logger LOG = Logger.getLogger(AnsiExporter.class.getName());

    private static final String ESC = "\u001B[";
    private static final String CSI_CLEAR_SCREEN = ESC + "2J";
    private static final String CSI_HOME = ESC + "H";
    private static final String SGR_RESET = ESC + "0m";

    private static final int FALLBACK_FG = 7;
    private static final int FALLBACK_BG = 0;

    private final ColorService colors;
    private final MetadataTrailerCodec trailerCodec;

    public AnsiExporter() {
        this(new DefaultColorService(), new SauceCodec());
    }

    public AnsiExporter(ColorService colors, MetadataTrailerCodec trailerCodec) {
        this.colors = Objects.requireNonNull(colors, "colors");
        this.trailerCodec = Objects.requireNonNull(trailerCodec, "trailerCodec");
    }

    public byte[] export(CanvasDocument document, ExportOptions options) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");
        return new Encoder(document, options).run();
    }

    /**
     * Sample one cell the way export sees it. Packed colors are resolved only for the
     * truecolor modes.
     */
    ExportCell sample(CanvasDocument document, ExportOptions options, int row, int col) {
        CellValue v = options.getSource() == ExportOptions.Source.COMPOSITE
            ? document.getCompositeCell(row, col)
            : document.getLayerCell(document.getActiveLayer(), row, col);
        int fg = Rgb.UNSET;
        int bg = Rgb.UNSET;
        if (options.getColorMode() == ColorMode.TRUECOLOR_SGR || options.getColorMode() == ColorMode.PABLO_T) {
            if (v.hasFg()) fg = colors.toRgb(document.getPalette(), v.fg());
            if (v.hasBg()) bg = colors.toRgb(document.getPalette(), v.bg());
        }
        return new ExportCell(v.glyph(), GlyphId.toUnicodeRepresentative(v.glyph()),
            v.fg(), v.bg(), fg, bg, v.attrs());
    }

    static int digits(int v) {
        int n = 1;
        while (v >= 10) {
            v /= 10;
            n++;
        }
        return n;
    }

    /**
     * SGR state as last written to the output.
     */
    private static final class EmittedPen {
        boolean bold;
        boolean dim;
        boolean italic;
        boolean underline;
        boolean blink;
        boolean inverse;
        boolean strikethrough;
        boolean hasFg;
        boolean hasBg;
        /** Last foreground came from a {@code ...t} overlay. */
        boolean fgTc;
        boolean bgTc;
        int fgIndex = 7;
        int bgIndex = 0;
        int fg = Rgb.UNSET;
        int bg = Rgb.UNSET;
    }

    /**
     * State of one export pass.
     */
    private final class Encoder {
        private final CanvasDocument doc;
        private final ExportOptions opt;
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final BuiltinPalette source;
        private final RemapTable toVga16;
        private final RemapTable toXterm256;
        private final RemapTable toXterm240;
        private final int defaultFgXterm;
        private final int defaultBgXterm;
        private final int defaultFgXterm240;
        private final int defaultBgXterm240;
        private final int defaultFgColor;
        private final int defaultBgColor;
        private EmittedPen pen = new EmittedPen();

        Encoder(CanvasDocument doc, ExportOptions opt) {
            this.doc = doc;
            this.opt = opt;
            this.source = doc.getPalette();
            this.toVga16 = colors.remap(source, BuiltinPalette.VGA16);
            this.toXterm256 = colors.remap(source, BuiltinPalette.XTERM256);
            this.toXterm240 = opt.isXterm240Safe() ? colors.remap(source, BuiltinPalette.XTERM240_SAFE) : null;

            boolean fgSet = Rgb.isSet(opt.getDefaultFg());
            boolean bgSet = Rgb.isSet(opt.getDefaultBg());
            this.defaultFgColor = fgSet ? opt.getDefaultFg() : BuiltinPalette.XTERM256.color(7);
            this.defaultBgColor = bgSet ? opt.getDefaultBg() : BuiltinPalette.XTERM256.color(0);
            this.defaultFgXterm = fgSet ? colorToXterm256(opt.getDefaultFg(), 7) : 7;
            this.defaultBgXterm = bgSet ? colorToXterm256(opt.getDefaultBg(), 0) : 0;
            this.defaultFgXterm240 = opt.isXterm240Safe() ? colorToXterm240(defaultFgColor, 16) : 7;
            this.defaultBgXterm240 = opt.isXterm240Safe() ? colorToXterm240(defaultBgColor, 16) : 0;
        }

        byte[] run() {
            int cols = Math.max(1, doc.getColumns());
            int rows = Math.max(1, doc.getRows());

            if (opt.getTextEncoding() == ExportOptions.TextEncoding.UTF8_BOM) {
                Utf8Codec.encode(Utf8Codec.BOM, out);
            }
            switch (opt.getScreenPrep()) {
                case CLEAR -> ascii(CSI_CLEAR_SCREEN);
                case HOME -> ascii(CSI_HOME);
                case CLEAR_AND_HOME -> ascii(CSI_CLEAR_SCREEN + CSI_HOME);
                case NONE -> {
                }
            }

            for (int y = 0; y < rows; y++) {
                int xEnd = opt.isPreserveLineLength() ? cols - 1 : lastInterestingColumn(y, cols);
                int x = 0;
                while (x <= xEnd) {
                    ExportCell c = sample(doc, opt, y, x);
                    if (opt.isCompress() && opt.isUseCursorForward() && isSkippable(c)) {
                        int run = 1;
                        while (x + run <= xEnd && isSkippable(sample(doc, opt, y, x + run))) {
                            run++;
                        }
                        if (3 + digits(run) < run) {
                            restoreDefaultsBeforeSkip();
                            ascii(ESC + run + "C");
                            x += run;
                            continue;
                        }
                    }
                    ensureSgr(c);
                    writeGlyph(c);
                    x++;
                }
                ascii(opt.getNewline() == ExportOptions.Newline.CRLF ? "\r\n" : "\n");
            }

            if (opt.isFinalReset()) {
                reset();
            }

            byte[] payload = out.toByteArray();
            if (!opt.isWriteSauce()) {
                return payload;
            }
            return trailerCodec.write(payload, sauceRecord(payload.length, cols, rows), opt.getSauceWriteOptions());
        }

        private SauceRecord sauceRecord(int fileSize, int cols, int rows) {
            SauceRecord meta = doc.getSauce().orElseGet(() -> SauceRecord.builder().build());
            return meta.toBuilder()
                .fileSize(fileSize)
                .dataType(SauceDataType.CHARACTER)
                .fileType(1)
                .tinfo1(Math.min(cols, 0xFFFF))
                .tinfo2(Math.min(rows, 0xFFFF))
                .build();
        }

        private int lastInterestingColumn(int y, int cols) {
            for (int x = cols - 1; x >= 0; x--) {
                ExportCell c = sample(doc, opt, y, x);
                if (!GlyphId.isBlankish(c.glyph()) || !bgDefaultish(c) || c.attrs() != 0) {
                    return x;
                }
            }
            return -1;
        }

        private boolean isSkippable(ExportCell c) {
            return GlyphId.isBlank(c.glyph()) && bgDefaultish(c) && c.attrs() == 0;
        }

        private boolean bgDefaultish(ExportCell c) {
            if (c.bgUnset()) {
                return true;
            }
            return switch (opt.getColorMode()) {
                case TRUECOLOR_SGR, PABLO_T -> wantBg(c) == defaultBgColor;
                case ANSI16 -> remapVga16(c.bgIndex(), FALLBACK_BG) == 0;
                case XTERM256 -> {
                    int def = opt.isXterm240Safe() ? defaultBgXterm240 : defaultBgXterm;
                    yield remapXterm(c.bgIndex(), def) == def;
                }
            };
        }

        private void restoreDefaultsBeforeSkip() {
            if (opt.getColorMode() == ColorMode.ANSI16) {
                if (pen.hasBg && pen.bgIndex != 0) {
                    reset();
                }
                return;
            }
            Params p = new Params();
            if (pen.hasFg && opt.isUseDefaultFg39()) {
                p.add(39);
                pen.hasFg = false;
            }
            if (pen.hasBg && opt.isUseDefaultBg49()) {
                p.add(49);
                pen.hasBg = false;
            }
            sgr(p);
        }

        private void ensureSgr(ExportCell c) {
            int allowed = opt.getAttributeMode() == AttributeMode.CLASSIC_DOS
                ? Attrs.BOLD | Attrs.BLINK | Attrs.REVERSE
                : Attrs.ALL;
            int want = c.attrs() & allowed;
            switch (opt.getColorMode()) {
                case PABLO_T -> ensurePabloT(c, want);
                case ANSI16 -> ensureAnsi16(c, want);
                default -> ensureModern(c, want);
            }
        }

        private void ensureAnsi16(ExportCell c, int want) {
            int fg16 = c.fgUnset() ? FALLBACK_FG : remapVga16(c.fgIndex(), FALLBACK_FG);
            int bg16 = c.bgUnset() ? FALLBACK_BG : remapVga16(c.bgIndex(), FALLBACK_BG);
            boolean wantInverse = Attrs.has(want, Attrs.REVERSE);

            boolean wantBold16 = false;
            boolean wantBlink16 = false;
            int fgBase = fg16;
            int bgBase = bg16;
            if (opt.getBrightMode() == BrightMode.BOLD_AND_ICE_BLINK) {
                if (fgBase >= 8) {
                    wantBold16 = true;
                    fgBase -= 8;
                }
                if (opt.isIceColors() && bgBase >= 8) {
                    wantBlink16 = true;
                    bgBase -= 8;
                }
                // Without iCE there is no bright background to select.
                bgBase &= 7;
            }

            if ((pen.bold && !wantBold16) || (pen.blink && !wantBlink16)) {
                reset();
            }

            Params p = new Params();
            if (wantInverse && !pen.inverse) p.add(7);
            if (!wantInverse && pen.inverse) p.add(27);

            boolean fgChanged = pen.fgTc || !pen.hasFg || pen.fgIndex != fg16;
            boolean bgChanged = pen.bgTc || !pen.hasBg || pen.bgIndex != bg16;
            if (opt.getBrightMode() == BrightMode.SGR_90_100) {
                if (fgChanged) p.add(fg16 < 8 ? 30 + fg16 : 90 + fg16 - 8);
                if (bgChanged) p.add(bg16 < 8 ? 40 + bg16 : 100 + bg16 - 8);
            } else {
                if (wantBold16 && !pen.bold) p.add(1);
                if (wantBlink16 && !pen.blink) p.add(5);
                if (fgChanged) p.add(30 + fgBase);
                if (bgChanged) p.add(40 + bgBase);
            }
            sgr(p);

            pen.bold = wantBold16;
            pen.blink = wantBlink16;
            pen.inverse = wantInverse;
            pen.hasFg = true;
            pen.hasBg = true;
            pen.fgIndex = fg16;
            pen.bgIndex = bg16;
            pen.fgTc = false;
            pen.bgTc = false;
        }

        private void ensurePabloT(ExportCell c, int want) {
            int wantFg = c.fgUnset() ? defaultFgColor : wantFg(c);
            int wantBg = c.bgUnset() ? defaultBgColor : wantBg(c);

            Params resets = new Params();
            if (c.fgUnset() && opt.isUseDefaultFg39() && (pen.hasFg || pen.fgTc)) {
                resets.add(39);
                pen.hasFg = false;
                pen.fgTc = false;
            }
            if (c.bgUnset() && opt.isUseDefaultBg49() && (pen.hasBg || pen.bgTc)) {
                resets.add(49);
                pen.hasBg = false;
                pen.bgTc = false;
            }
            sgr(resets);

            if (opt.isPabloWithAnsi16Fallback()) {
                ensureAnsi16(c, want);
                pen.fg = wantFg;
                pen.bg = wantBg;
                if (!c.fgUnset() && wantFg != BuiltinPalette.VGA16.color(pen.fgIndex)) {
                    pabloColor(1, wantFg);
                    pen.fgTc = true;
                }
                if (!c.bgUnset() && wantBg != BuiltinPalette.VGA16.color(pen.bgIndex)) {
                    pabloColor(0, wantBg);
                    pen.bgTc = true;
                }
                return;
            }

            boolean wantInverse = Attrs.has(want, Attrs.REVERSE);
            if (wantInverse != pen.inverse) {
                ascii(ESC + (wantInverse ? "7" : "27") + "m");
                pen.inverse = wantInverse;
            }
            if (!c.fgUnset() && (!pen.hasFg || pen.fg != wantFg || !pen.fgTc)) {
                pabloColor(1, wantFg);
                pen.hasFg = true;
                pen.fg = wantFg;
                pen.fgTc = true;
            }
            if (!c.bgUnset() && (!pen.hasBg || pen.bg != wantBg || !pen.bgTc)) {
                pabloColor(0, wantBg);
                pen.hasBg = true;
                pen.bg = wantBg;
                pen.bgTc = true;
            }
        }

        private void ensureModern(ExportCell c, int want) {
            Params p = new Params();
            boolean wantBold = Attrs.has(want, Attrs.BOLD);
            boolean wantDim = Attrs.has(want, Attrs.DIM);
            boolean wantItalic = Attrs.has(want, Attrs.ITALIC);
            boolean wantUnderline = Attrs.has(want, Attrs.UNDERLINE);
            boolean wantBlink = Attrs.has(want, Attrs.BLINK);
            boolean wantInverse = Attrs.has(want, Attrs.REVERSE);
            boolean wantStrike = Attrs.has(want, Attrs.STRIKETHROUGH);

            // SGR 22 clears bold and dim together.
            if ((pen.bold && !wantBold) || (pen.dim && !wantDim)) {
                p.add(22);
                pen.bold = false;
                pen.dim = false;
            }
            if (wantBold && !pen.bold) {
                p.add(1);
                pen.bold = true;
            }
            if (wantDim && !pen.dim) {
                p.add(2);
                pen.dim = true;
            }
            if (pen.italic != wantItalic) {
                p.add(wantItalic ? 3 : 23);
                pen.italic = wantItalic;
            }
            if (pen.underline != wantUnderline) {
                p.add(wantUnderline ? 4 : 24);
                pen.underline = wantUnderline;
            }
            if (pen.blink != wantBlink) {
                p.add(wantBlink ? 5 : 25);
                pen.blink = wantBlink;
            }
            if (pen.inverse != wantInverse) {
                p.add(wantInverse ? 7 : 27);
                pen.inverse = wantInverse;
            }
            if (pen.strikethrough != wantStrike) {
                p.add(wantStrike ? 9 : 29);
                pen.strikethrough = wantStrike;
            }

            if (c.fgUnset() && opt.isUseDefaultFg39()) {
                if (pen.hasFg) {
                    p.add(39);
                    pen.hasFg = false;
                    pen.fgTc = false;
                }
            } else if (opt.getColorMode() == ColorMode.XTERM256) {
                int def = opt.isXterm240Safe() ? defaultFgXterm240 : defaultFgXterm;
                int idx = c.fgUnset() ? def : remapXterm(c.fgIndex(), def);
                if (!pen.hasFg || pen.fgIndex != idx) {
                    p.add(38).add(5).add(idx);
                    pen.hasFg = true;
                    pen.fgIndex = idx;
                    pen.fgTc = false;
                }
            } else {
                int color = c.fgUnset() ? defaultFgColor : wantFg(c);
                if (!pen.hasFg || pen.fg != color) {
                    p.add(38).add(2).add(Rgb.red(color)).add(Rgb.green(color)).add(Rgb.blue(color));
                    pen.hasFg = true;
                    pen.fg = color;
                    pen.fgTc = false;
                }
            }

            if (c.bgUnset() && opt.isUseDefaultBg49()) {
                if (pen.hasBg) {
                    p.add(49);
                    pen.hasBg = false;
                    pen.bgTc = false;
                }
            } else if (opt.getColorMode() == ColorMode.XTERM256) {
                int def = opt.isXterm240Safe() ? defaultBgXterm240 : defaultBgXterm;
                int idx = c.bgUnset() ? def : remapXterm(c.bgIndex(), def);
                if (!pen.hasBg || pen.bgIndex != idx) {
                    p.add(48).add(5).add(idx);
                    pen.hasBg = true;
                    pen.bgIndex = idx;
                    pen.bgTc = false;
                }
            } else {
                int color = c.bgUnset() ? defaultBgColor : wantBg(c);
                if (!pen.hasBg || pen.bg != color) {
                    p.add(48).add(2).add(Rgb.red(color)).add(Rgb.green(color)).add(Rgb.blue(color));
                    pen.hasBg = true;
                    pen.bg = color;
                    pen.bgTc = false;
                }
            }
            sgr(p);
        }

        private void writeGlyph(ExportCell c) {
            if (opt.getTextEncoding() == ExportOptions.TextEncoding.CP437) {
                int b = '?';
                int g = c.glyph();
                if (GlyphId.isBitmapIndex(g) || GlyphId.isEmbeddedIndex(g)) {
                    int idx = GlyphId.index(g);
                    b = idx <= 0xFF ? idx : '?';
                } else {
                    int mapped = opt.getByteEncoding().fromUnicode(c.codePoint());
                    if (mapped >= 0) b = mapped;
                }
                out.write(b);
                return;
            }
            int cp = c.codePoint();
            Utf8Codec.encode(cp < 0x20 ? ' ' : cp, out);
        }

        private int wantFg(ExportCell c) {
            if (Rgb.isSet(c.fg())) {
                return c.fg();
            }
            LOG.log(Level.FINE, "Foreground index {0} has no color, using default", c.fgIndex());
            return defaultFgColor;
        }

        private int wantBg(ExportCell c) {
            if (c.bgUnset() || Rgb.isSet(c.bg())) {
                return c.bgUnset() ? defaultBgColor : c.bg();
            }
            LOG.log(Level.FINE, "Background index {0} has no color, using default", c.bgIndex());
            return defaultBgColor;
        }

        private int remapVga16(int idx, int fallback) {
            return remap(toVga16, BuiltinPalette.VGA16, idx, fallback, 0);
        }

        private int remapXterm(int idx, int fallback) {
            if (toXterm240 != null) {
                return remap(toXterm240, BuiltinPalette.XTERM240_SAFE, idx, fallback, 16);
            }
            return remap(toXterm256, BuiltinPalette.XTERM256, idx, fallback, 0);
        }

        private int remap(RemapTable table, BuiltinPalette target, int idx, int fallback, int offset) {
            if (idx == ColorService.UNSET_INDEX) {
                return fallback;
            }
            int mapped = table.map(idx);
            if (mapped == ColorService.UNSET_INDEX) {
                mapped = colors.toIndex(target, colors.toRgb(source, idx));
            }
            if (mapped == ColorService.UNSET_INDEX) {
                LOG.log(Level.FINE, "No {0} color for index {1}, using {2}",
                    new Object[] { target.title(), idx, fallback });
                return fallback;
            }
            return mapped + offset;
        }

        private int colorToXterm256(int color, int fallback) {
            int idx = colors.toIndex(BuiltinPalette.XTERM256, color);
            return idx == ColorService.UNSET_INDEX ? fallback : idx;
        }

        private int colorToXterm240(int color, int fallback) {
            int idx = colors.toIndex(BuiltinPalette.XTERM240_SAFE, color);
            return idx == ColorService.UNSET_INDEX ? fallback : 16 + idx;
        }

        private void reset() {
            ascii(SGR_RESET);
            pen = new EmittedPen();
        }

        private void pabloColor(int which, int color) {
            ascii(ESC + which + ";" + Rgb.red(color) + ";" + Rgb.green(color) + ";" + Rgb.blue(color) + "t");
        }

        private void sgr(Params p) {
            if (!p.isEmpty()) {
                ascii(ESC + p + "m");
            }
        }

        private void ascii(String s) {
            out.writeBytes(s.getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * ';'-joined SGR parameter list.
     */
    private static final class Params {
        private final StringBuilder sb = new StringBuilder();

        Params add(int v) {
            if (sb.length() > 0) sb.append(';');
            sb.append(v);
            return this;
        }

        boolean isEmpty() {
            return sb.length() == 0;
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}

package org.ansi4j.format.codec;

import org.ansi4j.charset.ByteEncoding;
import org.ansi4j.color.Rgb;
import org.ansi4j.sauce.SauceWriteOptions;

import java.util.Objects;

/**
 * Export settings. Immutable; derive variants with {@link #toBuilder()}.
 */
public final class ExportOptions {

    public enum TextEncoding {
        /** One byte per cell through {@link ExportOptions#getByteEncoding()}. */
        CP437,
        UTF8,
        UTF8_BOM
    }

    public enum Source {
        /** All visible layers flattened. */
        COMPOSITE,
        ACTIVE_LAYER
    }

    public enum ColorMode {
        /** SGR 30-37/40-47 with bold and iCE blink or 90-97/100-107 for bright colors. */
        ANSI16,
        /** SGR 38;5;n / 48;5;n. */
        XTERM256,
        /** SGR 38;2;r;g;b / 48;2;r;g;b. */
        TRUECOLOR_SGR,
        /** {@code ESC[1;r;g;bt} / {@code ESC[0;r;g;bt}, optionally over a 16-color baseline. */
        PABLO_T
    }

    public enum AttributeMode {
        /** Only bold, blink and reverse survive. */
        CLASSIC_DOS,
        MODERN
    }

    public enum BrightMode {
        /** Bright foreground as bold, bright background as blink (with iCE colors). */
        BOLD_AND_ICE_BLINK,
        /** Bright colors as SGR 90-97 and 100-107. */
        SGR_90_100
    }

    public enum Newline {
        CRLF,
        LF
    }

    public enum ScreenPrep {
        NONE,
        CLEAR,
        HOME,
        CLEAR_AND_HOME
    }

    public static final ExportOptions DEFAULTS = builder().build();

    private final TextEncoding textEncoding;
    private final ByteEncoding byteEncoding;
    private final Source source;
    private final ColorMode colorMode;
    private final AttributeMode attributeMode;
    private final BrightMode brightMode;
    private final boolean iceColors;
    private final boolean xterm240Safe;
    private final int defaultFg;
    private final int defaultBg;
    private final Newline newline;
    private final ScreenPrep screenPrep;
    private final boolean preserveLineLength;
    private final boolean compress;
    private final boolean useCursorForward;
    private final boolean finalReset;
    private final boolean useDefaultFg39;
    private final boolean useDefaultBg49;
    private final boolean pabloWithAnsi16Fallback;
    private final boolean writeSauce;
    private final SauceWriteOptions sauceWriteOptions;

    private ExportOptions(Builder b) {
        this.textEncoding = b.textEncoding;
        this.byteEncoding = b.byteEncoding;
        this.source = b.source;
        this.colorMode = b.colorMode;
        this.attributeMode = b.attributeMode;
        this.brightMode = b.brightMode;
        this.iceColors = b.iceColors;
        this.xterm240Safe = b.xterm240Safe;
        this.defaultFg = b.defaultFg;
        this.defaultBg = b.defaultBg;
        this.newline = b.newline;
        this.screenPrep = b.screenPrep;
        this.preserveLineLength = b.preserveLineLength;
        this.compress = b.compress;
        this.useCursorForward = b.useCursorForward;
        this.finalReset = b.finalReset;
        this.useDefaultFg39 = b.useDefaultFg39;
        this.useDefaultBg49 = b.useDefaultBg49;
        this.pabloWithAnsi16Fallback = b.pabloWithAnsi16Fallback;
        this.writeSauce = b.writeSauce;
        this.sauceWriteOptions = b.sauceWriteOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.textEncoding = textEncoding;
        b.byteEncoding = byteEncoding;
        b.source = source;
        b.colorMode = colorMode;
        b.attributeMode = attributeMode;
        b.brightMode = brightMode;
        b.iceColors = iceColors;
        b.xterm240Safe = xterm240Safe;
        b.defaultFg = defaultFg;
        b.defaultBg = defaultBg;
        b.newline = newline;
        b.screenPrep = screenPrep;
        b.preserveLineLength = preserveLineLength;
        b.compress = compress;
        b.useCursorForward = useCursorForward;
        b.finalReset = finalReset;
        b.useDefaultFg39 = useDefaultFg39;
        b.useDefaultBg49 = useDefaultBg49;
        b.pabloWithAnsi16Fallback = pabloWithAnsi16Fallback;
        b.writeSauce = writeSauce;
        b.sauceWriteOptions = sauceWriteOptions;
        return b;
    }

    public TextEncoding getTextEncoding() {
        return textEncoding;
    }

    public ByteEncoding getByteEncoding() {
        return byteEncoding;
    }

    public Source getSource() {
        return source;
    }

    public ColorMode getColorMode() {
        return colorMode;
    }

    public AttributeMode getAttributeMode() {
        return attributeMode;
    }

    public BrightMode getBrightMode() {
        return brightMode;
    }

    public boolean isIceColors() {
        return iceColors;
    }

    /** In {@link ColorMode#XTERM256}, quantize into 16..255 only. */
    public boolean isXterm240Safe() {
        return xterm240Safe;
    }

    public int getDefaultFg() {
        return defaultFg;
    }

    public int getDefaultBg() {
        return defaultBg;
    }

    public Newline getNewline() {
        return newline;
    }

    public ScreenPrep getScreenPrep() {
        return screenPrep;
    }

    /** Emit every column instead of trimming trailing blank cells. */
    public boolean isPreserveLineLength() {
        return preserveLineLength;
    }

    public boolean isCompress() {
        return compress;
    }

    /** With {@link #isCompress()}, replace runs of blank cells by {@code ESC[nC}. */
    public boolean isUseCursorForward() {
        return useCursorForward;
    }

    public boolean isFinalReset() {
        return finalReset;
    }

    public boolean isUseDefaultFg39() {
        return useDefaultFg39;
    }

    public boolean isUseDefaultBg49() {
        return useDefaultBg49;
    }

    public boolean isPabloWithAnsi16Fallback() {
        return pabloWithAnsi16Fallback;
    }

    public boolean isWriteSauce() {
        return writeSauce;
    }

    public SauceWriteOptions getSauceWriteOptions() {
        return sauceWriteOptions;
    }

    @Override
    public String toString() {
        return "ExportOptions{" +
                "textEncoding=" + textEncoding +
                ", colorMode=" + colorMode +
                ", attributeMode=" + attributeMode +
                ", brightMode=" + brightMode +
                ", iceColors=" + iceColors +
                ", xterm240Safe=" + xterm240Safe +
                ", defaultFg=" + Rgb.toHex(defaultFg) +
                ", defaultBg=" + Rgb.toHex(defaultBg) +
                ", newline=" + newline +
                ", screenPrep=" + screenPrep +
                ", preserveLineLength=" + preserveLineLength +
                ", compress=" + compress +
                ", useCursorForward=" + useCursorForward +
                ", writeSauce=" + writeSauce +
                '}';
    }

    public static final class Builder {
        private TextEncoding textEncoding = TextEncoding.CP437;
        private ByteEncoding byteEncoding = ByteEncoding.CP437;
        private Source source = Source.COMPOSITE;
        private ColorMode colorMode = ColorMode.ANSI16;
        private AttributeMode attributeMode = AttributeMode.CLASSIC_DOS;
        private BrightMode brightMode = BrightMode.BOLD_AND_ICE_BLINK;
        private boolean iceColors = true;
        private boolean xterm240Safe;
        private int defaultFg = Rgb.UNSET;
        private int defaultBg = Rgb.UNSET;
        private Newline newline = Newline.CRLF;
        private ScreenPrep screenPrep = ScreenPrep.NONE;
        private boolean preserveLineLength;
        private boolean compress = true;
        private boolean useCursorForward;
        private boolean finalReset = true;
        private boolean useDefaultFg39 = true;
        private boolean useDefaultBg49 = true;
        private boolean pabloWithAnsi16Fallback = true;
        private boolean writeSauce;
        private SauceWriteOptions sauceWriteOptions = SauceWriteOptions.DEFAULTS;

        private Builder() {
        }

        public Builder textEncoding(TextEncoding textEncoding) {
            this.textEncoding = Objects.requireNonNull(textEncoding, "textEncoding");
            return this;
        }

        public Builder byteEncoding(ByteEncoding byteEncoding) {
            this.byteEncoding = Objects.requireNonNull(byteEncoding, "byteEncoding");
            return this;
        }

        public Builder source(Source source) {
            this.source = Objects.requireNonNull(source, "source");
            return this;
        }

        public Builder colorMode(ColorMode colorMode) {
            this.colorMode = Objects.requireNonNull(colorMode, "colorMode");
            return this;
        }

        public Builder attributeMode(AttributeMode attributeMode) {
            this.attributeMode = Objects.requireNonNull(attributeMode, "attributeMode");
            return this;
        }

        public Builder brightMode(BrightMode brightMode) {
            this.brightMode = Objects.requireNonNull(brightMode, "brightMode");
            return this;
        }

        public Builder iceColors(boolean iceColors) {
            this.iceColors = iceColors;
            return this;
        }

        public Builder xterm240Safe(boolean xterm240Safe) {
            this.xterm240Safe = xterm240Safe;
            return this;
        }

        public Builder defaultFg(int color) {
            this.defaultFg = color;
            return this;
        }

        public Builder defaultBg(int color) {
            this.defaultBg = color;
            return this;
        }

        public Builder newline(Newline newline) {
            this.newline = Objects.requireNonNull(newline, "newline");
            return this;
        }

        public Builder screenPrep(ScreenPrep screenPrep) {
            this.screenPrep = Objects.requireNonNull(screenPrep, "screenPrep");
            return this;
        }

        public Builder preserveLineLength(boolean preserveLineLength) {
            this.preserveLineLength = preserveLineLength;
            return this;
        }

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder useCursorForward(boolean useCursorForward) {
            this.useCursorForward = useCursorForward;
            return this;
        }

        public Builder finalReset(boolean finalReset) {
            this.finalReset = finalReset;
            return this;
        }

        public Builder useDefaultFg39(boolean useDefaultFg39) {
            this.useDefaultFg39 = useDefaultFg39;
            return this;
        }

        public Builder useDefaultBg49(boolean useDefaultBg49) {
            this.useDefaultBg49 = useDefaultBg49;
            return this;
        }

        public Builder pabloWithAnsi16Fallback(boolean pabloWithAnsi16Fallback) {
            this.pabloWithAnsi16Fallback = pabloWithAnsi16Fallback;
            return this;
        }

        public Builder writeSauce(boolean writeSauce) {
            this.writeSauce = writeSauce;
            return this;
        }

        public Builder sauceWriteOptions(SauceWriteOptions sauceWriteOptions) {
            this.sauceWriteOptions = Objects.requireNonNull(sauceWriteOptions, "sauceWriteOptions");
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(this);
        }
    }
}

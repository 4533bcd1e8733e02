package org.ansi4j.format.codec;

import org.ansi4j.charset.ByteEncoding;
import org.ansi4j.color.Rgb;
import org.ansi4j.format.pen.PenSettings;

import java.util.Objects;

/**
 * Import settings. Immutable; derive variants with {@link #toBuilder()}.
 */
public final class ImportOptions {

    public static final int AUTO_COLUMNS = 0;
    public static final int MAX_COLUMNS = 4096;

    public static final ImportOptions DEFAULTS = builder().build();

    private final int columns;
    private final boolean iceColors;
    private final int defaultFg;
    private final int defaultBg;
    private final boolean defaultBgUnset;
    private final WrapPolicy wrapPolicy;
    private final boolean cp437;
    private final ByteEncoding byteEncoding;
    private final GlyphPolicy glyphPolicy;

    private ImportOptions(Builder b) {
        this.columns = b.columns;
        this.iceColors = b.iceColors;
        this.defaultFg = b.defaultFg;
        this.defaultBg = b.defaultBg;
        this.defaultBgUnset = b.defaultBgUnset;
        this.wrapPolicy = b.wrapPolicy;
        this.cp437 = b.cp437;
        this.byteEncoding = b.byteEncoding;
        this.glyphPolicy = b.glyphPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .columns(columns)
            .iceColors(iceColors)
            .defaultFg(defaultFg)
            .defaultBg(defaultBg)
            .defaultBgUnset(defaultBgUnset)
            .wrapPolicy(wrapPolicy)
            .cp437(cp437)
            .byteEncoding(byteEncoding)
            .glyphPolicy(glyphPolicy);
    }

    /** Explicit column count, or {@link #AUTO_COLUMNS} to detect it. */
    public int getColumns() {
        return columns;
    }

    public boolean isIceColors() {
        return iceColors;
    }

    public int getDefaultFg() {
        return defaultFg;
    }

    public int getDefaultBg() {
        return defaultBg;
    }

    public boolean isDefaultBgUnset() {
        return defaultBgUnset;
    }

    public WrapPolicy getWrapPolicy() {
        return wrapPolicy;
    }

    /**
     * Prefer 8-bit decoding. Detection may still switch to UTF-8; when false, text is always
     * decoded as UTF-8.
     */
    public boolean isCp437() {
        return cp437;
    }

    public ByteEncoding getByteEncoding() {
        return byteEncoding;
    }

    public GlyphPolicy getGlyphPolicy() {
        return glyphPolicy;
    }

    public PenSettings toPenSettings() {
        return new PenSettings(iceColors, defaultFg, defaultBg, defaultBgUnset);
    }

    @Override
    public String toString() {
        return "ImportOptions{" +
                "columns=" + columns +
                ", iceColors=" + iceColors +
                ", defaultFg=" + Rgb.toHex(defaultFg) +
                ", defaultBg=" + Rgb.toHex(defaultBg) +
                ", defaultBgUnset=" + defaultBgUnset +
                ", wrapPolicy=" + wrapPolicy +
                ", cp437=" + cp437 +
                ", byteEncoding=" + byteEncoding +
                ", glyphPolicy=" + glyphPolicy +
                '}';
    }

    public static final class Builder {
        private int columns = AUTO_COLUMNS;
        private boolean iceColors = true;
        private int defaultFg = Rgb.UNSET;
        private int defaultBg = Rgb.UNSET;
        private boolean defaultBgUnset;
        private WrapPolicy wrapPolicy = WrapPolicy.EAGER;
        private boolean cp437 = true;
        private ByteEncoding byteEncoding = ByteEncoding.CP437;
        private GlyphPolicy glyphPolicy = GlyphPolicy.UNICODE;

        private Builder() {
        }

        /**
         * Column count; zero or negative selects detection, larger than {@value #MAX_COLUMNS}
         * is clamped.
         */
        public Builder columns(int columns) {
            this.columns = columns <= 0 ? AUTO_COLUMNS : Math.min(columns, MAX_COLUMNS);
            return this;
        }

        public Builder iceColors(boolean iceColors) {
            this.iceColors = iceColors;
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

        public Builder defaultBgUnset(boolean defaultBgUnset) {
            this.defaultBgUnset = defaultBgUnset;
            return this;
        }

        public Builder wrapPolicy(WrapPolicy wrapPolicy) {
            this.wrapPolicy = Objects.requireNonNull(wrapPolicy, "wrapPolicy");
            return this;
        }

        public Builder cp437(boolean cp437) {
            this.cp437 = cp437;
            return this;
        }

        public Builder byteEncoding(ByteEncoding byteEncoding) {
            this.byteEncoding = Objects.requireNonNull(byteEncoding, "byteEncoding");
            return this;
        }

        public Builder glyphPolicy(GlyphPolicy glyphPolicy) {
            this.glyphPolicy = Objects.requireNonNull(glyphPolicy, "glyphPolicy");
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }
    }
}

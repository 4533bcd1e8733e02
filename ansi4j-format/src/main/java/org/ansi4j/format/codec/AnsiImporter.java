package org.ansi4j.format.codec;

import org.ansi4j.canvas.CanvasSnapshot;
import org.ansi4j.canvas.GlyphId;
import org.ansi4j.charset.BuiltinFontRegistry;
import org.ansi4j.charset.ByteEncoding;
import org.ansi4j.charset.FontInfo;
import org.ansi4j.charset.FontRegistry;
import org.ansi4j.charset.Utf8Codec;
import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.color.ColorService;
import org.ansi4j.color.DefaultColorService;
import org.ansi4j.color.PaletteInference;
import org.ansi4j.color.Rgb;
import org.ansi4j.format.detect.ColumnDetector;
import org.ansi4j.format.detect.EncodingDetector;
import org.ansi4j.format.pen.Pen;
import org.ansi4j.format.pen.PenSettings;
import org.ansi4j.format.pen.SgrEvent;
import org.ansi4j.sauce.MetadataTrailerCodec;
import org.ansi4j.sauce.SauceCodec;
import org.ansi4j.sauce.SauceParsed;
import org.ansi4j.sauce.SauceRecord;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes an ANSI art byte stream into a single-layer {@link CanvasSnapshot}.
 * <p>
 * A Text/Sequence state machine drives a {@link Pen} and writes into {@link CellPlanes}.
 * Malformed input never fails the import: unterminated sequences are dropped and scanning
 * resumes. The only failure is input that is really another container format.
 */
public final class AnsiImporter {

    private static final Logger LOG = Logger.getLogger(AnsiImporter.class.getName());

    static final String XBIN_ERROR = "File appears to be XBin (XBIN header). Use the XBin (.xb) importer.";

    static final String DEFAULT_BITMAP_FONT = "IBM VGA 437";
    static final String DEFAULT_UNICODE_FONT = "unscii-16-full";

    private static final int LF = '\n';
    private static final int CR = '\r';
    private static final int TAB = '\t';
    private static final int SUB = 0x1A;
    private static final int ESC = 0x1B;
    private static final int TAB_WIDTH = 8;

    /** Upper bound on decoded cells; the row limit is this divided by the column count. */
    static final int MAX_CELLS = 1 << 22;

    private static final int TEXT = 0;
    private static final int SEQUENCE = 1;
    private static final int END = 2;

    private final ColorService colors;
    private final FontRegistry fonts;
    private final MetadataTrailerCodec trailerCodec;
    private final EncodingDetector encodingDetector;
    private final ColumnDetector columnDetector;

    public AnsiImporter() {
        this(new DefaultColorService(), new BuiltinFontRegistry(), new SauceCodec());
    }

    public AnsiImporter(ColorService colors, FontRegistry fonts, MetadataTrailerCodec trailerCodec) {
        this.colors = Objects.requireNonNull(colors, "colors");
        this.fonts = Objects.requireNonNull(fonts, "fonts");
        this.trailerCodec = Objects.requireNonNull(trailerCodec, "trailerCodec");
        this.encodingDetector = new EncodingDetector(fonts);
        this.columnDetector = new ColumnDetector(encodingDetector);
    }

    public ImportResult importBytes(byte[] bytes, ImportOptions options) {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(options, "options");
        if (isXBin(bytes)) {
            LOG.log(Level.WARNING, XBIN_ERROR);
            return ImportResult.failure(XBIN_ERROR);
        }

        SauceParsed parsed = trailerCodec.parse(bytes);
        SauceRecord sauce = parsed.getRecord().orElse(null);
        int length = sauce != null ? Math.min(parsed.payloadLength(), bytes.length) : bytes.length;

        ImportOptions opt = options;
        if (sauce != null) {
            Optional<FontInfo> font = fonts.find(sauce.getTinfos());
            if (font.isPresent()) {
                opt = options.toBuilder().byteEncoding(font.get().encoding()).build();
            } else if (!sauce.getTinfos().isEmpty()) {
                LOG.log(Level.FINE, "Unknown SAUCE font {0}", sauce.getTinfos());
            }
        }

        int columns = columnDetector.detect(bytes, length, sauce, opt);
        if (bytes.length == 0) {
            return ImportResult.success(emptySnapshot(columns), !opt.isCp437());
        }

        boolean utf8 = encodingDetector.shouldDecodeAsUtf8(bytes, length, sauce, opt);
        Decoder decoder = new Decoder(opt, columns, !utf8);
        decoder.run(bytes, length);
        CanvasSnapshot snapshot = decoder.finish(sauce != null ? sauce : synthesizeSauce(!utf8));
        LOG.log(Level.FINE, "Imported {0}x{1} ({2})",
            new Object[] { snapshot.getColumns(), snapshot.getRows(), utf8 ? "UTF-8" : opt.getByteEncoding() });
        return ImportResult.success(snapshot, utf8);
    }

    static boolean isXBin(byte[] bytes) {
        return bytes.length >= 5
            && bytes[0] == 'X' && bytes[1] == 'B' && bytes[2] == 'I' && bytes[3] == 'N'
            && bytes[4] == SUB;
    }

    private static SauceRecord synthesizeSauce(boolean decodeCp437) {
        return SauceRecord.builder()
            .tinfos(decodeCp437 ? DEFAULT_BITMAP_FONT : DEFAULT_UNICODE_FONT)
            .build();
    }

    private static CanvasSnapshot emptySnapshot(int columns) {
        int[] glyphs = new int[columns];
        int[] fg = new int[columns];
        int[] bg = new int[columns];
        Arrays.fill(glyphs, GlyphId.SPACE);
        Arrays.fill(fg, ColorService.UNSET_INDEX);
        Arrays.fill(bg, ColorService.UNSET_INDEX);
        return new CanvasSnapshot(columns, 1, BuiltinPalette.VGA16, null, glyphs, fg, bg, new int[columns], null);
    }

    /**
     * State of one decoding pass.
     */
    private final class Decoder {
        private final ImportOptions opt;
        private final PenSettings settings;
        private final int columns;
        private final boolean decodeCp437;
        private final ByteEncoding encoding;
        private final int blankGlyph;
        private final CellPlanes planes;

        private Pen pen;
        private int row;
        private int col;
        private int rowMax;
        private boolean trailingLineFeed;
        private boolean truncated;
        private final int maxRows;
        private int savedRow;
        private int savedCol;

        Decoder(ImportOptions opt, int columns, boolean decodeCp437) {
            this.opt = opt;
            this.settings = opt.toPenSettings();
            this.columns = columns;
            this.decodeCp437 = decodeCp437;
            this.encoding = opt.getByteEncoding();
            this.blankGlyph = decodeCp437 && opt.getGlyphPolicy() == GlyphPolicy.BITMAP_INDEX
                ? GlyphId.ofBitmapIndex(' ')
                : GlyphId.SPACE;
            this.pen = Pen.defaults(settings);
            this.planes = new CellPlanes(columns);
            this.maxRows = Math.max(1, MAX_CELLS / columns);
            planes.ensureRows(1, blankGlyph, pen.getBg());
        }

        void run(byte[] bytes, int length) {
            int state = TEXT;
            int i = 0;
            while (i < length && state != END) {
                int b = bytes[i] & 0xFF;
                if (opt.getWrapPolicy() == WrapPolicy.EAGER
                        && state == TEXT && col == columns && b != LF && b != CR) {
                    row = Math.min(row + 1, maxRows);
                    col = 0;
                }
                if (state == TEXT) {
                    switch (b) {
                        case LF -> {
                            row = Math.min(row + 1, maxRows);
                            col = 0;
                            if (row < maxRows) {
                                trailingLineFeed = row > rowMax;
                                rowMax = Math.max(rowMax, row);
                            }
                            i++;
                        }
                        case CR -> {
                            col = 0;
                            i++;
                        }
                        case TAB -> {
                            int next = Math.min((col / TAB_WIDTH + 1) * TAB_WIDTH, columns);
                            while (col < next) {
                                put(blankGlyph);
                            }
                            i++;
                        }
                        case SUB -> state = END;
                        case ESC -> {
                            if (i + 1 < length && bytes[i + 1] == '[') {
                                state = SEQUENCE;
                                i += 2;
                            } else {
                                i++;
                            }
                        }
                        default -> i = text(bytes, i, length);
                    }
                    continue;
                }

                CsiSequence seq = CsiSequence.scan(bytes, i, length);
                if (!seq.isTerminated()) {
                    LOG.log(Level.FINE, "Abandoned control sequence at offset {0}", i);
                }
                apply(seq);
                state = TEXT;
                i = seq.getNext();
            }
        }

        private int text(byte[] bytes, int i, int length) {
            if (decodeCp437) {
                int raw = bytes[i] & 0xFF;
                if (opt.getGlyphPolicy() == GlyphPolicy.BITMAP_INDEX) {
                    put(GlyphId.ofBitmapIndex(raw < 0x20 ? ' ' : raw));
                } else {
                    put(GlyphId.ofUnicode(raw < 0x20 ? ' ' : encoding.toUnicode(raw)));
                }
                return i + 1;
            }
            Utf8Codec.Decoded d = Utf8Codec.decode(bytes, i, length);
            int cp = d.codePoint();
            if (row == 0 && col == 0 && cp == Utf8Codec.BOM) {
                return i + d.length();
            }
            if (cp >= 0x20) {
                put(GlyphId.ofUnicode(cp));
            }
            return i + d.length();
        }

        private void put(int glyph) {
            if (col == columns) {
                row = Math.min(row + 1, maxRows);
                col = 0;
            }
            col = Math.min(Math.max(col, 0), columns - 1);
            row = Math.max(row, 0);
            if (row >= maxRows) {
                if (!truncated) {
                    LOG.log(Level.FINE, "Dropping cells beyond row limit {0}", maxRows);
                    truncated = true;
                }
                col++;
                return;
            }
            trailingLineFeed = false;
            planes.ensureRows(row + 1, blankGlyph, pen.getBg());
            planes.put(row, col, glyph, pen.getFg(), pen.getBg(), pen.attrs());
            rowMax = Math.max(rowMax, row);
            col++;
        }

        private void apply(CsiSequence seq) {
            switch (seq.getCommand()) {
                case CURSOR_POSITION -> {
                    row = Math.min(seq.getCount(0, 1) - 1, maxRows);
                    col = seq.getCount(1, 1) - 1;
                }
                case CURSOR_UP -> row = Math.max(0, row - seq.getCount(0, 1));
                case CURSOR_DOWN -> row = Math.min(row + seq.getCount(0, 1), maxRows);
                case CURSOR_FORWARD -> col = Math.min(columns, col + seq.getCount(0, 1));
                case CURSOR_BACK -> col = Math.max(0, col - seq.getCount(0, 1));
                case CURSOR_COLUMN -> col = seq.getCount(0, 1) - 1;
                case SAVE_CURSOR -> {
                    savedRow = row;
                    savedCol = col;
                }
                case RESTORE_CURSOR -> {
                    row = savedRow;
                    col = savedCol;
                }
                case ERASE_DISPLAY -> {
                    if (seq.getParam(0, 0) == 2) {
                        eraseAll();
                    }
                }
                case SGR -> pen = pen.applyAll(SgrEvent.parse(seq.params()), settings);
                case PABLO_TRUECOLOR -> pen = pen.apply(SgrEvent.parsePabloTrueColor(seq.params()), settings);
                case IGNORED, UNRECOGNIZED -> {
                }
            }
        }

        private void eraseAll() {
            row = 0;
            col = 0;
            savedRow = 0;
            savedCol = 0;
            rowMax = 0;
            trailingLineFeed = false;
            pen = pen.apply(SgrEvent.RESET, settings);
            planes.reset(blankGlyph, pen.getBg());
        }

        CanvasSnapshot finish(SauceRecord sauce) {
            // A line feed that ends the stream closes its row rather than opening a new one.
            int rows = Math.max(1, trailingLineFeed ? rowMax : rowMax + 1);
            planes.ensureRows(rows, blankGlyph, pen.getBg());
            int cells = rows * columns;

            int[] fg32 = planes.fg();
            int[] bg32 = planes.bg();
            BuiltinPalette palette = pen.sawXterm256() || pen.sawTrueColor()
                ? BuiltinPalette.XTERM256
                : BuiltinPalette.VGA16;

            int[] fg = new int[cells];
            int[] bg = new int[cells];
            Map<Integer, Integer> histogram = new HashMap<>();
            for (int i = 0; i < cells; i++) {
                fg[i] = colors.toIndex(palette, fg32[i]);
                bg[i] = colors.toIndex(palette, bg32[i]);
                if (Rgb.isSet(fg32[i])) histogram.merge(fg32[i], 1, Integer::sum);
                if (Rgb.isSet(bg32[i])) histogram.merge(bg32[i], 1, Integer::sum);
            }
            String paletteTitle = PaletteInference.infer(histogram).map(BuiltinPalette::title).orElse(null);

            return new CanvasSnapshot(columns, rows, palette, paletteTitle,
                Arrays.copyOf(planes.glyphs(), cells), fg, bg,
                Arrays.copyOf(planes.attrs(), cells), sauce);
        }
    }
}

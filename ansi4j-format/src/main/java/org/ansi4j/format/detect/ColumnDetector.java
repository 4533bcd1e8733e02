package org.ansi4j.format.detect;

import org.ansi4j.charset.Utf8Codec;
import org.ansi4j.format.codec.CsiSequence;
import org.ansi4j.format.codec.ImportOptions;
import org.ansi4j.sauce.SauceDataType;
import org.ansi4j.sauce.SauceRecord;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Infers the column count of a stream. Highest precedence first: explicit option, SAUCE width,
 * the furthest column named by an absolute cursor sequence, and for newline-delimited text the
 * furthest non-blank glyph with wrapping disabled. Inferred widths snap up to 80, 100, 132 or
 * 160.
 */
public final class ColumnDetector {

    private static final Logger LOG = Logger.getLogger(ColumnDetector.class.getName());

    public static final int DEFAULT_COLUMNS = 80;

    private static final int LF = '\n';
    private static final int CR = '\r';
    private static final int TAB = '\t';
    private static final int SUB = 0x1A;
    private static final int ESC = 0x1B;
    private static final int TAB_WIDTH = 8;

    private static final int TEXT = 0;
    private static final int SEQUENCE = 1;
    private static final int END = 2;

    private final EncodingDetector encodingDetector;

    public ColumnDetector(EncodingDetector encodingDetector) {
        this.encodingDetector = Objects.requireNonNull(encodingDetector, "encodingDetector");
    }

    /**
     * @param bytes  the whole input
     * @param length payload length (input without the SAUCE trailer)
     * @param sauce  parsed trailer record, or null
     */
    public int detect(byte[] bytes, int length, SauceRecord sauce, ImportOptions options) {
        if (options.getColumns() > 0) {
            return options.getColumns();
        }
        int sauceCols = sauceColumns(sauce);
        if (isValid(sauceCols)) {
            LOG.log(Level.FINE, "Width {0} from SAUCE", sauceCols);
            return normalize(sauceCols);
        }
        int explicit = maxExplicitColumn(bytes, length);
        if (explicit > 0) {
            LOG.log(Level.FINE, "Width {0} from cursor positioning", explicit);
            return normalize(explicit);
        }
        if (hasNewlines(bytes, length)) {
            boolean utf8 = encodingDetector.shouldDecodeAsUtf8(bytes, length, sauce, options);
            int maxCol0 = maxColumnWithNewlines(bytes, length, options, !utf8);
            return normalize(maxCol0 >= 0 ? maxCol0 + 1 : 1);
        }
        return DEFAULT_COLUMNS;
    }

    /**
     * Snap an inferred width up to a conventional terminal width. Anything up to 80 is 80;
     * widths above 160 are only clamped.
     */
    public static int normalize(int columns) {
        int cols = Math.max(1, Math.min(ImportOptions.MAX_COLUMNS, columns));
        if (cols <= 80) return 80;
        if (cols <= 100) return 100;
        if (cols <= 132) return 132;
        if (cols <= 160) return 160;
        return cols;
    }

    /**
     * Width declared by a SAUCE record: {@code tinfo1} for character and XBin data, twice the
     * file type for BinaryText. Zero when there is none.
     */
    public static int sauceColumns(SauceRecord sauce) {
        if (sauce == null) {
            return 0;
        }
        SauceDataType type = sauce.getDataTypeKind();
        if (type == SauceDataType.BINARY_TEXT) {
            return sauce.getFileType() * 2;
        }
        if (type == SauceDataType.CHARACTER || type == SauceDataType.XBIN) {
            return sauce.getTinfo1();
        }
        return 0;
    }

    /**
     * Largest 1-based column referenced by {@code ESC[r;cH}, {@code ESC[r;cf} or {@code ESC[cG}.
     */
    public static int maxExplicitColumn(byte[] bytes, int length) {
        int max = 0;
        int i = 0;
        while (i < length) {
            if ((bytes[i] & 0xFF) != ESC || i + 1 >= length || bytes[i + 1] != '[') {
                i++;
                continue;
            }
            CsiSequence seq = CsiSequence.scan(bytes, i + 2, length);
            if (!seq.isTerminated()) {
                i++;
                continue;
            }
            int fin = seq.getFinalByte();
            if (fin == 'H' || fin == 'f') {
                max = Math.max(max, seq.getParam(1, 1));
            } else if (fin == 'G') {
                max = Math.max(max, seq.getParam(0, 1));
            }
            i = seq.getNext();
        }
        return max;
    }

    /**
     * Replay cursor motion without wrapping and return the largest 0-based column of a
     * non-space glyph, or -1 when there is none. Trailing padding does not count.
     */
    static int maxColumnWithNewlines(byte[] bytes, int length, ImportOptions options, boolean decodeCp437) {
        int row = 0;
        int col = 0;
        int savedRow = 0;
        int savedCol = 0;
        int maxLast = -1;
        int lineLast = -1;
        int state = TEXT;
        int i = 0;
        while (i < length && state != END) {
            int b = bytes[i] & 0xFF;
            if (state == TEXT) {
                switch (b) {
                    case LF -> {
                        row++;
                        maxLast = Math.max(maxLast, lineLast);
                        lineLast = -1;
                        col = 0;
                        i++;
                    }
                    case CR -> {
                        col = 0;
                        i++;
                    }
                    case TAB -> {
                        col = (col / TAB_WIDTH + 1) * TAB_WIDTH;
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
                    default -> {
                        int cp;
                        boolean printable;
                        if (decodeCp437) {
                            cp = b < 0x20 ? ' ' : options.getByteEncoding().toUnicode(b);
                            printable = true;
                            i++;
                        } else {
                            Utf8Codec.Decoded d = Utf8Codec.decode(bytes, i, length);
                            cp = d.codePoint();
                            printable = cp >= 0x20;
                            i += d.length();
                        }
                        if (printable) {
                            if (cp != ' ') {
                                lineLast = Math.max(lineLast, col);
                            }
                            col++;
                        }
                    }
                }
                continue;
            }

            CsiSequence seq = CsiSequence.scan(bytes, i, length);
            state = TEXT;
            i = seq.getNext();
            switch (seq.getCommand()) {
                case CURSOR_POSITION -> {
                    row = seq.getCount(0, 1) - 1;
                    col = seq.getCount(1, 1) - 1;
                }
                case CURSOR_UP -> row = Math.max(0, row - seq.getCount(0, 1));
                case CURSOR_DOWN -> row += seq.getCount(0, 1);
                case CURSOR_FORWARD -> col += seq.getCount(0, 1);
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
                default -> {
                }
            }
        }
        return Math.max(maxLast, lineLast);
    }

    private static boolean hasNewlines(byte[] bytes, int length) {
        for (int i = 0; i < length; i++) {
            if (bytes[i] == LF || bytes[i] == CR) {
                return true;
            }
        }
        return false;
    }

    private static boolean isValid(int columns) {
        return columns >= 1 && columns <= ImportOptions.MAX_COLUMNS;
    }
}

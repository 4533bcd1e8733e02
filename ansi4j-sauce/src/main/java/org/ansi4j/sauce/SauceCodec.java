package org.ansi4j.sauce;

import org.ansi4j.charset.Cp437;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SAUCE 00 reader/writer: optional 0x1A, optional "COMNT" block of 64-byte lines, then a
 * fixed 128-byte record at the very end of the file.
 */
public final class SauceCodec implements MetadataTrailerCodec {

    private static final Logger LOG = Logger.getLogger(SauceCodec.class.getName());

    public static final int RECORD_SIZE = 128;
    public static final int COMMENT_HEADER_SIZE = 5;
    public static final int EOF_BYTE = 0x1A;

    private static final int OFF_TITLE = 7;
    private static final int OFF_AUTHOR = 42;
    private static final int OFF_GROUP = 62;
    private static final int OFF_DATE = 82;
    private static final int OFF_FILESIZE = 90;
    private static final int OFF_DATATYPE = 94;
    private static final int OFF_FILETYPE = 95;
    private static final int OFF_TINFO1 = 96;
    private static final int OFF_TINFO2 = 98;
    private static final int OFF_TINFO3 = 100;
    private static final int OFF_TINFO4 = 102;
    private static final int OFF_COMMENTS = 104;
    private static final int OFF_TFLAGS = 105;
    private static final int OFF_TINFOS = 106;

    private static final byte[] ID = { 'S', 'A', 'U', 'C', 'E', '0', '0' };
    private static final byte[] COMMENT_ID = { 'C', 'O', 'M', 'N', 'T' };

    private final boolean decodeCp437;

    public SauceCodec() {
        this(true);
    }

    /**
     * @param decodeCp437 decode text fields as CP437; otherwise bytes map to Latin-1 chars
     */
    public SauceCodec(boolean decodeCp437) {
        this.decodeCp437 = decodeCp437;
    }

    @Override
    public SauceParsed parse(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < RECORD_SIZE) {
            return SauceParsed.absent(bytes.length);
        }
        int off = bytes.length - RECORD_SIZE;
        if (!matches(bytes, off, ID)) {
            return SauceParsed.absent(bytes.length);
        }

        int commentCount = bytes[off + OFF_COMMENTS] & 0xFF;
        SauceRecord.Builder b = SauceRecord.builder()
            .title(decodeField(bytes, off + OFF_TITLE, SauceRecord.TITLE_LENGTH, decodeCp437))
            .author(decodeField(bytes, off + OFF_AUTHOR, SauceRecord.AUTHOR_LENGTH, decodeCp437))
            .group(decodeField(bytes, off + OFF_GROUP, SauceRecord.GROUP_LENGTH, decodeCp437))
            .date(decodeField(bytes, off + OFF_DATE, SauceRecord.DATE_LENGTH, false))
            .fileSize(readU32(bytes, off + OFF_FILESIZE))
            .dataType(bytes[off + OFF_DATATYPE] & 0xFF)
            .fileType(bytes[off + OFF_FILETYPE] & 0xFF)
            .tinfo1(readU16(bytes, off + OFF_TINFO1))
            .tinfo2(readU16(bytes, off + OFF_TINFO2))
            .tinfo3(readU16(bytes, off + OFF_TINFO3))
            .tinfo4(readU16(bytes, off + OFF_TINFO4))
            .tflags(bytes[off + OFF_TFLAGS] & 0xFF);

        int zlen = 0;
        while (zlen < SauceRecord.TINFOS_LENGTH && bytes[off + OFF_TINFOS + zlen] != 0) {
            zlen++;
        }
        b.tinfos(decodeField(bytes, off + OFF_TINFOS, zlen, decodeCp437));

        int payloadEnd = off;
        boolean hadComments = false;
        if (commentCount > 0) {
            int need = COMMENT_HEADER_SIZE + commentCount * SauceRecord.COMMENT_LINE_LENGTH;
            if (payloadEnd >= need && matches(bytes, payloadEnd - need, COMMENT_ID)) {
                int linesAt = payloadEnd - need + COMMENT_HEADER_SIZE;
                List<String> comments = new ArrayList<>(commentCount);
                for (int i = 0; i < commentCount; i++) {
                    comments.add(decodeField(bytes, linesAt + i * SauceRecord.COMMENT_LINE_LENGTH,
                        SauceRecord.COMMENT_LINE_LENGTH, decodeCp437));
                }
                b.comments(comments);
                payloadEnd -= need;
                hadComments = true;
            } else {
                LOG.log(Level.FINE, "Record declares {0} comment lines but no COMNT block was found", commentCount);
            }
        }

        boolean hadEof = false;
        if (payloadEnd > 0 && (bytes[payloadEnd - 1] & 0xFF) == EOF_BYTE) {
            hadEof = true;
            payloadEnd--;
        }
        return new SauceParsed(b.build(), payloadEnd, hadComments, hadEof);
    }

    @Override
    public byte[] write(byte[] payload, SauceRecord record, SauceWriteOptions options) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(options, "options");

        List<String> comments = new ArrayList<>();
        if (options.includeComments()) {
            comments = chunkComments(record.getComments());
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length + RECORD_SIZE + 1
            + (comments.isEmpty() ? 0 : COMMENT_HEADER_SIZE + comments.size() * SauceRecord.COMMENT_LINE_LENGTH));
        out.writeBytes(payload);
        if (options.includeEofByte()) {
            out.write(EOF_BYTE);
        }
        if (!comments.isEmpty()) {
            out.writeBytes(COMMENT_ID);
            for (String line : comments) {
                out.writeBytes(encodeField(line, SauceRecord.COMMENT_LINE_LENGTH, options.encodeCp437()));
            }
        }

        byte[] rec = new byte[RECORD_SIZE];
        Arrays.fill(rec, (byte) ' ');
        System.arraycopy(ID, 0, rec, 0, ID.length);
        put(rec, OFF_TITLE, encodeField(stripControls(record.getTitle()), SauceRecord.TITLE_LENGTH, options.encodeCp437()));
        put(rec, OFF_AUTHOR, encodeField(stripControls(record.getAuthor()), SauceRecord.AUTHOR_LENGTH, options.encodeCp437()));
        put(rec, OFF_GROUP, encodeField(stripControls(record.getGroup()), SauceRecord.GROUP_LENGTH, options.encodeCp437()));
        put(rec, OFF_DATE, encodeField(SauceDates.sanitize(record.getDate()), SauceRecord.DATE_LENGTH, false));
        long fileSize = record.getFileSize() != 0 ? record.getFileSize() : payload.length;
        writeU32(rec, OFF_FILESIZE, fileSize);
        rec[OFF_DATATYPE] = (byte) record.getDataType();
        rec[OFF_FILETYPE] = (byte) record.getFileType();
        writeU16(rec, OFF_TINFO1, record.getTinfo1());
        writeU16(rec, OFF_TINFO2, record.getTinfo2());
        writeU16(rec, OFF_TINFO3, record.getTinfo3());
        writeU16(rec, OFF_TINFO4, record.getTinfo4());
        rec[OFF_COMMENTS] = (byte) comments.size();
        rec[OFF_TFLAGS] = (byte) record.getTflags();

        byte[] tinfos = encodeField(stripControls(record.getTinfos()), SauceRecord.TINFOS_LENGTH, options.encodeCp437());
        int n = tinfos.length;
        while (n > 0 && tinfos[n - 1] == ' ') {
            n--;
        }
        Arrays.fill(rec, OFF_TINFOS, OFF_TINFOS + SauceRecord.TINFOS_LENGTH, (byte) 0);
        System.arraycopy(tinfos, 0, rec, OFF_TINFOS, n);

        out.writeBytes(rec);
        return out.toByteArray();
    }

    /**
     * Split lines longer than 64 code points; at most 255 lines survive.
     */
    static List<String> chunkComments(List<String> lines) {
        List<String> out = new ArrayList<>();
        for (String raw : lines) {
            String line = stripControls(raw);
            if (line.isEmpty()) {
                out.add("");
                continue;
            }
            int i = 0;
            while (i < line.length()) {
                int end = i;
                int count = 0;
                while (end < line.length() && count < SauceRecord.COMMENT_LINE_LENGTH) {
                    end += Character.charCount(line.codePointAt(end));
                    count++;
                }
                out.add(line.substring(i, end));
                i = end;
            }
        }
        if (out.size() > SauceRecord.MAX_COMMENT_LINES) {
            LOG.log(Level.FINE, "Dropping {0} comment lines beyond the limit of {1}",
                new Object[] { out.size() - SauceRecord.MAX_COMMENT_LINES, SauceRecord.MAX_COMMENT_LINES });
            out = new ArrayList<>(out.subList(0, SauceRecord.MAX_COMMENT_LINES));
        }
        return out;
    }

    static String stripControls(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints().filter(cp -> cp >= 0x20 && cp != 0x7F).forEach(sb::appendCodePoint);
        return sb.toString();
    }

    static byte[] encodeField(String s, int width, boolean cp437) {
        byte[] out = new byte[width];
        Arrays.fill(out, (byte) ' ');
        int o = 0;
        for (int i = 0; i < s.length() && o < width; ) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);
            int b;
            if (cp < 0x80) {
                b = cp;
            } else if (cp437) {
                b = Cp437.fromUnicode(cp);
            } else {
                b = -1;
            }
            out[o++] = (byte) (b < 0 ? '?' : b);
        }
        return out;
    }

    private static String decodeField(byte[] bytes, int off, int len, boolean cp437) {
        int n = len;
        while (n > 0 && (bytes[off + n - 1] == 0 || bytes[off + n - 1] == ' ')) {
            n--;
        }
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            int b = bytes[off + i] & 0xFF;
            sb.appendCodePoint(cp437 ? Cp437.toUnicode(b) : b);
        }
        return sb.toString();
    }

    private static boolean matches(byte[] bytes, int off, byte[] magic) {
        if (off < 0 || off + magic.length > bytes.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (bytes[off + i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    private static void put(byte[] rec, int off, byte[] field) {
        System.arraycopy(field, 0, rec, off, field.length);
    }

    private static int readU16(byte[] b, int off) {
        return (b[off] & 0xFF) | ((b[off + 1] & 0xFF) << 8);
    }

    private static long readU32(byte[] b, int off) {
        return (b[off] & 0xFFL) | ((b[off + 1] & 0xFFL) << 8) | ((b[off + 2] & 0xFFL) << 16) | ((b[off + 3] & 0xFFL) << 24);
    }

    private static void writeU16(byte[] b, int off, int v) {
        b[off] = (byte) v;
        b[off + 1] = (byte) (v >>> 8);
    }

    private static void writeU32(byte[] b, int off, long v) {
        b[off] = (byte) v;
        b[off + 1] = (byte) (v >>> 8);
        b[off + 2] = (byte) (v >>> 16);
        b[off + 3] = (byte) (v >>> 24);
    }
}

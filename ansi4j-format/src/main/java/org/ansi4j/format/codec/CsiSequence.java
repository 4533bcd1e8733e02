package org.ansi4j.format.codec;

/**
 * A control sequence scanned from the bytes after {@code ESC [}.
 * <p>
 * The final byte is anything in 0x40..0x7E, or '!' which some scene tools use as a terminator.
 * Scanning gives up after {@link #MAX_LENGTH} bytes.
 */
public final class CsiSequence {

    public static final int MAX_LENGTH = 64;

    /** Parameter values saturate here so huge numbers cannot overflow. */
    static final int MAX_PARAM_VALUE = 65535;

    private static final int[] NO_PARAMS = new int[0];

    private final int finalByte;
    private final int[] params;
    private final int next;

    private CsiSequence(int finalByte, int[] params, int next) {
        this.finalByte = finalByte;
        this.params = params;
        this.next = next;
    }

    /**
     * Scan a sequence body.
     *
     * @param bytes input
     * @param start first byte after {@code ESC [}
     * @param limit end of the scannable region
     */
    public static CsiSequence scan(byte[] bytes, int start, int limit) {
        int j = start;
        int consumed = 0;
        while (j < limit && consumed < MAX_LENGTH) {
            int ch = bytes[j] & 0xFF;
            if (isFinal(ch)) {
                return new CsiSequence(ch, parseParams(bytes, start, j), j + 1);
            }
            j++;
            consumed++;
        }
        return new CsiSequence(-1, NO_PARAMS, Math.min(limit, start + consumed + 1));
    }

    public static boolean isFinal(int ch) {
        return (ch >= 0x40 && ch <= 0x7E) || ch == '!';
    }

    /**
     * Split a parameter string on ';'. Empty fields read as 0 and a trailing field is always
     * produced, so an empty body yields {@code [0]}. Other bytes ('?', spaces) are skipped.
     */
    static int[] parseParams(byte[] bytes, int from, int to) {
        int count = 1;
        for (int i = from; i < to; i++) {
            if (bytes[i] == ';') count++;
        }
        int[] out = new int[count];
        int n = 0;
        int cur = 0;
        for (int i = from; i < to; i++) {
            int ch = bytes[i];
            if (ch >= '0' && ch <= '9') {
                cur = Math.min(MAX_PARAM_VALUE, cur * 10 + (ch - '0'));
            } else if (ch == ';') {
                out[n++] = cur;
                cur = 0;
            }
        }
        out[n] = cur;
        return out;
    }

    public boolean isTerminated() {
        return finalByte >= 0;
    }

    /** Final byte, or -1 when the sequence was abandoned. */
    public int getFinalByte() {
        return finalByte;
    }

    public CsiCommand getCommand() {
        return isTerminated() ? CsiCommand.forFinal(finalByte) : CsiCommand.UNRECOGNIZED;
    }

    public int[] getParams() {
        return params.clone();
    }

    int[] params() {
        return params;
    }

    /**
     * Parameter at {@code index}, or {@code defaultValue} when absent. A present zero is
     * returned as zero.
     */
    public int getParam(int index, int defaultValue) {
        if (index >= params.length) return defaultValue;
        return params[index];
    }

    /**
     * Parameter at {@code index} where absent or zero both mean {@code defaultValue}.
     */
    public int getCount(int index, int defaultValue) {
        int v = getParam(index, 0);
        return v == 0 ? defaultValue : v;
    }

    /** Offset to resume scanning text at. */
    public int getNext() {
        return next;
    }
}

package org.ansi4j.canvas;

/**
 * Cell attribute bits.
 */
public final class Attrs {

    public static final int NONE = 0;
    public static final int BOLD = 1;
    public static final int DIM = 1 << 1;
    public static final int ITALIC = 1 << 2;
    public static final int UNDERLINE = 1 << 3;
    public static final int BLINK = 1 << 4;
    public static final int REVERSE = 1 << 5;
    public static final int STRIKETHROUGH = 1 << 6;

    public static final int ALL = BOLD | DIM | ITALIC | UNDERLINE | BLINK | REVERSE | STRIKETHROUGH;

    private Attrs() {
    }

    public static boolean has(int attrs, int bit) {
        return (attrs & bit) != 0;
    }
}

package org.ansi4j.format.codec;

/**
 * Control sequence final bytes the importer recognizes.
 */
public enum CsiCommand {
    CURSOR_POSITION,
    CURSOR_UP,
    CURSOR_DOWN,
    CURSOR_FORWARD,
    CURSOR_BACK,
    CURSOR_COLUMN,
    SAVE_CURSOR,
    RESTORE_CURSOR,
    ERASE_DISPLAY,
    SGR,
    /** {@code ESC[which;r;g;bt} 24-bit color used by PabloDraw and Icy Draw. */
    PABLO_TRUECOLOR,
    /** Known finals with no effect on a static canvas (modes, erase line, '!'). */
    IGNORED,
    UNRECOGNIZED;

    public static CsiCommand forFinal(int finalByte) {
        return switch (finalByte) {
            case 'H', 'f' -> CURSOR_POSITION;
            case 'A' -> CURSOR_UP;
            case 'B' -> CURSOR_DOWN;
            case 'C' -> CURSOR_FORWARD;
            case 'D' -> CURSOR_BACK;
            case 'G' -> CURSOR_COLUMN;
            case 's' -> SAVE_CURSOR;
            case 'u' -> RESTORE_CURSOR;
            case 'J' -> ERASE_DISPLAY;
            case 'm' -> SGR;
            case 't' -> PABLO_TRUECOLOR;
            case 'p', 'h', 'l', 'K', '!' -> IGNORED;
            default -> UNRECOGNIZED;
        };
    }
}

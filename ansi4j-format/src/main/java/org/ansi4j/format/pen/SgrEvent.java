package org.ansi4j.format.pen;

import org.ansi4j.color.Rgb;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One attribute or color change decoded from an SGR parameter list.
 *
 * @param kind  what changes
 * @param value palette index for the indexed kinds, packed color for the RGB kinds, else 0
 */
public record SgrEvent(Kind kind, int value) {

    public enum Kind {
        RESET,
        BOLD,
        DIM,
        ITALIC,
        UNDERLINE,
        BLINK,
        INVERSE,
        STRIKETHROUGH,
        NORMAL_INTENSITY,
        ITALIC_OFF,
        UNDERLINE_OFF,
        BLINK_OFF,
        INVERSE_OFF,
        STRIKETHROUGH_OFF,
        DEFAULT_FG,
        DEFAULT_BG,
        /** 30-37, value 0..7 */
        FG_16,
        /** 90-97, value 8..15 */
        FG_BRIGHT,
        /** 40-47, value 0..7 */
        BG_16,
        /** 100-107, value 8..15 */
        BG_BRIGHT,
        FG_256,
        BG_256,
        FG_RGB,
        BG_RGB,
        UNKNOWN
    }

    public static final SgrEvent RESET = new SgrEvent(Kind.RESET, 0);

    public static SgrEvent of(Kind kind) {
        return new SgrEvent(kind, 0);
    }

    /**
     * Decode an SGR parameter list. An empty list means reset. Extended selectors
     * ({@code 38;5;n}, {@code 38;2;r;g;b} and the 48 forms) consume their arguments; out-of-range
     * arguments drop the event but still consume them.
     */
    public static List<SgrEvent> parse(int[] params) {
        if (params.length == 0) {
            return Collections.singletonList(RESET);
        }
        List<SgrEvent> events = new ArrayList<>(params.length);
        for (int k = 0; k < params.length; k++) {
            int code = params[k];
            switch (code) {
                case 0 -> events.add(RESET);
                case 1 -> events.add(of(Kind.BOLD));
                case 2 -> events.add(of(Kind.DIM));
                case 3 -> events.add(of(Kind.ITALIC));
                case 4 -> events.add(of(Kind.UNDERLINE));
                case 5 -> events.add(of(Kind.BLINK));
                case 7 -> events.add(of(Kind.INVERSE));
                case 9 -> events.add(of(Kind.STRIKETHROUGH));
                case 22 -> events.add(of(Kind.NORMAL_INTENSITY));
                case 23 -> events.add(of(Kind.ITALIC_OFF));
                case 24 -> events.add(of(Kind.UNDERLINE_OFF));
                case 25 -> events.add(of(Kind.BLINK_OFF));
                case 27 -> events.add(of(Kind.INVERSE_OFF));
                case 29 -> events.add(of(Kind.STRIKETHROUGH_OFF));
                case 39 -> events.add(of(Kind.DEFAULT_FG));
                case 49 -> events.add(of(Kind.DEFAULT_BG));
                case 38, 48 -> k = parseExtended(params, k, code == 38, events);
                default -> events.add(simpleColor(code));
            }
        }
        return events;
    }

    /**
     * Decode the positional truecolor form {@code ESC[which;r;g;bt}: which 0 sets the background,
     * 1 the foreground.
     *
     * @return the event, or {@link Kind#UNKNOWN} when fewer than four parameters are present or
     *         the selector is neither 0 nor 1
     */
    public static SgrEvent parsePabloTrueColor(int[] params) {
        if (params.length < 4) {
            return of(Kind.UNKNOWN);
        }
        int color = Rgb.of(params[1], params[2], params[3]);
        return switch (params[0]) {
            case 0 -> new SgrEvent(Kind.BG_RGB, color);
            case 1 -> new SgrEvent(Kind.FG_RGB, color);
            default -> of(Kind.UNKNOWN);
        };
    }

    private static SgrEvent simpleColor(int code) {
        if (code >= 30 && code <= 37) {
            return new SgrEvent(Kind.FG_16, code - 30);
        }
        if (code >= 90 && code <= 97) {
            return new SgrEvent(Kind.FG_BRIGHT, code - 90 + 8);
        }
        if (code >= 40 && code <= 47) {
            return new SgrEvent(Kind.BG_16, code - 40);
        }
        if (code >= 100 && code <= 107) {
            return new SgrEvent(Kind.BG_BRIGHT, code - 100 + 8);
        }
        return of(Kind.UNKNOWN);
    }

    private static int parseExtended(int[] params, int k, boolean fg, List<SgrEvent> events) {
        int mode = param(params, k + 1);
        if (mode == 5) {
            int idx = param(params, k + 2);
            if (idx >= 0 && idx <= 255) {
                events.add(new SgrEvent(fg ? Kind.FG_256 : Kind.BG_256, idx));
            }
            return k + 2;
        }
        if (mode == 2) {
            int r = param(params, k + 2);
            int g = param(params, k + 3);
            int b = param(params, k + 4);
            if (r >= 0 && g >= 0 && b >= 0) {
                events.add(new SgrEvent(fg ? Kind.FG_RGB : Kind.BG_RGB, Rgb.of(r, g, b)));
            }
            return k + 4;
        }
        return k;
    }

    private static int param(int[] params, int index) {
        return index < params.length ? params[index] : -1;
    }
}

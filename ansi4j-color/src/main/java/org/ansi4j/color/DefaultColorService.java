package org.ansi4j.color;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ColorService} over the builtin palettes. Remap tables are built on first use
 * and cached per instance; callers sharing an instance across threads must serialize.
 */
public final class DefaultColorService implements ColorService {

    private static final Logger LOG = Logger.getLogger(DefaultColorService.class.getName());

    private final Map<BuiltinPalette, Map<BuiltinPalette, RemapTable>> remapCache = new EnumMap<>(BuiltinPalette.class);

    @Override
    public int toRgb(BuiltinPalette palette, int index) {
        Objects.requireNonNull(palette, "palette");
        if (index == UNSET_INDEX) {
            return Rgb.UNSET;
        }
        return palette.color(index);
    }

    @Override
    public int toIndex(BuiltinPalette palette, int color) {
        Objects.requireNonNull(palette, "palette");
        if (!Rgb.isSet(color)) {
            return UNSET_INDEX;
        }
        return nearest(palette, color);
    }

    @Override
    public RemapTable remap(BuiltinPalette from, BuiltinPalette to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Map<BuiltinPalette, RemapTable> byTarget = remapCache.computeIfAbsent(from, k -> new EnumMap<>(BuiltinPalette.class));
        RemapTable table = byTarget.get(to);
        if (table == null) {
            table = buildRemap(from, to);
            byTarget.put(to, table);
            LOG.log(Level.FINE, "Built remap table {0} -> {1}", new Object[] { from.title(), to.title() });
        }
        return table;
    }

    private static RemapTable buildRemap(BuiltinPalette from, BuiltinPalette to) {
        int[] mapping = new int[from.size()];
        for (int i = 0; i < mapping.length; i++) {
            if (from == to) {
                mapping[i] = i;
            } else if (from == BuiltinPalette.XTERM240_SAFE && to == BuiltinPalette.XTERM256) {
                mapping[i] = 16 + i;
            } else if (from == BuiltinPalette.XTERM16 && to == BuiltinPalette.XTERM256) {
                mapping[i] = i;
            } else {
                mapping[i] = nearest(to, from.color(i));
            }
        }
        return new RemapTable(from, to, mapping);
    }

    private static int nearest(BuiltinPalette palette, int color) {
        int best = 0;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < palette.size(); i++) {
            int d = Rgb.distanceSq(palette.color(i), color);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
                if (d == 0) {
                    break;
                }
            }
        }
        return best;
    }
}

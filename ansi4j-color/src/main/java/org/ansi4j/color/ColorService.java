package org.ansi4j.color;

/**
 * Palette lookups shared by the importer and exporter: index to color, color to
 * nearest index, and cached palette-to-palette remap tables.
 * <p>
 * Implementations may cache derived tables and are not required to be thread-safe.
 */
public interface ColorService {

    /** Sentinel index meaning "no explicit color". */
    int UNSET_INDEX = 0xFFFF;

    /**
     * @return packed color, or {@link Rgb#UNSET} for the unset sentinel or an out-of-range index
     */
    int toRgb(BuiltinPalette palette, int index);

    /**
     * Nearest index by squared RGB distance, lowest index on ties.
     *
     * @return palette index, or {@link #UNSET_INDEX} when {@code color} is {@link Rgb#UNSET}
     */
    int toIndex(BuiltinPalette palette, int color);

    RemapTable remap(BuiltinPalette from, BuiltinPalette to);
}

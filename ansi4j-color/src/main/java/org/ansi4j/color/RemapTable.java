package org.ansi4j.color;

import java.util.Objects;

/**
 * Index-to-index mapping from one palette to another.
 */
public final class RemapTable {

    private final BuiltinPalette from;
    private final BuiltinPalette to;
    private final int[] mapping;

    RemapTable(BuiltinPalette from, BuiltinPalette to, int[] mapping) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        if (mapping.length != from.size()) {
            throw new IllegalArgumentException("Mapping must have " + from.size() + " entries, got " + mapping.length);
        }
    }

    public BuiltinPalette getFrom() {
        return from;
    }

    public BuiltinPalette getTo() {
        return to;
    }

    /**
     * @return index in the target palette, or {@link ColorService#UNSET_INDEX} for indices
     *         outside the source palette
     */
    public int map(int index) {
        if (index < 0 || index >= mapping.length) {
            return ColorService.UNSET_INDEX;
        }
        return mapping[index];
    }
}

package org.ansi4j.color;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Guesses which builtin palette a piece of art was drawn with, from a histogram of the
 * packed colors it uses. The smallest palette that contains every used color exactly
 * wins; otherwise the palette with the lowest count-weighted nearest-color error, biased
 * slightly toward smaller palettes.
 */
public final class PaletteInference {

    private PaletteInference() {
    }

    /**
     * @param histogram packed color to use count; unset colors are ignored
     * @return the inferred palette, or empty when fewer than two distinct colors are used
     */
    public static Optional<BuiltinPalette> infer(Map<Integer, Integer> histogram) {
        Map<Integer, Integer> used = new HashMap<>();
        histogram.forEach((color, count) -> {
            if (Rgb.isSet(color) && count > 0) {
                used.put(color, count);
            }
        });
        if (used.size() < 2) {
            return Optional.empty();
        }

        List<BuiltinPalette> bySize = new ArrayList<>(List.of(BuiltinPalette.values()));
        bySize.sort(Comparator.comparingInt(BuiltinPalette::size).thenComparing(BuiltinPalette::title));
        for (BuiltinPalette p : bySize) {
            Set<Integer> members = new HashSet<>();
            for (int c : p.colors()) {
                members.add(c);
            }
            if (members.containsAll(used.keySet())) {
                return Optional.of(p);
            }
        }

        BuiltinPalette best = null;
        long bestScore = Long.MAX_VALUE;
        for (BuiltinPalette p : BuiltinPalette.values()) {
            int[] colors = p.colors();
            long score = 0;
            for (Map.Entry<Integer, Integer> e : used.entrySet()) {
                int nearest = Integer.MAX_VALUE;
                for (int c : colors) {
                    nearest = Math.min(nearest, Rgb.distanceSq(e.getKey(), c));
                }
                score += (long) nearest * e.getValue();
            }
            score += p.size();
            if (score < bestScore) {
                bestScore = score;
                best = p;
            }
        }
        return Optional.ofNullable(best);
    }
}

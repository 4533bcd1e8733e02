package org.ansi4j.canvas;

import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.sauce.SauceRecord;

import java.util.Optional;

/**
 * Host document: a fixed-width grid of cells over one or more layers, with palette and
 * optional SAUCE metadata.
 */
public interface CanvasDocument {

    int getColumns();

    int getRows();

    /**
     * Palette the fg/bg indices refer to.
     */
    BuiltinPalette getPalette();

    Optional<String> getPaletteTitle();

    Optional<SauceRecord> getSauce();

    int getLayerCount();

    int getActiveLayer();

    boolean isLayerVisible(int layer);

    /**
     * Cell of one layer. Out-of-range coordinates read as {@link CellValue#BLANK}.
     */
    CellValue getLayerCell(int layer, int row, int col);

    /**
     * Cell as seen through all visible layers. Background comes from the topmost visible layer
     * with a set background; glyph, foreground and attributes from the topmost visible layer
     * with a non-blank glyph.
     */
    CellValue getCompositeCell(int row, int col);

    /**
     * Replace the whole document (all layers, size, palette and metadata) with a single-layer
     * snapshot.
     */
    void replaceWith(CanvasSnapshot snapshot);
}

package org.ansi4j.canvas;

import org.ansi4j.color.BuiltinPalette;
import org.ansi4j.color.ColorService;
import org.ansi4j.sauce.SauceRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Layered canvas with a fixed column count and rows that grow on demand.
 */
public class TextCanvas implements CanvasDocument {

    private static final Logger LOG = Logger.getLogger(TextCanvas.class.getName());

    public static final int MAX_COLUMNS = 4096;

    private int columns;
    private int rows;
    private BuiltinPalette palette;
    private String paletteTitle;
    private SauceRecord sauce;
    private final List<Layer> layers = new ArrayList<>();
    private int activeLayer;

    public TextCanvas(int columns) {
        this(columns, BuiltinPalette.VGA16);
    }

    public TextCanvas(int columns, BuiltinPalette palette) {
        if (columns < 1 || columns > MAX_COLUMNS) {
            throw new IllegalArgumentException("columns must be in 1.." + MAX_COLUMNS + ", got " + columns);
        }
        this.columns = columns;
        this.rows = 1;
        this.palette = Objects.requireNonNull(palette, "palette");
        layers.add(new Layer("Base", columns, 1));
    }

    @Override
    public synchronized int getColumns() {
        return columns;
    }

    @Override
    public synchronized int getRows() {
        return rows;
    }

    @Override
    public synchronized BuiltinPalette getPalette() {
        return palette;
    }

    @Override
    public synchronized Optional<String> getPaletteTitle() {
        return Optional.ofNullable(paletteTitle);
    }

    @Override
    public synchronized Optional<SauceRecord> getSauce() {
        return Optional.ofNullable(sauce);
    }

    public synchronized void setSauce(SauceRecord sauce) {
        this.sauce = sauce;
    }

    @Override
    public synchronized int getLayerCount() {
        return layers.size();
    }

    @Override
    public synchronized int getActiveLayer() {
        return activeLayer;
    }

    public synchronized void setActiveLayer(int layer) {
        checkLayer(layer);
        this.activeLayer = layer;
    }

    @Override
    public synchronized boolean isLayerVisible(int layer) {
        checkLayer(layer);
        return layers.get(layer).visible;
    }

    public synchronized void setLayerVisible(int layer, boolean visible) {
        checkLayer(layer);
        layers.get(layer).visible = visible;
    }

    public synchronized String getLayerName(int layer) {
        checkLayer(layer);
        return layers.get(layer).name;
    }

    /**
     * Add a transparent layer on top and return its index.
     */
    public synchronized int addLayer(String name) {
        layers.add(new Layer(Objects.requireNonNull(name, "name"), columns, rows));
        return layers.size() - 1;
    }

    /**
     * Grow every layer to at least {@code count} rows.
     */
    public synchronized void ensureRows(int count) {
        if (count <= rows) return;
        for (Layer layer : layers) {
            layer.grow(columns, count);
        }
        rows = count;
    }

    public synchronized void setCell(int layer, int row, int col, CellValue cell) {
        checkLayer(layer);
        Objects.requireNonNull(cell, "cell");
        if (row < 0 || col < 0 || col >= columns) {
            throw new IllegalArgumentException("Cell out of range: " + row + "," + col);
        }
        ensureRows(row + 1);
        layers.get(layer).set(row * columns + col, cell);
    }

    @Override
    public synchronized CellValue getLayerCell(int layer, int row, int col) {
        checkLayer(layer);
        if (!inBounds(row, col)) {
            return CellValue.BLANK;
        }
        return layers.get(layer).get(row * columns + col);
    }

    @Override
    public synchronized CellValue getCompositeCell(int row, int col) {
        if (!inBounds(row, col)) {
            return CellValue.BLANK;
        }
        int i = row * columns + col;
        int bg = ColorService.UNSET_INDEX;
        for (int l = layers.size() - 1; l >= 0; l--) {
            Layer layer = layers.get(l);
            if (layer.visible && layer.bg[i] != ColorService.UNSET_INDEX) {
                bg = layer.bg[i];
                break;
            }
        }
        for (int l = layers.size() - 1; l >= 0; l--) {
            Layer layer = layers.get(l);
            if (layer.visible && layer.glyphs[i] != GlyphId.SPACE) {
                return new CellValue(layer.glyphs[i], layer.fg[i], bg, layer.attrs[i]);
            }
        }
        return new CellValue(GlyphId.SPACE, ColorService.UNSET_INDEX, bg, Attrs.NONE);
    }

    @Override
    public synchronized void replaceWith(CanvasSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Layer base = new Layer("Base", snapshot.getColumns(), snapshot.getRows());
        System.arraycopy(snapshot.glyphs(), 0, base.glyphs, 0, base.glyphs.length);
        System.arraycopy(snapshot.fg(), 0, base.fg, 0, base.fg.length);
        System.arraycopy(snapshot.bg(), 0, base.bg, 0, base.bg.length);
        System.arraycopy(snapshot.attrs(), 0, base.attrs, 0, base.attrs.length);
        layers.clear();
        layers.add(base);
        activeLayer = 0;
        columns = snapshot.getColumns();
        rows = snapshot.getRows();
        palette = snapshot.getPalette();
        paletteTitle = snapshot.getPaletteTitle().orElse(null);
        sauce = snapshot.getSauce().orElse(null);
        LOG.log(Level.FINE, "Canvas replaced: {0}x{1}", new Object[] { columns, rows });
    }

    private boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < columns;
    }

    private void checkLayer(int layer) {
        if (layer < 0 || layer >= layers.size()) {
            throw new IllegalArgumentException("No such layer: " + layer);
        }
    }

    static int cellCount(int columns, int rows) {
        long cells = (long) columns * rows;
        if (rows < 0 || cells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Canvas too large: " + columns + "x" + rows);
        }
        return (int) cells;
    }

    private static final class Layer {
        final String name;
        boolean visible = true;
        int[] glyphs;
        int[] fg;
        int[] bg;
        int[] attrs;

        Layer(String name, int columns, int rows) {
            this.name = name;
            int cells = cellCount(columns, rows);
            glyphs = new int[cells];
            fg = new int[cells];
            bg = new int[cells];
            attrs = new int[cells];
            clear(0, cells);
        }

        void grow(int columns, int rows) {
            int old = glyphs.length;
            int cells = cellCount(columns, rows);
            glyphs = Arrays.copyOf(glyphs, cells);
            fg = Arrays.copyOf(fg, cells);
            bg = Arrays.copyOf(bg, cells);
            attrs = Arrays.copyOf(attrs, cells);
            clear(old, cells);
        }

        private void clear(int from, int to) {
            Arrays.fill(glyphs, from, to, GlyphId.SPACE);
            Arrays.fill(fg, from, to, ColorService.UNSET_INDEX);
            Arrays.fill(bg, from, to, ColorService.UNSET_INDEX);
            Arrays.fill(attrs, from, to, Attrs.NONE);
        }

        CellValue get(int i) {
            return new CellValue(glyphs[i], fg[i], bg[i], attrs[i]);
        }

        void set(int i, CellValue cell) {
            glyphs[i] = cell.glyph();
            fg[i] = cell.fg();
            bg[i] = cell.bg();
            attrs[i] = cell.attrs();
        }
    }
}

package org.ansi4j.format;

import org.ansi4j.canvas.CanvasSnapshot;
import org.ansi4j.canvas.TextCanvas;
import org.ansi4j.format.codec.ExportResult;
import org.ansi4j.format.codec.ImportOptions;
import org.ansi4j.format.codec.ImportResult;
import org.ansi4j.format.preset.Preset;
import org.ansi4j.format.preset.PresetId;
import org.ansi4j.format.preset.Presets;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Command-line converter: imports an ANSI file and writes it back out with a preset.
 * <p>
 * Usage: {@code <input> <output> [preset-key] [columns]}. The preset and column count can
 * also be set via env ANSI4J_PRESET and ANSI4J_COLUMNS; arguments win. Defaults are
 * scene-classic and auto-detected columns.
 */
public final class AnsiConvertMain {

    private static final Logger LOG = Logger.getLogger(AnsiConvertMain.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    private static final PresetId DEFAULT_PRESET = PresetId.SCENE_CLASSIC;

    private AnsiConvertMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        if (args.length < 2) {
            System.err.println("Usage: AnsiConvertMain <input> <output> [preset-key] [columns]");
            return EXIT_USAGE;
        }
        Path input = Path.of(args[0]);
        Path output = Path.of(args[1]);

        Preset preset = Presets.get(DEFAULT_PRESET);
        String presetEnv = env.get("ANSI4J_PRESET");
        if (presetEnv != null && !presetEnv.isEmpty()) {
            Optional<Preset> p = Presets.find(presetEnv);
            if (p.isPresent()) {
                preset = p.get();
            } else {
                System.err.println("Unknown ANSI4J_PRESET, using " + preset.key() + ": " + presetEnv);
            }
        }
        if (args.length > 2 && args[2] != null && !args[2].isEmpty()) {
            Optional<Preset> p = Presets.find(args[2]);
            if (p.isPresent()) {
                preset = p.get();
            } else {
                System.err.println("Unknown preset argument, using " + preset.key() + ": " + args[2]);
            }
        }

        int columns = ImportOptions.AUTO_COLUMNS;
        String columnsEnv = env.get("ANSI4J_COLUMNS");
        if (columnsEnv != null && !columnsEnv.isEmpty()) {
            try {
                columns = Integer.parseInt(columnsEnv.trim());
            } catch (NumberFormatException e) {
                System.err.println("Invalid ANSI4J_COLUMNS, using auto-detect: " + columnsEnv);
            }
        }
        if (args.length > 3 && args[3] != null && !args[3].isEmpty()) {
            try {
                columns = Integer.parseInt(args[3].trim());
            } catch (NumberFormatException e) {
                System.err.println("Invalid columns argument, using " + columns + ": " + args[3]);
            }
        }
        if (columns < 0) {
            System.err.println("Negative columns, using auto-detect");
            columns = ImportOptions.AUTO_COLUMNS;
        } else if (columns > ImportOptions.MAX_COLUMNS) {
            System.err.println("Columns above " + ImportOptions.MAX_COLUMNS + ", clamping");
            columns = ImportOptions.MAX_COLUMNS;
        }

        ImportOptions importOptions = preset.importOptions().toBuilder().columns(columns).build();
        AnsiFormat format = new AnsiFormat();
        ImportResult imported = format.importFile(input, importOptions);
        if (!imported.isSuccess()) {
            System.err.println("Import failed: " + imported.getError().orElse("unknown error"));
            return EXIT_FAILED;
        }
        CanvasSnapshot snapshot = imported.getSnapshot().orElseThrow();
        TextCanvas canvas = new TextCanvas(snapshot.getColumns());
        canvas.replaceWith(snapshot);
        LOG.info("Imported " + input + " as " + snapshot.getColumns() + "x" + snapshot.getRows()
            + (imported.isDecodedAsUtf8() ? " (UTF-8)" : " (8-bit)"));

        ExportResult exported = format.exportFile(canvas, output, preset.exportOptions());
        if (!exported.isSuccess()) {
            System.err.println("Export failed: " + exported.getError().orElse("unknown error"));
            return EXIT_FAILED;
        }
        LOG.info("Wrote " + output + " with preset " + preset.key());
        return EXIT_OK;
    }
}

package org.ansi4j.format;

import org.ansi4j.canvas.CanvasDocument;
import org.ansi4j.format.codec.AnsiExporter;
import org.ansi4j.format.codec.AnsiImporter;
import org.ansi4j.format.codec.ExportOptions;
import org.ansi4j.format.codec.ExportResult;
import org.ansi4j.format.codec.ImportOptions;
import org.ansi4j.format.codec.ImportResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for reading and writing ANSI art. Failures are reported through
 * {@link ImportResult} / {@link ExportResult}; nothing here throws for bad input or I/O.
 */
public final class AnsiFormat {

    private static final Logger LOG = Logger.getLogger(AnsiFormat.class.getName());

    public static final Set<String> IMPORT_EXTENSIONS = Set.of("ans", "nfo", "diz");
    public static final Set<String> EXPORT_EXTENSIONS = Set.of("ans");

    private final AnsiImporter importer;
    private final AnsiExporter exporter;

    public AnsiFormat() {
        this(new AnsiImporter(), new AnsiExporter());
    }

    public AnsiFormat(AnsiImporter importer, AnsiExporter exporter) {
        this.importer = Objects.requireNonNull(importer, "importer");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    public static boolean canImport(Path path) {
        return IMPORT_EXTENSIONS.contains(extension(path));
    }

    public static boolean canExport(Path path) {
        return EXPORT_EXTENSIONS.contains(extension(path));
    }

    public ImportResult importBytes(byte[] bytes, ImportOptions options) {
        return decode(bytes, options, "input");
    }

    public ImportResult importFile(Path path, ImportOptions options) {
        Objects.requireNonNull(path, "path");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read " + path, e);
            return ImportResult.failure("Failed to open file for reading: " + path);
        }
        return decode(bytes, options, path.toString());
    }

    private ImportResult decode(byte[] bytes, ImportOptions options, String source) {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(options, "options");
        try {
            return importer.importBytes(bytes, options);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Import of " + source + " failed", e);
            return ImportResult.failure("Failed to decode " + source + ": " + e);
        }
    }

    /**
     * Import {@code path} and, on success, replace the contents of {@code document}.
     * The document is left untouched on failure.
     */
    public ImportResult importInto(CanvasDocument document, Path path, ImportOptions options) {
        Objects.requireNonNull(document, "document");
        ImportResult result = importFile(path, options);
        result.getSnapshot().ifPresent(document::replaceWith);
        return result;
    }

    public ExportResult exportBytes(CanvasDocument document, ExportOptions options) {
        return ExportResult.success(exporter.export(document, options));
    }

    public ExportResult exportFile(CanvasDocument document, Path path, ExportOptions options) {
        Objects.requireNonNull(path, "path");
        byte[] bytes = exporter.export(document, options);
        try {
            Files.write(path, bytes);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to write " + path, e);
            return ExportResult.failure("Failed to write file contents: " + path);
        }
        return ExportResult.success(bytes);
    }

    private static String extension(Path path) {
        Path name = Objects.requireNonNull(path, "path").getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot < 0 ? "" : s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

package org.ansi4j.format;

import org.ansi4j.sauce.SauceCodec;
import org.ansi4j.sauce.SauceParsed;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnsiConvertMainTest {

    @TempDir
    Path dir;

    private Path input() throws IOException {
        Path in = dir.resolve("in.ans");
        Files.write(in, "\u001B[1;34mHello\r\n".getBytes(StandardCharsets.ISO_8859_1));
        return in;
    }

    @Test
    void tooFewArguments_isUsageError() {
        assertEquals(AnsiConvertMain.EXIT_USAGE, AnsiConvertMain.run(new String[] { "only-one" }, Map.of()));
    }

    @Test
    void defaultPreset_writesSauce() throws IOException {
        Path out = dir.resolve("out.ans");
        int status = AnsiConvertMain.run(new String[] { input().toString(), out.toString() }, Map.of());
        assertEquals(AnsiConvertMain.EXIT_OK, status);
        SauceParsed parsed = new SauceCodec().parse(Files.readAllBytes(out));
        assertTrue(parsed.isPresent());
        assertEquals(80, parsed.getRecord().orElseThrow().getTinfo1());
    }

    @Test
    void presetArgument_overridesEnvironment() throws IOException {
        Path out = dir.resolve("out.ans");
        String[] args = { input().toString(), out.toString(), "modern-utf8-256", "100" };
        int status = AnsiConvertMain.run(args, Map.of("ANSI4J_PRESET", "scene-classic"));
        assertEquals(AnsiConvertMain.EXIT_OK, status);
        byte[] bytes = Files.readAllBytes(out);
        assertFalse(new SauceCodec().parse(bytes).isPresent());
        String text = new String(bytes, StandardCharsets.UTF_8);
        assertTrue(text.contains("Hello"));
        assertFalse(text.contains("\r\n"));
    }

    @Test
    void environmentColumns_areUsed() throws IOException {
        Path out = dir.resolve("out.ans");
        String[] args = { input().toString(), out.toString() };
        assertEquals(AnsiConvertMain.EXIT_OK, AnsiConvertMain.run(args, Map.of("ANSI4J_COLUMNS", "132")));
        assertEquals(132, new SauceCodec().parse(Files.readAllBytes(out)).getRecord().orElseThrow().getTinfo1());
    }

    @Test
    void invalidSettings_fallBackToDefaults() throws IOException {
        Path out = dir.resolve("out.ans");
        String[] args = { input().toString(), out.toString(), "bogus", "wide" };
        assertEquals(AnsiConvertMain.EXIT_OK, AnsiConvertMain.run(args, Map.of("ANSI4J_COLUMNS", "-5")));
        assertEquals(80, new SauceCodec().parse(Files.readAllBytes(out)).getRecord().orElseThrow().getTinfo1());
    }

    @Test
    void oversizedColumns_areClamped() throws IOException {
        Path out = dir.resolve("out.ans");
        String[] args = { input().toString(), out.toString(), "scene-classic", "9000" };
        assertEquals(AnsiConvertMain.EXIT_OK, AnsiConvertMain.run(args, Map.of()));
        assertEquals(4096, new SauceCodec().parse(Files.readAllBytes(out)).getRecord().orElseThrow().getTinfo1());
    }

    @Test
    void missingInput_fails() {
        String[] args = { dir.resolve("nope.ans").toString(), dir.resolve("out.ans").toString() };
        assertEquals(AnsiConvertMain.EXIT_FAILED, AnsiConvertMain.run(args, Map.of()));
    }
}

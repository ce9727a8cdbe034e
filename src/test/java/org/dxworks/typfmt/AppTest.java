package org.dxworks.typfmt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    private static final String UNFORMATTED = "#f(a,b)\n";
    private static final String FORMATTED = "#f(a, b)\n";

    @TempDir
    Path tempDir;

    @Test
    void usageErrors() {
        assertEquals(2, App.run(new String[]{}));
        assertEquals(2, App.run(new String[]{"--width", tempDir.toString()}));
        assertEquals(2, App.run(new String[]{tempDir.resolve("missing.typ").toString()}));
    }

    @Test
    void checkReportsUnformattedFilesWithoutWriting() throws IOException {
        Path file = Files.writeString(tempDir.resolve("doc.typ"), UNFORMATTED);
        assertEquals(1, App.run(new String[]{"--check", tempDir.toString()}));
        assertEquals(UNFORMATTED, Files.readString(file));
    }

    @Test
    void checkPassesOnFormattedFiles() throws IOException {
        Files.writeString(tempDir.resolve("doc.typ"), FORMATTED);
        assertEquals(0, App.run(new String[]{"--check", tempDir.toString()}));
    }

    @Test
    void formatRewritesOnlyTypstFiles() throws IOException {
        Path typst = Files.writeString(tempDir.resolve("doc.typ"), UNFORMATTED);
        Path other = Files.writeString(tempDir.resolve("notes.txt"), UNFORMATTED);
        assertEquals(0, App.run(new String[]{tempDir.toString()}));
        assertEquals(FORMATTED, Files.readString(typst));
        assertEquals(UNFORMATTED, Files.readString(other));
    }

    @Test
    void syntaxErrorsFailTheRunAndLeaveTheFile() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.typ"), "#f(a,\n");
        assertEquals(1, App.run(new String[]{broken.toString()}));
        assertEquals("#f(a,\n", Files.readString(broken));
    }

    @Test
    void failingFilesDoNotStopTheOthers() throws IOException {
        Files.writeString(tempDir.resolve("broken.typ"), "#f(a,\n");
        Files.writeString(tempDir.resolve("deep.typ"), "#" + "(".repeat(1000) + "1" + ")".repeat(1000) + "\n");
        Files.write(tempDir.resolve("binary.typ"), new byte[]{(byte) 0xC3, (byte) 0x28, '\n'});
        Path good = Files.writeString(tempDir.resolve("good.typ"), UNFORMATTED);

        assertEquals(1, App.run(new String[]{tempDir.toString()}));
        assertEquals(FORMATTED, Files.readString(good));
    }

    @Test
    void formatFileTellsWhetherItChanged() throws IOException, SyntaxErrorException {
        Typfmt typfmt = new Typfmt();
        Path file = Files.writeString(tempDir.resolve("doc.typ"), UNFORMATTED);
        assertTrue(App.formatFile(typfmt, file, false));
        assertFalse(App.formatFile(typfmt, file, false));
    }
}

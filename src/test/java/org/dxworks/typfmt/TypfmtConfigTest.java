package org.dxworks.typfmt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TypfmtConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        TypfmtConfig config = TypfmtConfig.load(tempDir.resolve("typfmt-config.yml"));
        assertEquals(120, config.getMaxWidth());
        assertEquals(2, config.getBlankLinesUpperBound());
    }

    @Test
    void readsBothSettings() throws IOException {
        Path file = tempDir.resolve("typfmt-config.yml");
        Files.writeString(file, "maxWidth: 80\nblankLinesUpperBound: 1\n");
        TypfmtConfig config = TypfmtConfig.load(file);
        assertEquals(80, config.getMaxWidth());
        assertEquals(1, config.getBlankLinesUpperBound());
    }

    @Test
    void absentSettingsKeepTheirDefaults() throws IOException {
        Path file = tempDir.resolve("typfmt-config.yml");
        Files.writeString(file, "maxWidth: 100\n");
        TypfmtConfig config = TypfmtConfig.load(file);
        assertEquals(100, config.getMaxWidth());
        assertEquals(2, config.getBlankLinesUpperBound());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("typfmt-config.yml");
        Files.writeString(file, "maxWidth: [not, a, number\n");
        assertEquals(120, TypfmtConfig.load(file).getMaxWidth());
    }

    @Test
    void invalidValuesAreReplaced() {
        TypfmtConfig config = TypfmtConfig.with(0, -1);
        assertEquals(120, config.getMaxWidth());
        assertEquals(2, config.getBlankLinesUpperBound());
    }
}

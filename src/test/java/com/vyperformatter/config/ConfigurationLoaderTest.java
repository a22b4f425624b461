package com.vyperformatter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWithoutAFile() {
        FormatterConfig config = ConfigurationLoader.loadConfig(null);

        assertEquals(80, config.getLineLength());
        assertTrue(config.isSafetyCheck());
        assertTrue(config.isFallbackToOriginal());
        assertTrue(config.getIgnoreFiles().isEmpty());
    }

    @Test
    void missingFileFallsBackToDefaults() {
        FormatterConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml"));

        assertEquals(ConfigurationLoader.DEFAULT_LINE_LENGTH, config.getLineLength());
    }

    @Test
    void readsGeneralSection() throws IOException {
        Path file = _write("general:\n"
                + "  lineLength: 100\n"
                + "  safetyCheck: false\n"
                + "  ignoreFiles:\n"
                + "    - \"build/**\"\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertEquals(100, config.getLineLength());
        assertFalse(config.isSafetyCheck());
        assertTrue(config.isFallbackToOriginal());
        assertEquals(List.of("build/**"), config.getIgnoreFiles());
    }

    @Test
    void lineLengthOutOfRangeUsesDefault() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(_write("general:\n  lineLength: 5\n"));

        assertEquals(80, config.getLineLength());
    }

    @Test
    void nonNumericLineLengthUsesDefault() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(_write("general:\n  lineLength: wide\n"));

        assertEquals(80, config.getLineLength());
    }

    @Test
    void invalidFlagUsesDefault() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(_write("general:\n  safetyCheck: [1, 2]\n"));

        assertTrue(config.isSafetyCheck());
    }

    @Test
    void brokenYamlFallsBackToDefaults() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(_write("general: [unclosed\n"));

        assertEquals(80, config.getLineLength());
        assertTrue(config.isSafetyCheck());
    }

    @Test
    void missingGeneralSectionUsesDefaults() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadConfig(_write("other: 1\n"));

        assertEquals(80, config.getLineLength());
    }

    @Test
    void savedConfigCanBeLoadedAgain() throws IOException {
        Path file = tempDir.resolve("nested").resolve(ConfigurationLoader.CONFIG_FILE_NAME);
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig()
                .with(FormatterConfig.LINE_LENGTH, 120)
                .with(FormatterConfig.FALLBACK_TO_ORIGINAL, false);

        ConfigurationLoader.saveConfig(config, file);
        FormatterConfig loaded = ConfigurationLoader.loadConfig(file);

        assertTrue(Files.exists(file));
        assertEquals(120, loaded.getLineLength());
        assertFalse(loaded.isFallbackToOriginal());
        assertTrue(loaded.isSafetyCheck());
    }

    private Path _write(String content) throws IOException {
        Path file = tempDir.resolve(ConfigurationLoader.CONFIG_FILE_NAME);
        Files.writeString(file, content);
        return file;
    }
}

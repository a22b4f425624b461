package com.vyperformatter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class FormatterConfigTest {

    @Test
    void coercesLooselyTypedValues() {
        FormatterConfig config = new FormatterConfig(Map.of(
                FormatterConfig.LINE_LENGTH, 100L,
                FormatterConfig.SAFETY_CHECK, "false"));

        assertEquals(100, config.getLineLength());
        assertFalse(config.isSafetyCheck());
    }

    @Test
    void unexpectedTypesFallBackToDefaults() {
        FormatterConfig config = new FormatterConfig(Map.of(
                FormatterConfig.FALLBACK_TO_ORIGINAL, 3,
                FormatterConfig.IGNORE_FILES, "build/**"));

        assertTrue(config.isFallbackToOriginal());
        assertTrue(config.getIgnoreFiles().isEmpty());
        assertEquals(ConfigurationLoader.DEFAULT_LINE_LENGTH, config.getLineLength());
    }

    @Test
    void withReturnsAModifiedCopy() {
        FormatterConfig original = new FormatterConfig(Map.of(FormatterConfig.IGNORE_FILES, List.of("a/**")));

        FormatterConfig changed = original.with(FormatterConfig.LINE_LENGTH, 99);

        assertEquals(99, changed.getLineLength());
        assertEquals(80, original.getLineLength());
        assertEquals(List.of("a/**"), changed.getIgnoreFiles());
    }
}

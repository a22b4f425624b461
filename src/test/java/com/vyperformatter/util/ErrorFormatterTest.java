package com.vyperformatter.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.vyperformatter.api.error.FormatterError;
import com.vyperformatter.api.error.Severity;

class ErrorFormatterTest {
    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void formatsLocationSeverityAndSuggestion() {
        FormatterError error = new FormatterError(Severity.ERROR, "bad thing", 3, 5, "fix it");

        assertEquals("a.vy:3:5: ERROR: bad thing\n  Suggestion: fix it",
                plain.formatError(Paths.get("a.vy"), error));
    }

    @Test
    void omitsMissingFileAndSuggestion() {
        FormatterError error = new FormatterError(Severity.WARNING, "long line", 7, 81);

        assertEquals("7:81: WARNING: long line", plain.formatError(null, error));
    }

    @Test
    void summarizesBlockingDiagnosticsPerFile() {
        Map<Path, List<FormatterError>> errors = new LinkedHashMap<>();
        errors.put(Paths.get("a.vy"), List.of(new FormatterError(Severity.FATAL, "parse", 1, 1)));
        errors.put(Paths.get("b.vy"), List.of(new FormatterError(Severity.WARNING, "long", 2, 81)));

        assertEquals("Error Summary:\na.vy: 1 fatal\nTotal: 1 fatal, 1 warnings", plain.formatErrorSummary(errors));
    }

    @Test
    void colorizeWrapsOnlyWhenEnabled() {
        assertEquals("ok", plain.colorize(ErrorFormatter.ANSI_GREEN, "ok"));
        assertEquals(ErrorFormatter.ANSI_GREEN + "ok" + ErrorFormatter.ANSI_RESET,
                new ErrorFormatter(true).colorize(ErrorFormatter.ANSI_GREEN, "ok"));
    }
}

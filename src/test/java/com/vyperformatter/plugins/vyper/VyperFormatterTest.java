package com.vyperformatter.plugins.vyper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.vyperformatter.api.FormatterResult;
import com.vyperformatter.api.error.FormatterError;
import com.vyperformatter.api.error.Severity;
import com.vyperformatter.config.FormatterConfig;
import com.vyperformatter.plugins.vyper.formatting.BracketMatchException;
import com.vyperformatter.plugins.vyper.formatting.TreeFormatter;
import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.safety.ComparisonResult;

class VyperFormatterTest {
    private static final Path FILE = Paths.get("Token.vy");

    @Test
    void formatsValidSource() {
        VyperFormatter formatter = new VyperFormatter();

        FormatterResult result = formatter.format(FILE, "x:uint256\n");

        assertTrue(result.isSuccessful());
        assertTrue(result.isChanged());
        assertEquals("x: uint256\n", result.getFormattedCode());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void formattedSourceIsUnchanged() {
        FormatterResult result = new VyperFormatter().format(FILE, "x: uint256\n");

        assertTrue(result.isSuccessful());
        assertFalse(result.isChanged());
    }

    @Test
    void parseErrorIsFatalAndKeepsSource() {
        String source = "x = (1\n";

        FormatterResult result = new VyperFormatter().format(FILE, source);

        assertFalse(result.isSuccessful());
        assertFalse(result.isChanged());
        assertEquals(source, result.getFormattedCode());
        FormatterError error = result.getErrors().get(0);
        assertEquals(Severity.FATAL, error.getSeverity());
        assertTrue(error.getMessage().startsWith("Cannot parse source"), error.getMessage());
        assertEquals(1, error.getLine());
    }

    @Test
    void unsupportedConstructIsReported() {
        FormatterResult result = new VyperFormatter().format(FILE, "if x\n");

        assertFalse(result.isSuccessful());
        assertTrue(result.hasErrorsOf(Severity.ERROR));
        assertTrue(result.getErrors().get(0).getMessage().startsWith("Unsupported construct"));
    }

    @Test
    void bracketMismatchIsAnInternalError() {
        VyperFormatter formatter = new VyperFormatter() {
            @Override
            protected TreeFormatter createTreeFormatter(int lineLength) {
                return new TreeFormatter(lineLength) {
                    @Override
                    public Result format(List<Leaf> leaves) {
                        throw new BracketMatchException("Unmatched closing bracket ')' at line 1");
                    }
                };
            }
        };

        FormatterResult result = formatter.format(FILE, "x = f(1)\n");

        assertFalse(result.isSuccessful());
        assertEquals("x = f(1)\n", result.getFormattedCode());
        FormatterError error = result.getErrors().get(0);
        assertEquals(Severity.FATAL, error.getSeverity());
        assertEquals("Internal error: Unmatched closing bracket ')' at line 1", error.getMessage());
    }

    @Test
    void unsafeOutputFallsBackToOriginal() {
        VyperFormatter formatter = new VyperFormatter((original, formatted) -> ComparisonResult.mismatch("differs", 1));
        String source = "x:uint256\n";

        FormatterResult result = formatter.format(FILE, source);

        assertFalse(result.isSuccessful());
        assertEquals(source, result.getFormattedCode());
        FormatterError error = result.getErrors().get(0);
        assertEquals(Severity.ERROR, error.getSeverity());
        assertTrue(error.getMessage().contains("differs"));
        assertTrue(error.getSuggestion().contains("safetyCheck"));
    }

    @Test
    void unsafeOutputWithoutFallbackHasNoCode() {
        VyperFormatter formatter = new VyperFormatter((original, formatted) -> ComparisonResult.mismatch("differs", 1));
        formatter.initialize(_config(Map.of(FormatterConfig.FALLBACK_TO_ORIGINAL, false)));

        FormatterResult result = formatter.format(FILE, "x:uint256\n");

        assertFalse(result.isSuccessful());
        assertNull(result.getFormattedCode());
    }

    @Test
    void disabledSafetyCheckSkipsTheOracle() {
        VyperFormatter formatter = new VyperFormatter((original, formatted) -> {
            throw new AssertionError("oracle must not run");
        });
        formatter.initialize(_config(Map.of(FormatterConfig.SAFETY_CHECK, false)));

        FormatterResult result = formatter.format(FILE, "x:uint256\n");

        assertTrue(result.isSuccessful());
        assertEquals("x: uint256\n", result.getFormattedCode());
    }

    @Test
    void overflowingLineIsAWarning() {
        String source = "@external\n"
                + "def foo() -> uint256:\n"
                + "    return " + "a".repeat(90) + "\n";

        FormatterResult result = new VyperFormatter().format(FILE, source);

        assertTrue(result.isSuccessful());
        assertFalse(result.isChanged());
        FormatterError warning = result.getErrors().get(0);
        assertEquals(Severity.WARNING, warning.getSeverity());
        assertEquals("Line is 101 characters long, limit is 80", warning.getMessage());
        assertEquals(3, warning.getLine());
        assertEquals(81, warning.getColumn());
        assertFalse(warning.isBlocking());
    }

    @Test
    void lineLengthComesFromConfig() {
        VyperFormatter formatter = new VyperFormatter();
        formatter.initialize(_config(Map.of(FormatterConfig.LINE_LENGTH, 40)));

        FormatterResult result = formatter.format(FILE,
                "@external\ndef foo():\n    self.b(alpha_value, beta_value, gamma_value, delta_value)\n");

        assertEquals(40, formatter.getLineLength());
        assertTrue(result.isSuccessful());
        for (String line : result.getFormattedCode().split("\n")) {
            assertTrue(line.length() <= 40, line);
        }
    }

    private static FormatterConfig _config(Map<String, Object> overrides) {
        Map<String, Object> values = new HashMap<>();
        values.put(FormatterConfig.LINE_LENGTH, 80);
        values.put(FormatterConfig.SAFETY_CHECK, true);
        values.put(FormatterConfig.FALLBACK_TO_ORIGINAL, true);
        values.putAll(overrides);
        return new FormatterConfig(values);
    }
}

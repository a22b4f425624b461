package com.vyperformatter.plugins.vyper.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.vyperformatter.plugins.vyper.parsing.ParseException;
import com.vyperformatter.plugins.vyper.parsing.Tokenizer;
import com.vyperformatter.plugins.vyper.safety.ComparisonResult;
import com.vyperformatter.plugins.vyper.safety.TokenStreamComparator;

/**
 * Formats each {@code fixtures/<name>.vy} and compares with {@code <name>.expected.vy}.
 */
class FormattingFixturesTest {

    @ParameterizedTest
    @ValueSource(strings = {"contract", "counter"})
    void matchesExpectedOutput(String name) throws IOException, ParseException {
        String source = _fixture(name + ".vy");
        String expected = _fixture(name + ".expected.vy");

        assertEquals(expected, _format(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {"contract", "counter"})
    void expectedOutputIsAFixedPoint(String name) throws IOException, ParseException {
        String expected = _fixture(name + ".expected.vy");

        assertEquals(expected, _format(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"contract", "counter"})
    void formattingPreservesMeaning(String name) throws IOException, ParseException {
        String source = _fixture(name + ".vy");

        ComparisonResult result = new TokenStreamComparator().compare(source, _format(source));
        assertTrue(result.isEquivalent(), result::toString);
    }

    private static String _format(String source) throws ParseException {
        return new TreeFormatter(80).format(Tokenizer.tokenize(source)).getText();
    }

    private static String _fixture(String fileName) throws IOException {
        try (InputStream in = FormattingFixturesTest.class.getResourceAsStream("/fixtures/" + fileName)) {
            assertNotNull(in, "missing fixture " + fileName);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

package com.vyperformatter.plugins.vyper.safety;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TokenStreamComparatorTest {

    private final TokenStreamComparator comparator = new TokenStreamComparator();

    @Test
    void layoutAndCommentsDoNotMatter() {
        String original = "@external\n"
                + "def foo():\n"
                + "    self.b(0, # amount\n"
                + "     msg.sender, # sender\n"
                + "     True, # refund\n"
                + "    )\n";
        String formatted = "@external\n"
                + "def foo():\n"
                + "    self.b(\n"
                + "        0,  # amount\n"
                + "        msg.sender,  # sender\n"
                + "        True,  # refund\n"
                + "    )\n";

        assertTrue(comparator.compare(original, formatted).isEquivalent());
    }

    @Test
    void quoteStyleDoesNotMatter() {
        assertTrue(comparator.compareSemantics("x = 'a'\n", "x = \"a\"\n"));
        assertTrue(comparator.compareSemantics("x = 'it\\'s'\n", "x = \"it's\"\n"));
    }

    @Test
    void docstringWhitespaceDoesNotMatter() {
        assertTrue(comparator.compareSemantics(
                "def f():\n    '''  a\n        b '''\n",
                "def f():\n    \"\"\"a\n    b\"\"\"\n"));
    }

    @Test
    void optionalParenthesesDoNotMatter() {
        assertTrue(comparator.compareSemantics("x = (a + b)\n", "x = a + b\n"));
        assertTrue(comparator.compareSemantics("if (a > b):\n    pass\n", "if a > b:\n    pass\n"));
        assertTrue(comparator.compareSemantics("return (a, b)\n", "return a, b\n"));
    }

    @Test
    void oneElementTupleCommaMatters() {
        assertFalse(comparator.compareSemantics("x = (1,)\n", "x = (1)\n"));
        assertTrue(comparator.compareSemantics("x = (1,)\n", "x = (\n    1,\n)\n"));
        assertTrue(comparator.compareSemantics("x = f(1,)\n", "x = f(1)\n"));
        assertTrue(comparator.compareSemantics("x = (1, 2,)\n", "x = (1, 2)\n"));
    }

    @Test
    void groupingParenthesesMatter() {
        ComparisonResult result = comparator.compare("x = (a + b) * c\n", "x = a + b * c\n");

        assertFalse(result.isEquivalent());
        assertEquals(1, result.getLine());
    }

    @Test
    void inlineBodyMatchesIndentedBody() {
        assertTrue(comparator.compareSemantics("if x: return\n", "if x:\n    return\n"));
    }

    @Test
    void detectsChangedToken() {
        ComparisonResult result = comparator.compare("x: uint256\n", "x: uint128\n");

        assertFalse(result.isEquivalent());
        assertTrue(result.getMessage().contains("became"), result.getMessage());
        assertEquals(1, result.getLine());
    }

    @Test
    void detectsChangedIndentation() {
        ComparisonResult result = comparator.compare(
                "if x:\n    a = 1\nb = 2\n",
                "if x:\n    a = 1\n    b = 2\n");

        assertFalse(result.isEquivalent());
        assertTrue(result.getMessage().startsWith("indentation of 'b = 2' changed"), result.getMessage());
        assertEquals(3, result.getLine());
    }

    @Test
    void detectsDroppedStatement() {
        ComparisonResult result = comparator.compare("a = 1\nb = 2\n", "a = 1\n");

        assertFalse(result.isEquivalent());
        assertEquals("statement count changed from 2 to 1", result.getMessage());
        assertEquals(2, result.getLine());
    }

    @Test
    void unparsableOutputIsAMismatch() {
        ComparisonResult result = comparator.compare("x = (1)\n", "x = (1\n");

        assertFalse(result.isEquivalent());
        assertTrue(result.getMessage().startsWith("formatted code does not parse"), result.getMessage());
    }

    @Test
    void unparsableSourceIsAMismatch() {
        ComparisonResult result = comparator.compare("x = $\n", "x = 1\n");

        assertFalse(result.isEquivalent());
        assertTrue(result.getMessage().startsWith("source does not parse"), result.getMessage());
    }
}

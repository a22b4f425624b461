package com.vyperformatter.plugins.vyper.parsing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

class TokenizerTest {

    private static final String CONTRACT = "# @version ^0.3.7\n"
            + "\n"
            + "x: uint256  # counter\n"
            + "\n"
            + "@external\n"
            + "def foo(a: uint256,\n"
            + "        b: uint256) -> uint256:\n"
            + "    # add them\n"
            + "    return a + b\n";

    @Test
    void leavesReproduceTheSource() throws ParseException {
        assertEquals(CONTRACT, _render(Tokenizer.tokenize(CONTRACT)));
    }

    @Test
    void sourceWithoutFinalNewlineIsReproduced() throws ParseException {
        String source = "x: uint256\ny: address";
        assertEquals(source, _render(Tokenizer.tokenize(source)));
    }

    @Test
    void windowsLineEndingsAreNormalized() throws ParseException {
        assertEquals("x: uint256\ny: address\n", _render(Tokenizer.tokenize("x: uint256\r\ny: address\r\n")));
    }

    @Test
    void blocksProduceIndentAndDedent() throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize(CONTRACT);

        assertEquals(1, _count(leaves, LeafType.INDENT));
        assertEquals(1, _count(leaves, LeafType.DEDENT));
        assertEquals(LeafType.ENDMARKER, leaves.get(leaves.size() - 1).getType());
    }

    @Test
    void newlinesInsideBracketsStayInPrefixes() throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize(CONTRACT);

        // x line, decorator, def header, return
        assertEquals(4, _count(leaves, LeafType.NEWLINE));
        Leaf b = leaves.stream().filter(l -> l.getValue().equals("b")).findFirst().orElseThrow();
        assertEquals("\n        ", b.getPrefix());
        assertEquals(7, b.getLine());
    }

    @Test
    void commentsAndBlankLinesBecomePrefixes() throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize(CONTRACT);

        assertEquals("# @version ^0.3.7\n\n", leaves.get(0).getPrefix());
        Leaf ret = leaves.stream().filter(l -> l.isKeyword("return")).findFirst().orElseThrow();
        assertEquals("    # add them\n    ", ret.getPrefix());
    }

    @Test
    void wholeStatementStringIsDocstring() throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize("def foo():\n    \"\"\"Doc.\"\"\"\n    x = \"a\"\n");

        List<LeafType> stringTypes = leaves.stream()
                .filter(l -> l.getValue().startsWith("\""))
                .map(Leaf::getType)
                .collect(Collectors.toList());
        assertEquals(List.of(LeafType.DOCSTRING, LeafType.STRING), stringTypes);
    }

    @Test
    void softKeywordsNeedAFollowingName() throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize("flag: bool\nenum Color:\n    RED\n");

        assertEquals(LeafType.NAME, leaves.get(0).getType());
        Leaf enumLeaf = leaves.stream().filter(l -> l.getValue().equals("enum")).findFirst().orElseThrow();
        assertEquals(LeafType.KEYWORD, enumLeaf.getType());
    }

    @Test
    void keywordAfterDotIsAName() throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize("x = self.from\n");

        Leaf attribute = leaves.stream().filter(l -> l.getValue().equals("from")).findFirst().orElseThrow();
        assertEquals(LeafType.NAME, attribute.getType());
    }

    @Test
    void operatorsAreClassified() throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize("def f() -> uint256:\n    x **= 2\n    y += x // 3\n");

        assertTrue(leaves.stream().anyMatch(l -> l.getType() == LeafType.ARROW && l.getValue().equals("->")));
        assertTrue(leaves.stream().anyMatch(l -> l.getType() == LeafType.AUG_ASSIGN && l.getValue().equals("**=")));
        assertTrue(leaves.stream().anyMatch(l -> l.getType() == LeafType.AUG_ASSIGN && l.getValue().equals("+=")));
        assertTrue(leaves.stream().anyMatch(l -> l.isOperator("//")));
    }

    @Test
    void unterminatedStringIsRejected() {
        ParseException e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = \"abc\n"));
        assertEquals(1, e.getLine());
        assertTrue(e.getMessage().contains("unterminated string literal"));
    }

    @Test
    void unmatchedClosingBracketIsRejected() {
        ParseException e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = 1)\n"));
        assertTrue(e.getMessage().contains("unmatched ')'"));
    }

    @Test
    void unclosedBracketIsRejected() {
        ParseException e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("foo(1,\n"));
        assertEquals(1, e.getLine());
        assertTrue(e.getMessage().contains("'(' was never closed"));
    }

    @Test
    void mismatchedBracketsAreRejected() {
        ParseException e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = [1)\n"));
        assertTrue(e.getMessage().contains("does not match"));
    }

    @Test
    void inconsistentDedentIsRejected() {
        ParseException e = assertThrows(ParseException.class,
                () -> Tokenizer.tokenize("if x:\n        a = 1\n    b = 2\n"));
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().contains("unindent does not match"));
    }

    @Test
    void unexpectedCharacterReportsItsPosition() {
        ParseException e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = 1 $\n"));
        assertEquals(1, e.getLine());
        assertEquals(7, e.getColumn());
        assertTrue(e.getMessage().endsWith("(line 1, column 7)"));
    }

    private static String _render(List<Leaf> leaves) {
        StringBuilder sb = new StringBuilder();
        for (Leaf leaf : leaves) {
            sb.append(leaf.getPrefix()).append(leaf.getValue());
        }
        return sb.toString();
    }

    private static long _count(List<Leaf> leaves, LeafType type) {
        return leaves.stream().filter(l -> l.getType() == type).count();
    }
}

package com.vyperformatter.plugins.vyper.safety;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;
import com.vyperformatter.plugins.vyper.parsing.ParseException;
import com.vyperformatter.plugins.vyper.parsing.Tokenizer;

/**
 * Compares two sources statement by statement after tokenizing both.
 * <p>
 * Everything the formatter may legitimately change is canonicalized away first:
 * layout and comments, trailing commas before a closing bracket, parentheses wrapping
 * a whole right-hand side, return value, condition or assert part, quote style and
 * docstring whitespace. A body written on its header line counts as a statement one
 * level deeper.
 */
public class TokenStreamComparator implements SafetyOracle {
    private static final Set<String> COMPOUND_HEADERS = Set.of(
            "if", "elif", "else", "for", "def", "event", "struct", "interface", "enum", "flag");

    @Override
    public ComparisonResult compare(String original, String formatted) {
        List<Statement> expected;
        try {
            expected = statements(original);
        } catch (ParseException e) {
            return ComparisonResult.mismatch("source does not parse: " + e.getMessage(), e.getLine());
        }

        List<Statement> actual;
        try {
            actual = statements(formatted);
        } catch (ParseException e) {
            return ComparisonResult.mismatch("formatted code does not parse: " + e.getMessage(), e.getLine());
        }

        int count = Math.min(expected.size(), actual.size());
        for (int i = 0; i < count; i++) {
            Statement left = expected.get(i);
            Statement right = actual.get(i);
            if (left.depth != right.depth) {
                return ComparisonResult.mismatch("indentation of '" + left.text() + "' changed", left.line);
            }
            if (!left.tokens.equals(right.tokens)) {
                return ComparisonResult.mismatch("'" + left.text() + "' became '" + right.text() + "'", left.line);
            }
        }
        if (expected.size() != actual.size()) {
            int line = count < expected.size() ? expected.get(count).line : 0;
            return ComparisonResult.mismatch("statement count changed from " + expected.size()
                    + " to " + actual.size(), line);
        }
        return ComparisonResult.equivalent();
    }

    /**
     * Canonical statements of a source text, in order.
     */
    static List<Statement> statements(String source) throws ParseException {
        List<Leaf> leaves = Tokenizer.tokenize(source);
        List<Statement> result = new ArrayList<>();
        Deque<String> blocks = new ArrayDeque<>();
        String lastHeader = null;
        int depth = 0;
        List<Leaf> pending = new ArrayList<>();

        for (Leaf leaf : leaves) {
            switch (leaf.getType()) {
                case INDENT -> {
                    depth++;
                    blocks.push(lastHeader == null ? "" : lastHeader);
                }
                case DEDENT -> {
                    depth--;
                    blocks.pop();
                }
                case ENDMARKER -> {
                }
                case NEWLINE -> {
                    if (!pending.isEmpty()) {
                        lastHeader = _addStatement(result, pending, depth, "interface".equals(blocks.peek()));
                        pending = new ArrayList<>();
                    }
                }
                default -> pending.add(leaf);
            }
        }
        return result;
    }

    /**
     * Adds one statement, split at its header colon when a body follows on the same
     * line. Returns the header keyword when the statement opens an indented block.
     */
    private static String _addStatement(List<Statement> result, List<Leaf> leaves, int depth, boolean member) {
        Leaf first = leaves.get(0);
        int colon = -1;
        if (first.getType() == LeafType.KEYWORD && COMPOUND_HEADERS.contains(first.getValue())
                && !(member && first.isKeyword("def"))) {
            int from = 1;
            if (first.isKeyword("for")) {
                int in = _findAtDepthZero(leaves, 1, leaves.size(), LeafType.KEYWORD, "in");
                from = in < 0 ? 1 : in;
            }
            colon = _findAtDepthZero(leaves, from, leaves.size(), LeafType.COLON, ":");
        }

        if (colon >= 0 && colon + 1 < leaves.size()) {
            result.add(_canonical(new ArrayList<>(leaves.subList(0, colon + 1)), depth));
            result.add(_canonical(new ArrayList<>(leaves.subList(colon + 1, leaves.size())), depth + 1));
            return null;
        }
        result.add(_canonical(new ArrayList<>(leaves), depth));
        return colon >= 0 ? first.getValue() : null;
    }

    private static Statement _canonical(List<Leaf> leaves, int depth) {
        int line = leaves.get(0).getLine();
        for (int i = leaves.size() - 2; i >= 0; i--) {
            if (leaves.get(i).getType() == LeafType.COMMA && leaves.get(i + 1).isClosingBracket()
                    && !_isOneTuple(leaves, i + 1)) {
                leaves.remove(i);
            }
        }
        _unwrapOptionalParens(leaves);

        List<String> tokens = new ArrayList<>(leaves.size());
        for (Leaf leaf : leaves) {
            tokens.add(_canonicalText(leaf));
        }
        return new Statement(depth, line, tokens);
    }

    /**
     * Whether the parentheses closed at {@code closing} hold a single element with its
     * comma, as in {@code (1,)}. That comma makes the tuple and is kept.
     */
    private static boolean _isOneTuple(List<Leaf> leaves, int closing) {
        if (leaves.get(closing).getType() != LeafType.RPAR) {
            return false;
        }
        int nesting = 0;
        int commas = 0;
        for (int i = closing - 1; i >= 0; i--) {
            Leaf leaf = leaves.get(i);
            if (leaf.isClosingBracket()) {
                nesting++;
            } else if (leaf.isOpeningBracket()) {
                if (nesting == 0) {
                    Leaf previous = i > 0 ? leaves.get(i - 1) : null;
                    boolean trailer = previous != null && switch (previous.getType()) {
                        case NAME, STRING, RPAR, RSQB, RBRACE -> true;
                        default -> false;
                    };
                    return !trailer && commas == 1;
                }
                nesting--;
            } else if (nesting == 0 && leaf.getType() == LeafType.COMMA) {
                commas++;
            }
        }
        return false;
    }

    private static void _unwrapOptionalParens(List<Leaf> leaves) {
        Leaf first = leaves.get(0);
        if (first.getType() != LeafType.KEYWORD) {
            int assignment = -1;
            for (int i = 1; i < leaves.size() && assignment < 0; i++) {
                LeafType type = leaves.get(i).getType();
                if ((type == LeafType.EQUAL || type == LeafType.AUG_ASSIGN) && _depthAt(leaves, i) == 0) {
                    assignment = i;
                }
            }
            if (assignment > 0) {
                _unwrap(leaves, assignment + 1, leaves.size(), true);
            }
            return;
        }

        switch (first.getValue()) {
            case "return" -> _unwrap(leaves, 1, leaves.size(), true);
            case "if", "elif" -> {
                int last = leaves.size() - 1;
                if (leaves.get(last).getType() == LeafType.COLON) {
                    _unwrap(leaves, 1, last, false);
                }
            }
            case "assert" -> {
                int comma = _findAtDepthZero(leaves, 1, leaves.size(), LeafType.COMMA, ",");
                if (comma < 0) {
                    _unwrap(leaves, 1, leaves.size(), false);
                } else {
                    _unwrap(leaves, comma + 1, leaves.size(), false);
                    _unwrap(leaves, 1, comma, false);
                }
            }
            default -> {
            }
        }
    }

    private static void _unwrap(List<Leaf> leaves, int from, int to, boolean allowTuple) {
        while (to - from > 2 && _wraps(leaves, from, to, allowTuple)) {
            leaves.remove(to - 1);
            leaves.remove(from);
            to -= 2;
        }
    }

    private static boolean _wraps(List<Leaf> leaves, int from, int to, boolean allowTuple) {
        if (leaves.get(from).getType() != LeafType.LPAR) {
            return false;
        }
        int nesting = 0;
        for (int i = from; i < to; i++) {
            Leaf leaf = leaves.get(i);
            if (leaf.isOpeningBracket()) {
                nesting++;
            } else if (leaf.isClosingBracket()) {
                nesting--;
                if (nesting == 0 && i != to - 1) {
                    return false;
                }
            } else if (nesting == 1 && leaf.getType() == LeafType.COMMA && !allowTuple) {
                return false;
            }
        }
        return nesting == 0;
    }

    private static int _depthAt(List<Leaf> leaves, int index) {
        int nesting = 0;
        for (int i = 0; i < index; i++) {
            if (leaves.get(i).isOpeningBracket()) {
                nesting++;
            } else if (leaves.get(i).isClosingBracket()) {
                nesting--;
            }
        }
        return nesting;
    }

    private static int _findAtDepthZero(List<Leaf> leaves, int from, int to, LeafType type, String value) {
        for (int i = from; i < to; i++) {
            Leaf leaf = leaves.get(i);
            if (leaf.getType() == type && leaf.getValue().equals(value) && _depthAt(leaves, i) == 0) {
                return i;
            }
        }
        return -1;
    }

    private static String _canonicalText(Leaf leaf) {
        return switch (leaf.getType()) {
            case STRING -> "STRING:" + _stringContent(leaf.getValue());
            case DOCSTRING -> "DOCSTRING:" + String.join(" ", _docstringBody(leaf.getValue()).trim().split("\\s+"));
            default -> leaf.getValue();
        };
    }

    /**
     * Literal prefix and body with quote escapes removed, so that {@code 'a"b'} and
     * {@code "a\"b"} compare equal.
     */
    private static String _stringContent(String literal) {
        int prefixLength = 0;
        while (prefixLength < literal.length() && Character.isLetter(literal.charAt(prefixLength))) {
            prefixLength++;
        }
        String prefix = literal.substring(0, prefixLength).toLowerCase();
        String value = literal.substring(prefixLength);
        int quoteLength = value.startsWith("\"\"\"") || value.startsWith("'''") ? 3 : 1;
        String body = value.substring(quoteLength, value.length() - quoteLength);
        return prefix + "|" + body.replace("\\\"", "\"").replace("\\'", "'");
    }

    private static String _docstringBody(String literal) {
        String content = _stringContent(literal);
        return content.substring(content.indexOf('|') + 1);
    }

    /**
     * A statement reduced to its block depth and canonical token texts.
     */
    static final class Statement {
        final int depth;
        final int line;
        final List<String> tokens;

        Statement(int depth, int line, List<String> tokens) {
            this.depth = depth;
            this.line = line;
            this.tokens = tokens;
        }

        String text() {
            return String.join(" ", tokens);
        }
    }
}

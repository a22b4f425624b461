package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;

/**
 * Groups a token stream into logical lines, one per simple statement, compound
 * statement header or comment line.
 * <p>
 * Along the way the generator moves comments out of leaf prefixes, normalizes string
 * quotes and docstrings, wraps right-hand sides and conditions in optional
 * parentheses and records the blank lines the author left before each line.
 */
public class LineGenerator {
    private static final Set<String> COMPOUND_HEADERS = Set.of(
            "if", "elif", "else", "for", "def", "event", "struct", "interface", "enum", "flag");

    private final int lineLength;
    private final List<Line> lines = new ArrayList<>();
    private final Deque<String> blocks = new ArrayDeque<>();
    private Line current;
    private int depth;
    private String lastHeader;

    public LineGenerator(int lineLength) {
        this.lineLength = lineLength;
    }

    /**
     * Builds the logical lines of a whole file.
     *
     * @throws UnsupportedConstructException when a compound statement header has no colon
     */
    public List<Line> generate(List<Leaf> leaves) {
        int index = 0;
        while (index < leaves.size()) {
            Leaf leaf = leaves.get(index);
            switch (leaf.getType()) {
                case INDENT -> {
                    depth++;
                    blocks.push(lastHeader == null ? "" : lastHeader);
                    index++;
                }
                case DEDENT -> {
                    _standaloneComments(leaf.getPrefix(), false);
                    depth--;
                    blocks.pop();
                    index++;
                }
                case ENDMARKER -> {
                    _standaloneComments(leaf.getPrefix(), true);
                    index++;
                }
                case NEWLINE -> {
                    _standaloneComments(leaf.getPrefix(), false);
                    index++;
                }
                default -> {
                    int end = index;
                    while (leaves.get(end).getType() != LeafType.NEWLINE) {
                        end++;
                    }
                    _statement(leaves.subList(index, end), leaves.get(end));
                    index = end + 1;
                }
            }
        }
        return lines;
    }

    private void _statement(List<Leaf> statement, Leaf newline) {
        Leaf first = statement.get(0);
        int blankLines = _standaloneComments(first.getPrefix(), false);
        first.setPrefix("");

        boolean member = "interface".equals(blocks.peek());
        int colon = _headerColon(statement, member);
        List<Leaf> header = colon < 0 ? statement : statement.subList(0, colon + 1);

        current = new Line(depth, false, member);
        current.setBlankLinesBefore(blankLines);
        _appendAll(_prepare(header, depth));

        lastHeader = null;
        if (colon >= 0 && colon + 1 < statement.size()) {
            // Inline body goes on its own line one level deeper
            _flush();
            List<Leaf> body = statement.subList(colon + 1, statement.size());
            current = new Line(depth + 1, false, "interface".equals(first.getValue()));
            _appendAll(_prepare(body, depth + 1));
        } else if (colon >= 0) {
            lastHeader = first.getValue();
        }

        _appendComments(newline.getPrefix());
        _flush();
    }

    /**
     * Emits the comments of a prefix at the start of a line as comment lines.
     *
     * @return blank lines between the last comment (or the prefix start) and the code
     */
    private int _standaloneComments(String prefix, boolean endOfFile) {
        for (Comments.ProtoComment comment : Comments.fromPrefix(prefix, endOfFile)) {
            Line line = new Line(depth, false, false);
            line.setBlankLinesBefore(Math.min(comment.getNewlines(), 1));
            line.append(new Leaf(LeafType.STANDALONE_COMMENT, comment.getValue(), "", 0, 0), false);
            lines.add(line);
        }
        return Math.min(Comments.newlinesAfterComments(prefix), 1);
    }

    private void _appendAll(List<Leaf> leaves) {
        for (Leaf leaf : leaves) {
            _appendComments(leaf.getPrefix());
            leaf.setPrefix("");
            current.append(leaf, false);
        }
    }

    /**
     * Routes comments found in the prefix of a leaf that is not the first of its
     * line. Inside brackets they stay on the line; outside, a trailing comment ends
     * the line and a standalone comment gets a line of its own.
     */
    private void _appendComments(String prefix) {
        for (Comments.ProtoComment comment : Comments.fromPrefix(prefix, false)) {
            Leaf leaf = new Leaf(comment.getType(), comment.getValue(), "", 0, 0);
            if (current.getBracketTracker().anyOpenBrackets()) {
                current.append(leaf, false);
            } else if (comment.getType() == LeafType.COMMENT) {
                current.append(leaf, false);
                _flush();
            } else {
                _flush();
                current.setBlankLinesBefore(Math.min(comment.getNewlines(), 1));
                current.append(leaf, false);
                _flush();
            }
        }
    }

    private void _flush() {
        if (!current.isEmpty()) {
            lines.add(current);
        }
        current = new Line(current.getDepth(), false, current.isInterfaceMember());
    }

    /**
     * Index of the colon ending a compound statement header, or -1 for a simple
     * statement. Signatures inside an interface are simple statements.
     */
    private static int _headerColon(List<Leaf> statement, boolean member) {
        Leaf first = statement.get(0);
        if (first.getType() != LeafType.KEYWORD || !COMPOUND_HEADERS.contains(first.getValue())) {
            return -1;
        }
        if (member && first.isKeyword("def")) {
            return -1;
        }

        int from = 1;
        if (first.isKeyword("else")) {
            if (statement.size() > 1 && statement.get(1).getType() == LeafType.COLON) {
                return 1;
            }
            throw new UnsupportedConstructException("'else' without ':'", first.getLine());
        }
        if (first.isKeyword("for")) {
            // The loop variable may carry an annotation
            int in = _findAtDepthZero(statement, 1, statement.size(), leaf -> leaf.isKeyword("in"));
            from = in < 0 ? 1 : in;
        }

        int colon = _findAtDepthZero(statement, from, statement.size(), leaf -> leaf.getType() == LeafType.COLON);
        if (colon < 0) {
            throw new UnsupportedConstructException(
                    "'" + first.getValue() + "' statement without ':'", first.getLine());
        }
        return colon;
    }

    /**
     * Normalizes strings and adds optional parentheses to the leaves of one statement.
     */
    private List<Leaf> _prepare(List<Leaf> statement, int statementDepth) {
        List<Leaf> result = new ArrayList<>(statement.size() + 4);
        for (Leaf leaf : statement) {
            if (leaf.getType() == LeafType.STRING) {
                result.add(_withValue(leaf, Strings.normalizeQuotes(leaf.getValue())));
            } else if (leaf.getType() == LeafType.DOCSTRING) {
                result.add(_withValue(leaf, Strings.formatDocstring(leaf.getValue(), statementDepth, lineLength)));
            } else {
                result.add(leaf);
            }
        }

        Leaf first = result.get(0);
        if (first.getType() != LeafType.KEYWORD) {
            int assignment = _findAtDepthZero(result, 1, result.size(),
                    leaf -> leaf.getType() == LeafType.EQUAL || leaf.getType() == LeafType.AUG_ASSIGN);
            if (assignment > 0) {
                _wrapInInvisibleParens(result, assignment + 1, result.size());
            }
            return result;
        }

        switch (first.getValue()) {
            case "return" -> _wrapInInvisibleParens(result, 1, result.size());
            case "if", "elif" -> {
                int colon = result.size() - 1;
                if (result.get(colon).getType() == LeafType.COLON) {
                    _normalizeCondition(result, 1, colon);
                }
            }
            case "assert" -> {
                int comma = _findAtDepthZero(result, 1, result.size(), leaf -> leaf.getType() == LeafType.COMMA);
                if (comma < 0) {
                    _wrapInInvisibleParens(result, 1, result.size());
                } else {
                    _wrapInInvisibleParens(result, comma + 1, result.size());
                    _wrapInInvisibleParens(result, 1, comma);
                }
            }
            default -> {
            }
        }
        return result;
    }

    /**
     * Drops redundant parentheses around a whole condition, then wraps it in
     * invisible ones.
     */
    private static void _normalizeCondition(List<Leaf> leaves, int from, int to) {
        while (to - from > 2 && _isRedundantPair(leaves, from, to)) {
            leaves.remove(to - 1);
            leaves.remove(from);
            to -= 2;
        }
        _wrapInInvisibleParens(leaves, from, to);
    }

    private static boolean _isRedundantPair(List<Leaf> leaves, int from, int to) {
        Leaf opening = leaves.get(from);
        if (opening.getType() != LeafType.LPAR || opening.isOptionalParen()) {
            return false;
        }
        int nesting = 0;
        for (int i = from; i < to; i++) {
            Leaf leaf = leaves.get(i);
            if (i > from && leaf.getPrefix().indexOf('#') >= 0) {
                return false;
            }
            if (leaf.isOpeningBracket()) {
                nesting++;
            } else if (leaf.isClosingBracket()) {
                nesting--;
                if (nesting == 0 && i != to - 1) {
                    return false;
                }
            } else if (nesting == 1 && leaf.getType() == LeafType.COMMA) {
                return false;
            }
        }
        return nesting == 0;
    }

    private static void _wrapInInvisibleParens(List<Leaf> leaves, int from, int to) {
        if (to - from < 2) {
            return;
        }
        Leaf last = leaves.get(to - 1);
        Leaf firstWrapped = leaves.get(from);
        leaves.add(to, Leaf.invisibleParen(LeafType.RPAR, last.getLine(), last.getColumn()));
        leaves.add(from, Leaf.invisibleParen(LeafType.LPAR, firstWrapped.getLine(), firstWrapped.getColumn()));
    }

    private static int _findAtDepthZero(List<Leaf> leaves, int from, int to, Predicate<Leaf> predicate) {
        int nesting = 0;
        for (int i = 0; i < to; i++) {
            Leaf leaf = leaves.get(i);
            if (i >= from && nesting == 0 && predicate.test(leaf)) {
                return i;
            }
            if (leaf.isOpeningBracket()) {
                nesting++;
            } else if (leaf.isClosingBracket()) {
                nesting--;
            }
        }
        return -1;
    }

    private static Leaf _withValue(Leaf leaf, String value) {
        return new Leaf(leaf.getType(), value, leaf.getPrefix(), leaf.getLine(), leaf.getColumn());
    }
}

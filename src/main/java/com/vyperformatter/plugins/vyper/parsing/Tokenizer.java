package com.vyperformatter.plugins.vyper.parsing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lossless tokenizer for Vyper source.
 * <p>
 * Concatenating {@code prefix + value} of every produced leaf reproduces the input
 * (with {@code \r\n} normalized to {@code \n}). Layout follows Python: NEWLINE ends a
 * logical line outside brackets, INDENT and DEDENT track block nesting, and ENDMARKER
 * closes the stream. Blank lines and comment-only lines become prefix text.
 */
public class Tokenizer {
    private static final int TAB_WIDTH = 4;

    private static final String[] THREE_CHAR_OPERATORS = {"**=", "//=", "<<=", ">>="};
    private static final String[] TWO_CHAR_OPERATORS = {
            "->", ":=", "==", "!=", "<=", ">=", "<<", ">>", "**", "//",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^="};
    private static final String SINGLE_CHAR_OPERATORS = "+-*/%&|^~<>=.,:@()[]{}";

    private final String text;
    private final List<Leaf> leaves = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Leaf> openBrackets = new ArrayDeque<>();
    private final StringBuilder prefix = new StringBuilder();

    private int pos;
    private int line = 1;
    private int lineStart;

    private Tokenizer(String source) {
        this.text = source.replace("\r\n", "\n");
    }

    /**
     * Splits source text into leaves.
     *
     * @throws ParseException for characters or layout the grammar does not allow
     */
    public static List<Leaf> tokenize(String source) throws ParseException {
        return new Tokenizer(source).run();
    }

    private List<Leaf> run() throws ParseException {
        indents.push(0);
        boolean atLineStart = true;

        while (true) {
            if (atLineStart) {
                if (!_readLineStart()) {
                    break;
                }
                atLineStart = false;
                continue;
            }

            if (pos >= text.length()) {
                if (!openBrackets.isEmpty()) {
                    Leaf open = openBrackets.peek();
                    throw new ParseException("'" + open.getValue() + "' was never closed",
                            open.getLine(), open.getColumn());
                }
                // Last line without a trailing newline
                _emit(LeafType.NEWLINE, "");
                atLineStart = true;
                continue;
            }

            char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                prefix.append(c);
                pos++;
            } else if (c == '\\' && pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
                prefix.append("\\\n");
                pos += 2;
                _newLine();
            } else if (c == '\n') {
                if (openBrackets.isEmpty()) {
                    _emit(LeafType.NEWLINE, "\n");
                    pos++;
                    _newLine();
                    atLineStart = true;
                } else {
                    prefix.append(c);
                    pos++;
                    _newLine();
                }
            } else if (c == '#') {
                int end = _endOfLine(pos);
                prefix.append(text, pos, end);
                pos = end;
            } else {
                _readToken();
            }
        }

        _markDocstrings();
        return leaves;
    }

    /**
     * Consumes blank and comment-only lines at the start of a logical line, then emits
     * INDENT or DEDENT tokens for the first code line. Returns false at end of input.
     */
    private boolean _readLineStart() throws ParseException {
        List<String> chunks = new ArrayList<>();
        List<Integer> commentColumns = new ArrayList<>();

        while (true) {
            int start = pos;
            int width = 0;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == ' ') {
                    width++;
                } else if (c == '\t') {
                    width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
                } else if (c == '\f') {
                    width = 0;
                } else {
                    break;
                }
                pos++;
            }

            if (pos >= text.length()) {
                chunks.add(text.substring(start));
                commentColumns.add(-1);
                _closeBlocks(chunks, commentColumns, 0);
                prefix.append(String.join("", chunks));
                _emit(LeafType.ENDMARKER, "");
                return false;
            }

            char c = text.charAt(pos);
            if (c == '\n') {
                chunks.add(text.substring(start, pos + 1));
                commentColumns.add(-1);
                pos++;
                _newLine();
                continue;
            }
            if (c == '#') {
                int end = _endOfLine(pos);
                int next = Math.min(end + 1, text.length());
                chunks.add(text.substring(start, next));
                commentColumns.add(width);
                pos = next;
                if (end < text.length()) {
                    _newLine();
                }
                continue;
            }

            int current = indents.peek();
            if (width > current) {
                indents.push(width);
                _emit(LeafType.INDENT, "");
            } else if (width < current) {
                _closeBlocks(chunks, commentColumns, width);
            }
            prefix.append(String.join("", chunks)).append(text, start, pos);
            return true;
        }
    }

    /**
     * Emits one DEDENT per closed block. Comment lines indented at least as deep as a
     * closed block stay inside it by becoming that DEDENT's prefix.
     */
    private void _closeBlocks(List<String> chunks, List<Integer> commentColumns, int width)
            throws ParseException {
        while (indents.peek() > width) {
            int level = indents.pop();
            int take = 0;
            for (int i = 0; i < chunks.size(); i++) {
                int column = commentColumns.get(i);
                if (column < 0) {
                    continue;
                }
                if (column >= level) {
                    take = i + 1;
                } else {
                    break;
                }
            }
            List<String> inner = chunks.subList(0, take);
            prefix.append(String.join("", inner));
            inner.clear();
            commentColumns.subList(0, take).clear();
            _emit(LeafType.DEDENT, "");
        }
        if (indents.peek() != width) {
            throw new ParseException("unindent does not match any outer indentation level",
                    line, width + 1);
        }
    }

    private void _readToken() throws ParseException {
        char c = text.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            int end = pos;
            while (end < text.length()
                    && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
                end++;
            }
            String word = text.substring(pos, end);
            if (end < text.length() && _isQuote(text.charAt(end)) && _isStringPrefix(word)) {
                _readString(end);
                return;
            }
            pos = end;
            _emit(_classifyWord(word), word);
            return;
        }

        if (Character.isDigit(c)
                || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            _readNumber();
            return;
        }

        if (_isQuote(c)) {
            _readString(pos);
            return;
        }

        if (text.startsWith("...", pos)) {
            pos += 3;
            _emit(LeafType.ELLIPSIS, "...");
            return;
        }

        for (String operator : THREE_CHAR_OPERATORS) {
            if (text.startsWith(operator, pos)) {
                pos += 3;
                _emit(LeafType.AUG_ASSIGN, operator);
                return;
            }
        }
        for (String operator : TWO_CHAR_OPERATORS) {
            if (text.startsWith(operator, pos)) {
                pos += 2;
                LeafType type = switch (operator) {
                    case "->" -> LeafType.ARROW;
                    case "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=" -> LeafType.AUG_ASSIGN;
                    default -> LeafType.OPERATOR;
                };
                _emit(type, operator);
                return;
            }
        }
        if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
            _readPunctuation(c);
            return;
        }

        throw new ParseException("unexpected character '" + c + "'", line, _column());
    }

    private void _readPunctuation(char c) throws ParseException {
        LeafType type = switch (c) {
            case '(' -> LeafType.LPAR;
            case ')' -> LeafType.RPAR;
            case '[' -> LeafType.LSQB;
            case ']' -> LeafType.RSQB;
            case '{' -> LeafType.LBRACE;
            case '}' -> LeafType.RBRACE;
            case ',' -> LeafType.COMMA;
            case ':' -> LeafType.COLON;
            case '.' -> LeafType.DOT;
            case '@' -> LeafType.AT;
            case '=' -> LeafType.EQUAL;
            default -> LeafType.OPERATOR;
        };

        if (type.isClosingBracket()) {
            if (openBrackets.isEmpty()) {
                throw new ParseException("unmatched '" + c + "'", line, _column());
            }
            Leaf open = openBrackets.pop();
            if (open.getType().closingCounterpart() != type) {
                throw new ParseException("closing '" + c + "' does not match opening '"
                        + open.getValue() + "' on line " + open.getLine(), line, _column());
            }
        }

        pos++;
        Leaf leaf = _emit(type, String.valueOf(c));
        if (type.isOpeningBracket()) {
            openBrackets.push(leaf);
        }
    }

    private void _readNumber() {
        int end = pos;
        if (text.charAt(end) == '0' && end + 1 < text.length()
                && "xXbBoO".indexOf(text.charAt(end + 1)) >= 0) {
            end += 2;
            while (end < text.length()
                    && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
                end++;
            }
        } else {
            end = _skipDigits(end);
            if (end < text.length() && text.charAt(end) == '.'
                    && end + 1 < text.length() && Character.isDigit(text.charAt(end + 1))) {
                end = _skipDigits(end + 1);
            }
            if (end < text.length() && (text.charAt(end) == 'e' || text.charAt(end) == 'E')) {
                int exponent = end + 1;
                if (exponent < text.length() && (text.charAt(exponent) == '+' || text.charAt(exponent) == '-')) {
                    exponent++;
                }
                if (exponent < text.length() && Character.isDigit(text.charAt(exponent))) {
                    end = _skipDigits(exponent);
                }
            }
        }
        String number = text.substring(pos, end);
        pos = end;
        _emit(LeafType.NUMBER, number);
    }

    private int _skipDigits(int from) {
        int end = from;
        while (end < text.length() && (Character.isDigit(text.charAt(end)) || text.charAt(end) == '_')) {
            end++;
        }
        return end;
    }

    private void _readString(int quoteStart) throws ParseException {
        int startLine = line;
        int startColumn = _column();
        char quote = text.charAt(quoteStart);
        String triple = String.valueOf(quote).repeat(3);
        boolean isTriple = text.startsWith(triple, quoteStart);
        int end = quoteStart + (isTriple ? 3 : 1);

        while (true) {
            if (end >= text.length()) {
                throw new ParseException("unterminated string literal", startLine, startColumn);
            }
            char c = text.charAt(end);
            if (c == '\\') {
                if (end + 1 < text.length() && text.charAt(end + 1) == '\n') {
                    _newLineAt(end + 2);
                }
                end += 2;
                continue;
            }
            if (c == '\n') {
                if (!isTriple) {
                    throw new ParseException("unterminated string literal", startLine, startColumn);
                }
                _newLineAt(end + 1);
                end++;
                continue;
            }
            if (isTriple ? text.startsWith(triple, end) : c == quote) {
                end += isTriple ? 3 : 1;
                break;
            }
            end++;
        }

        String value = text.substring(pos, end);
        pos = end;
        leaves.add(new Leaf(LeafType.STRING, value, prefix.toString(), startLine, startColumn));
        prefix.setLength(0);
    }

    private LeafType _classifyWord(String word) {
        Leaf previous = _lastSignificant();
        if (previous != null && previous.getType() == LeafType.DOT) {
            return LeafType.NAME;
        }
        if (Keywords.isHardKeyword(word)) {
            return LeafType.KEYWORD;
        }
        if (Keywords.isSoftKeyword(word) && _nameFollows(pos)) {
            return LeafType.KEYWORD;
        }
        return LeafType.NAME;
    }

    private boolean _nameFollows(int from) {
        int i = from;
        if (i >= text.length() || (text.charAt(i) != ' ' && text.charAt(i) != '\t')) {
            return false;
        }
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i < text.length() && (Character.isLetter(text.charAt(i)) || text.charAt(i) == '_');
    }

    private Leaf _lastSignificant() {
        for (int i = leaves.size() - 1; i >= 0; i--) {
            if (!leaves.get(i).getType().isLayout()) {
                return leaves.get(i);
            }
        }
        return null;
    }

    /**
     * Retypes strings that make up a whole statement.
     */
    private void _markDocstrings() {
        for (int i = 0; i < leaves.size(); i++) {
            Leaf leaf = leaves.get(i);
            if (leaf.getType() != LeafType.STRING || i + 1 >= leaves.size()) {
                continue;
            }
            boolean startsStatement = i == 0 || leaves.get(i - 1).getType().isLayout();
            boolean endsStatement = leaves.get(i + 1).getType() == LeafType.NEWLINE;
            if (startsStatement && endsStatement) {
                leaves.set(i, new Leaf(LeafType.DOCSTRING, leaf.getValue(), leaf.getPrefix(),
                        leaf.getLine(), leaf.getColumn()));
            }
        }
    }

    private Leaf _emit(LeafType type, String value) {
        int column = _column() - value.length();
        Leaf leaf = new Leaf(type, value, prefix.toString(), line, Math.max(column, 1));
        leaves.add(leaf);
        prefix.setLength(0);
        return leaf;
    }

    private int _endOfLine(int from) {
        int end = text.indexOf('\n', from);
        return end < 0 ? text.length() : end;
    }

    private int _column() {
        return pos - lineStart + 1;
    }

    private void _newLine() {
        _newLineAt(pos);
    }

    private void _newLineAt(int nextLineStart) {
        line++;
        lineStart = nextLineStart;
    }

    private static boolean _isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static boolean _isStringPrefix(String word) {
        if (word.length() > 2) {
            return false;
        }
        for (char c : word.toCharArray()) {
            if ("bBrRxXuUfF".indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }
}

package com.vyperformatter.plugins.vyper.parsing;

/**
 * A single token of a Vyper source file together with the whitespace and comments
 * ({@code prefix}) that precede it.
 * <p>
 * Leaves are immutable once parsed, except that the formatter rewrites prefixes
 * while rendering and may turn optional (invisible) parentheses into real ones.
 */
public class Leaf {
    private final LeafType type;
    private final int line;
    private final int column;
    private final boolean optional;
    private String value;
    private String prefix;

    public Leaf(LeafType type, String value, String prefix, int line, int column) {
        this(type, value, prefix, line, column, false);
    }

    private Leaf(LeafType type, String value, String prefix, int line, int column, boolean optional) {
        this.type = type;
        this.value = value;
        this.prefix = prefix;
        this.line = line;
        this.column = column;
        this.optional = optional;
    }

    /**
     * Creates an invisible parenthesis the formatter may later make visible.
     */
    public static Leaf invisibleParen(LeafType type, int line, int column) {
        if (type != LeafType.LPAR && type != LeafType.RPAR) {
            throw new IllegalArgumentException("Only parentheses can be invisible: " + type);
        }
        return new Leaf(type, "", "", line, column, true);
    }

    /**
     * Copies type, value and position into a fresh leaf with an empty prefix.
     */
    public Leaf copy() {
        return new Leaf(type, value, "", line, column, optional);
    }

    /**
     * Same as {@link #copy()} but with another type, used when a comment changes role.
     */
    public Leaf copyAs(LeafType newType) {
        return new Leaf(newType, value, "", line, column, optional);
    }

    public LeafType getType() { return type; }
    public String getValue() { return value; }
    public String getPrefix() { return prefix; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    /**
     * True for parentheses inserted or hidden by the formatter, visible or not.
     */
    public boolean isOptionalParen() {
        return optional;
    }

    public boolean isInvisible() {
        return optional && value.isEmpty();
    }

    public void ensureVisible() {
        if (type == LeafType.LPAR) {
            value = "(";
        } else if (type == LeafType.RPAR) {
            value = ")";
        }
    }

    public boolean isOpeningBracket() {
        return type.isOpeningBracket();
    }

    public boolean isClosingBracket() {
        return type.isClosingBracket();
    }

    public boolean isKeyword(String keyword) {
        return type == LeafType.KEYWORD && value.equals(keyword);
    }

    public boolean isOperator(String operator) {
        return type == LeafType.OPERATOR && value.equals(operator);
    }

    /**
     * Whether this leaf can end an operand, so that an operator after it is binary.
     */
    public boolean endsOperand() {
        return switch (type) {
            case NAME, NUMBER, STRING, DOCSTRING, ELLIPSIS, RPAR, RSQB, RBRACE -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return prefix + value;
    }
}

package com.vyperformatter.plugins.vyper.parsing;

/**
 * Token categories produced by the {@link Tokenizer}.
 */
public enum LeafType {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    DOCSTRING,  // a string literal that forms a whole statement
    ELLIPSIS,
    OPERATOR,
    COMMA,
    COLON,
    DOT,
    AT,
    ARROW,
    EQUAL,
    AUG_ASSIGN,
    LPAR,
    RPAR,
    LSQB,
    RSQB,
    LBRACE,
    RBRACE,
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER,
    COMMENT,            // shares its physical line with preceding code
    STANDALONE_COMMENT; // occupies its own line

    public boolean isOpeningBracket() {
        return this == LPAR || this == LSQB || this == LBRACE;
    }

    public boolean isClosingBracket() {
        return this == RPAR || this == RSQB || this == RBRACE;
    }

    public boolean isComment() {
        return this == COMMENT || this == STANDALONE_COMMENT;
    }

    /**
     * Layout tokens carry no text of their own and never enter a formatted line.
     */
    public boolean isLayout() {
        return this == NEWLINE || this == INDENT || this == DEDENT || this == ENDMARKER;
    }

    /**
     * Returns the closing bracket type for an opening bracket.
     */
    public LeafType closingCounterpart() {
        return switch (this) {
            case LPAR -> RPAR;
            case LSQB -> RSQB;
            case LBRACE -> RBRACE;
            default -> throw new IllegalStateException(this + " is not an opening bracket");
        };
    }
}

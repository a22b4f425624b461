package com.vyperformatter.plugins.vyper.parsing;

/**
 * Raised when source text cannot be turned into a leaf stream.
 */
public class ParseException extends Exception {
    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

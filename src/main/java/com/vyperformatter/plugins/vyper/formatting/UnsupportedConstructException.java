package com.vyperformatter.plugins.vyper.formatting;

/**
 * The source contains a statement shape the line builder cannot lay out.
 */
public class UnsupportedConstructException extends RuntimeException {
    private final int line;

    public UnsupportedConstructException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}

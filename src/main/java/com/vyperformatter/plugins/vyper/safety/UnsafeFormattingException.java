package com.vyperformatter.plugins.vyper.safety;

/**
 * Formatted output is not equivalent to the original source and must be discarded.
 */
public class UnsafeFormattingException extends Exception {
    private final int line;

    public UnsafeFormattingException(String message, int line) {
        super(message);
        this.line = line;
    }

    public UnsafeFormattingException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /**
     * Line of the original source where the difference starts, or 0 when unknown.
     */
    public int getLine() {
        return line;
    }
}

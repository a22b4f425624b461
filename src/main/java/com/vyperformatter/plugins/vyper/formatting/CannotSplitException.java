package com.vyperformatter.plugins.vyper.formatting;

/**
 * A split strategy does not apply to a line. The splitter moves on to the next one.
 */
public class CannotSplitException extends Exception {

    public CannotSplitException(String message) {
        super(message);
    }

    public CannotSplitException(String message, Throwable cause) {
        super(message, cause);
    }
}

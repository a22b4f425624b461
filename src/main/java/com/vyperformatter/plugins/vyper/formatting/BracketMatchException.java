package com.vyperformatter.plugins.vyper.formatting;

/**
 * Brackets of a logical line do not pair up. The tokenizer rejects unbalanced input,
 * so this signals a formatter defect rather than bad source.
 */
public class BracketMatchException extends RuntimeException {

    public BracketMatchException(String message) {
        super(message);
    }
}

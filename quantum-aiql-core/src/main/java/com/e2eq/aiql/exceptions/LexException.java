package com.e2eq.aiql.exceptions;

/**
 * Thrown when the lexer cannot turn the input into tokens: unterminated strings,
 * concepts, relations or block comments, characters outside the language, or input
 * larger than the configured cap.
 */
public class LexException extends AiqlSyntaxException {
    private static final long serialVersionUID = 1L;

    public LexException(String message, int line, int column) {
        super(message, line, column);
    }
}

package com.e2eq.aiql.lexer;

/**
 * Lexer switches.
 *
 * @param includeWhitespace emit WHITESPACE and COMMENT tokens instead of skipping them
 * @param maxInputSize      largest accepted input, in characters
 */
public record LexerOptions(boolean includeWhitespace, int maxInputSize) {

    public static final int DEFAULT_MAX_INPUT_SIZE = 10 * 1024 * 1024;

    public LexerOptions {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive, was " + maxInputSize);
        }
    }

    public static LexerOptions defaults() {
        return new LexerOptions(false, DEFAULT_MAX_INPUT_SIZE);
    }

    public LexerOptions withWhitespace() {
        return new LexerOptions(true, maxInputSize);
    }

    public LexerOptions withMaxInputSize(int size) {
        return new LexerOptions(includeWhitespace, size);
    }
}

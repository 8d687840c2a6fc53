package com.e2eq.aiql.exceptions;

/**
 * Base type for fatal errors raised while turning AIQL source text into a program.
 * <p>
 * Carries the 1-based line and column of the character or token at which
 * processing stopped. A column or line of {@code 0} means the position is unknown.
 * </p>
 */
public abstract class AiqlSyntaxException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    protected AiqlSyntaxException(String message, int line, int column) {
        super(buildMessage(message, line, column));
        this.line = line;
        this.column = column;
    }

    protected AiqlSyntaxException(String message, int line, int column, Throwable cause) {
        super(buildMessage(message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    private static String buildMessage(String message, int line, int column) {
        if (line <= 0) {
            return message;
        }
        return String.format("%s at line %d, column %d", message, line, column);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

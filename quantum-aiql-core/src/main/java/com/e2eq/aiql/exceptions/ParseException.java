package com.e2eq.aiql.exceptions;

import com.e2eq.aiql.lexer.Token;

/**
 * Thrown when the token stream does not form a valid program. The whole parse is
 * abandoned; no partial program is produced.
 */
public class ParseException extends AiqlSyntaxException {
    private static final long serialVersionUID = 1L;

    private final transient Token token;

    public ParseException(String message, Token token) {
        super(message + (token != null ? " (found " + token.type() + " '" + token.value() + "')" : ""),
                token != null ? token.line() : 0,
                token != null ? token.column() : 0);
        this.token = token;
    }

    public ParseException(String message, Token token, Throwable cause) {
        super(message, token != null ? token.line() : 0, token != null ? token.column() : 0, cause);
        this.token = token;
    }

    /**
     * The token at which parsing failed, or {@code null} when the failure was not tied to a token.
     */
    public Token getToken() {
        return token;
    }
}

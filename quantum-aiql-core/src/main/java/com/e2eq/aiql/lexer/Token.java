package com.e2eq.aiql.lexer;

import java.util.Objects;

/**
 * A lexical token: its type, the literal source text it was read from and the
 * 1-based position of its first character.
 */
public record Token(TokenType type, String value, int line, int column) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isSymbol(String symbol) {
        return type == TokenType.SYMBOL && value.equals(symbol);
    }

    public TokenCategory category() {
        return type.category();
    }
}

package com.e2eq.aiql.ast;

public enum UnaryOperator {
    NEGATE("-"),
    NOT("not ");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}

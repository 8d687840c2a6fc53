package com.e2eq.aiql.ast;

public enum LogicalOperator {
    AND("and", "∧"),
    OR("or", "∨"),
    NOT("not", "¬"),
    IMPLIES("implies", "→"),
    IFF("iff", "↔");

    private final String keyword;
    private final String symbol;

    LogicalOperator(String keyword, String symbol) {
        this.keyword = keyword;
        this.symbol = symbol;
    }

    public String keyword() {
        return keyword;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isUnary() {
        return this == NOT;
    }
}
